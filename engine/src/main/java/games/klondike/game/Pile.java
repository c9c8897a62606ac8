package games.klondike.game;

import java.util.List;
import java.util.Optional;

/**
 * Capability shared by every pile a move can start from or end on: the stock, the
 * tableau piles and the foundations.
 * <p>
 * {@link KlondikeGame#place} works only against this interface once it has resolved its
 * {@link PileRef}s, so the rules of each pile kind live in the pile itself.
 */
public interface Pile {

    /**
     * Returns which kind of pile this is.
     */
    PileRef.Kind kind();

    /**
     * Decides whether {@code candidate} may be placed on this pile as the bottom of an
     * incoming run. Never mutates the pile.
     *
     * @param candidate the card that would touch the current top of this pile
     * @return {@code true} if the rules of this pile accept the card
     */
    boolean verify(Card candidate);

    /**
     * Removes the top {@code n} movable cards and returns them bottom to top.
     *
     * @throws EmptyPileException if fewer than {@code n} movable cards are available
     * @throws UnsupportedOperationException if this pile never gives up cards
     */
    List<Card> take(int n);

    /**
     * Places a run on top of this pile, first element lowest.
     */
    void put(List<Card> run);

    /**
     * Number of cards a move may take from this pile right now.
     */
    int movableCount();

    /**
     * Total number of cards held, including any that cannot be moved.
     */
    int size();

    /**
     * Returns the top card, if any is face up.
     */
    Optional<Card> peekTop();

    /**
     * Returns the bottom card of the run that a move of {@code count} cards would take,
     * i.e. the card at position {@code movableCount() - count} of the movable cards.
     *
     * @throws EmptyPileException if {@code count} is not in {@code 1..movableCount()}
     */
    Card peekRun(int count);
}
