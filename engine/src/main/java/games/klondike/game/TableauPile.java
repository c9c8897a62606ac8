package games.klondike.game;

import java.util.List;
import java.util.Optional;

/**
 * One of the seven playing columns: a face-down (hidden) part under a face-up (shown) part.
 * <p>
 * Only shown cards can be moved or built upon. Taking cards always leaves the pile in a
 * playable state: whenever the shown part becomes empty while hidden cards remain, the top
 * hidden card is turned face up in the same call. {@link #withdraw(int)} reports whether
 * that happened.
 * <p>
 * Building rule: a card may be placed on a shown card of the opposite colour that is
 * exactly one rank higher; an empty pile accepts only a King.
 */
public class TableauPile implements Pile {
    private final CardCollection hidden = new CardCollection();
    private final CardCollection shown = new CardCollection();

    /**
     * Creates an empty pile.
     */
    public TableauPile() {
    }

    /**
     * Creates a pile with the given face-down and face-up cards, both bottom to top.
     * If {@code shownCards} is empty the top hidden card is revealed immediately.
     */
    TableauPile(List<Card> hiddenCards, List<Card> shownCards) {
        hidden.put(hiddenCards);
        shown.put(shownCards);
        reveal();
    }

    /**
     * Creates a pile from cards dealt one at a time, first card at the bottom. The last
     * card dealt is face up and all others face down.
     *
     * @param dealt the dealt cards, bottom to top
     * @return the new pile
     */
    public static TableauPile deal(List<Card> dealt) {
        return new TableauPile(dealt, List.of());
    }

    @Override
    public PileRef.Kind kind() {
        return PileRef.Kind.TABLEAU;
    }

    /**
     * Removes the top {@code n} shown cards and reveals a hidden card if the shown part
     * became empty.
     *
     * @param n number of shown cards to move
     * @return the removed run and whether a card was revealed
     * @throws EmptyPileException if fewer than {@code n} cards are shown
     */
    public Withdrawal withdraw(int n) {
        List<Card> taken = shown.take(n);
        boolean revealed = reveal();
        return new Withdrawal(taken, revealed);
    }

    /**
     * Same as {@link #withdraw(int)}, returning only the cards.
     */
    @Override
    public List<Card> take(int n) {
        return withdraw(n).cards();
    }

    @Override
    public void put(List<Card> run) {
        shown.put(run);
    }

    @Override
    public boolean verify(Card candidate) {
        Optional<Card> top = shown.peekTop();
        if (top.isEmpty()) {
            return candidate.getRank() == Rank.KING;
        }
        Card target = top.get();
        boolean oneLower = target.getRank().getValue() - candidate.getRank().getValue() == 1;
        boolean alternatingColour = !candidate.getSuit().isSameColour(target.getSuit());
        return oneLower && alternatingColour;
    }

    @Override
    public int movableCount() {
        return shown.size();
    }

    @Override
    public int size() {
        return hidden.size() + shown.size();
    }

    @Override
    public Optional<Card> peekTop() {
        return shown.peekTop();
    }

    @Override
    public Card peekRun(int count) {
        if (count < 1 || count > shown.size()) {
            throw new EmptyPileException(count, shown.size());
        }
        return shown.get(shown.size() - count);
    }

    /**
     * Returns the face-up cards, bottom to top.
     */
    public List<Card> shownCards() {
        return shown.cards();
    }

    public int hiddenCount() {
        return hidden.size();
    }

    public boolean isEmpty() {
        return size() == 0;
    }

    /**
     * Hidden cards, bottom to top. Not part of the playing view; used to account for every
     * card on the board.
     */
    List<Card> hiddenCards() {
        return hidden.cards();
    }

    // Turns the top hidden card face up when nothing is shown; no-op otherwise.
    private boolean reveal() {
        if (shown.isEmpty() && !hidden.isEmpty()) {
            shown.put(hidden.take(1));
            return true;
        }
        return false;
    }

    @Override
    public String toString() {
        return "TableauPile: " + hidden.size() + " hidden, " + shown;
    }

    /**
     * Result of taking cards from a tableau pile.
     *
     * @param cards the removed run, bottom to top
     * @param revealed {@code true} if a hidden card was turned face up by the take
     */
    public record Withdrawal(List<Card> cards, boolean revealed) {
        public Withdrawal {
            cards = List.copyOf(cards);
        }
    }
}
