package games.klondike.game;

import java.util.List;

/**
 * A foundation: collects one suit from Ace up to King.
 * <p>
 * The rule is checked twice. {@link #verify(Card)} is the recoverable check a move makes
 * before touching any pile. {@link #put(Card)} applies the same rule again on every write
 * and throws {@link InvalidCardException} if it is broken, which can only happen when a
 * caller wrote without verifying first.
 * <p>
 * Cards never leave a foundation during play: {@link #take(int)} is unsupported.
 */
public class SuitDeck extends CardCollection implements Pile {
    /** Number of cards in a completed foundation. */
    public static final int COMPLETE_SIZE = 13;

    private final Suit suit;

    public SuitDeck(Suit suit) {
        if (suit == null) {
            throw new IllegalArgumentException("suit must not be null");
        }
        this.suit = suit;
    }

    public Suit getSuit() {
        return suit;
    }

    @Override
    public PileRef.Kind kind() {
        return PileRef.Kind.FOUNDATION;
    }

    /**
     * Accepts the Ace of this suit on an empty foundation, otherwise the next rank of
     * this suit.
     * <p>
     * An Ace of another suit is refused even on an empty foundation: each foundation is
     * bound to its suit, so accepting it here would only fail later on the write path.
     */
    @Override
    public boolean verify(Card candidate) {
        if (candidate.getSuit() != suit) {
            return false;
        }
        return nextRankValue() == candidate.getRank().getValue();
    }

    /**
     * Writes {@code card} on top, enforcing suit and rank order.
     *
     * @throws InvalidCardException if the card does not continue this foundation
     */
    @Override
    public void put(Card card) {
        checkNext(card, nextRankValue());
        super.put(card);
    }

    /**
     * Checks that {@code run} continues this foundation card by card, so a run that breaks
     * part way is rejected before its first card is written.
     *
     * @throws InvalidCardException if any card of the run is out of suit or sequence
     */
    @Override
    protected void checkRun(List<Card> run) {
        int expected = nextRankValue();
        for (Card card : run) {
            checkNext(card, expected++);
        }
    }

    private void checkNext(Card card, int expectedRank) {
        if (card == null) {
            throw new IllegalArgumentException("card must not be null");
        }
        if (card.getSuit() != suit) {
            throw new InvalidCardException(card, "Card " + card.shortName() + " does not match foundation suit " + suit);
        }
        if (card.getRank().getValue() != expectedRank) {
            throw new InvalidCardException(card, "Card " + card.shortName()
                    + " does not follow the top of the " + suit + " foundation");
        }
    }

    /**
     * Always throws; foundations do not give cards back.
     *
     * @throws UnsupportedOperationException always
     */
    @Override
    public List<Card> take(int n) {
        throw new UnsupportedOperationException("Cards cannot be taken from a foundation");
    }

    /**
     * Always throws; foundations do not give cards back.
     *
     * @throws UnsupportedOperationException always
     */
    @Override
    public List<Card> takeAll() {
        throw new UnsupportedOperationException("Cards cannot be taken from a foundation");
    }

    /**
     * Always zero, since nothing can be taken from a foundation.
     */
    @Override
    public int movableCount() {
        return 0;
    }

    @Override
    public Card peekRun(int count) {
        throw new EmptyPileException(count, 0);
    }

    public boolean isComplete() {
        return size() == COMPLETE_SIZE;
    }

    private int nextRankValue() {
        return size() + 1;
    }

    @Override
    public String toString() {
        return "SuitDeck(" + suit + "): " + super.toString();
    }
}
