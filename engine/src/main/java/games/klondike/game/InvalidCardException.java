package games.klondike.game;

/**
 * Thrown when a card is written onto a foundation that cannot hold it.
 * <p>
 * Foundations enforce their suit and rank order on every write, independently of
 * {@link SuitDeck#verify(Card)}. Reaching this exception means a caller skipped the
 * verify step; it is an invariant breach and is not meant to be recovered from.
 */
public class InvalidCardException extends IllegalStateException {

    private final transient Card card;

    public InvalidCardException(Card card, String message) {
        super(message);
        this.card = card;
    }

    /**
     * Returns the card that was rejected.
     */
    public Card getCard() {
        return card;
    }
}
