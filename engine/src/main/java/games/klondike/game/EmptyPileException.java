package games.klondike.game;

import java.util.NoSuchElementException;

/**
 * Thrown when a take asks a pile for more cards than it holds.
 * <p>
 * The request is never truncated; when this escapes from inside {@link KlondikeGame#place}
 * it indicates a logic error, since {@code place} checks pile sizes before taking.
 */
public class EmptyPileException extends NoSuchElementException {

    private final int requested;
    private final int available;

    public EmptyPileException(int requested, int available) {
        super("Cannot take " + requested + " card(s) from a pile holding " + available);
        this.requested = requested;
        this.available = available;
    }

    public int getRequested() {
        return requested;
    }

    public int getAvailable() {
        return available;
    }
}
