package games.klondike.game;

/**
 * Thrown by {@link KlondikeGame#place} when a requested move breaks the rules of the game.
 * <p>
 * This is the only failure expected during normal play. Every check that can raise it
 * runs before any card is moved, so the game is unchanged and the caller may simply
 * reject the move and ask again.
 */
public class IllegalMoveException extends RuntimeException {

    public IllegalMoveException(String message) {
        super(message);
    }

    public IllegalMoveException(String message, Throwable cause) {
        super(message, cause);
    }
}
