package games.klondike.console;

import games.klondike.game.PileRef;

/**
 * One parsed console command.
 *
 * @param type what the command does
 * @param count number of cards to move; only meaningful for {@link Type#PLACE}
 * @param source pile to take from; null unless {@link Type#PLACE}
 * @param dest pile to place on; null unless {@link Type#PLACE}
 */
public record Command(Type type, int count, PileRef source, PileRef dest) {

    /** Console command kinds. */
    public enum Type {
        PLACE,
        BOARD,
        HELP,
        QUIT
    }

    public static Command place(int count, PileRef source, PileRef dest) {
        return new Command(Type.PLACE, count, source, dest);
    }

    public static Command of(Type type) {
        return new Command(type, 0, null, null);
    }
}
