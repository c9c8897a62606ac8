package games.klondike.console;

import games.klondike.game.PileRef;
import java.util.Locale;

/**
 * Parses console input into {@link Command}s.
 * <p>
 * Grammar (case-insensitive, whitespace separated):
 * <ul>
 *   <li>{@code place [N] FROM TO} or {@code move [N] FROM TO}; {@code N} defaults to 1</li>
 *   <li>{@code board}, {@code help}, {@code quit}</li>
 * </ul>
 * Piles are named {@code S}, {@code T1}..{@code T7} and {@code F1}..{@code F4}, or given as
 * integer addresses ({@code -1}, {@code 0..6}, {@code 16..19}).
 */
public final class CommandParser {
    private CommandParser() {
    }

    /**
     * Parses one line of input.
     *
     * @param line the raw input line
     * @return the parsed command
     * @throws IllegalArgumentException if the line is not a valid command
     */
    public static Command parse(String line) {
        if (line == null || line.isBlank()) {
            throw new IllegalArgumentException("Empty command");
        }
        String[] tokens = line.trim().split("\\s+");
        String verb = tokens[0].toLowerCase(Locale.ROOT);
        switch (verb) {
            case "place":
            case "move":
                return parsePlace(tokens);
            case "board":
                return Command.of(Command.Type.BOARD);
            case "help":
                return Command.of(Command.Type.HELP);
            case "quit":
            case "exit":
                return Command.of(Command.Type.QUIT);
            default:
                throw new IllegalArgumentException("Unknown command: " + tokens[0]);
        }
    }

    /**
     * Parses a pile name or integer pile address.
     *
     * @param token e.g. "S", "t3", "F1", "-1", "16"
     * @return the addressed pile
     * @throws IllegalArgumentException if the token names no pile
     */
    public static PileRef parsePile(String token) {
        String normalized = token.trim().toUpperCase(Locale.ROOT);
        if (normalized.equals("S")) {
            return PileRef.stock();
        }
        try {
            if (normalized.length() > 1 && normalized.charAt(0) == 'T') {
                return PileRef.tableau(Integer.parseInt(normalized.substring(1)) - 1);
            }
            if (normalized.length() > 1 && normalized.charAt(0) == 'F') {
                return PileRef.foundation(Integer.parseInt(normalized.substring(1)) - 1);
            }
            return PileRef.decode(Integer.parseInt(normalized));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Unknown pile: " + token, e);
        }
    }

    private static Command parsePlace(String[] tokens) {
        if (tokens.length == 3) {
            return Command.place(1, parsePile(tokens[1]), parsePile(tokens[2]));
        }
        if (tokens.length == 4) {
            int count;
            try {
                count = Integer.parseInt(tokens[1]);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Card count must be a number: " + tokens[1], e);
            }
            return Command.place(count, parsePile(tokens[2]), parsePile(tokens[3]));
        }
        throw new IllegalArgumentException("Usage: place [N] FROM TO");
    }
}
