package games.klondike.console;

import games.klondike.config.KlondikeProperties;
import games.klondike.game.BoardFormatter;
import games.klondike.game.IllegalMoveException;
import games.klondike.game.KlondikeGame;
import games.klondike.game.Suit;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Interactive text session over a single {@link KlondikeGame}.
 *
 * <p>Each turn the session prompts, reads one line, and applies it. Illegal moves and
 * unknown commands are reported and the player is asked again; the board is unchanged
 * in both cases. The session ends on {@code quit}, at end of input, or when the game is
 * finished.
 *
 * <p>Input and output are injected so tests can script a whole session.
 */
public class ConsoleSession {
    private static final Logger log = LoggerFactory.getLogger(ConsoleSession.class);

    static final String PROMPT = "Enter command (place N FROM TO | board | help | quit): ";
    static final String FINISHED = "Congratulations, every card is on the foundations!";

    private static final String HELP = String.join("\n",
            "Commands:",
            "  place N FROM TO   move N cards from pile FROM to pile TO (N defaults to 1)",
            "  board             show the board",
            "  help              show this help",
            "  quit              leave the game",
            "Piles: S = stock, T1..T7 = tableau, F1..F4 = foundations (" + suitOrder() + ")",
            "Layout (XX = face down, CN = face up):",
            "  S     F1 F2 F3 F4",
            "  CN    CN CN CN CN",
            "",
            "  T1 T2 T3 T4 T5 T6 T7",
            "  CN XX XX XX XX XX XX",
            "     CN XX XX XX XX XX",
            "        CN XX XX XX XX",
            "           CN XX XX XX",
            "              CN XX XX",
            "                 CN XX",
            "                    CN");

    private final KlondikeGame game;
    private final BufferedReader in;
    private final PrintStream out;
    private final KlondikeProperties properties;

    public ConsoleSession(KlondikeGame game, BufferedReader in, PrintStream out, KlondikeProperties properties) {
        this.game = game;
        this.in = in;
        this.out = out;
        this.properties = properties;
    }

    /**
     * Runs the session until the player quits, input ends or the game is finished.
     *
     * @return number of moves that were accepted
     * @throws UncheckedIOException if reading input fails
     */
    public int run() {
        log.info("Console session started");
        int moves = 0;
        printBoard();
        while (!game.isFinished()) {
            out.print(PROMPT);
            out.flush();
            String line = readLine();
            if (line == null) {
                if (log.isDebugEnabled()) {
                    log.debug("Input closed after {} move(s)", moves);
                }
                break;
            }
            if (line.isBlank()) {
                continue;
            }

            Command command;
            try {
                command = CommandParser.parse(line);
            } catch (IllegalArgumentException e) {
                out.println(e.getMessage());
                continue;
            }

            if (command.type() == Command.Type.QUIT) {
                break;
            } else if (command.type() == Command.Type.HELP) {
                out.println(HELP);
            } else if (command.type() == Command.Type.BOARD) {
                printBoard();
            } else if (apply(command)) {
                moves++;
                if (properties.isShowBoardAfterMove()) {
                    printBoard();
                }
            }
        }
        if (game.isFinished()) {
            out.println(FINISHED);
        }
        log.info("Console session ended after {} move(s), finished={}", moves, game.isFinished());
        return moves;
    }

    private boolean apply(Command command) {
        try {
            game.place(command.count(), command.source(), command.dest());
            return true;
        } catch (IllegalMoveException e) {
            out.println("Illegal move: " + e.getMessage());
            return false;
        }
    }

    private void printBoard() {
        out.print(new BoardFormatter(game, properties.isColour()).format());
    }

    private String readLine() {
        try {
            return in.readLine();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read console input", e);
        }
    }

    private static String suitOrder() {
        StringBuilder sb = new StringBuilder();
        for (Suit suit : Suit.values()) {
            sb.append(suit.getSymbol());
        }
        return sb.toString();
    }
}
