package games.klondike.console;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import games.klondike.config.KlondikeProperties;
import games.klondike.game.Card;
import games.klondike.game.Deck;
import games.klondike.game.KlondikeBuilder;
import games.klondike.game.KlondikeGame;
import games.klondike.game.Rank;
import java.io.BufferedReader;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Scripted console sessions.
 *
 * <p>The ordered deck deals K♣ to T1, Q♦ shown on T5 and Q♥ shown on T7, so
 * {@code place T5 T1} is legal and {@code place T2 T1} (J♣ on K♣) is not.
 */
class ConsoleSessionTest {
    private ByteArrayOutputStream buffer;
    private KlondikeProperties properties;

    @BeforeEach
    void setUp() {
        buffer = new ByteArrayOutputStream();
        properties = new KlondikeProperties();
        properties.setColour(false);
        properties.setShowBoardAfterMove(false);
    }

    @Test
    void legalMoveIsAppliedAndCounted() {
        KlondikeGame game = new KlondikeGame(Deck.ordered());

        int moves = session(game, "place T5 T1", "quit").run();

        assertEquals(1, moves);
        assertEquals(List.of(Card.parse("K♣"), Card.parse("Q♦")), game.getTableau(0));
        assertEquals(List.of(Card.parse("K♦")), game.getTableau(4));
    }

    @Test
    void illegalMoveIsReportedAndBoardUnchanged() {
        KlondikeGame game = new KlondikeGame(Deck.ordered());
        String before = game.toString();

        int moves = session(game, "place T2 T1", "quit").run();

        assertEquals(0, moves);
        assertTrue(output().contains("Illegal move: "), output());
        assertEquals(before, game.toString());
    }

    @Test
    void parseErrorsAndHelpDoNotEndTheSession() {
        KlondikeGame game = new KlondikeGame(Deck.ordered());

        int moves = session(game, "dance", "", "help", "board", "place T7 T1").run();

        assertEquals(1, moves);
        String out = output();
        assertTrue(out.contains("Unknown command: dance"));
        assertTrue(out.contains("Commands:"));
        assertFalse(out.contains(ConsoleSession.FINISHED));
    }

    @Test
    void endOfInputStopsTheSession() {
        KlondikeGame game = new KlondikeGame(Deck.ordered());

        assertEquals(0, session(game).run());
        assertTrue(output().contains(ConsoleSession.PROMPT));
    }

    @Test
    void finishingMoveEndsSessionWithoutFurtherInput() {
        KlondikeGame game = KlondikeBuilder.newGame()
                .foundationUpTo("F1", Rank.KING)
                .foundationUpTo("F2", Rank.KING)
                .foundationUpTo("F3", Rank.KING)
                .foundationUpTo("F4", Rank.QUEEN)
                .build();

        int moves = session(game, "place S F4", "this line is never read").run();

        assertEquals(1, moves);
        assertTrue(game.isFinished());
        String out = output();
        assertTrue(out.endsWith(ConsoleSession.FINISHED + System.lineSeparator()), out);
        assertFalse(out.contains("Unknown command"));
    }

    @Test
    void boardIsReprintedAfterMovesWhenEnabled() {
        properties.setShowBoardAfterMove(true);
        KlondikeGame game = new KlondikeGame(Deck.ordered());

        session(game, "place T5 T1").run();

        String out = output();
        int first = out.indexOf("T7");
        assertTrue(first >= 0);
        assertTrue(out.indexOf("T7", first + 1) > first, "board printed twice");
    }

    private ConsoleSession session(KlondikeGame game, String... lines) {
        BufferedReader in = new BufferedReader(new StringReader(String.join("\n", lines)));
        PrintStream out = new PrintStream(buffer, true, StandardCharsets.UTF_8);
        return new ConsoleSession(game, in, out, properties);
    }

    private String output() {
        return buffer.toString(StandardCharsets.UTF_8);
    }
}
