package games.klondike.game;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import org.junit.jupiter.api.Test;

/**
 * Dealing, read accessors and the finish condition.
 *
 * <p><b>Tests and their intentions:</b>
 * <ul>
 *   <li><b>dealGivesPileIAHiddenCardsAndOneShown</b> - pile i holds i hidden + 1 shown, 24 left in stock</li>
 *   <li><b>dealTakesFromTopOfDeck</b> - with an ordered deck the Clubs come off first, one at a time</li>
 *   <li><b>dealKeepsEveryCardOnce</b> - 52 distinct cards, empty hand, empty foundations</li>
 *   <li><b>finishedOnlyWhenAllFoundationsComplete</b> - one missing King keeps the game running</li>
 *   <li><b>playingEveryCardFromStockFinishesGame</b> - 52 stock-to-foundation moves end the game</li>
 * </ul>
 */
class KlondikeGameTest {

    @Test
    void dealGivesPileIAHiddenCardsAndOneShown() {
        KlondikeGame game = new KlondikeGame(Deck.ordered());

        for (int i = 0; i < PileRef.TABLEAU_COUNT; i++) {
            assertEquals(i, game.getTableauHiddenCount(i), "hidden cards in T" + (i + 1));
            assertEquals(1, game.getTableau(i).size(), "shown cards in T" + (i + 1));
        }
        assertEquals(24, game.getStock().size());
        assertEquals(21, game.getTableauHiddenCounts().stream().mapToInt(Integer::intValue).sum());
    }

    @Test
    void dealTakesFromTopOfDeck() {
        KlondikeGame game = new KlondikeGame(Deck.ordered());

        // Ordered deck ends with the Clubs, K♣ on top: T1 gets K♣, T2 gets Q♣ then J♣, T3 ends on 8♣.
        assertEquals(KlondikeBuilder.parse("K♣"), game.getTableau(0));
        assertEquals(KlondikeBuilder.parse("J♣"), game.getTableau(1));
        assertEquals(KlondikeBuilder.parse("8♣"), game.getTableau(2));
        // 28 cards dealt: all 13 Clubs, all 13 Diamonds, Q♥ and K♥; J♥ is now the stock top.
        assertEquals(Card.parse("J♥"), game.peekStock().orElseThrow());
        assertEquals(Card.parse("J♥"), game.peek(PileRef.stock()).orElseThrow());
    }

    @Test
    void dealKeepsEveryCardOnce() {
        KlondikeGame game = new KlondikeGame(new Deck(new Random(11)));

        List<Card> all = game.allCards();
        assertEquals(Deck.SIZE, all.size());
        assertEquals(Deck.SIZE, new HashSet<>(all).size());
        assertEquals(Deck.SIZE, game.cardCount());
        assertEquals(0, game.getHandSize());
        for (List<Card> foundation : game.getFoundations()) {
            assertTrue(foundation.isEmpty());
        }
        assertFalse(game.isFinished());
    }

    @Test
    void finishedOnlyWhenAllFoundationsComplete() {
        KlondikeGame almost = KlondikeBuilder.newGame()
                .foundationUpTo("F1", Rank.KING)
                .foundationUpTo("F2", Rank.KING)
                .foundationUpTo("F3", Rank.KING)
                .foundationUpTo("F4", Rank.QUEEN)
                .build();
        assertFalse(almost.isFinished());
        assertEquals(Card.parse("K♣"), almost.peekStock().orElseThrow());

        almost.place(1, PileRef.STOCK_CODE, PileRef.FOUNDATION_FLAG | 3);

        assertTrue(almost.isFinished());
        assertTrue(almost.getStock().isEmpty());
        assertEquals(SuitDeck.COMPLETE_SIZE, almost.getFoundation(3).size());
    }

    @Test
    void playingEveryCardFromStockFinishesGame() {
        // Stock holds Kings at the bottom and Aces on top, so each draw continues a foundation.
        List<Card> stock = new ArrayList<>();
        Rank[] ranks = Rank.values();
        for (int r = ranks.length - 1; r >= 0; r--) {
            for (Suit suit : Suit.values()) {
                stock.add(new Card(ranks[r], suit));
            }
        }
        KlondikeGame game = KlondikeBuilder.newGame().stock(stock).withoutAutoFill().build();

        int moves = 0;
        while (game.peekStock().isPresent()) {
            assertFalse(game.isFinished(), "finished after only " + moves + " moves");
            Card top = game.peekStock().get();
            game.place(1, -1, PileRef.foundation(top.getSuit().ordinal()).encode());
            moves++;
        }

        assertEquals(Deck.SIZE, moves);
        assertTrue(game.isFinished());
    }
}
