package games.klondike.game;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Fluent builder for constructing exact {@link KlondikeGame} states in tests.
 *
 * <p>Every built game holds all 52 cards: cards not placed explicitly are put at the
 * bottom of the stock in suit/rank order, under any cards given to {@link #stock(String...)}.
 * Duplicates and foundation piles that are not an Ace-up run fail fast in {@link #build()}.
 *
 * <pre>{@code
 * KlondikeGame game = KlondikeBuilder.newGame()
 *     .tableau("T1", "K♠")
 *     .tableau("T2", 2, "7♦", "3♣", "Q♥", "J♣")
 *     .foundation("F1", "A♠", "2♠")
 *     .stock("9♣")
 *     .build();
 * }</pre>
 *
 * <p>All card lists are bottom-to-top; the last card is the top.
 */
public final class KlondikeBuilder {

    private final List<List<Card>> hidden = new ArrayList<>();
    private final List<List<Card>> shown = new ArrayList<>();
    private final List<List<Card>> foundations = new ArrayList<>();
    private final List<Card> stock = new ArrayList<>();
    private boolean autoFill = true;

    private KlondikeBuilder() {
        for (int i = 0; i < PileRef.TABLEAU_COUNT; i++) {
            hidden.add(new ArrayList<>());
            shown.add(new ArrayList<>());
        }
        for (int i = 0; i < PileRef.FOUNDATION_COUNT; i++) {
            foundations.add(new ArrayList<>());
        }
    }

    public static KlondikeBuilder newGame() {
        return new KlondikeBuilder();
    }

    /**
     * Sets a tableau pile with every card face up.
     */
    public KlondikeBuilder tableau(String pile, String... cards) {
        return tableau(pile, 0, cards);
    }

    /**
     * Sets a tableau pile whose first {@code hiddenCount} cards are face down.
     *
     * @param pile "T1".."T7"
     * @param hiddenCount number of face-down cards at the bottom
     * @param cards bottom-to-top cards
     */
    public KlondikeBuilder tableau(String pile, int hiddenCount, String... cards) {
        PileRef ref = ref(pile, PileRef.Kind.TABLEAU);
        if (hiddenCount < 0 || hiddenCount > cards.length) {
            throw new IllegalArgumentException("Invalid hiddenCount=" + hiddenCount + " for " + pile);
        }
        if (cards.length > 0 && hiddenCount == cards.length) {
            throw new IllegalArgumentException("Non-empty " + pile + " must have at least 1 face-up card");
        }
        List<Card> parsed = parse(cards);
        hidden.set(ref.getIndex(), new ArrayList<>(parsed.subList(0, hiddenCount)));
        shown.set(ref.getIndex(), new ArrayList<>(parsed.subList(hiddenCount, parsed.size())));
        return this;
    }

    /**
     * Sets a foundation, Ace first.
     */
    public KlondikeBuilder foundation(String pile, String... cards) {
        PileRef ref = ref(pile, PileRef.Kind.FOUNDATION);
        foundations.set(ref.getIndex(), parse(cards));
        return this;
    }

    /**
     * Fills foundation {@code pile} with its suit from Ace up to {@code top}.
     */
    public KlondikeBuilder foundationUpTo(String pile, Rank top) {
        PileRef ref = ref(pile, PileRef.Kind.FOUNDATION);
        Suit suit = Suit.values()[ref.getIndex()];
        List<Card> run = new ArrayList<>();
        for (Rank rank : Rank.values()) {
            if (rank.getValue() > top.getValue()) {
                break;
            }
            run.add(new Card(rank, suit));
        }
        foundations.set(ref.getIndex(), run);
        return this;
    }

    /**
     * Puts cards on top of the stock; the last card is drawn first.
     */
    public KlondikeBuilder stock(String... cards) {
        stock.addAll(parse(cards));
        return this;
    }

    public KlondikeBuilder stock(List<Card> cards) {
        stock.addAll(cards);
        return this;
    }

    /**
     * Leaves unspecified cards out of the game instead of filling them into the stock.
     */
    public KlondikeBuilder withoutAutoFill() {
        autoFill = false;
        return this;
    }

    public KlondikeGame build() {
        Set<Card> used = new LinkedHashSet<>();
        for (int i = 0; i < PileRef.TABLEAU_COUNT; i++) {
            claim(used, hidden.get(i));
            claim(used, shown.get(i));
        }
        for (List<Card> foundation : foundations) {
            claim(used, foundation);
        }
        claim(used, stock);

        List<Card> stockCards = new ArrayList<>();
        if (autoFill) {
            for (Card card : Deck.standardOrder()) {
                if (!used.contains(card)) {
                    stockCards.add(card);
                }
            }
        }
        stockCards.addAll(stock);

        List<TableauPile> piles = new ArrayList<>();
        for (int i = 0; i < PileRef.TABLEAU_COUNT; i++) {
            piles.add(new TableauPile(hidden.get(i), shown.get(i)));
        }
        List<SuitDeck> decks = new ArrayList<>();
        for (int i = 0; i < PileRef.FOUNDATION_COUNT; i++) {
            SuitDeck deck = new SuitDeck(Suit.values()[i]);
            deck.put(foundations.get(i));
            decks.add(deck);
        }
        return new KlondikeGame(new StockPile(stockCards), piles, decks);
    }

    private static void claim(Set<Card> used, List<Card> cards) {
        for (Card card : cards) {
            if (!used.add(card)) {
                throw new IllegalStateException("Card placed twice: " + card);
            }
        }
    }

    private static PileRef ref(String pile, PileRef.Kind expected) {
        char type = Character.toUpperCase(pile.charAt(0));
        int index = Integer.parseInt(pile.substring(1)) - 1;
        PileRef ref = type == 'T' ? PileRef.tableau(index) : PileRef.foundation(index);
        if (ref.getKind() != expected) {
            throw new IllegalArgumentException("Expected a " + expected + " pile, got " + pile);
        }
        return ref;
    }

    static List<Card> parse(String... cards) {
        List<Card> parsed = new ArrayList<>(cards.length);
        Set<Card> seen = new HashSet<>();
        for (String code : cards) {
            Card card = Card.parse(code);
            if (!seen.add(card)) {
                throw new IllegalArgumentException("Duplicate card " + code);
            }
            parsed.add(card);
        }
        return parsed;
    }
}
