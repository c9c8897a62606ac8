package games.klondike.game;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A Klondike board and the rules for moving cards around it.
 * <p>
 * <strong>Layout:</strong>
 * <ul>
 *   <li><strong>Stock (S, address -1):</strong> receives the whole deck, deals the tableau and
 *       keeps the remaining 24 cards face down. Cards leave it one at a time.</li>
 *   <li><strong>Tableau (T1–T7, addresses 0–6):</strong> pile {@code i} is dealt {@code i + 1}
 *       cards with only the last one face up.</li>
 *   <li><strong>Foundations (F1–F4, addresses 16–19):</strong> one per suit in {@link Suit}
 *       order, built from Ace to King.</li>
 *   <li><strong>Hand:</strong> a transfer buffer used inside {@link #place}; always empty
 *       between calls.</li>
 * </ul>
 * <p>
 * Every card is held by exactly one of these containers. The board only changes through
 * {@link #place(int, int, int)}, which checks the whole move before moving anything, so a
 * rejected move leaves the board untouched. The game is finished when all four foundations
 * are complete; dead ends are not detected.
 * <p>
 * Not thread-safe; a game is driven by a single caller.
 */
public class KlondikeGame {
    private static final Logger log = LoggerFactory.getLogger(KlondikeGame.class);

    private final StockPile stock;
    private final List<TableauPile> tableau;
    private final List<SuitDeck> foundations;
    private final CardCollection hand = new CardCollection();

    /**
     * Deals a new game from a freshly shuffled deck.
     */
    public KlondikeGame() {
        this(new Deck());
    }

    /**
     * Deals a new game from the given deck.
     * <p>
     * The whole deck goes into the stock; tableau pile {@code i} then takes {@code i + 1}
     * cards one at a time from the stock top, the last of which is left face up.
     *
     * @param deck the pre-shuffled deck; its last card is dealt first
     */
    public KlondikeGame(Deck deck) {
        Objects.requireNonNull(deck, "deck");
        this.stock = new StockPile(deck.asUnmodifiableList());
        this.tableau = new ArrayList<>(PileRef.TABLEAU_COUNT);
        for (int pileIndex = 0; pileIndex < PileRef.TABLEAU_COUNT; pileIndex++) {
            List<Card> dealt = new ArrayList<>(pileIndex + 1);
            for (int cardCount = 0; cardCount <= pileIndex; cardCount++) {
                dealt.addAll(stock.take(1));
            }
            tableau.add(TableauPile.deal(dealt));
        }
        this.foundations = newFoundations();
        if (log.isDebugEnabled()) {
            log.debug("Dealt new game, {} card(s) left in stock:\n{}", stock.size(), new BoardFormatter(this, false).format());
        }
    }

    /**
     * Assembles a game from existing piles. Foundations must be in {@link Suit} order.
     */
    KlondikeGame(StockPile stock, List<TableauPile> tableau, List<SuitDeck> foundations) {
        this.stock = Objects.requireNonNull(stock, "stock");
        if (tableau.size() != PileRef.TABLEAU_COUNT) {
            throw new IllegalArgumentException("Expected " + PileRef.TABLEAU_COUNT + " tableau piles, got " + tableau.size());
        }
        if (foundations.size() != PileRef.FOUNDATION_COUNT) {
            throw new IllegalArgumentException("Expected " + PileRef.FOUNDATION_COUNT + " foundations, got " + foundations.size());
        }
        for (int i = 0; i < foundations.size(); i++) {
            if (foundations.get(i).getSuit() != Suit.values()[i]) {
                throw new IllegalArgumentException("Foundation " + i + " must collect " + Suit.values()[i]);
            }
        }
        this.tableau = new ArrayList<>(tableau);
        this.foundations = new ArrayList<>(foundations);
    }

    /**
     * Moves {@code count} cards from one pile to another, addressing piles by integer code
     * ({@code -1} stock, {@code 0..6} tableau, {@code 16..19} foundation).
     *
     * @param count number of cards to move from the top of the source
     * @param sourceIndex address of the pile to take from
     * @param destIndex address of the pile to place on
     * @return this game, for chaining
     * @throws IllegalMoveException if the move breaks a rule; the board is unchanged
     * @see PileRef
     */
    public KlondikeGame place(int count, int sourceIndex, int destIndex) {
        if (sourceIndex == destIndex) {
            throw reject("Cannot move cards onto the pile they come from");
        }
        if (destIndex == PileRef.STOCK_CODE) {
            throw reject("Cannot place cards onto the stock");
        }
        return place(count, resolve(sourceIndex), resolve(destIndex));
    }

    /**
     * Moves {@code count} cards from {@code source} to {@code dest}.
     * <p>
     * The move is checked in full before any card moves:
     * <ol>
     *   <li>source and destination differ and the destination is not the stock;</li>
     *   <li>at least one card moves; the stock gives exactly one card per move and a
     *       foundation receives exactly one card per move;</li>
     *   <li>foundations never act as a source;</li>
     *   <li>the source has {@code count} movable cards;</li>
     *   <li>the destination accepts the bottom card of the moving run, i.e. the card that
     *       will lie directly on its current top.</li>
     * </ol>
     * The run then travels source → hand → destination, keeping its order.
     *
     * @return this game, for chaining
     * @throws IllegalMoveException if any check fails; the board is unchanged
     */
    public KlondikeGame place(int count, PileRef source, PileRef dest) {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(dest, "dest");
        if (source.equals(dest)) {
            throw reject("Cannot move cards onto the pile they come from");
        }
        if (dest.getKind() == PileRef.Kind.STOCK) {
            throw reject("Cannot place cards onto the stock");
        }
        if (count < 1) {
            throw reject("Must move at least one card, got " + count);
        }
        if (source.getKind() == PileRef.Kind.STOCK && count != 1) {
            throw reject("Can only take 1 card at a time from the stock");
        }
        if (source.getKind() == PileRef.Kind.FOUNDATION) {
            throw reject("Cards cannot be taken back from foundation " + source);
        }
        if (dest.getKind() == PileRef.Kind.FOUNDATION && count != 1) {
            throw reject("Foundation " + dest + " accepts one card at a time");
        }

        Pile from = pile(source);
        Pile to = pile(dest);
        if (from.movableCount() < count) {
            throw reject("Cannot move " + count + " card(s) from " + source + ", only " + from.movableCount() + " available");
        }
        Card candidate = from.peekRun(count);
        if (!to.verify(candidate)) {
            throw reject("invalid move: " + candidate.shortName() + " cannot be placed on " + dest);
        }

        hand.put(takeFrom(from, source, count));
        to.put(hand.takeAll());
        if (log.isDebugEnabled()) {
            log.debug("Moved {} card(s) from {} to {}, starting with {}", count, source, dest, candidate.shortName());
        }
        return this;
    }

    /**
     * Returns {@code true} once all four foundations hold Ace to King.
     */
    public boolean isFinished() {
        for (SuitDeck foundation : foundations) {
            if (!foundation.isComplete()) {
                return false;
            }
        }
        return true;
    }

    /**
     * Returns the stock, bottom to top. The last card is the one a stock move takes.
     */
    public List<Card> getStock() {
        return stock.cards();
    }

    /**
     * Returns the top card of the stock, if any.
     */
    public Optional<Card> peekStock() {
        return stock.peekTop();
    }

    /**
     * Returns the face-up cards of tableau pile {@code index}, bottom to top.
     */
    public List<Card> getTableau(int index) {
        return tableauPile(index).shownCards();
    }

    /**
     * Returns the number of face-down cards under tableau pile {@code index}.
     */
    public int getTableauHiddenCount(int index) {
        return tableauPile(index).hiddenCount();
    }

    /**
     * Returns the face-up suffix of every tableau pile. Hidden cards are excluded.
     */
    public List<List<Card>> getVisibleTableau() {
        List<List<Card>> visible = new ArrayList<>(tableau.size());
        for (TableauPile pile : tableau) {
            visible.add(pile.shownCards());
        }
        return Collections.unmodifiableList(visible);
    }

    /**
     * Returns the count of face-down cards for each tableau pile.
     */
    public List<Integer> getTableauHiddenCounts() {
        List<Integer> counts = new ArrayList<>(tableau.size());
        for (TableauPile pile : tableau) {
            counts.add(pile.hiddenCount());
        }
        return Collections.unmodifiableList(counts);
    }

    /**
     * Returns foundation {@code index} (in {@link Suit} order), Ace first.
     */
    public List<Card> getFoundation(int index) {
        return foundationPile(index).cards();
    }

    /**
     * Returns all four foundations in {@link Suit} order.
     */
    public List<List<Card>> getFoundations() {
        List<List<Card>> piles = new ArrayList<>(foundations.size());
        for (SuitDeck foundation : foundations) {
            piles.add(foundation.cards());
        }
        return Collections.unmodifiableList(piles);
    }

    /**
     * Returns the top card of the pile at {@code ref}, if one is face up.
     */
    public Optional<Card> peek(PileRef ref) {
        return pile(ref).peekTop();
    }

    /**
     * Returns the number of cards at {@code ref}, face-down cards included.
     */
    public int sizeOf(PileRef ref) {
        return pile(ref).size();
    }

    /**
     * Number of cards in the transfer buffer; zero whenever no move is in progress.
     */
    public int getHandSize() {
        return hand.size();
    }

    /**
     * Total number of cards across every container; 52 for any game built from a deck.
     */
    public int cardCount() {
        int total = stock.size() + hand.size();
        for (TableauPile pile : tableau) {
            total += pile.size();
        }
        for (SuitDeck foundation : foundations) {
            total += foundation.size();
        }
        return total;
    }

    /**
     * Every card on the board including face-down cards, stock first, then tableau,
     * foundations and hand.
     */
    List<Card> allCards() {
        List<Card> all = new ArrayList<>(stock.cards());
        for (TableauPile pile : tableau) {
            all.addAll(pile.hiddenCards());
            all.addAll(pile.shownCards());
        }
        for (SuitDeck foundation : foundations) {
            all.addAll(foundation.cards());
        }
        all.addAll(hand.cards());
        return all;
    }

    @Override
    public String toString() {
        return new BoardFormatter(this, false).format();
    }

    private List<Card> takeFrom(Pile from, PileRef source, int count) {
        if (from instanceof TableauPile) {
            TableauPile.Withdrawal withdrawal = ((TableauPile) from).withdraw(count);
            if (withdrawal.revealed() && log.isDebugEnabled()) {
                log.debug("Revealed {} on {}", from.peekTop().map(Card::shortName).orElse("--"), source);
            }
            return withdrawal.cards();
        }
        return from.take(count);
    }

    private PileRef resolve(int code) {
        try {
            return PileRef.decode(code);
        } catch (IllegalArgumentException e) {
            if (log.isDebugEnabled()) {
                log.debug("Rejected move: {}", e.getMessage());
            }
            throw new IllegalMoveException(e.getMessage(), e);
        }
    }

    private Pile pile(PileRef ref) {
        Pile pile;
        switch (ref.getKind()) {
            case STOCK:
                pile = stock;
                break;
            case FOUNDATION:
                pile = foundations.get(ref.getIndex());
                break;
            default:
                pile = tableau.get(ref.getIndex());
                break;
        }
        if (pile.kind() != ref.getKind()) {
            throw new IllegalStateException(ref + " resolved to a " + pile.kind() + " pile");
        }
        return pile;
    }

    private TableauPile tableauPile(int index) {
        return tableau.get(PileRef.tableau(index).getIndex());
    }

    private SuitDeck foundationPile(int index) {
        return foundations.get(PileRef.foundation(index).getIndex());
    }

    private IllegalMoveException reject(String message) {
        if (log.isDebugEnabled()) {
            log.debug("Rejected move: {}", message);
        }
        return new IllegalMoveException(message);
    }

    private static List<SuitDeck> newFoundations() {
        List<SuitDeck> piles = new ArrayList<>(PileRef.FOUNDATION_COUNT);
        for (Suit suit : Suit.values()) {
            piles.add(new SuitDeck(suit));
        }
        return piles;
    }
}
