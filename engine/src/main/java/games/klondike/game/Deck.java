package games.klondike.game;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

/**
 * A complete 52-card sequence handed to a {@link KlondikeGame} for the deal.
 * <p>
 * The last card of the sequence is the top of the deck and is dealt first. The engine
 * never shuffles on its own: a deck is either built here (shuffled or in suit/rank order)
 * or supplied by the caller, in which case it must contain every card exactly once.
 */
public class Deck {
    /** Number of cards in a complete deck. */
    public static final int SIZE = 52;

    private final List<Card> cards = new ArrayList<>(SIZE);

    /**
     * Constructs a new Deck with all 52 cards, shuffled with a fresh random source.
     */
    public Deck() {
        this(new Random());
    }

    /**
     * Constructs a new Deck with all 52 cards, shuffled with the given random source.
     * A seeded {@link Random} gives a reproducible deal.
     *
     * @param random the random source; must not be null
     */
    public Deck(Random random) {
        cards.addAll(standardOrder());
        Collections.shuffle(cards, random);
    }

    /**
     * Constructs a Deck from a caller-supplied, already shuffled sequence.
     *
     * @param cards bottom-to-top card order
     * @throws IllegalArgumentException unless the sequence is 52 distinct cards
     */
    public Deck(List<Card> cards) {
        if (cards == null || cards.size() != SIZE) {
            throw new IllegalArgumentException("A deck needs exactly " + SIZE + " cards, got "
                    + (cards == null ? 0 : cards.size()));
        }
        Set<Card> seen = new HashSet<>();
        for (Card card : cards) {
            if (card == null || !seen.add(card)) {
                throw new IllegalArgumentException("Deck contains a null or duplicate card: " + card);
            }
        }
        this.cards.addAll(cards);
    }

    /**
     * Returns a deck in suit-then-rank order (Spades A..K first, Clubs K on top).
     */
    public static Deck ordered() {
        return new Deck(standardOrder());
    }

    /**
     * Returns the 52 cards in suit-then-rank order.
     */
    public static List<Card> standardOrder() {
        List<Card> all = new ArrayList<>(SIZE);
        for (Suit suit : EnumSet.allOf(Suit.class)) {
            for (Rank rank : Rank.values()) {
                all.add(new Card(rank, suit));
            }
        }
        return all;
    }

    public int size() {
        return cards.size();
    }

    /**
     * Returns an unmodifiable view of the cards, bottom to top.
     *
     * @return an unmodifiable list of the deck's cards
     */
    public List<Card> asUnmodifiableList() {
        return Collections.unmodifiableList(cards);
    }

    @Override
    public String toString() {
        return "Deck(size=" + cards.size() + ")";
    }
}
