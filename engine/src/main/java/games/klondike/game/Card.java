package games.klondike.game;

import java.util.Objects;

/**
 * A single playing card with a {@link Rank} and a {@link Suit}.
 * <p>
 * Cards are immutable. A deck holds exactly one card per rank and suit, so equality is
 * by value: two {@code Card} instances with the same rank and suit denote the same
 * physical card.
 */
public class Card {
    private final Rank rank;
    private final Suit suit;

    /**
     * Constructs a Card with the given rank and suit.
     *
     * @param rank the rank of the card (must not be null)
     * @param suit the suit of the card (must not be null)
     * @throws NullPointerException if rank or suit is null
     */
    public Card(Rank rank, Suit suit) {
        this.rank = Objects.requireNonNull(rank, "rank");
        this.suit = Objects.requireNonNull(suit, "suit");
    }

    /**
     * Parses a card from its short name or an ASCII code.
     * <p>
     * The last character is the suit (symbol or letter) and the rest is the rank label,
     * so "Q♠", "qs", "10♦" and "10D" are all accepted.
     *
     * @param code the card code
     * @return the parsed card
     * @throws IllegalArgumentException if the code is not a card
     */
    public static Card parse(String code) {
        if (code == null || code.trim().length() < 2) {
            throw new IllegalArgumentException("Invalid card code: " + code);
        }
        String trimmed = code.trim();
        int split = trimmed.length() - 1;
        return new Card(Rank.fromLabel(trimmed.substring(0, split)), Suit.fromToken(trimmed.substring(split)));
    }

    /**
     * Returns the rank of this card.
     *
     * @return the rank
     */
    public Rank getRank() {
        return rank;
    }

    /**
     * Returns the suit of this card.
     *
     * @return the suit
     */
    public Suit getSuit() {
        return suit;
    }

    /**
     * Returns {@code true} if this card is red (Hearts or Diamonds).
     */
    public boolean isRed() {
        return suit.isRed();
    }

    /**
     * Returns the short, non-coloured name of this card, e.g. "Q♠", "10♦", "A♣".
     *
     * @return the short name of the card
     */
    public String shortName() {
        return rank.getLabel() + suit.getSymbol();
    }

    /**
     * Returns the short name wrapped in ANSI red when the suit is red, for terminals.
     *
     * @return the coloured short name
     */
    public String toColouredString() {
        return Suit.colouriseIfRed(suit, shortName());
    }

    @Override
    public String toString() {
        return shortName();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Card)) {
            return false;
        }
        Card card = (Card) o;
        return rank == card.rank && suit == card.suit;
    }

    @Override
    public int hashCode() {
        return Objects.hash(rank, suit);
    }
}
