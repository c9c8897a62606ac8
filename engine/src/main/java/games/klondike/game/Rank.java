package games.klondike.game;

/**
 * The 13 ranks of a standard deck, Ace low.
 * <p>
 * Foundations build upward by one from {@link #ACE}; tableau piles build downward by one
 * and can only be started with a {@link #KING}.
 */
public enum Rank {
    ACE(1, "A"),
    TWO(2, "2"),
    THREE(3, "3"),
    FOUR(4, "4"),
    FIVE(5, "5"),
    SIX(6, "6"),
    SEVEN(7, "7"),
    EIGHT(8, "8"),
    NINE(9, "9"),
    TEN(10, "10"),
    JACK(11, "J"),
    QUEEN(12, "Q"),
    KING(13, "K");

    /** Numeric value of the rank (1–13). */
    private final int value;
    /** Short string label for display (e.g., "A", "K", "10"). */
    private final String label;

    Rank(int value, String label) {
        this.value = value;
        this.label = label;
    }

    /**
     * Returns the numeric value of this rank.
     *
     * @return 1 for Ace through 13 for King
     */
    public int getValue() {
        return value;
    }

    /**
     * Returns the short string label of this rank.
     *
     * @return the label (e.g., "A", "K", "10")
     */
    public String getLabel() {
        return label;
    }

    /**
     * Resolves a rank from its label, ignoring case.
     *
     * @param label "A", "2".."10", "J", "Q" or "K"
     * @return the matching rank
     * @throws IllegalArgumentException if no rank has that label
     */
    public static Rank fromLabel(String label) {
        if (label != null) {
            for (Rank rank : values()) {
                if (rank.label.equalsIgnoreCase(label.trim())) {
                    return rank;
                }
            }
        }
        throw new IllegalArgumentException("Unknown rank: " + label);
    }

    @Override
    public String toString() {
        return label;
    }
}
