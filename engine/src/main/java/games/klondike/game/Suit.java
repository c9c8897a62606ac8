package games.klondike.game;

/**
 * The four suits of a standard deck, in foundation order.
 * <p>
 * The declaration order is significant: foundation {@code i} of a {@link KlondikeGame}
 * collects {@code Suit.values()[i]}, so foundation 0 is always Spades.
 * <p>
 * Each suit is either red (Hearts, Diamonds) or black (Spades, Clubs). Tableau piles
 * require alternating colours, which is checked with {@link #isSameColour(Suit)}.
 */
public enum Suit {
    /** Spades – black, ♠. */
    SPADES("♠", 'S', false),
    /** Hearts – red, ♥. */
    HEARTS("♥", 'H', true),
    /** Diamonds – red, ♦. */
    DIAMONDS("♦", 'D', true),
    /** Clubs – black, ♣. */
    CLUBS("♣", 'C', false);

    /** ANSI escape code for red text output in terminals. */
    private static final String ANSI_RED = "\u001B[31m";
    /** ANSI escape code to reset text formatting in terminals. */
    private static final String ANSI_RESET = "\u001B[0m";

    private final String symbol;
    private final char letter;
    private final boolean red;

    Suit(String symbol, char letter, boolean red) {
        this.symbol = symbol;
        this.letter = letter;
        this.red = red;
    }

    /**
     * Returns the Unicode symbol of this suit.
     *
     * @return the suit symbol (e.g., "♠", "♥")
     */
    public String getSymbol() {
        return symbol;
    }

    /**
     * Returns the single ASCII letter used for this suit in typed card codes ("QS", "10h").
     *
     * @return the upper-case suit letter
     */
    public char getLetter() {
        return letter;
    }

    /**
     * Checks whether this suit is red.
     *
     * @return {@code true} for Hearts and Diamonds; {@code false} for Spades and Clubs
     */
    public boolean isRed() {
        return red;
    }

    /**
     * Checks whether this suit has the same colour as another suit.
     *
     * @param other the suit to compare with; must not be null
     * @return {@code true} if both suits are red or both are black
     */
    public boolean isSameColour(Suit other) {
        return red == other.red;
    }

    /**
     * Resolves a suit from either its symbol or its ASCII letter, ignoring case.
     *
     * @param token a symbol ("♣") or letter ("c", "C")
     * @return the matching suit
     * @throws IllegalArgumentException if the token names no suit
     */
    public static Suit fromToken(String token) {
        if (token != null) {
            String trimmed = token.trim();
            for (Suit suit : values()) {
                if (suit.symbol.equals(trimmed)
                        || (trimmed.length() == 1 && Character.toUpperCase(trimmed.charAt(0)) == suit.getLetter())) {
                    return suit;
                }
            }
        }
        throw new IllegalArgumentException("Unknown suit: " + token);
    }

    @Override
    public String toString() {
        return symbol;
    }

    /**
     * Colourises the given value string using ANSI red codes if the suit is red.
     *
     * @param suit the suit to check for colour (may be null)
     * @param value the string value to colourise
     * @return the value wrapped in ANSI red codes if suit is red; otherwise the value unchanged
     */
    public static String colouriseIfRed(Suit suit, String value) {
        if (suit != null && suit.isRed()) {
            return ANSI_RED + value + ANSI_RESET;
        }
        return value;
    }
}
