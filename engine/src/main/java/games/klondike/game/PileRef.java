package games.klondike.game;

import java.util.Objects;

/**
 * Address of a single pile on the board: the stock, one of the seven tableau piles or one
 * of the four foundations.
 * <p>
 * {@link KlondikeGame#place(int, int, int)} takes pile addresses as plain integers. The
 * integer form is:
 * <ul>
 *   <li>{@code -1} – the stock;</li>
 *   <li>{@code 0..6} – tableau pile {@code index};</li>
 *   <li>{@code 16..19} – foundation {@code index & 0xF}, i.e. the {@code 0x10} bit marks a
 *       foundation.</li>
 * </ul>
 * {@link #decode(int)} and {@link #encode()} convert between the two forms and are exact
 * inverses on those values. Every other integer is rejected.
 */
public final class PileRef {
    /** Number of tableau piles on the board. */
    public static final int TABLEAU_COUNT = 7;
    /** Number of foundations on the board. */
    public static final int FOUNDATION_COUNT = 4;
    /** Integer address of the stock. */
    public static final int STOCK_CODE = -1;
    /** Bit that marks a foundation address. */
    public static final int FOUNDATION_FLAG = 0x10;

    /** The kinds of pile a move can address. */
    public enum Kind {
        STOCK,
        TABLEAU,
        FOUNDATION
    }

    private static final PileRef STOCK = new PileRef(Kind.STOCK, 0);

    private final Kind kind;
    private final int index;

    private PileRef(Kind kind, int index) {
        this.kind = kind;
        this.index = index;
    }

    public static PileRef stock() {
        return STOCK;
    }

    /**
     * @param index tableau position, 0..6
     * @throws IllegalArgumentException if the position is out of range
     */
    public static PileRef tableau(int index) {
        if (index < 0 || index >= TABLEAU_COUNT) {
            throw new IllegalArgumentException("Tableau index out of range: " + index);
        }
        return new PileRef(Kind.TABLEAU, index);
    }

    /**
     * @param index foundation position, 0..3, in {@link Suit} order
     * @throws IllegalArgumentException if the position is out of range
     */
    public static PileRef foundation(int index) {
        if (index < 0 || index >= FOUNDATION_COUNT) {
            throw new IllegalArgumentException("Foundation index out of range: " + index);
        }
        return new PileRef(Kind.FOUNDATION, index);
    }

    /**
     * Decodes an integer pile address.
     *
     * @param code {@code -1}, {@code 0..6} or {@code 16..19}
     * @return the addressed pile
     * @throws IllegalArgumentException if {@code code} addresses no pile
     */
    public static PileRef decode(int code) {
        if (code == STOCK_CODE) {
            return STOCK;
        }
        if (code >= 0 && (code ^ FOUNDATION_FLAG) < FOUNDATION_FLAG) {
            int local = code & 0xF;
            if (local < FOUNDATION_COUNT) {
                return new PileRef(Kind.FOUNDATION, local);
            }
        } else if (code >= 0 && code < TABLEAU_COUNT) {
            return new PileRef(Kind.TABLEAU, code);
        }
        throw new IllegalArgumentException("Not a pile address: " + code);
    }

    /**
     * Returns the integer address of this pile; {@code decode(ref.encode()).equals(ref)}.
     */
    public int encode() {
        switch (kind) {
            case STOCK:
                return STOCK_CODE;
            case FOUNDATION:
                return FOUNDATION_FLAG | index;
            default:
                return index;
        }
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * Position within the pile kind: tableau 0..6, foundation 0..3, always 0 for the stock.
     */
    public int getIndex() {
        return index;
    }

    /**
     * Returns the console code of this pile: "S", "T1".."T7" or "F1".."F4".
     */
    public String label() {
        switch (kind) {
            case STOCK:
                return "S";
            case FOUNDATION:
                return "F" + (index + 1);
            default:
                return "T" + (index + 1);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof PileRef)) {
            return false;
        }
        PileRef other = (PileRef) o;
        return kind == other.kind && index == other.index;
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, index);
    }

    @Override
    public String toString() {
        return label();
    }
}
