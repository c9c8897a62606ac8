package games.klondike.game;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Renders a {@link KlondikeGame} as boxed, multi-line text for consoles and debug logs.
 * <p>
 * The stock and foundations are shown on one row, the tableau below it with one column per
 * pile. Face-down tableau cards are drawn as {@code XX} above the face-up run, matching the
 * layout printed by the console {@code help} command. Cell widths ignore ANSI colour codes
 * so coloured and plain output line up the same way.
 * <p>
 * Reads the game through its public accessors only; formatting never changes the board.
 */
public class BoardFormatter {
    /** Default cell width (in characters) used when content is narrower than this value. */
    private static final int CELL_WIDTH = 4;
    /** Placeholder for a face-down card. */
    static final String HIDDEN = "XX";
    /** Placeholder for an empty pile. */
    static final String EMPTY = "--";

    private final KlondikeGame game;
    private final boolean colour;

    /**
     * @param game the game to render; must not be null
     * @param colour {@code true} to wrap red cards in ANSI red
     */
    public BoardFormatter(KlondikeGame game, boolean colour) {
        this.game = game;
        this.colour = colour;
    }

    /**
     * Renders the stock and foundations, then the tableau.
     *
     * @return the board as a multi-line string ending with a newline
     */
    public String format() {
        StringBuilder sb = new StringBuilder();
        appendTopRow(sb);
        appendTableauSection(sb);
        return sb.toString();
    }

    /**
     * Appends the boxed stock and foundation row. The stock shows its top card and size,
     * an empty foundation shows its suit symbol.
     */
    private void appendTopRow(StringBuilder sb) {
        List<String> labels = new ArrayList<>();
        List<String> values = new ArrayList<>();

        labels.add(PileRef.stock().label());
        Optional<Card> stockTop = game.peekStock();
        values.add(stockTop.map(card -> render(card) + " (" + game.getStock().size() + ")").orElse(EMPTY));

        List<List<Card>> foundations = game.getFoundations();
        for (int i = 0; i < foundations.size(); i++) {
            labels.add(PileRef.foundation(i).label());
            List<Card> pile = foundations.get(i);
            values.add(pile.isEmpty() ? Suit.values()[i].getSymbol() : render(pile.get(pile.size() - 1)));
        }

        int width = Math.max(CELL_WIDTH, Math.max(maxVisibleLength(labels), maxVisibleLength(values)));
        String border = buildBorder(labels.size(), width);
        sb.append(border).append('\n')
                .append(buildRow(labels, width)).append('\n')
                .append(buildRow(values, width)).append('\n')
                .append(border).append('\n');
    }

    /**
     * Appends the tableau: one column per pile, hidden cards first, padded to the tallest
     * column.
     */
    private void appendTableauSection(StringBuilder sb) {
        List<String> labels = new ArrayList<>();
        List<List<String>> columns = new ArrayList<>();
        List<List<Card>> visible = game.getVisibleTableau();
        List<Integer> hiddenCounts = game.getTableauHiddenCounts();
        for (int i = 0; i < visible.size(); i++) {
            labels.add(PileRef.tableau(i).label());
            List<String> column = new ArrayList<>();
            for (int h = 0; h < hiddenCounts.get(i); h++) {
                column.add(HIDDEN);
            }
            for (Card card : visible.get(i)) {
                column.add(render(card));
            }
            if (column.isEmpty()) {
                column.add(EMPTY);
            }
            columns.add(column);
        }

        int width = CELL_WIDTH;
        width = Math.max(width, maxVisibleLength(labels));
        int maxRows = 0;
        for (List<String> column : columns) {
            width = Math.max(width, maxVisibleLength(column));
            maxRows = Math.max(maxRows, column.size());
        }

        String border = buildBorder(labels.size(), width);
        sb.append(border).append('\n').append(buildRow(labels, width)).append('\n');
        for (int row = 0; row < maxRows; row++) {
            List<String> cells = new ArrayList<>();
            for (List<String> column : columns) {
                cells.add(row < column.size() ? column.get(row) : "");
            }
            sb.append(buildRow(cells, width)).append('\n');
        }
        sb.append(border).append('\n');
    }

    // Plain or ANSI-coloured short name.
    private String render(Card card) {
        return colour ? card.toColouredString() : card.shortName();
    }

    /**
     * Builds a border line of {@code count} boxes, each {@code cellWidth} wide inside.
     *
     * @param count number of boxes
     * @param cellWidth inner width of each box
     * @return the border line
     */
    private String buildBorder(int count, int cellWidth) {
        StringBuilder line = new StringBuilder();
        for (int i = 0; i < count; i++) {
            line.append("+").append("-".repeat(cellWidth + 2)).append("+");
            if (i < count - 1) {
                line.append(" ");
            }
        }
        return line.toString();
    }

    /**
     * Builds one row of boxed cells, each centred within {@code cellWidth}.
     *
     * @param cells cell contents, left to right
     * @param cellWidth inner width of each box
     * @return the row line
     */
    private String buildRow(List<String> cells, int cellWidth) {
        StringBuilder line = new StringBuilder();
        for (int i = 0; i < cells.size(); i++) {
            line.append("| ").append(padCell(cells.get(i), cellWidth)).append(" |");
            if (i < cells.size() - 1) {
                line.append(" ");
            }
        }
        return line.toString();
    }

    // Centres value in width visible characters; odd padding goes to the right.
    private String padCell(String value, int width) {
        int visible = visibleLength(value);
        if (visible >= width) {
            return value;
        }
        int totalPad = width - visible;
        int left = totalPad / 2;
        return " ".repeat(left) + value + " ".repeat(totalPad - left);
    }

    /**
     * Length of {@code value} as shown on a terminal, ignoring ANSI colour codes.
     */
    private int visibleLength(String value) {
        return value.replaceAll("\\u001B\\[[;\\d]*m", "").length();
    }

    private int maxVisibleLength(List<String> items) {
        int max = 0;
        for (String item : items) {
            max = Math.max(max, visibleLength(item));
        }
        return max;
    }
}
