package games.klondike.game;

import java.util.List;

/**
 * The undealt draw pile.
 * <p>
 * The stock receives the full deck when a game is created, deals the tableau from its top
 * and then hands out one card at a time. It is a source only: {@link #verify(Card)} rejects
 * every card, so no move can end on it.
 */
public class StockPile extends CardCollection implements Pile {

    public StockPile(List<Card> cards) {
        super(cards);
    }

    @Override
    public PileRef.Kind kind() {
        return PileRef.Kind.STOCK;
    }

    @Override
    public boolean verify(Card candidate) {
        return false;
    }

    @Override
    public int movableCount() {
        return size();
    }

    @Override
    public Card peekRun(int count) {
        if (count < 1 || count > size()) {
            throw new EmptyPileException(count, size());
        }
        return get(size() - count);
    }

    @Override
    public String toString() {
        return "StockPile: " + size() + " card(s)";
    }
}
