package games.klondike.game;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * An ordered, mutable sequence of cards; the last element is the top.
 * <p>
 * Cards only enter through {@link #put(Card)} / {@link #put(List)} and only leave through
 * {@link #take(int)} / {@link #takeAll()}. Runs keep their relative order in both
 * directions, so {@code put(take(n))} on another collection moves the run unchanged.
 */
public class CardCollection {
    private final List<Card> cards = new ArrayList<>();

    public CardCollection() {
    }

    public CardCollection(List<Card> initial) {
        put(initial);
    }

    /**
     * Removes the top {@code n} cards and returns them bottom to top.
     * <p>
     * {@code take(1)} removes exactly the top card.
     *
     * @param n number of cards to remove, {@code 1 <= n <= size()}
     * @return the removed run, in its original order
     * @throws EmptyPileException if {@code n} is out of range
     */
    public List<Card> take(int n) {
        if (n < 1 || n > cards.size()) {
            throw new EmptyPileException(n, cards.size());
        }
        List<Card> top = cards.subList(cards.size() - n, cards.size());
        List<Card> removed = new ArrayList<>(top);
        top.clear();
        return removed;
    }

    /**
     * Removes and returns every card, bottom to top. An empty collection yields an empty list.
     */
    public List<Card> takeAll() {
        List<Card> removed = new ArrayList<>(cards);
        cards.clear();
        return removed;
    }

    /**
     * Places a single card on top.
     *
     * @param card the card; must not be null
     */
    public void put(Card card) {
        if (card == null) {
            throw new IllegalArgumentException("card must not be null");
        }
        cards.add(card);
    }

    /**
     * Places a run of cards on top, first element lowest. The whole run is checked with
     * {@link #checkRun(List)} before any card is written, so a rejected run leaves the
     * collection unchanged.
     *
     * @param run the cards to append in order
     */
    public void put(List<Card> run) {
        checkRun(run);
        for (Card card : run) {
            put(card);
        }
    }

    /**
     * Rejects a run that {@link #put(List)} could not write in full. The base collection
     * accepts any run without null cards.
     *
     * @param run the run about to be written
     * @throws IllegalArgumentException if the run contains a null card
     */
    protected void checkRun(List<Card> run) {
        for (Card card : run) {
            if (card == null) {
                throw new IllegalArgumentException("card must not be null");
            }
        }
    }

    /**
     * Returns the number of cards held.
     *
     * @return the card count
     */
    public int size() {
        return cards.size();
    }

    /** {@code true} when no card is held. */
    public boolean isEmpty() {
        return cards.isEmpty();
    }

    /**
     * Returns the top card without removing it.
     */
    public Optional<Card> peekTop() {
        return cards.isEmpty() ? Optional.empty() : Optional.of(cards.get(cards.size() - 1));
    }

    /**
     * Returns the card at the given position, counted from the bottom (0).
     */
    public Card get(int index) {
        return cards.get(index);
    }

    /**
     * Returns an unmodifiable view of the cards, bottom to top.
     */
    public List<Card> cards() {
        return Collections.unmodifiableList(cards);
    }

    @Override
    public String toString() {
        return cards.toString();
    }
}
