package com.deepansh.desk.history;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Bounded turn log for one handler (the Dispatcher or a single Worker).
 *
 * Eviction is strictly oldest-first over non-pinned turns. A turn is pinned
 * while it is the originating context of an unresolved pending action, so it
 * survives eviction until {@link #unpinAll()} is called on resolution.
 *
 * Stored as part of the session record, hence the Jackson constructor.
 */
@Slf4j
public class HistoryWindow {

    private final int bound;
    private final List<ConversationTurn> turns;
    private final Set<Long> pinned;
    private long nextOrdinal;

    public HistoryWindow(int bound) {
        this(bound, new ArrayList<>(), new LinkedHashSet<>(), 0);
    }

    @JsonCreator
    public HistoryWindow(@JsonProperty("bound") int bound,
                         @JsonProperty("turns") List<ConversationTurn> turns,
                         @JsonProperty("pinned") Set<Long> pinned,
                         @JsonProperty("nextOrdinal") long nextOrdinal) {
        if (bound < 1) {
            throw new IllegalArgumentException("History bound must be at least 1, was " + bound);
        }
        this.bound = bound;
        this.turns = turns != null ? new ArrayList<>(turns) : new ArrayList<>();
        this.pinned = pinned != null ? new LinkedHashSet<>(pinned) : new LinkedHashSet<>();
        this.nextOrdinal = nextOrdinal;
        evictOverflow();
    }

    public ConversationTurn append(TurnRole role, String content) {
        ConversationTurn turn = new ConversationTurn(role, content != null ? content : "", nextOrdinal++);
        turns.add(turn);
        evictOverflow();
        return turn;
    }

    /**
     * Protects the turn with {@code ordinal} from eviction.
     *
     * @throws IllegalStateException if pinning would leave no evictable slot
     */
    public void pin(long ordinal) {
        boolean present = turns.stream().anyMatch(t -> t.ordinal() == ordinal);
        if (!present) {
            throw new IllegalArgumentException("No turn with ordinal " + ordinal + " in window");
        }
        if (!pinned.contains(ordinal) && pinned.size() + 1 >= bound) {
            throw new IllegalStateException(
                    "Cannot pin more than " + (bound - 1) + " turns in a window of " + bound);
        }
        pinned.add(ordinal);
    }

    /** Pins the most recent turn of the given role, if any. */
    public void pinLast(TurnRole role) {
        for (int i = turns.size() - 1; i >= 0; i--) {
            if (turns.get(i).role() == role) {
                pin(turns.get(i).ordinal());
                return;
            }
        }
    }

    public void unpinAll() {
        pinned.clear();
    }

    public void clear() {
        turns.clear();
        pinned.clear();
    }

    public int getBound() {
        return bound;
    }

    public List<ConversationTurn> getTurns() {
        return Collections.unmodifiableList(turns);
    }

    public Set<Long> getPinned() {
        return Collections.unmodifiableSet(pinned);
    }

    public long getNextOrdinal() {
        return nextOrdinal;
    }

    @JsonIgnore
    public int size() {
        return turns.size();
    }

    private void evictOverflow() {
        Iterator<ConversationTurn> it = turns.iterator();
        while (turns.size() > bound && it.hasNext()) {
            ConversationTurn candidate = it.next();
            if (!pinned.contains(candidate.ordinal())) {
                it.remove();
                log.debug("Evicted turn #{} ({})", candidate.ordinal(), candidate.role());
            }
        }
    }
}
