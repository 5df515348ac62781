package com.deepansh.desk.history;

/**
 * One exchange in a handler's history. The ordinal is assigned by the owning
 * {@link HistoryWindow} and never reused, even after eviction.
 */
public record ConversationTurn(TurnRole role, String content, long ordinal) {
}
