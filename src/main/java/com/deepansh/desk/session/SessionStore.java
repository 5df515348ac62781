package com.deepansh.desk.session;

import java.util.Optional;

/**
 * Durable, keyed storage of whole session records.
 * Writers to the same session id are serialized by the implementation.
 */
public interface SessionStore {

    /**
     * Atomically replaces the stored record; a partial write is never observable.
     */
    void save(Session session);

    /**
     * @return the last durably saved record, or empty if none exists
     * @throws com.deepansh.desk.exception.SessionCorruptException if the record cannot be read
     */
    Optional<Session> load(String sessionId);

    void delete(String sessionId);

    boolean exists(String sessionId);
}
