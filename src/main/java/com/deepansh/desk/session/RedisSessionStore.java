package com.deepansh.desk.session;

import com.deepansh.desk.exception.DeskException;
import com.deepansh.desk.exception.SessionCorruptException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;
import java.util.Optional;

/**
 * Redis-backed session store.
 *
 * Design decisions:
 * - Key pattern: desk:session:{sessionId}
 * - Stored as a single JSON value; SET replaces it atomically
 * - TTL reset on every write so abandoned sessions expire
 * - Unreadable values are renamed to {key}:corrupt and reported
 */
@Slf4j
public class RedisSessionStore implements SessionStore {

    static final String KEY_PREFIX = "desk:session:";

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final Duration ttl;

    public RedisSessionStore(StringRedisTemplate redisTemplate, ObjectMapper objectMapper, Duration ttl) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.ttl = ttl;
    }

    /** Writers are serialized by the per-session lock in SessionRegistry. */
    @Override
    public void save(Session session) {
        String id = SessionIds.requireSafe(session.getSessionId());
        try {
            String json = objectMapper.writeValueAsString(session);
            redisTemplate.opsForValue().set(buildKey(id), json, ttl);
            log.debug("Saved session {} to Redis (TTL: {}h)", id, ttl.toHours());
        } catch (JsonProcessingException e) {
            throw new DeskException("Could not serialize session " + id, e);
        }
    }

    @Override
    public Optional<Session> load(String sessionId) {
        String id = SessionIds.requireSafe(sessionId);
        String key = buildKey(id);
        String json = redisTemplate.opsForValue().get(key);
        if (json == null) {
            log.debug("No session found in Redis: {}", id);
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(json, Session.class));
        } catch (JsonProcessingException e) {
            log.error("Session {} in Redis is unreadable; renaming to {}:corrupt", id, key);
            redisTemplate.rename(key, key + ":corrupt");
            throw new SessionCorruptException(id, e);
        }
    }

    @Override
    public void delete(String sessionId) {
        redisTemplate.delete(buildKey(SessionIds.requireSafe(sessionId)));
        log.info("Deleted session {} from Redis", sessionId);
    }

    @Override
    public boolean exists(String sessionId) {
        return Boolean.TRUE.equals(redisTemplate.hasKey(buildKey(SessionIds.requireSafe(sessionId))));
    }

    private String buildKey(String sessionId) {
        return KEY_PREFIX + sessionId;
    }
}
