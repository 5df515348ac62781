package com.deepansh.desk.session;

import com.deepansh.desk.dispatch.DeskResponse;
import com.deepansh.desk.dispatch.DispatcherFactory;
import com.deepansh.desk.exception.SessionCorruptException;
import com.deepansh.desk.exception.SessionNotFoundException;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Per-process map from session id to its live runtime. Replaces any notion
 * of process-wide handler singletons: every session owns its Dispatcher,
 * Workers and approval gate.
 *
 * Live runtimes are a cache over the store. A runtime is dropped when its
 * session exits, when it has been idle longer than {@code maxIdle}, or when
 * more than {@code maxLive} runtimes are held (least recently used first).
 * A runtime whose turn is in progress is never dropped.
 */
@Slf4j
public class SessionRegistry {

    static final String RECOVERY_NOTICE =
            "Your previous session could not be restored and a new one was started. Sorry for the inconvenience.";

    static final Duration DEFAULT_MAX_IDLE = Duration.ofMinutes(30);
    static final int DEFAULT_MAX_LIVE = 500;

    private final Map<String, SessionRuntime> runtimes = new ConcurrentHashMap<>();
    private final SessionStore store;
    private final DispatcherFactory dispatcherFactory;
    private final SessionIdGenerator idGenerator;
    private final Clock clock;
    private final Duration maxIdle;
    private final int maxLive;

    public SessionRegistry(SessionStore store, DispatcherFactory dispatcherFactory, SessionIdGenerator idGenerator) {
        this(store, dispatcherFactory, idGenerator, Clock.systemUTC(), DEFAULT_MAX_IDLE, DEFAULT_MAX_LIVE);
    }

    public SessionRegistry(SessionStore store,
                           DispatcherFactory dispatcherFactory,
                           SessionIdGenerator idGenerator,
                           Clock clock,
                           Duration maxIdle,
                           int maxLive) {
        this.store = store;
        this.dispatcherFactory = dispatcherFactory;
        this.idGenerator = idGenerator;
        this.clock = clock;
        this.maxIdle = maxIdle;
        this.maxLive = Math.max(1, maxLive);
    }

    /** Starts and persists a new session. A blank requester leaves identity to be asked for. */
    public SessionRuntime create(String requesterId, String prefix) {
        Session session = dispatcherFactory.newSession(idGenerator.generate(prefix));
        if (requesterId != null && !requesterId.isBlank()) {
            session.setRequesterId(requesterId.trim());
        }
        store.save(session);
        SessionRuntime runtime = new SessionRuntime(session, dispatcherFactory.create(session), null);
        runtime.touch(clock.instant());
        runtimes.put(session.getSessionId(), runtime);
        log.info("Created session {}", session.getSessionId());
        sweep(runtime);
        return runtime;
    }

    /**
     * Returns the live runtime, loading it from the store if needed. An
     * unreadable record is replaced by a fresh session under the same id and
     * the runtime carries a recovery notice.
     *
     * @throws SessionNotFoundException if no record exists
     */
    public SessionRuntime open(String sessionId) {
        SessionRuntime runtime = runtimes.computeIfAbsent(sessionId, this::load);
        runtime.touch(clock.instant());
        sweep(runtime);
        return runtime;
    }

    /**
     * Runs {@code work} while holding the session's lock, so turns of one
     * session never overlap. Different sessions proceed independently.
     * A session that answers EXIT is released from memory afterwards.
     */
    public <T> T execute(String sessionId, Function<SessionRuntime, T> work) {
        while (true) {
            SessionRuntime runtime = open(sessionId);
            runtime.getLock().lock();
            try {
                // Evicted between open and lock: retry against the current runtime.
                if (runtimes.get(sessionId) != runtime) {
                    continue;
                }
                T result = work.apply(runtime);
                runtime.touch(clock.instant());
                if (result instanceof DeskResponse response && response.getType() == DeskResponse.Type.EXIT) {
                    runtimes.remove(sessionId, runtime);
                    log.debug("Session {} released after exit", sessionId);
                }
                return result;
            } finally {
                runtime.getLock().unlock();
            }
        }
    }

    public Optional<SessionRuntime> find(String sessionId) {
        return Optional.ofNullable(runtimes.get(sessionId));
    }

    public void evict(String sessionId) {
        SessionRuntime runtime = runtimes.get(sessionId);
        if (runtime != null) {
            tryEvict(runtime);
        }
    }

    public int liveCount() {
        return runtimes.size();
    }

    /** Drops idle runtimes, then the least recently used ones above the bound; {@code keep} stays. */
    private void sweep(SessionRuntime keep) {
        Instant cutoff = clock.instant().minus(maxIdle);
        for (SessionRuntime runtime : List.copyOf(runtimes.values())) {
            if (runtime != keep && runtime.getLastUsed().isBefore(cutoff) && tryEvict(runtime)) {
                log.debug("Session {} released after {} idle", runtime.getSessionId(), maxIdle);
            }
        }
        if (runtimes.size() <= maxLive) {
            return;
        }
        List<SessionRuntime> oldestFirst = runtimes.values().stream()
                .filter(runtime -> runtime != keep)
                .sorted(Comparator.comparing(SessionRuntime::getLastUsed))
                .toList();
        for (SessionRuntime runtime : oldestFirst) {
            if (runtimes.size() <= maxLive) {
                break;
            }
            tryEvict(runtime);
        }
    }

    private boolean tryEvict(SessionRuntime runtime) {
        if (!runtime.getLock().tryLock()) {
            return false;
        }
        try {
            return runtimes.remove(runtime.getSessionId(), runtime);
        } finally {
            runtime.getLock().unlock();
        }
    }

    private SessionRuntime load(String sessionId) {
        try {
            Session session = store.load(sessionId)
                    .orElseThrow(() -> new SessionNotFoundException(sessionId));
            return new SessionRuntime(session, dispatcherFactory.create(session), null);
        } catch (SessionCorruptException e) {
            log.error("Session {} is corrupt, starting a fresh one", sessionId, e);
            Session fresh = dispatcherFactory.newSession(sessionId);
            store.save(fresh);
            return new SessionRuntime(fresh, dispatcherFactory.create(fresh), RECOVERY_NOTICE);
        }
    }
}
