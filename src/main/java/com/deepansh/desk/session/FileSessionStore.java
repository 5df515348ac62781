package com.deepansh.desk.session;

import com.deepansh.desk.exception.DeskException;
import com.deepansh.desk.exception.SessionCorruptException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One JSON file per session: {@code <directory>/session_<id>.json}.
 *
 * Design decisions:
 * - Write to a temp file in the same directory, then rename over the target
 * - Striped per-id locks: writers to the same session never interleave, and the
 *   lock table stays the same size however many sessions pass through
 * - Unreadable records are moved aside to {@code .corrupt-<millis>} and reported
 */
@Slf4j
public class FileSessionStore implements SessionStore {

    static final int LOCK_STRIPES = 64;

    private final Path directory;
    private final ObjectMapper objectMapper;
    private final ReentrantLock[] locks = new ReentrantLock[LOCK_STRIPES];

    public FileSessionStore(Path directory, ObjectMapper objectMapper) {
        this.directory = directory;
        this.objectMapper = objectMapper;
        for (int i = 0; i < locks.length; i++) {
            locks[i] = new ReentrantLock();
        }
    }

    @Override
    public void save(Session session) {
        String id = SessionIds.requireSafe(session.getSessionId());
        ReentrantLock lock = lockFor(id);
        lock.lock();
        Path temp = null;
        try {
            Files.createDirectories(directory);
            temp = Files.createTempFile(directory, "session_" + id + "_", ".tmp");
            objectMapper.writeValue(temp.toFile(), session);
            Path target = fileFor(id);
            try {
                Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                log.debug("Atomic move unsupported in {}, falling back to replace", directory);
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
            log.debug("Saved session {} to {}", id, target);
        } catch (IOException e) {
            throw new DeskException("Could not save session " + id, e);
        } finally {
            deleteQuietly(temp);
            lock.unlock();
        }
    }

    @Override
    public Optional<Session> load(String sessionId) {
        String id = SessionIds.requireSafe(sessionId);
        ReentrantLock lock = lockFor(id);
        lock.lock();
        try {
            Path file = fileFor(id);
            if (!Files.exists(file)) {
                log.debug("No saved session {}", id);
                return Optional.empty();
            }
            try {
                Session session = objectMapper.readValue(file.toFile(), Session.class);
                if (session == null || !id.equals(session.getSessionId())) {
                    throw new IOException("Record does not belong to session " + id);
                }
                log.info("Loaded session {} [activeWorker={}]", id, session.getActiveWorkerType());
                return Optional.of(session);
            } catch (IOException e) {
                quarantine(file);
                throw new SessionCorruptException(id, e);
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void delete(String sessionId) {
        String id = SessionIds.requireSafe(sessionId);
        ReentrantLock lock = lockFor(id);
        lock.lock();
        try {
            Files.deleteIfExists(fileFor(id));
            log.info("Deleted session {}", id);
        } catch (IOException e) {
            throw new DeskException("Could not delete session " + id, e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean exists(String sessionId) {
        return Files.exists(fileFor(SessionIds.requireSafe(sessionId)));
    }

    Path fileFor(String id) {
        return directory.resolve("session_" + id + ".json");
    }

    ReentrantLock lockFor(String id) {
        return locks[Math.floorMod(id.hashCode(), locks.length)];
    }

    private void quarantine(Path file) {
        Path aside = file.resolveSibling(file.getFileName() + ".corrupt-" + System.currentTimeMillis());
        try {
            Files.move(file, aside, StandardCopyOption.REPLACE_EXISTING);
            log.error("Session file {} is unreadable; moved to {}", file, aside);
        } catch (IOException e) {
            log.error("Session file {} is unreadable and could not be moved aside", file, e);
        }
    }

    private static void deleteQuietly(Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.warn("Could not remove temp file {}", temp, e);
        }
    }
}
