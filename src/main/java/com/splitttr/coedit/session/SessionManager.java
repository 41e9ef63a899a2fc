package com.splitttr.coedit.session;

import com.splitttr.coedit.channel.ParticipantChannel;
import com.splitttr.coedit.client.DocumentStorage;
import com.splitttr.coedit.client.StorageUnavailableException;
import com.splitttr.coedit.message.CursorPosition;
import com.splitttr.coedit.message.Mutation;
import com.splitttr.coedit.message.ServerMessage;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-wide directory of live sessions.
 *
 * <p>The directory map is only ever touched with non-blocking operations. Loading a
 * document happens after its {@link SessionEntry} is in the map, and saving happens
 * before the entry is removed, both outside any map call, so storage I/O for one
 * document never holds up another. Whether a session may still be joined or edited is
 * decided by the session itself under its own lock (see
 * {@link DocumentSession#retireIfEmpty()}).
 */
@ApplicationScoped
public class SessionManager {

    private static final Logger LOG = Logger.getLogger(SessionManager.class);

    private final ConcurrentHashMap<String, SessionEntry> sessions = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Set<String>> userSessions = new ConcurrentHashMap<>();

    @Inject
    DocumentStorage storage;

    @ConfigProperty(name = "coedit.session.history-limit", defaultValue = "1000")
    int historyLimit;

    Clock clock = Clock.systemUTC();

    /**
     * One session per document: the session id is the trimmed document path.
     */
    public static String sessionIdFor(String documentPath) {
        if (documentPath == null || documentPath.isBlank()) {
            throw new IllegalArgumentException("Document path required");
        }
        return documentPath.trim();
    }

    /**
     * Attaches {@code userId} to the session of {@code documentPath}, opening it from
     * storage when nobody has it open yet. A storage failure fails the join and leaves
     * no session behind.
     */
    public JoinResult join(String documentPath, String userId, ParticipantChannel channel) {
        String sessionId = sessionIdFor(documentPath);
        try {
            while (true) {
                SessionEntry entry = entryFor(sessionId);
                DocumentSession session = entry.awaitOpen();
                Optional<SessionSnapshot> attached = session.attach(userId, channel);
                if (attached.isEmpty()) {
                    // retiring: wait for its final save, then open a fresh one
                    entry.awaitRemoved();
                    continue;
                }
                syncIndex(userId, sessionId);
                session.flush();
                LOG.infof("User %s joined session %s (%d participants)",
                    userId, sessionId, attached.get().participants().size());
                return new JoinResult(sessionId, attached.get());
            }
        } catch (StorageUnavailableException e) {
            LOG.warnf("Join of %s to %s failed: %s", userId, sessionId, e.getMessage());
            throw e;
        }
    }

    private SessionEntry entryFor(String sessionId) {
        SessionEntry fresh = new SessionEntry();
        SessionEntry existing = sessions.putIfAbsent(sessionId, fresh);
        if (existing != null) {
            return existing;
        }
        try {
            fresh.opened(open(sessionId));
        } catch (RuntimeException e) {
            sessions.remove(sessionId, fresh);
            fresh.failed(e);
            throw e;
        }
        return fresh;
    }

    private DocumentSession open(String sessionId) {
        String content = storage.loadContent(sessionId);
        DocumentSession session = new DocumentSession(sessionId, sessionId, content, historyLimit, clock);
        session.setDepartureListener(this::participantLost);
        LOG.infof("Opened session %s (%d chars)", sessionId, content == null ? 0 : content.length());
        return session;
    }

    /**
     * Detaches {@code userId}. The last one out retires the session and persists any
     * content not yet saved, exactly once.
     */
    public void leave(String sessionId, String userId) {
        DocumentSession session = requireSession(sessionId);
        boolean removed = session.detach(userId);
        if (session.retireIfEmpty().isPresent()) {
            evict(session, userId);
            LOG.infof("Session %s is empty, evicted", sessionId);
        } else {
            session.flush();
        }
        syncIndex(userId, sessionId);
        if (removed) {
            LOG.infof("User %s left session %s", userId, sessionId);
        }
    }

    public MutationResult submitMutation(String sessionId, Mutation mutation) {
        return requireSession(sessionId).applyMutation(mutation);
    }

    public PresenceUpdate updateCursor(String sessionId, String userId, int line, int column) {
        return requireSession(sessionId).updateCursor(userId, line, column);
    }

    public PresenceUpdate updateSelection(String sessionId, String userId, int startLine, int startColumn,
                                          int endLine, int endColumn) {
        return requireSession(sessionId).updateSelection(userId, startLine, startColumn, endLine, endColumn);
    }

    public Resolution resolveConflicts(String sessionId, List<Mutation> pending) {
        return requireSession(sessionId).resolveConflicts(pending);
    }

    /**
     * Reconciles a batch of queued edits from {@code userId} and sends it a summary of
     * what was applied and what was rejected.
     */
    public Resolution submitBatch(String sessionId, String userId, List<Mutation> pending) {
        DocumentSession session = requireSession(sessionId);
        Resolution resolution = session.resolveConflicts(pending);
        session.sendTo(userId, ServerMessage.resolution(sessionId, resolution.resolved(),
            resolution.finalContent(), resolution.version(), resolution.applied(), resolution.rejected()));
        return resolution;
    }

    public SessionSnapshot resendSnapshot(String sessionId, String userId) {
        return requireSession(sessionId).sendSnapshot(userId)
            .orElseThrow(() -> new IllegalArgumentException(userId + " is not a participant of " + sessionId));
    }

    /**
     * Evicts every session idle for longer than {@code maxIdle}, whether or not it
     * still has participants. Catches sessions whose leave was never observed.
     *
     * @return number of sessions evicted
     */
    public int cleanupIdle(Duration maxIdle) {
        Instant cutoff = clock.instant().minus(maxIdle);
        int evicted = 0;
        for (DocumentSession session : liveSessions()) {
            Optional<List<String>> stranded = session.retireIfIdleSince(cutoff);
            if (stranded.isEmpty()) {
                continue;
            }
            evicted++;
            evict(session, null);
            stranded.get().forEach(userId -> syncIndex(userId, session.getSessionId()));
            LOG.infof("Evicted idle session %s (last activity %s, %d participants)",
                session.getSessionId(), session.getLastActivityAt(), stranded.get().size());
        }
        return evicted;
    }

    /**
     * Saves every session with changes not yet persisted.
     *
     * @return number of sessions persisted
     */
    public int persistDirtySessions() {
        int persisted = 0;
        for (DocumentSession session : liveSessions()) {
            if (!session.isRetired() && persistPending(session, null)) {
                persisted++;
            }
        }
        return persisted;
    }

    /**
     * Final save and directory removal of a retired session. Only the caller that
     * retired it gets here, so the save happens once. The entry stays in the map
     * until the save is done, which keeps a new joiner from loading stale content.
     */
    private void evict(DocumentSession session, String author) {
        String sessionId = session.getSessionId();
        SessionEntry entry = sessions.get(sessionId);
        try {
            persistPending(session, author);
        } finally {
            if (entry != null && entry.holds(session)) {
                sessions.remove(sessionId, entry);
                entry.markRemoved();
            }
        }
    }

    private boolean persistPending(DocumentSession session, String userId) {
        String path = session.getDocumentPath();
        try {
            Optional<DocumentSession.PendingSave> saved = session.saveIfDirty(save ->
                storage.persistContent(path, save.content(), userId != null ? userId : save.lastEditorId()));
            saved.ifPresent(save -> LOG.debugf("Persisted %s at version %d", path, save.version()));
            return saved.isPresent();
        } catch (StorageUnavailableException e) {
            LOG.errorf(e, "Failed to persist document %s", path);
            return false;
        }
    }

    private void participantLost(DocumentSession session, ChannelDeliveryFailure failure) {
        if (session.retireIfEmpty().isPresent()) {
            evict(session, failure.userId());
            LOG.infof("Session %s lost its last participant, evicted", session.getSessionId());
        }
        syncIndex(failure.userId(), failure.sessionId());
    }

    /**
     * Brings the reverse index entry for {@code userId} in line with the user's current
     * membership of {@code sessionId}. Evaluated inside the per-user compute, so
     * concurrent joins and leaves of one user always settle on the latest membership.
     */
    private void syncIndex(String userId, String sessionId) {
        userSessions.compute(userId, (u, ids) -> {
            DocumentSession current = sessionOrNull(sessionId);
            boolean member = current != null && current.hasParticipant(userId);
            Set<String> updated = ids != null ? ids : ConcurrentHashMap.newKeySet();
            if (member) {
                updated.add(sessionId);
            } else {
                updated.remove(sessionId);
            }
            return updated.isEmpty() ? null : updated;
        });
    }

    private List<DocumentSession> liveSessions() {
        List<DocumentSession> live = new ArrayList<>();
        for (SessionEntry entry : sessions.values()) {
            DocumentSession session = entry.sessionOrNull();
            if (session != null) {
                live.add(session);
            }
        }
        return live;
    }

    private DocumentSession sessionOrNull(String sessionId) {
        SessionEntry entry = sessions.get(sessionId);
        return entry == null ? null : entry.sessionOrNull();
    }

    public Optional<DocumentSession> findSession(String sessionId) {
        return Optional.ofNullable(sessionOrNull(sessionId));
    }

    public DocumentSession requireSession(String sessionId) {
        DocumentSession session = sessionOrNull(sessionId);
        if (session == null) {
            throw new SessionNotFoundException(sessionId);
        }
        return session;
    }

    public Set<String> sessionsOf(String userId) {
        Set<String> ids = userSessions.get(userId);
        return ids == null ? Set.of() : Set.copyOf(ids);
    }

    public List<CursorPosition> cursorsOf(String sessionId) {
        return requireSession(sessionId).getCursors();
    }

    public int activeSessionCount() {
        return liveSessions().size();
    }
}
