package com.splitttr.coedit.session;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.splitttr.coedit.channel.DeliveryResult;
import com.splitttr.coedit.channel.ParticipantChannel;
import com.splitttr.coedit.message.CursorPosition;
import com.splitttr.coedit.message.Mutation;
import com.splitttr.coedit.message.ServerMessage;
import com.splitttr.coedit.message.TextSelection;
import org.jboss.logging.Logger;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * Live collaborative state of one open document and the serialization point for
 * everything that touches it.
 *
 * <p>One lock guards content, history, participants and lifecycle state together, so
 * at most one mutation is applied at a time per session. Notifications are queued on
 * the recipients' outboxes while the lock is held, which keeps per-recipient order
 * equal to acceptance order. The actual sends happen in {@link #flush()}, after the
 * lock is released.
 *
 * <p>A session leaves the directory by being retired. Retirement happens once, under the
 * lock, and from then on every document or presence operation fails with
 * {@link SessionNotFoundException}, so nothing can be accepted after the final save.
 */
public class DocumentSession {

    private static final Logger LOG = Logger.getLogger(DocumentSession.class);

    private static final ObjectMapper mapper = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private final ReentrantLock lock = new ReentrantLock();
    private final ReentrantLock saveLock = new ReentrantLock();
    private final String sessionId;
    private final String documentPath;
    private final Clock clock;
    private final Instant createdAt;
    private final DocumentState document;
    private final ParticipantRegistry participants = new ParticipantRegistry();

    private volatile DepartureListener departureListener = DepartureListener.NONE;
    private volatile Instant lastActivityAt;
    private SessionState state = SessionState.CREATED;
    private boolean retired;
    private long persistedVersion;
    private String lastEditorId;

    public record PendingSave(String content, long version, String lastEditorId) {}

    public DocumentSession(String sessionId, String documentPath, String initialContent, int historyLimit,
                           Clock clock) {
        this.sessionId = sessionId;
        this.documentPath = documentPath;
        this.clock = clock;
        this.document = new DocumentState(initialContent, historyLimit);
        this.createdAt = clock.instant();
        this.lastActivityAt = createdAt;
    }

    public void setDepartureListener(DepartureListener listener) {
        this.departureListener = listener == null ? DepartureListener.NONE : listener;
    }

    // --- membership ---

    /**
     * Registers {@code userId} and queues its snapshot plus a join notice for everyone
     * else. Nothing is sent until {@link #flush()}.
     *
     * @return the snapshot handed to the joiner, or empty when this session already
     *         reached {@link SessionState#EMPTY} and must be replaced
     */
    public Optional<SessionSnapshot> attach(String userId, ParticipantChannel channel) {
        lock.lock();
        try {
            if (state == SessionState.EMPTY) {
                return Optional.empty();
            }
            Instant now = touch();
            Participant replaced = participants.add(userId, channel, now);
            if (replaced != null) {
                LOG.debugf("User %s re-attached to session %s on channel %s", userId, sessionId, channel.id());
            }
            state = SessionState.ACTIVE;

            SessionSnapshot snapshot = snapshotLocked();
            enqueueTo(userId, snapshot.toMessage());
            enqueueToAllExcept(ServerMessage.participantJoined(sessionId, userId, participants.userIds(), now), userId);
            return Optional.of(snapshot);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes {@code userId} and queues a leave notice for the rest. The session turns
     * EMPTY when the last participant goes.
     *
     * @return false when the user was not a participant
     */
    public boolean detach(String userId) {
        lock.lock();
        try {
            if (participants.remove(userId) == null) {
                return false;
            }
            Instant now = touch();
            enqueueToAllExcept(ServerMessage.participantLeft(sessionId, userId, now), null);
            if (participants.isEmpty()) {
                state = SessionState.EMPTY;
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Queues a fresh snapshot for {@code userId}, e.g. after one of its mutations was
     * rejected. Taken under the lock so nothing accepted later can overtake it.
     */
    public Optional<SessionSnapshot> sendSnapshot(String userId) {
        SessionSnapshot snapshot;
        lock.lock();
        try {
            ensureNotRetired();
            if (!participants.contains(userId)) {
                return Optional.empty();
            }
            snapshot = snapshotLocked();
            enqueueTo(userId, snapshot.toMessage());
        } finally {
            lock.unlock();
        }
        flush();
        return Optional.of(snapshot);
    }

    // --- document ---

    /**
     * Checks the mutation against the live content and applies it when the expected
     * text is still in place. An applied mutation is broadcast to everyone but its
     * author; a rejected one goes back to the author only. Rejections are never
     * retried or rebased.
     */
    public MutationResult applyMutation(Mutation mutation) {
        Mutation bound = mutation.bind(sessionId, clock.instant());
        MutationResult result;
        lock.lock();
        try {
            ensureNotRetired();
            result = acceptLocked(bound);
            if (result.applied()) {
                enqueueToAllExcept(ServerMessage.mutation(sessionId, bound, result.version()), bound.userId());
            } else {
                enqueueTo(bound.userId(), ServerMessage.rejected(sessionId, bound, result.reason()));
            }
        } finally {
            lock.unlock();
        }
        if (!result.applied()) {
            LOG.debugf("Rejected %s from %s in %s: %s", bound.kind(), bound.userId(), sessionId, result.reason());
        }
        flush();
        return result;
    }

    /**
     * Reconciles a batch of pending mutations, e.g. edits queued while a client was
     * offline. Mutations are applied in ascending timestamp order (arrival order on
     * ties) and each one is checked against the content as already updated by the
     * ones before it. Whatever fails its check is rejected, not merged.
     */
    public Resolution resolveConflicts(List<Mutation> pending) {
        Instant receivedAt = clock.instant();
        List<Mutation> ordered = new ArrayList<>(pending.size());
        for (Mutation m : pending) {
            ordered.add(m.bind(sessionId, receivedAt));
        }
        ordered.sort(Comparator.comparing(Mutation::timestamp));

        List<Mutation> applied = new ArrayList<>();
        List<Mutation> rejected = new ArrayList<>();
        Resolution resolution;
        lock.lock();
        try {
            ensureNotRetired();
            for (Mutation m : ordered) {
                MutationResult result = acceptLocked(m);
                if (result.applied()) {
                    applied.add(m);
                    enqueueToAllExcept(ServerMessage.mutation(sessionId, m, result.version()), m.userId());
                } else {
                    rejected.add(m);
                    enqueueTo(m.userId(), ServerMessage.rejected(sessionId, m, result.reason()));
                }
            }
            touch();
            resolution = new Resolution(rejected.isEmpty(), document.content(), document.version(),
                List.copyOf(applied), List.copyOf(rejected));
        } finally {
            lock.unlock();
        }
        LOG.debugf("Resolved %d pending mutations in %s: %d applied, %d rejected",
            ordered.size(), sessionId, applied.size(), rejected.size());
        flush();
        return resolution;
    }

    private MutationResult acceptLocked(Mutation mutation) {
        if (!participants.contains(mutation.userId())) {
            return MutationResult.rejected(mutation,
                "User " + mutation.userId() + " is not a participant of " + sessionId, document.version());
        }
        return applyLocked(mutation);
    }

    private MutationResult applyLocked(Mutation mutation) {
        String reason = document.checkPrecondition(mutation);
        if (reason != null) {
            return MutationResult.rejected(mutation, reason, document.version());
        }
        document.apply(mutation);
        lastEditorId = mutation.userId();
        touch();
        return MutationResult.applied(mutation, document.version());
    }

    // --- presence ---

    public PresenceUpdate updateCursor(String userId, int line, int column) {
        PresenceUpdate update;
        lock.lock();
        try {
            ensureNotRetired();
            Instant now = clock.instant();
            update = participants.updateCursor(userId, line, column, now);
            if (update != PresenceUpdate.UNKNOWN_PARTICIPANT) {
                touch();
            }
            if (update == PresenceUpdate.CHANGED) {
                enqueueToAllExcept(ServerMessage.cursor(sessionId, participants.get(userId).cursor()), userId);
            }
        } finally {
            lock.unlock();
        }
        if (update == PresenceUpdate.CHANGED) {
            flush();
        }
        return update;
    }

    public PresenceUpdate updateSelection(String userId, int startLine, int startColumn, int endLine,
                                          int endColumn) {
        PresenceUpdate update;
        lock.lock();
        try {
            ensureNotRetired();
            Instant now = clock.instant();
            update = participants.updateSelection(userId, startLine, startColumn, endLine, endColumn, now);
            if (update != PresenceUpdate.UNKNOWN_PARTICIPANT) {
                touch();
            }
            if (update == PresenceUpdate.CHANGED) {
                enqueueToAllExcept(ServerMessage.selection(sessionId, participants.get(userId).selection()), userId);
            }
        } finally {
            lock.unlock();
        }
        if (update == PresenceUpdate.CHANGED) {
            flush();
        }
        return update;
    }

    // --- delivery ---

    /**
     * Delivers {@code message} to every participant except {@code excludeUserId}.
     * Best effort per channel: a failed send drops that participant and never stops
     * delivery to the others.
     */
    public BroadcastReport broadcast(ServerMessage message, String excludeUserId) {
        lock.lock();
        try {
            enqueueToAllExcept(message, excludeUserId);
        } finally {
            lock.unlock();
        }
        return flush();
    }

    public BroadcastReport sendTo(String userId, ServerMessage message) {
        lock.lock();
        try {
            enqueueTo(userId, message);
        } finally {
            lock.unlock();
        }
        return flush();
    }

    /**
     * Drains every participant's outbox. Must be called without the session lock and
     * outside any directory update, since dropping a dead participant notifies the
     * {@link DepartureListener}.
     */
    public BroadcastReport flush() {
        List<Participant> targets = currentParticipants();
        List<ChannelDeliveryFailure> lost = new ArrayList<>();
        int recipients = -1;

        while (!targets.isEmpty()) {
            List<Participant> failed = new ArrayList<>();
            List<DeliveryResult> results = new ArrayList<>();
            for (Participant p : targets) {
                DeliveryResult result = p.outbox().drain();
                if (!result.delivered()) {
                    failed.add(p);
                    results.add(result);
                }
            }
            if (recipients < 0) {
                recipients = targets.size() - failed.size();
            }
            if (failed.isEmpty()) {
                break;
            }
            // the leave notices queued for the survivors need another round
            targets = dropFailed(failed, results, lost);
        }

        for (ChannelDeliveryFailure failure : lost) {
            departureListener.participantLost(this, failure);
        }
        return lost.isEmpty() && recipients <= 0
            ? BroadcastReport.NONE
            : new BroadcastReport(Math.max(recipients, 0), List.copyOf(lost));
    }

    private List<Participant> dropFailed(List<Participant> failed, List<DeliveryResult> results,
                                         List<ChannelDeliveryFailure> lost) {
        lock.lock();
        try {
            boolean removedAny = false;
            for (int i = 0; i < failed.size(); i++) {
                Participant p = failed.get(i);
                if (!participants.removeIfChannel(p.userId(), p.channel())) {
                    continue;
                }
                removedAny = true;
                String reason = results.get(i).describe();
                LOG.warnf("Delivery to %s in session %s failed, dropping participant: %s",
                    p.userId(), sessionId, reason);
                lost.add(new ChannelDeliveryFailure(sessionId, p.userId(), p.channel().id(), reason));
                enqueueToAllExcept(ServerMessage.participantLeft(sessionId, p.userId(), touch()), null);
            }
            if (participants.isEmpty() && state == SessionState.ACTIVE) {
                state = SessionState.EMPTY;
            }
            return removedAny ? participants.all() : List.of();
        } finally {
            lock.unlock();
        }
    }

    private void enqueueTo(String userId, ServerMessage message) {
        Participant p = participants.get(userId);
        if (p != null) {
            p.outbox().offer(toJson(message));
        }
    }

    private void enqueueToAllExcept(ServerMessage message, String excludeUserId) {
        List<Participant> targets = participants.allExcept(excludeUserId);
        if (targets.isEmpty()) return;
        String json = toJson(message);
        for (Participant p : targets) {
            p.outbox().offer(json);
        }
    }

    private List<Participant> currentParticipants() {
        lock.lock();
        try {
            return participants.all();
        } finally {
            lock.unlock();
        }
    }

    // --- retirement ---

    /**
     * Retires the session once its last participant is gone (state EMPTY). A freshly
     * opened session nobody attached to yet is left alone. Only one caller ever gets a
     * non-empty result; that caller owns the final save and the directory removal.
     *
     * @return the participants that were still attached (none here), or empty when
     *         this call did not retire the session
     */
    public Optional<List<String>> retireIfEmpty() {
        lock.lock();
        try {
            if (retired || state != SessionState.EMPTY) {
                return Optional.empty();
            }
            return Optional.of(retireLocked());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Retires the session when its last activity is older than {@code cutoff}, with
     * participants or not. Checked and retired under the lock, so an operation that
     * touches the session first keeps it alive.
     *
     * @return the participants stranded by the retirement, or empty when not retired
     */
    public Optional<List<String>> retireIfIdleSince(Instant cutoff) {
        lock.lock();
        try {
            if (retired || !lastActivityAt.isBefore(cutoff)) {
                return Optional.empty();
            }
            return Optional.of(retireLocked());
        } finally {
            lock.unlock();
        }
    }

    private List<String> retireLocked() {
        List<String> stranded = participants.userIds();
        participants.clear();
        retired = true;
        state = SessionState.EMPTY;
        LOG.debugf("Session %s retired at version %d", sessionId, document.version());
        return stranded;
    }

    public boolean isRetired() {
        lock.lock();
        try {
            return retired;
        } finally {
            lock.unlock();
        }
    }

    private void ensureNotRetired() {
        if (retired) {
            throw new SessionNotFoundException(sessionId);
        }
    }

    // --- state ---

    public SessionSnapshot snapshot() {
        lock.lock();
        try {
            return snapshotLocked();
        } finally {
            lock.unlock();
        }
    }

    private SessionSnapshot snapshotLocked() {
        return new SessionSnapshot(sessionId, documentPath, document.content(), document.version(),
            participants.userIds(), participants.cursors(), participants.selections());
    }

    /**
     * @return what to persist, or empty when nothing changed since the last persist
     */
    public Optional<PendingSave> pendingSave() {
        lock.lock();
        try {
            if (document.version() == persistedVersion) {
                return Optional.empty();
            }
            return Optional.of(new PendingSave(document.content(), document.version(), lastEditorId));
        } finally {
            lock.unlock();
        }
    }

    public void markPersisted(long version) {
        lock.lock();
        try {
            persistedVersion = Math.max(persistedVersion, version);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Hands the unsaved content to {@code writer} and marks it persisted once the
     * writer returns. Saves of one session never overlap, so a version is written at
     * most once. Runs without the session lock; edits keep flowing during the write.
     *
     * @return what was saved, or empty when there was nothing to save
     */
    public Optional<PendingSave> saveIfDirty(Consumer<PendingSave> writer) {
        saveLock.lock();
        try {
            Optional<PendingSave> pending = pendingSave();
            if (pending.isPresent()) {
                writer.accept(pending.get());
                markPersisted(pending.get().version());
            }
            return pending;
        } finally {
            saveLock.unlock();
        }
    }

    public boolean hasUnpersistedChanges() {
        return pendingSave().isPresent();
    }

    private Instant touch() {
        Instant now = clock.instant();
        if (now.isAfter(lastActivityAt)) {
            lastActivityAt = now;
        }
        return lastActivityAt;
    }

    public String getSessionId() {
        return sessionId;
    }

    public String getDocumentPath() {
        return documentPath;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getLastActivityAt() {
        return lastActivityAt;
    }

    public SessionState getState() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }

    public boolean isEmpty() {
        lock.lock();
        try {
            return participants.isEmpty();
        } finally {
            lock.unlock();
        }
    }

    public boolean hasParticipant(String userId) {
        lock.lock();
        try {
            return participants.contains(userId);
        } finally {
            lock.unlock();
        }
    }

    public List<String> getParticipantIds() {
        lock.lock();
        try {
            return participants.userIds();
        } finally {
            lock.unlock();
        }
    }

    public List<CursorPosition> getCursors() {
        lock.lock();
        try {
            return participants.cursors();
        } finally {
            lock.unlock();
        }
    }

    public List<TextSelection> getSelections() {
        lock.lock();
        try {
            return participants.selections();
        } finally {
            lock.unlock();
        }
    }

    public String getContent() {
        lock.lock();
        try {
            return document.content();
        } finally {
            lock.unlock();
        }
    }

    public long getVersion() {
        lock.lock();
        try {
            return document.version();
        } finally {
            lock.unlock();
        }
    }

    public List<Mutation> getHistory() {
        lock.lock();
        try {
            return document.history();
        } finally {
            lock.unlock();
        }
    }

    String getBaseContent() {
        lock.lock();
        try {
            return document.baseContent();
        } finally {
            lock.unlock();
        }
    }

    private String toJson(ServerMessage message) {
        try {
            return mapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode " + message.type() + " message", e);
        }
    }
}
