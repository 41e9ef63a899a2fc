package com.splitttr.coedit.websocket;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.splitttr.coedit.channel.DeliveryResult;
import com.splitttr.coedit.channel.WebSocketChannel;
import com.splitttr.coedit.client.StorageUnavailableException;
import com.splitttr.coedit.message.ClientMessage;
import com.splitttr.coedit.message.Mutation;
import com.splitttr.coedit.message.ServerMessage;
import com.splitttr.coedit.security.AuthService;
import com.splitttr.coedit.session.JoinResult;
import com.splitttr.coedit.session.MutationResult;
import com.splitttr.coedit.session.PresenceUpdate;
import com.splitttr.coedit.session.Resolution;
import com.splitttr.coedit.session.SessionManager;
import com.splitttr.coedit.session.SessionNotFoundException;
import io.quarkus.websockets.next.CloseReason;
import io.quarkus.websockets.next.OnClose;
import io.quarkus.websockets.next.OnError;
import io.quarkus.websockets.next.OnOpen;
import io.quarkus.websockets.next.OnTextMessage;
import io.quarkus.websockets.next.WebSocket;
import io.quarkus.websockets.next.WebSocketConnection;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * WebSocket endpoint for real-time collaborative editing.
 * Requires JWT authentication - user identity extracted from token, never from the
 * message body. One connection edits one document at a time.
 */
@WebSocket(path = "/ws/coedit")
public class CollaborationSocket {

    private static final Logger LOG = Logger.getLogger(CollaborationSocket.class);

    private static final int POLICY_VIOLATION = 1008;

    private static final ObjectMapper mapper = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    @Inject
    SessionManager sessionManager;

    @Inject
    AuthService authService;

    @ConfigProperty(name = "coedit.channel.send-timeout", defaultValue = "PT5S")
    Duration sendTimeout;

    // Store connection state externally since the socket instance may not persist
    private static final Map<String, ConnectionState> connectionStates = new ConcurrentHashMap<>();

    record ConnectionState(String userId, String sessionId, WebSocketChannel channel) {}

    @OnOpen
    public void onOpen(WebSocketConnection connection) {
        Optional<String> userId = authService.currentUserId();
        if (userId.isEmpty()) {
            LOG.warnf("Unauthenticated WebSocket connection attempt: %s", connection.id());
            connection.closeAndAwait(new CloseReason(POLICY_VIOLATION, "Authentication required"));
            return;
        }
        LOG.infof("Authenticated WebSocket opened: %s (user: %s)", connection.id(), userId.get());
    }

    @OnTextMessage
    public void onMessage(String messageJson, WebSocketConnection connection) {
        // token could expire mid-session
        Optional<String> authenticated = authService.currentUserId();
        if (authenticated.isEmpty()) {
            LOG.warnf("Authentication expired for connection: %s", connection.id());
            connection.closeAndAwait(new CloseReason(POLICY_VIOLATION, "Authentication expired"));
            return;
        }
        String userId = authenticated.get();

        ClientMessage msg;
        try {
            msg = mapper.readValue(messageJson, ClientMessage.class);
        } catch (JsonProcessingException e) {
            LOG.debugf("Malformed message on %s: %s", connection.id(), e.getOriginalMessage());
            sendError(connection, "Malformed message");
            return;
        }
        if (msg.type() == null) {
            sendError(connection, "Message type required");
            return;
        }
        LOG.debugf("Received %s from %s on %s", msg.type(), userId, connection.id());

        try {
            switch (msg.type()) {
                case "join" -> handleJoin(msg, connection, userId);
                case "leave" -> handleLeave(connection);
                case "mutation" -> handleMutation(msg, connection, userId);
                case "cursor" -> handleCursor(msg, connection, userId);
                case "selection" -> handleSelection(msg, connection, userId);
                case "batch" -> handleBatch(msg, connection, userId);
                case "snapshot" -> handleSnapshot(connection, userId);
                default -> sendError(connection, "Unknown message type: " + msg.type());
            }
        } catch (SessionNotFoundException | StorageUnavailableException | IllegalArgumentException e) {
            LOG.debugf("Request %s from %s failed: %s", msg.type(), userId, e.getMessage());
            sendError(connection, e.getMessage());
        }
    }

    private void handleJoin(ClientMessage msg, WebSocketConnection connection, String userId) {
        if (connectionStates.containsKey(connection.id())) {
            handleLeave(connection);
        }
        WebSocketChannel channel = new WebSocketChannel(connection, sendTimeout);
        JoinResult joined = sessionManager.join(msg.documentPath(), userId, channel);
        connectionStates.put(connection.id(), new ConnectionState(userId, joined.sessionId(), channel));
    }

    private void handleMutation(ClientMessage msg, WebSocketConnection connection, String userId) {
        ConnectionState state = joinedState(connection, userId);
        if (state == null) return;

        Mutation mutation = msg.toMutation(userId, state.sessionId());
        MutationResult result = sessionManager.submitMutation(state.sessionId(), mutation);
        if (result.applied()) {
            LOG.debugf("Applied %s at %d in %s (version %d)",
                mutation.kind(), mutation.position(), state.sessionId(), result.version());
        }
    }

    private void handleCursor(ClientMessage msg, WebSocketConnection connection, String userId) {
        ConnectionState state = joinedState(connection, userId);
        if (state == null) return;
        if (!msg.hasCursor()) {
            sendError(connection, "Cursor requires line and column");
            return;
        }
        PresenceUpdate update = sessionManager.updateCursor(state.sessionId(), userId, msg.line(), msg.column());
        if (update == PresenceUpdate.UNKNOWN_PARTICIPANT) {
            sendError(connection, "Not a participant of " + state.sessionId());
        }
    }

    private void handleSelection(ClientMessage msg, WebSocketConnection connection, String userId) {
        ConnectionState state = joinedState(connection, userId);
        if (state == null) return;
        if (!msg.hasSelection()) {
            sendError(connection, "Selection requires start and end positions");
            return;
        }
        PresenceUpdate update = sessionManager.updateSelection(state.sessionId(), userId,
            msg.startLine(), msg.startColumn(), msg.endLine(), msg.endColumn());
        if (update == PresenceUpdate.UNKNOWN_PARTICIPANT) {
            sendError(connection, "Not a participant of " + state.sessionId());
        }
    }

    private void handleBatch(ClientMessage msg, WebSocketConnection connection, String userId) {
        ConnectionState state = joinedState(connection, userId);
        if (state == null) return;

        List<Mutation> pending = msg.toMutations(userId, state.sessionId());
        Resolution resolution = sessionManager.submitBatch(state.sessionId(), userId, pending);
        LOG.debugf("Batch of %d from %s in %s: %d rejected",
            pending.size(), userId, state.sessionId(), resolution.rejected().size());
    }

    private void handleSnapshot(WebSocketConnection connection, String userId) {
        ConnectionState state = joinedState(connection, userId);
        if (state == null) return;
        sessionManager.resendSnapshot(state.sessionId(), userId);
    }

    private void handleLeave(WebSocketConnection connection) {
        ConnectionState state = connectionStates.remove(connection.id());
        if (state == null) return;
        try {
            sessionManager.leave(state.sessionId(), state.userId());
        } catch (SessionNotFoundException e) {
            // already evicted by the idle sweep or by a failed send
            LOG.debugf("Session %s was gone when %s left", state.sessionId(), state.userId());
        }
    }

    private ConnectionState joinedState(WebSocketConnection connection, String authenticatedUserId) {
        ConnectionState state = connectionStates.get(connection.id());
        if (state == null) {
            sendError(connection, "Not joined to a document");
            return null;
        }
        if (!state.userId().equals(authenticatedUserId)) {
            LOG.warnf("User ID mismatch: state=%s, auth=%s", state.userId(), authenticatedUserId);
            sendError(connection, "Authentication mismatch");
            return null;
        }
        return state;
    }

    @OnClose
    public void onClose(WebSocketConnection connection) {
        LOG.infof("WebSocket closed: %s", connection.id());
        handleLeave(connection);
    }

    @OnError
    public void onError(WebSocketConnection connection, Throwable t) {
        LOG.warnf(t, "WebSocket error on %s", connection.id());
        handleLeave(connection);
    }

    private void sendError(WebSocketConnection connection, String message) {
        String json;
        try {
            json = mapper.writeValueAsString(ServerMessage.error(message));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode error message", e);
        }
        DeliveryResult result = new WebSocketChannel(connection, sendTimeout).send(json);
        if (!result.delivered()) {
            LOG.debugf("Could not deliver error to %s: %s", connection.id(), result.describe());
        }
    }
}
