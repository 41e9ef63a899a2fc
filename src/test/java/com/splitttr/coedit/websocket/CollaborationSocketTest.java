package com.splitttr.coedit.websocket;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.splitttr.coedit.channel.ParticipantChannel;
import com.splitttr.coedit.message.Mutation;
import com.splitttr.coedit.message.MutationKind;
import com.splitttr.coedit.security.AuthService;
import com.splitttr.coedit.session.JoinResult;
import com.splitttr.coedit.session.MutationResult;
import com.splitttr.coedit.session.PresenceUpdate;
import com.splitttr.coedit.session.Resolution;
import com.splitttr.coedit.session.SessionManager;
import com.splitttr.coedit.session.SessionNotFoundException;
import com.splitttr.coedit.session.SessionSnapshot;
import io.quarkus.websockets.next.CloseReason;
import io.quarkus.websockets.next.WebSocketConnection;
import io.smallrye.mutiny.Uni;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * CollaborationSocket routing tests
 *
 * Covers:
 * - authentication on open and on every frame
 * - identity always taken from the token, never from the frame
 * - protocol errors answered with an error frame instead of closing
 * - implicit leave on close
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("CollaborationSocket routing")
class CollaborationSocketTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Mock
    private SessionManager sessionManager;

    @Mock
    private AuthService authService;

    @Mock
    private WebSocketConnection connection;

    @Captor
    private ArgumentCaptor<List<Mutation>> batch;

    private CollaborationSocket socket;

    @BeforeEach
    void setUp() {
        socket = new CollaborationSocket();
        socket.sessionManager = sessionManager;
        socket.authService = authService;
        socket.sendTimeout = Duration.ofSeconds(1);

        // connection state is keyed by id and shared across socket instances
        String connectionId = "conn-" + UUID.randomUUID();
        lenient().when(connection.id()).thenReturn(connectionId);
        lenient().when(connection.isOpen()).thenReturn(true);
        lenient().when(connection.sendText(anyString())).thenReturn(Uni.createFrom().voidItem());
        lenient().when(authService.currentUserId()).thenReturn(Optional.of("user1"));
        lenient().when(sessionManager.join(anyString(), anyString(), any(ParticipantChannel.class)))
            .thenAnswer(inv -> new JoinResult("doc.md", new SessionSnapshot("doc.md", "doc.md", "hello", 0,
                List.of((String) inv.getArgument(1)), List.of(), List.of())));
    }

    @Test
    @DisplayName("Open without a valid token - closed with policy violation")
    void onOpen_Unauthenticated_Closes() {
        // Given
        when(authService.currentUserId()).thenReturn(Optional.empty());

        // When
        socket.onOpen(connection);

        // Then
        ArgumentCaptor<CloseReason> reason = ArgumentCaptor.forClass(CloseReason.class);
        verify(connection).closeAndAwait(reason.capture());
        assertThat(reason.getValue().getCode()).isEqualTo(1008);
    }

    @Test
    @DisplayName("Open with a valid token - connection kept")
    void onOpen_Authenticated_Kept() {
        socket.onOpen(connection);

        verify(connection, never()).closeAndAwait(any(CloseReason.class));
    }

    @Test
    @DisplayName("Join - user id comes from the token, never from the frame")
    void join_UsesTokenSubject() {
        // When
        socket.onMessage("{\"type\":\"join\",\"documentPath\":\"doc.md\",\"userId\":\"mallory\"}", connection);

        // Then
        verify(sessionManager).join(eq("doc.md"), eq("user1"), any(ParticipantChannel.class));
        assertThat(sentTypes()).isEmpty();
    }

    @Test
    @DisplayName("Mutation before join - error frame, nothing submitted")
    void mutation_BeforeJoin_Error() {
        socket.onMessage("{\"type\":\"mutation\",\"kind\":\"insert\",\"position\":0,\"insertedText\":\"x\"}",
            connection);

        assertThat(lastError()).isEqualTo("Not joined to a document");
        verify(sessionManager, never()).submitMutation(anyString(), any());
    }

    @Test
    @DisplayName("Mutation after join - routed to the joined session as the authenticated user")
    void mutation_AfterJoin_Routed() {
        // Given
        when(sessionManager.submitMutation(eq("doc.md"), any(Mutation.class)))
            .thenAnswer(inv -> new MutationResult(true, inv.getArgument(1), null, 1));
        socket.onMessage("{\"type\":\"join\",\"documentPath\":\"doc.md\"}", connection);

        // When
        socket.onMessage("{\"type\":\"mutation\",\"kind\":\"insert\",\"position\":5,\"insertedText\":\"!\"}",
            connection);

        // Then
        ArgumentCaptor<Mutation> submitted = ArgumentCaptor.forClass(Mutation.class);
        verify(sessionManager).submitMutation(eq("doc.md"), submitted.capture());
        assertThat(submitted.getValue().userId()).isEqualTo("user1");
        assertThat(submitted.getValue().kind()).isEqualTo(MutationKind.INSERT);
        assertThat(submitted.getValue().position()).isEqualTo(5);
        assertThat(submitted.getValue().timestamp()).isNull();
    }

    @Test
    @DisplayName("Mutation without a position - error frame")
    void mutation_MissingPosition_Error() {
        socket.onMessage("{\"type\":\"join\",\"documentPath\":\"doc.md\"}", connection);

        socket.onMessage("{\"type\":\"mutation\",\"kind\":\"insert\",\"insertedText\":\"x\"}", connection);

        assertThat(lastError()).isEqualTo("Mutation requires kind and position");
        verify(sessionManager, never()).submitMutation(anyString(), any());
    }

    @Test
    @DisplayName("Token subject changes mid-connection - authentication mismatch")
    void mutation_DifferentUser_Mismatch() {
        // Given
        socket.onMessage("{\"type\":\"join\",\"documentPath\":\"doc.md\"}", connection);
        when(authService.currentUserId()).thenReturn(Optional.of("user2"));

        // When
        socket.onMessage("{\"type\":\"cursor\",\"line\":1,\"column\":1}", connection);

        // Then
        assertThat(lastError()).isEqualTo("Authentication mismatch");
        verify(sessionManager, never()).updateCursor(anyString(), anyString(), anyInt(), anyInt());
    }

    @Test
    @DisplayName("Malformed JSON and unknown type - error frames, connection stays open")
    void malformedAndUnknown_Errors() {
        socket.onMessage("{not json", connection);
        socket.onMessage("{\"type\":\"teleport\"}", connection);

        List<String> errors = sentMessages().stream().map(m -> m.path("error").asText()).toList();
        assertThat(errors).containsExactly("Malformed message", "Unknown message type: teleport");
        verify(connection, never()).closeAndAwait(any(CloseReason.class));
    }

    @Test
    @DisplayName("Session gone - SessionNotFoundException becomes an error frame")
    void sessionNotFound_Error() {
        // Given
        socket.onMessage("{\"type\":\"join\",\"documentPath\":\"doc.md\"}", connection);
        when(sessionManager.updateCursor("doc.md", "user1", 3, 4))
            .thenThrow(new SessionNotFoundException("doc.md"));

        // When
        socket.onMessage("{\"type\":\"cursor\",\"line\":3,\"column\":4}", connection);

        // Then
        assertThat(lastError()).isEqualTo("Session not found: doc.md");
    }

    @Test
    @DisplayName("Selection without an end position - error frame")
    void selection_MissingFields_Error() {
        socket.onMessage("{\"type\":\"join\",\"documentPath\":\"doc.md\"}", connection);

        socket.onMessage("{\"type\":\"selection\",\"startLine\":1,\"startColumn\":0}", connection);

        assertThat(lastError()).isEqualTo("Selection requires start and end positions");
        verify(sessionManager, never()).updateSelection(anyString(), anyString(), anyInt(), anyInt(), anyInt(), anyInt());
    }

    @Test
    @DisplayName("Selection - routed with all four coordinates")
    void selection_Routed() {
        // Given
        when(sessionManager.updateSelection("doc.md", "user1", 1, 0, 2, 5)).thenReturn(PresenceUpdate.CHANGED);
        socket.onMessage("{\"type\":\"join\",\"documentPath\":\"doc.md\"}", connection);

        // When
        socket.onMessage("{\"type\":\"selection\",\"startLine\":1,\"startColumn\":0,\"endLine\":2,\"endColumn\":5}",
            connection);

        // Then
        verify(sessionManager).updateSelection("doc.md", "user1", 1, 0, 2, 5);
        assertThat(sentTypes()).isEmpty();
    }

    @Test
    @DisplayName("Batch - every queued mutation submitted in one call")
    void batch_Routed() {
        // Given
        when(sessionManager.submitBatch(eq("doc.md"), eq("user1"), anyList()))
            .thenAnswer(inv -> new Resolution(true, "hello!!", 2, inv.getArgument(2), List.of()));
        socket.onMessage("{\"type\":\"join\",\"documentPath\":\"doc.md\"}", connection);

        // When
        socket.onMessage("{\"type\":\"batch\",\"mutations\":["
            + "{\"kind\":\"insert\",\"position\":5,\"insertedText\":\"!\",\"timestamp\":\"2026-01-01T10:00:01Z\"},"
            + "{\"kind\":\"insert\",\"position\":6,\"insertedText\":\"!\",\"timestamp\":\"2026-01-01T10:00:02Z\"}]}",
            connection);

        // Then
        verify(sessionManager).submitBatch(eq("doc.md"), eq("user1"), batch.capture());
        assertThat(batch.getValue()).hasSize(2).allMatch(m -> m.userId().equals("user1"));
    }

    @Test
    @DisplayName("Empty batch - error frame")
    void batch_Empty_Error() {
        socket.onMessage("{\"type\":\"join\",\"documentPath\":\"doc.md\"}", connection);

        socket.onMessage("{\"type\":\"batch\",\"mutations\":[]}", connection);

        assertThat(lastError()).isEqualTo("Batch requires at least one mutation");
    }

    @Test
    @DisplayName("Close - leaves the joined session, tolerating one already evicted")
    void onClose_Leaves() {
        // Given
        socket.onMessage("{\"type\":\"join\",\"documentPath\":\"doc.md\"}", connection);
        doThrow(new SessionNotFoundException("doc.md")).when(sessionManager).leave("doc.md", "user1");

        // When
        socket.onClose(connection);
        socket.onClose(connection);

        // Then
        verify(sessionManager, times(1)).leave("doc.md", "user1");
    }

    @Test
    @DisplayName("Join on a connection already in a document - leaves the previous one first")
    void join_Twice_LeavesPrevious() {
        socket.onMessage("{\"type\":\"join\",\"documentPath\":\"doc.md\"}", connection);

        socket.onMessage("{\"type\":\"join\",\"documentPath\":\"other.md\"}", connection);

        verify(sessionManager).leave("doc.md", "user1");
        verify(sessionManager).join(eq("other.md"), eq("user1"), any(ParticipantChannel.class));
    }

    private List<JsonNode> sentMessages() {
        ArgumentCaptor<String> sent = ArgumentCaptor.forClass(String.class);
        verify(connection, atLeast(0)).sendText(sent.capture());
        return sent.getAllValues().stream().map(this::parse).toList();
    }

    private List<String> sentTypes() {
        return sentMessages().stream().map(m -> m.path("type").asText()).toList();
    }

    private String lastError() {
        List<JsonNode> sent = sentMessages();
        assertThat(sent).isNotEmpty();
        JsonNode last = sent.get(sent.size() - 1);
        assertThat(last.path("type").asText()).isEqualTo("error");
        return last.path("error").asText();
    }

    private JsonNode parse(String json) {
        try {
            return mapper.readTree(json);
        } catch (Exception e) {
            throw new AssertionError("Not JSON: " + json, e);
        }
    }
}
