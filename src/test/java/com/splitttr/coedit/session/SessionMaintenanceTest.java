package com.splitttr.coedit.session;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;

import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("SessionMaintenance scheduled jobs")
class SessionMaintenanceTest {

    @Mock
    private SessionManager sessionManager;

    private SessionMaintenance maintenance;

    @BeforeEach
    void setUp() {
        maintenance = new SessionMaintenance();
        maintenance.sessionManager = sessionManager;
        maintenance.maxIdle = Duration.ofMinutes(30);
    }

    @Test
    @DisplayName("Sweep - evicts with the configured idle threshold")
    void sweep_UsesConfiguredThreshold() {
        when(sessionManager.cleanupIdle(Duration.ofMinutes(30))).thenReturn(2);

        maintenance.sweepIdleSessions();

        verify(sessionManager).cleanupIdle(Duration.ofMinutes(30));
        verify(sessionManager).activeSessionCount();
    }

    @Test
    @DisplayName("Sweep - nothing evicted, nothing else queried")
    void sweep_NothingEvicted() {
        when(sessionManager.cleanupIdle(any(Duration.class))).thenReturn(0);

        maintenance.sweepIdleSessions();

        verify(sessionManager, never()).activeSessionCount();
    }

    @Test
    @DisplayName("Autosave - persists dirty sessions")
    void autosave_PersistsDirty() {
        maintenance.autosave();

        verify(sessionManager).persistDirtySessions();
    }
}
