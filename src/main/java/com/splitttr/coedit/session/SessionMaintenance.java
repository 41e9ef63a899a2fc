package com.splitttr.coedit.session;

import io.quarkus.scheduler.Scheduled;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.time.Duration;

/**
 * Periodic housekeeping: idle-session sweep and autosave of dirty documents.
 */
@ApplicationScoped
public class SessionMaintenance {

    private static final Logger LOG = Logger.getLogger(SessionMaintenance.class);

    @Inject
    SessionManager sessionManager;

    @ConfigProperty(name = "coedit.session.max-idle", defaultValue = "PT1H")
    Duration maxIdle;

    @Scheduled(every = "${coedit.sweep.every:5m}", concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    void sweepIdleSessions() {
        int evicted = sessionManager.cleanupIdle(maxIdle);
        if (evicted > 0) {
            LOG.infof("Idle sweep evicted %d session(s), %d still active",
                evicted, sessionManager.activeSessionCount());
        }
    }

    @Scheduled(every = "${coedit.autosave.every:30s}", concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    void autosave() {
        int persisted = sessionManager.persistDirtySessions();
        if (persisted > 0) {
            LOG.debugf("Autosaved %d session(s)", persisted);
        }
    }
}
