package com.splitttr.coedit.security;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.jwt.JsonWebToken;
import org.jboss.logging.Logger;

import java.util.Optional;

/**
 * Maps the bearer token of the upgrade request to a user id. The 'sub' claim holds
 * the Clerk user id. Access to individual documents is decided upstream; this
 * service only answers "who is this".
 */
@ApplicationScoped
public class AuthService {

    private static final Logger LOG = Logger.getLogger(AuthService.class);

    @Inject
    JsonWebToken jwt;

    public Optional<String> currentUserId() {
        try {
            String subject = jwt.getSubject();
            return subject == null || subject.isBlank() ? Optional.empty() : Optional.of(subject);
        } catch (RuntimeException e) {
            // no token bound to the current request context
            LOG.debugf("No JWT subject available: %s", e.getMessage());
            return Optional.empty();
        }
    }

    public boolean isAuthenticated() {
        return currentUserId().isPresent();
    }
}
