package com.splitttr.coedit.security;

import org.eclipse.microprofile.jwt.JsonWebToken;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("AuthService")
class AuthServiceTest {

    @Mock
    private JsonWebToken jwt;

    private AuthService authService;

    @BeforeEach
    void setUp() {
        authService = new AuthService();
        authService.jwt = jwt;
    }

    @Test
    @DisplayName("Subject present - user id is the subject")
    void subjectPresent() {
        when(jwt.getSubject()).thenReturn("user_2abc");

        assertThat(authService.currentUserId()).contains("user_2abc");
        assertThat(authService.isAuthenticated()).isTrue();
    }

    @Test
    @DisplayName("Blank subject - not authenticated")
    void blankSubject() {
        when(jwt.getSubject()).thenReturn("  ");

        assertThat(authService.currentUserId()).isEmpty();
    }

    @Test
    @DisplayName("No token in context - not authenticated, no exception")
    void noTokenInContext() {
        when(jwt.getSubject()).thenThrow(new IllegalStateException("No active request context"));

        assertThat(authService.isAuthenticated()).isFalse();
    }
}
