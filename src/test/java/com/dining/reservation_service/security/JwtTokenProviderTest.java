package com.dining.reservation_service.security;

import com.dining.reservation_service.entity.Role;
import com.dining.reservation_service.entity.User;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("JwtTokenProvider")
class JwtTokenProviderTest {

    private static final String SECRET = "test-secret-key-that-is-long-enough-for-hs256";

    private JwtTokenProvider tokenProvider;
    private User admin;

    @BeforeEach
    void setUp() {
        tokenProvider = new JwtTokenProvider(SECRET, Duration.ofHours(1));
        admin = new User("Admin", "020000000", "admin@example.com", "hash", Role.ADMIN);
        admin.setId(42L);
    }

    @Test
    @DisplayName("A generated token resolves back to the user's id and role")
    void roundTrip() {
        String token = tokenProvider.generateToken(admin);

        Optional<Caller> caller = tokenProvider.parseToken(token);

        assertThat(caller).isPresent();
        assertThat(caller.get().getId()).isEqualTo(42L);
        assertThat(caller.get().isAdmin()).isTrue();
    }

    @Test
    @DisplayName("A token signed with another secret is rejected")
    void rejectsForeignSignature() {
        JwtTokenProvider other = new JwtTokenProvider("another-secret-key-that-is-long-enough-too", Duration.ofHours(1));

        assertThat(tokenProvider.parseToken(other.generateToken(admin))).isEmpty();
    }

    @Test
    @DisplayName("An expired token is rejected")
    void rejectsExpired() {
        JwtTokenProvider shortLived = new JwtTokenProvider(SECRET, Duration.ofSeconds(-5));

        assertThat(tokenProvider.parseToken(shortLived.generateToken(admin))).isEmpty();
    }

    @Test
    @DisplayName("Garbage is rejected")
    void rejectsGarbage() {
        assertThat(tokenProvider.parseToken("not-a-token")).isEmpty();
        assertThat(tokenProvider.parseToken("")).isEmpty();
    }
}
