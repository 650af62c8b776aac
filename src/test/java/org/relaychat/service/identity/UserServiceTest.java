package org.relaychat.service.identity;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.relaychat.dto.AuthResponse;
import org.relaychat.events.user.UserEvent;
import org.relaychat.exception.ConflictException;
import org.relaychat.model.UserAccount;
import org.relaychat.repo.UserAccountRepository;
import org.relaychat.security.JwtUtil;
import org.springframework.security.authentication.BadCredentialsException;
import org.springframework.security.crypto.password.PasswordEncoder;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class UserServiceTest {

    @Mock
    private UserAccountRepository userRepo;

    @Mock
    private OutboxService outboxService;

    @Mock
    private PasswordEncoder passwordEncoder;

    @Mock
    private JwtUtil jwtUtil;

    @InjectMocks
    private UserService userService;

    private UserAccount buildUser() {
        return UserAccount.builder().id(1L).email("user@example.com").username("user")
                .displayName("User").passwordHash("hashed").version(0L).build();
    }

    @Test
    void register_duplicateEmail_shouldFailWithoutEvent() {
        when(userRepo.existsByEmail("user@example.com")).thenReturn(true);

        assertThatThrownBy(() -> userService.register("user@example.com", "user", "secret1", null))
                .isInstanceOf(ConflictException.class);
        verifyNoInteractions(outboxService);
        verify(userRepo, never()).saveAndFlush(any());
    }

    @Test
    void register_withoutDisplayName_shouldUseUsername() {
        when(passwordEncoder.encode("secret1")).thenReturn("hashed");
        when(userRepo.saveAndFlush(any(UserAccount.class))).thenAnswer(inv -> {
            UserAccount u = inv.getArgument(0);
            u.setId(1L);
            return u;
        });

        UserAccount u = userService.register("user@example.com", "user", "secret1", " ");

        assertThat(u.getDisplayName()).isEqualTo("user");
        verify(outboxService).record(argThat((UserEvent e) -> e.userId().equals(1L) && e.version() == 0L));
    }

    @Test
    void authenticate_wrongPassword_shouldFail() {
        UserAccount u = buildUser();
        when(userRepo.findByEmail("user@example.com")).thenReturn(Optional.of(u));
        when(passwordEncoder.matches("wrong", "hashed")).thenReturn(false);

        assertThatThrownBy(() -> userService.authenticate("user@example.com", "wrong"))
                .isInstanceOf(BadCredentialsException.class);
        verifyNoInteractions(jwtUtil);
    }

    @Test
    void authenticate_shouldReturnTokenAndUser() {
        UserAccount u = buildUser();
        when(userRepo.findByEmail("user@example.com")).thenReturn(Optional.of(u));
        when(passwordEncoder.matches("secret1", "hashed")).thenReturn(true);
        when(jwtUtil.generateToken(1L)).thenReturn("jwt-token");

        AuthResponse response = userService.authenticate("user@example.com", "secret1");

        assertThat(response.getToken()).isEqualTo("jwt-token");
        assertThat(response.getUser().getEmail()).isEqualTo("user@example.com");
    }

    @Test
    void search_tooShort_shouldBeRejected() {
        assertThatThrownBy(() -> userService.search("a", 10)).isInstanceOf(IllegalArgumentException.class);
    }
}
