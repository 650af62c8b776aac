package org.relaychat.controller;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.relaychat.dto.AuthRequest;
import org.relaychat.dto.AuthResponse;
import org.relaychat.dto.RegisterRequest;
import org.relaychat.dto.UserDto;
import org.relaychat.model.UserAccount;
import org.relaychat.service.identity.UserService;
import org.springframework.http.ResponseEntity;
import org.springframework.security.authentication.BadCredentialsException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AuthControllerTest {

    @Mock
    private UserService userService;

    @InjectMocks
    private AuthController authController;

    private UserAccount buildUser() {
        return UserAccount.builder()
                .id(1L)
                .email("user@example.com")
                .username("user")
                .displayName("User")
                .passwordHash("hashed")
                .build();
    }

    @Test
    void register_shouldReturn201WithToken() {
        UserAccount u = buildUser();
        when(userService.register("user@example.com", "user", "secret1", "User")).thenReturn(u);
        when(userService.issueToken(u)).thenReturn("jwt-token");

        ResponseEntity<AuthResponse> response = authController.register(
                new RegisterRequest("user@example.com", "user", "secret1", "User"));

        assertThat(response.getStatusCode().value()).isEqualTo(201);
        assertThat(response.getBody().getToken()).isEqualTo("jwt-token");
        assertThat(response.getBody().getUser().getUsername()).isEqualTo("user");
    }

    @Test
    void login_shouldReturnAuthResponse_whenCredentialsAreValid() {
        AuthResponse expected = new AuthResponse("jwt-token", UserDto.of(buildUser()));
        when(userService.authenticate("user@example.com", "secret1")).thenReturn(expected);

        ResponseEntity<AuthResponse> response = authController.login(new AuthRequest("user@example.com", "secret1"));

        assertThat(response.getStatusCode().is2xxSuccessful()).isTrue();
        assertThat(response.getBody()).isSameAs(expected);
    }

    @Test
    void login_shouldPropagateBadCredentials() {
        when(userService.authenticate("user@example.com", "wrong"))
                .thenThrow(new BadCredentialsException("Identifiants invalides"));

        assertThatThrownBy(() -> authController.login(new AuthRequest("user@example.com", "wrong")))
                .isInstanceOf(BadCredentialsException.class);
        verify(userService, never()).issueToken(any());
    }
}
