package org.relaychat.controller;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.relaychat.dto.AuthRequest;
import org.relaychat.dto.AuthResponse;
import org.relaychat.dto.RegisterRequest;
import org.relaychat.dto.UserDto;
import org.relaychat.model.UserAccount;
import org.relaychat.service.identity.UserService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/auth")
@RequiredArgsConstructor
public class AuthController {

    private final UserService userService;

    @PostMapping("/register")
    public ResponseEntity<AuthResponse> register(@Valid @RequestBody RegisterRequest req) {
        UserAccount u = userService.register(req.getEmail(), req.getUsername(), req.getPassword(), req.getDisplayName());
        return ResponseEntity.status(HttpStatus.CREATED).body(new AuthResponse(userService.issueToken(u), UserDto.of(u)));
    }

    @PostMapping("/login")
    public ResponseEntity<AuthResponse> login(@Valid @RequestBody AuthRequest req) {
        return ResponseEntity.ok(userService.authenticate(req.getEmail(), req.getPassword()));
    }
}
