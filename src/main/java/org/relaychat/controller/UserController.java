package org.relaychat.controller;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.relaychat.dto.UpdateProfileRequest;
import org.relaychat.dto.UserDto;
import org.relaychat.service.identity.UserService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.security.Principal;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/users")
@RequiredArgsConstructor
public class UserController {

    private final UserService userService;

    @GetMapping("/me")
    public UserDto me(Principal principal) {
        return UserDto.of(userService.findById(Principals.userId(principal)));
    }

    @PutMapping("/me")
    public UserDto updateMe(@Valid @RequestBody UpdateProfileRequest req, Principal principal) {
        return UserDto.of(userService.updateProfile(Principals.userId(principal), req.getDisplayName(), req.getAvatarUrl()));
    }

    @PutMapping("/me/status")
    public ResponseEntity<?> updateStatus(@RequestBody Map<String, Boolean> body, Principal principal) {
        Boolean online = body.get("online");
        if (online == null) {
            return ResponseEntity.badRequest().body(Map.of("error", "Champ 'online' requis"));
        }
        return ResponseEntity.ok(UserDto.of(userService.updateOnlineStatus(Principals.userId(principal), online)));
    }

    @DeleteMapping("/me")
    public ResponseEntity<Void> deleteMe(Principal principal) {
        userService.deleteAccount(Principals.userId(principal));
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/search")
    public List<UserDto> search(@RequestParam("q") String query,
                                @RequestParam(value = "limit", defaultValue = "20") int limit) {
        return userService.search(query, limit).stream().map(UserDto::of).toList();
    }

    @GetMapping("/{id}")
    public UserDto byId(@PathVariable Long id) {
        return UserDto.of(userService.findById(id));
    }
}
