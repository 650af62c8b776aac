package org.relaychat.service.identity;

import lombok.RequiredArgsConstructor;
import org.relaychat.dto.AuthResponse;
import org.relaychat.dto.UserDto;
import org.relaychat.events.user.UserCreated;
import org.relaychat.events.user.UserDeleted;
import org.relaychat.events.user.UserSnapshot;
import org.relaychat.events.user.UserUpdated;
import org.relaychat.exception.ConflictException;
import org.relaychat.exception.NotFoundException;
import org.relaychat.model.UserAccount;
import org.relaychat.repo.UserAccountRepository;
import org.relaychat.security.JwtUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.security.authentication.BadCredentialsException;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Comptes utilisateurs. Chaque mutation écrit son événement d'outbox dans la même transaction.
 */
@Service
@RequiredArgsConstructor
public class UserService {

    private static final Logger log = LoggerFactory.getLogger(UserService.class);

    private final UserAccountRepository userRepo;
    private final OutboxService outboxService;
    private final PasswordEncoder passwordEncoder;
    private final JwtUtil jwtUtil;

    @Transactional
    public UserAccount register(String email, String username, String password, String displayName) {
        if (userRepo.existsByEmail(email)) {
            throw new ConflictException("Email déjà utilisé");
        }
        if (userRepo.existsByUsername(username)) {
            throw new ConflictException("Pseudo déjà utilisé");
        }
        Instant now = Instant.now();
        UserAccount u = UserAccount.builder()
                .email(email)
                .username(username)
                .passwordHash(passwordEncoder.encode(password))
                .displayName(displayName != null && !displayName.isBlank() ? displayName : username)
                .createdAt(now)
                .updatedAt(now)
                .build();
        UserAccount saved = userRepo.saveAndFlush(u);

        outboxService.record(new UserCreated(newEventId(), saved.getId(), now, versionOf(saved), UserSnapshot.of(saved)));
        log.info("Utilisateur {} créé ({})", saved.getId(), saved.getUsername());
        return saved;
    }

    public AuthResponse authenticate(String email, String password) {
        UserAccount u = userRepo.findByEmail(email).orElse(null);
        if (u == null || !passwordEncoder.matches(password, u.getPasswordHash())) {
            throw new BadCredentialsException("Identifiants invalides");
        }
        return new AuthResponse(jwtUtil.generateToken(u.getId()), UserDto.of(u));
    }

    public String issueToken(UserAccount u) {
        return jwtUtil.generateToken(u.getId());
    }

    public UserAccount findById(Long id) {
        return userRepo.findById(id).orElseThrow(() -> new NotFoundException("Utilisateur introuvable"));
    }

    public List<UserAccount> search(String query, int limit) {
        if (query == null || query.trim().length() < 2) {
            throw new IllegalArgumentException("La recherche demande au moins 2 caractères");
        }
        return userRepo.search(query.trim(), PageRequest.of(0, Math.min(Math.max(limit, 1), 50)));
    }

    @Transactional
    public UserAccount updateProfile(Long userId, String displayName, String avatarUrl) {
        UserAccount u = findById(userId);
        List<String> changes = new ArrayList<>();
        if (displayName != null && !displayName.isBlank() && !displayName.equals(u.getDisplayName())) {
            u.setDisplayName(displayName);
            changes.add("displayName");
        }
        if (avatarUrl != null && !Objects.equals(avatarUrl, u.getAvatarUrl())) {
            u.setAvatarUrl(avatarUrl.isBlank() ? null : avatarUrl);
            changes.add("avatarUrl");
        }
        if (changes.isEmpty()) {
            return u;
        }
        return saveAndRecordUpdate(u, changes);
    }

    @Transactional
    public UserAccount updateOnlineStatus(Long userId, boolean online) {
        UserAccount u = findById(userId);
        u.setOnline(online);
        u.setLastSeen(Instant.now());
        return saveAndRecordUpdate(u, List.of("online", "lastSeen"));
    }

    @Transactional
    public void deleteAccount(Long userId) {
        UserAccount u = findById(userId);
        // l'événement est écrit avant la suppression de la ligne, avec une version au-dessus de la dernière
        outboxService.record(new UserDeleted(newEventId(), u.getId(), Instant.now(), versionOf(u) + 1, UserSnapshot.of(u)));
        userRepo.delete(u);
        log.info("Utilisateur {} supprimé", userId);
    }

    private UserAccount saveAndRecordUpdate(UserAccount u, List<String> changes) {
        Instant now = Instant.now();
        u.setUpdatedAt(now);
        UserAccount saved = userRepo.saveAndFlush(u);
        outboxService.record(new UserUpdated(newEventId(), saved.getId(), now, versionOf(saved), UserSnapshot.of(saved), changes));
        log.debug("Utilisateur {} mis à jour {}", saved.getId(), changes);
        return saved;
    }

    private static long versionOf(UserAccount u) {
        return u.getVersion() == null ? 0L : u.getVersion();
    }

    private static String newEventId() {
        return UUID.randomUUID().toString();
    }
}
