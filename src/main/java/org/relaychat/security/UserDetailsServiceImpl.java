package org.relaychat.security;

import lombok.RequiredArgsConstructor;
import org.relaychat.model.UserAccount;
import org.relaychat.repo.UserAccountRepository;
import org.springframework.security.core.userdetails.User;
import org.springframework.security.core.userdetails.UserDetails;
import org.springframework.security.core.userdetails.UserDetailsService;
import org.springframework.security.core.userdetails.UsernameNotFoundException;
import org.springframework.stereotype.Service;

/**
 * Le "username" Spring Security est l'identifiant numérique de l'utilisateur,
 * de sorte que {@code Principal.getName()} donne directement l'id.
 */
@Service
@RequiredArgsConstructor
public class UserDetailsServiceImpl implements UserDetailsService {

    private final UserAccountRepository userRepo;

    @Override
    public UserDetails loadUserByUsername(String username) throws UsernameNotFoundException {
        Long id;
        try {
            id = Long.valueOf(username);
        } catch (NumberFormatException e) {
            throw new UsernameNotFoundException("Identifiant invalide");
        }
        UserAccount u = userRepo.findById(id)
                .orElseThrow(() -> new UsernameNotFoundException("Utilisateur non trouvé"));
        return User.withUsername(String.valueOf(u.getId()))
                .password(u.getPasswordHash())
                .roles("USER")
                .build();
    }
}
