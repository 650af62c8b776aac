package org.relaychat.model;

import jakarta.persistence.*;
import lombok.*;
import org.springframework.data.domain.Persistable;

import java.time.Instant;

/**
 * Vue matérialisée d'un utilisateur côté messagerie.
 * Seul l'abonné aux événements d'identité la modifie.
 */
@Entity
@Table(name = "user_profiles")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class UserProfile implements Persistable<Long> {
    @Id
    private Long userId;

    @Column(nullable = false)
    private String username;

    private String displayName;

    private String email;

    private String avatarUrl;

    private boolean online;

    private Instant lastSeen;

    // version de la ligne source au moment de l'événement appliqué
    private long sourceVersion;

    // pierre tombale : un profil supprimé n'est jamais ressuscité par un événement en retard
    private boolean deleted;

    private Instant updatedAt;

    // vrai : save() fait un INSERT, et un doublon concurrent échoue au lieu d'écraser la ligne
    @Transient
    @Getter(AccessLevel.NONE)
    private boolean fresh;

    @Override
    public Long getId() {
        return userId;
    }

    @Override
    public boolean isNew() {
        return fresh;
    }

    @PostLoad
    @PostPersist
    void markStored() {
        this.fresh = false;
    }
}
