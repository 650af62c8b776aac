package org.relaychat.dto;

import lombok.*;
import org.relaychat.model.UserAccount;

import java.time.Instant;

@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class UserDto {
    private Long id;
    private String email;
    private String username;
    private String displayName;
    private String avatarUrl;
    private boolean online;
    private Instant lastSeen;
    private Instant createdAt;

    public static UserDto of(UserAccount u) {
        return UserDto.builder()
                .id(u.getId())
                .email(u.getEmail())
                .username(u.getUsername())
                .displayName(u.getDisplayName())
                .avatarUrl(u.getAvatarUrl())
                .online(u.isOnline())
                .lastSeen(u.getLastSeen())
                .createdAt(u.getCreatedAt())
                .build();
    }
}
