package org.relaychat.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.relaychat.model.MessageStatus;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Lot de statuts accumulés hors ligne par un appareil.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class StatusSyncRequest {
    private String deviceId;
    private Instant lastSyncTimestamp;
    @NotNull @Size(max = 500) @Valid
    private List<Update> statusUpdates = new ArrayList<>();

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Update {
        @NotNull
        private Long messageId;
        private Long conversationId;
        @NotNull
        private MessageStatus status;
        // moment où l'appareil a constaté le statut
        private Instant timestamp;
    }
}
