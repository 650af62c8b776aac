package org.relaychat.controller;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.relaychat.dto.ConversationReadResult;
import org.relaychat.dto.ConversationSummary;
import org.relaychat.dto.CreateConversationRequest;
import org.relaychat.dto.ParticipantView;
import org.relaychat.dto.ReadStatus;
import org.relaychat.dto.StatusSyncRequest;
import org.relaychat.dto.StatusSyncResult;
import org.relaychat.model.MessageStatusEvent;
import org.relaychat.service.messaging.ConversationService;
import org.relaychat.service.messaging.MessageStatusService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.security.Principal;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/conversations")
@RequiredArgsConstructor
public class ConversationController {

    private final ConversationService conversationService;
    private final MessageStatusService statusService;

    @GetMapping
    public List<ConversationSummary> list(Principal principal) {
        return conversationService.listConversations(Principals.userId(principal));
    }

    @PostMapping
    public ResponseEntity<ConversationSummary> create(@Valid @RequestBody CreateConversationRequest req, Principal principal) {
        ConversationSummary c = conversationService.createConversation(Principals.userId(principal),
                req.getKind(), req.getName(), req.getDescription(), req.getParticipantIds());
        return ResponseEntity.status(HttpStatus.CREATED).body(c);
    }

    @PostMapping("/sync-status")
    public StatusSyncResult syncStatus(@Valid @RequestBody StatusSyncRequest req, Principal principal) {
        return statusService.syncStatus(Principals.userId(principal), req.getDeviceId(),
                req.getLastSyncTimestamp(), req.getStatusUpdates());
    }

    @GetMapping("/{id}")
    public ConversationSummary get(@PathVariable Long id, Principal principal) {
        return conversationService.getConversation(id, Principals.userId(principal));
    }

    @GetMapping("/{id}/participants")
    public List<ParticipantView> participants(@PathVariable Long id, Principal principal) {
        return conversationService.participants(id, Principals.userId(principal));
    }

    @PostMapping("/{id}/participants")
    public ResponseEntity<?> addParticipant(@PathVariable Long id, @RequestBody Map<String, Long> body, Principal principal) {
        Long userId = body.get("userId");
        if (userId == null) {
            return ResponseEntity.badRequest().body(Map.of("error", "Champ 'userId' requis"));
        }
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(conversationService.addParticipant(id, Principals.userId(principal), userId));
    }

    @DeleteMapping("/{id}/participants/{userId}")
    public ResponseEntity<Void> removeParticipant(@PathVariable Long id, @PathVariable Long userId, Principal principal) {
        conversationService.removeParticipant(id, Principals.userId(principal), userId);
        return ResponseEntity.noContent().build();
    }

    @PatchMapping("/{id}/read")
    public ConversationReadResult markRead(@PathVariable Long id, Principal principal,
                                           @RequestHeader(value = "X-Device-Id", required = false) String deviceId) {
        return statusService.markConversationRead(id, Principals.userId(principal), deviceId);
    }

    @PatchMapping("/{id}/read/{messageId}")
    public ConversationReadResult markReadUpTo(@PathVariable Long id, @PathVariable Long messageId, Principal principal,
                                               @RequestHeader(value = "X-Device-Id", required = false) String deviceId) {
        return statusService.markConversationReadUpTo(id, Principals.userId(principal), messageId, deviceId);
    }

    @GetMapping("/{id}/status")
    public ReadStatus readStatus(@PathVariable Long id, Principal principal) {
        return statusService.readStatus(id, Principals.userId(principal));
    }

    @GetMapping("/{id}/unread-count")
    public Map<String, Object> unreadCount(@PathVariable Long id, Principal principal) {
        return Map.of("conversationId", id, "unreadCount", statusService.unreadCount(id, Principals.userId(principal)));
    }

    @GetMapping("/{id}/status-events")
    public List<MessageStatusEvent> statusEvents(@PathVariable Long id, Principal principal,
                                                 @RequestParam(value = "limit", defaultValue = "50") int limit) {
        return statusService.conversationStatusHistory(id, Principals.userId(principal), limit);
    }
}
