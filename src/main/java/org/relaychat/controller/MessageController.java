package org.relaychat.controller;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.relaychat.dto.MessageView;
import org.relaychat.dto.SendMessageRequest;
import org.relaychat.dto.StatusTransition;
import org.relaychat.model.MessageStatusEvent;
import org.relaychat.service.messaging.MessageService;
import org.relaychat.service.messaging.MessageStatusService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.security.Principal;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/messages")
@RequiredArgsConstructor
public class MessageController {

    private final MessageService messageService;
    private final MessageStatusService statusService;

    @GetMapping("/conversations/{conversationId}")
    public List<MessageView> list(@PathVariable Long conversationId, Principal principal,
                                  @RequestParam(value = "limit", defaultValue = "50") int limit,
                                  @RequestParam(value = "offset", defaultValue = "0") int offset) {
        return messageService.messages(conversationId, Principals.userId(principal), limit, offset);
    }

    @PostMapping
    public ResponseEntity<MessageView> send(@Valid @RequestBody SendMessageRequest req, Principal principal) {
        MessageView m = messageService.sendMessage(Principals.userId(principal), req.getConversationId(),
                req.getContent(), req.getMessageType(), req.getReplyTo());
        return ResponseEntity.status(HttpStatus.CREATED).body(m);
    }

    @PatchMapping("/{id}")
    public MessageView edit(@PathVariable Long id, @RequestBody Map<String, String> body, Principal principal) {
        return messageService.editMessage(id, Principals.userId(principal), body.get("content"));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable Long id, Principal principal) {
        messageService.deleteMessage(id, Principals.userId(principal));
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/search")
    public List<MessageView> search(@RequestParam("q") String query, Principal principal,
                                    @RequestParam(value = "limit", defaultValue = "20") int limit) {
        return messageService.search(Principals.userId(principal), query, limit);
    }

    @PatchMapping("/{id}/delivered")
    public StatusTransition delivered(@PathVariable Long id, Principal principal,
                                      @RequestHeader(value = "X-Device-Id", required = false) String deviceId) {
        return statusService.markDelivered(id, Principals.userId(principal), deviceId);
    }

    @PatchMapping("/{id}/read")
    public StatusTransition read(@PathVariable Long id, Principal principal,
                                 @RequestHeader(value = "X-Device-Id", required = false) String deviceId) {
        return statusService.markRead(id, Principals.userId(principal), deviceId);
    }

    @GetMapping("/{id}/status-events")
    public List<MessageStatusEvent> statusEvents(@PathVariable Long id, Principal principal) {
        return statusService.statusHistory(id, Principals.userId(principal));
    }
}
