package org.relaychat.dto;

import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.relaychat.model.ConversationKind;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CreateConversationRequest {
    @NotNull
    private ConversationKind kind;
    @Size(max = 100)
    private String name;
    @Size(max = 500)
    private String description;
    @NotEmpty
    private List<Long> participantIds;
}
