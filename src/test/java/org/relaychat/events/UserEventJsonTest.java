package org.relaychat.events;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.exc.InvalidTypeIdException;
import org.junit.jupiter.api.Test;
import org.relaychat.events.user.UserDeleted;
import org.relaychat.events.user.UserEvent;
import org.relaychat.events.user.UserSnapshot;
import org.relaychat.events.user.UserUpdated;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class UserEventJsonTest {

    private final ObjectMapper mapper = new ObjectMapper().findAndRegisterModules();

    private static UserSnapshot snapshot() {
        return new UserSnapshot(4L, "dave", "dave@test.io", "David", null, true,
                Instant.parse("2024-05-01T10:00:00Z"), Instant.EPOCH, Instant.EPOCH);
    }

    @Test
    void updated_shouldCarryTypeVersionAndChanges() throws Exception {
        UserUpdated event = new UserUpdated("evt-1", 4L, Instant.now(), 3, snapshot(), List.of("displayName"));

        JsonNode json = mapper.readTree(mapper.writeValueAsString(event));

        assertThat(json.get("eventType").asText()).isEqualTo("USER_UPDATED");
        assertThat(json.get("userId").asLong()).isEqualTo(4L);
        assertThat(json.get("version").asLong()).isEqualTo(3L);
        assertThat(json.get("data").get("displayName").asText()).isEqualTo("David");
        assertThat(json.get("changes").get(0).asText()).isEqualTo("displayName");
    }

    @Test
    void deleted_shouldDecodeToItsVariant() throws Exception {
        String json = mapper.writeValueAsString(new UserDeleted("evt-2", 4L, Instant.now(), 5, snapshot()));

        UserEvent decoded = mapper.readValue(json, UserEvent.class);

        assertThat(decoded).isInstanceOf(UserDeleted.class);
        assertThat(decoded.version()).isEqualTo(5L);
        assertThat(decoded.data().username()).isEqualTo("dave");
    }

    @Test
    void unknownEventType_shouldBeRejected() {
        assertThatThrownBy(() -> mapper.readValue("{\"eventType\":\"USER_MERGED\",\"userId\":1}", UserEvent.class))
                .isInstanceOf(InvalidTypeIdException.class);
    }

    @Test
    void changes_shouldBeCopied() {
        List<String> changes = new ArrayList<>(List.of("online"));
        UserUpdated event = new UserUpdated("evt-3", 4L, Instant.now(), 1, snapshot(), changes);

        changes.add("lastSeen");

        assertThat(event.changes()).containsExactly("online");
    }
}
