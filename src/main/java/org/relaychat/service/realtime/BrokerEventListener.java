package org.relaychat.service.realtime;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.relaychat.events.chat.ChatChannel;
import org.relaychat.events.chat.ChatEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.connection.Message;
import org.springframework.data.redis.connection.MessageListener;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * Abonné aux canaux de messagerie : décode l'événement selon son canal et le confie au routeur.
 */
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "app.realtime.enabled", havingValue = "true", matchIfMissing = true)
public class BrokerEventListener implements MessageListener {

    private static final Logger log = LoggerFactory.getLogger(BrokerEventListener.class);

    private final FanoutRouter router;
    private final ObjectMapper objectMapper;

    @Override
    public void onMessage(Message message, byte[] pattern) {
        String channelName = new String(message.getChannel(), StandardCharsets.UTF_8);
        ChatChannel channel = ChatChannel.fromChannel(channelName).orElse(null);
        if (channel == null) {
            log.debug("Canal {} sans routage, ignoré", channelName);
            return;
        }
        ChatEvent event;
        try {
            event = objectMapper.readValue(message.getBody(), channel.payloadType());
        } catch (IOException e) {
            log.warn("Événement {} illisible, ignoré: {}", channelName, e.getMessage());
            return;
        }
        router.route(event);
    }
}
