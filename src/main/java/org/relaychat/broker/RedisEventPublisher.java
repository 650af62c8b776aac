package org.relaychat.broker;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

@Component
public class RedisEventPublisher implements EventPublisher {

    private static final Logger log = LoggerFactory.getLogger(RedisEventPublisher.class);

    private final StringRedisTemplate redis;

    public RedisEventPublisher(StringRedisTemplate redis) {
        this.redis = redis;
    }

    @Override
    public void publish(String channel, String payload) {
        Long receivers = redis.convertAndSend(channel, payload);
        log.debug("Publié sur {} ({} abonnés)", channel, receivers);
    }
}
