package org.relaychat.config;

import org.relaychat.events.chat.ChatChannel;
import org.relaychat.model.UserEventType;
import org.relaychat.service.messaging.UserEventSubscriber;
import org.relaychat.service.realtime.BrokerEventListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.listener.ChannelTopic;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;
import org.springframework.data.redis.listener.Topic;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Arrays;
import java.util.List;

/**
 * Abonnements Redis. Chaque boucle (abonné identité, passerelle temps réel) n'est branchée
 * que si son composant est actif dans ce processus.
 * Les messages sont traités un par un, dans l'ordre de réception.
 */
@Configuration
public class RedisConfig {

    private static final Logger log = LoggerFactory.getLogger(RedisConfig.class);

    @Bean
    public RedisMessageListenerContainer redisMessageListenerContainer(RedisConnectionFactory connectionFactory,
                                                                       ObjectProvider<UserEventSubscriber> userEventSubscriber,
                                                                       ObjectProvider<BrokerEventListener> brokerEventListener) {
        RedisMessageListenerContainer container = new RedisMessageListenerContainer();
        container.setConnectionFactory(connectionFactory);
        container.setTaskExecutor(listenerExecutor());

        userEventSubscriber.ifAvailable(s -> {
            container.addMessageListener(s, new ChannelTopic(UserEventType.USER_EVENTS_CHANNEL));
            log.info("Abonné au canal {}", UserEventType.USER_EVENTS_CHANNEL);
        });
        brokerEventListener.ifAvailable(l -> {
            List<Topic> topics = Arrays.stream(ChatChannel.values())
                    .map(c -> (Topic) new ChannelTopic(c.channel()))
                    .toList();
            container.addMessageListener(l, topics);
            log.info("Passerelle abonnée à {} canaux", topics.size());
        });
        return container;
    }

    // un seul fil, file FIFO : typing=false ne double jamais typing=true, v3 ne passe pas avant v2
    static ThreadPoolTaskExecutor listenerExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setThreadNamePrefix("redis-listener-");
        executor.setDaemon(true);
        executor.initialize();
        return executor;
    }
}
