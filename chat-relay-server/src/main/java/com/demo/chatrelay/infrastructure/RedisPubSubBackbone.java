package com.demo.chatrelay.infrastructure;

import com.demo.chatrelay.domain.BackboneEnvelope;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.connection.MessageListener;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.listener.ChannelTopic;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;

/**
 * Redis PubSub backbone. Envelopes travel as JSON strings on plain channel names,
 * so instances of any version that agree on the envelope shape can share a Redis.
 */
@Component
@Slf4j
public class RedisPubSubBackbone implements PubSubBackbone {

    private final StringRedisTemplate redisTemplate;
    private final RedisMessageListenerContainer listenerContainer;
    private final ObjectMapper objectMapper;

    public RedisPubSubBackbone(StringRedisTemplate redisTemplate,
                               RedisMessageListenerContainer listenerContainer,
                               ObjectMapper objectMapper) {
        this.redisTemplate = redisTemplate;
        this.listenerContainer = listenerContainer;
        this.objectMapper = objectMapper;
    }

    @Override
    public void publish(String channel, BackboneEnvelope envelope) {
        String payload;
        try {
            payload = objectMapper.writeValueAsString(envelope);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Envelope is not serializable for channel " + channel, e);
        }

        Long subscribers = redisTemplate.convertAndSend(channel, payload);

        if (subscribers == null || subscribers == 0) {
            log.warn("No active subscribers for channel: {}", channel);
        }
        log.debug("Published to backbone: channel={}, subscribers={}", channel, subscribers);
    }

    @Override
    public void subscribe(BackboneListener listener, String... channels) {
        MessageListener messageListener = (message, pattern) -> {
            String channel = new String(message.getChannel(), StandardCharsets.UTF_8);
            try {
                String body = new String(message.getBody(), StandardCharsets.UTF_8);
                BackboneEnvelope envelope = objectMapper.readValue(body, BackboneEnvelope.class);
                listener.onMessage(channel, envelope);
            } catch (Exception e) {
                log.error("Error processing backbone message: channel={}", channel, e);
            }
        };

        List<ChannelTopic> topics = Arrays.stream(channels).map(ChannelTopic::new).toList();
        listenerContainer.addMessageListener(messageListener, topics);

        log.info("Subscribed to backbone channels: {}", Arrays.toString(channels));
    }
}
