package com.company.obscalc.service;

import com.company.obscalc.event.CalcStateChangedEvent;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.event.EventListener;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Publishes calculation changes to {@code <prefix><programId>} channels.
 * Best effort: a Redis outage is logged and counted, never propagated.
 */
@Component
@Slf4j
@ConditionalOnProperty(value = "obscalc.notifier.redis.enabled", havingValue = "true")
public class RedisChangeRelay {

    private final RedisTemplate<String, Object> changeRelayTemplate;
    private final MeterRegistry meterRegistry;
    private final String channelPrefix;

    public RedisChangeRelay(@Qualifier("changeRelayTemplate") RedisTemplate<String, Object> changeRelayTemplate,
                            MeterRegistry meterRegistry,
                            @Value("${obscalc.notifier.redis.channel-prefix:obscalc:changes:}") String channelPrefix) {
        this.changeRelayTemplate = changeRelayTemplate;
        this.meterRegistry = meterRegistry;
        this.channelPrefix = channelPrefix;
    }

    @Async
    @EventListener
    public void relay(CalcStateChangedEvent event) {
        if (event.getProgramId() == null) {
            return;
        }

        try {
            changeRelayTemplate.convertAndSend(channelPrefix + event.getProgramId(), toMessage(event));
            meterRegistry.counter("obscalc.notifier.redis.published").increment();
        } catch (Exception e) {
            log.warn("Failed to relay change of {} to Redis", event.getObservationId(), e);
            meterRegistry.counter("obscalc.notifier.redis.failures").increment();
        }
    }

    static Map<String, Object> toMessage(CalcStateChangedEvent event) {
        Map<String, Object> message = new LinkedHashMap<>();
        message.put("kind", event.getKind().name());
        message.put("observationId", event.getObservationId());
        message.put("ownerId", event.getProgramId());
        message.put("previousState", event.getPreviousState() != null ? event.getPreviousState().name() : null);
        message.put("newState", event.getNewState().name());
        message.put("occurredAt", event.getOccurredAt());
        return message;
    }
}
