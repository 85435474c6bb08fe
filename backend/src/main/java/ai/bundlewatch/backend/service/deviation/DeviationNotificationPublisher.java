package ai.bundlewatch.backend.service.deviation;

import ai.bundlewatch.backend.service.alert.AlertSink;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Hands newly saved deviation alerts to the external delivery layer through a Redis list,
 * then marks them SENT in the alert sink.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "adherence.notifications.redis.enabled", havingValue = "true")
public class DeviationNotificationPublisher implements DeviationListener {

    static final String QUEUE_KEY = "queue:deviation_alerts";

    private final RedisTemplate<String, Object> redisTemplate;
    private final AlertSink alertSink;
    private final Clock clock;

    @Autowired
    public DeviationNotificationPublisher(RedisTemplate<String, Object> redisTemplate, AlertSink alertSink, Clock clock) {
        this.redisTemplate = redisTemplate;
        this.alertSink = alertSink;
        this.clock = clock;
    }

    @Override
    public void onDeviationEmitted(Deviation deviation, String alertId) {
        Map<String, Object> message = new LinkedHashMap<>();
        message.put("alertId", alertId);
        message.put("sourceId", deviation.getKey().asSourceId());
        message.put("severity", deviation.getSeverity().getValue());
        message.put("patientId", deviation.getPatientId());
        message.put("title", deviation.getTitle());
        message.put("summary", deviation.getSummary());
        message.put("recommendation", deviation.getRecommendation());
        message.put("queuedAt", clock.instant().toString());

        Long length = redisTemplate.opsForList().rightPush(QUEUE_KEY, message);
        log.debug("Queued deviation alert {} ({} pending)", alertId, length);

        if (!alertSink.markSent(alertId)) {
            log.warn("Queued deviation alert {} but could not mark it sent", alertId);
        }
    }
}
