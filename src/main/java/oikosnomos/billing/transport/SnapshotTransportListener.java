package oikosnomos.billing.transport;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import oikosnomos.billing.dto.BillingSnapshotDTO;
import oikosnomos.billing.event.BillingSnapshotComputedEvent;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.event.EventListener;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Component;

/**
 * Publishes each computed snapshot on home/{home_id}/billing/today_cost.
 * The broker call runs on the publish pool, after persistence has been queued.
 */
@Component
@Slf4j
public class SnapshotTransportListener {

    private final MqttTransport mqttTransport;
    private final ObjectMapper objectMapper;
    private final TaskExecutor publishExecutor;

    public SnapshotTransportListener(MqttTransport mqttTransport,
                                     ObjectMapper objectMapper,
                                     @Qualifier("publishExecutor") TaskExecutor publishExecutor) {
        this.mqttTransport = mqttTransport;
        this.objectMapper = objectMapper;
        this.publishExecutor = publishExecutor;
    }

    @EventListener
    @Order(Ordered.LOWEST_PRECEDENCE)
    public void onSnapshotComputed(BillingSnapshotComputedEvent event) {
        String topic = TopicNames.billingTopic(event.getHomeId());
        byte[] payload;
        try {
            payload = objectMapper.writeValueAsBytes(BillingSnapshotDTO.message(event.getSnapshot()));
        } catch (JsonProcessingException e) {
            log.error("Could not serialize snapshot of home {}: {}", event.getHomeId(), e.getMessage(), e);
            return;
        }
        try {
            publishExecutor.execute(() -> {
                if (mqttTransport.publish(topic, payload)) {
                    log.debug("Published snapshot to {}", topic);
                }
            });
        } catch (TaskRejectedException e) {
            log.warn("Publish queue full, dropping snapshot for {}", topic);
        }
    }
}
