package oikosnomos.billing.transport;

import lombok.extern.slf4j.Slf4j;
import oikosnomos.billing.config.BillingProperties;
import oikosnomos.billing.service.HomeService;
import oikosnomos.billing.service.IngestGateway;
import org.eclipse.paho.client.mqttv3.IMqttDeliveryToken;
import org.eclipse.paho.client.mqttv3.MqttCallbackExtended;
import org.eclipse.paho.client.mqttv3.MqttClient;
import org.eclipse.paho.client.mqttv3.MqttConnectOptions;
import org.eclipse.paho.client.mqttv3.MqttException;
import org.eclipse.paho.client.mqttv3.MqttMessage;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;
import org.springframework.util.backoff.BackOffExecution;
import org.springframework.util.backoff.ExponentialBackOff;

import jakarta.annotation.PreDestroy;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.ScheduledFuture;

/**
 * Pub/sub side of the engine: subscribes to the readings of every billed home and
 * publishes snapshots. Publishing is best effort; a lost message is logged, never retried.
 * <p>
 * Paho's automatic reconnect only covers connections that were once established, so a
 * failed first connect is retried here on the task scheduler with capped exponential backoff.
 */
@Component
@Slf4j
public class MqttTransport implements MqttCallbackExtended {

    private final MqttClient client;
    private final MqttConnectOptions connectOptions;
    private final IngestGateway ingestGateway;
    private final HomeService homeService;
    private final BillingProperties properties;
    private final TaskScheduler taskScheduler;

    private final Object connectLock = new Object();
    private BackOffExecution connectBackOff;
    private ScheduledFuture<?> pendingConnect;
    private volatile boolean stopped;

    public MqttTransport(MqttClient client,
                         MqttConnectOptions connectOptions,
                         IngestGateway ingestGateway,
                         HomeService homeService,
                         BillingProperties properties,
                         TaskScheduler taskScheduler) {
        this.client = client;
        this.connectOptions = connectOptions;
        this.ingestGateway = ingestGateway;
        this.homeService = homeService;
        this.properties = properties;
        this.taskScheduler = taskScheduler;
        client.setCallback(this);
    }

    @EventListener(ApplicationReadyEvent.class)
    public void start() {
        BillingProperties.Mqtt mqtt = properties.getMqtt();
        ExponentialBackOff backOff = new ExponentialBackOff(mqtt.getInitialReconnectDelay().toMillis(), 2.0);
        backOff.setMaxInterval(mqtt.getMaxReconnectDelay().toMillis());
        synchronized (connectLock) {
            connectBackOff = backOff.start();
        }
        connect();
    }

    /**
     * One attempt at the first connection. On failure the next attempt is scheduled;
     * once connected, Paho's automatic reconnect takes over.
     */
    void connect() {
        if (stopped || client.isConnected()) {
            return;
        }
        String brokerUrl = properties.getMqtt().getBrokerUrl();
        try {
            client.connect(connectOptions);
            log.info("Connected to broker {}", brokerUrl);
        } catch (MqttException e) {
            synchronized (connectLock) {
                if (stopped) {
                    return;
                }
                long delay = connectBackOff.nextBackOff();
                log.warn("Could not connect to broker {}: {}, retrying in {} ms", brokerUrl, e.getMessage(), delay);
                pendingConnect = taskScheduler.schedule(this::connect, Instant.now().plusMillis(delay));
            }
        }
    }

    @Override
    public void connectComplete(boolean reconnect, String serverUri) {
        if (reconnect) {
            log.info("Reconnected to {}", serverUri);
        }
        subscribeAll();
    }

    void subscribeAll() {
        List<String> homeIds;
        try {
            homeIds = homeService.billedHomeIds();
        } catch (DataAccessException e) {
            log.error("Could not list homes to subscribe to: {}", e.getMessage());
            return;
        }
        int qos = properties.getMqtt().getQos();
        for (String homeId : homeIds) {
            String filter = TopicNames.readingFilter(homeId);
            try {
                client.subscribe(filter, qos);
                log.info("Subscribed to {}", filter);
            } catch (MqttException e) {
                log.error("Subscription to {} failed: {}", filter, e.getMessage());
            }
        }
    }

    @Override
    public void messageArrived(String topic, MqttMessage message) {
        ingestGateway.handle(topic, message.getPayload());
    }

    /**
     * Publishes a payload. Returns false when the message could not be handed to the broker.
     */
    public boolean publish(String topic, byte[] payload) {
        if (!client.isConnected()) {
            log.warn("Not connected, dropping message for {}", topic);
            return false;
        }
        try {
            MqttMessage message = new MqttMessage(payload);
            message.setQos(properties.getMqtt().getQos());
            client.publish(topic, message);
            return true;
        } catch (MqttException e) {
            log.warn("Publish to {} failed: {}", topic, e.getMessage());
            return false;
        }
    }

    @Override
    public void connectionLost(Throwable cause) {
        log.warn("Connection to broker lost: {}", cause != null ? cause.getMessage() : "unknown");
    }

    @Override
    public void deliveryComplete(IMqttDeliveryToken token) {
        // qos 0 by default, nothing to track
    }

    @PreDestroy
    public void stop() {
        synchronized (connectLock) {
            stopped = true;
            if (pendingConnect != null) {
                pendingConnect.cancel(false);
            }
        }
        try {
            if (client.isConnected()) {
                client.disconnect();
            }
            client.close();
            log.info("Disconnected from broker");
        } catch (MqttException e) {
            log.warn("Error while disconnecting from broker: {}", e.getMessage());
        }
    }
}
