package oikosnomos.billing.config;

import org.eclipse.paho.client.mqttv3.MqttClient;
import org.eclipse.paho.client.mqttv3.MqttConnectOptions;
import org.eclipse.paho.client.mqttv3.MqttException;
import org.eclipse.paho.client.mqttv3.persist.MemoryPersistence;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class MqttConfig {

    @Bean
    public MqttClient mqttClient(BillingProperties properties) throws MqttException {
        BillingProperties.Mqtt mqtt = properties.getMqtt();
        MqttClient client = new MqttClient(mqtt.getBrokerUrl(), mqtt.getClientId(), new MemoryPersistence());
        // Paho waits forever on a blocking publish by default
        client.setTimeToWait(mqtt.getConnectionTimeout().toMillis());
        return client;
    }

    @Bean
    public MqttConnectOptions mqttConnectOptions(BillingProperties properties) {
        MqttConnectOptions options = new MqttConnectOptions();
        options.setAutomaticReconnect(true);
        options.setCleanSession(true);
        options.setConnectionTimeout((int) properties.getMqtt().getConnectionTimeout().toSeconds());
        return options;
    }
}
