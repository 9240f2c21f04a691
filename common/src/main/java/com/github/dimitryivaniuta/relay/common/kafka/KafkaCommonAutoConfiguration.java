package com.github.dimitryivaniuta.relay.common.kafka;

import java.util.HashMap;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.serialization.ByteArraySerializer;
import org.apache.kafka.common.serialization.StringSerializer;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import reactor.kafka.sender.KafkaSender;
import reactor.kafka.sender.SenderOptions;

/**
 * Creates the shared reactive Kafka sender. Switched off unless {@code kafka.enabled=true},
 * so services that only forward over HTTP never open a producer.
 */
@Slf4j
@AutoConfiguration
@ConditionalOnProperty(prefix = "kafka", name = "enabled", havingValue = "true")
@EnableConfigurationProperties({
        AppKafkaProperties.class
})
public class KafkaCommonAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public SenderOptions<String, byte[]> senderOptions(AppKafkaProperties p) {
        Map<String, Object> cfg = new HashMap<>();
        cfg.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, p.getBootstrapServers());
        cfg.put(ProducerConfig.CLIENT_ID_CONFIG, p.getClientId());
        cfg.put(ProducerConfig.ACKS_CONFIG, p.getProducer().getAcks());
        cfg.put(ProducerConfig.COMPRESSION_TYPE_CONFIG, p.getProducer().getCompressionType());
        cfg.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
        cfg.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, ByteArraySerializer.class);
        cfg.put(ProducerConfig.LINGER_MS_CONFIG, p.getProducer().getLingerMs());
        cfg.put(ProducerConfig.BATCH_SIZE_CONFIG, p.getProducer().getBatchSize());
        cfg.put(ProducerConfig.DELIVERY_TIMEOUT_MS_CONFIG, p.getProducer().getDeliveryTimeoutMs());
        cfg.put(ProducerConfig.REQUEST_TIMEOUT_MS_CONFIG, p.getProducer().getRequestTimeoutMs());
        cfg.put(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, true);
        log.info("Kafka sender configured: bootstrap={}, clientId={}", p.getBootstrapServers(), p.getClientId());
        return SenderOptions.create(cfg);
    }

    @Bean(name = "reactorKafkaSender", destroyMethod = "close")
    @ConditionalOnMissingBean(name = "reactorKafkaSender")
    public KafkaSender<String, byte[]> reactorKafkaSender(SenderOptions<String, byte[]> opts) {
        return KafkaSender.create(opts);
    }
}
