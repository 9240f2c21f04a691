package com.github.dimitryivaniuta.relay.common.kafka;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Kafka producer settings used for {@code kafka://} destinations.
 *
 * YAML prefix: {@code kafka}. Only bound when {@code kafka.enabled=true}.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "kafka")
public class AppKafkaProperties {

    private boolean enabled = false;

    @NotBlank
    private String bootstrapServers = "localhost:9092";

    @NotBlank
    private String clientId = "schema-relay";

    @Valid
    private Producer producer = new Producer();

    @Getter
    @Setter
    public static class Producer {
        @NotBlank private String acks = "all";
        @NotBlank private String compressionType = "lz4";
        @Min(0) private int lingerMs = 5;
        @Min(1) private int batchSize = 32 * 1024;
        @Min(1) private int deliveryTimeoutMs = 120_000;
        @Min(1) private int requestTimeoutMs = 30_000;
    }
}
