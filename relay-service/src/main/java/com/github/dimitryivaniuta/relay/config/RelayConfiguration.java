package com.github.dimitryivaniuta.relay.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.relay.forward.DestinationForwarder;
import com.github.dimitryivaniuta.relay.forward.Forwarder;
import com.github.dimitryivaniuta.relay.forward.HttpForwarder;
import com.github.dimitryivaniuta.relay.forward.KafkaForwarder;
import com.github.dimitryivaniuta.relay.forward.RoutingForwarder;
import com.github.dimitryivaniuta.relay.registry.ApicurioRegistryClient;
import com.github.dimitryivaniuta.relay.registry.RegistryClient;
import io.netty.channel.ChannelOption;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.kafka.sender.KafkaSender;
import reactor.netty.http.client.HttpClient;

@Slf4j
@Configuration
@EnableConfigurationProperties({
        RelayProperties.class
})
public class RelayConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public RegistryClient registryClient(WebClient.Builder builder, ObjectMapper objectMapper, RelayProperties props) {
        RelayProperties.Registry r = props.getRegistry();
        WebClient client = builder.clone()
                .clientConnector(new ReactorClientHttpConnector(httpClient(r.getConnectTimeout(), r.getReadTimeout())))
                .baseUrl(r.getBaseUrl())
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                .build();
        log.info("Schema registry: {} (group={})", r.getBaseUrl(), r.getGroupId());
        return new ApicurioRegistryClient(client, objectMapper, props);
    }

    @Bean
    public HttpForwarder httpForwarder(WebClient.Builder builder, RelayProperties props) {
        Duration timeout = props.getForwarding().getRequestTimeout();
        WebClient client = builder.clone()
                .clientConnector(new ReactorClientHttpConnector(httpClient(props.getRegistry().getConnectTimeout(), timeout)))
                .build();
        return new HttpForwarder(client, timeout);
    }

    @Bean
    @ConditionalOnProperty(prefix = "kafka", name = "enabled", havingValue = "true")
    public KafkaForwarder kafkaForwarder(KafkaSender<String, byte[]> reactorKafkaSender, RelayProperties props) {
        return new KafkaForwarder(reactorKafkaSender, props.getForwarding().getRequestTimeout());
    }

    @Bean
    @ConditionalOnMissingBean(Forwarder.class)
    public Forwarder forwarder(List<DestinationForwarder> transports) {
        log.info("Forwarding transports: {}", transports.stream().map(t -> t.getClass().getSimpleName()).toList());
        return new RoutingForwarder(transports);
    }

    private static HttpClient httpClient(Duration connectTimeout, Duration responseTimeout) {
        return HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) connectTimeout.toMillis())
                .responseTimeout(responseTimeout);
    }
}
