package com.bookindexer.ingest.config;

import java.util.HashMap;
import java.util.Map;

import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.serialization.StringSerializer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;
import org.springframework.kafka.core.DefaultKafkaProducerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.core.ProducerFactory;

/**
 * String producer for the audit topics. Audit records are JSON text keyed by domain id.
 */
@Configuration
public class KafkaTemplateConfig {

    @Bean
    public ProducerFactory<String, String> auditProducerFactory(Environment environment) {
        Map<String, Object> producerProps = new HashMap<>();

        producerProps.put(
                ProducerConfig.BOOTSTRAP_SERVERS_CONFIG,
                environment.getProperty("spring.kafka.bootstrap-servers", "localhost:9092"));
        producerProps.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
        producerProps.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, StringSerializer.class);

        producerProps.put(ProducerConfig.ACKS_CONFIG, environment.getProperty("spring.kafka.producer.acks", "all"));
        producerProps.put(
                ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG,
                Boolean.parseBoolean(environment.getProperty("spring.kafka.producer.enable-idempotence", "true")));

        // Bound the time send() may block on metadata so a missing broker cannot stall a batch
        String maxBlockMs = environment.getProperty("spring.kafka.producer.properties.max.block.ms");
        if (maxBlockMs != null && !maxBlockMs.isBlank()) {
            producerProps.put(ProducerConfig.MAX_BLOCK_MS_CONFIG, Long.parseLong(maxBlockMs));
        }

        String lingerMs = environment.getProperty("spring.kafka.producer.properties.linger.ms");
        if (lingerMs != null && !lingerMs.isBlank()) {
            producerProps.put(ProducerConfig.LINGER_MS_CONFIG, Integer.parseInt(lingerMs));
        }

        return new DefaultKafkaProducerFactory<>(producerProps);
    }

    @Bean
    public KafkaTemplate<String, String> kafkaTemplate(ProducerFactory<String, String> auditProducerFactory) {
        KafkaTemplate<String, String> template = new KafkaTemplate<>(auditProducerFactory);
        // Carries the trace of the push request that produced the record into its headers
        template.setObservationEnabled(true);
        return template;
    }
}
