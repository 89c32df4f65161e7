package com.flagship.iam_service.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.iam_service.domain.iam.IamTopics;
import com.flagship.iam_service.domain.iam.IamTranscodings;
import com.flagship.iam_service.eventsourcing.mapper.AesGcmCipher;
import com.flagship.iam_service.eventsourcing.mapper.EventMapper;
import com.flagship.iam_service.eventsourcing.mapper.ZlibCompressor;
import com.flagship.iam_service.eventsourcing.recorder.ApplicationRecorder;
import com.flagship.iam_service.eventsourcing.recorder.JdbcApplicationRecorder;
import com.flagship.iam_service.eventsourcing.topic.TopicResolver;
import com.flagship.iam_service.eventsourcing.transcoder.JsonTranscoder;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

/**
 * Event-sourcing components: topic registry, transcoder, mapper and recorder.
 *
 * Registries are filled here, once, at startup. Nothing else registers
 * topics or transcodings later.
 */
@Configuration
@Slf4j
public class EventSourcingConfig {

    @Bean
    public TopicResolver topicResolver() {
        return IamTopics.registerAll(new TopicResolver());
    }

    @Bean
    public JsonTranscoder transcoder(ObjectMapper objectMapper) {
        return IamTranscodings.registerAll(JsonTranscoder.withDefaults(objectMapper));
    }

    @Bean
    public EventMapper eventMapper(ObjectMapper objectMapper, JsonTranscoder transcoder, TopicResolver topicResolver,
                                   @Value("${iam.mapper.compression.enabled:false}") boolean compressionEnabled,
                                   @Value("${iam.mapper.cipher.key:}") String cipherKey) {
        ZlibCompressor compressor = compressionEnabled ? new ZlibCompressor() : null;
        AesGcmCipher cipher = cipherKey.isBlank() ? null : AesGcmCipher.fromBase64(cipherKey);
        log.info("Event mapper configured: compression={}, encryption={}", compressor != null, cipher != null);
        return new EventMapper(objectMapper, transcoder, topicResolver, compressor, cipher);
    }

    @Bean
    public ApplicationRecorder applicationRecorder(JdbcTemplate jdbcTemplate) {
        return new JdbcApplicationRecorder(jdbcTemplate);
    }
}
