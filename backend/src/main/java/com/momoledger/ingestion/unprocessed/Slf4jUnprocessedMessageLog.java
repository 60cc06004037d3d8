package com.momoledger.ingestion.unprocessed;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.momoledger.domain.RawSms;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Writes one JSON line per unprocessed message to the {@value #LOGGER_NAME} logger.
 * logback-spring.xml routes that logger to its own file.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class Slf4jUnprocessedMessageLog implements UnprocessedMessageLog {

    public static final String LOGGER_NAME = "momoledger.unprocessed";

    private static final Logger UNPROCESSED = LoggerFactory.getLogger(LOGGER_NAME);

    private final ObjectMapper objectMapper;

    @Override
    public void log(RawSms sms, String reason) {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("sms", sms != null ? sms.getAttributes() : null);
        entry.put("error", reason);
        try {
            UNPROCESSED.warn(objectMapper.writeValueAsString(entry));
        } catch (JsonProcessingException e) {
            UNPROCESSED.warn("sms={} error={}", sms, reason);
        } catch (RuntimeException e) {
            log.error("Could not record unprocessed message ({}): {}", reason, e.getMessage(), e);
        }
    }
}
