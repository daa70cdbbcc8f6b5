package com.tradeadvisor.backend.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tradeadvisor.backend.config.RequestCorrelationFilter;
import com.tradeadvisor.backend.model.AuditEvent;
import com.tradeadvisor.backend.repository.AuditEventRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;

/**
 * Append-only trail of fallbacks, executions and lifecycle changes.
 * A failed write is logged and never fails the business operation that triggered it.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class AuditEventService {

    public static final String ADVISOR = "ADVISOR";
    public static final String EXECUTION = "EXECUTION";
    public static final String RECOMMENDATION = "RECOMMENDATION";
    public static final String ACCOUNT = "ACCOUNT";

    private final AuditEventRepository auditEventRepository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public void recordEvent(Long userId, String eventType, String action, String description, Object metadata) {
        try {
            String payload = metadata == null ? null : objectMapper.writeValueAsString(metadata);
            AuditEvent event = AuditEvent.builder()
                    .userId(userId)
                    .eventType(eventType)
                    .action(action)
                    .description(truncate(description, 512))
                    .metadata(truncate(payload, 4000))
                    .correlationId(MDC.get(RequestCorrelationFilter.CORRELATION_ID_KEY))
                    .createdAt(Instant.now(clock))
                    .build();
            auditEventRepository.save(event);
        } catch (JsonProcessingException | DataAccessException e) {
            log.warn("Failed to record audit event {}:{} - {}", eventType, action, e.getMessage());
        }
    }

    private static String truncate(String value, int max) {
        if (value == null || value.length() <= max) {
            return value;
        }
        return value.substring(0, max);
    }
}
