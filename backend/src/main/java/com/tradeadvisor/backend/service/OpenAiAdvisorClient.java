package com.tradeadvisor.backend.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.tradeadvisor.backend.config.AdvisorProperties;
import com.tradeadvisor.backend.exception.AdvisorResponseException;
import com.tradeadvisor.backend.exception.AdvisorUnavailableException;
import com.tradeadvisor.backend.trading.pipeline.AdvisorClient;
import com.tradeadvisor.backend.trading.pipeline.AdvisorPrompt;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

/**
 * OpenAI-compatible chat-completions adapter. One call per invocation, guarded by the advisor
 * circuit breaker. Throttling, server errors and I/O failures are reported as retryable.
 */
@Slf4j
@Service
public class OpenAiAdvisorClient implements AdvisorClient {

    private final RestTemplate restTemplate;
    private final CircuitBreaker circuitBreaker;
    private final AdvisorProperties advisorProperties;
    private final ObjectMapper objectMapper;
    private final MeterRegistry meterRegistry;

    public OpenAiAdvisorClient(@Qualifier("advisorRestTemplate") RestTemplate restTemplate,
                               CircuitBreaker advisorCircuitBreaker,
                               AdvisorProperties advisorProperties,
                               ObjectMapper objectMapper,
                               MeterRegistry meterRegistry) {
        this.restTemplate = restTemplate;
        this.circuitBreaker = advisorCircuitBreaker;
        this.advisorProperties = advisorProperties;
        this.objectMapper = objectMapper;
        this.meterRegistry = meterRegistry;
    }

    @PostConstruct
    void init() {
        circuitBreaker.getEventPublisher().onStateTransition(event ->
                log.warn("Advisor circuit breaker {}", event.getStateTransition()));
        Gauge.builder("advisor_circuit_state", circuitBreaker, breaker -> mapState(breaker.getState()))
                .register(meterRegistry);
    }

    @Override
    public String requestRecommendation(AdvisorPrompt prompt) {
        AdvisorProperties.Api api = advisorProperties.getApi();
        if (api.getApiKey() == null || api.getApiKey().isBlank()) {
            throw new AdvisorUnavailableException("Advisor API key is not configured", false);
        }
        Timer.Sample sample = Timer.start(meterRegistry);
        boolean success = false;
        try {
            String response = circuitBreaker.executeSupplier(() -> doRequest(prompt, api));
            success = true;
            return response;
        } catch (CallNotPermittedException e) {
            throw new AdvisorUnavailableException("Advisor circuit breaker is open", false, e);
        } finally {
            sample.stop(Timer.builder("advisor_call_latency")
                    .tag("model", api.getModel())
                    .tag("status", success ? "success" : "error")
                    .register(meterRegistry));
        }
    }

    private String doRequest(AdvisorPrompt prompt, AdvisorProperties.Api api) {
        String url = api.getBaseUrl().replaceAll("/+$", "") + "/chat/completions";
        try {
            HttpHeaders headers = new HttpHeaders();
            headers.setContentType(MediaType.APPLICATION_JSON);
            headers.setBearerAuth(api.getApiKey());
            HttpEntity<String> entity = new HttpEntity<>(requestBody(prompt, api), headers);
            ResponseEntity<String> response = restTemplate.exchange(url, HttpMethod.POST, entity, String.class);
            return extractContent(response.getBody());
        } catch (HttpClientErrorException.TooManyRequests e) {
            log.warn("Advisor rate limited (429): {}", e.getMessage());
            throw new AdvisorUnavailableException("Advisor rate limited", true, e);
        } catch (HttpServerErrorException e) {
            log.warn("Advisor server error {}: {}", e.getStatusCode().value(), e.getMessage());
            throw new AdvisorUnavailableException("Advisor server error (" + e.getStatusCode().value() + ")", true, e);
        } catch (ResourceAccessException e) {
            log.warn("Advisor unreachable at {}: {}", url, e.getMessage());
            throw new AdvisorUnavailableException("Advisor unreachable: " + e.getMessage(), true, e);
        } catch (HttpClientErrorException e) {
            throw new AdvisorUnavailableException("Advisor rejected the request (" + e.getStatusCode().value() + ")", false, e);
        }
    }

    private String requestBody(AdvisorPrompt prompt, AdvisorProperties.Api api) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("model", api.getModel());
        body.put("temperature", api.getTemperature());
        body.put("max_tokens", api.getMaxTokens());
        ArrayNode messages = body.putArray("messages");
        messages.addObject().put("role", "system").put("content", prompt.systemPrompt());
        messages.addObject().put("role", "user").put("content", prompt.userPrompt());
        body.putObject("response_format").put("type", "json_object");
        try {
            return objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize advisor request", e);
        }
    }

    private String extractContent(String responseBody) {
        if (responseBody == null || responseBody.isBlank()) {
            throw new AdvisorResponseException("choices", "empty completion body");
        }
        try {
            JsonNode content = objectMapper.readTree(responseBody).path("choices").path(0).path("message").path("content");
            if (!content.isTextual() || content.asText().isBlank()) {
                throw new AdvisorResponseException("choices", "completion has no message content");
            }
            return content.asText();
        } catch (JsonProcessingException e) {
            throw new AdvisorResponseException("choices", "completion body is not JSON", e);
        }
    }

    private int mapState(CircuitBreaker.State state) {
        return switch (state) {
            case CLOSED -> 0;
            case OPEN -> 1;
            case HALF_OPEN -> 2;
            default -> 3;
        };
    }
}
