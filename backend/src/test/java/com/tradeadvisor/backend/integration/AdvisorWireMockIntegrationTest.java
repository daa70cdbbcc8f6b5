package com.tradeadvisor.backend.integration;

import com.github.tomakehurst.wiremock.WireMockServer;
import com.tradeadvisor.backend.exception.AdvisorResponseException;
import com.tradeadvisor.backend.exception.AdvisorUnavailableException;
import com.tradeadvisor.backend.service.OpenAiAdvisorClient;
import com.tradeadvisor.backend.trading.pipeline.AdvisorPrompt;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;

import static com.github.tomakehurst.wiremock.client.WireMock.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest
class AdvisorWireMockIntegrationTest {

    private static final WireMockServer wireMock = new WireMockServer(0);
    private static final AdvisorPrompt PROMPT = new AdvisorPrompt("You are a trading advisor", "GAZP at 170");

    @DynamicPropertySource
    static void registerProperties(DynamicPropertyRegistry registry) {
        registry.add("advisor.api.base-url", () -> "http://localhost:" + wireMock.port() + "/v1");
        registry.add("advisor.api.api-key", () -> "test-key");
    }

    static {
        wireMock.start();
        configureFor("localhost", wireMock.port());
    }

    @AfterAll
    static void stopWireMock() {
        wireMock.stop();
    }

    @Autowired
    private OpenAiAdvisorClient advisorClient;

    @Autowired
    private CircuitBreaker advisorCircuitBreaker;

    @BeforeEach
    void reset() {
        wireMock.resetAll();
        advisorCircuitBreaker.reset();
    }

    @Test
    void returnsMessageContentOfFirstChoice() {
        stubFor(post(urlEqualTo("/v1/chat/completions"))
                .willReturn(okJson("{\"choices\":[{\"message\":{\"role\":\"assistant\","
                        + "\"content\":\"{\\\"action\\\":\\\"HOLD\\\"}\"}}]}")));

        String content = advisorClient.requestRecommendation(PROMPT);

        assertThat(content).isEqualTo("{\"action\":\"HOLD\"}");
        verify(postRequestedFor(urlEqualTo("/v1/chat/completions"))
                .withHeader("Authorization", equalTo("Bearer test-key"))
                .withRequestBody(matchingJsonPath("$.messages[0].role", equalTo("system")))
                .withRequestBody(matchingJsonPath("$.messages[1].content", equalTo("GAZP at 170")))
                .withRequestBody(matchingJsonPath("$.response_format.type", equalTo("json_object"))));
    }

    @Test
    void serverErrorsAndThrottlingAreRetryable() {
        stubFor(post(urlEqualTo("/v1/chat/completions")).willReturn(aResponse().withStatus(503)));
        assertThatThrownBy(() -> advisorClient.requestRecommendation(PROMPT))
                .isInstanceOfSatisfying(AdvisorUnavailableException.class, ex -> assertThat(ex.isRetryable()).isTrue());

        stubFor(post(urlEqualTo("/v1/chat/completions")).willReturn(aResponse().withStatus(429)));
        assertThatThrownBy(() -> advisorClient.requestRecommendation(PROMPT))
                .isInstanceOfSatisfying(AdvisorUnavailableException.class, ex -> assertThat(ex.isRetryable()).isTrue());
    }

    @Test
    void clientErrorsAreNotRetryable() {
        stubFor(post(urlEqualTo("/v1/chat/completions")).willReturn(aResponse().withStatus(400)));

        assertThatThrownBy(() -> advisorClient.requestRecommendation(PROMPT))
                .isInstanceOfSatisfying(AdvisorUnavailableException.class, ex -> assertThat(ex.isRetryable()).isFalse());
    }

    @Test
    void completionWithoutContentIsAResponseError() {
        stubFor(post(urlEqualTo("/v1/chat/completions")).willReturn(okJson("{\"choices\":[]}")));

        assertThatThrownBy(() -> advisorClient.requestRecommendation(PROMPT))
                .isInstanceOfSatisfying(AdvisorResponseException.class, ex -> assertThat(ex.getField()).isEqualTo("choices"));
    }

    @Test
    void openCircuitFailsFastWithoutCallingTheAdvisor() {
        advisorCircuitBreaker.transitionToOpenState();

        assertThatThrownBy(() -> advisorClient.requestRecommendation(PROMPT))
                .isInstanceOfSatisfying(AdvisorUnavailableException.class, ex -> assertThat(ex.isRetryable()).isFalse());
        verify(0, postRequestedFor(urlEqualTo("/v1/chat/completions")));
    }
}
