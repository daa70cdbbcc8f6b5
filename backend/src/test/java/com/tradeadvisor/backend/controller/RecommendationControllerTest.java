package com.tradeadvisor.backend.controller;

import com.jayway.jsonpath.JsonPath;
import com.tradeadvisor.backend.config.AdvisorProperties;
import com.tradeadvisor.backend.config.OpenApiConfig;
import com.tradeadvisor.backend.service.ContextBuilder;
import com.tradeadvisor.backend.trading.pipeline.AdvisorClient;
import com.tradeadvisor.backend.trading.pipeline.MarketDataProvider;
import com.tradeadvisor.backend.util.TestFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class RecommendationControllerTest {

    private static final String VALID_BUY = "{\"action\":\"BUY\",\"quantity\":100,\"price\":170,"
            + "\"stop_loss\":160,\"take_profit\":190,\"reasoning\":\"Trend resumes\",\"risk_level\":\"MEDIUM\","
            + "\"confidence\":75,\"time_horizon\":\"2 weeks\",\"key_factors\":[\"MACD cross\"]}";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @Autowired
    private AdvisorProperties advisorProperties;

    @MockBean
    private AdvisorClient advisorClient;

    @MockBean
    private ContextBuilder contextBuilder;

    @MockBean
    private MarketDataProvider marketDataProvider;

    @BeforeEach
    void setup() {
        TestFixtures.clearDatabase(jdbcTemplate);
        when(contextBuilder.build(anyLong(), anyString())).thenAnswer(invocation ->
                TestFixtures.analysisContext(invocation.getArgument(0), 25.0, "170", List.of()));
        when(advisorClient.requestRecommendation(any())).thenReturn(VALID_BUY);
    }

    @Test
    void requestConfirmAndInspectPortfolio() throws Exception {
        openAccount(701L);

        String body = mockMvc.perform(post("/api/recommendations")
                        .header(OpenApiConfig.USER_ID_HEADER, 701L)
                        .param("ticker", "GAZP"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.recommendation.action").value("BUY"))
                .andExpect(jsonPath("$.recommendation.quantity").value(100))
                .andExpect(jsonPath("$.recommendation.status").value("PENDING"))
                .andExpect(jsonPath("$.recommendation.source").value("ADVISOR"))
                .andExpect(jsonPath("$.execution").isEmpty())
                .andReturn().getResponse().getContentAsString();
        Integer id = JsonPath.read(body, "$.recommendation.id");

        mockMvc.perform(post("/api/recommendations/{id}/confirm", id).header(OpenApiConfig.USER_ID_HEADER, 701L))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.executed").value(true))
                .andExpect(jsonPath("$.transaction.shares").value(100))
                .andExpect(jsonPath("$.transaction.action").value("BUY"));

        mockMvc.perform(post("/api/recommendations/{id}/confirm", id).header(OpenApiConfig.USER_ID_HEADER, 701L))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.executed").value(false))
                .andExpect(jsonPath("$.reason").value("ALREADY_RESOLVED"));

        mockMvc.perform(get("/api/portfolio").header(OpenApiConfig.USER_ID_HEADER, 701L))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.positions[0].ticker").value("GAZP"))
                .andExpect(jsonPath("$.positions[0].shares").value(100));

        mockMvc.perform(get("/api/recommendations/{id}", id).header(OpenApiConfig.USER_ID_HEADER, 701L))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("CONFIRMED"));
    }

    @Test
    void rejectedRecommendationCannotBeConfirmed() throws Exception {
        openAccount(703L);
        String body = mockMvc.perform(post("/api/recommendations").header(OpenApiConfig.USER_ID_HEADER, 703L))
                .andExpect(status().isOk())
                .andReturn().getResponse().getContentAsString();
        Integer id = JsonPath.read(body, "$.recommendation.id");

        mockMvc.perform(post("/api/recommendations/{id}/reject", id).header(OpenApiConfig.USER_ID_HEADER, 703L))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("REJECTED"));

        mockMvc.perform(post("/api/recommendations/{id}/confirm", id).header(OpenApiConfig.USER_ID_HEADER, 703L))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.reason").value("ALREADY_RESOLVED"));

        mockMvc.perform(get("/api/recommendations").header(OpenApiConfig.USER_ID_HEADER, 703L))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].id").value(id));
    }

    @Test
    void historyDefaultsToConfiguredLimit() throws Exception {
        openAccount(706L);
        for (int i = 0; i < 3; i++) {
            mockMvc.perform(post("/api/recommendations").header(OpenApiConfig.USER_ID_HEADER, 706L))
                    .andExpect(status().isOk());
        }
        int configured = advisorProperties.getRecommendation().getHistoryLimit();
        advisorProperties.getRecommendation().setHistoryLimit(2);
        try {
            mockMvc.perform(get("/api/recommendations").header(OpenApiConfig.USER_ID_HEADER, 706L))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.length()").value(2));

            mockMvc.perform(get("/api/recommendations").header(OpenApiConfig.USER_ID_HEADER, 706L).param("limit", "3"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.length()").value(3));
        } finally {
            advisorProperties.getRecommendation().setHistoryLimit(configured);
        }
    }

    @Test
    void autoConfirmExecutesImmediately() throws Exception {
        openAccount(702L);

        mockMvc.perform(put("/api/settings")
                        .header(OpenApiConfig.USER_ID_HEADER, 702L)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"autoConfirm\":true}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.autoConfirm").value(true));

        mockMvc.perform(post("/api/recommendations").header(OpenApiConfig.USER_ID_HEADER, 702L).param("ticker", "GAZP"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.execution.executed").value(true))
                .andExpect(jsonPath("$.recommendation.status").value("CONFIRMED"));
    }

    @Test
    void invalidSettingsAreRejected() throws Exception {
        mockMvc.perform(put("/api/settings")
                        .header(OpenApiConfig.USER_ID_HEADER, 704L)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"stopLossPct\":1.5}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("VALIDATION_FAILED"));
    }

    @Test
    void missingUserHeaderAndUnknownIdsMapToErrors() throws Exception {
        mockMvc.perform(get("/api/portfolio"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("BAD_REQUEST"));

        openAccount(705L);
        mockMvc.perform(get("/api/recommendations/{id}", 999999L).header(OpenApiConfig.USER_ID_HEADER, 705L))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.errorCode").value("NOT_FOUND"));

        mockMvc.perform(post("/api/portfolio")
                        .header(OpenApiConfig.USER_ID_HEADER, 705L)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isConflict());
    }

    private void openAccount(Long userId) throws Exception {
        mockMvc.perform(post("/api/portfolio")
                        .header(OpenApiConfig.USER_ID_HEADER, userId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"username\":\"trader" + userId + "\",\"initialCapital\":100000}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.userId").value(userId.intValue()));
    }
}
