package com.tradeadvisor.backend.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tradeadvisor.backend.exception.AdvisorResponseException;
import com.tradeadvisor.backend.model.RecommendationSource;
import com.tradeadvisor.backend.model.RiskLevel;
import com.tradeadvisor.backend.model.TradeAction;
import com.tradeadvisor.backend.trading.pipeline.TradeProposal;
import com.tradeadvisor.backend.util.MoneyUtils;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns the advisor's free text into a {@link TradeProposal}. Strict JSON is tried first; failing that,
 * markdown fences are stripped and the first balanced object is cut out of the surrounding prose.
 * The result is schema-checked field by field and the first offending field is reported.
 */
@Component
@RequiredArgsConstructor
public class ResponseValidator {

    private static final Pattern CODE_FENCE = Pattern.compile("```(?:json|JSON)?\\s*(.*?)```", Pattern.DOTALL);

    private final ObjectMapper objectMapper;

    public TradeProposal parse(String rawText) {
        if (rawText == null || rawText.isBlank()) {
            throw new AdvisorResponseException("body", "empty response");
        }
        JsonNode root = readObject(rawText.trim())
                .or(() -> recover(rawText))
                .orElseThrow(() -> new AdvisorResponseException("body", "no JSON object found in response"));
        return toProposal(root);
    }

    private Optional<JsonNode> recover(String rawText) {
        Matcher fence = CODE_FENCE.matcher(rawText);
        if (fence.find()) {
            Optional<JsonNode> fenced = readObject(fence.group(1).trim());
            if (fenced.isPresent()) {
                return fenced;
            }
        }
        return extractFirstObject(rawText).flatMap(this::readObject);
    }

    private Optional<JsonNode> readObject(String candidate) {
        try {
            JsonNode node = objectMapper.readTree(candidate);
            return node != null && node.isObject() ? Optional.of(node) : Optional.empty();
        } catch (JsonProcessingException e) {
            return Optional.empty();
        }
    }

    /**
     * Cuts the first balanced {@code {...}} out of {@code text}, ignoring braces inside string literals.
     */
    static Optional<String> extractFirstObject(String text) {
        int start = text.indexOf('{');
        while (start >= 0) {
            int depth = 0;
            boolean inString = false;
            boolean escaped = false;
            for (int i = start; i < text.length(); i++) {
                char c = text.charAt(i);
                if (inString) {
                    if (escaped) {
                        escaped = false;
                    } else if (c == '\\') {
                        escaped = true;
                    } else if (c == '"') {
                        inString = false;
                    }
                    continue;
                }
                if (c == '"') {
                    inString = true;
                } else if (c == '{') {
                    depth++;
                } else if (c == '}') {
                    depth--;
                    if (depth == 0) {
                        return Optional.of(text.substring(start, i + 1));
                    }
                }
            }
            start = text.indexOf('{', start + 1);
        }
        return Optional.empty();
    }

    private TradeProposal toProposal(JsonNode root) {
        TradeAction action = enumField(root, "action", TradeAction.class);
        int quantity = quantity(root, action);
        BigDecimal price = requiredPositive(root, "price");
        int confidence = integerField(root, "confidence");
        if (confidence < 0 || confidence > 100) {
            throw new AdvisorResponseException("confidence", "must be between 0 and 100, got " + confidence);
        }
        RiskLevel riskLevel = enumField(root, "risk_level", RiskLevel.class);
        BigDecimal stopLoss = optionalDecimal(root, "stop_loss");
        BigDecimal takeProfit = optionalDecimal(root, "take_profit");

        if (action == TradeAction.BUY) {
            if (stopLoss == null || stopLoss.compareTo(price) >= 0) {
                throw new AdvisorResponseException("stop_loss", "BUY requires stop_loss below price");
            }
            if (takeProfit == null || takeProfit.compareTo(price) <= 0) {
                throw new AdvisorResponseException("take_profit", "BUY requires take_profit above price");
            }
        } else if (action == TradeAction.SELL) {
            if (stopLoss != null && stopLoss.signum() <= 0) {
                throw new AdvisorResponseException("stop_loss", "must be positive");
            }
            if (takeProfit != null && takeProfit.signum() <= 0) {
                throw new AdvisorResponseException("take_profit", "must be positive");
            }
        }

        return TradeProposal.builder()
                .action(action)
                .quantity(quantity)
                .price(price)
                .stopLoss(stopLoss)
                .takeProfit(takeProfit)
                .reasoning(optionalText(root, "reasoning"))
                .riskLevel(riskLevel)
                .confidence(confidence)
                .timeHorizon(optionalText(root, "time_horizon"))
                .keyFactors(keyFactors(root))
                .source(RecommendationSource.ADVISOR)
                .build();
    }

    private int quantity(JsonNode root, TradeAction action) {
        JsonNode node = root.get("quantity");
        if (node == null || node.isNull()) {
            if (action == TradeAction.HOLD) {
                return 0;
            }
            throw new AdvisorResponseException("quantity", "is required for " + action);
        }
        int quantity = integerField(root, "quantity");
        if (quantity < 0) {
            throw new AdvisorResponseException("quantity", "must not be negative");
        }
        if (action != TradeAction.HOLD && quantity == 0) {
            throw new AdvisorResponseException("quantity", "must be greater than zero for " + action);
        }
        return quantity;
    }

    private <E extends Enum<E>> E enumField(JsonNode root, String field, Class<E> type) {
        JsonNode node = root.get(field);
        if (node == null || !node.isTextual()) {
            throw new AdvisorResponseException(field, "is required");
        }
        try {
            return Enum.valueOf(type, node.asText().trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new AdvisorResponseException(field, "unknown value '" + node.asText() + "'");
        }
    }

    private int integerField(JsonNode root, String field) {
        BigDecimal value = decimal(root.get(field), field);
        if (value == null) {
            throw new AdvisorResponseException(field, "is required");
        }
        try {
            return value.stripTrailingZeros().intValueExact();
        } catch (ArithmeticException e) {
            throw new AdvisorResponseException(field, "must be an integer, got " + value.toPlainString());
        }
    }

    private BigDecimal requiredPositive(JsonNode root, String field) {
        BigDecimal value = decimal(root.get(field), field);
        if (value == null) {
            throw new AdvisorResponseException(field, "is required");
        }
        if (value.signum() <= 0) {
            throw new AdvisorResponseException(field, "must be greater than zero");
        }
        return MoneyUtils.scale(value);
    }

    private BigDecimal optionalDecimal(JsonNode root, String field) {
        BigDecimal value = decimal(root.get(field), field);
        return value == null ? null : MoneyUtils.scale(value);
    }

    private BigDecimal decimal(JsonNode node, String field) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isNumber()) {
            return node.decimalValue();
        }
        if (node.isTextual()) {
            try {
                return new BigDecimal(node.asText().trim());
            } catch (NumberFormatException e) {
                throw new AdvisorResponseException(field, "not a number: '" + node.asText() + "'");
            }
        }
        throw new AdvisorResponseException(field, "not a number");
    }

    private String optionalText(JsonNode root, String field) {
        JsonNode node = root.get(field);
        return node == null || node.isNull() ? null : node.asText();
    }

    private List<String> keyFactors(JsonNode root) {
        JsonNode node = root.get("key_factors");
        List<String> factors = new ArrayList<>();
        if (node == null || node.isNull()) {
            return factors;
        }
        if (node.isArray()) {
            node.forEach(item -> factors.add(item.asText()));
        } else {
            factors.add(node.asText());
        }
        return factors;
    }
}
