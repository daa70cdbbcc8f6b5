package com.tradeadvisor.backend.service.marketdata;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tradeadvisor.backend.config.MarketDataProperties;
import com.tradeadvisor.backend.model.Candle;
import com.tradeadvisor.backend.trading.pipeline.MarketDataProvider;
import com.tradeadvisor.backend.util.MoneyUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Reads quotes and daily candles from the Moscow Exchange ISS REST API. ISS tables arrive as
 * {@code {"columns": [...], "data": [[...], ...]}} and are decoded by column name.
 */
@Service
@Slf4j
public class MoexMarketDataProvider implements MarketDataProvider {

    private static final ZoneId EXCHANGE_ZONE = ZoneId.of("Europe/Moscow");
    private static final int DAILY_INTERVAL = 24;
    private static final int PAGE_SIZE = 500;

    private final RestTemplate restTemplate;
    private final MarketDataProperties properties;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public MoexMarketDataProvider(@Qualifier("marketDataRestTemplate") RestTemplate restTemplate,
                                  MarketDataProperties properties,
                                  ObjectMapper objectMapper,
                                  Clock clock) {
        this.restTemplate = restTemplate;
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public Optional<BigDecimal> currentPrice(String ticker) {
        Optional<BigDecimal> last = lastTradePrice(ticker);
        if (last.isPresent()) {
            return last;
        }
        // no trades yet today: fall back to the latest close
        List<Candle> candles = dailyCandles(ticker, 10);
        if (candles.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(MoneyUtils.bd(candles.get(candles.size() - 1).getClose()));
    }

    @Override
    public Optional<BigDecimal> lastTradePrice(String ticker) {
        String url = UriComponentsBuilder.fromHttpUrl(properties.getBaseUrl())
                .pathSegment("engines", "stock", "markets", "shares", "boards", properties.getBoard(),
                        "securities", ticker + ".json")
                .queryParam("iss.meta", "off")
                .queryParam("iss.only", "marketdata")
                .queryParam("marketdata.columns", "LAST")
                .toUriString();
        List<Map<String, JsonNode>> rows = table(fetch(url), "marketdata");
        if (!rows.isEmpty()) {
            JsonNode last = rows.get(0).get("LAST");
            if (last != null && last.isNumber() && last.doubleValue() > 0) {
                return Optional.of(MoneyUtils.scale(last.decimalValue()));
            }
        }
        return Optional.empty();
    }

    @Override
    public List<Candle> dailyCandles(String ticker, int days) {
        LocalDate till = LocalDate.now(clock.withZone(EXCHANGE_ZONE));
        LocalDate from = till.minusDays(Math.max(days, 1));
        List<Candle> candles = new ArrayList<>();
        int start = 0;
        while (true) {
            String url = UriComponentsBuilder.fromHttpUrl(properties.getBaseUrl())
                    .pathSegment("engines", "stock", "markets", "shares", "securities", ticker, "candles.json")
                    .queryParam("iss.meta", "off")
                    .queryParam("interval", DAILY_INTERVAL)
                    .queryParam("from", from)
                    .queryParam("till", till)
                    .queryParam("start", start)
                    .toUriString();
            List<Map<String, JsonNode>> rows = table(fetch(url), "candles");
            for (Map<String, JsonNode> row : rows) {
                candles.add(toCandle(row));
            }
            if (rows.size() < PAGE_SIZE) {
                break;
            }
            start += rows.size();
        }
        log.debug("Fetched {} daily candles for {}", candles.size(), ticker);
        return candles;
    }

    private JsonNode fetch(String url) {
        try {
            String body = restTemplate.getForObject(url, String.class);
            if (body == null || body.isBlank()) {
                throw new MarketDataException("Empty response from " + url);
            }
            return objectMapper.readTree(body);
        } catch (RestClientException e) {
            throw new MarketDataException("Market data request failed: " + e.getMessage(), e);
        } catch (JsonProcessingException e) {
            throw new MarketDataException("Market data response is not JSON: " + e.getOriginalMessage(), e);
        }
    }

    private List<Map<String, JsonNode>> table(JsonNode root, String name) {
        JsonNode table = root.path(name);
        JsonNode columns = table.path("columns");
        JsonNode data = table.path("data");
        if (!columns.isArray() || !data.isArray()) {
            throw new MarketDataException("Market data response has no '" + name + "' table");
        }
        List<Map<String, JsonNode>> rows = new ArrayList<>();
        for (JsonNode values : data) {
            Map<String, JsonNode> row = new HashMap<>();
            for (int i = 0; i < columns.size() && i < values.size(); i++) {
                row.put(columns.get(i).asText(), values.get(i));
            }
            rows.add(row);
        }
        return rows;
    }

    private Candle toCandle(Map<String, JsonNode> row) {
        String begin = text(row, "begin");
        return Candle.builder()
                .date(begin == null ? null : LocalDate.parse(begin.substring(0, 10)))
                .open(number(row, "open"))
                .high(number(row, "high"))
                .low(number(row, "low"))
                .close(number(row, "close"))
                .volume((long) number(row, "volume"))
                .build();
    }

    private static double number(Map<String, JsonNode> row, String column) {
        JsonNode node = row.get(column);
        return node == null || node.isNull() ? 0.0 : node.asDouble();
    }

    private static String text(Map<String, JsonNode> row, String column) {
        JsonNode node = row.get(column);
        return node == null || node.isNull() ? null : node.asText();
    }
}
