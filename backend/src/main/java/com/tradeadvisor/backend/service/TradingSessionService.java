package com.tradeadvisor.backend.service;

import com.tradeadvisor.backend.config.SessionProperties;
import com.tradeadvisor.backend.trading.pipeline.SessionClock;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;

@Service
public class TradingSessionService {

    private static final DateTimeFormatter SESSION_FORMAT = DateTimeFormatter.ofPattern("HH:mm");

    private final SessionProperties sessionProperties;

    public TradingSessionService(SessionProperties sessionProperties) {
        this.sessionProperties = sessionProperties;
    }

    public SessionClock clockAt(Instant nowUtc) {
        ZoneId zone = zone();
        ZonedDateTime now = nowUtc.atZone(zone);
        LocalTime time = now.toLocalTime();
        LocalTime open = LocalTime.parse(sessionProperties.getOpen(), SESSION_FORMAT);
        LocalTime close = LocalTime.parse(sessionProperties.getClose(), SESSION_FORMAT);

        long sinceOpen = Duration.between(open, time).toMinutes();
        long untilClose = Duration.between(time, close).toMinutes();
        boolean isOpen = !time.isBefore(open) && time.isBefore(close);
        return new SessionClock(isOpen, sinceOpen, untilClose);
    }

    /**
     * Midnight of the exchange-local day containing {@code nowUtc}; daily limits count from here.
     */
    public Instant startOfTradingDay(Instant nowUtc) {
        return nowUtc.atZone(zone()).toLocalDate().atStartOfDay(zone()).toInstant();
    }

    public ZoneId zone() {
        return ZoneId.of(sessionProperties.getTimezone());
    }
}
