package com.signalengine.calendar;

import com.signalengine.config.SignalEngineProperties;
import com.signalengine.domain.enums.Market;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZonedDateTime;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import org.springframework.stereotype.Service;

/**
 * Trading hours of each market in its exchange time zone.
 *
 * <p>A market is open when the exchange-local date is a trading day (not a weekend, not a
 * configured full holiday) and the local time falls inside one of its sessions.
 * Holidays come from {@code signalengine.calendar.holidays.<MARKET>} and are updated
 * yearly from the exchanges' published calendars.
 */
@Service
public class MarketCalendarService {

    private final Map<Market, Set<LocalDate>> holidays;

    public MarketCalendarService(SignalEngineProperties properties) {
        Map<Market, Set<LocalDate>> loaded = new EnumMap<>(Market.class);
        properties.getCalendar().getHolidays().forEach((market, dates) -> loaded.put(
                Market.valueOf(market.trim().toUpperCase(Locale.ROOT)), Set.copyOf(dates)));
        this.holidays = Collections.unmodifiableMap(loaded);
    }

    public boolean isMarketOpen(Market market, Instant instant) {
        ZonedDateTime local = instant.atZone(market.getZoneId());
        if (!isTradingDay(market, local.toLocalDate())) {
            return false;
        }
        return market.getSessions().stream().anyMatch(session -> session.contains(local.toLocalTime()));
    }

    /** Weekends and configured full holidays are not trading days. */
    public boolean isTradingDay(Market market, LocalDate date) {
        DayOfWeek dow = date.getDayOfWeek();
        if (dow == DayOfWeek.SATURDAY || dow == DayOfWeek.SUNDAY) {
            return false;
        }
        return !holidays.getOrDefault(market, Set.of()).contains(date);
    }

    /** Markets open at the given instant. */
    public Set<Market> openMarkets(Instant instant) {
        return Arrays.stream(Market.values())
                .filter(market -> isMarketOpen(market, instant))
                .collect(Collectors.toSet());
    }
}
