package com.signalengine.domain.enums;

import com.signalengine.exception.ConfigurationException;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Market a venue belongs to, with its exchange time zone and continuous trading sessions.
 *
 * <p>Each market has its own realtime worker queue ({@code vn}, {@code us}). Sessions are
 * inclusive at both ends:
 * <ul>
 *   <li>VN (HOSE, HNX, UPCOM): 09:00-11:30 and 13:00-15:00 Asia/Ho_Chi_Minh</li>
 *   <li>US (NASDAQ, NYSE): 09:30-16:00 America/New_York</li>
 * </ul>
 */
public enum Market {
    VN(
            ZoneId.of("Asia/Ho_Chi_Minh"),
            Set.of("HOSE", "HNX", "UPCOM"),
            List.of(
                    new Session(LocalTime.of(9, 0), LocalTime.of(11, 30)),
                    new Session(LocalTime.of(13, 0), LocalTime.of(15, 0))),
            "vn"),
    US(
            ZoneId.of("America/New_York"),
            Set.of("NASDAQ", "NYSE"),
            List.of(new Session(LocalTime.of(9, 30), LocalTime.of(16, 0))),
            "us");

    private final ZoneId zoneId;
    private final Set<String> venues;
    private final List<Session> sessions;
    private final String queueName;

    Market(ZoneId zoneId, Set<String> venues, List<Session> sessions, String queueName) {
        this.zoneId = zoneId;
        this.venues = venues;
        this.sessions = sessions;
        this.queueName = queueName;
    }

    public ZoneId getZoneId() {
        return zoneId;
    }

    public Set<String> getVenues() {
        return venues;
    }

    public List<Session> getSessions() {
        return sessions;
    }

    /** Name of the realtime worker queue serving this market. */
    public String getQueueName() {
        return queueName;
    }

    /**
     * Resolves the market of a venue code (case-insensitive).
     *
     * @throws ConfigurationException if the venue belongs to no known market
     */
    public static Market forVenue(String venue) {
        if (venue != null) {
            String normalized = venue.trim().toUpperCase(Locale.ROOT);
            for (Market market : values()) {
                if (market.venues.contains(normalized)) {
                    return market;
                }
            }
        }
        throw new ConfigurationException("Unknown venue: " + venue);
    }

    /** A continuous trading session in exchange-local time. */
    public record Session(LocalTime start, LocalTime end) {

        public boolean contains(LocalTime time) {
            return !time.isBefore(start) && !time.isAfter(end);
        }
    }
}
