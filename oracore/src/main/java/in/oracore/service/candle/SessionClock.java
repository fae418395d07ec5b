package in.oracore.service.candle;

import in.oracore.domain.signal.SessionFlag;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;

/**
 * Session Clock - US equity session boundaries.
 *
 * Regular session: 09:30 - 16:00 America/New_York. Bars opening before 09:30 are
 * pre-market, bars opening at or after 16:00 are after-hours. Daylight saving is
 * handled by the zone rules.
 */
public final class SessionClock {
    private static final ZoneId NEW_YORK = ZoneId.of("America/New_York");

    private static final LocalTime SESSION_START = LocalTime.of(9, 30);
    private static final LocalTime SESSION_END = LocalTime.of(16, 0);

    public static Instant getSessionStart(LocalDate date) {
        return ZonedDateTime.of(date, SESSION_START, NEW_YORK).toInstant();
    }

    public static Instant getSessionEnd(LocalDate date) {
        return ZonedDateTime.of(date, SESSION_END, NEW_YORK).toInstant();
    }

    /**
     * New York calendar date of a timestamp. Session VWAP resets when this changes.
     */
    public static LocalDate sessionDate(Instant timestamp) {
        return timestamp.atZone(NEW_YORK).toLocalDate();
    }

    public static SessionFlag sessionFlag(Instant barOpen) {
        LocalDate date = sessionDate(barOpen);
        if (barOpen.isBefore(getSessionStart(date))) {
            return SessionFlag.PRE;
        }
        if (barOpen.isBefore(getSessionEnd(date))) {
            return SessionFlag.REGULAR;
        }
        return SessionFlag.AFTER;
    }

    private SessionClock() {}
}
