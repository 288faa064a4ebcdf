package solcore.config;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;

/**
 * Closed UTC interval [start, end] written as "start/end".
 */
public record TimeWindow(Instant start, Instant end) {

    public TimeWindow {
        if (start == null || end == null) throw new IllegalArgumentException("time window bounds must not be null");
        if (end.isBefore(start)) {
            throw new IllegalArgumentException("time window ends before it starts: " + start + "/" + end);
        }
    }

    public static TimeWindow parse(String text) {
        if (text == null) throw new IllegalArgumentException("time window must not be null");
        String[] parts = text.split("/");
        if (parts.length != 2) {
            throw new IllegalArgumentException("time window must be 'start/end': " + text);
        }
        return new TimeWindow(parseUtc(parts[0]), parseUtc(parts[1]));
    }

    /**
     * ISO-8601 instant or offset date-time; a local date-time without offset is read as UTC.
     */
    public static Instant parseUtc(String text) {
        String s = text.trim();
        try {
            return LocalDateTime.parse(s).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException notLocal) {
            try {
                return OffsetDateTime.parse(s).toInstant();
            } catch (DateTimeParseException e) {
                throw new IllegalArgumentException("Unparseable timestamp: " + text, e);
            }
        }
    }

    public boolean contains(Instant t) {
        return !t.isBefore(start) && !t.isAfter(end);
    }

    @Override
    public String toString() {
        return start + "/" + end;
    }
}
