package com.daniel.feedarr.feed;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.springframework.util.StringUtils;

// ReleaseDate turns the media server's date strings (inCinemas, digitalRelease, added, ...) into an instant.
// Values without an offset are read as UTC; values that do not parse are treated as absent.
public record ReleaseDate(Instant instant) {

    // Fallback for noisy values such as "2024-05-01 (estimated)".
    private static final Pattern DATE_PATTERN = Pattern.compile(
            "(?<!\\d)(19\\d{2}|20\\d{2}|2100)-(0[1-9]|1[0-2])-(0[1-9]|[12]\\d|3[01])(?!\\d)"
    );

    public LocalDate toUtcDate() {
        return instant.atOffset(ZoneOffset.UTC).toLocalDate();
    }

    // ISO yyyy-MM-dd, used for the human-readable date paragraphs.
    public String toIsoDate() {
        return toUtcDate().toString();
    }

    public static Optional<ReleaseDate> parse(String rawValue) {
        if (!StringUtils.hasText(rawValue)) {
            return Optional.empty();
        }
        String value = rawValue.trim();

        return tryParse(() -> OffsetDateTime.parse(value).toInstant())
                .or(() -> tryParse(() -> LocalDateTime.parse(value).toInstant(ZoneOffset.UTC)))
                .map(ReleaseDate::new)
                .or(() -> parseDate(value));
    }

    private static Optional<Instant> tryParse(Supplier<Instant> parser) {
        try {
            return Optional.of(parser.get());
        } catch (DateTimeParseException ex) {
            return Optional.empty();
        }
    }

    private static Optional<ReleaseDate> parseDate(String value) {
        Matcher matcher = DATE_PATTERN.matcher(value);
        if (!matcher.find()) {
            return Optional.empty();
        }
        try {
            LocalDate date = LocalDate.of(
                    Integer.parseInt(matcher.group(1)),
                    Integer.parseInt(matcher.group(2)),
                    Integer.parseInt(matcher.group(3)));
            return Optional.of(new ReleaseDate(date.atStartOfDay().toInstant(ZoneOffset.UTC)));
        } catch (DateTimeException ex) {
            return Optional.empty();
        }
    }
}
