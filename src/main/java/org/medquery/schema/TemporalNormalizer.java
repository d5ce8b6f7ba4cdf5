package org.medquery.schema;

import lombok.extern.slf4j.Slf4j;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Optional;

/**
 * Normalizes temporal field values by trying an ordered list of parse strategies. A value none of
 * the strategies accepts is returned as {@link TemporalValue.Unparsed} rather than failing the
 * record.
 */
@Slf4j
public final class TemporalNormalizer {

    private static final DateTimeFormatter SPACE_SEPARATED = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private static final List<ParseStrategy> STRATEGIES = List.of(
            TemporalNormalizer::parseWithOffset,
            text -> attempt(() -> LocalDateTime.parse(text, DateTimeFormatter.ISO_LOCAL_DATE_TIME)),
            text -> attempt(() -> LocalDateTime.parse(text, SPACE_SEPARATED)),
            text -> attempt(() -> LocalDate.parse(text, DateTimeFormatter.ISO_LOCAL_DATE).atStartOfDay())
    );

    private TemporalNormalizer() {
    }

    public static TemporalValue normalize(Object value) {
        if (value instanceof TemporalValue temporal) {
            return temporal;
        }
        if (value instanceof LocalDateTime dateTime) {
            return new TemporalValue.Parsed(dateTime);
        }
        String raw = value.toString();
        String trimmed = raw.trim();
        for (ParseStrategy strategy : STRATEGIES) {
            Optional<LocalDateTime> parsed = strategy.parse(trimmed);
            if (parsed.isPresent()) {
                return new TemporalValue.Parsed(parsed.get());
            }
        }
        log.warn("Keeping unparsable temporal value as raw text");
        return new TemporalValue.Unparsed(raw);
    }

    // Offset timestamps (including a trailing Z) are stored as UTC wall-clock time.
    private static Optional<LocalDateTime> parseWithOffset(String text) {
        return attempt(() -> OffsetDateTime.parse(text, DateTimeFormatter.ISO_OFFSET_DATE_TIME)
                .withOffsetSameInstant(ZoneOffset.UTC)
                .toLocalDateTime());
    }

    private static Optional<LocalDateTime> attempt(ParseAttempt attempt) {
        try {
            return Optional.of(attempt.run());
        } catch (DateTimeParseException exception) {
            return Optional.empty();
        }
    }

    @FunctionalInterface
    interface ParseStrategy {
        Optional<LocalDateTime> parse(String text);
    }

    @FunctionalInterface
    private interface ParseAttempt {
        LocalDateTime run();
    }
}
