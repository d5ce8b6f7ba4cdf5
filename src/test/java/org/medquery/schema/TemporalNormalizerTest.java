package org.medquery.schema;

import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;

class TemporalNormalizerTest {

    @Test
    void parsesIsoLocalDateTime() {
        assertEquals(new TemporalValue.Parsed(LocalDateTime.of(2180, 7, 23, 12, 35)),
                TemporalNormalizer.normalize("2180-07-23T12:35:00"));
    }

    @Test
    void parsesSpaceSeparatedDateTime() {
        assertEquals(new TemporalValue.Parsed(LocalDateTime.of(2180, 7, 23, 12, 35, 10)),
                TemporalNormalizer.normalize("2180-07-23 12:35:10"));
    }

    @Test
    void offsetTimestampsAreConvertedToUtc() {
        assertEquals(new TemporalValue.Parsed(LocalDateTime.of(2180, 7, 23, 10, 35)),
                TemporalNormalizer.normalize("2180-07-23T12:35:00+02:00"));
        assertEquals(new TemporalValue.Parsed(LocalDateTime.of(2180, 7, 23, 12, 35)),
                TemporalNormalizer.normalize("2180-07-23T12:35:00Z"));
    }

    @Test
    void dateOnlyBecomesStartOfDay() {
        assertEquals(new TemporalValue.Parsed(LocalDateTime.of(2180, 7, 23, 0, 0)),
                TemporalNormalizer.normalize(" 2180-07-23 "));
    }

    @Test
    void unparsableValueIsKeptRaw() {
        TemporalValue value = TemporalNormalizer.normalize("last tuesday");
        TemporalValue.Unparsed unparsed = assertInstanceOf(TemporalValue.Unparsed.class, value);
        assertEquals("last tuesday", unparsed.raw());
        assertEquals("last tuesday", unparsed.storageValue());
    }

    @Test
    void replayValueParsesBackToTheSameTimestamp() {
        TemporalValue first = TemporalNormalizer.normalize("2180-07-23 12:00:00");
        assertEquals(first, TemporalNormalizer.normalize(first.replayValue()));
    }
}
