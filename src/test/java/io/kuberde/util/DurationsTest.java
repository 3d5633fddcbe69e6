package io.kuberde.util;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Duration;

final class DurationsTest {

    @Test
    void parsesCompoundAndIsoForms() {
        Assertions.assertEquals(Duration.ofSeconds(30), Durations.parse("30s"));
        Assertions.assertEquals(Duration.ofHours(8), Durations.parse("8h"));
        Assertions.assertEquals(Duration.ofMinutes(90), Durations.parse("1h30m"));
        Assertions.assertEquals(Duration.ofMillis(250), Durations.parse("250ms"));
        Assertions.assertEquals(Duration.ofMillis(1500), Durations.parse("1.5s"));
        Assertions.assertEquals(Duration.ofHours(8), Durations.parse("PT8H"));
        Assertions.assertEquals(Duration.ZERO, Durations.parse("0"));
    }

    @Test
    void rejectsGarbageAndFallsBackOnBlank() {
        Assertions.assertThrows(IllegalArgumentException.class, () -> Durations.parse("8 hours"));
        Assertions.assertThrows(IllegalArgumentException.class, () -> Durations.parse("h"));
        Assertions.assertThrows(IllegalArgumentException.class, () -> Durations.parse("10x"));
        Assertions.assertThrows(IllegalArgumentException.class, () -> Durations.parse("PTXH"));
        Assertions.assertEquals(Duration.ofSeconds(5), Durations.parseOrDefault("  ", Duration.ofSeconds(5)));
    }

    @Test
    void formatsCompactly() {
        Assertions.assertEquals("1h30m", Durations.format(Duration.ofMinutes(90)));
        Assertions.assertEquals("250ms", Durations.format(Duration.ofMillis(250)));
    }
}
