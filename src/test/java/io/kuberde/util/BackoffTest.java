package io.kuberde.util;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Duration;

final class BackoffTest {

    @Test
    void doublesUntilCapped() {
        Backoff backoff = Backoff.of(1_000L, 30_000L, 2.0d);
        Assertions.assertEquals(Duration.ofSeconds(1), backoff.delayForAttempt(0));
        Assertions.assertEquals(Duration.ofSeconds(2), backoff.delayForAttempt(1));
        Assertions.assertEquals(Duration.ofSeconds(16), backoff.delayForAttempt(4));
        Assertions.assertEquals(Duration.ofSeconds(30), backoff.delayForAttempt(5));
        Assertions.assertEquals(Duration.ofSeconds(30), backoff.delayForAttempt(500));
        Assertions.assertEquals(Duration.ofSeconds(1), backoff.delayForAttempt(-3));
    }

    @Test
    void rejectsInvertedBounds() {
        Assertions.assertThrows(IllegalArgumentException.class, () -> Backoff.of(5_000L, 1_000L, 2.0d));
        Assertions.assertThrows(IllegalArgumentException.class, () -> Backoff.of(0L, 1_000L, 2.0d));
        Assertions.assertThrows(IllegalArgumentException.class, () -> Backoff.of(100L, 1_000L, 0.5d));
    }
}
