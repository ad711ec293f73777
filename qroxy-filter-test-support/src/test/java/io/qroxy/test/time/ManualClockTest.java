/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.qroxy.test.time;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ManualClockTest {

    private static final Instant START = Instant.parse("2024-01-15T10:00:00Z");

    @Test
    void onlyMovesWhenAdvanced() {
        var clock = new ManualClock(START);
        assertThat(clock.instant()).isEqualTo(START);
        clock.advance(Duration.ofSeconds(5)).advanceMillis(250);
        assertThat(clock.instant()).isEqualTo(START.plusMillis(5250));
    }

    @Test
    void withZoneKeepsInstant() {
        var zone = ZoneId.of("Europe/Paris");
        var clock = new ManualClock(START).withZone(zone);
        assertThat(clock.getZone()).isEqualTo(zone);
        assertThat(clock.instant()).isEqualTo(START);
    }
}
