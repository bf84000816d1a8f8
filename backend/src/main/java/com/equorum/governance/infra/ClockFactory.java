package com.equorum.governance.infra;

import io.micronaut.context.annotation.Factory;
import jakarta.inject.Singleton;

import java.time.Clock;

/**
 * Wall-clock source for every time comparison in the service (voting windows,
 * lock age, timelock readiness and expiry).
 *
 * Tests replace this bean with a manually advanced clock.
 */
@Factory
public class ClockFactory {

    @Singleton
    public Clock clock() {
        return Clock.systemUTC();
    }
}
