package org.decide.authentication.shared.helpers;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;

public class NowHelper {

    private static final NowClock clock = new NowClock(Clock.systemUTC());

    private NowHelper() {}

    public static Instant now() {
        return clock.now();
    }

    public static Instant nowPlus(long amount, ChronoUnit unit) {
        return clock.nowPlus(amount, unit);
    }

    public static class NowClock {
        private final Clock clock;

        public NowClock(Clock clock) {
            this.clock = clock;
        }

        public Instant now() {
            return clock.instant();
        }

        public Instant nowPlus(long amount, ChronoUnit unit) {
            return clock.instant().plus(amount, unit);
        }
    }
}
