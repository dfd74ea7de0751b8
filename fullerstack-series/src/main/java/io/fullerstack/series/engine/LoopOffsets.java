package io.fullerstack.series.engine;

import java.time.Duration;
import java.time.Instant;

/**
 * Offset arithmetic for replaying the recorded window {@code [earliest, latest]}
 * outside its bounds. Every offset is a whole multiple of the window duration.
 */
final class LoopOffsets {

    private LoopOffsets() {
    }

    /**
     * @return the offset whose shifted window starts at or before {@code t} and
     * ends after it: {@code floor((t - earliest) / period) * period}
     */
    static Duration anchoring(Instant earliest, Duration period, Instant t) {
        return period.multipliedBy(floorDiv(Duration.between(earliest, t), period));
    }

    /**
     * Steps the window forward (or back) a whole period at a time until {@code t}
     * is inside it.
     *
     * @return zero when {@code t} is already inside the window
     */
    static Duration stepping(Instant earliest, Instant latest, Duration period, Instant t) {
        if (t.isAfter(latest)) {
            return period.multipliedBy(ceilDiv(Duration.between(latest, t), period));
        }
        if (t.isBefore(earliest)) {
            return period.multipliedBy(ceilDiv(Duration.between(t, earliest), period)).negated();
        }
        return Duration.ZERO;
    }

    static long floorDiv(Duration dividend, Duration divisor) {
        long quotient = dividend.dividedBy(divisor);
        if (dividend.isNegative() && !divisor.multipliedBy(quotient).equals(dividend)) {
            quotient--;
        }
        return quotient;
    }

    /**
     * @param dividend non-negative
     */
    static long ceilDiv(Duration dividend, Duration divisor) {
        long quotient = dividend.dividedBy(divisor);
        if (!divisor.multipliedBy(quotient).equals(dividend)) {
            quotient++;
        }
        return quotient;
    }
}
