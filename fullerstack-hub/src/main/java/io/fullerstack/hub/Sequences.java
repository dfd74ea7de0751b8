package io.fullerstack.hub;

import lombok.experimental.UtilityClass;

/**
 * Serial-number arithmetic for hub sequence numbers.
 *
 * <p>Sequence numbers are signed 64-bit counters that are allowed to wrap from
 * {@link Long#MAX_VALUE} to {@link Long#MIN_VALUE}. Ordering is decided by the
 * sign of the wrapped difference, so a value just past the wrap is still newer
 * than one just before it. Two sequences more than 2^63 apart cannot be ordered;
 * a hub never has that many values in flight.
 */
@UtilityClass
public class Sequences {

    /**
     * @param candidate sequence of an incoming value
     * @param last      sequence of the last accepted value
     * @return true if {@code candidate} was assigned after {@code last}
     */
    public boolean isNewer(long candidate, long last) {
        return candidate - last > 0;
    }

    /**
     * @return the sequence following {@code sequence}, wrapping at {@link Long#MAX_VALUE}
     */
    public long next(long sequence) {
        return sequence + 1;
    }
}
