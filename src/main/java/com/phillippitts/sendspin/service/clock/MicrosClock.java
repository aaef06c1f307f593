package com.phillippitts.sendspin.service.clock;

/**
 * Monotonic local time source in microseconds.
 *
 * <p>Only differences between readings are meaningful; the epoch is arbitrary.
 */
@FunctionalInterface
public interface MicrosClock {

    long nowMicros();
}
