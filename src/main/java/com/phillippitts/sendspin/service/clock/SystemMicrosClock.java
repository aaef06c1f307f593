package com.phillippitts.sendspin.service.clock;

import com.phillippitts.sendspin.util.TimeUtils;

/** {@link MicrosClock} backed by {@link System#nanoTime()}. */
public final class SystemMicrosClock implements MicrosClock {

    @Override
    public long nowMicros() {
        return System.nanoTime() / TimeUtils.NANOS_PER_MICRO;
    }
}
