/*
 * Copyright Stereo Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.stereo.server.internal.util;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.Timer;

/**
 * Meters of the session engine, registered in the global registry.
 */
public class Metrics {

    private static final String SESSIONS_OPENED = "stereo_sessions_opened";
    private static final String SESSIONS_CLOSED = "stereo_sessions_closed";
    private static final String SESSION_FAULTS = "stereo_session_faults";
    private static final String DECODE_ERRORS = "stereo_decode_errors";
    private static final String HANDLER_FAULTS = "stereo_handler_faults";
    private static final String EVENTS_FLUSHED = "stereo_events_flushed";
    private static final String FLUSH_DURATION = "stereo_flush_duration";

    private static final String COMMAND_LABEL = "command";

    private Metrics() {
    }

    public static Meter.MeterProvider<Counter> sessionsOpenedCounter() {
        return Counter.builder(SESSIONS_OPENED)
                .description("Sessions opened since startup")
                .withRegistry(io.micrometer.core.instrument.Metrics.globalRegistry);
    }

    public static Meter.MeterProvider<Counter> sessionsClosedCounter() {
        return Counter.builder(SESSIONS_CLOSED)
                .description("Sessions torn down since startup")
                .withRegistry(io.micrometer.core.instrument.Metrics.globalRegistry);
    }

    public static Meter.MeterProvider<Counter> sessionFaultCounter() {
        return Counter.builder(SESSION_FAULTS)
                .description("Sessions torn down because an activity failed")
                .withRegistry(io.micrometer.core.instrument.Metrics.globalRegistry);
    }

    public static Meter.MeterProvider<Counter> decodeErrorCounter() {
        return Counter.builder(DECODE_ERRORS)
                .description("Client frames dropped because they could not be decoded")
                .withRegistry(io.micrometer.core.instrument.Metrics.globalRegistry);
    }

    /**
     * Handler faults, tagged with the tag of the failing command.
     */
    public static Counter handlerFaultCounter(String command) {
        return Counter.builder(HANDLER_FAULTS)
                .description("Commands whose handler failed")
                .tag(COMMAND_LABEL, command)
                .register(io.micrometer.core.instrument.Metrics.globalRegistry);
    }

    public static Meter.MeterProvider<Counter> eventsFlushedCounter() {
        return Counter.builder(EVENTS_FLUSHED)
                .description("Events written to clients")
                .withRegistry(io.micrometer.core.instrument.Metrics.globalRegistry);
    }

    public static Meter.MeterProvider<Timer> flushTimer() {
        return Timer.builder(FLUSH_DURATION)
                .description("Time taken to encode and write one batch of events")
                .withRegistry(io.micrometer.core.instrument.Metrics.globalRegistry);
    }
}
