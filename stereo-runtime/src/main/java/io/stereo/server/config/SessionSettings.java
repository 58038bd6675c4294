/*
 * Copyright Stereo Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.stereo.server.config;

import java.time.Duration;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Tuning of the per connection session engine.
 *
 * @param queueCapacity capacity of each session's inbound and outbound queues
 * @param batchSize events per outbound frame at most
 * @param batchDelay longest time an event waits for its frame to fill
 * @param debounceQuietPeriod time collection changes are gathered before the client is told
 * @param inboundHighWatermark buffered client frames at which reading from the socket pauses
 * @param inboundLowWatermark buffered client frames at which reading resumes
 * @param importTimeout timeout for downloading an import source
 */
public record SessionSettings(int queueCapacity,
                              int batchSize,
                              Duration batchDelay,
                              Duration debounceQuietPeriod,
                              int inboundHighWatermark,
                              int inboundLowWatermark,
                              Duration importTimeout) {

    public static final int DEFAULT_QUEUE_CAPACITY = 10_000;
    public static final int DEFAULT_BATCH_SIZE = 100;
    public static final Duration DEFAULT_BATCH_DELAY = Duration.ofMillis(100);
    public static final Duration DEFAULT_DEBOUNCE_QUIET_PERIOD = Duration.ofMillis(100);
    public static final int DEFAULT_INBOUND_HIGH_WATERMARK = 64;
    public static final int DEFAULT_INBOUND_LOW_WATERMARK = 16;
    public static final Duration DEFAULT_IMPORT_TIMEOUT = Duration.ofSeconds(60);

    public SessionSettings {
        if (queueCapacity < 1 || batchSize < 1) {
            throw new IllegalArgumentException("queueCapacity and batchSize must be positive");
        }
        if (batchDelay.isNegative() || debounceQuietPeriod.isNegative()) {
            throw new IllegalArgumentException("delays must not be negative");
        }
        if (inboundLowWatermark < 0 || inboundHighWatermark <= inboundLowWatermark) {
            throw new IllegalArgumentException("inbound watermarks must satisfy 0 <= low < high");
        }
    }

    public static SessionSettings defaults() {
        return new SessionSettings(DEFAULT_QUEUE_CAPACITY, DEFAULT_BATCH_SIZE, DEFAULT_BATCH_DELAY, DEFAULT_DEBOUNCE_QUIET_PERIOD,
                DEFAULT_INBOUND_HIGH_WATERMARK, DEFAULT_INBOUND_LOW_WATERMARK, DEFAULT_IMPORT_TIMEOUT);
    }

    @JsonCreator
    static SessionSettings fromConfig(@JsonProperty("queueCapacity") @Nullable Integer queueCapacity,
                                      @JsonProperty("batchSize") @Nullable Integer batchSize,
                                      @JsonProperty("batchDelay") @Nullable Duration batchDelay,
                                      @JsonProperty("debounceQuietPeriod") @Nullable Duration debounceQuietPeriod,
                                      @JsonProperty("inboundHighWatermark") @Nullable Integer inboundHighWatermark,
                                      @JsonProperty("inboundLowWatermark") @Nullable Integer inboundLowWatermark,
                                      @JsonProperty("importTimeout") @Nullable Duration importTimeout) {
        return new SessionSettings(
                queueCapacity != null ? queueCapacity : DEFAULT_QUEUE_CAPACITY,
                batchSize != null ? batchSize : DEFAULT_BATCH_SIZE,
                batchDelay != null ? batchDelay : DEFAULT_BATCH_DELAY,
                debounceQuietPeriod != null ? debounceQuietPeriod : DEFAULT_DEBOUNCE_QUIET_PERIOD,
                inboundHighWatermark != null ? inboundHighWatermark : DEFAULT_INBOUND_HIGH_WATERMARK,
                inboundLowWatermark != null ? inboundLowWatermark : DEFAULT_INBOUND_LOW_WATERMARK,
                importTimeout != null ? importTimeout : DEFAULT_IMPORT_TIMEOUT);
    }
}
