/*
 * Copyright Stereo Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.stereo.server.model;

import java.time.LocalDate;
import java.util.List;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * A track in a collection.
 *
 * <p>The external id ({@code yt_id} on the wire and in storage) is the natural key and never changes;
 * every other field may be edited. Fields below {@code mood} are user data: they describe how the
 * owner of the collection uses the track rather than the track itself.</p>
 *
 * <p>{@code bp_id} is numeric in storage but always written as a JSON string so that clients
 * using floating point numbers cannot lose precision.</p>
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record Track(
                    @JsonProperty("yt_id") String externalId,
                    @JsonFormat(shape = JsonFormat.Shape.STRING) @Nullable Long bpId,
                    @Nullable String mbId,
                    String title,
                    @Nullable String mixName,
                    List<String> artists,
                    @Nullable LocalDate releaseDate,
                    @Nullable String label,
                    @Nullable String album,
                    @Nullable Integer length,
                    @Nullable Integer bpm,
                    @Nullable String genre,
                    @Nullable String key,
                    @Nullable String mood,
                    @Nullable Integer rating,
                    @Nullable Integer playCount,
                    @Nullable LocalDate lastPlayed) {

    public Track {
        Objects.requireNonNull(externalId, "yt_id");
        Objects.requireNonNull(title, "title");
        Objects.requireNonNull(artists, "artists");
        artists = List.copyOf(artists);
        playCount = playCount == null ? 0 : playCount;
    }

    /**
     * Minimal track with only the required fields.
     */
    public static Track of(String externalId, String title, List<String> artists) {
        return new Track(externalId, null, null, title, null, artists, null, null, null, null, null, null, null, null, null, 0, null);
    }

    public Track withRating(@Nullable Integer newRating) {
        return new Track(externalId, bpId, mbId, title, mixName, artists, releaseDate, label, album, length, bpm, genre, key, mood,
                newRating, playCount, lastPlayed);
    }

    /**
     * Records one more play of this track on the given day.
     */
    public Track played(LocalDate day) {
        return new Track(externalId, bpId, mbId, title, mixName, artists, releaseDate, label, album, length, bpm, genre, key, mood,
                rating, playCount + 1, day);
    }
}
