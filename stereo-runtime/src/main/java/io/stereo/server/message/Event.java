/*
 * Copyright Stereo Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.stereo.server.message;

import java.util.List;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.annotation.JsonTypeName;

import io.stereo.server.model.Severity;
import io.stereo.server.model.Track;
import io.stereo.server.model.TrackCollection;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * A message sent to a client. Events are written in batches, as a JSON array.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonInclude(JsonInclude.Include.NON_NULL)
public sealed interface Event
        permits Event.Heartbeat, Event.TrackUpdate, Event.ReloadTracks, Event.Rows, Event.RowIndex, Event.BackendInfo,
        Event.TrackInfo, Event.CollectionInfo, Event.DefaultCollection, Event.PathCompletions, Event.SearchResult,
        Event.SearchComplete, Event.TrackFound, Event.TrackNotFound, Event.CollectionContainsIdResponse,
        Event.Notification, Event.ImportFromValid, Event.ValidateTrackReply, Event.PlayId {

    @JsonTypeName("heartbeat")
    record Heartbeat(long timestamp) implements Event {
    }

    @JsonTypeName("track-update")
    record TrackUpdate(Track track) implements Event {
    }

    /**
     * Tells the client its cached rows are stale.
     */
    @JsonTypeName("reload-tracks")
    record ReloadTracks() implements Event {
    }

    /**
     * @param lastRow number of rows matching the filter, so the grid knows where the data ends
     */
    @JsonTypeName("rows")
    record Rows(int id, List<Track> rows, @JsonProperty("last_row") @Nullable Integer lastRow) implements Event {
        public Rows {
            rows = List.copyOf(rows);
        }
    }

    /**
     * @param index position of the track under the requested sort and filter, {@code -1} when absent
     */
    @JsonTypeName("row-index")
    record RowIndex(int id, int index) implements Event {
    }

    @JsonTypeName("backend-info")
    record BackendInfo(String version) implements Event {
    }

    @JsonTypeName("track-info")
    record TrackInfo(Track track) implements Event {
    }

    /**
     * Either a (refreshed) collection or, when a requested collection is unusable, an error message
     * with suggestions for the path the client tried.
     */
    @JsonTypeName("collection-info")
    record CollectionInfo(@Nullable Integer id,
                          @Nullable TrackCollection collection,
                          @JsonProperty("error_message") @Nullable String errorMessage,
                          @JsonProperty("path_completions") @Nullable List<String> pathCompletions)
            implements Event {

        public static CollectionInfo of(@Nullable Integer id, TrackCollection collection) {
            return new CollectionInfo(id, Objects.requireNonNull(collection), null, null);
        }

        public static CollectionInfo invalid(int id, String errorMessage, List<String> pathCompletions) {
            return new CollectionInfo(id, null, errorMessage, List.copyOf(pathCompletions));
        }
    }

    @JsonTypeName("default-collection")
    record DefaultCollection(TrackCollection collection) implements Event {
    }

    @JsonTypeName("path-completions")
    record PathCompletions(int id, List<String> paths) implements Event {
        public PathCompletions {
            paths = List.copyOf(paths);
        }
    }

    @JsonTypeName("search-result")
    record SearchResult(@JsonProperty("query_id") int queryId, Track track) implements Event {
    }

    @JsonTypeName("search-complete")
    record SearchComplete(@JsonProperty("query_id") int queryId) implements Event {
    }

    @JsonTypeName("track-found")
    record TrackFound(int id, Track track, @JsonProperty("exists_in_db") boolean existsInDb) implements Event {
    }

    @JsonTypeName("track-not-found")
    record TrackNotFound(int id) implements Event {
    }

    @JsonTypeName("collection-contains-id-response")
    record CollectionContainsIdResponse(int id, @JsonProperty("contains_id") boolean containsId) implements Event {
    }

    /**
     * A message for the user, shown by the client with the given severity.
     */
    @JsonTypeName("notification")
    record Notification(String message, Severity kind) implements Event {

        public static Notification info(String message) {
            return new Notification(message, Severity.INFO);
        }

        public static Notification warn(String message) {
            return new Notification(message, Severity.WARN);
        }

        public static Notification error(String message) {
            return new Notification(message, Severity.ERROR);
        }
    }

    @JsonTypeName("import-from-valid")
    record ImportFromValid(String path, @JsonProperty("is_valid") boolean valid) implements Event {
    }

    @JsonTypeName("validate-track-reply")
    record ValidateTrackReply(int id, @JsonProperty("is_valid") boolean valid) implements Event {
    }

    /**
     * Asks the client to play the track with the given external id.
     */
    @JsonTypeName("play-id")
    record PlayId(String id) implements Event {
    }
}
