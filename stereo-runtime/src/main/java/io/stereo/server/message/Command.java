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
import com.fasterxml.jackson.databind.JsonNode;

import io.stereo.server.model.SearchKind;
import io.stereo.server.model.SortModelItem;
import io.stereo.server.model.Track;
import io.stereo.server.model.TrackFilter;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * A message sent by a client.
 *
 * <p>The set of variants is closed: every implementation is listed in {@link CommandType}, which
 * also carries the wire tag written in the {@code type} property. Commands carrying an {@code id}
 * expect a response echoing it; the others are fire-and-forget.</p>
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonInclude(JsonInclude.Include.NON_NULL)
public sealed interface Command
        permits Command.Heartbeat, Command.DeleteTracks, Command.UpdateRating, Command.IncPlayCount, Command.GetRows,
        Command.GetRowIndex, Command.AddTrack, Command.AddTracks, Command.UpdateTrack, Command.GetTrackInfo,
        Command.GetRandomTrack, Command.SetCollection, Command.CreateCollection, Command.GetPathCompletions,
        Command.Search, Command.SearchCancelAll, Command.SearchTrack, Command.CollectionContainsId,
        Command.CheckImportFrom, Command.ImportFrom, Command.ValidateTrack, Command.ExportTracksToCollection {

    default CommandType commandType() {
        return CommandType.of(this);
    }

    record Heartbeat(Long timestamp) implements Command {
        public Heartbeat {
            Objects.requireNonNull(timestamp, "timestamp");
        }
    }

    record DeleteTracks(List<String> ids) implements Command {
        public DeleteTracks {
            ids = List.copyOf(Objects.requireNonNull(ids, "ids"));
        }
    }

    /**
     * @param rating new rating, {@code null} clears it
     */
    record UpdateRating(@JsonProperty("yt_id") String externalId,
                        @JsonInclude(JsonInclude.Include.ALWAYS) @Nullable Integer rating)
            implements Command {
        public UpdateRating {
            Objects.requireNonNull(externalId, "yt_id");
        }
    }

    record IncPlayCount(@JsonProperty("yt_id") String externalId) implements Command {
        public IncPlayCount {
            Objects.requireNonNull(externalId, "yt_id");
        }
    }

    /**
     * Page {@code [startRow, endRow)} of the active collection under the given sort and filter.
     */
    record GetRows(Integer id,
                   Integer startRow,
                   Integer endRow,
                   @Nullable List<SortModelItem> sortModel,
                   @Nullable TrackFilter filterModel)
            implements Command {
        public GetRows {
            Objects.requireNonNull(id, "id");
            Objects.requireNonNull(startRow, "startRow");
            Objects.requireNonNull(endRow, "endRow");
            sortModel = sortModel == null ? List.of() : List.copyOf(sortModel);
            filterModel = filterModel == null ? TrackFilter.none() : filterModel;
        }
    }

    record GetRowIndex(Integer id,
                       @JsonProperty("yt_id") String externalId,
                       @Nullable List<SortModelItem> sortModel,
                       @Nullable TrackFilter filterModel)
            implements Command {
        public GetRowIndex {
            Objects.requireNonNull(id, "id");
            Objects.requireNonNull(externalId, "yt_id");
            sortModel = sortModel == null ? List.of() : List.copyOf(sortModel);
            filterModel = filterModel == null ? TrackFilter.none() : filterModel;
        }
    }

    record AddTrack(Track track,
                    @JsonProperty("overwrite_existing") @Nullable Boolean overwriteExisting)
            implements Command {
        public AddTrack {
            Objects.requireNonNull(track, "track");
            overwriteExisting = Boolean.TRUE.equals(overwriteExisting);
        }
    }

    record AddTracks(List<Track> tracks,
                     @JsonProperty("overwrite_existing") @Nullable Boolean overwriteExisting)
            implements Command {
        public AddTracks {
            tracks = List.copyOf(Objects.requireNonNull(tracks, "tracks"));
            overwriteExisting = Boolean.TRUE.equals(overwriteExisting);
        }
    }

    record UpdateTrack(Track old,
                       @JsonProperty("new") Track replacement)
            implements Command {
        public UpdateTrack {
            Objects.requireNonNull(old, "old");
            Objects.requireNonNull(replacement, "new");
        }

        public boolean changesId() {
            return !old.externalId().equals(replacement.externalId());
        }
    }

    record GetTrackInfo(@JsonProperty("yt_id") String externalId) implements Command {
        public GetTrackInfo {
            Objects.requireNonNull(externalId, "yt_id");
        }
    }

    record GetRandomTrack() implements Command {
    }

    record SetCollection(Integer id, String path) implements Command {
        public SetCollection {
            Objects.requireNonNull(id, "id");
            Objects.requireNonNull(path, "path");
        }
    }

    record CreateCollection(String path) implements Command {
        public CreateCollection {
            Objects.requireNonNull(path, "path");
        }
    }

    record GetPathCompletions(Integer id,
                              @JsonProperty("path_prefix") String pathPrefix)
            implements Command {
        public GetPathCompletions {
            Objects.requireNonNull(id, "id");
            Objects.requireNonNull(pathPrefix, "path_prefix");
        }
    }

    record Search(String query,
                  @JsonProperty("query_id") Integer queryId,
                  Integer limit,
                  @Nullable SearchKind kind)
            implements Command {
        public Search {
            Objects.requireNonNull(query, "query");
            Objects.requireNonNull(queryId, "query_id");
            Objects.requireNonNull(limit, "limit");
            kind = kind == null ? SearchKind.FUZZY : kind;
        }
    }

    record SearchCancelAll() implements Command {
    }

    /**
     * Looks up the best external match for a title and artist.
     */
    record SearchTrack(Integer id, String title, String artist) implements Command {
        public SearchTrack {
            Objects.requireNonNull(id, "id");
            Objects.requireNonNull(title, "title");
            Objects.requireNonNull(artist, "artist");
        }
    }

    record CollectionContainsId(Integer id,
                                @JsonProperty("yt_id") String externalId)
            implements Command {
        public CollectionContainsId {
            Objects.requireNonNull(id, "id");
            Objects.requireNonNull(externalId, "yt_id");
        }
    }

    record CheckImportFrom(String path) implements Command {
        public CheckImportFrom {
            Objects.requireNonNull(path, "path");
        }
    }

    /**
     * @param path local file or {@code http(s)} URL of a collection to merge into the active one
     * @param keepUserData copy rating, play count and last played from the source
     */
    record ImportFrom(String path,
                      @JsonProperty("keep_user_data") Boolean keepUserData)
            implements Command {
        public ImportFrom {
            Objects.requireNonNull(path, "path");
            Objects.requireNonNull(keepUserData, "keep_user_data");
        }
    }

    /**
     * @param track arbitrary JSON to check against the track schema
     */
    record ValidateTrack(Integer id, JsonNode track) implements Command {
        public ValidateTrack {
            Objects.requireNonNull(id, "id");
            Objects.requireNonNull(track, "track");
        }
    }

    record ExportTracksToCollection(List<Track> tracks, String collection) implements Command {
        public ExportTracksToCollection {
            tracks = List.copyOf(Objects.requireNonNull(tracks, "tracks"));
            Objects.requireNonNull(collection, "collection");
        }
    }
}
