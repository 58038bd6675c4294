/*
 * Copyright Stereo Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.stereo.server.service;

import java.nio.file.Path;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import io.stereo.server.model.OnConflict;
import io.stereo.server.model.RowRange;
import io.stereo.server.model.SortModelItem;
import io.stereo.server.model.Track;
import io.stereo.server.model.TrackFilter;

/**
 * Persistent storage of tracks.
 *
 * <p>A collection is a single storage file identified by its location. Every call is atomic
 * against that file and independent of any other call; implementations hold no per-session state.
 * Storage failures surface as {@link CatalogStoreException}.</p>
 */
public interface CatalogStore {

    /**
     * Columns describing a track, as opposed to how its owner uses it.
     */
    Set<String> METADATA_COLUMNS = Set.of("yt_id", "bp_id", "mb_id", "title", "mix_name", "artists", "release_date", "label",
            "album", "length", "bpm", "genre", "key", "mood");

    /**
     * Columns holding user data: rating, play count and last played date.
     */
    Set<String> USER_COLUMNS = Set.of("rating", "play_count", "last_played");

    /**
     * Creates the storage at {@code location} if it is missing. Existing data is left untouched.
     */
    void init(Path location);

    void insert(Path location, Track track, OnConflict onConflict);

    void insertMany(Path location, List<Track> tracks, OnConflict onConflict);

    /**
     * Sets the given columns of one track.
     *
     * @param changes column name to new value, {@code null} values clear the column
     * @throws IllegalArgumentException if a key is not a track column or is {@code yt_id}
     */
    void update(Path location, String id, Map<String, Object> changes);

    void delete(Path location, String id);

    /**
     * @return the number of tracks removed
     */
    int deleteMany(Path location, Collection<String> ids);

    Optional<Track> get(Path location, String id);

    boolean contains(Path location, String id);

    Optional<Track> getRandom(Path location, TrackFilter filter);

    int count(Path location, TrackFilter filter);

    /**
     * Tracks matching {@code filter}, ordered by {@code sort}, restricted to {@code rows}.
     */
    List<Track> queryPage(Path location, TrackFilter filter, List<SortModelItem> sort, RowRange rows);

    /**
     * Zero based position of a track in the ordering {@link #queryPage} would produce.
     *
     * @return the position or {@code -1} if the track does not match or does not exist
     */
    int rowIndex(Path location, String id, TrackFilter filter, List<SortModelItem> sort);

    /**
     * Checks that {@code location} is an existing collection with every track column and
     * {@code yt_id} as its key. Never throws for unreadable or foreign files.
     */
    boolean validateSchema(Path location);

    /**
     * Merges the tracks of collection {@code source} into {@code location}. Tracks already present in
     * {@code location} are left unchanged.
     *
     * @param columns columns to copy, ignored where the source lacks them
     * @param preserveUserFields whether {@link #USER_COLUMNS} are copied as well; otherwise they take
     *                           their defaults
     * @return the number of tracks added
     */
    int importFrom(Path location, Path source, Set<String> columns, boolean preserveUserFields);
}
