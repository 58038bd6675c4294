/*
 * Copyright Stereo Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.stereo.server.internal.store;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.stream.Collectors;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.stereo.server.model.Track;
import io.stereo.server.service.CatalogStoreException;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Mapping between {@link Track} and rows of the {@code tracks} table.
 *
 * <p>Artists are stored as a JSON array and dates as ISO-8601 text.</p>
 */
final class TrackRows {

    static final String TABLE = "tracks";
    static final String KEY_COLUMN = "yt_id";

    static final List<String> COLUMNS = List.of(
            "yt_id", "bp_id", "mb_id", "title", "mix_name", "artists", "release_date", "label", "album",
            "length", "bpm", "genre", "key", "mood", "rating", "play_count", "last_played");

    static final String CREATE_TABLE = """
            CREATE TABLE IF NOT EXISTS tracks (
                yt_id TEXT PRIMARY KEY,
                bp_id INTEGER,
                mb_id TEXT,
                title TEXT NOT NULL,
                mix_name TEXT,
                artists TEXT NOT NULL,
                release_date TEXT,
                label TEXT,
                album TEXT,
                length INTEGER,
                bpm INTEGER,
                genre TEXT,
                key TEXT,
                mood TEXT,
                rating INTEGER,
                play_count INTEGER DEFAULT 0,
                last_played TEXT
            )""";

    private static final ObjectMapper JSON = new ObjectMapper();
    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {
    };

    private TrackRows() {
    }

    static String quote(String column) {
        return '"' + column + '"';
    }

    /**
     * @throws IllegalArgumentException if {@code column} is not a track column
     */
    static String requireColumn(String column) {
        if (!COLUMNS.contains(column)) {
            throw new IllegalArgumentException("Unknown track column '" + column + "'");
        }
        return column;
    }

    static String columnList(Collection<String> columns) {
        return columns.stream().map(TrackRows::quote).collect(Collectors.joining(", "));
    }

    static String insertSql(String conflictClause) {
        String placeholders = COLUMNS.stream().map(c -> "?").collect(Collectors.joining(", "));
        return "INSERT OR " + conflictClause + " INTO " + TABLE + " (" + columnList(COLUMNS) + ") VALUES (" + placeholders + ")";
    }

    static void bind(PreparedStatement statement, Track track) throws SQLException {
        int i = 1;
        statement.setObject(i++, track.externalId());
        statement.setObject(i++, track.bpId());
        statement.setObject(i++, track.mbId());
        statement.setObject(i++, track.title());
        statement.setObject(i++, track.mixName());
        statement.setObject(i++, toJson(track.artists()));
        statement.setObject(i++, toText(track.releaseDate()));
        statement.setObject(i++, track.label());
        statement.setObject(i++, track.album());
        statement.setObject(i++, track.length());
        statement.setObject(i++, track.bpm());
        statement.setObject(i++, track.genre());
        statement.setObject(i++, track.key());
        statement.setObject(i++, track.mood());
        statement.setObject(i++, track.rating());
        statement.setObject(i++, track.playCount());
        statement.setObject(i, toText(track.lastPlayed()));
    }

    static Track read(ResultSet row) throws SQLException {
        return new Track(
                row.getString("yt_id"),
                longOrNull(row, "bp_id"),
                row.getString("mb_id"),
                row.getString("title"),
                row.getString("mix_name"),
                fromJson(row.getString("artists")),
                dateOrNull(row, "release_date"),
                row.getString("label"),
                row.getString("album"),
                intOrNull(row, "length"),
                intOrNull(row, "bpm"),
                row.getString("genre"),
                row.getString("key"),
                row.getString("mood"),
                intOrNull(row, "rating"),
                intOrNull(row, "play_count"),
                dateOrNull(row, "last_played"));
    }

    /**
     * Converts a field value to the form it is stored in.
     */
    @Nullable
    static Object toColumnValue(@Nullable Object value) {
        if (value instanceof LocalDate date) {
            return toText(date);
        }
        else if (value instanceof List<?> list) {
            return toJson(list);
        }
        return value;
    }

    private static String toJson(List<?> values) {
        try {
            return JSON.writeValueAsString(values);
        }
        catch (JsonProcessingException e) {
            throw new CatalogStoreException("Cannot store list " + values, e);
        }
    }

    private static List<String> fromJson(@Nullable String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        try {
            return JSON.readValue(text, STRING_LIST);
        }
        catch (JsonProcessingException e) {
            throw new CatalogStoreException("Corrupt artists column: " + text, e);
        }
    }

    @Nullable
    private static String toText(@Nullable LocalDate date) {
        return date == null ? null : date.toString();
    }

    @Nullable
    private static LocalDate dateOrNull(ResultSet row, String column) throws SQLException {
        String text = row.getString(column);
        return text == null || text.isEmpty() ? null : LocalDate.parse(text);
    }

    @Nullable
    private static Integer intOrNull(ResultSet row, String column) throws SQLException {
        int value = row.getInt(column);
        return row.wasNull() ? null : value;
    }

    @Nullable
    private static Long longOrNull(ResultSet row, String column) throws SQLException {
        long value = row.getLong(column);
        return row.wasNull() ? null : value;
    }
}
