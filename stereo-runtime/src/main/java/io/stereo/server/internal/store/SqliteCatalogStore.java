/*
 * Copyright Stereo Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.stereo.server.internal.store;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sqlite.SQLiteConfig;

import io.stereo.server.model.OnConflict;
import io.stereo.server.model.RowRange;
import io.stereo.server.model.SortModelItem;
import io.stereo.server.model.Track;
import io.stereo.server.model.TrackFilter;
import io.stereo.server.service.CatalogStore;
import io.stereo.server.service.CatalogStoreException;

/**
 * {@link CatalogStore} keeping each collection in its own SQLite file, with a single
 * {@code tracks} table keyed by {@code yt_id}.
 *
 * <p>Every operation opens its own connection, so calls from different sessions never share
 * transaction state.</p>
 */
public class SqliteCatalogStore implements CatalogStore {

    private static final Logger LOGGER = LoggerFactory.getLogger(SqliteCatalogStore.class);

    private static final String JDBC_PREFIX = "jdbc:sqlite:";
    private static final String SOURCE_SCHEMA = "source_db";

    @FunctionalInterface
    private interface SqlWork<T> {
        T apply(Connection connection) throws SQLException;
    }

    @FunctionalInterface
    private interface SqlBody<T> {
        T run() throws SQLException;
    }

    @Override
    public void init(Path location) {
        try {
            Path parent = location.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
        }
        catch (IOException e) {
            throw new CatalogStoreException("Cannot create directory for " + location, e);
        }
        withConnection(location, "initialise", connection -> {
            try (Statement statement = connection.createStatement()) {
                statement.executeUpdate(TrackRows.CREATE_TABLE);
            }
            return null;
        });
    }

    @Override
    public void insert(Path location, Track track, OnConflict onConflict) {
        LOGGER.debug("Inserting track {} into {} ({})", track.externalId(), location, onConflict);
        withConnection(location, "insert track", connection -> {
            try (PreparedStatement statement = connection.prepareStatement(TrackRows.insertSql(onConflict.name()))) {
                TrackRows.bind(statement, track);
                return statement.executeUpdate();
            }
        });
    }

    @Override
    public void insertMany(Path location, List<Track> tracks, OnConflict onConflict) {
        if (tracks.isEmpty()) {
            return;
        }
        LOGGER.debug("Inserting {} tracks into {} ({})", tracks.size(), location, onConflict);
        withConnection(location, "insert tracks", connection -> {
            try (PreparedStatement statement = connection.prepareStatement(TrackRows.insertSql(onConflict.name()))) {
                for (Track track : tracks) {
                    TrackRows.bind(statement, track);
                    statement.addBatch();
                }
                return inTransaction(connection, statement::executeBatch);
            }
        });
    }

    @Override
    public void update(Path location, String id, Map<String, Object> changes) {
        if (changes.isEmpty()) {
            return;
        }
        List<String> columns = new ArrayList<>(changes.keySet());
        for (String column : columns) {
            if (TrackRows.KEY_COLUMN.equals(TrackRows.requireColumn(column))) {
                throw new IllegalArgumentException("The key column cannot be updated");
            }
        }
        String assignments = columns.stream()
                .map(column -> TrackRows.quote(column) + " = ?")
                .collect(Collectors.joining(", "));
        String sql = "UPDATE " + TrackRows.TABLE + " SET " + assignments + " WHERE yt_id = ?";
        withConnection(location, "update track", connection -> {
            try (PreparedStatement statement = connection.prepareStatement(sql)) {
                int i = 1;
                for (String column : columns) {
                    statement.setObject(i++, TrackRows.toColumnValue(changes.get(column)));
                }
                statement.setString(i, id);
                return statement.executeUpdate();
            }
        });
    }

    @Override
    public void delete(Path location, String id) {
        LOGGER.debug("Deleting track {} from {}", id, location);
        withConnection(location, "delete track", connection -> {
            try (PreparedStatement statement = connection.prepareStatement("DELETE FROM tracks WHERE yt_id = ?")) {
                statement.setString(1, id);
                return statement.executeUpdate();
            }
        });
    }

    @Override
    public int deleteMany(Path location, Collection<String> ids) {
        if (ids.isEmpty()) {
            return 0;
        }
        LOGGER.debug("Deleting {} tracks from {}", ids.size(), location);
        return withConnection(location, "delete tracks", connection -> {
            try (PreparedStatement statement = connection.prepareStatement("DELETE FROM tracks WHERE yt_id = ?")) {
                for (String id : ids) {
                    statement.setString(1, id);
                    statement.addBatch();
                }
                int[] counts = inTransaction(connection, statement::executeBatch);
                int deleted = 0;
                for (int count : counts) {
                    deleted += Math.max(count, 0);
                }
                return deleted;
            }
        });
    }

    @Override
    public Optional<Track> get(Path location, String id) {
        return withConnection(location, "read track", connection -> {
            try (PreparedStatement statement = connection.prepareStatement("SELECT * FROM tracks WHERE yt_id = ?")) {
                statement.setString(1, id);
                try (ResultSet row = statement.executeQuery()) {
                    return row.next() ? Optional.of(TrackRows.read(row)) : Optional.<Track>empty();
                }
            }
        });
    }

    @Override
    public boolean contains(Path location, String id) {
        return withConnection(location, "look up track", connection -> {
            try (PreparedStatement statement = connection.prepareStatement("SELECT 1 FROM tracks WHERE yt_id = ? LIMIT 1")) {
                statement.setString(1, id);
                try (ResultSet row = statement.executeQuery()) {
                    return row.next();
                }
            }
        });
    }

    @Override
    public Optional<Track> getRandom(Path location, TrackFilter filter) {
        FilterSql.Clause clause = FilterSql.where(filter);
        String sql = "SELECT * FROM tracks" + clause.where() + " ORDER BY RANDOM() LIMIT 1";
        return withConnection(location, "pick random track", connection -> {
            try (PreparedStatement statement = prepare(connection, sql, clause.params())) {
                try (ResultSet row = statement.executeQuery()) {
                    return row.next() ? Optional.of(TrackRows.read(row)) : Optional.<Track>empty();
                }
            }
        });
    }

    @Override
    public int count(Path location, TrackFilter filter) {
        FilterSql.Clause clause = FilterSql.where(filter);
        String sql = "SELECT COUNT(*) FROM tracks" + clause.where();
        return withConnection(location, "count tracks", connection -> {
            try (PreparedStatement statement = prepare(connection, sql, clause.params());
                    ResultSet row = statement.executeQuery()) {
                return row.next() ? row.getInt(1) : 0;
            }
        });
    }

    @Override
    public List<Track> queryPage(Path location, TrackFilter filter, List<SortModelItem> sort, RowRange rows) {
        FilterSql.Clause clause = FilterSql.where(filter);
        String sql = "SELECT * FROM tracks" + clause.where() + FilterSql.orderBy(sort) + " LIMIT ? OFFSET ?";
        List<Object> params = new ArrayList<>(clause.params());
        params.add(rows.limit());
        params.add(rows.start());
        return withConnection(location, "query tracks", connection -> {
            try (PreparedStatement statement = prepare(connection, sql, params);
                    ResultSet row = statement.executeQuery()) {
                List<Track> page = new ArrayList<>();
                while (row.next()) {
                    page.add(TrackRows.read(row));
                }
                return page;
            }
        });
    }

    @Override
    public int rowIndex(Path location, String id, TrackFilter filter, List<SortModelItem> sort) {
        FilterSql.Clause clause = FilterSql.where(filter);
        String window = "ROW_NUMBER() OVER (" + FilterSql.orderBy(sort).trim() + ") - 1";
        String sql = "SELECT position FROM (SELECT yt_id, " + window + " AS position FROM tracks" + clause.where()
                + ") WHERE yt_id = ?";
        List<Object> params = new ArrayList<>(clause.params());
        params.add(id);
        return withConnection(location, "locate track", connection -> {
            try (PreparedStatement statement = prepare(connection, sql, params);
                    ResultSet row = statement.executeQuery()) {
                return row.next() ? row.getInt(1) : -1;
            }
        });
    }

    @Override
    public boolean validateSchema(Path location) {
        if (!Files.isRegularFile(location)) {
            return false;
        }
        SQLiteConfig config = new SQLiteConfig();
        config.setReadOnly(true);
        try (Connection connection = DriverManager.getConnection(url(location), config.toProperties());
                Statement statement = connection.createStatement();
                ResultSet rows = statement.executeQuery("PRAGMA table_info(tracks)")) {
            Set<String> found = new HashSet<>();
            Set<String> keys = new HashSet<>();
            while (rows.next()) {
                String name = rows.getString("name");
                found.add(name);
                if (rows.getInt("pk") > 0) {
                    keys.add(name);
                }
            }
            return found.containsAll(TrackRows.COLUMNS) && keys.contains(TrackRows.KEY_COLUMN);
        }
        catch (SQLException e) {
            LOGGER.debug("{} is not a collection: {}", location, e.getMessage());
            return false;
        }
    }

    @Override
    public int importFrom(Path location, Path source, Set<String> columns, boolean preserveUserFields) {
        Set<String> wanted = new LinkedHashSet<>();
        for (String column : columns) {
            wanted.add(TrackRows.requireColumn(column));
        }
        if (preserveUserFields) {
            wanted.addAll(USER_COLUMNS);
        }
        else {
            wanted.removeAll(USER_COLUMNS);
        }
        return withConnection(location, "import tracks", connection -> {
            try (PreparedStatement attach = connection.prepareStatement("ATTACH DATABASE ? AS " + SOURCE_SCHEMA)) {
                attach.setString(1, source.toAbsolutePath().toString());
                attach.execute();
            }
            try {
                Set<String> available = columnsOf(connection, SOURCE_SCHEMA);
                List<String> copied = TrackRows.COLUMNS.stream()
                        .filter(wanted::contains)
                        .filter(available::contains)
                        .toList();
                if (copied.isEmpty()) {
                    LOGGER.warn("No columns to import from {}", source);
                    return 0;
                }
                String names = TrackRows.columnList(copied);
                String sql = "INSERT OR IGNORE INTO main.tracks (" + names + ") SELECT " + names + " FROM " + SOURCE_SCHEMA + ".tracks";
                try (Statement statement = connection.createStatement()) {
                    int imported = statement.executeUpdate(sql);
                    LOGGER.info("Imported {} tracks from {} into {}", imported, source, location);
                    return imported;
                }
            }
            finally {
                try (Statement detach = connection.createStatement()) {
                    detach.execute("DETACH DATABASE " + SOURCE_SCHEMA);
                }
            }
        });
    }

    // ==================== Internals ====================

    private static String url(Path location) {
        return JDBC_PREFIX + location.toAbsolutePath();
    }

    private static <T> T withConnection(Path location, String operation, SqlWork<T> work) {
        try (Connection connection = DriverManager.getConnection(url(location))) {
            return work.apply(connection);
        }
        catch (SQLException e) {
            throw new CatalogStoreException("Failed to " + operation + " in " + location + ": " + e.getMessage(), e);
        }
    }

    private static <T> T inTransaction(Connection connection, SqlBody<T> body) throws SQLException {
        connection.setAutoCommit(false);
        try {
            T result = body.run();
            connection.commit();
            return result;
        }
        catch (SQLException | RuntimeException e) {
            connection.rollback();
            throw e;
        }
        finally {
            connection.setAutoCommit(true);
        }
    }

    private static PreparedStatement prepare(Connection connection, String sql, List<Object> params) throws SQLException {
        PreparedStatement statement = connection.prepareStatement(sql);
        try {
            for (int i = 0; i < params.size(); i++) {
                statement.setObject(i + 1, params.get(i));
            }
            return statement;
        }
        catch (SQLException e) {
            statement.close();
            throw e;
        }
    }

    private static Set<String> columnsOf(Connection connection, String schema) throws SQLException {
        Set<String> names = new HashSet<>();
        try (Statement statement = connection.createStatement();
                ResultSet rows = statement.executeQuery("PRAGMA " + schema + ".table_info(tracks)")) {
            while (rows.next()) {
                names.add(rows.getString("name"));
            }
        }
        return names;
    }
}
