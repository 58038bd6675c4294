/*
 * Copyright Stereo Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.stereo.server.internal.dispatch;

import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDate;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.stereo.server.internal.codec.MessageCodec;
import io.stereo.server.internal.session.SearchTaskSupervisor;
import io.stereo.server.internal.session.Session;
import io.stereo.server.internal.session.StateChangeDebouncer;
import io.stereo.server.internal.util.Metrics;
import io.stereo.server.message.Command;
import io.stereo.server.message.CommandType;
import io.stereo.server.message.Event;
import io.stereo.server.model.OnConflict;
import io.stereo.server.model.RowRange;
import io.stereo.server.model.Track;
import io.stereo.server.model.TrackCollection;
import io.stereo.server.model.TrackFilter;
import io.stereo.server.service.CatalogStore;
import io.stereo.server.service.DiscoveryProvider;
import io.stereo.server.service.PathCompletion;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Executes the commands of one session, one at a time, in the order they were received.
 *
 * <p>Each {@link CommandType} maps to exactly one handler. Handlers that work on the active
 * collection do nothing when the session has none. A handler that fails is logged and counted;
 * the next command is dispatched as usual.</p>
 *
 * <h2>Architecture</h2>
 * <pre>
 *   inbound queue
 *        │
 *        ▼
 *   CommandDispatcher ──► CatalogStore / DiscoveryProvider / PathCompletion
 *        │   │    │
 *        │   │    └──► StateChangeDebouncer (collection changed)
 *        │   └───────► SearchTaskSupervisor (search, search-cancel-all)
 *        ▼
 *   outbound queue
 * </pre>
 */
public class CommandDispatcher {

    private static final Logger LOGGER = LoggerFactory.getLogger(CommandDispatcher.class);

    static final String INVALID_COLLECTION = "not a valid collection";
    static final String COLLECTION_EXISTS = "cannot create collection - file exists!";

    private final Session session;
    private final CatalogStore store;
    private final DiscoveryProvider discovery;
    private final PathCompletion pathCompletion;
    private final SearchTaskSupervisor search;
    private final StateChangeDebouncer debouncer;
    private final ImportSourceResolver importSources;
    private final MessageCodec codec;
    private final BlockingQueue<Event> outbound;
    private final Clock clock;

    private final Map<CommandType, Route<?>> routes = new EnumMap<>(CommandType.class);

    /**
     * A handler together with the command class it accepts.
     */
    private record Route<C extends Command>(Class<C> commandClass, CommandHandler<C> handler) {

        void dispatch(Command command) throws Exception {
            handler.handle(commandClass.cast(command));
        }
    }

    public CommandDispatcher(Session session,
                             CatalogStore store,
                             DiscoveryProvider discovery,
                             PathCompletion pathCompletion,
                             SearchTaskSupervisor search,
                             StateChangeDebouncer debouncer,
                             ImportSourceResolver importSources,
                             MessageCodec codec,
                             BlockingQueue<Event> outbound,
                             Clock clock) {
        this.session = session;
        this.store = store;
        this.discovery = discovery;
        this.pathCompletion = pathCompletion;
        this.search = search;
        this.debouncer = debouncer;
        this.importSources = importSources;
        this.codec = codec;
        this.outbound = outbound;
        this.clock = clock;
        for (CommandType type : CommandType.values()) {
            routes.put(type, route(type));
        }
    }

    private Route<?> route(CommandType type) {
        return switch (type) {
            case HEARTBEAT -> new Route<>(Command.Heartbeat.class, this::onHeartbeat);
            case DELETE_TRACKS -> new Route<>(Command.DeleteTracks.class, this::onDeleteTracks);
            case UPDATE_RATING -> new Route<>(Command.UpdateRating.class, this::onUpdateRating);
            case INC_PLAY_COUNT -> new Route<>(Command.IncPlayCount.class, this::onIncPlayCount);
            case GET_ROWS -> new Route<>(Command.GetRows.class, this::onGetRows);
            case GET_ROW_INDEX -> new Route<>(Command.GetRowIndex.class, this::onGetRowIndex);
            case ADD_TRACK -> new Route<>(Command.AddTrack.class, this::onAddTrack);
            case ADD_TRACKS -> new Route<>(Command.AddTracks.class, this::onAddTracks);
            case UPDATE_TRACK -> new Route<>(Command.UpdateTrack.class, this::onUpdateTrack);
            case GET_TRACK_INFO -> new Route<>(Command.GetTrackInfo.class, this::onGetTrackInfo);
            case GET_RANDOM_TRACK -> new Route<>(Command.GetRandomTrack.class, this::onGetRandomTrack);
            case SET_COLLECTION -> new Route<>(Command.SetCollection.class, this::onSetCollection);
            case CREATE_COLLECTION -> new Route<>(Command.CreateCollection.class, this::onCreateCollection);
            case GET_PATH_COMPLETIONS -> new Route<>(Command.GetPathCompletions.class, this::onGetPathCompletions);
            case SEARCH -> new Route<>(Command.Search.class, this::onSearch);
            case SEARCH_CANCEL_ALL -> new Route<>(Command.SearchCancelAll.class, this::onSearchCancelAll);
            case SEARCH_TRACK -> new Route<>(Command.SearchTrack.class, this::onSearchTrack);
            case COLLECTION_CONTAINS_ID -> new Route<>(Command.CollectionContainsId.class, this::onCollectionContainsId);
            case CHECK_IMPORT_FROM -> new Route<>(Command.CheckImportFrom.class, this::onCheckImportFrom);
            case IMPORT_FROM -> new Route<>(Command.ImportFrom.class, this::onImportFrom);
            case VALIDATE_TRACK -> new Route<>(Command.ValidateTrack.class, this::onValidateTrack);
            case EXPORT_TRACKS_TO_COLLECTION -> new Route<>(Command.ExportTracksToCollection.class, this::onExportTracksToCollection);
        };
    }

    // ==================== Dispatch ====================

    /**
     * Takes commands from {@code inbound} and dispatches them until interrupted.
     */
    public void run(BlockingQueue<Command> inbound) throws InterruptedException {
        while (true) {
            dispatch(inbound.take());
        }
    }

    /**
     * Runs the handler for one command. Handler failures are logged and counted, never thrown.
     *
     * @throws InterruptedException if the session is torn down while the handler runs
     */
    public void dispatch(Command command) throws InterruptedException {
        CommandType type = command.commandType();
        LOGGER.debug("{}: dispatching {}", session.id(), type.tag());
        try {
            routes.get(type).dispatch(command);
        }
        catch (InterruptedException e) {
            throw e;
        }
        catch (Exception e) {
            LOGGER.error("{}: failed to handle {}: {}", session.id(), type.tag(), command, e);
            Metrics.handlerFaultCounter(type.tag()).increment();
        }
    }

    @Nullable
    private TrackCollection activeCollection() {
        return session.collection();
    }

    private void emit(Event event) throws InterruptedException {
        outbound.put(event);
    }

    // ==================== Handlers ====================

    private void onHeartbeat(Command.Heartbeat command) throws InterruptedException {
        emit(new Event.Heartbeat(command.timestamp()));
    }

    private void onDeleteTracks(Command.DeleteTracks command) throws InterruptedException {
        TrackCollection collection = activeCollection();
        if (collection == null) {
            return;
        }
        int deleted = store.deleteMany(collection.path(), command.ids());
        LOGGER.debug("{}: deleted {} of {} tracks", session.id(), deleted, command.ids().size());
        emit(new Event.ReloadTracks());
        debouncer.signal();
    }

    private void onUpdateRating(Command.UpdateRating command) throws InterruptedException {
        TrackCollection collection = activeCollection();
        if (collection == null) {
            return;
        }
        store.update(collection.path(), command.externalId(), Collections.singletonMap("rating", command.rating()));
        Optional<Track> updated = store.get(collection.path(), command.externalId());
        if (updated.isPresent()) {
            emit(new Event.TrackUpdate(updated.get()));
        }
    }

    private void onIncPlayCount(Command.IncPlayCount command) throws InterruptedException {
        TrackCollection collection = activeCollection();
        if (collection == null) {
            return;
        }
        Optional<Track> track = store.get(collection.path(), command.externalId());
        if (track.isPresent()) {
            Track played = track.get().played(LocalDate.now(clock));
            store.insert(collection.path(), played, OnConflict.REPLACE);
            emit(new Event.TrackUpdate(played));
        }
    }

    private void onGetRows(Command.GetRows command) throws InterruptedException {
        TrackCollection collection = activeCollection();
        if (collection == null) {
            return;
        }
        TrackFilter filter = command.filterModel();
        int total = store.count(collection.path(), filter);
        List<Track> rows = store.queryPage(collection.path(), filter, command.sortModel(),
                new RowRange(command.startRow(), command.endRow()));
        emit(new Event.Rows(command.id(), rows, total));
    }

    private void onGetRowIndex(Command.GetRowIndex command) throws InterruptedException {
        TrackCollection collection = activeCollection();
        if (collection == null) {
            return;
        }
        int index = store.rowIndex(collection.path(), command.externalId(), command.filterModel(), command.sortModel());
        emit(new Event.RowIndex(command.id(), index));
    }

    private void onAddTrack(Command.AddTrack command) throws InterruptedException {
        TrackCollection collection = activeCollection();
        if (collection == null) {
            return;
        }
        store.insert(collection.path(), command.track(), OnConflict.overwriting(command.overwriteExisting()));
        // echo what the client sent, even if the stored track was kept
        emit(new Event.TrackUpdate(command.track()));
        debouncer.signal();
    }

    private void onAddTracks(Command.AddTracks command) throws InterruptedException {
        TrackCollection collection = activeCollection();
        if (collection == null) {
            return;
        }
        store.insertMany(collection.path(), command.tracks(), OnConflict.overwriting(command.overwriteExisting()));
        emit(new Event.ReloadTracks());
        debouncer.signal();
    }

    private void onUpdateTrack(Command.UpdateTrack command) throws InterruptedException {
        TrackCollection collection = activeCollection();
        if (collection == null) {
            return;
        }
        if (command.changesId()) {
            store.delete(collection.path(), command.old().externalId());
            store.insert(collection.path(), command.replacement(), OnConflict.REPLACE);
            emit(new Event.ReloadTracks());
        }
        else {
            store.insert(collection.path(), command.replacement(), OnConflict.REPLACE);
            emit(new Event.TrackUpdate(command.replacement()));
        }
        debouncer.signal();
    }

    private void onGetTrackInfo(Command.GetTrackInfo command) throws InterruptedException {
        TrackCollection collection = activeCollection();
        if (collection == null) {
            return;
        }
        Optional<Track> track = store.get(collection.path(), command.externalId());
        if (track.isPresent()) {
            emit(new Event.TrackInfo(track.get()));
        }
    }

    private void onGetRandomTrack(Command.GetRandomTrack command) throws InterruptedException {
        TrackCollection collection = activeCollection();
        if (collection == null) {
            return;
        }
        Optional<Track> track = store.getRandom(collection.path(), TrackFilter.none());
        if (track.isPresent()) {
            emit(new Event.PlayId(track.get().externalId()));
        }
    }

    private void onSetCollection(Command.SetCollection command) throws InterruptedException {
        Path path = toPath(command.path());
        if (path != null && store.validateSchema(path)) {
            TrackCollection collection = new TrackCollection(path, store.count(path, TrackFilter.none()));
            session.replaceCollection(collection);
            LOGGER.info("{}: active collection is now {} ({} tracks)", session.id(), path, collection.size());
            emit(Event.CollectionInfo.of(command.id(), collection));
        }
        else {
            session.replaceCollection(null);
            LOGGER.info("{}: {} is not a valid collection", session.id(), command.path());
            emit(Event.CollectionInfo.invalid(command.id(), INVALID_COLLECTION, pathCompletion.complete(command.path())));
        }
        debouncer.signal();
    }

    private void onCreateCollection(Command.CreateCollection command) throws InterruptedException {
        Path path = toPath(command.path());
        if (path == null) {
            emit(Event.Notification.error("cannot create collection - invalid path " + command.path()));
            return;
        }
        if (Files.exists(path)) {
            emit(Event.Notification.error(COLLECTION_EXISTS));
            return;
        }
        store.init(path);
        session.replaceCollection(new TrackCollection(path, 0));
        LOGGER.info("{}: created collection {}", session.id(), path);
        debouncer.signal();
    }

    private void onGetPathCompletions(Command.GetPathCompletions command) throws InterruptedException {
        emit(new Event.PathCompletions(command.id(), pathCompletion.complete(command.pathPrefix())));
    }

    private void onSearch(Command.Search command) throws InterruptedException {
        search.start(command.query(), command.kind(), command.limit(), command.queryId());
    }

    private void onSearchCancelAll(Command.SearchCancelAll command) throws InterruptedException {
        search.cancelAll();
    }

    private void onSearchTrack(Command.SearchTrack command) throws InterruptedException {
        Optional<Track> match;
        try (Stream<Track> candidates = discovery.searchFuzzy(command.title() + " - " + command.artist())) {
            match = candidates.findFirst();
        }
        if (match.isEmpty()) {
            emit(new Event.TrackNotFound(command.id()));
            return;
        }
        Track track = match.get();
        TrackCollection collection = activeCollection();
        boolean exists = collection != null && store.contains(collection.path(), track.externalId());
        emit(new Event.TrackFound(command.id(), track, exists));
    }

    private void onCollectionContainsId(Command.CollectionContainsId command) throws InterruptedException {
        TrackCollection collection = activeCollection();
        if (collection == null) {
            return;
        }
        emit(new Event.CollectionContainsIdResponse(command.id(), store.contains(collection.path(), command.externalId())));
    }

    private void onCheckImportFrom(Command.CheckImportFrom command) throws InterruptedException {
        boolean valid;
        try (ImportSourceResolver.ImportSource source = importSources.resolve(command.path())) {
            valid = source.isValid();
        }
        emit(new Event.ImportFromValid(command.path(), valid));
    }

    private void onImportFrom(Command.ImportFrom command) throws InterruptedException {
        TrackCollection collection = activeCollection();
        if (collection == null) {
            return;
        }
        int imported;
        try (ImportSourceResolver.ImportSource source = importSources.resolve(command.path())) {
            if (!source.isValid()) {
                emit(Event.Notification.error("cannot import: " + source.problem()));
                return;
            }
            imported = store.importFrom(collection.path(), source.location(), CatalogStore.METADATA_COLUMNS, command.keepUserData());
        }
        LOGGER.info("{}: imported {} tracks from {}", session.id(), imported, command.path());
        emit(Event.Notification.info("imported " + imported + " tracks"));
        emit(new Event.ReloadTracks());
        debouncer.signal();
    }

    private void onValidateTrack(Command.ValidateTrack command) throws InterruptedException {
        emit(new Event.ValidateTrackReply(command.id(), codec.isValidTrack(command.track())));
    }

    private void onExportTracksToCollection(Command.ExportTracksToCollection command) throws InterruptedException {
        Path target = toPath(command.collection());
        if (target == null || !store.validateSchema(target)) {
            emit(Event.Notification.error("cannot export - " + command.collection() + " is " + INVALID_COLLECTION));
            return;
        }
        int before = store.count(target, TrackFilter.none());
        store.insertMany(target, command.tracks(), OnConflict.IGNORE);
        int exported = store.count(target, TrackFilter.none()) - before;
        LOGGER.info("{}: exported {} of {} tracks to {}", session.id(), exported, command.tracks().size(), target);
        emit(Event.Notification.info("exported " + exported + " tracks to " + target));

        TrackCollection collection = activeCollection();
        if (collection != null && sameFile(collection.path(), target)) {
            debouncer.signal();
        }
    }

    // ==================== Helpers ====================

    @Nullable
    private static Path toPath(String path) {
        try {
            return Path.of(path);
        }
        catch (InvalidPathException e) {
            return null;
        }
    }

    private static boolean sameFile(Path a, Path b) {
        return a.toAbsolutePath().normalize().equals(b.toAbsolutePath().normalize());
    }
}
