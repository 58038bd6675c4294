/*
 * Copyright Stereo Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.stereo.server.message;

import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * The closed set of client command variants with their wire tags.
 */
public enum CommandType {

    HEARTBEAT("heartbeat", Command.Heartbeat.class),
    DELETE_TRACKS("delete-tracks", Command.DeleteTracks.class),
    UPDATE_RATING("update-rating", Command.UpdateRating.class),
    INC_PLAY_COUNT("inc-play-count", Command.IncPlayCount.class),
    GET_ROWS("get-rows", Command.GetRows.class),
    GET_ROW_INDEX("get-row-index", Command.GetRowIndex.class),
    ADD_TRACK("add-track", Command.AddTrack.class),
    ADD_TRACKS("add-tracks", Command.AddTracks.class),
    UPDATE_TRACK("update-track", Command.UpdateTrack.class),
    GET_TRACK_INFO("get-track-info", Command.GetTrackInfo.class),
    GET_RANDOM_TRACK("get-random-track", Command.GetRandomTrack.class),
    SET_COLLECTION("set-collection", Command.SetCollection.class),
    CREATE_COLLECTION("create-collection", Command.CreateCollection.class),
    GET_PATH_COMPLETIONS("get-path-completions", Command.GetPathCompletions.class),
    SEARCH("search", Command.Search.class),
    SEARCH_CANCEL_ALL("search-cancel-all", Command.SearchCancelAll.class),
    SEARCH_TRACK("search-track", Command.SearchTrack.class),
    COLLECTION_CONTAINS_ID("collection-contains-id", Command.CollectionContainsId.class),
    CHECK_IMPORT_FROM("check-import-from", Command.CheckImportFrom.class),
    IMPORT_FROM("import-from", Command.ImportFrom.class),
    VALIDATE_TRACK("validate-track", Command.ValidateTrack.class),
    EXPORT_TRACKS_TO_COLLECTION("export-tracks-to-collection", Command.ExportTracksToCollection.class);

    private static final Map<Class<?>, CommandType> BY_CLASS = Stream.of(values())
            .collect(Collectors.toUnmodifiableMap(CommandType::commandClass, Function.identity()));

    private final String tag;
    private final Class<? extends Command> commandClass;

    CommandType(String tag, Class<? extends Command> commandClass) {
        this.tag = tag;
        this.commandClass = commandClass;
    }

    /**
     * @return the value of the {@code type} property on the wire
     */
    public String tag() {
        return tag;
    }

    public Class<? extends Command> commandClass() {
        return commandClass;
    }

    public static CommandType of(Command command) {
        CommandType type = BY_CLASS.get(command.getClass());
        if (type == null) {
            throw new IllegalArgumentException("Unregistered command class " + command.getClass().getName());
        }
        return type;
    }
}
