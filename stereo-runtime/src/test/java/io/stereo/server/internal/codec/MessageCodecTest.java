/*
 * Copyright Stereo Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.stereo.server.internal.codec;

import java.nio.file.Path;
import java.time.LocalDate;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;
import org.junit.jupiter.params.provider.ValueSource;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.stereo.server.message.Command;
import io.stereo.server.message.CommandType;
import io.stereo.server.message.Event;
import io.stereo.server.model.FilterCondition;
import io.stereo.server.model.SearchKind;
import io.stereo.server.model.Track;
import io.stereo.server.model.TrackCollection;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.InstanceOfAssertFactories.type;

class MessageCodecTest {

    private static final ObjectMapper JSON = new ObjectMapper();

    private final MessageCodec codec = new MessageCodec();

    @Test
    void shouldDecodeHeartbeat() throws Exception {
        // Given
        String frame = "{\"type\":\"heartbeat\",\"timestamp\":1700000000000}";

        // When
        Command command = codec.decode(frame);

        // Then
        assertThat(command).isEqualTo(new Command.Heartbeat(1700000000000L));
        assertThat(command.commandType()).isEqualTo(CommandType.HEARTBEAT);
    }

    @Test
    void shouldApplyDefaultsWhenDecodingAddTrack() throws Exception {
        // Given
        String frame = "{\"type\":\"add-track\",\"track\":{\"yt_id\":\"abc\",\"title\":\"Song\",\"artists\":[\"Artist\"]}}";

        // When
        Command command = codec.decode(frame);

        // Then
        assertThat(command).asInstanceOf(type(Command.AddTrack.class))
                .satisfies(addTrack -> {
                    assertThat(addTrack.overwriteExisting()).isFalse();
                    assertThat(addTrack.track().externalId()).isEqualTo("abc");
                    assertThat(addTrack.track().playCount()).isZero();
                    assertThat(addTrack.track().rating()).isNull();
                });
    }

    @Test
    void shouldAcceptBeatportIdAsString() throws Exception {
        // Given
        String frame = "{\"type\":\"add-track\",\"overwrite_existing\":true,"
                + "\"track\":{\"yt_id\":\"abc\",\"bp_id\":\"12345678901234567\",\"title\":\"Song\",\"artists\":[]}}";

        // When
        Command command = codec.decode(frame);

        // Then
        assertThat(command).asInstanceOf(type(Command.AddTrack.class))
                .satisfies(addTrack -> {
                    assertThat(addTrack.overwriteExisting()).isTrue();
                    assertThat(addTrack.track().bpId()).isEqualTo(12345678901234567L);
                });
    }

    @Test
    void shouldDecodeSearchKindAndDefaultToFuzzy() throws Exception {
        // Given
        String byLabel = "{\"type\":\"search\",\"query\":\"Hospital\",\"query_id\":7,\"limit\":20,\"kind\":\"by-label\"}";
        String noKind = "{\"type\":\"search\",\"query\":\"Hospital\",\"query_id\":8,\"limit\":20}";

        // When
        Command first = codec.decode(byLabel);
        Command second = codec.decode(noKind);

        // Then
        assertThat(first).isEqualTo(new Command.Search("Hospital", 7, 20, SearchKind.BY_LABEL));
        assertThat(second).isEqualTo(new Command.Search("Hospital", 8, 20, SearchKind.FUZZY));
    }

    @Test
    void shouldDecodeGridFilterModel() throws Exception {
        // Given
        String frame = "{\"type\":\"get-rows\",\"id\":3,\"startRow\":0,\"endRow\":100,"
                + "\"sortModel\":[{\"colId\":\"title\",\"sort\":\"desc\"}],"
                + "\"filterModel\":{"
                + "\"title\":{\"filterType\":\"text\",\"type\":\"contains\",\"filter\":\"love\"},"
                + "\"bpm\":{\"filterType\":\"number\",\"operator\":\"OR\",\"conditions\":["
                + "{\"filterType\":\"number\",\"type\":\"lessThan\",\"filter\":100},"
                + "{\"filterType\":\"number\",\"type\":\"greaterThan\",\"filter\":170}]}}}";

        // When
        Command command = codec.decode(frame);

        // Then
        Command.GetRows getRows = (Command.GetRows) command;
        assertThat(getRows.sortModel()).singleElement()
                .satisfies(item -> assertThat(item.isDescending()).isTrue());
        assertThat(getRows.filterModel().conditions().get("title"))
                .isEqualTo(FilterCondition.Simple.text("contains", "love"));
        assertThat(getRows.filterModel().conditions().get("bpm"))
                .asInstanceOf(type(FilterCondition.Combined.class))
                .satisfies(combined -> {
                    assertThat(combined.isDisjunction()).isTrue();
                    assertThat(combined.conditions()).extracting(FilterCondition.Simple::type)
                            .containsExactly("lessThan", "greaterThan");
                });
    }

    @Test
    void shouldDefaultMissingSortAndFilterModels() throws Exception {
        // Given
        String frame = "{\"type\":\"get-rows\",\"id\":1,\"startRow\":0,\"endRow\":50}";

        // When
        Command.GetRows getRows = (Command.GetRows) codec.decode(frame);

        // Then
        assertThat(getRows.sortModel()).isEmpty();
        assertThat(getRows.filterModel().isEmpty()).isTrue();
    }

    @Test
    void shouldKeepExplicitNullRating() throws Exception {
        // Given
        String frame = "{\"type\":\"update-rating\",\"yt_id\":\"abc\",\"rating\":null}";

        // When
        Command command = codec.decode(frame);

        // Then
        assertThat(command).isEqualTo(new Command.UpdateRating("abc", null));
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "",
            "not json",
            "null",
            "[]",
            "{}",
            "{\"type\":\"dance\"}",
            "{\"type\":\"inc-play-count\"}",
            "{\"type\":\"heartbeat\",\"timestamp\":1}{\"type\":\"heartbeat\",\"timestamp\":2}",
            "{\"type\":\"search\",\"query\":\"x\",\"query_id\":1,\"limit\":5,\"kind\":\"by-colour\"}"
    })
    void shouldRejectMalformedFrames(String frame) {
        // When/Then
        assertThatThrownBy(() -> codec.decode(frame)).isInstanceOf(DecodeException.class);
    }

    @Test
    void shouldEncodeBatchAsJsonArray() throws Exception {
        // Given
        List<Event> batch = List.of(new Event.BackendInfo("1.2.3"), new Event.ReloadTracks(), new Event.SearchComplete(4));

        // When
        JsonNode encoded = JSON.readTree(codec.encodeBatch(batch));

        // Then
        assertThat(encoded.isArray()).isTrue();
        assertThat(encoded).hasSize(3);
        assertThat(encoded.get(0).get("type").asText()).isEqualTo("backend-info");
        assertThat(encoded.get(0).get("version").asText()).isEqualTo("1.2.3");
        assertThat(encoded.get(1).get("type").asText()).isEqualTo("reload-tracks");
        assertThat(encoded.get(2).get("type").asText()).isEqualTo("search-complete");
        assertThat(encoded.get(2).get("query_id").asInt()).isEqualTo(4);
    }

    @Test
    void shouldEncodeTrackFieldsInSnakeCaseWithStringBeatportId() throws Exception {
        // Given
        Track track = new Track("abc", 12345L, null, "Song", "Extended Mix", List.of("A", "B"), LocalDate.of(2020, 1, 2),
                "Label", null, 300, 174, "DnB", "Am", null, 5, 2, LocalDate.of(2024, 6, 1));

        // When
        JsonNode encoded = JSON.readTree(codec.encode(new Event.TrackUpdate(track))).get("track");

        // Then
        assertThat(encoded.get("yt_id").asText()).isEqualTo("abc");
        assertThat(encoded.get("bp_id").isTextual()).isTrue();
        assertThat(encoded.get("bp_id").asText()).isEqualTo("12345");
        assertThat(encoded.get("mix_name").asText()).isEqualTo("Extended Mix");
        assertThat(encoded.get("release_date").asText()).isEqualTo("2020-01-02");
        assertThat(encoded.get("play_count").asInt()).isEqualTo(2);
        assertThat(encoded.get("last_played").asText()).isEqualTo("2024-06-01");
    }

    @Test
    void shouldOmitAbsentFieldsOfCollectionInfo() throws Exception {
        // Given
        Event event = Event.CollectionInfo.of(null, new TrackCollection(Path.of("/music/stereo.db"), 12));

        // When
        JsonNode encoded = JSON.readTree(codec.encode(event));

        // Then
        assertThat(encoded.has("id")).isFalse();
        assertThat(encoded.has("error_message")).isFalse();
        assertThat(encoded.get("collection").get("path").asText()).isEqualTo("/music/stereo.db");
        assertThat(encoded.get("collection").get("size").asInt()).isEqualTo(12);
    }

    @Test
    void shouldEncodeNotificationSeverity() throws Exception {
        // When
        JsonNode encoded = JSON.readTree(codec.encode(Event.Notification.warn("careful")));

        // Then
        assertThat(encoded.get("type").asText()).isEqualTo("notification");
        assertThat(encoded.get("kind").asText()).isEqualTo("warn");
    }

    static Stream<String> commandFrames() {
        String track = "{\"yt_id\":\"abc\",\"bp_id\":\"12345678901234\",\"title\":\"Song\",\"mix_name\":\"Extended Mix\","
                + "\"artists\":[\"A\",\"B\"],\"release_date\":\"2020-01-02\",\"bpm\":174,\"rating\":4,\"play_count\":3,"
                + "\"last_played\":\"2024-06-01\"}";
        return Stream.of(
                "{\"type\":\"heartbeat\",\"timestamp\":1700000000000}",
                "{\"type\":\"delete-tracks\",\"ids\":[\"a\",\"b\"]}",
                "{\"type\":\"update-rating\",\"yt_id\":\"abc\",\"rating\":5}",
                "{\"type\":\"update-rating\",\"yt_id\":\"abc\",\"rating\":null}",
                "{\"type\":\"inc-play-count\",\"yt_id\":\"abc\"}",
                "{\"type\":\"get-rows\",\"id\":3,\"startRow\":0,\"endRow\":100,"
                        + "\"sortModel\":[{\"colId\":\"title\",\"sort\":\"desc\"}],"
                        + "\"filterModel\":{\"bpm\":{\"filterType\":\"number\",\"operator\":\"OR\",\"conditions\":["
                        + "{\"filterType\":\"number\",\"type\":\"lessThan\",\"filter\":100},"
                        + "{\"filterType\":\"number\",\"type\":\"inRange\",\"filter\":170,\"filterTo\":175}]},"
                        + "\"title\":{\"filterType\":\"text\",\"type\":\"contains\",\"filter\":\"dawn\"}}}",
                "{\"type\":\"get-rows\",\"id\":1,\"startRow\":0,\"endRow\":50}",
                "{\"type\":\"get-row-index\",\"id\":4,\"yt_id\":\"abc\",\"sortModel\":[{\"colId\":\"bpm\",\"sort\":\"asc\"}],"
                        + "\"filterModel\":{\"release_date\":{\"filterType\":\"date\",\"type\":\"inRange\","
                        + "\"dateFrom\":\"2020-01-01\",\"dateTo\":\"2020-12-31\"}}}",
                "{\"type\":\"add-track\",\"overwrite_existing\":true,\"track\":" + track + "}",
                "{\"type\":\"add-track\",\"track\":{\"yt_id\":\"abc\",\"title\":\"Song\",\"artists\":[\"Artist\"]}}",
                "{\"type\":\"add-tracks\",\"overwrite_existing\":false,\"tracks\":[" + track + "]}",
                "{\"type\":\"update-track\",\"old\":" + track + ",\"new\":{\"yt_id\":\"abc\",\"title\":\"Renamed\",\"artists\":[\"A\"]}}",
                "{\"type\":\"get-track-info\",\"yt_id\":\"abc\"}",
                "{\"type\":\"get-random-track\"}",
                "{\"type\":\"set-collection\",\"id\":2,\"path\":\"/music/stereo.db\"}",
                "{\"type\":\"create-collection\",\"path\":\"/music/new.db\"}",
                "{\"type\":\"get-path-completions\",\"id\":5,\"path_prefix\":\"/music/s\"}",
                "{\"type\":\"search\",\"query\":\"jungle\",\"query_id\":6,\"limit\":20,\"kind\":\"by-label\"}",
                "{\"type\":\"search\",\"query\":\"jungle\",\"query_id\":7,\"limit\":20}",
                "{\"type\":\"search-cancel-all\"}",
                "{\"type\":\"search-track\",\"id\":8,\"title\":\"Song\",\"artist\":\"A\"}",
                "{\"type\":\"collection-contains-id\",\"id\":9,\"yt_id\":\"abc\"}",
                "{\"type\":\"check-import-from\",\"path\":\"https://example.com/stereo.db\"}",
                "{\"type\":\"import-from\",\"path\":\"/music/other.db\",\"keep_user_data\":true}",
                "{\"type\":\"validate-track\",\"id\":10,\"track\":{\"yt_id\":\"abc\",\"title\":7,\"extra\":[1,2]}}",
                "{\"type\":\"export-tracks-to-collection\",\"tracks\":[" + track + "],\"collection\":\"/music/export.db\"}");
    }

    @ParameterizedTest
    @MethodSource("commandFrames")
    void shouldDecodeWhatItEncodes(String frame) throws Exception {
        // Given
        Command original = codec.decode(frame);

        // When
        Command decoded = codec.decode(codec.encode(original));

        // Then
        assertThat(decoded).isEqualTo(original);
    }

    @Test
    void shouldHaveRoundTripFrameForEveryCommandType() throws Exception {
        // Given
        Set<CommandType> covered = EnumSet.noneOf(CommandType.class);

        // When
        for (String frame : commandFrames().toList()) {
            covered.add(codec.decode(frame).commandType());
        }

        // Then
        assertThat(covered).containsExactlyInAnyOrder(CommandType.values());
    }

    @Test
    void shouldValidateTracks() throws Exception {
        // Given
        JsonNode valid = JSON.readTree("{\"yt_id\":\"abc\",\"title\":\"Song\",\"artists\":[\"A\"]}");
        JsonNode missingTitle = JSON.readTree("{\"yt_id\":\"abc\",\"artists\":[\"A\"]}");
        JsonNode wrongType = JSON.readTree("{\"yt_id\":\"abc\",\"title\":\"Song\",\"artists\":[\"A\"],\"bpm\":\"fast\"}");
        JsonNode notAnObject = JSON.readTree("[1,2]");

        // When/Then
        assertThat(codec.isValidTrack(valid)).isTrue();
        assertThat(codec.isValidTrack(missingTitle)).isFalse();
        assertThat(codec.isValidTrack(wrongType)).isFalse();
        assertThat(codec.isValidTrack(notAnObject)).isFalse();
    }
}
