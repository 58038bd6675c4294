/*
 * Copyright Stereo Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.stereo.server.internal.codec;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.jsontype.NamedType;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import io.stereo.server.message.Command;
import io.stereo.server.message.CommandType;
import io.stereo.server.message.Event;
import io.stereo.server.model.Track;

/**
 * Translates between wire text and typed messages.
 *
 * <p>A client frame holds exactly one command. A server frame holds a JSON array of events. Dates are
 * written as ISO-8601 strings and absent optional fields are omitted. Instances are thread safe.</p>
 */
public class MessageCodec {

    private static final Logger LOGGER = LoggerFactory.getLogger(MessageCodec.class);

    private static final TypeReference<List<Event>> EVENT_LIST = new TypeReference<>() {
    };

    private final ObjectMapper mapper;
    private final ObjectReader commandReader;
    private final ObjectWriter commandWriter;
    private final ObjectWriter eventWriter;
    private final ObjectWriter eventListWriter;

    public MessageCodec() {
        this(createObjectMapper());
    }

    MessageCodec(ObjectMapper mapper) {
        this.mapper = mapper;
        this.commandReader = mapper.readerFor(Command.class);
        this.commandWriter = mapper.writerFor(Command.class);
        this.eventWriter = mapper.writerFor(Event.class);
        this.eventListWriter = mapper.writerFor(EVENT_LIST);
    }

    public static ObjectMapper createObjectMapper() {
        JsonMapper mapper = JsonMapper.builder()
                .addModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES)
                .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
                .build();
        for (CommandType type : CommandType.values()) {
            mapper.registerSubtypes(new NamedType(type.commandClass(), type.tag()));
        }
        mapper.registerSubtypes(Event.class.getPermittedSubclasses());
        return mapper;
    }

    /**
     * Decodes one client frame.
     *
     * @throws DecodeException if the frame is not exactly one valid command
     */
    public Command decode(String text) throws DecodeException {
        try {
            Command command = commandReader.readValue(text);
            if (command == null) {
                throw new DecodeException("Frame holds no command");
            }
            return command;
        }
        catch (JsonProcessingException e) {
            throw new DecodeException("Invalid command: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Encodes one batch of events as a JSON array.
     */
    public String encodeBatch(List<? extends Event> events) {
        try {
            return eventListWriter.writeValueAsString(events);
        }
        catch (JsonProcessingException e) {
            // every event is a plain record, so this is a programming error
            throw new IllegalStateException("Failed to encode events", e);
        }
    }

    public String encode(Event event) {
        try {
            return eventWriter.writeValueAsString(event);
        }
        catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode event " + event.getClass().getSimpleName(), e);
        }
    }

    public String encode(Command command) {
        try {
            return commandWriter.writeValueAsString(command);
        }
        catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode command " + command.commandType().tag(), e);
        }
    }

    /**
     * Checks whether an arbitrary JSON value would decode as a track.
     */
    public boolean isValidTrack(JsonNode node) {
        if (!node.isObject()) {
            return false;
        }
        try {
            return mapper.treeToValue(node, Track.class) != null;
        }
        catch (JsonProcessingException | IllegalArgumentException e) {
            LOGGER.debug("Track failed validation: {}", e.getMessage());
            return false;
        }
    }
}
