/*
 * Copyright Stereo Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.stereo.server.internal;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.socket.SocketChannel;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.handler.codec.http.websocketx.WebSocketFrameAggregator;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolHandler;
import io.netty.handler.logging.LogLevel;
import io.netty.handler.logging.LoggingHandler;

import io.stereo.server.internal.session.SessionManager;

/**
 * Sets up the pipeline of an accepted connection: HTTP, the WebSocket upgrade on
 * {@value #WEBSOCKET_PATH}, then the session bridge.
 */
public class StereoChannelInitializer extends ChannelInitializer<SocketChannel> {

    private static final Logger LOGGER = LoggerFactory.getLogger(StereoChannelInitializer.class);

    public static final String WEBSOCKET_PATH = "/ws";
    static final int MAX_CONTENT_LENGTH = 65536;
    // large imports and exports travel as single frames
    static final int MAX_FRAME_PAYLOAD_LENGTH = 64 * 1024 * 1024;

    private final SessionManager sessionManager;
    private final boolean logNetwork;

    public StereoChannelInitializer(SessionManager sessionManager, boolean logNetwork) {
        this.sessionManager = sessionManager;
        this.logNetwork = logNetwork;
    }

    @Override
    protected void initChannel(SocketChannel ch) {
        LOGGER.trace("Connection from {}", ch.remoteAddress());
        ChannelPipeline pipeline = ch.pipeline();
        if (logNetwork) {
            pipeline.addLast("networkLogger", new LoggingHandler("io.stereo.server.internal.NetworkLogger", LogLevel.INFO));
        }
        pipeline.addLast("httpCodec", new HttpServerCodec());
        pipeline.addLast("httpAggregator", new HttpObjectAggregator(MAX_CONTENT_LENGTH));
        pipeline.addLast("webSocketProtocol", new WebSocketServerProtocolHandler(WEBSOCKET_PATH, null, true, MAX_FRAME_PAYLOAD_LENGTH));
        pipeline.addLast("webSocketAggregator", new WebSocketFrameAggregator(MAX_FRAME_PAYLOAD_LENGTH));
        pipeline.addLast("frontendHandler", new WebSocketFrontendHandler(sessionManager));
    }
}
