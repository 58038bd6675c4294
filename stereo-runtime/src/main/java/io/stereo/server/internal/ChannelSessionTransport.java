/*
 * Copyright Stereo Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.stereo.server.internal;

import java.io.IOException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.handler.codec.http.websocketx.CloseWebSocketFrame;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;

import io.stereo.server.internal.session.SessionTransport;

/**
 * {@link SessionTransport} over a Netty WebSocket channel.
 */
public class ChannelSessionTransport implements SessionTransport {

    private static final Logger LOGGER = LoggerFactory.getLogger(ChannelSessionTransport.class);

    private final Channel channel;

    public ChannelSessionTransport(Channel channel) {
        this.channel = channel;
    }

    @Override
    public String remoteAddress() {
        return String.valueOf(channel.remoteAddress());
    }

    /**
     * Writes one text frame and waits until it has been flushed to the socket.
     */
    @Override
    public void send(String text) throws IOException, InterruptedException {
        if (!channel.isActive()) {
            throw new IOException("Channel " + channel.id() + " is closed");
        }
        ChannelFuture future = channel.writeAndFlush(new TextWebSocketFrame(text)).await();
        if (!future.isSuccess()) {
            throw new IOException("Write to channel " + channel.id() + " failed", future.cause());
        }
    }

    @Override
    public void pauseReading() {
        LOGGER.trace("{}: pausing reads", channel.id());
        channel.config().setAutoRead(false);
    }

    @Override
    public void resumeReading() {
        LOGGER.trace("{}: resuming reads", channel.id());
        channel.config().setAutoRead(true);
    }

    @Override
    public void close(int statusCode, String reason) {
        if (channel.isActive()) {
            channel.writeAndFlush(new CloseWebSocketFrame(statusCode, reason))
                    .addListener(ChannelFutureListener.CLOSE);
        }
    }
}
