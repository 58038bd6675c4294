/*
 * Copyright Stereo Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.stereo.server.internal;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolHandler;
import io.netty.util.ReferenceCountUtil;

import io.stereo.server.internal.session.SessionManager;
import io.stereo.server.internal.session.SessionSupervisor;
import io.stereo.server.internal.session.SessionTransport;
import io.stereo.server.tag.VisibleForTesting;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Bridges one WebSocket channel to its session.
 *
 * <p>The session is opened once the WebSocket handshake completes. Text frames are handed to the
 * session's {@link io.stereo.server.internal.session.InboundFrameBuffer}; the session's receive
 * loop consumes them off the event loop.</p>
 */
public class WebSocketFrontendHandler extends ChannelInboundHandlerAdapter {

    private static final Logger LOGGER = LoggerFactory.getLogger(WebSocketFrontendHandler.class);

    private final SessionManager sessionManager;

    @VisibleForTesting
    @Nullable
    SessionSupervisor session;

    public WebSocketFrontendHandler(SessionManager sessionManager) {
        this.sessionManager = sessionManager;
    }

    // ==================== Netty Channel Callbacks ====================

    /**
     * Netty callback for custom events (WebSocket handshake completion).
     */
    @Override
    public void userEventTriggered(ChannelHandlerContext ctx, Object event) throws Exception {
        if (event instanceof WebSocketServerProtocolHandler.HandshakeComplete handshakeComplete) {
            LOGGER.debug("{}: handshake complete for {}", ctx.channel().id(), handshakeComplete.requestUri());
            this.session = sessionManager.open(new ChannelSessionTransport(ctx.channel()));
        }
        super.userEventTriggered(ctx, event);
    }

    /**
     * Netty callback when the client connection is closed.
     */
    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        LOGGER.trace("INACTIVE on inbound {}", ctx.channel());
        if (session != null) {
            session.frameBuffer().peerClosed();
        }
        super.channelInactive(ctx);
    }

    /**
     * Netty callback when a frame is read from the client.
     */
    @Override
    public void channelRead(ChannelHandlerContext ctx, Object msg) {
        try {
            if (msg instanceof TextWebSocketFrame textFrame && session != null) {
                session.frameBuffer().append(textFrame.text());
            }
            else if (msg instanceof WebSocketFrame frame) {
                LOGGER.debug("{}: ignoring {}", ctx.channel().id(), frame.getClass().getSimpleName());
            }
        }
        finally {
            ReferenceCountUtil.release(msg);
        }
    }

    /**
     * Netty callback for client-side exceptions.
     */
    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        LOGGER.warn("{}: closing channel after exception: {}", ctx.channel().id(), cause.toString());
        LOGGER.debug("{}: exception detail", ctx.channel().id(), cause);
        if (session != null) {
            new ChannelSessionTransport(ctx.channel()).close(SessionTransport.INTERNAL_ERROR, "internal error");
        }
        else {
            ctx.close();
        }
    }
}
