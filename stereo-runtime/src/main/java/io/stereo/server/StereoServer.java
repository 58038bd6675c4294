/*
 * Copyright Stereo Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.stereo.server;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.InetSocketAddress;
import java.nio.file.Files;
import java.time.Clock;
import java.time.Duration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.util.concurrent.DefaultThreadFactory;

import io.stereo.server.config.ServerConfig;
import io.stereo.server.internal.StereoChannelInitializer;
import io.stereo.server.internal.codec.MessageCodec;
import io.stereo.server.internal.discovery.DiscoveryProviders;
import io.stereo.server.internal.dispatch.ImportSourceResolver;
import io.stereo.server.internal.session.SessionManager;
import io.stereo.server.internal.session.SessionServices;
import io.stereo.server.internal.store.FileSystemPathCompletion;
import io.stereo.server.internal.store.SqliteCatalogStore;
import io.stereo.server.internal.util.VersionInfo;
import io.stereo.server.message.Event;
import io.stereo.server.service.CatalogStore;
import io.stereo.server.service.DiscoveryProvider;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * The stereo server: a WebSocket endpoint at {@code ws://host:port/ws} backed by one session per
 * connection.
 */
public final class StereoServer implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(StereoServer.class);

    static final String SHUTDOWN_MESSAGE = "server shutting down";
    private static final Duration SHUTDOWN_DRAIN_TIMEOUT = Duration.ofSeconds(1);

    private final ServerConfig config;
    private final SessionManager sessionManager;

    private @Nullable EventLoopGroup bossGroup;
    private @Nullable EventLoopGroup workerGroup;
    private @Nullable Channel serverChannel;

    public StereoServer(ServerConfig config) {
        this(config, new SqliteCatalogStore(), DiscoveryProviders.load());
    }

    public StereoServer(ServerConfig config, CatalogStore store, DiscoveryProvider discovery) {
        this.config = config;
        this.sessionManager = new SessionManager(new SessionServices(store,
                discovery,
                new FileSystemPathCompletion(),
                new ImportSourceResolver(store, config.session().importTimeout()),
                new MessageCodec(),
                config.defaultCollection(),
                VersionInfo.version(),
                config.session(),
                Clock.systemDefaultZone()));
    }

    /**
     * Binds the listening socket.
     *
     * @throws IllegalStateException if the server was already started
     */
    public synchronized StereoServer startup() throws InterruptedException {
        if (serverChannel != null) {
            throw new IllegalStateException("This server is already running");
        }
        try {
            Files.createDirectories(config.home());
        }
        catch (IOException e) {
            throw new UncheckedIOException("Cannot create home directory " + config.home(), e);
        }
        LOGGER.info("Starting stereo {} with {}", VersionInfo.version(), config);

        bossGroup = new NioEventLoopGroup(1, new DefaultThreadFactory("stereo-boss"));
        workerGroup = new NioEventLoopGroup(0, new DefaultThreadFactory("stereo-worker"));
        ServerBootstrap bootstrap = new ServerBootstrap()
                .group(bossGroup, workerGroup)
                .channel(NioServerSocketChannel.class)
                .childOption(ChannelOption.TCP_NODELAY, true)
                .childHandler(new StereoChannelInitializer(sessionManager, config.dev()));
        serverChannel = bootstrap.bind(config.host(), config.port()).sync().channel();
        LOGGER.info("Listening on ws://{}:{}{}", config.host(), localPort(), StereoChannelInitializer.WEBSOCKET_PATH);
        return this;
    }

    /**
     * The port actually bound, useful when configured with port 0.
     */
    public int localPort() {
        Channel channel = serverChannel;
        if (channel == null) {
            throw new IllegalStateException("This server is not running");
        }
        return ((InetSocketAddress) channel.localAddress()).getPort();
    }

    /**
     * Blocks until the listening socket is closed.
     */
    public void block() throws InterruptedException {
        Channel channel = serverChannel;
        if (channel == null) {
            throw new IllegalStateException("This server is not running");
        }
        channel.closeFuture().sync();
    }

    /**
     * Tells every client the server is going away, then closes all sessions and the socket.
     */
    public synchronized void shutdown() throws InterruptedException {
        if (serverChannel == null) {
            return;
        }
        LOGGER.info("Shutting down");
        sessionManager.broadcast(Event.Notification.warn(SHUTDOWN_MESSAGE));
        if (!sessionManager.awaitOutboundDrained(SHUTDOWN_DRAIN_TIMEOUT)) {
            LOGGER.warn("Some clients were not told about the shutdown within {}", SHUTDOWN_DRAIN_TIMEOUT);
        }
        sessionManager.close();
        serverChannel.close().sync();
        serverChannel = null;
        if (workerGroup != null) {
            workerGroup.shutdownGracefully().sync();
        }
        if (bossGroup != null) {
            bossGroup.shutdownGracefully().sync();
        }
    }

    @Override
    public void close() throws InterruptedException {
        shutdown();
    }

    SessionManager sessionManager() {
        return sessionManager;
    }
}
