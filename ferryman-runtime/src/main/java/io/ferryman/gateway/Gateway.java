/*
 * Copyright Ferryman Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.ferryman.gateway;

import java.net.InetSocketAddress;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.WriteBufferWaterMark;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;

import io.ferryman.config.GatewayConfiguration;
import io.ferryman.config.ListenerDefinition;
import io.ferryman.config.OutboundDefinition;
import io.ferryman.internal.ClientFrontendHandler;
import io.ferryman.internal.ControlServerHandler;
import io.ferryman.internal.EngineLink;
import io.ferryman.internal.EngineSlot;
import io.ferryman.internal.EngineState;
import io.ferryman.internal.EngineStateMachine;
import io.ferryman.internal.SessionRouter;
import io.ferryman.internal.util.Metrics;
import io.ferryman.net.WireProtocol;
import io.ferryman.net.WireProtocolRegistry;
import io.ferryman.protocol.CommandResult;
import io.ferryman.protocol.ControlChannels;
import io.ferryman.protocol.LifecycleCommand;
import io.ferryman.service.HostPort;
import io.ferryman.session.SessionRegistry;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * The long-lived front of a Ferryman deployment. Holds every client connection and its
 * session across engine restarts, routes traffic to whichever engine is attached, and
 * answers lifecycle commands from the launcher.
 *
 * <pre>
 *   clients ─► listeners ─► ClientFrontendHandler ─┐
 *                                                  ├─► SessionRouter ─► EngineSlot ─► engine
 *   launcher ─► control port ─► ControlServerHandler ─► EngineStateMachine
 *   engine   ─┘
 * </pre>
 */
public class Gateway implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(Gateway.class);

    private final GatewayConfiguration configuration;
    private final WireProtocolRegistry protocols;
    private final Function<HostPort, EngineSpawner> spawnerFactory;
    private final Clock clock;
    private final ObjectMapper statusMapper = new ObjectMapper();

    private final SessionRegistry registry;
    private final EngineSlot slot = new EngineSlot();
    private final SessionRouter router;

    private @Nullable EventLoopGroup bossGroup;
    private @Nullable EventLoopGroup workerGroup;
    private @Nullable EngineStateMachine stateMachine;
    private volatile @Nullable EngineSpawner spawner;
    private @Nullable Channel controlChannel;
    private final Map<String, Channel> listenerChannels = new LinkedHashMap<>();
    private @Nullable Instant startedAt;

    /**
     * Gateway with the built-in wire protocols that spawns engines with the configured command.
     */
    public Gateway(GatewayConfiguration configuration) {
        this(configuration,
                WireProtocolRegistry.withBuiltIns(),
                controlAddress -> new ProcessEngineSpawner(configuration.engine(), controlAddress),
                Clock.systemUTC());
    }

    /**
     * @param configuration gateway configuration
     * @param protocols wire protocols available to listeners
     * @param spawnerFactory given the bound control address, creates the engine spawner
     * @param clock clock for uptimes and session timestamps
     */
    public Gateway(GatewayConfiguration configuration,
                   WireProtocolRegistry protocols,
                   Function<HostPort, EngineSpawner> spawnerFactory,
                   Clock clock) {
        this.configuration = Objects.requireNonNull(configuration, "configuration");
        this.protocols = Objects.requireNonNull(protocols, "protocols");
        this.spawnerFactory = Objects.requireNonNull(spawnerFactory, "spawnerFactory");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.registry = new SessionRegistry(configuration.inputQueue().capacity(), configuration.inputQueue().overflowPolicy(), clock);
        this.router = new SessionRouter(registry, slot, configuration.inputQueue(), configuration.throttle());
        Metrics.openSessionsGauge(registry::size);
    }

    // ==================== Startup ====================

    /**
     * Binds the control port and every listener, then starts an engine if configured to.
     * Returns once everything is bound; the engine start completes in the background.
     *
     * @return this gateway
     * @throws InterruptedException if interrupted while binding
     */
    public synchronized Gateway start() throws InterruptedException {
        if (startedAt != null) {
            throw new IllegalStateException("gateway already started");
        }
        // resolve protocols first so a bad listener fails before anything is bound
        Map<ListenerDefinition, WireProtocol> resolved = new LinkedHashMap<>();
        for (ListenerDefinition listener : configuration.listeners()) {
            resolved.put(listener, protocols.create(listener));
        }

        bossGroup = new NioEventLoopGroup(1);
        workerGroup = new NioEventLoopGroup();
        startedAt = clock.instant();

        // the spawner needs the bound control port, which is only known after binding
        stateMachine = new EngineStateMachine(mode -> boundSpawner().spawn(mode),
                slot,
                router,
                workerGroup.next(),
                configuration.engine().attachTimeout(),
                configuration.engine().stopTimeout(),
                clock);

        HostPort configuredControl = configuration.controlAddress();
        controlChannel = bindControl(configuredControl);
        HostPort boundControl = new HostPort(configuredControl.host(), ((InetSocketAddress) controlChannel.localAddress()).getPort());
        spawner = spawnerFactory.apply(boundControl);
        LOGGER.info("Control channel listening on {}", boundControl);

        for (Map.Entry<ListenerDefinition, WireProtocol> entry : resolved.entrySet()) {
            ListenerDefinition listener = entry.getKey();
            Channel channel = bindListener(listener, entry.getValue());
            listenerChannels.put(listener.name(), channel);
            LOGGER.info("Listener '{}' ({}) listening on {}", listener.name(), entry.getValue().name(), channel.localAddress());
        }

        if (configuration.engine().autoStart()) {
            stateMachine.handleCommand(LifecycleCommand.START)
                    .thenAccept(result -> LOGGER.info("Initial engine start: {} {}", result.status(), result.detail()));
        }
        return this;
    }

    private Channel bindControl(HostPort address) throws InterruptedException {
        ServerBootstrap bootstrap = new ServerBootstrap()
                .group(bossGroup, workerGroup)
                .channel(NioServerSocketChannel.class)
                .childOption(ChannelOption.TCP_NODELAY, true)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        ControlChannels.configure(ch.pipeline(), configuration.maxFrameSizeBytes(), configuration.logFrames());
                        ch.pipeline().addLast("controlHandler", new ControlServerHandler(stateMachine(), router, Gateway.this::handleControlCommand));
                    }
                });
        return bootstrap.bind(address.toSocketAddress()).sync().channel();
    }

    private Channel bindListener(ListenerDefinition listener, WireProtocol protocol) throws InterruptedException {
        OutboundDefinition outbound = configuration.outbound();
        ServerBootstrap bootstrap = new ServerBootstrap()
                .group(bossGroup, workerGroup)
                .channel(NioServerSocketChannel.class)
                .option(ChannelOption.SO_BACKLOG, 128)
                .childOption(ChannelOption.TCP_NODELAY, true)
                .childOption(ChannelOption.SO_KEEPALIVE, true)
                .childOption(ChannelOption.WRITE_BUFFER_WATER_MARK,
                        new WriteBufferWaterMark(outbound.writeBufferLowWaterMark(), outbound.writeBufferHighWaterMark()))
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        protocol.configurePipeline(ch.pipeline());
                        ch.pipeline().addLast("frontend", new ClientFrontendHandler(protocol, router, outbound.slowClientPolicy()));
                    }
                });
        return bootstrap.bind(listener.bindAddress().toSocketAddress()).sync().channel();
    }

    // ==================== Lifecycle commands ====================

    /**
     * Apply a lifecycle command. Never throws; failures are reported in the result.
     */
    public CompletableFuture<CommandResult> handleControlCommand(LifecycleCommand command) {
        if (command == LifecycleCommand.STATUS) {
            return CompletableFuture.completedFuture(status());
        }
        return stateMachine().handleCommand(command);
    }

    /**
     * @return the {@code status} answer, a JSON {@link StatusReport} as the detail
     */
    public CommandResult status() {
        try {
            return CommandResult.ok(statusMapper.writeValueAsString(statusReport()));
        }
        catch (JsonProcessingException e) {
            return CommandResult.error("could not render status: " + e.getMessage());
        }
    }

    public StatusReport statusReport() {
        Instant now = clock.instant();
        EngineState state = stateMachine().state();
        Long pid = null;
        Long uptime = null;
        EngineLink link = state.attachedLink();
        if (link != null) {
            pid = link.pid();
            uptime = Duration.between(link.attachedAt(), now).toSeconds();
        }
        else if (state instanceof EngineState.Starting starting && starting.process() != null) {
            pid = starting.process().pid();
        }
        Instant started = Objects.requireNonNull(startedAt);
        return new StatusReport(state.label(),
                registry.size(),
                registry.countAuthenticated(),
                pid,
                uptime,
                Duration.between(started, now).toSeconds());
    }

    // ==================== Accessors ====================

    public SessionRegistry sessions() {
        return registry;
    }

    public EngineState engineState() {
        return stateMachine().state();
    }

    /**
     * @return the address the control channel is bound to
     */
    public InetSocketAddress controlAddress() {
        return (InetSocketAddress) Objects.requireNonNull(controlChannel, "gateway not started").localAddress();
    }

    /**
     * @param name listener name
     * @return the address the listener is bound to
     */
    public InetSocketAddress listenerAddress(String name) {
        Channel channel = listenerChannels.get(name);
        if (channel == null) {
            throw new IllegalArgumentException("no listener named '" + name + "'");
        }
        return (InetSocketAddress) channel.localAddress();
    }

    private EngineSpawner boundSpawner() {
        EngineSpawner current = spawner;
        if (current == null) {
            throw new IllegalStateException("control channel not bound yet");
        }
        return current;
    }

    private EngineStateMachine stateMachine() {
        EngineStateMachine machine = stateMachine;
        if (machine == null) {
            throw new IllegalStateException("gateway not started");
        }
        return machine;
    }

    // ==================== Shutdown ====================

    /**
     * Stops the engine, waiting up to its stop timeout, then closes every listener and the
     * control channel.
     */
    @Override
    public synchronized void close() {
        if (startedAt == null || workerGroup == null) {
            return;
        }
        LOGGER.info("Gateway shutting down");
        EngineStateMachine machine = stateMachine;
        if (machine != null) {
            Duration grace = configuration.engine().stopTimeout().plusSeconds(1);
            try {
                machine.shutdown().get(grace.toMillis(), TimeUnit.MILLISECONDS);
            }
            catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            catch (ExecutionException | TimeoutException e) {
                LOGGER.warn("Engine did not stop cleanly during gateway shutdown: {}", e.toString());
            }
        }
        for (Channel channel : listenerChannels.values()) {
            channel.close().awaitUninterruptibly();
        }
        listenerChannels.clear();
        if (controlChannel != null) {
            controlChannel.close().awaitUninterruptibly();
        }
        registry.sessions().forEach(session -> session.connection().close("gateway shutting down"));
        bossGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS).awaitUninterruptibly();
        workerGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS).awaitUninterruptibly();
        workerGroup = null;
        LOGGER.info("Gateway stopped");
    }
}
