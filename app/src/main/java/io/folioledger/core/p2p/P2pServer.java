package io.folioledger.core.p2p;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.folioledger.core.protocol.ProtocolLimits;
import io.netty.bootstrap.Bootstrap;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.group.ChannelGroup;
import io.netty.channel.group.DefaultChannelGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.codec.LengthFieldBasedFrameDecoder;
import io.netty.handler.codec.LengthFieldPrepender;
import io.netty.handler.codec.MessageToMessageCodec;
import io.netty.handler.codec.string.StringDecoder;
import io.netty.handler.codec.string.StringEncoder;
import io.netty.util.AttributeKey;
import io.netty.util.CharsetUtil;
import io.netty.util.concurrent.GlobalEventExecutor;

import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Netty TCP transport between nodes. Frames are length-prefixed JSON {@link P2pMessage}s.
 * Heartbeats stay inside the transport: pings are answered here, and a peer silent for longer
 * than the idle timeout is closed. Everything else goes to the {@link PeerListener}.
 */
public final class P2pServer implements PeerConnector {
    private static final Logger LOG = Logger.getLogger(P2pServer.class.getName());
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final AttributeKey<PeerContext> CTX_KEY = AttributeKey.valueOf("peer-context");

    private static final int CONNECT_TIMEOUT_MS = 5_000;

    private final String name;
    private final String bindHost;
    private final int port;
    private final PeerListener listener;
    private final long pingIntervalMillis;
    private final long idleTimeoutMillis;
    private final boolean autoRespondPings;

    private final NioEventLoopGroup bossGroup = new NioEventLoopGroup(1);
    private final NioEventLoopGroup workerGroup = new NioEventLoopGroup();
    private final NioEventLoopGroup clientGroup = new NioEventLoopGroup();
    private final ChannelGroup channels = new DefaultChannelGroup(GlobalEventExecutor.INSTANCE);
    private final Set<PeerContext> peers = ConcurrentHashMap.newKeySet();

    private ScheduledExecutorService housekeeping;
    private Channel serverChannel;

    public P2pServer(String name, String bindHost, int port, PeerListener listener,
                     long pingIntervalMillis, long idleTimeoutMillis, boolean autoRespondPings) {
        this.name = Objects.requireNonNull(name, "name");
        this.bindHost = bindHost == null || bindHost.isBlank() ? "0.0.0.0" : bindHost;
        this.port = port;
        this.listener = Objects.requireNonNull(listener, "listener");
        this.pingIntervalMillis = Math.max(100L, pingIntervalMillis);
        this.idleTimeoutMillis = Math.max(this.pingIntervalMillis, idleTimeoutMillis);
        this.autoRespondPings = autoRespondPings;
    }

    /** Binds the listening socket. Only the authority accepts inbound peers. */
    public void start() {
        try {
            ServerBootstrap bootstrap = new ServerBootstrap();
            bootstrap.group(bossGroup, workerGroup)
                    .channel(NioServerSocketChannel.class)
                    .childHandler(new ChannelInitializer<SocketChannel>() {
                        @Override
                        protected void initChannel(SocketChannel ch) {
                            configurePipeline(ch.pipeline());
                        }
                    });

            serverChannel = bootstrap.bind(bindHost, port).sync().channel();
            channels.add(serverChannel);
            LOG.info(() -> "P2P server listening on " + bindHost + ':' + port + " (" + name + ")");
            startHousekeeping();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while starting P2P server", e);
        }
    }

    @Override
    public void connect(String host, int targetPort, Consumer<Throwable> onFailure) {
        startHousekeeping();
        Bootstrap bootstrap = new Bootstrap();
        bootstrap.group(clientGroup)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, CONNECT_TIMEOUT_MS)
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        configurePipeline(ch.pipeline());
                    }
                });

        bootstrap.connect(host, targetPort).addListener((ChannelFutureListener) future -> {
            if (future.isSuccess()) {
                LOG.info(() -> "Connected to peer " + host + ':' + targetPort);
            } else {
                LOG.log(Level.WARNING, "Failed to connect to peer " + host + ':' + targetPort, future.cause());
                if (onFailure != null) {
                    onFailure.accept(future.cause());
                }
            }
        });
    }

    public Collection<PeerChannel> peers() {
        return new ArrayList<>(peers);
    }

    public int boundPort() {
        if (serverChannel == null) {
            return -1;
        }
        return ((InetSocketAddress) serverChannel.localAddress()).getPort();
    }

    public void stop() {
        stopHousekeeping();
        try {
            if (serverChannel != null) {
                serverChannel.close().sync();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        channels.close().awaitUninterruptibly();
        bossGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS);
        workerGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS);
        clientGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS);
        peers.clear();
        LOG.info(() -> "P2P transport stopped (" + name + ")");
    }

    private synchronized void startHousekeeping() {
        if (housekeeping != null) {
            return;
        }
        housekeeping = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "p2p-heartbeat-" + name);
            t.setDaemon(true);
            return t;
        });
        housekeeping.scheduleAtFixedRate(this::runHousekeeping, pingIntervalMillis, pingIntervalMillis, TimeUnit.MILLISECONDS);
    }

    private synchronized void stopHousekeeping() {
        if (housekeeping != null) {
            housekeeping.shutdownNow();
            housekeeping = null;
        }
    }

    private void runHousekeeping() {
        try {
            long now = System.currentTimeMillis();
            for (PeerContext context : peers) {
                Channel channel = context.channel;
                if (!channel.isActive()) {
                    continue;
                }
                if (now - context.lastSeen > idleTimeoutMillis) {
                    LOG.fine(() -> "Closing stale peer " + context.remoteAddress());
                    channel.close();
                    continue;
                }
                if (now - context.lastPingSent >= pingIntervalMillis) {
                    context.lastPingSent = now;
                    channel.writeAndFlush(P2pMessage.ping());
                }
            }
        } catch (RuntimeException e) {
            LOG.log(Level.FINE, "P2P housekeeping failed", e);
        }
    }

    private void configurePipeline(ChannelPipeline pipeline) {
        pipeline.addLast(new LengthFieldBasedFrameDecoder(ProtocolLimits.MAX_FRAME_BYTES, 0, 4, 0, 4));
        pipeline.addLast(new LengthFieldPrepender(4));
        pipeline.addLast(new StringDecoder(CharsetUtil.UTF_8));
        pipeline.addLast(new StringEncoder(CharsetUtil.UTF_8));
        pipeline.addLast(new JsonCodec());
        pipeline.addLast(new PeerChannelHandler());
    }

    private final class PeerChannelHandler extends SimpleChannelInboundHandler<P2pMessage> {
        @Override
        public void channelActive(ChannelHandlerContext ctx) {
            PeerContext context = new PeerContext(ctx.channel());
            ctx.channel().attr(CTX_KEY).set(context);
            channels.add(ctx.channel());
            peers.add(context);
            listener.onPeerConnected(context);
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx) {
            PeerContext context = ctx.channel().attr(CTX_KEY).get();
            channels.remove(ctx.channel());
            if (context != null && peers.remove(context)) {
                listener.onPeerDisconnected(context);
            }
        }

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, P2pMessage msg) {
            PeerContext context = ctx.channel().attr(CTX_KEY).get();
            if (context == null) {
                return;
            }
            context.lastSeen = System.currentTimeMillis();
            if (!msg.isHeartbeat()) {
                listener.onMessage(context, msg);
            } else if (autoRespondPings && P2pMessage.PING.equals(msg.type())) {
                ctx.writeAndFlush(P2pMessage.pong());
            }
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
            LOG.log(Level.WARNING, "P2P channel error", cause);
            ctx.close();
        }
    }

    private static final class JsonCodec extends MessageToMessageCodec<String, P2pMessage> {
        @Override
        protected void encode(ChannelHandlerContext ctx, P2pMessage msg, List<Object> out) throws Exception {
            out.add(MAPPER.writeValueAsString(msg));
        }

        @Override
        protected void decode(ChannelHandlerContext ctx, String msg, List<Object> out) throws Exception {
            out.add(MAPPER.readValue(msg, P2pMessage.class));
        }
    }

    private static String remoteAddress(Channel channel) {
        SocketAddress raw = channel.remoteAddress();
        if (!(raw instanceof InetSocketAddress address)) {
            return String.valueOf(raw);
        }
        String host = address.getAddress() != null ? address.getAddress().getHostAddress() : address.getHostString();
        return host + ':' + address.getPort();
    }

    private static final class PeerContext implements PeerChannel {
        final Channel channel;
        final String remote;
        volatile long lastSeen;
        volatile long lastPingSent;

        PeerContext(Channel channel) {
            this.channel = channel;
            this.remote = P2pServer.remoteAddress(channel);
            this.lastSeen = System.currentTimeMillis();
            this.lastPingSent = 0L;
        }

        @Override
        public String remoteAddress() {
            return remote;
        }

        @Override
        public void send(P2pMessage message) {
            if (channel.isActive()) {
                channel.writeAndFlush(message);
            }
        }

        @Override
        public void close() {
            channel.close();
        }

        @Override
        public boolean isOpen() {
            return channel.isActive();
        }

        @Override
        public String toString() {
            return "Peer(" + remote + ")";
        }
    }
}
