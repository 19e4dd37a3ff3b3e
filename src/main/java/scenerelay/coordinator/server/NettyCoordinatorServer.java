package scenerelay.coordinator.server;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.util.AttributeKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import scenerelay.coordinator.model.Envelope;
import scenerelay.coordinator.model.Message;
import scenerelay.coordinator.transport.CoordinatorTransport;
import scenerelay.coordinator.transport.MessageCodec;
import scenerelay.coordinator.transport.TransportException;

import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * TCP transport for workers running as separate processes.
 *
 * Each worker connects and identifies itself with its first READY; the
 * channel is bound to that rank for the rest of the run.
 */
public final class NettyCoordinatorServer implements CoordinatorTransport {

    private static final Logger log = LoggerFactory.getLogger(NettyCoordinatorServer.class);
    private static final AttributeKey<Integer> RANK = AttributeKey.valueOf("scenerelay.rank");

    private final int workerCount;
    private final MessageCodec codec;
    private final Map<Integer, Channel> channels = new ConcurrentHashMap<>();
    private final Map<Integer, Boolean> joined = new ConcurrentHashMap<>();
    private final BlockingQueue<Envelope> inbox = new LinkedBlockingQueue<>();
    private final CountDownLatch allJoined;

    private volatile boolean running;
    private Channel serverChannel;
    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;

    public NettyCoordinatorServer(int workerCount) {
        this(workerCount, new MessageCodec());
    }

    public NettyCoordinatorServer(int workerCount, MessageCodec codec) {
        if (workerCount < 1) {
            throw new IllegalArgumentException("workerCount must be >= 1");
        }
        this.workerCount = workerCount;
        this.codec = codec;
        this.allJoined = new CountDownLatch(workerCount);
    }

    /**
     * Bind the listening socket.
     *
     * @return the bound port (useful with port 0)
     */
    public synchronized int start(String host, int port) {
        if (running) {
            return boundPort();
        }
        bossGroup = new NioEventLoopGroup(1);
        workerGroup = new NioEventLoopGroup();
        try {
            ServerBootstrap b = new ServerBootstrap()
                    .group(bossGroup, workerGroup)
                    .channel(NioServerSocketChannel.class)
                    .childOption(ChannelOption.TCP_NODELAY, true)
                    .childOption(ChannelOption.SO_KEEPALIVE, true)
                    .childHandler(new ChannelInitializer<SocketChannel>() {
                        @Override
                        protected void initChannel(SocketChannel ch) {
                            LineFraming.install(ch.pipeline());
                            ch.pipeline().addLast(new InboundHandler());
                        }
                    });

            ChannelFuture bound = b.bind(host, port).awaitUninterruptibly();
            if (!bound.isSuccess()) {
                throw new TransportException("Cannot listen on " + host + ":" + port, bound.cause());
            }
            serverChannel = bound.channel();
            running = true;
            log.info("Coordinator listening on {}:{} for {} workers", host, boundPort(), workerCount);
            return boundPort();
        } catch (RuntimeException e) {
            close();
            throw e instanceof TransportException te ? te
                    : new TransportException("Cannot listen on " + host + ":" + port + ": " + e.getMessage(), e);
        }
    }

    public int boundPort() {
        Channel ch = serverChannel;
        if (ch == null) {
            return -1;
        }
        return ((InetSocketAddress) ch.localAddress()).getPort();
    }

    /**
     * Wait until every rank has connected and announced READY once.
     *
     * @return true if the pool is complete
     */
    public boolean awaitWorkers(Duration timeout) throws InterruptedException {
        boolean complete = allJoined.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
        if (!complete) {
            log.warn("Only {} of {} workers joined within {}s", joined.size(), workerCount, timeout.toSeconds());
        }
        return complete;
    }

    @Override
    public int workerCount() {
        return workerCount;
    }

    @Override
    public void send(int rank, Message message) {
        Channel ch = channels.get(rank);
        if (ch == null || !ch.isActive()) {
            throw new TransportException("Worker " + rank + " is not connected");
        }
        ch.writeAndFlush(LineFraming.frame(codec.encode(message))).addListener(f -> {
            if (!f.isSuccess()) {
                log.warn("Send to worker {} failed: {}", rank, f.cause() == null ? "?" : f.cause().getMessage());
                ch.close();
            }
        });
    }

    @Override
    public Optional<Envelope> poll(Duration timeout) throws InterruptedException {
        return Optional.ofNullable(inbox.poll(Math.max(0, timeout.toMillis()), TimeUnit.MILLISECONDS));
    }

    @Override
    public boolean isConnected(int rank) {
        Channel ch = channels.get(rank);
        return ch != null && ch.isActive();
    }

    @Override
    public synchronized void close() {
        try {
            for (Channel ch : channels.values()) {
                ch.close().awaitUninterruptibly(2, TimeUnit.SECONDS);
            }
            if (serverChannel != null) {
                serverChannel.close().awaitUninterruptibly();
                serverChannel = null;
            }
        } finally {
            if (workerGroup != null) { workerGroup.shutdownGracefully(); workerGroup = null; }
            if (bossGroup != null)   { bossGroup.shutdownGracefully();   bossGroup = null;   }
            if (running) {
                log.info("Coordinator stopped listening");
            }
            running = false;
        }
    }

    public boolean isRunning() {
        return running;
    }

    private final class InboundHandler extends SimpleChannelInboundHandler<String> {

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, String line) {
            Message message;
            try {
                message = codec.decode(line);
            } catch (TransportException e) {
                log.warn("Dropping connection {}: {}", ctx.channel().remoteAddress(), e.getMessage());
                ctx.close();
                return;
            }

            Integer rank = ctx.channel().attr(RANK).get();
            if (rank == null) {
                if (!(message instanceof Message.Ready ready)) {
                    log.warn("First message from {} was not READY, closing", ctx.channel().remoteAddress());
                    ctx.close();
                    return;
                }
                rank = register(ctx.channel(), ready.rank());
                if (rank == null) {
                    ctx.close();
                    return;
                }
            }
            inbox.add(new Envelope(rank, message));
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx) {
            Integer rank = ctx.channel().attr(RANK).get();
            if (rank != null) {
                log.warn("Worker {} disconnected", rank);
            }
            ctx.fireChannelInactive();
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
            log.warn("Connection error from {}: {}", ctx.channel().remoteAddress(), cause.getMessage());
            ctx.close();
        }

        private Integer register(Channel ch, int rank) {
            if (rank > workerCount) {
                log.warn("Rejecting worker rank {}: pool size is {}", rank, workerCount);
                return null;
            }
            synchronized (channels) {
                Channel existing = channels.get(rank);
                if (existing != null && existing.isActive()) {
                    log.warn("Rejecting second connection for worker rank {}", rank);
                    return null;
                }
                channels.put(rank, ch);
            }
            ch.attr(RANK).set(rank);
            if (joined.putIfAbsent(rank, Boolean.TRUE) == null) {
                allJoined.countDown();
            }
            log.info("Worker {} joined from {}", rank, ch.remoteAddress());
            return rank;
        }
    }
}
