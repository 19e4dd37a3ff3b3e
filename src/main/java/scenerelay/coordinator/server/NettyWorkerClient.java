package scenerelay.coordinator.server;

import io.netty.bootstrap.Bootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import scenerelay.coordinator.model.Message;
import scenerelay.coordinator.transport.MessageCodec;
import scenerelay.coordinator.transport.TransportException;
import scenerelay.coordinator.transport.WorkerTransport;

import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Worker end of the TCP transport.
 */
public final class NettyWorkerClient implements WorkerTransport {

    private static final Logger log = LoggerFactory.getLogger(NettyWorkerClient.class);

    private final int rank;
    private final MessageCodec codec;
    private final BlockingQueue<Frame> inbound;
    private final EventLoopGroup group;
    private final Channel channel;

    private NettyWorkerClient(int rank, MessageCodec codec, BlockingQueue<Frame> inbound,
            EventLoopGroup group, Channel channel) {
        this.rank = rank;
        this.codec = codec;
        this.inbound = inbound;
        this.group = group;
        this.channel = channel;
    }

    /**
     * Connect worker {@code rank} to the coordinator.
     *
     * @throws TransportException if the coordinator cannot be reached
     */
    public static NettyWorkerClient connect(String host, int port, int rank, Duration timeout) {
        return connect(host, port, rank, timeout, new MessageCodec());
    }

    public static NettyWorkerClient connect(String host, int port, int rank, Duration timeout, MessageCodec codec) {
        if (rank < 1) {
            throw new IllegalArgumentException("worker rank must be >= 1");
        }
        EventLoopGroup group = new NioEventLoopGroup(1);
        BlockingQueue<Frame> queue = new LinkedBlockingQueue<>();
        try {
            Bootstrap b = new Bootstrap()
                    .group(group)
                    .channel(NioSocketChannel.class)
                    .option(ChannelOption.TCP_NODELAY, true)
                    .option(ChannelOption.SO_KEEPALIVE, true)
                    .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) Math.min(Integer.MAX_VALUE, timeout.toMillis()))
                    .handler(new ChannelInitializer<SocketChannel>() {
                        @Override
                        protected void initChannel(SocketChannel ch) {
                            LineFraming.install(ch.pipeline());
                            ch.pipeline().addLast(new InboundHandler(queue));
                        }
                    });

            ChannelFuture f = b.connect(host, port).awaitUninterruptibly();
            if (!f.isSuccess()) {
                throw new TransportException("Cannot connect to coordinator " + host + ":" + port, f.cause());
            }
            log.info("Worker {} connected to {}:{}", rank, host, port);
            return new NettyWorkerClient(rank, codec, queue, group, f.channel());
        } catch (RuntimeException e) {
            group.shutdownGracefully();
            throw e instanceof TransportException te ? te
                    : new TransportException("Cannot connect to coordinator: " + e.getMessage(), e);
        }
    }

    @Override
    public int rank() {
        return rank;
    }

    @Override
    public void send(Message message) {
        if (!channel.isActive()) {
            throw new TransportException("Connection to coordinator is closed");
        }
        ChannelFuture f = channel.writeAndFlush(LineFraming.frame(codec.encode(message))).awaitUninterruptibly();
        if (!f.isSuccess()) {
            throw new TransportException("Send to coordinator failed", f.cause());
        }
    }

    @Override
    public Message receive() throws InterruptedException {
        Frame frame = inbound.take();
        if (frame.line() == null) {
            inbound.add(frame);
            throw new TransportException("Connection to coordinator closed");
        }
        return codec.decode(frame.line());
    }

    @Override
    public void close() {
        try {
            channel.close().awaitUninterruptibly(2, TimeUnit.SECONDS);
        } finally {
            group.shutdownGracefully();
        }
    }

    /** A received line, or a null line once the connection is gone. */
    private record Frame(String line) {
    }

    private static final class InboundHandler extends SimpleChannelInboundHandler<String> {
        private final BlockingQueue<Frame> target;

        InboundHandler(BlockingQueue<Frame> target) {
            this.target = target;
        }

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, String line) {
            target.add(new Frame(line));
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx) {
            target.add(new Frame(null));
            ctx.fireChannelInactive();
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
            log.warn("Connection error: {}", cause.getMessage());
            ctx.close();
        }
    }
}
