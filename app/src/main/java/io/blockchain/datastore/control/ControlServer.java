package io.blockchain.datastore.control;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.group.ChannelGroup;
import io.netty.channel.group.DefaultChannelGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.LineBasedFrameDecoder;
import io.netty.handler.codec.string.StringDecoder;
import io.netty.util.CharsetUtil;
import io.netty.util.concurrent.GlobalEventExecutor;

import java.net.InetSocketAddress;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * TCP entry point of the control plane. Every line received
 * (e.g. {@code subscribe:abcd:1500000000}) is published to the replication channel
 * as-is; parsing and validation happen on the consuming side.
 */
public final class ControlServer {
    private static final Logger LOG = Logger.getLogger(ControlServer.class.getName());

    static final int MAX_LINE_LENGTH = 1024;

    private final String bind;
    private final int port;
    private final Consumer<String> sink;

    private final NioEventLoopGroup bossGroup = new NioEventLoopGroup(1);
    private final NioEventLoopGroup workerGroup = new NioEventLoopGroup();
    private final ChannelGroup channels = new DefaultChannelGroup(GlobalEventExecutor.INSTANCE);

    private Channel serverChannel;

    public ControlServer(String bind, int port, Consumer<String> sink) {
        this.bind = bind == null || bind.isBlank() ? "127.0.0.1" : bind;
        this.port = port;
        this.sink = Objects.requireNonNull(sink, "sink");
    }

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

            serverChannel = bootstrap.bind(bind, port).sync().channel();
            channels.add(serverChannel);
            LOG.info(() -> "Control server listening on " + bind + ":" + port());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while starting control server", e);
        }
    }

    /** Bound port, useful when started on port 0. */
    public int port() {
        if (serverChannel == null) {
            return port;
        }
        return ((InetSocketAddress) serverChannel.localAddress()).getPort();
    }

    public void stop() {
        try {
            if (serverChannel != null) {
                serverChannel.close().sync();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        channels.close().awaitUninterruptibly();
        bossGroup.shutdownGracefully();
        workerGroup.shutdownGracefully();
        LOG.info("Control server stopped");
    }

    private void configurePipeline(ChannelPipeline pipeline) {
        pipeline.addLast(new LineBasedFrameDecoder(MAX_LINE_LENGTH));
        // one char per byte, so namespace lengths are checked in bytes
        pipeline.addLast(new StringDecoder(CharsetUtil.ISO_8859_1));
        pipeline.addLast(new ControlLineHandler());
    }

    private final class ControlLineHandler extends SimpleChannelInboundHandler<String> {
        @Override
        public void channelActive(ChannelHandlerContext ctx) {
            channels.add(ctx.channel());
        }

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, String line) {
            String payload = line.trim();
            if (payload.isEmpty()) {
                return;
            }
            LOG.fine(() -> "Control payload from " + ctx.channel().remoteAddress() + ": " + payload);
            sink.accept(payload);
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
            LOG.log(Level.WARNING, "Control channel error", cause);
            ctx.close();
        }
    }
}
