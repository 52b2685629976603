package devicevault.pipeline.server;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.handler.timeout.IdleStateHandler;
import io.netty.util.concurrent.DefaultEventExecutorGroup;
import io.netty.util.concurrent.EventExecutorGroup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.util.concurrent.TimeUnit;

/**
 * Netty HTTP server for the operational API. All routing happens in the
 * shared {@link RouterHandler}, which runs on its own executor group because
 * content downloads block until a storage worker replies.
 */
public final class PipelineHttpServer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(PipelineHttpServer.class);

    private static final int MAX_CONTENT_LENGTH = 1024 * 1024;
    private static final int DEFAULT_HANDLER_THREADS = 16;

    private final RouterHandler router;
    private final String host;
    private final int port;
    private final int ioThreads;
    private final int handlerThreads;

    private volatile boolean running = false;
    private Channel serverChannel;
    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;
    private EventExecutorGroup handlerGroup;

    public PipelineHttpServer(RouterHandler router, String host, int port) {
        this(router, host, port, 0, DEFAULT_HANDLER_THREADS);
    }

    /**
     * @param ioThreads      Netty I/O threads, 0 for Netty's default
     * @param handlerThreads threads that run controllers
     */
    public PipelineHttpServer(RouterHandler router, String host, int port, int ioThreads, int handlerThreads) {
        this.router = router;
        this.host = host;
        this.port = port;
        this.ioThreads = ioThreads;
        this.handlerThreads = handlerThreads;
    }

    public synchronized void start() {
        if (running) {
            return;
        }
        bossGroup = new NioEventLoopGroup(1);
        workerGroup = new NioEventLoopGroup(ioThreads);
        handlerGroup = new DefaultEventExecutorGroup(handlerThreads);
        try {
            ServerBootstrap b = new ServerBootstrap()
                    .group(bossGroup, workerGroup)
                    .channel(NioServerSocketChannel.class)
                    .childOption(ChannelOption.TCP_NODELAY, true)
                    .childHandler(new ChannelInitializer<SocketChannel>() {
                        @Override
                        protected void initChannel(SocketChannel ch) {
                            ChannelPipeline p = ch.pipeline();
                            p.addLast(new IdleStateHandler(60, 0, 0, TimeUnit.SECONDS));
                            p.addLast(new HttpServerCodec());
                            p.addLast(new HttpObjectAggregator(MAX_CONTENT_LENGTH));
                            p.addLast(handlerGroup, "router", router);
                        }
                    });

            serverChannel = b.bind(host, port).syncUninterruptibly().channel();
            running = true;
            log.info("HTTP API listening on {}:{}", host, boundPort());
        } catch (RuntimeException e) {
            log.error("Failed to start HTTP API on {}:{}", host, port, e);
            stop();
            throw e;
        }
    }

    public synchronized void stop() {
        try {
            if (serverChannel != null) {
                serverChannel.close().syncUninterruptibly();
                serverChannel = null;
            }
        } finally {
            if (workerGroup != null) {
                workerGroup.shutdownGracefully();
                workerGroup = null;
            }
            if (bossGroup != null) {
                bossGroup.shutdownGracefully();
                bossGroup = null;
            }
            if (handlerGroup != null) {
                handlerGroup.shutdownGracefully();
                handlerGroup = null;
            }
            if (running) {
                log.info("HTTP API stopped");
            }
            running = false;
        }
    }

    /**
     * Block until the server channel closes.
     */
    public void awaitClose() throws InterruptedException {
        Channel channel = serverChannel;
        if (channel != null) {
            channel.closeFuture().sync();
        }
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * The actual listening port; differs from the configured one when that was 0.
     */
    public int boundPort() {
        Channel channel = serverChannel;
        if (channel == null) {
            return port;
        }
        return ((InetSocketAddress) channel.localAddress()).getPort();
    }

    @Override
    public void close() {
        stop();
    }
}
