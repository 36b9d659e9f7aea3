package netlab.provisioner.server;

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
import netlab.provisioner.config.Dependencies;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.TimeUnit;

/**
 * HTTP front of the provisioner.
 *
 * Console work blocks for seconds per node, so the router runs on a separate
 * executor group instead of the I/O event loop.
 */
public final class ProvisionerNettyServer {

    private static final Logger log = LoggerFactory.getLogger(ProvisionerNettyServer.class);

    private static volatile boolean running = false;
    private static Channel serverChannel;
    private static EventLoopGroup bossGroup;
    private static EventLoopGroup workerGroup;
    private static EventExecutorGroup handlerGroup;

    private ProvisionerNettyServer() {
    }

    public static synchronized boolean start(int port, Dependencies deps) {
        if (running)
            return true;
        try {
            bossGroup = new NioEventLoopGroup(1);
            workerGroup = new NioEventLoopGroup();
            handlerGroup = new DefaultEventExecutorGroup(4);
            RouterHandler router = deps.routerHandler();

            ServerBootstrap b = new ServerBootstrap()
                    .group(bossGroup, workerGroup)
                    .channel(NioServerSocketChannel.class)
                    .option(ChannelOption.SO_REUSEADDR, true)
                    .childOption(ChannelOption.TCP_NODELAY, true)
                    .childHandler(new ChannelInitializer<SocketChannel>() {
                        @Override
                        protected void initChannel(SocketChannel ch) {
                            ChannelPipeline p = ch.pipeline();
                            p.addLast(new IdleStateHandler(300, 0, 0, TimeUnit.SECONDS));
                            p.addLast(new HttpServerCodec());
                            p.addLast(new HttpObjectAggregator(1024 * 1024));
                            p.addLast(handlerGroup, router);
                        }
                    });

            serverChannel = b.bind(deps.config().serverHost(), port).syncUninterruptibly().channel();
            running = true;
            log.info("Provisioner API started on {}:{}", deps.config().serverHost(), port);
            return true;
        } catch (RuntimeException e) {
            log.error("Start error on port {}: {}", port, e.getMessage(), e);
            running = true;
            stop();
            return false;
        }
    }

    public static synchronized void stop() {
        if (!running)
            return;
        try {
            if (serverChannel != null) {
                serverChannel.close().syncUninterruptibly();
                serverChannel = null;
            }
        } finally {
            if (handlerGroup != null) {
                handlerGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS);
                handlerGroup = null;
            }
            if (workerGroup != null) {
                workerGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS);
                workerGroup = null;
            }
            if (bossGroup != null) {
                bossGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS);
                bossGroup = null;
            }
            running = false;
            log.info("Provisioner API stopped");
        }
    }

    public static boolean isRunning() {
        return running;
    }
}
