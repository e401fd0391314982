package concierge.orchestrator.server;

import concierge.orchestrator.server.ws.PushFrameHandler;
import concierge.orchestrator.service.EventBroker;
import concierge.orchestrator.service.RunService;
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
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;

/**
 * Netty server for the HTTP API and the {@code /ws} push channel.
 */
public final class OrchestratorServer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(OrchestratorServer.class);

    public static final String WS_PATH = "/ws";
    private static final int MAX_CONTENT_LENGTH = 1024 * 1024;
    private static final int MAX_FRAME_SIZE = 65536;

    private final RouterHandler router;
    private final RunService runService;
    private final EventBroker broker;

    private volatile boolean running = false;
    private Channel serverChannel;
    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;

    public OrchestratorServer(RouterHandler router, RunService runService, EventBroker broker) {
        this.router = router;
        this.runService = runService;
        this.broker = broker;
    }

    /** HTTP + WebSocket pipeline */
    ChannelInitializer<SocketChannel> pipelineInitializer() {
        return new ChannelInitializer<SocketChannel>() {
            @Override
            protected void initChannel(SocketChannel ch) {
                ChannelPipeline p = ch.pipeline();
                p.addLast(new HttpServerCodec());
                p.addLast(new HttpObjectAggregator(MAX_CONTENT_LENGTH));
                p.addLast(new WebSocketServerProtocolHandler(WS_PATH, null, true, MAX_FRAME_SIZE, false, true));
                p.addLast(new PushFrameHandler(runService, broker));
                p.addLast(router); // REST
            }
        };
    }

    /**
     * Bind and start serving. Port 0 picks a free port.
     *
     * @return the bound port
     */
    public synchronized int start(String host, int port) {
        if (running) {
            return port();
        }
        try {
            bossGroup = new NioEventLoopGroup(1);
            workerGroup = new NioEventLoopGroup();

            ServerBootstrap b = new ServerBootstrap()
                    .group(bossGroup, workerGroup)
                    .channel(NioServerSocketChannel.class)
                    .childOption(ChannelOption.TCP_NODELAY, true)
                    .childHandler(pipelineInitializer());

            serverChannel = b.bind(host, port).syncUninterruptibly().channel();
            running = true;
            log.info("Orchestrator listening on {}:{}", host, port());
            return port();
        } catch (RuntimeException e) {
            log.error("Failed to start server on port {}", port, e);
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
            if (running) {
                log.info("Orchestrator stopped");
            }
            running = false;
        }
    }

    public boolean isRunning() {
        return running;
    }

    public int port() {
        Channel channel = serverChannel;
        return channel != null ? ((InetSocketAddress) channel.localAddress()).getPort() : -1;
    }

    @Override
    public void close() {
        stop();
    }
}
