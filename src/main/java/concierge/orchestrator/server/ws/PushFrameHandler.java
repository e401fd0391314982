package concierge.orchestrator.server.ws;

import concierge.orchestrator.service.EventBroker;
import concierge.orchestrator.service.RunService;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.QueryStringDecoder;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Per-channel handler for the push endpoint. Creates a {@link PushSession}
 * once the WebSocket handshake completes and feeds it text frames.
 *
 * Not sharable: holds the channel's session.
 */
public class PushFrameHandler extends SimpleChannelInboundHandler<WebSocketFrame> {

    private static final Logger log = LoggerFactory.getLogger(PushFrameHandler.class);

    public static final String TENANT_HEADER = "X-Tenant-Id";
    public static final String TENANT_PARAM = "tenant";

    private final RunService runService;
    private final EventBroker broker;
    private PushSession session;

    public PushFrameHandler(RunService runService, EventBroker broker) {
        this.runService = runService;
        this.broker = broker;
    }

    @Override
    public void userEventTriggered(ChannelHandlerContext ctx, Object evt) throws Exception {
        if (evt instanceof WebSocketServerProtocolHandler.HandshakeComplete handshake) {
            String tenant = handshake.requestHeaders().get(TENANT_HEADER);
            if (tenant == null || tenant.isBlank()) {
                List<String> values = new QueryStringDecoder(handshake.requestUri()).parameters().get(TENANT_PARAM);
                tenant = values != null && !values.isEmpty() ? values.get(0) : null;
            }
            session = new PushSession(ctx.channel(), tenant, runService, broker);
            session.onConnected();
            log.debug("Push session opened from {} (tenant {})", ctx.channel().remoteAddress(), tenant);
            return;
        }
        super.userEventTriggered(ctx, evt);
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, WebSocketFrame frame) {
        if (session == null) {
            return;
        }
        if (frame instanceof TextWebSocketFrame text) {
            session.onMessage(text.text());
        } else {
            session.onMessage("");
        }
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        if (session != null) {
            session.close();
            log.debug("Push session closed");
        }
        super.channelInactive(ctx);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        log.warn("Push channel error: {}", cause.getMessage());
        ctx.close();
    }
}
