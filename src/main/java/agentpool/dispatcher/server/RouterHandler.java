package agentpool.dispatcher.server;

import agentpool.dispatcher.api.Controller;
import agentpool.dispatcher.api.Controller.ControllerResponse;
import agentpool.dispatcher.config.DispatcherConfig;
import com.fasterxml.jackson.core.JsonProcessingException;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandler.Sharable;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.DefaultFullHttpResponse;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.QueryStringDecoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static io.netty.handler.codec.http.HttpResponseStatus.BAD_REQUEST;
import static io.netty.handler.codec.http.HttpResponseStatus.FORBIDDEN;
import static io.netty.handler.codec.http.HttpResponseStatus.INTERNAL_SERVER_ERROR;
import static io.netty.handler.codec.http.HttpResponseStatus.NOT_FOUND;
import static io.netty.handler.codec.http.HttpVersion.HTTP_1_1;

/**
 * Routes requests to the first matching {@link Controller}.
 * Paths under {@code /internal/} require {@value #KEY_HEADER} once an agent key is configured.
 */
@Sharable
public class RouterHandler extends SimpleChannelInboundHandler<FullHttpRequest> {

    private static final Logger log = LoggerFactory.getLogger(RouterHandler.class);

    static final String KEY_HEADER = "X-Agentpool-Key";
    private static final String INTERNAL_PREFIX = "/internal/";

    private final List<Controller> controllers = new CopyOnWriteArrayList<>();
    private final DispatcherConfig config;

    public RouterHandler(DispatcherConfig config) {
        this.config = config;
    }

    /** Controllers are tried in registration order. */
    public RouterHandler registerController(Controller controller) {
        controllers.add(controller);
        log.debug("Registered controller: {}", controller.getClass().getSimpleName());
        return this;
    }

    public int controllerCount() {
        return controllers.size();
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, FullHttpRequest req) {
        String path = new QueryStringDecoder(req.uri()).path();
        write(ctx, route(ctx, req, path), false);
    }

    ControllerResponse route(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        HttpMethod method = req.method();
        if (!authorized(req, path)) {
            log.warn("Rejected {} {}: missing or wrong {}", method, path, KEY_HEADER);
            return ControllerResponse.error(FORBIDDEN, "forbidden");
        }
        try {
            for (Controller controller : controllers) {
                if (controller.matches(method, path)) {
                    return controller.handle(ctx, req, path);
                }
            }
            log.debug("No route for {} {}", method, path);
            return ControllerResponse.error(NOT_FOUND, "not found");
        } catch (JsonProcessingException e) {
            log.warn("Malformed JSON for {} {}: {}", method, path, e.getOriginalMessage());
            return ControllerResponse.error(BAD_REQUEST, "malformed JSON body");
        } catch (IllegalArgumentException e) {
            log.warn("Rejected {} {}: {}", method, path, e.getMessage());
            return ControllerResponse.error(BAD_REQUEST, String.valueOf(e.getMessage()));
        } catch (Exception e) {
            log.error("Handler failed for {} {}", method, path, e);
            return ControllerResponse.error(INTERNAL_SERVER_ERROR, e.toString());
        }
    }

    private boolean authorized(FullHttpRequest req, String path) {
        if (!config.hasAgentKey() || !path.startsWith(INTERNAL_PREFIX)) {
            return true;
        }
        return config.agentKey().equals(req.headers().get(KEY_HEADER));
    }

    private void write(ChannelHandlerContext ctx, ControllerResponse response, boolean closeAfter) {
        try {
            byte[] bytes = response.body() == null
                    ? new byte[0]
                    : response.body().getBytes(StandardCharsets.UTF_8);
            FullHttpResponse http = new DefaultFullHttpResponse(
                    HTTP_1_1, response.status(), Unpooled.wrappedBuffer(bytes));
            http.headers().set(HttpHeaderNames.CONTENT_TYPE, ControllerResponse.CONTENT_TYPE + "; charset=utf-8");
            http.headers().setInt(HttpHeaderNames.CONTENT_LENGTH, bytes.length);
            if (closeAfter) {
                ctx.writeAndFlush(http).addListener(ChannelFutureListener.CLOSE);
            } else {
                ctx.writeAndFlush(http);
            }
        } catch (RuntimeException e) {
            log.error("Failed to write response", e);
            ctx.close();
        }
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        log.error("Channel error", cause);
        write(ctx, ControllerResponse.error(INTERNAL_SERVER_ERROR, "channel error: " + cause.getMessage()), true);
    }
}
