package agentpool.dispatcher.api;

import agentpool.dispatcher.core.Jsons;
import com.fasterxml.jackson.core.JsonProcessingException;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;

/**
 * Base interface for HTTP controllers.
 * Controllers handle specific URL patterns and HTTP methods.
 */
public interface Controller {

    /**
     * Check if this controller can handle the given request.
     *
     * @param method HTTP method
     * @param path   Request path (without query string)
     */
    boolean matches(HttpMethod method, String path);

    /**
     * Handle the request. {@link IllegalArgumentException} is mapped to 400
     * by the router, anything else to 500.
     *
     * @param ctx  Netty channel context
     * @param req  Full HTTP request
     * @param path Request path (without query string)
     */
    ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) throws Exception;

    /**
     * Status plus JSON body.
     */
    record ControllerResponse(HttpResponseStatus status, String body) {

        public static final String CONTENT_TYPE = "application/json";

        public static ControllerResponse ok(Object body) throws JsonProcessingException {
            return of(HttpResponseStatus.OK, body);
        }

        public static ControllerResponse of(HttpResponseStatus status, Object body) throws JsonProcessingException {
            return new ControllerResponse(status, Jsons.mapper().writeValueAsString(body));
        }

        /** {@code {"error": message}} */
        public static ControllerResponse error(HttpResponseStatus status, String message) {
            return new ControllerResponse(status, Jsons.mapper().createObjectNode().put("error", message).toString());
        }

        public static ControllerResponse notFound(String message) {
            return error(HttpResponseStatus.NOT_FOUND, message);
        }

        public static ControllerResponse conflict(String message) {
            return error(HttpResponseStatus.CONFLICT, message);
        }
    }
}
