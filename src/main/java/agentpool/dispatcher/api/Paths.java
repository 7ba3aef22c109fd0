package agentpool.dispatcher.api;

import io.netty.handler.codec.http.QueryStringDecoder;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Map;

/**
 * Helpers for path segments and query parameters.
 */
public final class Paths {

    private Paths() {
    }

    /**
     * Segment after a fixed prefix, e.g. {@code /api/v1/dispatch/nina} with
     * prefix {@code /api/v1/dispatch/} gives {@code nina}. Null when the path
     * does not have exactly one segment after the prefix.
     */
    public static String segmentAfter(String path, String prefix) {
        if (!path.startsWith(prefix)) {
            return null;
        }
        String rest = path.substring(prefix.length());
        if (rest.isEmpty() || rest.contains("/")) {
            return null;
        }
        return QueryStringDecoder.decodeComponent(rest);
    }

    public static String queryParam(String uri, String name) {
        Map<String, List<String>> params = new QueryStringDecoder(uri).parameters();
        List<String> values = params.get(name);
        return values == null || values.isEmpty() ? null : values.get(0);
    }

    /**
     * ISO-8601 instant from a query parameter, or the fallback when absent.
     */
    public static Instant instantParam(String uri, String name, Instant fallback) {
        String value = queryParam(uri, name);
        if (value == null || value.isBlank()) {
            return fallback;
        }
        try {
            return Instant.parse(value.trim());
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException(name + " must be an ISO-8601 instant");
        }
    }
}
