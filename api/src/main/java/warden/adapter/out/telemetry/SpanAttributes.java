package warden.adapter.out.telemetry;

/**
 * Span attribute names used on gateway spans.
 */
public final class SpanAttributes {

    public static final String HTTP_METHOD = "http.request.method";
    public static final String HTTP_URL = "url.full";
    public static final String HTTP_STATUS_CODE = "http.response.status_code";
    public static final String NET_PEER_NAME = "server.address";
    public static final String NET_PEER_PORT = "server.port";

    private SpanAttributes() {}
}
