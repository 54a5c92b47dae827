package logq.engine.types;

/**
 * Request line split into its three parts, e.g. "GET http://example.com:80/ HTTP/1.1".
 */
public record HttpRequest(String method, String url, String protocol) {

    public HttpRequest {
        if (isBlank(method) || isBlank(url) || isBlank(protocol)) {
            throw new IllegalArgumentException("request line needs method, url and protocol");
        }
    }

    public static HttpRequest parse(String raw) {
        if (raw == null) throw new IllegalArgumentException("empty request line");
        String[] parts = raw.trim().split(" +");
        if (parts.length != 3) {
            throw new IllegalArgumentException("malformed request line: \"" + raw + "\"");
        }
        return new HttpRequest(parts[0], parts[1], parts[2]);
    }

    private static boolean isBlank(String s) { return s == null || s.isBlank(); }

    @Override
    public String toString() { return method + " " + url + " " + protocol; }
}
