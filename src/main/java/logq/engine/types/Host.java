package logq.engine.types;

/**
 * Network endpoint as it appears in access logs: a host name or address with an
 * optional port ("10.0.0.1:443", "[2001:db8::1]:80", "proxy.local").
 * Names are never resolved.
 */
public record Host(String name, int port) {
    public static final int NO_PORT = -1;

    public Host {
        if (name == null || name.isEmpty()) throw new IllegalArgumentException("host name must not be empty");
        if (port != NO_PORT && (port < 0 || port > 65535)) {
            throw new IllegalArgumentException("port out of range: " + port);
        }
    }

    public static Host parse(String raw) {
        if (raw == null || raw.isEmpty()) throw new IllegalArgumentException("empty host");
        if (raw.startsWith("[")) {
            int close = raw.indexOf(']');
            if (close < 0) throw new IllegalArgumentException("unterminated IPv6 address: " + raw);
            String name = raw.substring(1, close);
            String rest = raw.substring(close + 1);
            if (rest.isEmpty()) return new Host(checkName(name, raw), NO_PORT);
            if (!rest.startsWith(":")) throw new IllegalArgumentException("invalid host: " + raw);
            return new Host(checkName(name, raw), parsePort(rest.substring(1), raw));
        }
        int first = raw.indexOf(':');
        if (first < 0) return new Host(checkName(raw, raw), NO_PORT);
        if (first != raw.lastIndexOf(':')) {
            // bare IPv6 address, no port
            return new Host(checkName(raw, raw), NO_PORT);
        }
        return new Host(checkName(raw.substring(0, first), raw), parsePort(raw.substring(first + 1), raw));
    }

    private static String checkName(String name, String raw) {
        if (name.isEmpty()) throw new IllegalArgumentException("invalid host: " + raw);
        for (int i = 0; i < name.length(); i++) {
            char ch = name.charAt(i);
            boolean ok = Character.isLetterOrDigit(ch) || ch == '.' || ch == '-' || ch == '_' || ch == ':' || ch == '%';
            if (!ok) throw new IllegalArgumentException("invalid character '" + ch + "' in host: " + raw);
        }
        return name;
    }

    private static int parsePort(String s, String raw) {
        if (s.isEmpty() || s.length() > 5) throw new IllegalArgumentException("invalid port in host: " + raw);
        for (int i = 0; i < s.length(); i++) {
            if (!Character.isDigit(s.charAt(i))) throw new IllegalArgumentException("invalid port in host: " + raw);
        }
        return Integer.parseInt(s);
    }

    public boolean hasPort() { return port != NO_PORT; }

    @Override
    public String toString() {
        if (!hasPort()) return name;
        return name.indexOf(':') >= 0 ? "[" + name + "]:" + port : name + ":" + port;
    }
}
