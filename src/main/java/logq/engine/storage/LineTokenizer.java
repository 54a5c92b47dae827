package logq.engine.storage;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits an access-log line into raw fields.
 * Fields are separated by runs of whitespace. A field starting with '"' runs to the next
 * unescaped '"' (backslash escapes the next character); a field starting with '[' runs to
 * the next ']'. Quotes and brackets are not part of the returned field.
 */
public final class LineTokenizer {
    private LineTokenizer() {}

    public static List<String> tokenize(String line) {
        List<String> out = new ArrayList<>();
        int i = 0;
        int n = line.length();
        while (i < n) {
            char ch = line.charAt(i);
            if (Character.isWhitespace(ch)) {
                i++;
                continue;
            }
            if (ch == '"') {
                StringBuilder sb = new StringBuilder();
                i++;
                boolean closed = false;
                while (i < n) {
                    char c = line.charAt(i);
                    if (c == '\\' && i + 1 < n) {
                        sb.append(line.charAt(i + 1));
                        i += 2;
                    } else if (c == '"') {
                        closed = true;
                        i++;
                        break;
                    } else {
                        sb.append(c);
                        i++;
                    }
                }
                if (!closed) throw new IllegalArgumentException("unterminated quoted field at column " + (out.size() + 1));
                out.add(sb.toString());
            } else if (ch == '[') {
                int close = line.indexOf(']', i + 1);
                if (close < 0) throw new IllegalArgumentException("unterminated bracketed field at column " + (out.size() + 1));
                out.add(line.substring(i + 1, close));
                i = close + 1;
            } else {
                int start = i;
                while (i < n && !Character.isWhitespace(line.charAt(i))) i++;
                out.add(line.substring(start, i));
            }
        }
        return out;
    }
}
