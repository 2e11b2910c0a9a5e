package dev.jobharvest.ai;

import java.util.Locale;
import java.util.Set;

/**
 * Pulls the JSON document out of a free-form model answer.
 */
public final class JsonTextExtractor {

    private static final String FENCE = "```";
    private static final String JSON_FENCE = "```json";
    private static final Set<String> LANGUAGE_HINTS = Set.of("json", "javascript", "ts", "text");

    private JsonTextExtractor() {
    }

    /**
     * Returns the first balanced {@code {...}} or {@code [...]} span of {@code text}.
     * A response that is fenced as a whole is unwrapped first. Without a balanced span,
     * the body of a {@code ```json} block is returned, else the trimmed text.
     */
    public static String extract(String text) {
        if (text == null) {
            return "";
        }
        String s = text.strip();

        if (s.length() >= 6 && s.startsWith(FENCE) && s.endsWith(FENCE)) {
            String inner = s.substring(3, s.length() - 3).strip();
            int firstNewline = inner.indexOf('\n');
            if (firstNewline != -1) {
                String firstLine = inner.substring(0, firstNewline).strip().toLowerCase(Locale.ROOT);
                if (LANGUAGE_HINTS.contains(firstLine)) {
                    inner = inner.substring(firstNewline + 1);
                }
            }
            s = inner.strip();
        }

        String balanced = firstBalancedSpan(s);
        if (balanced != null) {
            return balanced;
        }

        int fenceStart = s.indexOf(JSON_FENCE);
        if (fenceStart != -1) {
            int fenceEnd = s.indexOf(FENCE, fenceStart + JSON_FENCE.length());
            if (fenceEnd != -1) {
                return s.substring(fenceStart + JSON_FENCE.length(), fenceEnd).strip();
            }
        }
        return s;
    }

    static String firstBalancedSpan(String s) {
        int start = -1;
        char opener = 0;
        char closer = 0;
        int depth = 0;
        boolean inString = false;
        boolean escape = false;

        for (int i = 0; i < s.length(); i++) {
            char ch = s.charAt(i);
            if (start == -1) {
                if (ch == '{' || ch == '[') {
                    start = i;
                    opener = ch;
                    closer = ch == '{' ? '}' : ']';
                    depth = 1;
                }
                continue;
            }
            if (inString) {
                if (escape) {
                    escape = false;
                } else if (ch == '\\') {
                    escape = true;
                } else if (ch == '"') {
                    inString = false;
                }
            } else if (ch == '"') {
                inString = true;
            } else if (ch == opener) {
                depth++;
            } else if (ch == closer) {
                depth--;
                if (depth == 0) {
                    return s.substring(start, i + 1);
                }
            }
        }
        return null;
    }
}
