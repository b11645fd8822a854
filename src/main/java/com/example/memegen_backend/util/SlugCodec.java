package com.example.memegen_backend.util;

import com.example.memegen_backend.dto.Rewrite;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Reversible mapping between overlay text lines and the URL path segment that carries them.
 * Lines are separated by {@code /}; reserved characters are escaped with {@code ~} codes.
 */
public final class SlugCodec {
    private SlugCodec() {}

    private static final String[][] ESCAPES = {
            {"?", "~q"},
            {"&", "~a"},
            {"%", "~p"},
            {"#", "~h"},
            {"/", "~s"},
            {"\\", "~b"},
            {"<", "~l"},
            {">", "~g"},
            {"\n", "~n"},
    };

    private static final Map<Character, String> UNESCAPES = new HashMap<>();

    static {
        for (String[] escape : ESCAPES) {
            UNESCAPES.put(escape[1].charAt(1), escape[0]);
        }
    }

    public static String encode(List<String> lines) {
        if (lines == null || lines.isEmpty()) {
            return "_";
        }
        List<String> parts = new ArrayList<>(lines.size());
        for (String line : lines) {
            parts.add(encodeLine(line));
        }
        return String.join("/", parts);
    }

    public static List<String> decode(String slug) {
        if (slug == null || slug.isEmpty()) {
            return List.of();
        }
        return Arrays.stream(slug.split("/", -1))
                .map(SlugCodec::decodeLine)
                .toList();
    }

    /**
     * Re-encodes the decoded form of a slug. The result is a fixed point: normalizing it again
     * reports no change.
     */
    public static Rewrite normalize(String slug) {
        String original = slug == null ? "" : slug;
        String normalized = encode(decode(original));
        return new Rewrite(normalized, !normalized.equals(original));
    }

    private static String encodeLine(String line) {
        if (line == null || line.isEmpty()) {
            return "_";
        }
        String s = line.replace("_", "__")
                .replace("-", "--")
                .replace(" ", "_");
        for (String[] escape : ESCAPES) {
            s = s.replace(escape[0], escape[1]);
        }
        return s.replace("\"", "''");
    }

    /**
     * Single left-to-right pass; doubled {@code _}, {@code -} and {@code '} bind before their single forms.
     */
    private static String decodeLine(String part) {
        StringBuilder out = new StringBuilder(part.length());
        int i = 0;
        while (i < part.length()) {
            char c = part.charAt(i);
            char next = i + 1 < part.length() ? part.charAt(i + 1) : '\0';
            if ((c == '_' || c == '-') && next == c) {
                out.append(c);
                i += 2;
            } else if (c == '_' || c == '-') {
                out.append(' ');
                i++;
            } else if (c == '\'' && next == '\'') {
                out.append('"');
                i += 2;
            } else if (c == '~' && UNESCAPES.containsKey(next)) {
                out.append(UNESCAPES.get(next));
                i += 2;
            } else {
                out.append(c);
                i++;
            }
        }
        return out.toString();
    }
}
