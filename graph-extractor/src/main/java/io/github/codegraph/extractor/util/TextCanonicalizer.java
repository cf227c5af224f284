package io.github.codegraph.extractor.util;

public final class TextCanonicalizer {
    private TextCanonicalizer() {
        /* utility class - no instances */
    }

    /**
     * Strips a leading UTF-8 BOM (EF BB BF) from the provided byte array, if present. Returns the original array if no
     * BOM is present.
     */
    public static byte[] stripUtf8Bom(byte[] bytes) {
        if (bytes.length >= 3 && (bytes[0] & 0xFF) == 0xEF && (bytes[1] & 0xFF) == 0xBB && (bytes[2] & 0xFF) == 0xBF) {
            byte[] withoutBom = new byte[bytes.length - 3];
            System.arraycopy(bytes, 3, withoutBom, 0, bytes.length - 3);
            return withoutBom;
        }
        return bytes;
    }

    /** Strips a leading U+FEFF from the provided String, if present. */
    public static String stripUtf8Bom(String s) {
        if (!s.isEmpty() && s.charAt(0) == '\uFEFF') {
            return s.substring(1);
        }
        return s;
    }

    /**
     * Removes template argument lists ({@code <...>}, nesting aware) and all whitespace from a C++ name, and drops a
     * leading global-scope {@code ::}. {@code operator<} and friends are left alone.
     */
    public static String canonicalName(String name) {
        var sb = new StringBuilder(name.length());
        int depth = 0;
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            if (c == '<' && depth == 0 && endsWithOperatorKeyword(sb)) {
                sb.append(c);
                continue;
            }
            if (c == '<') {
                depth++;
            } else if (c == '>' && depth > 0) {
                depth--;
            } else if (depth == 0 && !Character.isWhitespace(c)) {
                sb.append(c);
            }
        }
        var result = sb.toString();
        return result.startsWith("::") ? result.substring(2) : result;
    }

    /** The template argument list of a name such as {@code Generic<int>}, or "" if it has none. */
    public static String templateArguments(String name) {
        int open = name.indexOf('<');
        int close = name.lastIndexOf('>');
        if (open < 0 || close < open) {
            return "";
        }
        return name.substring(open, close + 1).replaceAll("\\s+", "");
    }

    private static boolean endsWithOperatorKeyword(StringBuilder sb) {
        int n = sb.length();
        int from = n;
        while (from > 0 && "<>=!+-*/%&|^~".indexOf(sb.charAt(from - 1)) >= 0) {
            from--;
        }
        return from >= 8 && sb.substring(from - 8, from).equals("operator");
    }
}
