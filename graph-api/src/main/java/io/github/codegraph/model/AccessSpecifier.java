package io.github.codegraph.model;

import java.util.Locale;
import org.jetbrains.annotations.Nullable;

public enum AccessSpecifier {
    PUBLIC,
    PROTECTED,
    PRIVATE;

    /** Parses a {@code public}/{@code protected}/{@code private} keyword, or returns null for anything else. */
    public static @Nullable AccessSpecifier fromKeyword(@Nullable String keyword) {
        if (keyword == null) {
            return null;
        }
        return switch (keyword.strip()) {
            case "public" -> PUBLIC;
            case "protected" -> PROTECTED;
            case "private" -> PRIVATE;
            default -> null;
        };
    }

    public String keyword() {
        return name().toLowerCase(Locale.ROOT);
    }
}
