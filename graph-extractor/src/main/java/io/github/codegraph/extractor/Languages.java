package io.github.codegraph.extractor;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.jetbrains.annotations.Nullable;

/** Language ids and file-extension detection. */
public final class Languages {
    public static final String C = "c";
    public static final String CPP = "cpp";

    public static final Set<String> ALL = Set.of(C, CPP);

    // .h is shared by C and C++; the C++ grammar accepts both
    private static final Map<String, String> BY_EXTENSION = Map.of(
            "c", C,
            "h", CPP,
            "cpp", CPP,
            "cc", CPP,
            "cxx", CPP,
            "hpp", CPP,
            "hh", CPP,
            "hxx", CPP);

    private Languages() {}

    public static @Nullable String fromPath(Path path) {
        var fileName = path.getFileName();
        return fileName == null ? null : fromFileName(fileName.toString());
    }

    public static @Nullable String fromFileName(String fileName) {
        int dot = fileName.lastIndexOf('.');
        if (dot < 0 || dot == fileName.length() - 1) {
            return null;
        }
        return BY_EXTENSION.get(fileName.substring(dot + 1).toLowerCase(Locale.ROOT));
    }
}
