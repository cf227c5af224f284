package io.github.codegraph.extractor.cfamily;

import com.google.common.base.Splitter;
import io.github.codegraph.extractor.util.TextCanonicalizer;
import java.util.Set;
import java.util.regex.Pattern;
import org.jetbrains.annotations.Nullable;

/** Normalizes the type text of declarations into names that can be looked up. */
final class TypeNames {

    private static final Pattern NOISE = Pattern.compile(
            "\\b(const|volatile|mutable|static|extern|inline|constexpr|register|typename|struct|class|union|enum)\\b");
    private static final Splitter WORDS = Splitter.on(Pattern.compile("\\s+")).omitEmptyStrings();

    private static final Set<String> PRIMITIVES = Set.of(
            "void", "bool", "char", "short", "int", "long", "float", "double", "signed", "unsigned", "size_t",
            "wchar_t", "char8_t", "char16_t", "char32_t", "int8_t", "int16_t", "int32_t", "int64_t", "uint8_t",
            "uint16_t", "uint32_t", "uint64_t", "ptrdiff_t", "auto");

    private TypeNames() {}

    /**
     * The bare type name of a declaration's type text: qualifiers, pointer and reference markers and template
     * arguments removed. {@code const std::vector<int>&} becomes {@code std::vector}, {@code unsigned long} becomes
     * {@code long}. Returns null when nothing remains.
     */
    static @Nullable String baseName(@Nullable String typeText) {
        if (typeText == null) {
            return null;
        }
        var stripped = NOISE.matcher(typeText).replaceAll(" ").replace('*', ' ').replace('&', ' ');
        var words = WORDS.splitToList(stripped.strip());
        if (words.size() > 1 && words.stream().allMatch(PRIMITIVES::contains)) {
            return words.get(words.size() - 1);
        }
        var name = TextCanonicalizer.canonicalName(stripped);
        return name.isEmpty() ? null : name;
    }

    /** True for builtin arithmetic types, {@code void} and {@code auto}, which never carry members. */
    static boolean primitive(@Nullable String baseName) {
        if (baseName == null) {
            return false;
        }
        return PRIMITIVES.contains(baseName.startsWith("std::") ? baseName.substring(5) : baseName);
    }
}
