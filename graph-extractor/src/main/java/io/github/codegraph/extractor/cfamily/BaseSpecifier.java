package io.github.codegraph.extractor.cfamily;

import io.github.codegraph.model.AccessSpecifier;

/**
 * One entry of a derived type's base-class list, as written.
 *
 * @param name base type text with whitespace removed, template arguments kept ({@code Generic<int>})
 * @param access explicit or defaulted access
 * @param virtual true for {@code virtual} bases
 * @param order 0-based position in the base list
 * @param line line of the base type in the source
 */
public record BaseSpecifier(String name, AccessSpecifier access, boolean virtual, int order, int line) {}
