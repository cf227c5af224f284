package io.github.codegraph.extractor.cfamily;

/**
 * The closed set of node shapes the extractor and resolver act on. A {@link LanguageProfile} maps each grammar's kind
 * tags onto these; anything it does not list is {@link #UNRECOGNIZED} and contributes no entity.
 */
public enum NodeShape {
    TRANSLATION_UNIT,
    /** Braced member or declaration lists that only group other declarations. */
    DECLARATION_LIST,
    NAMESPACE,
    CLASS,
    STRUCT,
    UNION,
    ENUM,
    FUNCTION_DEFINITION,
    DECLARATION,
    FIELD_DECLARATION,
    FRIEND_DECLARATION,
    TEMPLATE,
    TEMPLATE_INSTANTIATION,
    TYPE_DEFINITION,
    ALIAS,
    USING,
    INCLUDE,
    MACRO,
    /** {@code #if}/{@code #ifdef} and their branches; all branches are visited. */
    PREPROC_CONDITIONAL,
    LINKAGE,
    COMMENT,
    UNRECOGNIZED
}
