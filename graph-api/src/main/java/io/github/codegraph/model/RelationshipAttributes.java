package io.github.codegraph.model;

/** Well-known keys of {@link Relationship#attributes()}. */
public final class RelationshipAttributes {

    /** Inheritance access: {@code public}, {@code protected} or {@code private}. */
    public static final String ACCESS = "access";

    /** 0-based position of a base in the derived type's base list. */
    public static final String ORDER = "order";

    /** Template argument list of a templated base, e.g. {@code <int>}. */
    public static final String TEMPLATE_ARGUMENTS = "template_arguments";

    public static final String VIRTUAL = "virtual";

    /** {@code system} for angle-bracket includes, {@code local} for quoted ones. */
    public static final String INCLUDE_STYLE = "include_style";

    /** Variable a call was made through. */
    public static final String VIA = "via";

    public static final String OPERATOR = "operator";

    /** 0-based line of the call site. */
    public static final String LINE = "line";

    private RelationshipAttributes() {}
}
