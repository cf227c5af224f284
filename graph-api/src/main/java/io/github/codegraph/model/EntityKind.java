package io.github.codegraph.model;

import java.util.EnumSet;
import java.util.Set;

/** The kinds of program construct a {@link CodeEntity} can describe. */
public enum EntityKind {
    FUNCTION,
    METHOD,
    CONSTRUCTOR,
    DESTRUCTOR,
    CLASS,
    STRUCT,
    UNION,
    NAMESPACE,
    ENUM,
    ENUM_VALUE,
    TYPE_ALIAS,
    VARIABLE,
    MACRO,
    EXTERNAL_REFERENCE;

    public static final Set<EntityKind> CALLABLES = EnumSet.of(FUNCTION, METHOD, CONSTRUCTOR, DESTRUCTOR);

    /** Kinds that introduce a type with members (enums excluded). */
    public static final Set<EntityKind> RECORD_TYPES = EnumSet.of(CLASS, STRUCT, UNION);

    public boolean callable() {
        return CALLABLES.contains(this);
    }

    public boolean recordType() {
        return RECORD_TYPES.contains(this);
    }
}
