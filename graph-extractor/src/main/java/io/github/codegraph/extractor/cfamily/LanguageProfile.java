package io.github.codegraph.extractor.cfamily;

import static io.github.codegraph.extractor.cfamily.CFamilyNodeTypes.*;

import io.github.codegraph.extractor.Languages;
import io.github.codegraph.tree.SyntaxNode;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/** Maps one grammar's node kind tags to {@link NodeShape}s. */
public final class LanguageProfile {

    public static final LanguageProfile C = new LanguageProfile(Languages.C, commonShapes());
    public static final LanguageProfile CPP = new LanguageProfile(Languages.CPP, cppShapes());

    private final String language;
    private final Map<String, NodeShape> shapes;
    private final Set<String> commentKinds;

    private LanguageProfile(String language, Map<String, NodeShape> shapes) {
        this.language = language;
        this.shapes = Map.copyOf(shapes);
        this.commentKinds = shapes.entrySet().stream()
                .filter(e -> e.getValue() == NodeShape.COMMENT)
                .map(Map.Entry::getKey)
                .collect(Collectors.toUnmodifiableSet());
    }

    public static LanguageProfile forLanguage(String language) {
        return switch (language) {
            case Languages.C -> C;
            case Languages.CPP -> CPP;
            default -> throw new IllegalArgumentException("No profile for language " + language);
        };
    }

    public String language() {
        return language;
    }

    /** Node kinds of this grammar's comments. */
    public Set<String> commentKinds() {
        return commentKinds;
    }

    public NodeShape shapeOf(SyntaxNode node) {
        return shapes.getOrDefault(node.kind(), NodeShape.UNRECOGNIZED);
    }

    private static Map<String, NodeShape> commonShapes() {
        var m = new HashMap<String, NodeShape>();
        m.put(TRANSLATION_UNIT, NodeShape.TRANSLATION_UNIT);
        m.put(FIELD_DECLARATION_LIST, NodeShape.DECLARATION_LIST);
        m.put(STRUCT_SPECIFIER, NodeShape.STRUCT);
        m.put(UNION_SPECIFIER, NodeShape.UNION);
        m.put(ENUM_SPECIFIER, NodeShape.ENUM);
        m.put(FUNCTION_DEFINITION, NodeShape.FUNCTION_DEFINITION);
        m.put(DECLARATION, NodeShape.DECLARATION);
        m.put(FIELD_DECLARATION, NodeShape.FIELD_DECLARATION);
        m.put(TYPE_DEFINITION, NodeShape.TYPE_DEFINITION);
        m.put(PREPROC_INCLUDE, NodeShape.INCLUDE);
        m.put(PREPROC_DEF, NodeShape.MACRO);
        m.put(PREPROC_FUNCTION_DEF, NodeShape.MACRO);
        m.put(PREPROC_IF, NodeShape.PREPROC_CONDITIONAL);
        m.put(PREPROC_IFDEF, NodeShape.PREPROC_CONDITIONAL);
        m.put(PREPROC_ELSE, NodeShape.PREPROC_CONDITIONAL);
        m.put(PREPROC_ELIF, NodeShape.PREPROC_CONDITIONAL);
        m.put(PREPROC_ELIFDEF, NodeShape.PREPROC_CONDITIONAL);
        m.put(COMMENT, NodeShape.COMMENT);
        return m;
    }

    private static Map<String, NodeShape> cppShapes() {
        var m = commonShapes();
        m.put(DECLARATION_LIST, NodeShape.DECLARATION_LIST);
        m.put(NAMESPACE_DEFINITION, NodeShape.NAMESPACE);
        m.put(CLASS_SPECIFIER, NodeShape.CLASS);
        m.put(FRIEND_DECLARATION, NodeShape.FRIEND_DECLARATION);
        m.put(TEMPLATE_DECLARATION, NodeShape.TEMPLATE);
        m.put(TEMPLATE_INSTANTIATION, NodeShape.TEMPLATE_INSTANTIATION);
        m.put(ALIAS_DECLARATION, NodeShape.ALIAS);
        m.put(USING_DECLARATION, NodeShape.USING);
        m.put(LINKAGE_SPECIFICATION, NodeShape.LINKAGE);
        return m;
    }
}
