package io.github.codegraph.extractor.cfamily;

/** Tree-sitter node type names shared by the C and C++ grammars, plus the C++-only ones. */
public final class CFamilyNodeTypes {

    // Containers
    public static final String TRANSLATION_UNIT = "translation_unit";
    public static final String DECLARATION_LIST = "declaration_list";
    public static final String FIELD_DECLARATION_LIST = "field_declaration_list";
    public static final String ENUMERATOR_LIST = "enumerator_list";
    public static final String COMPOUND_STATEMENT = "compound_statement";
    public static final String LINKAGE_SPECIFICATION = "linkage_specification";

    // Specifiers
    public static final String CLASS_SPECIFIER = "class_specifier";
    public static final String STRUCT_SPECIFIER = "struct_specifier";
    public static final String UNION_SPECIFIER = "union_specifier";
    public static final String ENUM_SPECIFIER = "enum_specifier";
    public static final String ACCESS_SPECIFIER = "access_specifier";
    public static final String BASE_CLASS_CLAUSE = "base_class_clause";

    // Definitions and declarations
    public static final String NAMESPACE_DEFINITION = "namespace_definition";
    public static final String NESTED_NAMESPACE_SPECIFIER = "nested_namespace_specifier";
    public static final String FUNCTION_DEFINITION = "function_definition";
    public static final String DECLARATION = "declaration";
    public static final String FIELD_DECLARATION = "field_declaration";
    public static final String FRIEND_DECLARATION = "friend_declaration";
    public static final String PARAMETER_DECLARATION = "parameter_declaration";
    public static final String OPTIONAL_PARAMETER_DECLARATION = "optional_parameter_declaration";
    public static final String TEMPLATE_DECLARATION = "template_declaration";
    public static final String TEMPLATE_INSTANTIATION = "template_instantiation";
    public static final String TEMPLATE_PARAMETER_LIST = "template_parameter_list";
    public static final String TYPE_PARAMETER_DECLARATION = "type_parameter_declaration";
    public static final String TYPE_DEFINITION = "type_definition";
    public static final String ALIAS_DECLARATION = "alias_declaration";
    public static final String USING_DECLARATION = "using_declaration";
    public static final String ENUMERATOR = "enumerator";
    public static final String DELETE_METHOD_CLAUSE = "delete_method_clause";

    // Declarators
    public static final String FUNCTION_DECLARATOR = "function_declarator";
    public static final String POINTER_DECLARATOR = "pointer_declarator";
    public static final String REFERENCE_DECLARATOR = "reference_declarator";
    public static final String PARENTHESIZED_DECLARATOR = "parenthesized_declarator";
    public static final String ARRAY_DECLARATOR = "array_declarator";
    public static final String INIT_DECLARATOR = "init_declarator";
    public static final String ATTRIBUTED_DECLARATOR = "attributed_declarator";
    public static final String DESTRUCTOR_NAME = "destructor_name";
    public static final String OPERATOR_NAME = "operator_name";

    // Names
    public static final String IDENTIFIER = "identifier";
    public static final String FIELD_IDENTIFIER = "field_identifier";
    public static final String TYPE_IDENTIFIER = "type_identifier";
    public static final String NAMESPACE_IDENTIFIER = "namespace_identifier";
    public static final String QUALIFIED_IDENTIFIER = "qualified_identifier";
    public static final String TEMPLATE_FUNCTION = "template_function";
    public static final String TEMPLATE_METHOD = "template_method";
    public static final String TEMPLATE_TYPE = "template_type";
    public static final String PRIMITIVE_TYPE = "primitive_type";
    public static final String SIZED_TYPE_SPECIFIER = "sized_type_specifier";
    public static final String THIS = "this";
    public static final String TYPE_QUALIFIER = "type_qualifier";
    public static final String VIRTUAL_SPECIFIER = "virtual_specifier";
    public static final String TYPE_DESCRIPTOR = "type_descriptor";
    public static final String QUALIFIED_TYPE_IDENTIFIER = "qualified_type_identifier";

    // Expressions
    public static final String CALL_EXPRESSION = "call_expression";
    public static final String FIELD_EXPRESSION = "field_expression";
    public static final String NEW_EXPRESSION = "new_expression";
    public static final String BINARY_EXPRESSION = "binary_expression";
    public static final String ASSIGNMENT_EXPRESSION = "assignment_expression";
    public static final String POINTER_EXPRESSION = "pointer_expression";
    public static final String PARENTHESIZED_EXPRESSION = "parenthesized_expression";
    public static final String LAMBDA_EXPRESSION = "lambda_expression";
    public static final String ARGUMENT_LIST = "argument_list";
    public static final String INITIALIZER_LIST = "initializer_list";
    public static final String FIELD_INITIALIZER_LIST = "field_initializer_list";
    public static final String FIELD_INITIALIZER = "field_initializer";
    public static final String STRING_LITERAL = "string_literal";
    public static final String RAW_STRING_LITERAL = "raw_string_literal";
    public static final String CONCATENATED_STRING = "concatenated_string";
    public static final String CHAR_LITERAL = "char_literal";
    public static final String NUMBER_LITERAL = "number_literal";
    public static final String TRUE = "true";
    public static final String FALSE = "false";
    public static final String NULL = "null";
    public static final String NULLPTR = "nullptr";
    public static final String UNARY_EXPRESSION = "unary_expression";
    public static final String COMPOUND_LITERAL_EXPRESSION = "compound_literal_expression";
    public static final String FOR_RANGE_LOOP = "for_range_loop";
    public static final String DELETE_EXPRESSION = "delete_expression";

    // Preprocessor
    public static final String PREPROC_INCLUDE = "preproc_include";
    public static final String PREPROC_DEF = "preproc_def";
    public static final String PREPROC_FUNCTION_DEF = "preproc_function_def";
    public static final String PREPROC_IF = "preproc_if";
    public static final String PREPROC_IFDEF = "preproc_ifdef";
    public static final String PREPROC_ELSE = "preproc_else";
    public static final String PREPROC_ELIF = "preproc_elif";
    public static final String PREPROC_ELIFDEF = "preproc_elifdef";
    public static final String SYSTEM_LIB_STRING = "system_lib_string";

    public static final String COMMENT = "comment";

    // Field names
    public static final String FIELD_NAME = "name";
    public static final String FIELD_BODY = "body";
    public static final String FIELD_TYPE = "type";
    public static final String FIELD_DECLARATOR = "declarator";
    public static final String FIELD_VALUE = "value";
    public static final String FIELD_PARAMETERS = "parameters";
    public static final String FIELD_FUNCTION = "function";
    public static final String FIELD_ARGUMENTS = "arguments";
    public static final String FIELD_ARGUMENT = "argument";
    public static final String FIELD_FIELD = "field";
    public static final String FIELD_OPERATOR = "operator";
    public static final String FIELD_LEFT = "left";
    public static final String FIELD_RIGHT = "right";
    public static final String FIELD_PATH = "path";
    public static final String FIELD_DEFAULT_VALUE = "default_value";

    private CFamilyNodeTypes() {}
}
