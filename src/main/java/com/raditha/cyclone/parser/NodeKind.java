package com.raditha.cyclone.parser;

import java.util.HashMap;
import java.util.Map;

/**
 * Node kinds of the Java grammar as seen by the clone detector.
 * <p>
 * Most kinds are opaque structural labels. Only identifiers, literals,
 * pruned wrappers and the truncation sentinel get special treatment, which is
 * expressed through {@link Category}.
 */
public enum NodeKind {
    // compilation unit level
    COMPILATION_UNIT("CompilationUnit"),
    PACKAGE_DECLARATION("PackageDeclaration"),
    IMPORT_DECLARATION("ImportDeclaration"),
    MODIFIER("Modifier"),
    ARRAY_CREATION_LEVEL("ArrayCreationLevel"),

    // declarations
    ANNOTATION_DECLARATION("AnnotationDeclaration"),
    ANNOTATION_MEMBER_DECLARATION("AnnotationMemberDeclaration"),
    CLASS_OR_INTERFACE_DECLARATION("ClassOrInterfaceDeclaration"),
    COMPACT_CONSTRUCTOR_DECLARATION("CompactConstructorDeclaration"),
    CONSTRUCTOR_DECLARATION("ConstructorDeclaration"),
    ENUM_CONSTANT_DECLARATION("EnumConstantDeclaration"),
    ENUM_DECLARATION("EnumDeclaration"),
    FIELD_DECLARATION("FieldDeclaration"),
    INITIALIZER_DECLARATION("InitializerDeclaration"),
    METHOD_DECLARATION("MethodDeclaration"),
    PARAMETER("Parameter"),
    RECEIVER_PARAMETER("ReceiverParameter"),
    RECORD_DECLARATION("RecordDeclaration"),
    VARIABLE_DECLARATOR("VariableDeclarator"),

    // statements
    ASSERT_STMT("AssertStmt"),
    BLOCK_STMT("BlockStmt"),
    BREAK_STMT("BreakStmt"),
    CATCH_CLAUSE("CatchClause"),
    CONTINUE_STMT("ContinueStmt"),
    DO_STMT("DoStmt"),
    EMPTY_STMT("EmptyStmt", Category.COSMETIC),
    EXPLICIT_CONSTRUCTOR_INVOCATION_STMT("ExplicitConstructorInvocationStmt"),
    EXPRESSION_STMT("ExpressionStmt"),
    FOR_EACH_STMT("ForEachStmt"),
    FOR_STMT("ForStmt"),
    IF_STMT("IfStmt"),
    LABELED_STMT("LabeledStmt"),
    LOCAL_CLASS_DECLARATION_STMT("LocalClassDeclarationStmt"),
    LOCAL_RECORD_DECLARATION_STMT("LocalRecordDeclarationStmt"),
    RETURN_STMT("ReturnStmt"),
    SWITCH_ENTRY("SwitchEntry"),
    SWITCH_STMT("SwitchStmt"),
    SYNCHRONIZED_STMT("SynchronizedStmt"),
    THROW_STMT("ThrowStmt"),
    TRY_STMT("TryStmt"),
    UNPARSABLE_STMT("UnparsableStmt"),
    WHILE_STMT("WhileStmt"),
    YIELD_STMT("YieldStmt"),

    // expressions
    ARRAY_ACCESS_EXPR("ArrayAccessExpr"),
    ARRAY_CREATION_EXPR("ArrayCreationExpr"),
    ARRAY_INITIALIZER_EXPR("ArrayInitializerExpr"),
    ASSIGN_EXPR("AssignExpr"),
    BINARY_EXPR("BinaryExpr"),
    CAST_EXPR("CastExpr"),
    CLASS_EXPR("ClassExpr"),
    CONDITIONAL_EXPR("ConditionalExpr"),
    ENCLOSED_EXPR("EnclosedExpr", Category.TRANSPARENT),
    FIELD_ACCESS_EXPR("FieldAccessExpr"),
    INSTANCE_OF_EXPR("InstanceOfExpr"),
    LAMBDA_EXPR("LambdaExpr"),
    MARKER_ANNOTATION_EXPR("MarkerAnnotationExpr"),
    MEMBER_VALUE_PAIR("MemberValuePair"),
    METHOD_CALL_EXPR("MethodCallExpr"),
    METHOD_REFERENCE_EXPR("MethodReferenceExpr"),
    NAME_EXPR("NameExpr", Category.TRANSPARENT),
    NORMAL_ANNOTATION_EXPR("NormalAnnotationExpr"),
    NULL_LITERAL_EXPR("NullLiteralExpr"),
    OBJECT_CREATION_EXPR("ObjectCreationExpr"),
    PATTERN_EXPR("TypePatternExpr"),
    RECORD_PATTERN_EXPR("RecordPatternExpr"),
    SINGLE_MEMBER_ANNOTATION_EXPR("SingleMemberAnnotationExpr"),
    SUPER_EXPR("SuperExpr"),
    SWITCH_EXPR("SwitchExpr"),
    THIS_EXPR("ThisExpr"),
    TYPE_EXPR("TypeExpr"),
    UNARY_EXPR("UnaryExpr"),
    VARIABLE_DECLARATION_EXPR("VariableDeclarationExpr"),

    // types
    ARRAY_TYPE("ArrayType"),
    CLASS_OR_INTERFACE_TYPE("ClassOrInterfaceType"),
    INTERSECTION_TYPE("IntersectionType"),
    PRIMITIVE_TYPE("PrimitiveType"),
    TYPE_PARAMETER("TypeParameter"),
    UNION_TYPE("UnionType"),
    UNKNOWN_TYPE("UnknownType"),
    VAR_TYPE("VarType"),
    VOID_TYPE("VoidType"),
    WILDCARD_TYPE("WildcardType"),

    // leaves carrying a renamable value
    IDENTIFIER("SimpleName", Category.IDENTIFIER),
    STRING_LITERAL("StringLiteralExpr", Category.LITERAL),
    TEXT_BLOCK_LITERAL("TextBlockLiteralExpr", Category.LITERAL),
    CHAR_LITERAL("CharLiteralExpr", Category.LITERAL),
    INTEGER_LITERAL("IntegerLiteralExpr", Category.LITERAL),
    LONG_LITERAL("LongLiteralExpr", Category.LITERAL),
    DOUBLE_LITERAL("DoubleLiteralExpr", Category.LITERAL),
    BOOLEAN_LITERAL("BooleanLiteralExpr", Category.LITERAL),

    /** Stands for the children elided below the depth cap. */
    TRUNCATED("<truncated>", Category.SENTINEL),

    /** Any grammar type without its own constant; the type name is kept as the label. */
    OTHER("<other>");

    /**
     * How the normalizer and the matcher treat a kind.
     */
    public enum Category {
        /** Plain structural label. */
        STRUCTURE,
        /** Renamable name; replaced by a role token. */
        IDENTIFIER,
        /** Literal value; replaced by a role token. */
        LITERAL,
        /** Redundant grouping; replaced by its children. */
        TRANSPARENT,
        /** No structural meaning; dropped. */
        COSMETIC,
        /** Truncation marker. */
        SENTINEL
    }

    private static final Map<String, NodeKind> BY_TYPE_NAME = new HashMap<>();

    static {
        for (NodeKind kind : values()) {
            BY_TYPE_NAME.put(kind.typeName, kind);
        }
        // JavaParser releases before 3.25 call the type pattern PatternExpr
        BY_TYPE_NAME.put("PatternExpr", PATTERN_EXPR);
    }

    private final String typeName;
    private final Category category;

    NodeKind(String typeName) {
        this(typeName, Category.STRUCTURE);
    }

    NodeKind(String typeName, Category category) {
        this.typeName = typeName;
        this.category = category;
    }

    /**
     * Look up the kind for a JavaParser node type name.
     *
     * @return the matching kind, or {@link #OTHER} when the type has no constant
     */
    public static NodeKind forTypeName(String typeName) {
        return BY_TYPE_NAME.getOrDefault(typeName, OTHER);
    }

    public String typeName() {
        return typeName;
    }

    public Category category() {
        return category;
    }

    /**
     * True for identifier and literal leaves, the kinds normalized to role tokens.
     */
    public boolean isRoleLeaf() {
        return category == Category.IDENTIFIER || category == Category.LITERAL;
    }
}
