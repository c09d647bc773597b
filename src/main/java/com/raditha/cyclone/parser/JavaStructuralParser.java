package com.raditha.cyclone.parser;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.Position;
import com.github.javaparser.Problem;
import com.github.javaparser.Range;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.ImportDeclaration;
import com.github.javaparser.ast.Modifier;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.comments.Comment;
import com.github.javaparser.ast.expr.AssignExpr;
import com.github.javaparser.ast.expr.BinaryExpr;
import com.github.javaparser.ast.expr.BooleanLiteralExpr;
import com.github.javaparser.ast.expr.LiteralStringValueExpr;
import com.github.javaparser.ast.expr.MethodReferenceExpr;
import com.github.javaparser.ast.expr.Name;
import com.github.javaparser.ast.expr.SimpleName;
import com.github.javaparser.ast.expr.UnaryExpr;
import com.github.javaparser.ast.stmt.SwitchEntry;
import com.github.javaparser.ast.type.PrimitiveType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * {@link SourceParser} for Java built on JavaParser.
 * <p>
 * The JavaParser AST is copied into a {@link SyntaxTree} breadth first.
 * Comments are never attributed, so neither comments nor whitespace can
 * become nodes. Simple and qualified names become identifier leaves, literal
 * expressions become literal leaves, and operators, modifiers and primitive
 * type names are kept as structural labels.
 */
public class JavaStructuralParser implements SourceParser {

    private static final Logger logger = LoggerFactory.getLogger(JavaStructuralParser.class);

    private static final Comparator<Node> SOURCE_ORDER = Comparator.comparing(
            (Node n) -> n.getRange().map(r -> r.begin).orElse(null),
            Comparator.nullsLast(Comparator.naturalOrder()));

    private final ParserConfiguration configuration;

    public JavaStructuralParser() {
        this.configuration = new ParserConfiguration()
                .setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17)
                .setAttributeComments(false);
    }

    @Override
    public SyntaxTree parse(String fileId, String text) throws SourceParseException {
        LineOffsets lines = new LineOffsets(text);
        ParseResult<CompilationUnit> result;
        try {
            // JavaParser instances are not thread safe, the configuration is only read
            result = new JavaParser(configuration).parse(text);
        } catch (RuntimeException e) {
            throw new SourceParseException(fileId, 0, 0, "Parser failure: " + e.getMessage(), e);
        } catch (StackOverflowError e) {
            // the generated parser recurses once per nesting level
            throw new SourceParseException(fileId, 0, 0, "Nesting too deep to parse", e);
        }

        Optional<CompilationUnit> cu = result.getResult();
        if (!result.isSuccessful() || cu.isEmpty()) {
            throw toException(fileId, result.getProblems(), lines);
        }

        SyntaxTree tree = buildTree(fileId, cu.get(), lines);
        logger.debug("Parsed {} into {} nodes", fileId, tree.size());
        return tree;
    }

    private SourceParseException toException(String fileId, List<Problem> problems, LineOffsets lines) {
        if (problems.isEmpty()) {
            return new SourceParseException(fileId, 0, 0, "Unable to parse");
        }
        Problem first = problems.get(0);
        Optional<Position> position = first.getLocation()
                .flatMap(location -> location.getBegin().getRange())
                .map(range -> range.begin);
        int line = position.map(p -> p.line).orElse(0);
        int offset = position.map(p -> lines.offsetOf(p.line, p.column)).orElse(0);
        return new SourceParseException(fileId, offset, line, first.getMessage());
    }

    private SyntaxTree buildTree(String fileId, CompilationUnit cu, LineOffsets lines) {
        SyntaxTree.Builder builder = new SyntaxTree.Builder(fileId);
        Deque<Pending> queue = new ArrayDeque<>();
        queue.add(new Pending(cu, addNode(builder, cu, lines)));

        while (!queue.isEmpty()) {
            Pending pending = queue.poll();
            Node node = pending.node();
            if (kindOf(node).isRoleLeaf()) {
                continue;
            }

            int first = builder.size();
            List<Node> children = structuralChildren(node);
            for (Node child : children) {
                queue.add(new Pending(child, addNode(builder, child, lines)));
            }
            int count = children.size();

            // the referenced method name is a plain string in JavaParser, give it a leaf of its own
            if (node instanceof MethodReferenceExpr reference) {
                Range range = node.getRange().orElse(null);
                addLeaf(builder, NodeKind.IDENTIFIER, reference.getIdentifier(), range, lines);
                count++;
            }
            builder.setChildren(pending.index(), first, count);
        }
        return builder.build();
    }

    private List<Node> structuralChildren(Node node) {
        List<Node> children = new ArrayList<>();
        for (Node child : node.getChildNodes()) {
            if (!(child instanceof Comment)) {
                children.add(child);
            }
        }
        children.sort(SOURCE_ORDER);
        return children;
    }

    private int addNode(SyntaxTree.Builder builder, Node node, LineOffsets lines) {
        NodeKind kind = kindOf(node);
        return addLeaf(builder, kind, valueOf(node, kind), node.getRange().orElse(null), lines);
    }

    private int addLeaf(SyntaxTree.Builder builder, NodeKind kind, String value, Range range, LineOffsets lines) {
        if (range == null) {
            return builder.add(kind, value, 0, 0, 0, 0);
        }
        int from = lines.offsetOf(range.begin.line, range.begin.column);
        int to = lines.offsetOf(range.end.line, range.end.column) + 1;
        return builder.add(kind, value, from, Math.max(from, to), range.begin.line, range.end.line);
    }

    static NodeKind kindOf(Node node) {
        if (node instanceof Name) {
            return NodeKind.IDENTIFIER;
        }
        return NodeKind.forTypeName(node.getClass().getSimpleName());
    }

    /**
     * Value stored with a node: the text of identifiers and literals, the
     * operator or keyword of structural nodes that have one.
     */
    private static String valueOf(Node node, NodeKind kind) {
        if (node instanceof SimpleName simpleName) {
            return simpleName.getIdentifier();
        }
        if (node instanceof Name name) {
            return name.asString();
        }
        if (node instanceof LiteralStringValueExpr literal) {
            return literal.getValue();
        }
        if (node instanceof BooleanLiteralExpr literal) {
            return String.valueOf(literal.getValue());
        }
        if (node instanceof BinaryExpr binary) {
            return binary.getOperator().name();
        }
        if (node instanceof UnaryExpr unary) {
            return unary.getOperator().name();
        }
        if (node instanceof AssignExpr assign) {
            return assign.getOperator().name();
        }
        if (node instanceof Modifier modifier) {
            return modifier.getKeyword().asString();
        }
        if (node instanceof PrimitiveType primitive) {
            return primitive.getType().asString();
        }
        if (node instanceof SwitchEntry entry) {
            return entry.getType().name();
        }
        if (node instanceof ImportDeclaration importDeclaration) {
            return (importDeclaration.isStatic() ? "static" : "")
                    + (importDeclaration.isAsterisk() ? ".*" : "");
        }
        if (kind == NodeKind.OTHER) {
            return node.getClass().getSimpleName();
        }
        return null;
    }

    private record Pending(Node node, int index) {
    }
}
