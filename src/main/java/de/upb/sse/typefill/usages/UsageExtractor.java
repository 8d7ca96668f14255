package de.upb.sse.typefill.usages;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.expr.AnnotationExpr;
import com.github.javaparser.ast.expr.AssignExpr;
import com.github.javaparser.ast.expr.BinaryExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.NameExpr;
import com.github.javaparser.ast.expr.ObjectCreationExpr;
import com.github.javaparser.ast.expr.SimpleName;
import com.github.javaparser.ast.expr.VariableDeclarationExpr;
import com.github.javaparser.ast.stmt.ExplicitConstructorInvocationStmt;
import com.github.javaparser.ast.stmt.ExpressionStmt;
import com.github.javaparser.ast.stmt.Statement;
import com.github.javaparser.ast.type.Type;
import de.upb.sse.typefill.util.SourceOrder;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Collects the other places a block's name is used, to be shown to the model as extra context.
 *
 * Matching is purely by name text; there is no scope resolution, so a reused name picks up
 * unrelated usages. The first occurrence in the outer scope is taken to be the declaration.
 */
public class UsageExtractor {
    private static final Logger logger = Logger.getLogger(UsageExtractor.class.getName());

    static final String HEADER = "// Usages of '%s' are shown below:";

    public String extractUsageContext(Node outer, Node inner) {
        Objects.requireNonNull(outer, "outer");
        Objects.requireNonNull(inner, "inner");

        Optional<SimpleName> tracked = firstIdentifier(inner);
        if (!tracked.isPresent()) {
            logger.fine("No identifier in inner block, no usage context");
            return "";
        }

        String name = tracked.get().getIdentifier();
        List<Statement> usages = collectUsages(outer, name);
        logger.fine("Found " + usages.size() + " usages of '" + name + "'");
        if (usages.isEmpty()) {
            return "";
        }

        StringBuilder sb = new StringBuilder(String.format(HEADER, name)).append('\n');
        for (Statement usage : usages) {
            sb.append(usage.toString()).append('\n');
        }
        return sb.toString();
    }

    /** First identifier reference in pre-order, if any. */
    public Optional<SimpleName> firstIdentifier(Node node) {
        if (isIdentifierReference(node)) {
            return Optional.of((SimpleName) node);
        }
        for (Node child : SourceOrder.children(node)) {
            Optional<SimpleName> found = firstIdentifier(child);
            if (found.isPresent()) return found;
        }
        return Optional.empty();
    }

    /**
     * Usage statements for every occurrence of {@code name} in {@code outer} after the first one, in
     * discovery order. The statements are built from copies; {@code outer} is not modified.
     */
    public List<Statement> collectUsages(Node outer, String name) {
        Collector collector = new Collector(name);
        collector.scan(outer);
        return collector.usages;
    }

    /** Names inside a type belong to the annotation (hole markers included), not to the code. */
    static boolean isIdentifierReference(Node node) {
        if (!(node instanceof SimpleName)) return false;
        return !node.getParentNode().filter(p -> p instanceof Type).isPresent();
    }

    /**
     * Walks up from the reference while the ancestor is a call, a binary expression or a variable
     * declaration, and returns the last node reached. The walk always takes one step from the
     * referencing expression to its parent first; for a plain name that expression is the
     * {@link NameExpr}, not the {@link SimpleName} inside it.
     */
    static Node enclosingUsage(SimpleName reference) {
        Node usage = reference.getParentNode().orElse(reference);
        if (usage instanceof NameExpr) {
            usage = usage.getParentNode().orElse(usage);
        }
        Optional<Node> parent = usage.getParentNode();
        while (parent.isPresent() && extendsUsage(parent.get())) {
            usage = parent.get();
            parent = usage.getParentNode();
        }
        return usage;
    }

    private static boolean extendsUsage(Node node) {
        return isCallLike(node) || isBinary(node) || isVariableDeclaration(node);
    }

    private static boolean isCallLike(Node node) {
        return node instanceof MethodCallExpr
                || node instanceof ObjectCreationExpr
                || node instanceof ExplicitConstructorInvocationStmt
                || node instanceof AnnotationExpr;
    }

    private static boolean isBinary(Node node) {
        return node instanceof BinaryExpr || node instanceof AssignExpr;
    }

    private static boolean isVariableDeclaration(Node node) {
        return node instanceof VariableDeclarator || node instanceof VariableDeclarationExpr;
    }

    /** Wraps a usage into a statement that prints on its own line. */
    static Statement asStatement(Node usage, SimpleName reference) {
        if (usage instanceof Statement) {
            return ((Statement) usage).clone();
        }
        if (usage instanceof Expression) {
            return new ExpressionStmt(((Expression) usage).clone());
        }
        if (usage instanceof VariableDeclarator) {
            return new ExpressionStmt(new VariableDeclarationExpr(((VariableDeclarator) usage).clone()));
        }
        // another declaration with the same name (parameter, method, type): show the bare reference
        return new ExpressionStmt(new NameExpr(reference.clone()));
    }

    private static final class Collector {
        private final String name;
        private final List<Statement> usages = new ArrayList<>();
        private boolean declarationSeen;

        Collector(String name) {
            this.name = name;
        }

        void scan(Node node) {
            if (isIdentifierReference(node) && ((SimpleName) node).getIdentifier().equals(name)) {
                if (!declarationSeen) {
                    declarationSeen = true;
                    return;
                }
                SimpleName reference = (SimpleName) node;
                usages.add(asStatement(enclosingUsage(reference), reference));
            }
            for (Node child : SourceOrder.children(node)) {
                scan(child);
            }
        }
    }
}
