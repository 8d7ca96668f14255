package de.upb.sse.typefill.holes;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.type.ClassOrInterfaceType;
import de.upb.sse.typefill.visitors.TypeSiteVisitor;

import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Builds synthetic type nodes and prints trees with their missing annotations filled in.
 */
public final class TypeHoles {
    private static final Logger logger = Logger.getLogger(TypeHoles.class.getName());

    private TypeHoles() {
    }

    /**
     * A fresh, detached type node named {@code name}. Every call returns a new node so the result can
     * be attached to a tree without stealing it from another site.
     */
    public static ClassOrInterfaceType named(String name) {
        return new ClassOrInterfaceType(null, Objects.requireNonNull(name, "name"));
    }

    /**
     * Returns a copy of {@code tree} where every site without a written annotation carries
     * {@code typeName}. Written annotations, including holes, are left as they are. The input tree is
     * not modified.
     */
    public static Node fillMissing(Node tree, String typeName) {
        Objects.requireNonNull(tree, "tree");
        Objects.requireNonNull(typeName, "typeName");

        Node copy = tree.clone();
        int filled = new TypeSiteVisitor().visit(copy, (site, current) ->
                current.isPresent() ? current : Optional.of(named(typeName)));
        logger.fine("Visited " + filled + " type sites while filling missing annotations with " + typeName);
        return copy;
    }
}
