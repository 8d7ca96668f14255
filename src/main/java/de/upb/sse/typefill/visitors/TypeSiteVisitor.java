package de.upb.sse.typefill.visitors;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.type.Type;
import de.upb.sse.typefill.configuration.TypeFillConfiguration;
import de.upb.sse.typefill.util.SourceOrder;

import java.util.Objects;
import java.util.Optional;

/**
 * Visits every type-annotation site below a root in pre-order (source order) and writes back
 * whatever the transform returns.
 *
 * The same routine observes a tree (a transform returning its input leaves it untouched) and
 * rewrites it. Rewriting transforms must only be run on a tree the caller owns.
 */
public class TypeSiteVisitor {
    private final String holeMarker;

    public TypeSiteVisitor() {
        this(TypeFillConfiguration.DEFAULT_HOLE_MARKER);
    }

    public TypeSiteVisitor(String holeMarker) {
        this.holeMarker = Objects.requireNonNull(holeMarker, "holeMarker");
    }

    /**
     * @return the number of sites visited
     */
    public int visit(Node root, TypeTransform transform) {
        Objects.requireNonNull(root, "root");
        Objects.requireNonNull(transform, "transform");
        return visitNode(root, transform);
    }

    private int visitNode(Node node, TypeTransform transform) {
        int visited = 0;
        Optional<TypeSite> site = TypeSite.at(node, holeMarker);
        if (site.isPresent()) {
            rewrite(site.get(), transform);
            visited++;
        }
        // children are taken after the write-back, so the new type is the one traversed
        for (Node child : SourceOrder.children(node)) {
            visited += visitNode(child, transform);
        }
        return visited;
    }

    private void rewrite(TypeSite site, TypeTransform transform) {
        Optional<Type> current = site.get();
        Optional<Type> next = Objects.requireNonNull(transform.apply(site, current),
                "transform returned null instead of Optional.empty()");

        if (sameValue(current, next)) return;

        // a type still attached elsewhere would be moved, not copied, by setType
        Optional<Type> detached = next.map(t -> t.getParentNode().isPresent() ? t.clone() : t);
        site.set(detached);
    }

    private static boolean sameValue(Optional<Type> current, Optional<Type> next) {
        if (current.isPresent() && next.isPresent()) {
            return current.get() == next.get();
        }
        return current.isPresent() == next.isPresent();
    }
}
