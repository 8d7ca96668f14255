package de.upb.sse.typefill.util;

import com.github.javaparser.Position;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.comments.Comment;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Child ordering shared by all traversals.
 *
 * JavaParser keeps children in the order they were attached, which is not always the order they
 * appear in the source (and changes when a child is replaced). Traversals here sort by begin
 * position instead; nodes without a range (created programmatically) keep their relative order
 * and come after positioned ones.
 */
public final class SourceOrder {

    private static final Comparator<Node> BY_BEGIN = (a, b) -> {
        Optional<Position> beginA = a.getBegin();
        Optional<Position> beginB = b.getBegin();
        if (beginA.isPresent() && beginB.isPresent()) {
            return beginA.get().compareTo(beginB.get());
        }
        if (beginA.isPresent()) return -1;
        if (beginB.isPresent()) return 1;
        return 0;
    };

    private SourceOrder() {
    }

    /**
     * Snapshot of the non-comment children of {@code node} in source order. The returned list is a
     * copy, so callers may rewrite the tree while iterating it.
     */
    public static List<Node> children(Node node) {
        List<Node> children = new ArrayList<>();
        for (Node child : node.getChildNodes()) {
            if (child instanceof Comment) continue;
            children.add(child);
        }
        children.sort(BY_BEGIN);
        return children;
    }
}
