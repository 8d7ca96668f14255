package de.upb.sse.typefill.visitors;

import com.github.javaparser.ast.type.Type;

import java.util.Optional;
import java.util.function.Consumer;

/**
 * Rewrites the value of one type-annotation site. Empty means "no written annotation", both as
 * input and as output.
 */
@FunctionalInterface
public interface TypeTransform {

    Optional<Type> apply(TypeSite site, Optional<Type> current);

    static TypeTransform observing(Consumer<Optional<Type>> observer) {
        return (site, current) -> {
            observer.accept(current);
            return current;
        };
    }
}
