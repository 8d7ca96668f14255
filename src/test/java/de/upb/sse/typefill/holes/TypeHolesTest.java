package de.upb.sse.typefill.holes;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.type.Type;
import de.upb.sse.typefill.parsing.SourceParser;
import de.upb.sse.typefill.visitors.TypeSiteVisitor;
import de.upb.sse.typefill.visitors.TypeTransform;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class TypeHolesTest {
    private final SourceParser parser = new SourceParser();

    private static List<String> sites(Node tree) {
        List<String> seen = new ArrayList<>();
        new TypeSiteVisitor().visit(tree, TypeTransform.observing(t -> seen.add(t.map(Type::toString).orElse("-"))));
        return seen;
    }

    @Test
    @DisplayName("Missing annotations are filled, written ones are kept")
    void fills_only_missing() {
        Node tree = parser.parse("class A {\n"
                + "    java.util.function.Function<String, String> g = s -> s;\n"
                + "    void f(_hole_ p) {\n"
                + "        var x = 1;\n"
                + "    }\n"
                + "}");

        Node filled = TypeHoles.fillMissing(tree, "_hole_");

        assertEquals(Arrays.asList("java.util.function.Function<String, String>", "_hole_", "void", "_hole_", "_hole_"), sites(filled));
        assertTrue(filled.toString().contains("_hole_ x = 1;"));
    }

    @Test
    @DisplayName("The input tree is not modified")
    void input_untouched() {
        Node tree = parser.parse("void f() { var x = 1; }");
        String before = tree.toString();

        TypeHoles.fillMissing(tree, "Object");

        assertEquals(before, tree.toString());
        assertEquals(Arrays.asList("void", "-"), sites(tree));
    }

    @Test
    @DisplayName("Every synthetic type is a fresh node")
    void fresh_nodes() {
        assertNotSame(TypeHoles.named("_hole_"), TypeHoles.named("_hole_"));
        assertEquals("_placeholder_", TypeHoles.named("_placeholder_").toString());
        assertFalse(TypeHoles.named("T").getParentNode().isPresent());
    }
}
