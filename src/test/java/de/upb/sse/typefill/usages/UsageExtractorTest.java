package de.upb.sse.typefill.usages;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.expr.SimpleName;
import com.github.javaparser.ast.stmt.Statement;
import de.upb.sse.typefill.parsing.SourceParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class UsageExtractorTest {
    private static final String FIXTURES = "src/test/resources/typefill/usages/";

    private SourceParser parser;
    private UsageExtractor extractor;

    @BeforeEach
    void setup() {
        parser = new SourceParser();
        extractor = new UsageExtractor();
    }

    private Node fixture(String name) throws IOException {
        return parser.parse(Files.readString(Path.of(FIXTURES + name)));
    }

    private static List<String> printed(List<Statement> statements) {
        return statements.stream().map(Statement::toString).collect(Collectors.toList());
    }

    @Test
    @DisplayName("Usages after the declaration are listed in order under a header")
    void usages_in_order() throws IOException {
        String context = extractor.extractUsageContext(fixture("Scope.java"), parser.parse("int x = 1;"));
        assertEquals("// Usages of 'x' are shown below:\nf(x);\ng(x);\n", context);
    }

    @Test
    @DisplayName("An inner block without identifiers gives no context")
    void no_identifier() throws IOException {
        assertEquals("", extractor.extractUsageContext(fixture("Scope.java"), parser.parse(";")));
    }

    @Test
    @DisplayName("A name that only occurs once gives no context")
    void declaration_only() throws IOException {
        assertEquals("", extractor.extractUsageContext(fixture("Scope.java"), parser.parse("int unused = 2;")));
    }

    @Test
    @DisplayName("Names inside types are not identifier references")
    void hole_types_are_skipped() {
        Optional<SimpleName> first = extractor.firstIdentifier(parser.parse("_hole_ x = 1;"));
        assertTrue(first.isPresent());
        assertEquals("x", first.get().getIdentifier());
    }

    @Test
    @DisplayName("The method name is tracked for a method block, not its return type")
    void method_block_tracks_method_name() throws IOException {
        Node inner = parser.parse("static String hello(String name) {\n    return \"hello \" + name + \"!\";\n}");
        assertEquals("hello", extractor.firstIdentifier(inner).get().getIdentifier());

        String context = extractor.extractUsageContext(fixture("Greeter.java"), inner);
        assertEquals("// Usages of 'hello' are shown below:\n"
                + "System.out.println(hello(\"world\"));\n"
                + "System.out.println(hello(\"Federico\"));\n", context);
    }

    @Test
    @DisplayName("A reference passed as an argument yields the enclosing call")
    void argument_yields_call() throws IOException {
        List<Statement> usages = extractor.collectUsages(fixture("Scope.java"), "x");
        assertEquals(Arrays.asList("f(x);", "g(x);"), printed(usages));
    }

    @Test
    @DisplayName("N occurrences give N-1 usages: binary, assignment and declaration shapes")
    void every_later_occurrence_is_collected() throws IOException {
        // field, parameter, this.total, rhs total, total * 2
        List<Statement> usages = extractor.collectUsages(fixture("Counter.java"), "total");
        assertEquals(Arrays.asList(
                "total;",
                "this.total = total;",
                "this.total = total;",
                "int doubled = total * 2 + 1;"), printed(usages));
    }

    @Test
    @DisplayName("Member and element access on a name reach the enclosing call")
    void member_access_reaches_call() throws IOException {
        List<Statement> usages = extractor.collectUsages(fixture("Members.java"), "x");
        assertEquals(Arrays.asList(
                "System.out.println(x.name);",
                "x.age;",
                "h(x[0]);",
                "k(x.id);"), printed(usages));
    }

    @Test
    @DisplayName("Constructor delegation and annotation arguments are call-like")
    void delegation_and_annotation_are_call_like() throws IOException {
        List<Statement> usages = extractor.collectUsages(fixture("Delegating.java"), "x");
        assertEquals(Arrays.asList("this(x);", "@SuppressWarnings(x);"), printed(usages));
    }

    @Test
    @DisplayName("The outer tree is left as it was")
    void outer_not_modified() throws IOException {
        Node outer = fixture("Greeter.java");
        String before = outer.toString();
        extractor.extractUsageContext(outer, parser.parse("String hello(String name) { return name; }"));
        assertEquals(before, outer.toString());
    }
}
