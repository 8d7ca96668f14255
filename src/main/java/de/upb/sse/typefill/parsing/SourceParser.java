package de.upb.sse.typefill.parsing;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.Problem;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.BodyDeclaration;
import com.github.javaparser.ast.stmt.BlockStmt;
import com.github.javaparser.ast.type.Type;
import de.upb.sse.typefill.configuration.TypeFillConfiguration;
import de.upb.sse.typefill.exceptions.ParsingException;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Turns source text into JavaParser trees. Besides whole files it accepts the snippets a pipeline
 * hands around: a run of statements or a single class member.
 */
public class SourceParser {
    public static final String LANGUAGE_LEVEL_PROPERTY = "typefill.languageLevel";

    private static final Logger logger = Logger.getLogger(SourceParser.class.getName());

    private final TypeFillConfiguration config;

    public SourceParser() {
        this(new TypeFillConfiguration());
    }

    public SourceParser(TypeFillConfiguration config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    /**
     * Parses {@code code} as a compilation unit, then as a block of statements, then as a single
     * member declaration.
     *
     * @throws ParsingException if none of the three succeeds; carries the compilation unit problems
     */
    public Node parse(String code) {
        Objects.requireNonNull(code, "code");
        JavaParser parser = newParser();

        ParseResult<CompilationUnit> unit = parser.parse(code);
        if (unit.isSuccessful() && unit.getResult().isPresent()) {
            return unit.getResult().get();
        }

        ParseResult<BlockStmt> block = parser.parseBlock("{\n" + code + "\n}");
        if (block.isSuccessful() && block.getResult().isPresent()) {
            logger.fine("Parsed input as a block of statements");
            return block.getResult().get();
        }

        ParseResult<BodyDeclaration<?>> member = parser.parseBodyDeclaration(code);
        if (member.isSuccessful() && member.getResult().isPresent()) {
            logger.fine("Parsed input as a member declaration");
            return member.getResult().get();
        }

        logger.warning("Could not parse input as a compilation unit, statements or a member");
        throw new ParsingException("Could not parse source", messages(unit.getProblems()));
    }

    public CompilationUnit parseCompilationUnit(String code) {
        Objects.requireNonNull(code, "code");
        ParseResult<CompilationUnit> unit = newParser().parse(code);
        if (!unit.isSuccessful() || !unit.getResult().isPresent()) {
            throw new ParsingException("Could not parse compilation unit", messages(unit.getProblems()));
        }
        return unit.getResult().get();
    }

    /**
     * Normalizes a type written by a model. The text must be a single Java type and nothing else.
     *
     * @return the printed type, or empty if the text is blank or not exactly one type
     */
    public Optional<String> parseGeneratedType(String text) {
        if (text == null || text.trim().isEmpty()) {
            return Optional.empty();
        }
        ParseResult<Type> type = newParser().parseType(text.trim());
        if (!type.isSuccessful()) {
            return Optional.empty();
        }
        return type.getResult().map(Type::toString);
    }

    ParserConfiguration.LanguageLevel languageLevel() {
        String override = System.getProperty(LANGUAGE_LEVEL_PROPERTY, "");
        if (!override.isEmpty()) {
            try {
                return ParserConfiguration.LanguageLevel.valueOf(override.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                logger.warning("Ignoring unknown language level '" + override + "', using " + config.getLanguageLevel());
            }
        }
        return config.getLanguageLevel();
    }

    private JavaParser newParser() {
        ParserConfiguration parserConfig = new ParserConfiguration();
        parserConfig.setLanguageLevel(languageLevel());
        return new JavaParser(parserConfig);
    }

    private static List<String> messages(List<Problem> problems) {
        return problems.stream().map(Problem::getVerboseMessage).collect(Collectors.toList());
    }
}
