package de.upb.sse.typefill;

import com.github.javaparser.ast.Node;
import de.upb.sse.typefill.api.PublicApi.CheckResult;
import de.upb.sse.typefill.api.PublicApi.VerificationResult;
import de.upb.sse.typefill.configuration.TypeFillConfiguration;
import de.upb.sse.typefill.holes.TypeHoles;
import de.upb.sse.typefill.parsing.SourceParser;
import de.upb.sse.typefill.stats.CheckStats;
import de.upb.sse.typefill.usages.UsageExtractor;
import de.upb.sse.typefill.verify.CompletionVerifier;
import lombok.Getter;

import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Text-level entry point for the evaluation pipeline. Parses its inputs and hands the trees to the
 * verifier, the usage extractor or the hole printer.
 *
 * Configuration changes made through {@link #getConfig()} apply to subsequent calls.
 */
public class TypeFill {
    private static final Logger logger = Logger.getLogger(TypeFill.class.getName());

    @Getter private final TypeFillConfiguration config;
    @Getter private final CheckStats checkStats = new CheckStats();
    private final SourceParser parser;
    private final CompletionVerifier verifier;
    private final UsageExtractor extractor = new UsageExtractor();

    public TypeFill() {
        this(new TypeFillConfiguration());
    }

    public TypeFill(TypeFillConfiguration config) {
        this.config = Objects.requireNonNull(config, "config");
        this.parser = new SourceParser(config);
        this.verifier = new CompletionVerifier(config);
    }

    public VerificationResult verify(String originalCode, String completedCode) {
        return verifier.verify(parser.parse(originalCode), parser.parse(completedCode));
    }

    /**
     * Checks a completion and records the outcome in {@link #getCheckStats()}.
     */
    public CheckResult check(String originalCode, String completedCode) {
        CheckResult result = verifier.check(parser.parse(originalCode), parser.parse(completedCode));
        checkStats.record(result);
        logger.fine("Checked completion: " + result);
        return result;
    }

    /**
     * Usage context of the name introduced by {@code innerCode}, taken from {@code outerCode}.
     * Empty if there is nothing to show.
     */
    public String usages(String outerCode, String innerCode) {
        String context = extractor.extractUsageContext(parser.parse(outerCode), parser.parse(innerCode));
        checkStats.recordUsages(!context.isEmpty());
        return context;
    }

    /** Prints {@code code} with every missing annotation set to the configured any type. */
    public String prettyPrint(String code) {
        return prettyPrint(code, config.getAnyType());
    }

    public String prettyPrint(String code, String typeName) {
        Node filled = TypeHoles.fillMissing(parser.parse(code), typeName);
        return filled.toString();
    }

    /** A model-written type in normalized form, or empty if it is not a single valid type. */
    public Optional<String> parseGeneratedType(String text) {
        return parser.parseGeneratedType(text);
    }
}
