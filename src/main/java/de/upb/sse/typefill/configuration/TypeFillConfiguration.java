package de.upb.sse.typefill.configuration;

import com.github.javaparser.ParserConfiguration;
import lombok.*;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

@Getter
@Setter
@ToString
@NoArgsConstructor
public class TypeFillConfiguration {
    public static final String DEFAULT_HOLE_MARKER = "_hole_";
    public static final String DEFAULT_PLACEHOLDER_TYPE = "_placeholder_";

    /** Type name the prompt uses for a removed annotation. */
    private String holeMarker = DEFAULT_HOLE_MARKER;

    /** Type name written to every site before the skeleton comparison. Its value does not matter. */
    private String placeholderType = DEFAULT_PLACEHOLDER_TYPE;

    /** Type used when missing annotations are printed as "anything goes". */
    private String anyType = "Object";

    /**
     * Substrings of weak types and the score they add. Iteration order is the matching precedence,
     * so callers replacing the map should pass an ordered one.
     */
    @Getter(AccessLevel.NONE)
    @Setter(AccessLevel.NONE)
    private Map<String, Integer> weakTypeWeights = defaultWeakTypeWeights();

    private ParserConfiguration.LanguageLevel languageLevel = ParserConfiguration.LanguageLevel.JAVA_17;

    public TypeFillConfiguration(String holeMarker, String placeholderType, String anyType,
                                 Map<String, Integer> weakTypeWeights,
                                 ParserConfiguration.LanguageLevel languageLevel) {
        this.holeMarker = holeMarker;
        this.placeholderType = placeholderType;
        this.anyType = anyType;
        setWeakTypeWeights(weakTypeWeights);
        this.languageLevel = languageLevel;
    }

    /** Read-only view; iteration order is the matching precedence. */
    public Map<String, Integer> getWeakTypeWeights() {
        return Collections.unmodifiableMap(weakTypeWeights);
    }

    /** Takes a copy, so later changes to {@code weights} do not reach this configuration. */
    public void setWeakTypeWeights(Map<String, Integer> weights) {
        this.weakTypeWeights = new LinkedHashMap<>(Objects.requireNonNull(weights, "weights"));
    }

    public static Map<String, Integer> defaultWeakTypeWeights() {
        Map<String, Integer> weights = new LinkedHashMap<>();
        weights.put("any", 5);
        weights.put("unknown", 3);
        weights.put("undefined", 2);
        return weights;
    }
}
