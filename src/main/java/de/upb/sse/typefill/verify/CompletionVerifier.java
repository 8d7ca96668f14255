package de.upb.sse.typefill.verify;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.comments.Comment;
import com.github.javaparser.ast.type.Type;
import de.upb.sse.typefill.api.PublicApi.CheckProblem;
import de.upb.sse.typefill.api.PublicApi.CheckResult;
import de.upb.sse.typefill.api.PublicApi.VerificationResult;
import de.upb.sse.typefill.configuration.TypeFillConfiguration;
import de.upb.sse.typefill.holes.TypeHoles;
import de.upb.sse.typefill.visitors.TypeSiteVisitor;
import de.upb.sse.typefill.visitors.TypeTransform;

import java.util.EnumSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Decides whether a completion filled every removed type annotation and left the rest of the code
 * alone.
 *
 * Completeness and score come from a single pass over the completed tree. The skeleton check then
 * overwrites every annotation of a copy of both trees with the same placeholder and compares node
 * counts. Equal counts are a heuristic: reordered code or a same-sized substitution goes unnoticed.
 */
public class CompletionVerifier {
    private static final Logger logger = Logger.getLogger(CompletionVerifier.class.getName());

    private final TypeFillConfiguration config;

    public CompletionVerifier() {
        this(new TypeFillConfiguration());
    }

    public CompletionVerifier(TypeFillConfiguration config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    public VerificationResult verify(Node original, Node completed) {
        Objects.requireNonNull(original, "original");
        Objects.requireNonNull(completed, "completed");

        Tally tally = score(completed);
        if (!tally.complete) {
            return new VerificationResult(false, tally.score);
        }
        return new VerificationResult(sameSkeleton(original, completed), tally.score);
    }

    /**
     * Same analysis as {@link #verify(Node, Node)}, reported as a list of problems. The comment check
     * runs whether or not the completion is complete.
     */
    public CheckResult check(Node original, Node completed) {
        Objects.requireNonNull(original, "original");
        Objects.requireNonNull(completed, "completed");

        Set<CheckProblem> problems = EnumSet.noneOf(CheckProblem.class);
        Tally tally = score(completed);
        if (!tally.complete) {
            problems.add(CheckProblem.NOT_COMPLETE);
        } else if (!sameSkeleton(original, completed)) {
            problems.add(CheckProblem.CHANGED_CODE);
        }
        if (countComments(original) != countComments(completed)) {
            problems.add(CheckProblem.CHANGED_COMMENTS);
        }
        return new CheckResult(problems, tally.score);
    }

    /**
     * Weight of a single written annotation: the hole marker makes it incomplete, otherwise the first
     * weak-type substring it contains decides.
     */
    int weightOf(String typeText) {
        for (Map.Entry<String, Integer> weak : config.getWeakTypeWeights().entrySet()) {
            if (typeText.contains(weak.getKey())) {
                return weak.getValue();
            }
        }
        return 0;
    }

    private Tally score(Node completed) {
        Tally tally = new Tally();
        String holeMarker = config.getHoleMarker();

        int sites = new TypeSiteVisitor(holeMarker).visit(completed, TypeTransform.observing(current -> {
            if (!current.isPresent()) {
                // keep going, the score is still reported
                tally.complete = false;
                return;
            }
            String typeText = current.get().toString().trim();
            if (typeText.contains(holeMarker)) {
                tally.complete = false;
            } else {
                tally.score += weightOf(typeText);
            }
        }));

        logger.fine("Scored " + sites + " type sites: complete=" + tally.complete + ", score=" + tally.score);
        return tally;
    }

    private boolean sameSkeleton(Node original, Node completed) {
        int originalCount = countNodes(neutralized(original));
        int completedCount = countNodes(neutralized(completed));
        logger.fine("Node count after neutralizing types: original=" + originalCount + ", completed=" + completedCount);
        return originalCount == completedCount;
    }

    private Node neutralized(Node tree) {
        Node copy = tree.clone();
        String placeholder = config.getPlaceholderType();
        new TypeSiteVisitor(config.getHoleMarker()).visit(copy, (site, current) ->
                Optional.<Type>of(TypeHoles.named(placeholder)));
        return copy;
    }

    /** 1 + the counts of all children. Comments are not nodes here. */
    static int countNodes(Node node) {
        int count = 1;
        for (Node child : node.getChildNodes()) {
            if (child instanceof Comment) continue;
            count += countNodes(child);
        }
        return count;
    }

    static int countComments(Node tree) {
        return tree.getAllContainedComments().size() + (tree.getComment().isPresent() ? 1 : 0);
    }

    private static final class Tally {
        boolean complete = true;
        int score;
    }
}
