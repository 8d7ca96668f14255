package de.upb.sse.typefill.api;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

public final class PublicApi {

    private PublicApi() {
    }

    public enum CheckProblem {
        /** An annotation is still missing or holds the hole marker. */
        NOT_COMPLETE,
        /** Complete, but code other than types was added, removed or restructured. */
        CHANGED_CODE,
        /** The number of comments differs from the original. */
        CHANGED_COMMENTS
    }

    public static final class VerificationResult {
        public final boolean complete;

        /** Sum of weak-type weights. Higher means lazier annotations. */
        public final int score;

        public VerificationResult(boolean complete, int score) {
            this.complete = complete;
            this.score = score;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            VerificationResult that = (VerificationResult) o;
            return complete == that.complete && score == that.score;
        }

        @Override
        public int hashCode() {
            return Objects.hash(complete, score);
        }

        @Override
        public String toString() {
            return "(" + complete + ", " + score + ")";
        }
    }

    public static final class CheckResult {
        public final Set<CheckProblem> problems;
        public final int score;

        public CheckResult(Set<CheckProblem> problems, int score) {
            Objects.requireNonNull(problems, "problems");
            EnumSet<CheckProblem> copy = EnumSet.noneOf(CheckProblem.class);
            copy.addAll(problems);
            this.problems = Collections.unmodifiableSet(copy);
            this.score = score;
        }

        /** True iff there is nothing to complain about. */
        public boolean accepted() {
            return problems.isEmpty();
        }

        public boolean has(CheckProblem problem) {
            return problems.contains(problem);
        }

        @Override
        public String toString() {
            return "CheckResult{problems=" + problems + ", score=" + score + '}';
        }
    }
}
