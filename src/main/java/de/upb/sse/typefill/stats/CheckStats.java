package de.upb.sse.typefill.stats;

import de.upb.sse.typefill.api.PublicApi.CheckProblem;
import de.upb.sse.typefill.api.PublicApi.CheckResult;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

public class CheckStats {
    private final AtomicInteger checkedCompletions = new AtomicInteger();
    private final AtomicInteger acceptedCompletions = new AtomicInteger();
    private final AtomicInteger totalScore = new AtomicInteger();
    private final AtomicInteger usageRequests = new AtomicInteger();
    private final AtomicInteger usageContexts = new AtomicInteger();
    private final Map<CheckProblem, AtomicInteger> problemCounts = new EnumMap<>(CheckProblem.class);

    public CheckStats() {
        for (CheckProblem problem : CheckProblem.values()) {
            problemCounts.put(problem, new AtomicInteger());
        }
    }

    public void record(CheckResult result) {
        checkedCompletions.incrementAndGet();
        totalScore.addAndGet(result.score);
        if (result.accepted()) {
            acceptedCompletions.incrementAndGet();
        }
        for (CheckProblem problem : result.problems) {
            problemCounts.get(problem).incrementAndGet();
        }
    }

    public void recordUsages(boolean producedContext) {
        usageRequests.incrementAndGet();
        if (producedContext) {
            usageContexts.incrementAndGet();
        }
    }

    public int getCheckedCompletions() {
        return checkedCompletions.get();
    }

    public int getAcceptedCompletions() {
        return acceptedCompletions.get();
    }

    public int getTotalScore() {
        return totalScore.get();
    }

    public int getProblemCount(CheckProblem problem) {
        return problemCounts.get(problem).get();
    }

    public int getUsageRequests() {
        return usageRequests.get();
    }

    public int getUsageContexts() {
        return usageContexts.get();
    }

    // reset between runs to avoid accumulation
    public void reset() {
        checkedCompletions.set(0);
        acceptedCompletions.set(0);
        totalScore.set(0);
        usageRequests.set(0);
        usageContexts.set(0);
        problemCounts.values().forEach(c -> c.set(0));
    }

    @Override
    public String toString() {
        return "CheckStats{checked=" + checkedCompletions + ", accepted=" + acceptedCompletions
                + ", totalScore=" + totalScore + ", problems=" + problemCounts
                + ", usageRequests=" + usageRequests + ", usageContexts=" + usageContexts + '}';
    }
}
