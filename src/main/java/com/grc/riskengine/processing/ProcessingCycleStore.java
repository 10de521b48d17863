package com.grc.riskengine.processing;

import com.grc.riskengine.domain.ProcessingCycleSummary;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedDeque;

/**
 * Summaries of the last N processing cycles, newest first.
 */
@Component
public class ProcessingCycleStore {

    private static final int MAX_RECENT = 100;
    private final ConcurrentLinkedDeque<ProcessingCycleSummary> recent = new ConcurrentLinkedDeque<>();

    public void add(ProcessingCycleSummary summary) {
        recent.addFirst(summary);
        while (recent.size() > MAX_RECENT) recent.removeLast();
    }

    public List<ProcessingCycleSummary> getRecent(int limit) {
        List<ProcessingCycleSummary> out = new ArrayList<>();
        for (ProcessingCycleSummary s : recent) {
            if (out.size() >= limit) break;
            out.add(s);
        }
        return out;
    }
}
