package com.jeeves.runtime;

import com.jeeves.envelope.Envelope;
import com.jeeves.envelope.FlowInterrupt;
import com.jeeves.envelope.ProcessingRecord;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A stage's private envelope copy, plus the counters it started from, so the scheduler can merge
 * back only what the stage added. The worker never touches the run's envelope, so a stage that is
 * abandoned after its grace period cannot change the run once it has moved on.
 */
final class StageBranch {

    private final String stage;
    private final String outputKey;
    private final Envelope copy;
    private final int baseHistory;
    private final int baseErrors;
    private final int baseLlmCalls;
    private final int baseAgentHops;
    private final FlowInterrupt baseInterrupt;

    private StageBranch(String stage, String outputKey, Envelope copy) {
        this.stage = stage;
        this.outputKey = outputKey;
        this.copy = copy;
        this.baseHistory = copy.getProcessingHistory().size();
        this.baseErrors = copy.getErrors().size();
        this.baseLlmCalls = copy.getLlmCallCount();
        this.baseAgentHops = copy.getAgentHopCount();
        this.baseInterrupt = copy.getInterrupt().orElse(null);
    }

    /** Copies {@code main} for {@code stage}; the copy's current stage is the stage itself. */
    static StageBranch fork(Envelope main, String stage, String outputKey) {
        Envelope copy = main.copy();
        copy.setCurrentStage(stage);
        return new StageBranch(stage, outputKey, copy);
    }

    String stage() {
        return stage;
    }

    Envelope envelope() {
        return copy;
    }

    /** Output the stage stored, or null. */
    Map<String, Object> output() {
        return copy.getOutput(outputKey);
    }

    /**
     * Applies the branch's additions to {@code main}: its output key, new processing records, LLM
     * call and hop deltas, new errors and a newly raised interrupt. Stage-set status is left to
     * the caller.
     */
    void mergeInto(Envelope main) {
        Map<String, Object> output = copy.getOutput(outputKey);
        if (output != null) {
            main.setOutput(outputKey, output);
        }
        List<ProcessingRecord> history = copy.getProcessingHistory();
        for (ProcessingRecord r : history.subList(baseHistory, history.size())) {
            main.appendProcessingRecord(r);
        }
        main.addLlmCalls(Math.max(0, copy.getLlmCallCount() - baseLlmCalls));
        main.addAgentHops(Math.max(0, copy.getAgentHopCount() - baseAgentHops));
        List<Map<String, Object>> errors = copy.getErrors();
        for (Map<String, Object> e : errors.subList(baseErrors, errors.size())) {
            main.appendError(e);
        }
        raisedInterrupt().ifPresent(main::adoptInterrupt);
    }

    private Optional<FlowInterrupt> raisedInterrupt() {
        if (!copy.hasPendingInterrupt()) return Optional.empty();
        Optional<FlowInterrupt> current = copy.getInterrupt();
        if (current.isEmpty() || current.get().equals(baseInterrupt)) return Optional.empty();
        return current;
    }
}
