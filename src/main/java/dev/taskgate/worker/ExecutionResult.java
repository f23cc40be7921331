package dev.taskgate.worker;

import java.math.BigDecimal;

/**
 * What the execution engine reports back for one run.
 *
 * @param output   result text on success, or the question to ask when input is needed
 * @param error    failure description, null unless {@code outcome == FAILED}
 */
public record ExecutionResult(Outcome outcome, String output, String error, long tokensUsed, BigDecimal costUsd) {

    public enum Outcome { COMPLETED, FAILED, NEEDS_INPUT }

    public ExecutionResult {
        if (outcome == null) throw new IllegalArgumentException("outcome required");
        if (costUsd == null) costUsd = BigDecimal.ZERO;
    }

    public static ExecutionResult completed(String output, long tokensUsed, BigDecimal costUsd) {
        return new ExecutionResult(Outcome.COMPLETED, output, null, tokensUsed, costUsd);
    }

    public static ExecutionResult failed(String error, long tokensUsed, BigDecimal costUsd) {
        return new ExecutionResult(Outcome.FAILED, null, error, tokensUsed, costUsd);
    }

    public static ExecutionResult needsInput(String question) {
        return new ExecutionResult(Outcome.NEEDS_INPUT, question, null, 0L, BigDecimal.ZERO);
    }
}
