package org.tacheck.checkers;

import lombok.Getter;

import java.util.List;
import java.util.Objects;

/**
 * 检查器的结论：是否成立、说明，以及不成立时的见证路径 (从初始状态出发，最后一步是出错的状态)。
 * 此类是不可变的。
 */
@Getter
public final class CheckResult {

    private final boolean satisfied;
    private final String message;
    private final List<TraceStep> witness;

    private CheckResult(boolean satisfied, String message, List<TraceStep> witness) {
        this.satisfied = satisfied;
        this.message = Objects.requireNonNull(message, "Message cannot be null.");
        this.witness = List.copyOf(witness);
    }

    public static CheckResult satisfied(String message) {
        return new CheckResult(true, message, List.of());
    }

    public static CheckResult satisfied(String message, List<TraceStep> witness) {
        return new CheckResult(true, message, witness);
    }

    public static CheckResult violated(String message, List<TraceStep> witness) {
        return new CheckResult(false, message, witness);
    }

    public boolean hasWitness() {
        return !witness.isEmpty();
    }

    @Override
    public String toString() {
        return (satisfied ? "satisfied" : "violated") + ": " + message
                + (witness.isEmpty() ? "" : " " + witness);
    }
}
