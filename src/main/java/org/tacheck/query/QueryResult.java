package org.tacheck.query;

import lombok.AccessLevel;
import lombok.Getter;
import org.tacheck.automata.models.TimedAutomaton;
import org.tacheck.checkers.CheckResult;
import org.tacheck.checkers.TraceStep;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * 一个查询的结果：状态、说明文字、见证路径，以及 get-components / prune 查询产生的组件。
 * 此类是不可变的。
 */
@Getter
public final class QueryResult {

    public enum Status {
        /** 性质成立 */
        SUCCESS,
        /** 性质不成立，通常带有见证 */
        FAILURE,
        /** 达到状态数或时间上限，没有结论 */
        INCONCLUSIVE,
        /** 查询无法解析或引用的模型不合法，没有被求值 */
        REJECTED
    }

    private final String query;
    private final Status status;
    private final String diagnostics;
    private final List<TraceStep> witness;
    @Getter(AccessLevel.NONE)
    private final TimedAutomaton component;

    private QueryResult(String query, Status status, String diagnostics, List<TraceStep> witness,
                        TimedAutomaton component) {
        this.query = query;
        this.status = Objects.requireNonNull(status, "Status cannot be null.");
        this.diagnostics = Objects.requireNonNull(diagnostics, "Diagnostics cannot be null.");
        this.witness = List.copyOf(witness);
        this.component = component;
    }

    public static QueryResult of(String query, CheckResult result) {
        return new QueryResult(query, result.isSatisfied() ? Status.SUCCESS : Status.FAILURE,
                result.getMessage(), result.getWitness(), null);
    }

    public static QueryResult success(String query, String diagnostics, TimedAutomaton component) {
        return new QueryResult(query, Status.SUCCESS, diagnostics, List.of(), component);
    }

    public static QueryResult failure(String query, String diagnostics, List<TraceStep> witness) {
        return new QueryResult(query, Status.FAILURE, diagnostics, witness, null);
    }

    public static QueryResult inconclusive(String query, String diagnostics) {
        return new QueryResult(query, Status.INCONCLUSIVE, diagnostics, List.of(), null);
    }

    public static QueryResult rejected(String query, String diagnostics) {
        return new QueryResult(query, Status.REJECTED, diagnostics, List.of(), null);
    }

    public QueryResult withWitness(List<TraceStep> newWitness) {
        return new QueryResult(query, status, diagnostics, newWitness, component);
    }

    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }

    public boolean hasWitness() {
        return !witness.isEmpty();
    }

    public Optional<TimedAutomaton> getSavedComponent() {
        return Optional.ofNullable(component);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(query == null ? "<query>" : query).append(" -> ").append(status).append(": ").append(diagnostics);
        for (TraceStep step : witness) {
            sb.append(System.lineSeparator()).append("    ").append(step);
        }
        return sb.toString();
    }
}
