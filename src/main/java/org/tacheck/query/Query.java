package org.tacheck.query;

import lombok.Getter;
import org.tacheck.automata.symbolic.StatePredicate;

import java.util.List;
import java.util.Objects;

/**
 * 解析后的查询：种类、操作数系统表达式，以及可达性查询的起始/目标谓词或保存组件的名称。
 * 此类是不可变的。
 */
@Getter
public final class Query {

    private final QueryKind kind;
    private final List<SystemExpression> systems;
    private final StatePredicate start;
    private final StatePredicate target;
    private final String saveAs;
    private final String text;

    private Query(QueryKind kind, List<SystemExpression> systems, StatePredicate start, StatePredicate target,
                  String saveAs, String text) {
        this.kind = Objects.requireNonNull(kind, "Query kind cannot be null.");
        this.systems = List.copyOf(systems);
        this.start = start;
        this.target = target;
        this.saveAs = saveAs;
        this.text = text;
    }

    public static Query refinement(SystemExpression implementation, SystemExpression specification, String text) {
        return new Query(QueryKind.REFINEMENT, List.of(implementation, specification), null, null, null, text);
    }

    public static Query consistency(SystemExpression system, String text) {
        return new Query(QueryKind.CONSISTENCY, List.of(system), null, null, null, text);
    }

    public static Query determinism(SystemExpression system, String text) {
        return new Query(QueryKind.DETERMINISM, List.of(system), null, null, null, text);
    }

    /**
     * @param start 起始状态谓词，null 表示从初始状态出发
     */
    public static Query reachability(SystemExpression system, StatePredicate start, StatePredicate target, String text) {
        Objects.requireNonNull(target, "Target cannot be null.");
        return new Query(QueryKind.REACHABILITY, List.of(system), start, target, null, text);
    }

    public static Query getComponents(SystemExpression system, String saveAs, String text) {
        return new Query(QueryKind.GET_COMPONENTS, List.of(system), null, null,
                Objects.requireNonNull(saveAs, "Name cannot be null."), text);
    }

    public static Query prune(SystemExpression system, String saveAs, String text) {
        return new Query(QueryKind.PRUNE, List.of(system), null, null,
                Objects.requireNonNull(saveAs, "Name cannot be null."), text);
    }

    @Override
    public String toString() {
        return text != null ? text : kind.getKeyword() + ": " + systems;
    }
}
