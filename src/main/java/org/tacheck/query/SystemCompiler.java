package org.tacheck.query;

import org.tacheck.automata.models.SystemModel;
import org.tacheck.automata.models.TimedAutomaton;
import org.tacheck.automata.systems.ClockIndexTable;
import org.tacheck.automata.systems.CompiledComponent;
import org.tacheck.automata.systems.Composition;
import org.tacheck.automata.systems.Conjunction;
import org.tacheck.automata.systems.Pruned;
import org.tacheck.automata.systems.Quotient;
import org.tacheck.automata.systems.TransitionSystem;
import org.tacheck.explorer.ExplorationLimits;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 把系统表达式编译为迁移系统。
 * <p>
 * 分两遍进行：第一遍按表达式的遍历顺序为每个组件出现与每个商运算分配时钟下标，
 * 得到一张所有表达式共用的时钟下标表；第二遍自底向上构造迁移系统。
 * 合取与商的结果会被剪枝，使其只保留一致的部分。
 * 每次编译得到的系统只属于当前查询。
 */
public final class SystemCompiler {

    private static final Logger logger = LoggerFactory.getLogger(SystemCompiler.class);

    private final SystemModel model;
    private final ExplorationLimits limits;
    private final ClockIndexTable.Builder builder = ClockIndexTable.builder();
    private final Map<SystemExpression, ClockIndexTable.Allocation> allocations = new IdentityHashMap<>();
    private final Map<SystemExpression, Integer> quotientClocks = new IdentityHashMap<>();
    private int quotientCount;
    private ClockIndexTable table;

    private SystemCompiler(SystemModel model, ExplorationLimits limits) {
        this.model = Objects.requireNonNull(model, "Model cannot be null.");
        this.limits = Objects.requireNonNull(limits, "Limits cannot be null.");
    }

    /**
     * 编译若干表达式，结果共用同一张时钟下标表 (精化查询的两侧需要如此)。
     * 合取与商的剪枝受 limits 约束。
     * @throws org.tacheck.exceptions.ModelException 引用了未知组件，或运算的前提不满足
     * @throws org.tacheck.exceptions.ExplorationLimitExceededException 剪枝超出探索上限
     */
    public static List<TransitionSystem> compile(SystemModel model, List<SystemExpression> expressions,
                                                 ExplorationLimits limits) {
        SystemCompiler compiler = new SystemCompiler(model, limits);
        for (SystemExpression expression : expressions) {
            compiler.allocate(expression);
        }
        compiler.table = compiler.builder.build();
        logger.debug("查询的时钟下标表: {}", compiler.table);
        List<TransitionSystem> systems = new ArrayList<>();
        for (SystemExpression expression : expressions) {
            systems.add(compiler.build(expression));
        }
        return systems;
    }

    public static List<TransitionSystem> compile(SystemModel model, List<SystemExpression> expressions) {
        return compile(model, expressions, ExplorationLimits.unbounded());
    }

    public static TransitionSystem compile(SystemModel model, SystemExpression expression) {
        return compile(model, List.of(expression)).get(0);
    }

    private void allocate(SystemExpression expression) {
        if (expression instanceof SystemExpression.Component) {
            TimedAutomaton automaton = model.getComponent(((SystemExpression.Component) expression).getName());
            allocations.put(expression, builder.allocate(automaton));
            return;
        }
        SystemExpression.Binary binary = (SystemExpression.Binary) expression;
        allocate(binary.getLeft());
        allocate(binary.getRight());
        if (binary.getOperator() == SystemExpression.Operator.QUOTIENT) {
            quotientCount++;
            String owner = quotientCount == 1 ? "quotient" : "quotient#" + quotientCount;
            quotientClocks.put(expression, builder.allocateFresh(owner, "x_new"));
        }
    }

    private TransitionSystem build(SystemExpression expression) {
        if (expression instanceof SystemExpression.Component) {
            TimedAutomaton automaton = model.getComponent(((SystemExpression.Component) expression).getName());
            return CompiledComponent.of(automaton, allocations.get(expression), table);
        }
        SystemExpression.Binary binary = (SystemExpression.Binary) expression;
        TransitionSystem left = build(binary.getLeft());
        TransitionSystem right = build(binary.getRight());
        return switch (binary.getOperator()) {
            case CONJUNCTION -> new Pruned(new Conjunction(left, right), limits);
            case COMPOSITION -> new Composition(left, right);
            case QUOTIENT -> new Pruned(new Quotient(left, right, quotientClocks.get(expression)), limits);
        };
    }
}
