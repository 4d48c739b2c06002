package org.tacheck.checkers;

import org.tacheck.automata.symbolic.StatePredicate;
import org.tacheck.automata.symbolic.SymbolicState;
import org.tacheck.automata.systems.ClockIndexTable;
import org.tacheck.automata.systems.LocationTree;
import org.tacheck.automata.systems.TransitionSystem;
import org.tacheck.exceptions.ModelException;
import org.tacheck.explorer.ExplorationLimits;
import org.tacheck.explorer.Explorer;
import org.tacheck.expressions.dcs.DBM;
import org.tacheck.expressions.dcs.Federation;
import org.tacheck.expressions.dcs.MaxBounds;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * 可达性检查：从初始状态 (或给定的起始状态) 出发广度优先探索，
 * 直到某个状态满足目标谓词。见证路径的最后一步是状态与目标谓词的交。
 */
public final class ReachabilityChecker {

    private static final Logger logger = LoggerFactory.getLogger(ReachabilityChecker.class);

    private final TransitionSystem system;
    private final ExplorationLimits limits;
    private final boolean reduceClocks;

    public ReachabilityChecker(TransitionSystem system, ExplorationLimits limits, boolean reduceClocks) {
        this.system = system;
        this.limits = limits;
        this.reduceClocks = reduceClocks;
    }

    public ReachabilityChecker(TransitionSystem system) {
        this(system, ExplorationLimits.unbounded(), true);
    }

    /**
     * @param start  起始状态谓词，null 表示使用系统的初始状态
     * @param target 目标谓词
     * @throws ModelException 谓词引用了不存在的组件或时钟，或起始谓词没有为每个组件指定位置
     */
    public CheckResult check(StatePredicate start, StatePredicate target) {
        ClockIndexTable table = system.getClockTable();
        target.validate(system);
        MaxBounds bounds = target.maxBounds(table);
        if (start != null) {
            start.validate(system);
            bounds = bounds.merge(start.maxBounds(table));
        }
        // 谓词约束了时钟时不释放无关时钟
        boolean constrainsClocks = start != null || !target.clockConstraints().isEmpty();
        Explorer explorer = new Explorer(system, limits, reduceClocks && !constrainsClocks, bounds);

        List<SymbolicState> startStates = start == null ? explorer.initialStates() : startStates(start);
        if (startStates.isEmpty()) {
            return CheckResult.violated("No start state: the start constraints or the initial invariant are unsatisfiable",
                    List.of());
        }
        Explorer.Result result = explorer.explore(startStates, (index, state) -> target.holds(state, table));
        if (!result.isTargetFound()) {
            logger.info("{} 中目标 {} 不可达, 共探索 {} 个状态", system, target, result.getExploredStates());
            return CheckResult.violated("The target state is unreachable", List.of());
        }
        List<String> clockNames = table.getClockNames();
        List<TraceStep> witness = new ArrayList<>(Traces.pathTo(result.getArena(), result.getTargetIndex(), clockNames));
        SymbolicState reached = result.getArena().get(result.getTargetIndex());
        Federation hit = target.evaluate(reached.getLocation(), table).intersect(reached.getZone());
        TraceStep last = witness.remove(witness.size() - 1);
        witness.add(TraceStep.of(last.getLocation(), hit.getZones().get(0), last.getAction(), clockNames));
        logger.info("{} 中目标 {} 可达, 路径长度 {}", system, target, witness.size());
        return CheckResult.satisfied("The target state is reachable", witness);
    }

    private List<SymbolicState> startStates(StatePredicate start) {
        LocationTree location = system.constructLocation(start.locationAssignment());
        Federation zones = start.evaluate(location, system.getClockTable());
        List<SymbolicState> states = new ArrayList<>();
        for (DBM zone : zones.getZones()) {
            DBM entered = location.applyInvariant(zone);
            if (!entered.isEmpty()) {
                states.add(new SymbolicState(location, entered));
            }
        }
        return states;
    }
}
