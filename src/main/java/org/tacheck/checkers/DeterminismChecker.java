package org.tacheck.checkers;

import org.tacheck.automata.base.Action;
import org.tacheck.automata.symbolic.SymbolicState;
import org.tacheck.automata.systems.Transition;
import org.tacheck.automata.systems.TransitionSystem;
import org.tacheck.explorer.ExplorationLimits;
import org.tacheck.explorer.Explorer;
import org.tacheck.expressions.dcs.DBM;
import org.tacheck.expressions.dcs.Federation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * 确定性检查：在每个可达状态上，对每个非静默动作，任意两条迁移的可用区域
 * (守卫 ∧ 目标不变量的原像 ∧ 当前区域) 不得相交。
 * 按广度优先的探索顺序报告第一个相交处。
 */
public final class DeterminismChecker {

    private static final Logger logger = LoggerFactory.getLogger(DeterminismChecker.class);

    private final TransitionSystem system;
    private final Explorer explorer;

    public DeterminismChecker(TransitionSystem system, ExplorationLimits limits, boolean reduceClocks) {
        this.system = system;
        this.explorer = new Explorer(system, limits, reduceClocks, null);
    }

    public DeterminismChecker(TransitionSystem system) {
        this(system, ExplorationLimits.unbounded(), true);
    }

    public CheckResult check() {
        List<String> clockNames = system.getClockTable().getClockNames();
        Finding[] finding = new Finding[1];
        Explorer.Result result = explorer.explore((index, state) -> {
            finding[0] = findOverlap(state);
            return finding[0] != null;
        });
        if (!result.isTargetFound()) {
            logger.debug("{} 是确定的, 共探索 {} 个状态", system, result.getExploredStates());
            return CheckResult.satisfied("The system is deterministic");
        }
        List<TraceStep> witness = new ArrayList<>(Traces.pathTo(result.getArena(), result.getTargetIndex(), clockNames));
        SymbolicState state = result.getArena().get(result.getTargetIndex());
        witness.add(TraceStep.of(state.getLocation().getId(), finding[0].overlap, finding[0].action, clockNames));
        logger.info("{} 不确定: 位置 {}, 动作 {}", system, state.getLocation(), finding[0].action);
        return CheckResult.violated("Non-deterministic choice on action " + finding[0].action + " at "
                + state.getLocation() + " where " + finding[0].overlap.toConstraintString(clockNames), witness);
    }

    private static final class Finding {
        final Action action;
        final DBM overlap;

        Finding(Action action, DBM overlap) {
            this.action = action;
            this.overlap = overlap;
        }
    }

    private Finding findOverlap(SymbolicState state) {
        for (Action action : system.getActions()) {
            Federation enabled = Federation.empty(system.getDimension());
            for (Transition transition : system.nextTransitions(state.getLocation(), action)) {
                DBM allowed = transition.allowedGuard().intersect(state.getZone());
                if (allowed.isEmpty()) {
                    continue;
                }
                for (DBM zone : enabled.getZones()) {
                    DBM overlap = zone.intersect(allowed);
                    if (!overlap.isEmpty()) {
                        return new Finding(action, overlap);
                    }
                }
                enabled = enabled.union(allowed);
            }
        }
        return null;
    }
}
