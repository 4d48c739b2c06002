package org.tacheck.explorer;

import lombok.Getter;
import org.tacheck.automata.base.Action;
import org.tacheck.automata.symbolic.SymbolicState;
import org.tacheck.automata.systems.LocationTree;
import org.tacheck.automata.systems.Transition;
import org.tacheck.automata.systems.TransitionSystem;
import org.tacheck.expressions.dcs.DBM;
import org.tacheck.expressions.dcs.MaxBounds;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;
import java.util.Objects;

/**
 * 符号化可达性探索。从初始状态出发按广度优先展开，每个后继依次经过
 * 守卫与区域相交、时钟更新、释放无关时钟、时间流逝与目标不变量、外推，
 * 然后与已访问集合比较，被包含的状态直接丢弃。
 * <p>
 * 每个 Explorer 只服务于一次探索，内部状态不在线程间共享。
 */
public final class Explorer {

    private static final Logger logger = LoggerFactory.getLogger(Explorer.class);

    /**
     * 对每个新发现 (未被包含) 的状态调用一次。看到的是外推之前的区域。
     */
    @FunctionalInterface
    public interface Visitor {
        /**
         * @return true 表示找到目标，立即停止探索
         */
        boolean visit(int index, SymbolicState state);
    }

    /**
     * 一步后继：动作、所用迁移与外推之前的目标状态。
     */
    @Getter
    public static final class Successor {
        private final Action action;
        private final Transition transition;
        private final SymbolicState state;

        Successor(Action action, Transition transition, SymbolicState state) {
            this.action = action;
            this.transition = transition;
            this.state = state;
        }
    }

    /**
     * 探索结果：状态存储、找到的目标下标 (未找到为 -1) 以及已探索状态数。
     */
    @Getter
    public static final class Result {
        private final StateArena<SymbolicState> arena;
        private final int targetIndex;
        private final int exploredStates;

        Result(StateArena<SymbolicState> arena, int targetIndex, int exploredStates) {
            this.arena = arena;
            this.targetIndex = targetIndex;
            this.exploredStates = exploredStates;
        }

        public boolean isTargetFound() {
            return targetIndex >= 0;
        }
    }

    @Getter
    private final TransitionSystem system;
    private final ExplorationLimits limits;
    private final boolean reduceClocks;
    private final BitSet irrelevantClocks;
    private final MaxBounds extraBounds;

    public Explorer(TransitionSystem system, ExplorationLimits limits, boolean reduceClocks, MaxBounds extraBounds) {
        this.system = Objects.requireNonNull(system, "System cannot be null.");
        this.limits = Objects.requireNonNull(limits, "Limits cannot be null.");
        this.reduceClocks = reduceClocks;
        this.irrelevantClocks = reduceClocks ? system.getIrrelevantClocks() : new BitSet();
        this.extraBounds = extraBounds == null ? MaxBounds.zeros(system.getDimension()) : extraBounds;
    }

    public Explorer(TransitionSystem system, ExplorationLimits limits) {
        this(system, limits, true, null);
    }

    /**
     * 初始符号化状态 (可能为空，例如初始不变量不可满足或剪枝后初始状态不一致)。
     */
    public List<SymbolicState> initialStates() {
        List<SymbolicState> states = new ArrayList<>();
        for (DBM zone : system.initialZones()) {
            states.add(new SymbolicState(system.getInitialLocation(), freeIrrelevant(zone)));
        }
        return states;
    }

    /**
     * 按确定的顺序列出 state 的所有后继：静默动作在前，其余动作按字母顺序，同一动作内按边的声明顺序。
     */
    public List<Successor> successors(SymbolicState state) {
        List<Successor> result = new ArrayList<>();
        for (Action action : system.getActionsWithSilent()) {
            result.addAll(successors(state, action));
        }
        return result;
    }

    public List<Successor> successors(SymbolicState state, Action action) {
        List<Successor> result = new ArrayList<>();
        for (Transition transition : system.nextTransitions(state.getLocation(), action)) {
            DBM fired = transition.fire(state.getZone());
            if (fired.isEmpty()) {
                continue;
            }
            fired = freeIrrelevant(fired);
            for (DBM zone : system.closeUnderDelay(transition.getTarget(), fired)) {
                result.add(new Successor(action, transition, new SymbolicState(transition.getTarget(), zone)));
            }
        }
        return result;
    }

    private DBM freeIrrelevant(DBM zone) {
        DBM result = zone;
        for (int clock = irrelevantClocks.nextSetBit(0); clock >= 0; clock = irrelevantClocks.nextSetBit(clock + 1)) {
            result = result.free(clock);
        }
        return result;
    }

    /**
     * 外推使用系统在该位置的最大常量与额外常量 (如可达性目标中出现的常量) 的较大者。
     */
    public DBM extrapolate(LocationTree location, DBM zone) {
        return zone.extrapolateMaxBounds(system.getLocalMaxBounds(location).merge(extraBounds));
    }

    /**
     * 从初始状态出发探索，直到访问者返回 true 或所有状态都已探索。
     */
    public Result explore(Visitor visitor) {
        return explore(initialStates(), visitor);
    }

    /**
     * 从给定的起始状态出发探索。
     */
    public Result explore(List<SymbolicState> startStates, Visitor visitor) {
        StateArena<SymbolicState> arena = new StateArena<>();
        List<DBM> explorationZones = new ArrayList<>();
        PassedWaitingList<LocationTree> list = new PassedWaitingList<>();
        int explored = 0;

        for (SymbolicState start : startStates) {
            int index = arena.add(start, StateArena.NO_PARENT, null);
            DBM extrapolated = extrapolate(start.getLocation(), start.getZone());
            explorationZones.add(extrapolated);
            if (visitor.visit(index, start)) {
                return new Result(arena, index, explored);
            }
            list.add(start.getLocation(), extrapolated, index);
        }

        while (list.hasWaiting()) {
            int index = list.next();
            limits.check(++explored);
            SymbolicState current = arena.get(index).withZone(explorationZones.get(index));
            for (Successor successor : successors(current)) {
                SymbolicState next = successor.getState();
                DBM extrapolated = extrapolate(next.getLocation(), next.getZone());
                if (list.isSubsumed(next.getLocation(), extrapolated)) {
                    continue;
                }
                int nextIndex = arena.add(next, index, successor.getAction());
                explorationZones.add(extrapolated);
                if (visitor.visit(nextIndex, next)) {
                    list.logStatistics("探索提前结束");
                    return new Result(arena, nextIndex, explored);
                }
                list.add(next.getLocation(), extrapolated, nextIndex);
            }
        }
        list.logStatistics("探索完成");
        logger.debug("探索 {} 结束: 共 {} 个状态", system, arena.size());
        return new Result(arena, -1, explored);
    }
}
