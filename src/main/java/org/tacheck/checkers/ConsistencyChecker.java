package org.tacheck.checkers;

import org.tacheck.automata.base.Action;
import org.tacheck.automata.symbolic.SymbolicState;
import org.tacheck.automata.systems.LocationTree;
import org.tacheck.automata.systems.TransitionSystem;
import org.tacheck.explorer.ExplorationLimits;
import org.tacheck.explorer.Explorer;
import org.tacheck.explorer.PassedWaitingList;
import org.tacheck.explorer.StateArena;
import org.tacheck.expressions.dcs.DBM;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 一致性检查 (最小一致性博弈)。一个状态是一致的，当且仅当：
 * <ul>
 *     <li>它不在 inconsistent 位置；</li>
 *     <li>它的所有输入后继都是一致的 (环境可以任意选择输入)；</li>
 *     <li>它可以无限延迟，或者至少有一个输出/静默后继是一致的。</li>
 * </ul>
 * 区域被某个已判定为不一致的区域包含的状态直接判定为不一致；其余已访问过 (区域被包含) 的状态视为一致。
 * 博弈用显式栈的深度优先搜索实现，不使用递归。
 */
public final class ConsistencyChecker {

    private static final Logger logger = LoggerFactory.getLogger(ConsistencyChecker.class);

    private final TransitionSystem system;
    private final Explorer explorer;
    private final ExplorationLimits limits;
    /** 每个位置上已判定为不一致的 (外推后) 区域 */
    private final Map<LocationTree, List<DBM>> inconsistentZones = new HashMap<>();

    public ConsistencyChecker(TransitionSystem system, ExplorationLimits limits, boolean reduceClocks) {
        this.system = system;
        this.limits = limits;
        this.explorer = new Explorer(system, limits, reduceClocks, null);
    }

    public ConsistencyChecker(TransitionSystem system) {
        this(system, ExplorationLimits.unbounded(), true);
    }

    /**
     * 深度优先搜索的栈帧：先逐个检查输入后继，再尝试输出与静默后继。
     */
    private static final class Frame {
        final int index;
        final SymbolicState state;
        final List<Explorer.Successor> inputs;
        List<Explorer.Successor> outputs;
        boolean inputPhase = true;
        int position;

        Frame(int index, SymbolicState state, List<Explorer.Successor> inputs) {
            this.index = index;
            this.state = state;
            this.inputs = inputs;
        }
    }

    public CheckResult check() {
        List<String> clockNames = system.getClockTable().getClockNames();
        List<SymbolicState> initialStates = explorer.initialStates();
        if (initialStates.isEmpty()) {
            LocationTree initial = system.getInitialLocation();
            DBM zero = DBM.zero(system.getDimension());
            logger.info("{} 的初始状态不一致", system);
            return CheckResult.violated("The initial state is inconsistent: its invariant does not hold",
                    List.of(TraceStep.of(initial.getId(), zero, null, clockNames)));
        }

        inconsistentZones.clear();
        StateArena<SymbolicState> arena = new StateArena<>();
        PassedWaitingList<LocationTree> passed = new PassedWaitingList<>();
        for (SymbolicState initial : initialStates) {
            int rootIndex = arena.add(initial, StateArena.NO_PARENT, null);
            int failing = search(arena, passed, rootIndex);
            if (failing >= 0) {
                String reason = arena.get(failing).getLocation().isInconsistent()
                        ? "An inconsistent state is reachable"
                        : "A timelock is reachable: time cannot pass and no output leads to a consistent state";
                logger.info("{} 不一致, 见证状态 {}", system, arena.get(failing).getLocation());
                return CheckResult.violated(reason, Traces.pathTo(arena, failing, clockNames));
            }
        }
        passed.logStatistics("一致性检查");
        return CheckResult.satisfied("The system is consistent");
    }

    /**
     * @return 不一致时返回出错状态在 arena 中的下标，一致时返回 -1
     */
    private int search(StateArena<SymbolicState> arena, PassedWaitingList<LocationTree> passed, int rootIndex) {
        Deque<Frame> stack = new ArrayDeque<>();
        Boolean returned = enter(arena, passed, stack, rootIndex);
        if (returned != null) {
            return returned ? -1 : rootIndex;
        }
        int failing = -1;

        while (!stack.isEmpty()) {
            Frame frame = stack.peek();
            if (returned != null) {
                boolean childConsistent = returned;
                returned = null;
                if (frame.inputPhase && !childConsistent) {
                    stack.pop();
                    markInconsistent(frame.state);
                    returned = false;
                    continue;
                }
                if (!frame.inputPhase && childConsistent) {
                    stack.pop();
                    returned = true;
                    continue;
                }
                frame.position++;
            }

            if (frame.inputPhase) {
                if (frame.position < frame.inputs.size()) {
                    returned = enterChild(arena, passed, stack, frame, frame.inputs.get(frame.position));
                    if (Boolean.FALSE.equals(returned)) {
                        failing = arena.size() - 1;
                    }
                    continue;
                }
                if (!frame.state.getLocation().isUrgent() && frame.state.getZone().canDelayIndefinitely()) {
                    stack.pop();
                    returned = true;
                    continue;
                }
                frame.inputPhase = false;
                frame.position = 0;
                frame.outputs = controllableSuccessors(frame.state);
            }

            if (frame.position < frame.outputs.size()) {
                returned = enterChild(arena, passed, stack, frame, frame.outputs.get(frame.position));
                continue;
            }
            // 既不能无限延迟，也没有一致的输出或静默后继
            stack.pop();
            markInconsistent(frame.state);
            returned = false;
            failing = frame.index;
        }
        return Boolean.FALSE.equals(returned) ? failing : -1;
    }

    private Boolean enterChild(StateArena<SymbolicState> arena, PassedWaitingList<LocationTree> passed,
                               Deque<Frame> stack, Frame parent, Explorer.Successor successor) {
        int child = arena.add(successor.getState(), parent.index, successor.getAction());
        return enter(arena, passed, stack, child);
    }

    /**
     * 处理一个新到达的状态。
     * @return false 表示该状态立即判定为不一致，true 表示已访问 (视为一致)，null 表示已压栈等待展开。
     * 只有仍在栈上或已判定为一致的区域才会被乐观地视为一致
     */
    private Boolean enter(StateArena<SymbolicState> arena, PassedWaitingList<LocationTree> passed,
                          Deque<Frame> stack, int index) {
        SymbolicState state = arena.get(index);
        if (state.getLocation().isInconsistent()) {
            return false;
        }
        DBM extrapolated = explorer.extrapolate(state.getLocation(), state.getZone());
        if (isKnownInconsistent(state.getLocation(), extrapolated)) {
            return false;
        }
        if (!passed.add(state.getLocation(), extrapolated, index)) {
            return true;
        }
        limits.check(arena.size());
        SymbolicState exploring = state.withZone(extrapolated);
        List<Explorer.Successor> inputs = new ArrayList<>();
        for (Action action : system.getInputActions()) {
            inputs.addAll(explorer.successors(exploring, action));
        }
        stack.push(new Frame(index, exploring, inputs));
        return null;
    }

    private void markInconsistent(SymbolicState state) {
        inconsistentZones.computeIfAbsent(state.getLocation(), key -> new ArrayList<>()).add(state.getZone());
    }

    private boolean isKnownInconsistent(LocationTree location, DBM zone) {
        List<DBM> zones = inconsistentZones.get(location);
        if (zones == null) {
            return false;
        }
        for (DBM bad : zones) {
            if (zone.isSubsetOf(bad)) {
                return true;
            }
        }
        return false;
    }

    private List<Explorer.Successor> controllableSuccessors(SymbolicState state) {
        List<Explorer.Successor> result = new ArrayList<>(explorer.successors(state, Action.EPSILON));
        for (Action action : system.getOutputActions()) {
            result.addAll(explorer.successors(state, action));
        }
        return result;
    }
}
