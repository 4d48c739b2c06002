package org.tacheck.checkers;

import org.apache.commons.lang3.tuple.Pair;
import org.tacheck.automata.base.Action;
import org.tacheck.automata.symbolic.StatePair;
import org.tacheck.automata.systems.LocationTree;
import org.tacheck.automata.systems.Transition;
import org.tacheck.automata.systems.TransitionSystem;
import org.tacheck.exceptions.ModelException;
import org.tacheck.explorer.ExplorationLimits;
import org.tacheck.explorer.PassedWaitingList;
import org.tacheck.explorer.StateArena;
import org.tacheck.expressions.dcs.DBM;
import org.tacheck.expressions.dcs.Federation;
import org.tacheck.expressions.dcs.MaxBounds;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * 精化检查 A <= B (A 为实现，B 为规约)，基于交替模拟。
 * <p>
 * 从状态对出发：
 * <ul>
 *     <li>A 的每个输出 (以及静默迁移) 都必须能被 B 以同名输出匹配；</li>
 *     <li>B 的每个输入都必须能被 A 以同名输入匹配；</li>
 *     <li>A 在自身不变量内能做的延迟，B 的不变量也必须允许。</li>
 * </ul>
 * 匹配要求一侧可用守卫的并集包含于另一侧可用守卫的并集 (均与当前区域相交后比较)。
 * 博弈以状态对上的可达性实现，沿用探索器的已访问/待访问集合与包含检查。
 * <p>
 * 前置条件：两侧都一致且确定，I_B ⊆ I_A，O_A ⊆ O_B，I_A ∩ O_B = I_B ∩ O_A = ∅，B 没有静默迁移。
 */
public final class RefinementChecker {

    private static final Logger logger = LoggerFactory.getLogger(RefinementChecker.class);

    private final TransitionSystem left;
    private final TransitionSystem right;
    private final ExplorationLimits limits;
    private final boolean reduceClocks;
    private final List<String> clockNames;

    /**
     * @param left  实现 A
     * @param right 规约 B；必须与 A 共用同一张时钟下标表
     */
    public RefinementChecker(TransitionSystem left, TransitionSystem right, ExplorationLimits limits, boolean reduceClocks) {
        this.left = Objects.requireNonNull(left, "Left system cannot be null.");
        this.right = Objects.requireNonNull(right, "Right system cannot be null.");
        this.limits = Objects.requireNonNull(limits, "Limits cannot be null.");
        this.reduceClocks = reduceClocks;
        if (left.getClockTable() != right.getClockTable()) {
            throw new IllegalArgumentException("精化检查的两侧系统必须共用同一张时钟下标表");
        }
        this.clockNames = left.getClockTable().getClockNames();
    }

    public RefinementChecker(TransitionSystem left, TransitionSystem right) {
        this(left, right, ExplorationLimits.unbounded(), true);
    }

    public CheckResult check() {
        CheckResult precondition = checkPreconditions();
        if (precondition != null) {
            return precondition;
        }
        return play();
    }

    /**
     * @return 前置条件不满足时的结论，满足时返回 null
     * @throws ModelException B 含有静默迁移
     */
    private CheckResult checkPreconditions() {
        if (right.hasSilentTransitions()) {
            throw new ModelException("精化检查的规约一侧不能有静默迁移: " + right.getComponentNames());
        }
        List<String> problems = new ArrayList<>();
        SortedSet<Action> missingInputs = new TreeSet<>(right.getInputActions());
        missingInputs.removeAll(left.getInputActions());
        if (!missingInputs.isEmpty()) {
            problems.add("inputs " + missingInputs + " of the right side are not inputs of the left side");
        }
        SortedSet<Action> extraOutputs = new TreeSet<>(left.getOutputActions());
        extraOutputs.removeAll(right.getOutputActions());
        if (!extraOutputs.isEmpty()) {
            problems.add("outputs " + extraOutputs + " of the left side are not outputs of the right side");
        }
        for (Pair<TransitionSystem, TransitionSystem> sides : List.of(Pair.of(left, right), Pair.of(right, left))) {
            SortedSet<Action> clash = new TreeSet<>(sides.getLeft().getInputActions());
            clash.retainAll(sides.getRight().getOutputActions());
            if (!clash.isEmpty()) {
                problems.add("actions " + clash + " are inputs on one side and outputs on the other");
            }
        }
        if (!problems.isEmpty()) {
            return CheckResult.violated("Alphabets are not compatible: " + String.join("; ", problems), List.of());
        }

        for (Pair<String, TransitionSystem> side : List.of(Pair.of("left", left), Pair.of("right", right))) {
            CheckResult consistency = new ConsistencyChecker(side.getRight(), limits, reduceClocks).check();
            if (!consistency.isSatisfied()) {
                return CheckResult.violated("The " + side.getLeft() + " side is not consistent: "
                        + consistency.getMessage(), consistency.getWitness());
            }
            CheckResult determinism = new DeterminismChecker(side.getRight(), limits, reduceClocks).check();
            if (!determinism.isSatisfied()) {
                return CheckResult.violated("The " + side.getLeft() + " side is not deterministic: "
                        + determinism.getMessage(), determinism.getWitness());
            }
        }
        return null;
    }

    private CheckResult play() {
        int dimension = left.getDimension();
        StateArena<StatePair> arena = new StateArena<>();
        PassedWaitingList<String> list = new PassedWaitingList<>();

        LocationTree l0 = left.getInitialLocation();
        LocationTree r0 = right.getInitialLocation();
        DBM zero = DBM.zero(dimension);
        DBM initial = r0.applyInvariant(l0.applyInvariant(zero));
        if (initial.isEmpty()) {
            return CheckResult.violated("The initial state of the left side is not allowed by the right side",
                    List.of(TraceStep.of(pairId(l0, r0), l0.applyInvariant(zero), null, clockNames)));
        }
        StatePair start = afterDelay(l0, r0, initial);
        if (start == null) {
            return CheckResult.violated("The right side does not allow the delays of the left side in the initial state",
                    List.of(TraceStep.of(pairId(l0, r0), l0.applyInvariant(zero.up()), null, clockNames)));
        }
        int startIndex = arena.add(start, StateArena.NO_PARENT, null);
        list.add(start.getLocationKey(), start.getZone(), startIndex);

        int explored = 0;
        while (list.hasWaiting()) {
            int index = list.next();
            limits.check(++explored);
            StatePair current = arena.get(index);

            List<Action> leftMoves = new ArrayList<>();
            leftMoves.add(Action.EPSILON);
            leftMoves.addAll(left.getOutputActions());
            for (Action action : leftMoves) {
                List<Transition> leftTransitions = left.nextTransitions(current.getLeft(), action);
                List<Transition> rightTransitions = action.isEpsilon()
                        ? List.of()
                        : right.nextTransitions(current.getRight(), action);
                CheckResult failure = match(arena, index, current, action, leftTransitions, rightTransitions,
                        action.isEpsilon(), true);
                if (failure != null) {
                    return failure;
                }
                if (!expand(arena, list, index, current, action, leftTransitions, rightTransitions)) {
                    return delayFailure(arena, action);
                }
            }
            for (Action action : right.getInputActions()) {
                List<Transition> leftTransitions = left.nextTransitions(current.getLeft(), action);
                List<Transition> rightTransitions = right.nextTransitions(current.getRight(), action);
                CheckResult failure = match(arena, index, current, action, rightTransitions, leftTransitions,
                        false, false);
                if (failure != null) {
                    return failure;
                }
                if (!expand(arena, list, index, current, action, leftTransitions, rightTransitions)) {
                    return delayFailure(arena, action);
                }
            }
        }
        list.logStatistics("精化检查");
        logger.info("{} 精化 {}: 共 {} 个状态对", left, right, arena.size());
        return CheckResult.satisfied("The left side refines the right side");
    }

    /**
     * 检查 moving 一侧在当前区域内可用的部分是否都能被 matching 一侧匹配。
     *
     * @param stays        moving 一侧的迁移不需要匹配 (A 的静默迁移)
     * @param movingIsLeft moving 一侧是否为 A，仅用于诊断信息
     * @return 匹配失败时的结论，否则为 null
     */
    private CheckResult match(StateArena<StatePair> arena, int index, StatePair current, Action action,
                              List<Transition> moving, List<Transition> matching, boolean stays, boolean movingIsLeft) {
        if (stays || moving.isEmpty()) {
            return null;
        }
        Federation required = allowed(moving, current.getZone());
        if (required.isEmpty()) {
            return null;
        }
        Federation offered = allowed(matching, current.getZone());
        Federation unmatched = required.subtract(offered);
        if (unmatched.isEmpty()) {
            return null;
        }
        List<TraceStep> witness = pathTo(arena, index);
        StatePair pair = arena.get(index);
        witness.add(TraceStep.of(pairId(pair.getLeft(), pair.getRight()), unmatched.getZones().get(0), action, clockNames));
        String mover = movingIsLeft ? "left" : "right";
        String matcher = movingIsLeft ? "right" : "left";
        logger.info("精化失败: {} 一侧的 {} 不能被匹配, 状态对 {}", mover, action, pair.getLocationKey());
        return CheckResult.violated("The " + mover + " side can " + (movingIsLeft ? "output " : "accept input ")
                + action + " where the " + matcher + " side cannot: "
                + unmatched.toConstraintString(clockNames), witness);
    }

    private static Federation allowed(List<Transition> transitions, DBM zone) {
        Federation result = Federation.empty(zone.getDimension());
        for (Transition transition : transitions) {
            result = result.union(transition.allowedGuard().intersect(zone));
        }
        return result;
    }

    /**
     * 为所有匹配的迁移组合构造后继状态对。
     * @return 某个后继中 A 的延迟不被 B 允许时返回 false
     */
    private boolean expand(StateArena<StatePair> arena, PassedWaitingList<String> list, int index, StatePair current,
                           Action action, List<Transition> leftTransitions, List<Transition> rightTransitions) {
        for (Transition lt : leftTransitions) {
            if (action.isEpsilon()) {
                if (!addSuccessor(arena, list, index, current, action, lt, null)) {
                    return false;
                }
                continue;
            }
            for (Transition rt : rightTransitions) {
                if (!addSuccessor(arena, list, index, current, action, lt, rt)) {
                    return false;
                }
            }
        }
        return true;
    }

    /**
     * 依次执行：两侧守卫、两侧更新、时间流逝、A 的不变量 (记为 s_inv)、B 的不变量，
     * 然后检查 s_inv 包含于结果的时间前驱中，最后外推并与已访问集合比较。
     *
     * @param rt B 一侧的迁移；为 null 表示 B 停在原位置
     */
    private boolean addSuccessor(StateArena<StatePair> arena, PassedWaitingList<String> list, int index,
                                 StatePair current, Action action, Transition lt, Transition rt) {
        DBM zone = current.getZone().intersect(lt.getGuard());
        if (rt != null) {
            zone = zone.intersect(rt.getGuard());
        }
        if (zone.isEmpty()) {
            return true;
        }
        zone = lt.fire(zone);
        if (rt != null) {
            zone = rt.fire(zone);
        }
        LocationTree nextLeft = lt.getTarget();
        LocationTree nextRight = rt == null ? current.getRight() : rt.getTarget();
        // 延迟只能从满足目标不变式的进入点开始
        DBM leftEntered = nextLeft.applyInvariant(zone);
        DBM entered = nextRight.applyInvariant(leftEntered);
        if (entered.isEmpty()) {
            return true;
        }
        StatePair next = afterDelay(nextLeft, nextRight, leftEntered);
        if (next == null) {
            arena.add(new StatePair(nextLeft, nextRight, leftEntered), index, action);
            return false;
        }
        MaxBounds bounds = left.getLocalMaxBounds(nextLeft).merge(right.getLocalMaxBounds(nextRight));
        next = next.extrapolate(bounds);
        if (list.isSubsumed(next.getLocationKey(), next.getZone())) {
            return true;
        }
        int nextIndex = arena.add(next, index, action);
        list.add(next.getLocationKey(), next.getZone(), nextIndex);
        return true;
    }

    /**
     * 时间流逝后分别与 A、B 的不变量相交。
     * @return A 能延迟到的状态都在结果的时间前驱中时返回状态对，否则返回 null
     */
    private static StatePair afterDelay(LocationTree l, LocationTree r, DBM zone) {
        DBM delayed = l.isUrgent() || r.isUrgent() ? zone : zone.up();
        DBM leftInvariant = l.applyInvariant(delayed);
        DBM both = r.applyInvariant(leftInvariant);
        if (!leftInvariant.isSubsetOf(both.down())) {
            return null;
        }
        return new StatePair(l, r, both);
    }

    private CheckResult delayFailure(StateArena<StatePair> arena, Action action) {
        int failingIndex = arena.size() - 1;
        StatePair pair = arena.get(failingIndex);
        logger.info("精化失败: {} 之后 A 的延迟不被 B 允许, 状态对 {}", action, pair.getLocationKey());
        return CheckResult.violated("After " + action + " the left side can delay longer than the right side allows at "
                + pair.getLocationKey(), pathTo(arena, failingIndex));
    }

    private List<TraceStep> pathTo(StateArena<StatePair> arena, int index) {
        List<TraceStep> steps = new ArrayList<>();
        for (int i : arena.pathTo(index)) {
            StatePair pair = arena.get(i);
            steps.add(TraceStep.of(pairId(pair.getLeft(), pair.getRight()), pair.getZone(), arena.getAction(i), clockNames));
        }
        return steps;
    }

    private static String pairId(LocationTree l, LocationTree r) {
        return l.getId() + " <= " + r.getId();
    }
}
