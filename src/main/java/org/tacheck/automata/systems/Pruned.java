package org.tacheck.automata.systems;

import lombok.Getter;
import org.tacheck.automata.base.Action;
import org.tacheck.expressions.dcs.DBM;
import org.tacheck.expressions.dcs.Federation;
import org.tacheck.expressions.dcs.MaxBounds;
import org.tacheck.explorer.ExplorationLimits;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.SortedSet;

/**
 * 剪枝：去掉内部系统中所有不一致的状态，得到其最大的一致子系统。
 * <p>
 * 不一致状态集合按位置记录为 {@link Federation}，由不动点迭代求得：
 * <ul>
 *     <li>inconsistent 位置整体不一致；</li>
 *     <li>某个输入能把状态带入不一致状态，则该状态不一致 (环境可以强迫)；</li>
 *     <li>时间流逝会先到达不一致状态，而途中没有能避开不一致状态的输出或静默迁移，则该状态不一致；</li>
 *     <li>时间无法继续流逝且没有可用的输出或静默迁移，则该状态不一致 (时间锁)。</li>
 * </ul>
 * 剪枝后的守卫去掉了源状态与目标状态不一致的部分，时间流逝也不会越过不一致状态。
 * 迭代中每求值一个位置计为一个探索状态，受 {@link ExplorationLimits} 约束。
 */
public final class Pruned extends TransitionSystem {

    private static final Logger logger = LoggerFactory.getLogger(Pruned.class);

    @Getter
    private final TransitionSystem inner;
    private final Map<LocationTree, Federation> bad;
    @Getter
    private final int iterations;

    /**
     * @throws org.tacheck.exceptions.ExplorationLimitExceededException 不动点迭代超出探索上限
     */
    public Pruned(TransitionSystem inner, ExplorationLimits limits) {
        super(Objects.requireNonNull(inner, "Inner system cannot be null.").getClockTable());
        Objects.requireNonNull(limits, "Limits cannot be null.");
        this.inner = inner;
        this.bad = new LinkedHashMap<>();
        this.iterations = computeBadStates(limits);
    }

    public Pruned(TransitionSystem inner) {
        this(inner, ExplorationLimits.unbounded());
    }

    private int computeBadStates(ExplorationLimits limits) {
        int dimension = getDimension();
        List<LocationTree> locations = inner.getAllLocations();
        for (LocationTree location : locations) {
            bad.put(location, location.isInconsistent()
                    ? Federation.of(location.getInvariantOrUniverse(dimension))
                    : Federation.empty(dimension));
        }
        int rounds = 0;
        int evaluated = 0;
        boolean changed = true;
        while (changed) {
            changed = false;
            rounds++;
            for (LocationTree location : locations) {
                limits.check(++evaluated);
                Federation current = bad.get(location);
                Federation updated = computeLocalBad(location, current);
                if (!updated.isSubsetOf(current)) {
                    bad.put(location, current.union(updated));
                    changed = true;
                }
            }
        }
        long badLocations = bad.values().stream().filter(f -> !f.isEmpty()).count();
        logger.debug("剪枝 {} 在 {} 轮后收敛, {} 个位置含不一致状态", inner, rounds, badLocations);
        return rounds;
    }

    private Federation computeLocalBad(LocationTree location, Federation current) {
        int dimension = getDimension();
        DBM invariant = location.getInvariantOrUniverse(dimension);

        Federation inputBad = Federation.empty(dimension);
        for (Action action : inner.getInputActions()) {
            for (Transition transition : inner.nextTransitions(location, action)) {
                inputBad = inputBad.union(transition.preImage(badOf(transition.getTarget())).intersect(invariant));
            }
        }
        Federation losing = current.union(inputBad);

        Federation good = Federation.empty(dimension);
        List<Action> controllable = new ArrayList<>();
        controllable.add(Action.EPSILON);
        controllable.addAll(inner.getOutputActions());
        for (Action action : controllable) {
            for (Transition transition : inner.nextTransitions(location, action)) {
                LocationTree target = transition.getTarget();
                Federation safeTarget = Federation.of(target.getInvariantOrUniverse(dimension)).subtract(badOf(target));
                good = good.union(transition.preImage(safeTarget).intersect(invariant));
            }
        }
        good = good.subtract(losing);

        if (location.isUrgent()) {
            Federation stuck = Federation.of(invariant).subtract(good);
            return losing.union(stuck);
        }
        Federation escape = invariant.canDelayIndefinitely() ? good.union(invariant) : good;
        Federation stuck = Federation.of(invariant).subtract(escape.down());
        return losing.union(Federation.predt(losing, good).intersect(invariant)).union(stuck);
    }

    private Federation badOf(LocationTree location) {
        Federation result = bad.get(location);
        return result == null ? Federation.empty(getDimension()) : result;
    }

    /**
     * @return location 上的不一致状态集合
     */
    public Federation getBadStates(LocationTree location) {
        return badOf(location);
    }

    /**
     * 初始状态是否一致，即剪枝后是否还有初始状态。
     */
    public boolean isInitialStateConsistent() {
        return !initialZones().isEmpty();
    }

    @Override
    public CompositionType getCompositionType() {
        return CompositionType.PRUNED;
    }

    @Override
    public SortedSet<Action> getInputActions() {
        return inner.getInputActions();
    }

    @Override
    public SortedSet<Action> getOutputActions() {
        return inner.getOutputActions();
    }

    @Override
    public LocationTree getInitialLocation() {
        return inner.getInitialLocation();
    }

    @Override
    public List<Transition> nextTransitions(LocationTree location, Action action) {
        Federation sourceBad = badOf(location);
        List<Transition> result = new ArrayList<>();
        for (Transition transition : inner.nextTransitions(location, action)) {
            Federation excluded = sourceBad.union(transition.preImage(badOf(transition.getTarget())));
            Federation allowed = Federation.of(transition.getGuard()).subtract(excluded);
            for (DBM piece : allowed.getZones()) {
                result.add(transition.withGuard(piece));
            }
        }
        return result;
    }

    /**
     * 进入位置后只保留一致状态，时间流逝在到达不一致状态之前停止。
     */
    @Override
    public List<DBM> closeUnderDelay(LocationTree location, DBM zone) {
        DBM entered = location.applyInvariant(zone);
        if (entered.isEmpty()) {
            return List.of();
        }
        Federation locationBad = badOf(location);
        Federation safe = Federation.of(entered).subtract(locationBad);
        if (location.isUrgent() || safe.isEmpty()) {
            return safe.getZones();
        }
        Federation reachable = Federation.empty(getDimension());
        for (DBM piece : safe.getZones()) {
            reachable = reachable.union(Federation.postt(piece, locationBad).intersect(
                    location.getInvariantOrUniverse(getDimension())));
        }
        return reachable.getZones();
    }

    @Override
    public MaxBounds getMaxBounds() {
        return inner.getMaxBounds();
    }

    @Override
    public BitSet getIrrelevantClocks() {
        return inner.getIrrelevantClocks();
    }

    @Override
    public List<String> getComponentNames() {
        return inner.getComponentNames();
    }

    @Override
    public List<TransitionSystem> getChildren() {
        return List.of(inner);
    }

    @Override
    public LocationTree constructLocation(Map<String, String> chosen) {
        return inner.constructLocation(chosen);
    }

    @Override
    public boolean hasSilentTransitions() {
        return inner.hasSilentTransitions();
    }

    /**
     * 含不一致状态的位置及其不一致状态集合。
     */
    public Map<LocationTree, Federation> getBadStateMap() {
        return Collections.unmodifiableMap(bad);
    }
}
