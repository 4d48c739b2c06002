package org.tacheck.automata.systems;

import lombok.Getter;
import org.tacheck.automata.base.Action;
import org.tacheck.automata.base.Edge;
import org.tacheck.exceptions.ModelException;
import org.tacheck.expressions.dcs.Bound;
import org.tacheck.expressions.dcs.DBM;
import org.tacheck.expressions.dcs.Federation;
import org.tacheck.expressions.dcs.MaxBounds;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * 商 (T \\ S)：满足 "S 与商并行组合后精化 T" 的最大规约。
 * <p>
 * 商在 T 与 S 的位置对之外另有两个特殊位置：universal 接受一切动作，
 * inconsistent 的不变量为 x_new <= 0，进入后时间无法流逝。x_new 是为商新分配的时钟，
 * i_new 是新增的输入动作，用于让 T 的不变量被违反的情形可以被观察到。
 * <p>
 * 要求 S 的动作都是 T 的动作，且 S 没有静默迁移。
 */
public final class Quotient extends TransitionSystem {

    private static final Logger logger = LoggerFactory.getLogger(Quotient.class);

    @Getter
    private final TransitionSystem specification;
    @Getter
    private final TransitionSystem component;
    @Getter
    private final int newClock;
    @Getter
    private final Action newInput;

    private final SortedSet<Action> inputs;
    private final SortedSet<Action> outputs;
    private final LocationTree initial;
    private final LocationTree universal;
    private final LocationTree inconsistent;

    /**
     * @param specification T
     * @param component     S
     * @param newClock      为 x_new 分配的时钟下标
     * @throws ModelException S 的动作不全是 T 的动作，或 S 有静默迁移
     */
    public Quotient(TransitionSystem specification, TransitionSystem component, int newClock) {
        super(Objects.requireNonNull(specification, "Specification cannot be null.").getClockTable());
        this.specification = specification;
        this.component = Objects.requireNonNull(component, "Component cannot be null.");
        if (specification.getClockTable() != component.getClockTable()) {
            throw new IllegalArgumentException("两侧系统必须共用同一张时钟下标表");
        }
        if (newClock <= 0 || newClock >= getDimension()) {
            throw new IllegalArgumentException("非法的时钟下标: " + newClock);
        }
        for (Action action : component.getActions()) {
            if (!specification.getActions().contains(action)) {
                throw new ModelException("商运算要求除数的动作都属于被除数, 但 " + action + " 不属于 "
                        + specification.getComponentNames());
            }
        }
        if (component.hasSilentTransitions()) {
            throw new ModelException("商运算的除数不能有静默迁移: " + component.getComponentNames());
        }
        this.newClock = newClock;
        this.newInput = freshInput(specification, component);

        SortedSet<Action> in = new TreeSet<>(specification.getInputActions());
        in.addAll(component.getOutputActions());
        in.add(newInput);
        SortedSet<Action> out = new TreeSet<>(specification.getOutputActions());
        out.removeAll(component.getOutputActions());
        this.inputs = Collections.unmodifiableSortedSet(in);
        this.outputs = Collections.unmodifiableSortedSet(out);

        this.initial = LocationTree.pair(LocationTree.Kind.QUOTIENT,
                specification.getInitialLocation(), component.getInitialLocation());
        this.universal = LocationTree.universal();
        this.inconsistent = LocationTree.inconsistent(
                DBM.universe(getDimension()).constrain(newClock, 0, Bound.LE_ZERO));
        logger.debug("构造商 {} \\\\ {}: 输入 {}, 输出 {}", specification.getComponentNames(),
                component.getComponentNames(), inputs, outputs);
    }

    private static Action freshInput(TransitionSystem t, TransitionSystem s) {
        Action candidate = Action.of("i_new");
        int suffix = 1;
        while (t.getActions().contains(candidate) || s.getActions().contains(candidate)) {
            candidate = Action.of("i_new_" + suffix++);
        }
        return candidate;
    }

    @Override
    public CompositionType getCompositionType() {
        return CompositionType.QUOTIENT;
    }

    @Override
    public SortedSet<Action> getInputActions() {
        return inputs;
    }

    @Override
    public SortedSet<Action> getOutputActions() {
        return outputs;
    }

    @Override
    public LocationTree getInitialLocation() {
        return initial;
    }

    public LocationTree getUniversalLocation() {
        return universal;
    }

    public LocationTree getInconsistentLocation() {
        return inconsistent;
    }

    @Override
    public List<Transition> nextTransitions(LocationTree location, Action action) {
        int dimension = getDimension();
        if (location.isUniversal()) {
            if (action.isEpsilon() || !getActions().contains(action)) {
                return List.of();
            }
            return List.of(new Transition(action, DBM.universe(dimension), List.of(), universal, List.of()));
        }
        if (location.isInconsistent()) {
            if (!inputs.contains(action)) {
                return List.of();
            }
            return List.of(new Transition(action, inconsistent.getInvariant(), List.of(), inconsistent, List.of()));
        }

        LocationTree t = location.getLeft();
        LocationTree s = location.getRight();
        DBM invS = s.getInvariantOrUniverse(dimension);
        List<Transition> result = new ArrayList<>();

        if (action.isEpsilon()) {
            for (Transition tt : specification.nextTransitions(t, action)) {
                addIfSatisfiable(result, new Transition(action, tt.allowedGuard().intersect(invS), tt.getUpdates(),
                        LocationTree.pair(LocationTree.Kind.QUOTIENT, tt.getTarget(), s), tt.getEdges()));
            }
            return result;
        }
        if (!getActions().contains(action)) {
            return result;
        }

        if (action.equals(newInput)) {
            Federation violated = Federation.of(t.getInvariantOrUniverse(dimension)).complement().intersect(invS);
            addSplit(result, action, violated, List.of(new Update(newClock, 0)), inconsistent);
        } else if (component.getActions().contains(action)) {
            List<Transition> sMoves = component.nextTransitions(s, action);
            List<Transition> tMoves = specification.nextTransitions(t, action);
            for (Transition tt : tMoves) {
                DBM allowed = tt.allowedGuard().intersect(invS);
                for (Transition st : sMoves) {
                    List<Update> updates = new ArrayList<>(tt.getUpdates());
                    updates.addAll(st.getUpdates());
                    List<Edge> edges = new ArrayList<>(tt.getEdges());
                    edges.addAll(st.getEdges());
                    addIfSatisfiable(result, new Transition(action, allowed.intersect(st.getGuard()), updates,
                            LocationTree.pair(LocationTree.Kind.QUOTIENT, tt.getTarget(), st.getTarget()), edges));
                }
            }
            if (component.isOutput(action)) {
                Federation sGuards = Federation.empty(dimension);
                for (Transition st : sMoves) {
                    sGuards = sGuards.union(st.getGuard());
                }
                Federation tGuards = Federation.empty(dimension);
                for (Transition tt : tMoves) {
                    tGuards = tGuards.union(tt.allowedGuard());
                }
                addSplit(result, action, sGuards.complement().intersect(invS), List.of(), universal);
                addSplit(result, action, sGuards.subtract(tGuards).intersect(invS),
                        List.of(new Update(newClock, 0)), inconsistent);
            }
        } else {
            for (Transition tt : specification.nextTransitions(t, action)) {
                addIfSatisfiable(result, new Transition(action, tt.allowedGuard().intersect(invS), tt.getUpdates(),
                        LocationTree.pair(LocationTree.Kind.QUOTIENT, tt.getTarget(), s), tt.getEdges()));
            }
        }

        if (s.hasInvariant()) {
            addSplit(result, action, Federation.of(invS).complement(), List.of(), universal);
        }
        return result;
    }

    private static void addIfSatisfiable(List<Transition> result, Transition transition) {
        if (!transition.getGuard().isEmpty()) {
            result.add(transition);
        }
    }

    private static void addSplit(List<Transition> result, Action action, Federation guard,
                                 List<Update> updates, LocationTree target) {
        for (DBM zone : guard.getZones()) {
            result.add(new Transition(action, zone, updates, target, List.of()));
        }
    }

    @Override
    public MaxBounds getMaxBounds() {
        return specification.getMaxBounds().merge(component.getMaxBounds());
    }

    @Override
    public BitSet getIrrelevantClocks() {
        BitSet irrelevant = specification.getIrrelevantClocks();
        irrelevant.or(component.getIrrelevantClocks());
        irrelevant.clear(newClock);
        return irrelevant;
    }

    @Override
    public List<String> getComponentNames() {
        List<String> names = new ArrayList<>(specification.getComponentNames());
        names.addAll(component.getComponentNames());
        return names;
    }

    @Override
    public List<TransitionSystem> getChildren() {
        return List.of(specification, component);
    }

    @Override
    public LocationTree constructLocation(Map<String, String> chosen) {
        return LocationTree.pair(LocationTree.Kind.QUOTIENT,
                specification.constructLocation(chosen), component.constructLocation(chosen));
    }

    @Override
    public boolean hasSilentTransitions() {
        return specification.hasSilentTransitions();
    }
}
