package org.tacheck.automata.systems;

import lombok.Getter;
import org.tacheck.automata.base.Action;
import org.tacheck.automata.base.Edge;
import org.tacheck.automata.base.Location;
import org.tacheck.automata.models.TimedAutomaton;
import org.tacheck.core.Clock;
import org.tacheck.exceptions.ModelException;
import org.tacheck.expressions.dcs.DBM;
import org.tacheck.expressions.dcs.MaxBounds;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * 单个组件 (一次出现) 编译后的迁移系统。守卫与不变量在构造时按全局时钟下标编译为 DBM，
 * 迁移按源位置和动作预先分组，保持边的声明顺序。
 */
public final class CompiledComponent extends TransitionSystem {

    private static final Logger logger = LoggerFactory.getLogger(CompiledComponent.class);

    @Getter
    private final TimedAutomaton automaton;
    @Getter
    private final String instanceName;

    private final SortedSet<Action> inputs;
    private final SortedSet<Action> outputs;
    private final Map<Location, LocationTree> trees;
    private final Map<LocationTree, Map<Action, List<Transition>>> transitions;
    private final MaxBounds maxBounds;
    private final BitSet irrelevantClocks;
    private final boolean silent;

    private CompiledComponent(TimedAutomaton automaton, ClockIndexTable.Allocation allocation, ClockIndexTable clockTable) {
        super(clockTable);
        this.automaton = automaton;
        this.instanceName = allocation.getInstanceName();
        this.inputs = Collections.unmodifiableSortedSet(new TreeSet<>(automaton.getInputs()));
        this.outputs = Collections.unmodifiableSortedSet(new TreeSet<>(automaton.getOutputs()));
        int dimension = clockTable.getDimension();

        this.trees = new LinkedHashMap<>();
        for (Location location : automaton.getLocations()) {
            DBM invariant = location.hasInvariant()
                    ? DBM.universe(dimension).constrainAll(location.getInvariant(), allocation::indexOf)
                    : null;
            trees.put(location, LocationTree.simple(instanceName, location, invariant));
        }

        this.transitions = new HashMap<>();
        boolean hasSilent = false;
        for (Edge edge : automaton.getEdges()) {
            hasSilent |= edge.isSilent();
            DBM guard = DBM.universe(dimension).constrainAll(edge.getGuard(), allocation::indexOf);
            List<Update> updates = new ArrayList<>();
            edge.getResetSet().getResets().forEach((clock, value) ->
                    updates.add(new Update(allocation.indexOf(clock), value)));
            Transition transition = new Transition(edge.getAction(), guard, updates,
                    trees.get(edge.getTarget()), List.of(edge));
            transitions.computeIfAbsent(trees.get(edge.getSource()), k -> new HashMap<>())
                    .computeIfAbsent(edge.getAction(), k -> new ArrayList<>())
                    .add(transition);
        }
        this.silent = hasSilent;

        MaxBounds bounds = MaxBounds.zeros(dimension);
        for (Map.Entry<Clock, Integer> entry : automaton.getMaxConstants().entrySet()) {
            bounds = bounds.raise(allocation.indexOf(entry.getKey()), entry.getValue());
        }
        this.maxBounds = bounds;

        this.irrelevantClocks = new BitSet(dimension);
        Set<Clock> constrained = automaton.getConstrainedClocks();
        for (Clock clock : automaton.getClocks()) {
            if (!constrained.contains(clock)) {
                irrelevantClocks.set(allocation.indexOf(clock));
            }
        }
        logger.debug("编译组件 {}: {} 个位置, {} 条边, 无关时钟 {}", instanceName,
                trees.size(), automaton.getEdges().size(), irrelevantClocks);
    }

    /**
     * @param allocation 组件这次出现在 clockTable 中分到的时钟下标
     */
    public static CompiledComponent of(TimedAutomaton automaton, ClockIndexTable.Allocation allocation,
                                       ClockIndexTable clockTable) {
        Objects.requireNonNull(automaton, "Automaton cannot be null.");
        Objects.requireNonNull(allocation, "Allocation cannot be null.");
        Objects.requireNonNull(clockTable, "Clock table cannot be null.");
        return new CompiledComponent(automaton, allocation, clockTable);
    }

    /**
     * 编译单个组件为独立的系统 (只包含该组件自己的时钟)。
     */
    public static CompiledComponent standalone(TimedAutomaton automaton) {
        ClockIndexTable.Builder builder = ClockIndexTable.builder();
        ClockIndexTable.Allocation allocation = builder.allocate(automaton);
        return new CompiledComponent(automaton, allocation, builder.build());
    }

    @Override
    public CompositionType getCompositionType() {
        return CompositionType.SIMPLE;
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
        return trees.get(automaton.getInitialLocation());
    }

    @Override
    public List<Transition> nextTransitions(LocationTree location, Action action) {
        Map<Action, List<Transition>> byAction = transitions.get(location);
        if (byAction == null) {
            return List.of();
        }
        return byAction.getOrDefault(action, List.of());
    }

    @Override
    public MaxBounds getMaxBounds() {
        return maxBounds;
    }

    @Override
    public BitSet getIrrelevantClocks() {
        return (BitSet) irrelevantClocks.clone();
    }

    @Override
    public List<String> getComponentNames() {
        return List.of(instanceName);
    }

    @Override
    public List<TransitionSystem> getChildren() {
        return List.of();
    }

    @Override
    public LocationTree constructLocation(Map<String, String> chosen) {
        String locationName = chosen.get(instanceName);
        if (locationName == null) {
            throw new ModelException("未指定组件 " + instanceName + " 的位置");
        }
        return trees.get(automaton.getLocation(locationName));
    }

    @Override
    public boolean hasSilentTransitions() {
        return silent;
    }
}
