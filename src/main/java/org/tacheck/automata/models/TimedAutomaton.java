package org.tacheck.automata.models;

import lombok.Getter;
import org.tacheck.automata.base.Action;
import org.tacheck.automata.base.Alphabet;
import org.tacheck.automata.base.Edge;
import org.tacheck.automata.base.Location;
import org.tacheck.automata.base.SyncType;
import org.tacheck.core.Clock;
import org.tacheck.exceptions.ModelException;
import org.tacheck.expressions.dcs.ClockConstraint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * 代表一个定时 I/O 自动机组件。
 * 构造时检查所有结构引用 (位置、时钟、动作方向、唯一初始位置)，不合法时抛出 {@link ModelException}。
 * 位置的不变量存储在 {@link Location} 中。此类是不可变的。
 */
@Getter
public final class TimedAutomaton {

    private static final Logger logger = LoggerFactory.getLogger(TimedAutomaton.class);

    private final String name;
    private final List<Clock> clocks;
    private final Alphabet alphabet;
    private final List<Location> locations;
    private final Location initialLocation;
    private final List<Edge> edges;

    /** 每个时钟在守卫和不变量中出现过的最大常量的绝对值 */
    private final Map<Clock, Integer> maxConstants;

    private final Map<String, Location> locationsByName;
    private final Map<Location, List<Edge>> outgoing;

    /**
     * @param name      组件名称。
     * @param clocks    时钟列表 (声明顺序)。
     * @param alphabet  输入/输出字母表。
     * @param locations 位置列表，恰好一个初始位置。
     * @param edges     边列表 (声明顺序决定探索顺序)。
     */
    public TimedAutomaton(String name, List<Clock> clocks, Alphabet alphabet, List<Location> locations, List<Edge> edges) {
        this.name = Objects.requireNonNull(name, "Component name cannot be null.");
        this.clocks = List.copyOf(Objects.requireNonNull(clocks, "Clocks cannot be null."));
        this.alphabet = Objects.requireNonNull(alphabet, "Alphabet cannot be null.");
        this.locations = List.copyOf(Objects.requireNonNull(locations, "Locations cannot be null."));
        this.edges = List.copyOf(Objects.requireNonNull(edges, "Edges cannot be null."));

        if (name.isBlank()) {
            throw new ModelException("组件名称不能为空");
        }
        Set<String> clockNames = new HashSet<>();
        for (Clock clock : this.clocks) {
            if (!clock.getOwner().equals(name)) {
                throw new ModelException("组件 " + name + " 声明了属于 " + clock.getOwner() + " 的时钟 " + clock.getName());
            }
            if (!clockNames.add(clock.getName())) {
                throw new ModelException("组件 " + name + " 重复声明时钟 " + clock.getName());
            }
        }

        Map<String, Location> byName = new LinkedHashMap<>();
        Location initial = null;
        for (Location location : this.locations) {
            if (byName.put(location.getName(), location) != null) {
                throw new ModelException("组件 " + name + " 中位置名称重复: " + location.getName());
            }
            if (location.isInitial()) {
                if (initial != null) {
                    throw new ModelException("组件 " + name + " 有多个初始位置: " + initial.getName() + ", " + location.getName());
                }
                initial = location;
            }
            checkClocks(location.getInvariant(), "位置 " + location.getName() + " 的不变量");
        }
        if (initial == null) {
            logger.error("组件 {} 没有初始位置", name);
            throw new ModelException("组件 " + name + " 没有初始位置");
        }
        this.locationsByName = Collections.unmodifiableMap(byName);
        this.initialLocation = initial;

        Map<Location, List<Edge>> out = new HashMap<>();
        for (Location location : this.locations) {
            out.put(location, new ArrayList<>());
        }
        for (Edge edge : this.edges) {
            if (!edge.getSource().equals(byName.get(edge.getSource().getName()))) {
                throw new ModelException("边 " + edge + " 的源位置不属于组件 " + name);
            }
            if (!edge.getTarget().equals(byName.get(edge.getTarget().getName()))) {
                throw new ModelException("边 " + edge + " 的目标位置不属于组件 " + name);
            }
            checkAction(edge);
            checkClocks(edge.getGuard(), "边 " + edge + " 的守卫");
            for (Clock clock : edge.getResetSet().getResets().keySet()) {
                if (!this.clocks.contains(clock)) {
                    throw new ModelException("边 " + edge + " 重置了未声明的时钟 " + clock);
                }
            }
            out.get(byName.get(edge.getSource().getName())).add(edge);
        }
        Map<Location, List<Edge>> frozen = new HashMap<>();
        out.forEach((location, list) -> frozen.put(location, List.copyOf(list)));
        this.outgoing = Collections.unmodifiableMap(frozen);
        this.maxConstants = Collections.unmodifiableMap(computeMaxConstants());
        logger.debug("创建组件 {}: {} 个位置, {} 条边, {} 个时钟", name, this.locations.size(), this.edges.size(), this.clocks.size());
    }

    private void checkAction(Edge edge) {
        Action action = edge.getAction();
        if (action.isEpsilon()) {
            return;
        }
        if (edge.getSyncType() == SyncType.INPUT && !alphabet.isInput(action)) {
            throw new ModelException("边 " + edge + " 使用了未声明为输入的动作 " + action);
        }
        if (edge.getSyncType() == SyncType.OUTPUT && !alphabet.isOutput(action)) {
            throw new ModelException("边 " + edge + " 使用了未声明为输出的动作 " + action);
        }
    }

    private void checkClocks(List<ClockConstraint> constraints, String where) {
        for (ClockConstraint constraint : constraints) {
            for (Clock clock : List.of(constraint.getClock1(), constraint.getClock2())) {
                if (!clock.isZeroClock() && !clocks.contains(clock)) {
                    logger.error("{} 引用了未声明的时钟 {}", where, clock);
                    throw new ModelException(where + " 引用了未声明的时钟 " + clock);
                }
            }
        }
    }

    private Map<Clock, Integer> computeMaxConstants() {
        Map<Clock, Integer> max = new HashMap<>();
        for (Clock clock : clocks) {
            max.put(clock, 0);
        }
        List<ClockConstraint> all = new ArrayList<>();
        locations.forEach(location -> all.addAll(location.getInvariant()));
        edges.forEach(edge -> all.addAll(edge.getGuard()));
        for (ClockConstraint constraint : all) {
            int value = Math.abs(constraint.getBound());
            for (Clock clock : List.of(constraint.getClock1(), constraint.getClock2())) {
                if (!clock.isZeroClock()) {
                    max.merge(clock, value, Math::max);
                }
            }
        }
        for (Edge edge : edges) {
            edge.getResetSet().getResets().forEach((clock, value) -> max.merge(clock, value, Math::max));
        }
        return max;
    }

    public Location getLocation(String locationName) {
        Location location = locationsByName.get(locationName);
        if (location == null) {
            throw new ModelException("组件 " + name + " 中不存在位置 " + locationName);
        }
        return location;
    }

    public boolean hasLocation(String locationName) {
        return locationsByName.containsKey(locationName);
    }

    public Clock getClock(String clockName) {
        for (Clock clock : clocks) {
            if (clock.getName().equals(clockName)) {
                return clock;
            }
        }
        throw new ModelException("组件 " + name + " 中不存在时钟 " + clockName);
    }

    /**
     * @return 从 location 出发的所有边，保持声明顺序。
     */
    public List<Edge> getEdgesFrom(Location location) {
        return outgoing.getOrDefault(location, List.of());
    }

    public Set<Action> getInputs() {
        return alphabet.getInputs();
    }

    public Set<Action> getOutputs() {
        return alphabet.getOutputs();
    }

    /**
     * 出现在任一守卫或不变量中的时钟。不在其中的时钟对行为没有影响。
     */
    public Set<Clock> getConstrainedClocks() {
        Set<Clock> used = new HashSet<>();
        List<ClockConstraint> all = new ArrayList<>();
        locations.forEach(location -> all.addAll(location.getInvariant()));
        edges.forEach(edge -> all.addAll(edge.getGuard()));
        for (ClockConstraint constraint : all) {
            if (!constraint.getClock1().isZeroClock()) {
                used.add(constraint.getClock1());
            }
            if (!constraint.getClock2().isZeroClock()) {
                used.add(constraint.getClock2());
            }
        }
        return used;
    }

    @Override
    public String toString() {
        return "TimedAutomaton(name='" + name + "', initial=" + initialLocation.getName() + ")";
    }
}
