package org.tacheck.automata.systems;

import org.tacheck.automata.base.Action;
import org.tacheck.automata.base.Alphabet;
import org.tacheck.automata.base.Edge;
import org.tacheck.automata.base.Location;
import org.tacheck.automata.base.ResetSet;
import org.tacheck.automata.base.SyncType;
import org.tacheck.automata.models.TimedAutomaton;
import org.tacheck.core.Clock;
import org.tacheck.expressions.RelationType;
import org.tacheck.expressions.dcs.Bound;
import org.tacheck.expressions.dcs.ClockConstraint;
import org.tacheck.expressions.dcs.DBM;
import org.tacheck.expressions.dcs.Federation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * 把一个 (复合) 迁移系统展开为普通的定时 I/O 自动机组件，用于 get-components 与 prune 查询的 save-as。
 * <p>
 * 位置取离散可达的位置，位置名与时钟名由原名规范化为标识符 (例如 "A#2.x" 变为 "A_2_x")。
 * 守卫与不变量由 DBM 还原为约束的合取；被分成多块的守卫得到多条边。
 * 对剪枝后的系统，整体不一致的位置不会出现在结果中。
 */
public final class ComponentExtractor {

    private static final Logger logger = LoggerFactory.getLogger(ComponentExtractor.class);

    private final TransitionSystem system;
    private final String name;
    private final List<Clock> clocks;

    private ComponentExtractor(TransitionSystem system, String name) {
        this.system = system;
        this.name = name;
        this.clocks = new ArrayList<>();
        Set<String> used = new HashSet<>();
        for (String clockName : system.getClockTable().getClockNames()) {
            clocks.add(Clock.of(name, unique(sanitize(clockName), used)));
        }
    }

    /**
     * @param name 新组件的名称
     */
    public static TimedAutomaton extract(TransitionSystem system, String name) {
        Objects.requireNonNull(system, "System cannot be null.");
        Objects.requireNonNull(name, "Name cannot be null.");
        return new ComponentExtractor(system, name).build();
    }

    private TimedAutomaton build() {
        int dimension = system.getDimension();
        LocationTree initial = system.getInitialLocation();
        Map<LocationTree, Location> locations = new LinkedHashMap<>();
        Set<String> usedNames = new HashSet<>();
        for (LocationTree tree : system.getAllLocations()) {
            if (!tree.equals(initial) && isWhollyInconsistent(tree)) {
                continue;
            }
            List<ClockConstraint> invariant = tree.hasInvariant()
                    ? toConstraints(tree.getInvariant())
                    : List.of();
            Location location = Location.of(unique(sanitize(tree.getId()), usedNames), invariant,
                    tree.equals(initial), tree.isUrgent());
            locations.put(tree, location);
        }

        List<Edge> edges = new ArrayList<>();
        for (Map.Entry<LocationTree, Location> entry : locations.entrySet()) {
            for (Action action : system.getActionsWithSilent()) {
                for (Transition transition : system.nextTransitions(entry.getKey(), action)) {
                    Location target = locations.get(transition.getTarget());
                    if (target == null || transition.getGuard().isEmpty()) {
                        continue;
                    }
                    SyncType type = system.isInput(action) ? SyncType.INPUT : SyncType.OUTPUT;
                    edges.add(new Edge(entry.getValue(), target, action, type,
                            toConstraints(transition.getGuard()), toResets(transition.getUpdates())));
                }
            }
        }
        Alphabet alphabet = Alphabet.of(system.getInputActions(), system.getOutputActions());
        TimedAutomaton automaton = new TimedAutomaton(name, clocks, alphabet, new ArrayList<>(locations.values()), edges);
        logger.debug("从 {} 提取组件 {}: {} 个位置, {} 条边 (维度 {})", system, name,
                locations.size(), edges.size(), dimension);
        return automaton;
    }

    private boolean isWhollyInconsistent(LocationTree tree) {
        if (!(system instanceof Pruned)) {
            return false;
        }
        Federation bad = ((Pruned) system).getBadStates(tree);
        return !bad.isEmpty() && Federation.of(tree.getInvariantOrUniverse(system.getDimension())).isSubsetOf(bad);
    }

    /**
     * DBM 还原为约束的合取：单时钟的上下界，以及不能由上下界推出的差分约束。空列表表示 true。
     */
    List<ClockConstraint> toConstraints(DBM zone) {
        List<ClockConstraint> constraints = new ArrayList<>();
        int dimension = zone.getDimension();
        for (int i = 1; i < dimension; i++) {
            Clock clock = clocks.get(i - 1);
            int upper = zone.get(i, 0);
            int lower = zone.get(0, i);
            if (upper != Bound.INFINITY && !Bound.isStrict(upper) && !Bound.isStrict(lower)
                    && Bound.value(upper) == -Bound.value(lower)) {
                constraints.add(ClockConstraint.equalTo(clock, Bound.value(upper)));
                continue;
            }
            if (lower != Bound.LE_ZERO) {
                constraints.add(ClockConstraint.of(clock, Bound.isStrict(lower) ? RelationType.GT : RelationType.GE,
                        -Bound.value(lower)));
            }
            if (upper != Bound.INFINITY) {
                constraints.add(ClockConstraint.of(clock, Bound.isStrict(upper) ? RelationType.LT : RelationType.LE,
                        Bound.value(upper)));
            }
        }
        for (int i = 1; i < dimension; i++) {
            for (int j = 1; j < dimension; j++) {
                int raw = zone.get(i, j);
                if (i == j || raw == Bound.INFINITY || raw == Bound.add(zone.get(i, 0), zone.get(0, j))) {
                    continue;
                }
                constraints.add(ClockConstraint.of(clocks.get(i - 1), clocks.get(j - 1),
                        Bound.isStrict(raw) ? RelationType.LT : RelationType.LE, Bound.value(raw)));
            }
        }
        return constraints;
    }

    private ResetSet toResets(List<Update> updates) {
        if (updates.isEmpty()) {
            return ResetSet.EMPTY;
        }
        Map<Clock, Integer> resets = new LinkedHashMap<>();
        for (Update update : updates) {
            resets.put(clocks.get(update.getClockIndex() - 1), update.getValue());
        }
        return new ResetSet(resets);
    }

    /**
     * 非标识符字符替换为下划线，并去掉首尾多余的下划线。
     */
    static String sanitize(String raw) {
        String replaced = raw.replaceAll("[^A-Za-z0-9_]+", "_").replaceAll("^_+|_+$", "");
        if (replaced.isEmpty()) {
            return "L";
        }
        return Character.isDigit(replaced.charAt(0)) ? "_" + replaced : replaced;
    }

    private static String unique(String candidate, Set<String> used) {
        String result = candidate;
        int suffix = 2;
        while (!used.add(result)) {
            result = candidate + "_" + suffix++;
        }
        return result;
    }
}
