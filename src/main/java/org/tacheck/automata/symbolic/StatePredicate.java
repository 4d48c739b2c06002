package org.tacheck.automata.symbolic;

import lombok.Getter;
import org.tacheck.automata.systems.ClockIndexTable;
import org.tacheck.automata.systems.LocationTree;
import org.tacheck.automata.systems.TransitionSystem;
import org.tacheck.core.Clock;
import org.tacheck.exceptions.ModelException;
import org.tacheck.expressions.dcs.ClockConstraint;
import org.tacheck.expressions.dcs.DBM;
import org.tacheck.expressions.dcs.Federation;
import org.tacheck.expressions.dcs.MaxBounds;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 符号化状态上的谓词：位置原子 C.L、时钟约束 C.x ~ k 与 C.x - C.y ~ k，以及它们的合取与析取。
 * 对给定位置求值得到一个 {@link Federation}：位置原子为全集或空集，时钟约束为对应的区域。
 */
public abstract class StatePredicate {

    private StatePredicate() {
    }

    public static StatePredicate location(String component, String location) {
        return new LocationAtom(component, location);
    }

    public static StatePredicate clock(ClockConstraint constraint) {
        return new ClockAtom(constraint);
    }

    public static StatePredicate and(StatePredicate left, StatePredicate right) {
        return new And(left, right);
    }

    public static StatePredicate or(StatePredicate left, StatePredicate right) {
        return new Or(left, right);
    }

    public static StatePredicate always() {
        return True.INSTANCE;
    }

    /**
     * 在 location 上求值。
     * @throws ModelException 引用了系统中不存在的时钟
     */
    public abstract Federation evaluate(LocationTree location, ClockIndexTable table);

    /**
     * 谓词中出现的时钟常量，用于外推时保留判断谓词所需的精度。
     */
    public MaxBounds maxBounds(ClockIndexTable table) {
        MaxBounds bounds = MaxBounds.zeros(table.getDimension());
        for (ClockConstraint constraint : clockConstraints()) {
            for (Clock clock : List.of(constraint.getClock1(), constraint.getClock2())) {
                if (!clock.isZeroClock()) {
                    bounds = bounds.raise(indexOf(table, clock), Math.abs(constraint.getBound()));
                }
            }
        }
        return bounds;
    }

    public boolean holds(SymbolicState state, ClockIndexTable table) {
        return evaluate(state.getLocation(), table).hasIntersection(state.getZone());
    }

    /**
     * 检查谓词引用的组件与时钟都存在于 system 中。
     * @throws ModelException 引用了不存在的组件、位置或时钟
     */
    public void validate(TransitionSystem system) {
        for (LocationAtom atom : locationAtoms()) {
            if (!system.getComponentNames().contains(atom.component)) {
                throw new ModelException("谓词引用了系统中不存在的组件 " + atom.component);
            }
        }
        for (ClockConstraint constraint : clockConstraints()) {
            for (Clock clock : List.of(constraint.getClock1(), constraint.getClock2())) {
                if (!clock.isZeroClock()) {
                    indexOf(system.getClockTable(), clock);
                }
            }
        }
    }

    /**
     * 谓词中的位置原子 (按出现顺序) 组成的 组件名 -> 位置名 映射，用于构造起始状态。
     * @throws ModelException 同一组件出现了两个不同的位置
     */
    public Map<String, String> locationAssignment() {
        Map<String, String> chosen = new LinkedHashMap<>();
        for (LocationAtom atom : locationAtoms()) {
            String previous = chosen.putIfAbsent(atom.component, atom.location);
            if (previous != null && !previous.equals(atom.location)) {
                throw new ModelException("组件 " + atom.component + " 同时指定了位置 " + previous + " 与 " + atom.location);
            }
        }
        return chosen;
    }

    public List<LocationAtom> locationAtoms() {
        List<LocationAtom> atoms = new ArrayList<>();
        collect(atoms, new ArrayList<>());
        return atoms;
    }

    public List<ClockConstraint> clockConstraints() {
        List<ClockConstraint> constraints = new ArrayList<>();
        collect(new ArrayList<>(), constraints);
        return constraints;
    }

    abstract void collect(List<LocationAtom> atoms, List<ClockConstraint> constraints);

    private static int indexOf(ClockIndexTable table, Clock clock) {
        int index = table.indexOf(clock.getQualifiedName());
        if (index < 0) {
            throw new ModelException("谓词引用了系统中不存在的时钟 " + clock.getQualifiedName());
        }
        return index;
    }

    @Getter
    public static final class LocationAtom extends StatePredicate {
        private final String component;
        private final String location;

        private LocationAtom(String component, String location) {
            this.component = Objects.requireNonNull(component, "Component cannot be null.");
            this.location = Objects.requireNonNull(location, "Location cannot be null.");
        }

        @Override
        public Federation evaluate(LocationTree tree, ClockIndexTable table) {
            return tree.containsLocation(component, location)
                    ? Federation.universe(table.getDimension())
                    : Federation.empty(table.getDimension());
        }

        @Override
        void collect(List<LocationAtom> atoms, List<ClockConstraint> constraints) {
            atoms.add(this);
        }

        @Override
        public String toString() {
            return component + "." + location;
        }
    }

    @Getter
    public static final class ClockAtom extends StatePredicate {
        private final ClockConstraint constraint;

        private ClockAtom(ClockConstraint constraint) {
            this.constraint = Objects.requireNonNull(constraint, "Constraint cannot be null.");
        }

        @Override
        public Federation evaluate(LocationTree tree, ClockIndexTable table) {
            DBM zone = DBM.universe(table.getDimension()).constrain(constraint, clock -> indexOf(table, clock));
            return Federation.of(zone);
        }

        @Override
        void collect(List<LocationAtom> atoms, List<ClockConstraint> constraints) {
            constraints.add(constraint);
        }

        @Override
        public String toString() {
            return constraint.toString();
        }
    }

    private static final class And extends StatePredicate {
        private final StatePredicate left;
        private final StatePredicate right;

        private And(StatePredicate left, StatePredicate right) {
            this.left = Objects.requireNonNull(left, "Left cannot be null.");
            this.right = Objects.requireNonNull(right, "Right cannot be null.");
        }

        @Override
        public Federation evaluate(LocationTree tree, ClockIndexTable table) {
            Federation l = left.evaluate(tree, table);
            return l.isEmpty() ? l : l.intersect(right.evaluate(tree, table));
        }

        @Override
        void collect(List<LocationAtom> atoms, List<ClockConstraint> constraints) {
            left.collect(atoms, constraints);
            right.collect(atoms, constraints);
        }

        @Override
        public String toString() {
            return "(" + left + " && " + right + ")";
        }
    }

    private static final class Or extends StatePredicate {
        private final StatePredicate left;
        private final StatePredicate right;

        private Or(StatePredicate left, StatePredicate right) {
            this.left = Objects.requireNonNull(left, "Left cannot be null.");
            this.right = Objects.requireNonNull(right, "Right cannot be null.");
        }

        @Override
        public Federation evaluate(LocationTree tree, ClockIndexTable table) {
            return left.evaluate(tree, table).union(right.evaluate(tree, table));
        }

        @Override
        void collect(List<LocationAtom> atoms, List<ClockConstraint> constraints) {
            left.collect(atoms, constraints);
            right.collect(atoms, constraints);
        }

        @Override
        public String toString() {
            return "(" + left + " || " + right + ")";
        }
    }

    private static final class True extends StatePredicate {
        private static final True INSTANCE = new True();

        @Override
        public Federation evaluate(LocationTree tree, ClockIndexTable table) {
            return Federation.universe(table.getDimension());
        }

        @Override
        void collect(List<LocationAtom> atoms, List<ClockConstraint> constraints) {
        }

        @Override
        public String toString() {
            return "true";
        }
    }
}
