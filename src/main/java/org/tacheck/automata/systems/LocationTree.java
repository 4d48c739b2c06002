package org.tacheck.automata.systems;

import lombok.Getter;
import org.tacheck.automata.base.Location;
import org.tacheck.expressions.dcs.DBM;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 复合迁移系统中的一个位置：叶子是某个组件的位置，内部节点对应合取/并行/商运算的位置对，
 * 另有商运算引入的 universal 与 inconsistent 两个特殊位置。
 * 不变量在构造时就已经按全局时钟下标编译为 DBM (null 表示 true)。
 * 此类是不可变的。
 */
@Getter
public final class LocationTree {

    public enum Kind {
        SIMPLE,
        CONJUNCTION,
        COMPOSITION,
        QUOTIENT,
        UNIVERSAL,
        INCONSISTENT
    }

    private final Kind kind;
    private final String componentName;
    private final Location location;
    private final LocationTree left;
    private final LocationTree right;
    private final DBM invariant;
    private final boolean urgent;
    private final String id;

    private LocationTree(Kind kind, String componentName, Location location, LocationTree left, LocationTree right,
                         DBM invariant, boolean urgent, String id) {
        this.kind = kind;
        this.componentName = componentName;
        this.location = location;
        this.left = left;
        this.right = right;
        this.invariant = invariant;
        this.urgent = urgent;
        this.id = id;
    }

    /**
     * @param invariant 已编译的不变量，null 表示没有不变量
     */
    public static LocationTree simple(String componentName, Location location, DBM invariant) {
        Objects.requireNonNull(componentName, "Component name cannot be null.");
        Objects.requireNonNull(location, "Location cannot be null.");
        return new LocationTree(Kind.SIMPLE, componentName, location, null, null, invariant,
                location.isUrgent(), componentName + "." + location.getName());
    }

    /**
     * 位置对。合取与并行的不变量是两侧不变量的交，商运算的位置对没有不变量。
     */
    public static LocationTree pair(Kind kind, LocationTree left, LocationTree right) {
        Objects.requireNonNull(left, "Left location cannot be null.");
        Objects.requireNonNull(right, "Right location cannot be null.");
        String op;
        DBM invariant;
        switch (kind) {
            case CONJUNCTION -> {
                op = " && ";
                invariant = intersect(left.invariant, right.invariant);
            }
            case COMPOSITION -> {
                op = " // ";
                invariant = intersect(left.invariant, right.invariant);
            }
            case QUOTIENT -> {
                op = " \\\\ ";
                invariant = null;
            }
            default -> throw new IllegalArgumentException("不是位置对的种类: " + kind);
        }
        boolean urgent = kind != Kind.QUOTIENT && (left.urgent || right.urgent);
        return new LocationTree(kind, null, null, left, right, invariant, urgent,
                "(" + left.id + op + right.id + ")");
    }

    public static LocationTree universal() {
        return new LocationTree(Kind.UNIVERSAL, null, null, null, null, null, false, "universal");
    }

    /**
     * @param invariant 通常为 x_new <= 0：进入后不允许时间流逝
     */
    public static LocationTree inconsistent(DBM invariant) {
        return new LocationTree(Kind.INCONSISTENT, null, null, null, null, invariant, false, "inconsistent");
    }

    private static DBM intersect(DBM a, DBM b) {
        if (a == null) {
            return b;
        }
        if (b == null) {
            return a;
        }
        return a.intersect(b);
    }

    public boolean isUniversal() {
        return kind == Kind.UNIVERSAL;
    }

    public boolean isInconsistent() {
        return kind == Kind.INCONSISTENT;
    }

    public boolean hasInvariant() {
        return invariant != null;
    }

    /**
     * zone ∧ 不变量。
     */
    public DBM applyInvariant(DBM zone) {
        return invariant == null ? zone : zone.intersect(invariant);
    }

    /**
     * @return 不变量，没有不变量时返回全集
     */
    public DBM getInvariantOrUniverse(int dimension) {
        return invariant == null ? DBM.universe(dimension) : invariant;
    }

    /**
     * 从左到右收集所有叶子 (组件位置及特殊位置)。
     */
    public List<LocationTree> getLeaves() {
        List<LocationTree> leaves = new ArrayList<>();
        collectLeaves(leaves);
        return leaves;
    }

    private void collectLeaves(List<LocationTree> leaves) {
        if (left == null) {
            leaves.add(this);
            return;
        }
        left.collectLeaves(leaves);
        right.collectLeaves(leaves);
    }

    /**
     * 是否有叶子是组件 component 的位置 locationName。
     */
    public boolean containsLocation(String component, String locationName) {
        for (LocationTree leaf : getLeaves()) {
            if (leaf.kind == Kind.SIMPLE && leaf.componentName.equals(component)
                    && leaf.location.getName().equals(locationName)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        LocationTree that = (LocationTree) o;
        return kind == that.kind && id.equals(that.id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return id;
    }
}
