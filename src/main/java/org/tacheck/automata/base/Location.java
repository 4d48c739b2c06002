package org.tacheck.automata.base;

import lombok.Getter;
import org.tacheck.expressions.dcs.ClockConstraint;

import java.util.List;
import java.util.Objects;

/**
 * 代表定时自动机中的一个位置。
 * 位置在所属组件内由名称唯一确定，不变量是时钟约束的合取 (空列表表示 true)。
 * 紧急 (urgent) 位置不允许时间流逝。
 * Location 是不可变对象。
 */
@Getter
public final class Location implements Comparable<Location> {

    private final String name;
    private final List<ClockConstraint> invariant;
    private final boolean initial;
    private final boolean urgent;

    private final int hashCode;

    private Location(String name, List<ClockConstraint> invariant, boolean initial, boolean urgent) {
        this.name = Objects.requireNonNull(name, "Location name cannot be null");
        this.invariant = List.copyOf(Objects.requireNonNull(invariant, "Invariant cannot be null"));
        this.initial = initial;
        this.urgent = urgent;
        this.hashCode = Objects.hash(name, this.invariant, initial, urgent);
    }

    public static Location of(String name, List<ClockConstraint> invariant, boolean initial, boolean urgent) {
        return new Location(name, invariant, initial, urgent);
    }

    public static Location of(String name, List<ClockConstraint> invariant, boolean initial) {
        return new Location(name, invariant, initial, false);
    }

    /**
     * 没有不变量、非初始、非紧急的位置。
     */
    public static Location of(String name) {
        return new Location(name, List.of(), false, false);
    }

    public boolean hasInvariant() {
        return !invariant.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Location location = (Location) o;
        return initial == location.initial
                && urgent == location.urgent
                && name.equals(location.name)
                && invariant.equals(location.invariant);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        return name;
    }

    @Override
    public int compareTo(Location other) {
        return this.name.compareTo(other.name);
    }
}
