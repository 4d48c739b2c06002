package org.tacheck.automata.symbolic;

import lombok.Getter;
import org.tacheck.automata.systems.LocationTree;
import org.tacheck.expressions.dcs.DBM;
import org.tacheck.expressions.dcs.MaxBounds;

import java.util.Objects;

/**
 * 精化检查中的状态对：实现一侧与规约一侧各自的位置，加上两侧时钟共用的一个区域。
 * 两侧的时钟在同一张下标表中分配，因此一个区域即可同时描述两侧。
 * 此类是不可变的。
 */
@Getter
public final class StatePair {

    private final LocationTree left;
    private final LocationTree right;
    private final DBM zone;

    private final int hashCode;

    public StatePair(LocationTree left, LocationTree right, DBM zone) {
        this.left = Objects.requireNonNull(left, "Left location cannot be null.");
        this.right = Objects.requireNonNull(right, "Right location cannot be null.");
        this.zone = Objects.requireNonNull(zone, "Zone cannot be null.");
        this.hashCode = Objects.hash(left, right, zone);
    }

    /**
     * 两侧位置组成的键，用于按位置对分组的已访问集合。
     */
    public String getLocationKey() {
        return left.getId() + " <= " + right.getId();
    }

    public StatePair extrapolate(MaxBounds bounds) {
        return new StatePair(left, right, zone.extrapolateMaxBounds(bounds));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        StatePair that = (StatePair) o;
        return left.equals(that.left) &&
                right.equals(that.right) &&
                zone.equals(that.zone);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        return "StatePair(" + left + ", " + right + ", " + zone + ")";
    }
}
