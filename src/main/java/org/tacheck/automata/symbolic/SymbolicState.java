package org.tacheck.automata.symbolic;

import lombok.Getter;
import org.tacheck.automata.systems.LocationTree;
import org.tacheck.expressions.dcs.DBM;

import java.util.Objects;

/**
 * 代表一个符号化状态，即 (位置向量, 区域)。
 * 这是符号化状态空间图中的一个节点。
 * 此类是不可变的。
 */
@Getter
public final class SymbolicState {

    private final LocationTree location;
    private final DBM zone;

    private final int hashCode;

    public SymbolicState(LocationTree location, DBM zone) {
        this.location = Objects.requireNonNull(location, "Location cannot be null.");
        this.zone = Objects.requireNonNull(zone, "Zone cannot be null.");
        this.hashCode = Objects.hash(location, zone);
    }

    public SymbolicState withZone(DBM newZone) {
        return new SymbolicState(location, newZone);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        SymbolicState that = (SymbolicState) o;
        return location.equals(that.location) &&
                zone.equals(that.zone);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        return "SymbolicState(\n  Location: " + location + ",\n  " + zone.toString().indent(2) + "\n)";
    }
}
