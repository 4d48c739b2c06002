package org.tacheck.expressions.dcs;

import org.tacheck.utils.Rational;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.UnaryOperator;

/**
 * 区域的有限并 (federation)，用于表示守卫的并集、守卫的补集等非凸集合。
 * 内部只保存非空 DBM，且不保存被其他成员包含的 DBM。
 * 此类是不可变的。
 */
public final class Federation {

    private static final Logger logger = LoggerFactory.getLogger(Federation.class);

    private final int dimension;
    private final List<DBM> zones;

    private Federation(int dimension, List<DBM> zones) {
        this.dimension = dimension;
        this.zones = Collections.unmodifiableList(zones);
    }

    public static Federation empty(int dimension) {
        return new Federation(dimension, new ArrayList<>());
    }

    public static Federation universe(int dimension) {
        return of(DBM.universe(dimension));
    }

    public static Federation of(DBM zone) {
        List<DBM> zones = new ArrayList<>(1);
        if (!zone.isEmpty()) {
            zones.add(zone);
        }
        return new Federation(zone.getDimension(), zones);
    }

    public static Federation of(int dimension, List<DBM> zones) {
        List<DBM> reduced = new ArrayList<>();
        for (DBM zone : zones) {
            addReduced(reduced, zone, dimension);
        }
        return new Federation(dimension, reduced);
    }

    /**
     * 加入 zone，同时丢弃被包含的成员。
     */
    private static void addReduced(List<DBM> target, DBM zone, int dimension) {
        if (zone.getDimension() != dimension) {
            throw new IllegalArgumentException("DBM 维度不一致: " + zone.getDimension() + " vs " + dimension);
        }
        if (zone.isEmpty()) {
            return;
        }
        for (DBM existing : target) {
            if (zone.isSubsetOf(existing)) {
                return;
            }
        }
        target.removeIf(existing -> existing.isSubsetOf(zone));
        target.add(zone);
    }

    public int getDimension() {
        return dimension;
    }

    public List<DBM> getZones() {
        return zones;
    }

    public boolean isEmpty() {
        return zones.isEmpty();
    }

    public int size() {
        return zones.size();
    }

    // === 集合运算 ===

    public Federation union(DBM zone) {
        List<DBM> result = new ArrayList<>(zones);
        addReduced(result, zone, dimension);
        return new Federation(dimension, result);
    }

    public Federation union(Federation other) {
        List<DBM> result = new ArrayList<>(zones);
        for (DBM zone : other.zones) {
            addReduced(result, zone, dimension);
        }
        return new Federation(dimension, result);
    }

    public Federation intersect(DBM zone) {
        List<DBM> result = new ArrayList<>();
        for (DBM mine : zones) {
            addReduced(result, mine.intersect(zone), dimension);
        }
        return new Federation(dimension, result);
    }

    public Federation intersect(Federation other) {
        List<DBM> result = new ArrayList<>();
        for (DBM mine : zones) {
            for (DBM theirs : other.zones) {
                addReduced(result, mine.intersect(theirs), dimension);
            }
        }
        return new Federation(dimension, result);
    }

    public Federation subtract(DBM zone) {
        List<DBM> result = new ArrayList<>();
        for (DBM mine : zones) {
            for (DBM piece : subtract(mine, zone)) {
                addReduced(result, piece, dimension);
            }
        }
        return new Federation(dimension, result);
    }

    public Federation subtract(Federation other) {
        Federation result = this;
        for (DBM zone : other.zones) {
            if (result.isEmpty()) {
                break;
            }
            result = result.subtract(zone);
        }
        return result;
    }

    /**
     * 相对于全体非负赋值的补集。
     */
    public Federation complement() {
        return universe(dimension).subtract(this);
    }

    /**
     * 凸区域相减 z \ w，结果是互不相交的凸块。
     * 依次对 w 的每条比 z 更紧的边界 c，切下 z ∧ ¬c，剩余部分收紧为 z ∧ c。
     */
    static List<DBM> subtract(DBM z, DBM w) {
        List<DBM> pieces = new ArrayList<>();
        if (z.isEmpty()) {
            return pieces;
        }
        if (!z.hasIntersection(w)) {
            pieces.add(z);
            return pieces;
        }
        DBM remaining = z;
        int dim = z.getDimension();
        for (int i = 0; i < dim && !remaining.isEmpty(); i++) {
            for (int j = 0; j < dim; j++) {
                if (i == j) {
                    continue;
                }
                int raw = w.get(i, j);
                if (raw == Bound.INFINITY || remaining.get(i, j) <= raw) {
                    continue;
                }
                DBM piece = remaining.constrain(j, i, Bound.negate(raw));
                if (!piece.isEmpty()) {
                    pieces.add(piece);
                }
                remaining = remaining.constrain(i, j, raw);
                if (remaining.isEmpty()) {
                    break;
                }
            }
        }
        return pieces;
    }

    // === 时间运算 ===

    public Federation up() {
        return map(DBM::up);
    }

    public Federation down() {
        return map(DBM::down);
    }

    public Federation map(UnaryOperator<DBM> operator) {
        List<DBM> result = new ArrayList<>();
        for (DBM zone : zones) {
            addReduced(result, operator.apply(zone), dimension);
        }
        return new Federation(dimension, result);
    }

    /**
     * 时间前驱避开 good：能够通过延迟到达 bad 且途中不经过 good 的所有点。
     * 对凸的 b 与 g：(b↓ \ g↓) ∪ ((b ∩ g↓) \ g)↓；对 good 中各成员取交，对 bad 中各成员取并。
     */
    public static Federation predt(Federation bad, Federation good) {
        Federation result = empty(bad.dimension);
        for (DBM b : bad.zones) {
            Federation avoidingAll = of(b.down());
            for (DBM g : good.zones) {
                DBM gDown = g.down();
                Federation direct = of(b.down()).subtract(gDown);
                Federation beforeG = of(b.intersect(gDown)).subtract(g).down();
                avoidingAll = avoidingAll.intersect(direct.union(beforeG));
                if (avoidingAll.isEmpty()) {
                    break;
                }
            }
            result = result.union(avoidingAll);
        }
        return result;
    }

    /**
     * 时间后继避开 bad：从 start 出发经延迟可达且途中不经过 bad 的所有点。
     * 与 {@link #predt(Federation, Federation)} 在时间反向下对称。
     */
    public static Federation postt(DBM start, Federation bad) {
        Federation result = of(start.up());
        if (start.isEmpty()) {
            return result;
        }
        for (DBM b : bad.zones) {
            DBM bUp = b.up();
            Federation direct = of(start.up()).subtract(bUp);
            Federation afterB = of(start.intersect(bUp)).subtract(b).up();
            result = result.intersect(direct.union(afterB));
            if (result.isEmpty()) {
                break;
            }
        }
        return result;
    }

    // === 比较 ===

    public boolean isSubsetOf(DBM zone) {
        for (DBM mine : zones) {
            if (!mine.isSubsetOf(zone)) {
                return subtract(zone).isEmpty();
            }
        }
        return true;
    }

    public boolean isSubsetOf(Federation other) {
        for (DBM mine : zones) {
            boolean covered = false;
            for (DBM theirs : other.zones) {
                if (mine.isSubsetOf(theirs)) {
                    covered = true;
                    break;
                }
            }
            if (!covered && !of(mine).subtract(other).isEmpty()) {
                logger.debug("Federation.isSubsetOf: {} 未被覆盖", mine);
                return false;
            }
        }
        return true;
    }

    public boolean hasIntersection(DBM zone) {
        for (DBM mine : zones) {
            if (mine.hasIntersection(zone)) {
                return true;
            }
        }
        return false;
    }

    public boolean contains(Rational[] valuation) {
        for (DBM zone : zones) {
            if (zone.contains(valuation)) {
                return true;
            }
        }
        return false;
    }

    /**
     * 语义相等：互相包含。
     */
    public boolean sameSetAs(Federation other) {
        return this.isSubsetOf(other) && other.isSubsetOf(this);
    }

    public String toConstraintString(List<String> clockNames) {
        if (zones.isEmpty()) {
            return "false";
        }
        List<String> parts = new ArrayList<>();
        for (DBM zone : zones) {
            parts.add("(" + zone.toConstraintString(clockNames) + ")");
        }
        return String.join(" || ", parts);
    }

    @Override
    public String toString() {
        return "Federation" + zones;
    }
}
