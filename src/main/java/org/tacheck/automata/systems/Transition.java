package org.tacheck.automata.systems;

import lombok.Getter;
import org.tacheck.automata.base.Action;
import org.tacheck.automata.base.Edge;
import org.tacheck.expressions.dcs.Bound;
import org.tacheck.expressions.dcs.DBM;
import org.tacheck.expressions.dcs.Federation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 复合迁移系统中的一步离散迁移：守卫 (按全局时钟下标编译的 DBM)、更新、目标位置，
 * 以及参与这一步的组件边 (用于诊断输出)。
 * 此类是不可变的。
 */
@Getter
public final class Transition {

    private final Action action;
    private final DBM guard;
    private final List<Update> updates;
    private final LocationTree target;
    private final List<Edge> edges;

    public Transition(Action action, DBM guard, List<Update> updates, LocationTree target, List<Edge> edges) {
        this.action = Objects.requireNonNull(action, "Action cannot be null.");
        this.guard = Objects.requireNonNull(guard, "Guard cannot be null.");
        this.updates = Collections.unmodifiableList(new ArrayList<>(updates));
        this.target = Objects.requireNonNull(target, "Target cannot be null.");
        this.edges = Collections.unmodifiableList(new ArrayList<>(edges));
    }

    /**
     * 两侧同时迁移：守卫取交，更新拼接，目标组成位置对。
     */
    public static Transition combine(Transition left, Transition right, LocationTree.Kind kind) {
        List<Update> updates = new ArrayList<>(left.updates);
        updates.addAll(right.updates);
        List<Edge> edges = new ArrayList<>(left.edges);
        edges.addAll(right.edges);
        return new Transition(left.action, left.guard.intersect(right.guard), updates,
                LocationTree.pair(kind, left.target, right.target), edges);
    }

    /**
     * 只有一侧迁移，另一侧停在 stay。
     * @param movingIsLeft 迁移的一侧是否为左侧
     */
    public static Transition interleave(Transition moving, LocationTree stay, boolean movingIsLeft, LocationTree.Kind kind) {
        LocationTree target = movingIsLeft
                ? LocationTree.pair(kind, moving.target, stay)
                : LocationTree.pair(kind, stay, moving.target);
        return new Transition(moving.action, moving.guard, moving.updates, target, moving.edges);
    }

    public Transition withGuard(DBM newGuard) {
        return new Transition(action, newGuard, updates, target, edges);
    }

    /**
     * 离散部分：zone ∧ guard，然后依次执行更新。不包含时间流逝与目标不变量。
     */
    public DBM fire(DBM zone) {
        DBM result = zone.intersect(guard);
        for (Update update : updates) {
            if (result.isEmpty()) {
                break;
            }
            result = result.reset(update.getClockIndex(), update.getValue());
        }
        return result;
    }

    /**
     * 更新的原像：所有执行更新后落入 zone 的赋值。不考虑守卫。
     */
    public DBM preImage(DBM zone) {
        return preImage(zone, updates);
    }

    static DBM preImage(DBM zone, List<Update> updates) {
        DBM result = zone;
        for (Update update : updates) {
            int x = update.getClockIndex();
            result = result.constrain(x, 0, Bound.lessEqual(update.getValue()))
                    .constrain(0, x, Bound.lessEqual(-update.getValue()));
        }
        for (Update update : updates) {
            result = result.free(update.getClockIndex());
        }
        return result;
    }

    /**
     * guard ∧ 更新的原像 (target)，即能通过本迁移进入 target 的赋值。
     */
    public Federation preImage(Federation target) {
        List<DBM> pieces = new ArrayList<>();
        for (DBM zone : target.getZones()) {
            pieces.add(preImage(zone).intersect(guard));
        }
        return Federation.of(guard.getDimension(), pieces);
    }

    /**
     * 迁移后目标不变量仍成立的守卫部分：guard ∧ 更新的原像 (Inv(target))。
     */
    public DBM allowedGuard() {
        if (!target.hasInvariant()) {
            return guard;
        }
        return guard.intersect(preImage(target.getInvariant()));
    }

    @Override
    public String toString() {
        return String.format("--[%s, %s]--> %s", action, updates, target);
    }
}
