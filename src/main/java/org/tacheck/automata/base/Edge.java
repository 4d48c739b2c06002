package org.tacheck.automata.base;

import lombok.Getter;
import org.tacheck.expressions.dcs.ClockConstraint;

import java.util.List;
import java.util.Objects;

/**
 * 组件中的一条边：source --[action?/!, guard, resets]--> target。
 */
@Getter
public final class Edge {

    private final Location source;
    private final Location target;
    private final Action action;
    private final SyncType syncType;
    private final List<ClockConstraint> guard;
    private final ResetSet resetSet;

    private final int hashCode;

    /**
     * @param source   源位置 (q)
     * @param target   目标位置 (q')
     * @param action   触发迁移的动作 (a)，静默边使用 {@link Action#EPSILON}
     * @param syncType 输入或输出
     * @param guard    迁移的守卫 (g)，约束的合取
     * @param resetSet 迁移的时钟重置集 (r)
     */
    public Edge(Location source, Location target, Action action, SyncType syncType,
                List<ClockConstraint> guard, ResetSet resetSet) {
        this.source = Objects.requireNonNull(source, "Source location cannot be null.");
        this.target = Objects.requireNonNull(target, "Target location cannot be null.");
        this.action = Objects.requireNonNull(action, "Action cannot be null.");
        this.syncType = Objects.requireNonNull(syncType, "SyncType cannot be null.");
        this.guard = List.copyOf(Objects.requireNonNull(guard, "Guard cannot be null."));
        this.resetSet = Objects.requireNonNull(resetSet, "ResetSet cannot be null.");
        this.hashCode = Objects.hash(source, target, action, syncType, this.guard, resetSet);
    }

    public boolean isSilent() {
        return action.isEpsilon();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Edge that = (Edge) o;
        return source.equals(that.source) &&
                target.equals(that.target) &&
                action.equals(that.action) &&
                syncType == that.syncType &&
                guard.equals(that.guard) &&
                resetSet.equals(that.resetSet);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        String mark = isSilent() ? "" : (syncType == SyncType.INPUT ? "?" : "!");
        return String.format("%s --[%s%s, %s, %s]--> %s",
                source.getName(),
                action,
                mark,
                guard,
                resetSet,
                target.getName());
    }
}
