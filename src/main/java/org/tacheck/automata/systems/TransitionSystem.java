package org.tacheck.automata.systems;

import lombok.Getter;
import org.tacheck.automata.base.Action;
import org.tacheck.expressions.dcs.DBM;
import org.tacheck.expressions.dcs.MaxBounds;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * 按需展开的迁移系统。组件、合取、并行组合、商与剪枝都实现同一个
 * "从某位置出发、以某动作可用的迁移" 查询，探索器和各检查器只面向这个抽象编写。
 * <p>
 * 子类固定为 {@link CompositionType} 中列出的五种，构造函数仅包内可见。
 */
public abstract class TransitionSystem {

    @Getter
    protected final ClockIndexTable clockTable;

    private volatile List<LocationTree> allLocations;

    TransitionSystem(ClockIndexTable clockTable) {
        this.clockTable = clockTable;
    }

    public abstract CompositionType getCompositionType();

    public abstract SortedSet<Action> getInputActions();

    public abstract SortedSet<Action> getOutputActions();

    public abstract LocationTree getInitialLocation();

    /**
     * 从 location 出发、标签为 action 的所有迁移，顺序确定 (边的声明顺序)。
     * action 为 {@link Action#EPSILON} 时返回静默迁移。
     */
    public abstract List<Transition> nextTransitions(LocationTree location, Action action);

    /**
     * 整个系统的最大常量向量，用于外推。
     */
    public abstract MaxBounds getMaxBounds();

    /**
     * 在所有守卫与不变量中都没有出现的时钟，探索时可以直接释放。
     */
    public abstract BitSet getIrrelevantClocks();

    /**
     * 按表达式中从左到右的顺序列出组件名称。
     */
    public abstract List<String> getComponentNames();

    public abstract List<TransitionSystem> getChildren();

    /**
     * 根据每个组件所选的位置名构造复合位置。
     * @param chosen 组件名到位置名；必须覆盖系统中的每个组件
     */
    public abstract LocationTree constructLocation(Map<String, String> chosen);

    /**
     * 是否存在静默迁移。
     */
    public abstract boolean hasSilentTransitions();

    public int getDimension() {
        return clockTable.getDimension();
    }

    public SortedSet<Action> getActions() {
        SortedSet<Action> actions = new TreeSet<>(getInputActions());
        actions.addAll(getOutputActions());
        return Collections.unmodifiableSortedSet(actions);
    }

    public boolean isInput(Action action) {
        return getInputActions().contains(action);
    }

    public boolean isOutput(Action action) {
        return getOutputActions().contains(action);
    }

    /**
     * 某个位置的最大常量。目前所有位置共用整个系统的常量向量。
     */
    public MaxBounds getLocalMaxBounds(LocationTree location) {
        return getMaxBounds();
    }

    /**
     * 进入 location 后的区域：先与不变量相交，非紧急位置再允许时间流逝并重新与不变量相交。
     * 返回的区域互不包含且均非空；为空列表表示无法进入。
     *
     * @param zone 离散迁移 (守卫与更新) 之后的区域
     */
    public List<DBM> closeUnderDelay(LocationTree location, DBM zone) {
        DBM entered = location.applyInvariant(zone);
        if (entered.isEmpty()) {
            return List.of();
        }
        if (!location.isUrgent()) {
            entered = location.applyInvariant(entered.up());
        }
        return List.of(entered);
    }

    /**
     * 初始位置上的区域：全零赋值与初始不变量相交后再闭包时间流逝。
     */
    public List<DBM> initialZones() {
        return closeUnderDelay(getInitialLocation(), DBM.zero(getDimension()));
    }

    /**
     * 所有动作 (包括静默动作) 按确定顺序排列：静默动作在前，其余按字母顺序。
     */
    public List<Action> getActionsWithSilent() {
        List<Action> actions = new ArrayList<>();
        actions.add(Action.EPSILON);
        actions.addAll(getActions());
        return actions;
    }

    /**
     * 忽略时钟后从初始位置离散可达的所有位置 (保守的可达集合)，按发现顺序排列。
     */
    public List<LocationTree> getAllLocations() {
        List<LocationTree> result = allLocations;
        if (result == null) {
            Set<LocationTree> seen = new LinkedHashSet<>();
            Deque<LocationTree> queue = new ArrayDeque<>();
            seen.add(getInitialLocation());
            queue.add(getInitialLocation());
            while (!queue.isEmpty()) {
                LocationTree location = queue.poll();
                for (Action action : getActionsWithSilent()) {
                    for (Transition transition : nextTransitions(location, action)) {
                        if (seen.add(transition.getTarget())) {
                            queue.add(transition.getTarget());
                        }
                    }
                }
            }
            result = List.copyOf(seen);
            allLocations = result;
        }
        return result;
    }

    @Override
    public String toString() {
        return getCompositionType() + getComponentNames().toString();
    }
}
