package org.tacheck.automata.systems;

import lombok.Getter;
import org.tacheck.automata.base.Action;
import org.tacheck.expressions.dcs.MaxBounds;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 两个系统的同步积：共享动作两侧同时迁移，其余动作与静默动作交错执行。
 * 合取与并行组合只在字母表的计算与相容性条件上不同。
 */
public abstract class ProductSystem extends TransitionSystem {

    @Getter
    protected final TransitionSystem left;
    @Getter
    protected final TransitionSystem right;

    private final LocationTree.Kind kind;
    private final LocationTree initial;

    ProductSystem(TransitionSystem left, TransitionSystem right, LocationTree.Kind kind) {
        super(Objects.requireNonNull(left, "Left system cannot be null.").getClockTable());
        this.left = left;
        this.right = Objects.requireNonNull(right, "Right system cannot be null.");
        if (left.getClockTable() != right.getClockTable()) {
            throw new IllegalArgumentException("两侧系统必须共用同一张时钟下标表");
        }
        this.kind = kind;
        this.initial = LocationTree.pair(kind, left.getInitialLocation(), right.getInitialLocation());
    }

    @Override
    public LocationTree getInitialLocation() {
        return initial;
    }

    @Override
    public List<Transition> nextTransitions(LocationTree location, Action action) {
        LocationTree l = location.getLeft();
        LocationTree r = location.getRight();
        boolean inLeft = !action.isEpsilon() && left.getActions().contains(action);
        boolean inRight = !action.isEpsilon() && right.getActions().contains(action);
        List<Transition> result = new ArrayList<>();
        if (inLeft && inRight) {
            List<Transition> rightMoves = right.nextTransitions(r, action);
            for (Transition lt : left.nextTransitions(l, action)) {
                for (Transition rt : rightMoves) {
                    Transition joint = Transition.combine(lt, rt, kind);
                    if (!joint.getGuard().isEmpty()) {
                        result.add(joint);
                    }
                }
            }
            return result;
        }
        if (action.isEpsilon() || inLeft) {
            for (Transition lt : left.nextTransitions(l, action)) {
                result.add(Transition.interleave(lt, r, true, kind));
            }
        }
        if (action.isEpsilon() || inRight) {
            for (Transition rt : right.nextTransitions(r, action)) {
                result.add(Transition.interleave(rt, l, false, kind));
            }
        }
        return result;
    }

    @Override
    public MaxBounds getMaxBounds() {
        return left.getMaxBounds().merge(right.getMaxBounds());
    }

    @Override
    public BitSet getIrrelevantClocks() {
        BitSet irrelevant = left.getIrrelevantClocks();
        irrelevant.or(right.getIrrelevantClocks());
        return irrelevant;
    }

    @Override
    public List<String> getComponentNames() {
        List<String> names = new ArrayList<>(left.getComponentNames());
        names.addAll(right.getComponentNames());
        return names;
    }

    @Override
    public List<TransitionSystem> getChildren() {
        return List.of(left, right);
    }

    @Override
    public LocationTree constructLocation(Map<String, String> chosen) {
        return LocationTree.pair(kind, left.constructLocation(chosen), right.constructLocation(chosen));
    }

    @Override
    public boolean hasSilentTransitions() {
        return left.hasSilentTransitions() || right.hasSilentTransitions();
    }
}
