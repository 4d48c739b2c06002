package org.tacheck.automata.systems;

import org.tacheck.automata.base.Action;
import org.tacheck.exceptions.ModelException;

import java.util.Collections;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * 合取 (S && T)：两侧必须在所有共享动作上同步，输入与输出各自取并集。
 * 要求一侧的输入不是另一侧的输出。
 */
public final class Conjunction extends ProductSystem {

    private final SortedSet<Action> inputs;
    private final SortedSet<Action> outputs;

    public Conjunction(TransitionSystem left, TransitionSystem right) {
        super(left, right, LocationTree.Kind.CONJUNCTION);
        for (Action action : left.getInputActions()) {
            if (right.isOutput(action)) {
                throw new ModelException("合取不相容: 动作 " + action + " 在左侧是输入, 在右侧是输出");
            }
        }
        for (Action action : left.getOutputActions()) {
            if (right.isInput(action)) {
                throw new ModelException("合取不相容: 动作 " + action + " 在左侧是输出, 在右侧是输入");
            }
        }
        SortedSet<Action> in = new TreeSet<>(left.getInputActions());
        in.addAll(right.getInputActions());
        SortedSet<Action> out = new TreeSet<>(left.getOutputActions());
        out.addAll(right.getOutputActions());
        this.inputs = Collections.unmodifiableSortedSet(in);
        this.outputs = Collections.unmodifiableSortedSet(out);
    }

    @Override
    public CompositionType getCompositionType() {
        return CompositionType.CONJUNCTION;
    }

    @Override
    public SortedSet<Action> getInputActions() {
        return inputs;
    }

    @Override
    public SortedSet<Action> getOutputActions() {
        return outputs;
    }
}
