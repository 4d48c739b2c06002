package org.tacheck.automata.systems;

import org.tacheck.automata.base.Action;
import org.tacheck.exceptions.ModelException;

import java.util.Collections;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * 并行组合 (S // T)：一侧的输出与另一侧的同名输入同步，同步后的动作是组合的输出。
 * 要求两侧输出不相交。
 */
public final class Composition extends ProductSystem {

    private final SortedSet<Action> inputs;
    private final SortedSet<Action> outputs;

    public Composition(TransitionSystem left, TransitionSystem right) {
        super(left, right, LocationTree.Kind.COMPOSITION);
        for (Action action : left.getOutputActions()) {
            if (right.isOutput(action)) {
                throw new ModelException("并行组合不相容: 两侧都输出动作 " + action);
            }
        }
        SortedSet<Action> out = new TreeSet<>(left.getOutputActions());
        out.addAll(right.getOutputActions());
        SortedSet<Action> in = new TreeSet<>(left.getInputActions());
        in.addAll(right.getInputActions());
        in.removeAll(out);
        this.inputs = Collections.unmodifiableSortedSet(in);
        this.outputs = Collections.unmodifiableSortedSet(out);
    }

    @Override
    public CompositionType getCompositionType() {
        return CompositionType.COMPOSITION;
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
