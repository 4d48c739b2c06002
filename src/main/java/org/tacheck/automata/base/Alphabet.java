package org.tacheck.automata.base;

import lombok.Getter;
import org.tacheck.exceptions.ModelException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Collections;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * 定时 I/O 自动机的字母表：互不相交的输入动作集合与输出动作集合。
 * 静默动作不属于任何一方。
 * Alphabet 是不可变对象。
 */
@Getter
public final class Alphabet {

    private static final Logger logger = LoggerFactory.getLogger(Alphabet.class);

    private final SortedSet<Action> inputs;
    private final SortedSet<Action> outputs;
    private final SortedSet<Action> actions;
    private final int hashCode;

    /**
     * @throws ModelException 输入与输出有交集，或包含 epsilon
     */
    private Alphabet(Collection<Action> inputs, Collection<Action> outputs) {
        Objects.requireNonNull(inputs, "Inputs cannot be null");
        Objects.requireNonNull(outputs, "Outputs cannot be null");
        SortedSet<Action> in = new TreeSet<>(inputs);
        SortedSet<Action> out = new TreeSet<>(outputs);
        if (in.contains(Action.EPSILON) || out.contains(Action.EPSILON)) {
            throw new ModelException("静默动作不能声明为输入或输出");
        }
        SortedSet<Action> overlap = new TreeSet<>(in);
        overlap.retainAll(out);
        if (!overlap.isEmpty()) {
            logger.error("Alphabet: 输入与输出重叠 {}", overlap);
            throw new ModelException("输入与输出动作重叠: " + overlap);
        }
        SortedSet<Action> all = new TreeSet<>(in);
        all.addAll(out);
        this.inputs = Collections.unmodifiableSortedSet(in);
        this.outputs = Collections.unmodifiableSortedSet(out);
        this.actions = Collections.unmodifiableSortedSet(all);
        this.hashCode = Objects.hash(this.inputs, this.outputs);
    }

    public static Alphabet of(Collection<Action> inputs, Collection<Action> outputs) {
        return new Alphabet(inputs, outputs);
    }

    /**
     * 从标签创建。
     */
    public static Alphabet ofLabels(Collection<String> inputs, Collection<String> outputs) {
        return new Alphabet(
                inputs.stream().map(Action::of).collect(Collectors.toList()),
                outputs.stream().map(Action::of).collect(Collectors.toList()));
    }

    public boolean isInput(Action action) {
        return inputs.contains(action);
    }

    public boolean isOutput(Action action) {
        return outputs.contains(action);
    }

    public boolean contains(Action action) {
        return actions.contains(action);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Alphabet alphabet = (Alphabet) o;
        return inputs.equals(alphabet.inputs) && outputs.equals(alphabet.outputs);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        return "Alphabet{inputs=" + inputs + ", outputs=" + outputs + '}';
    }
}
