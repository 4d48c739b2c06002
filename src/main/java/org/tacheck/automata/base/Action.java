package org.tacheck.automata.base;

import lombok.Getter;

import java.util.Objects;

/**
 * 同步动作标签。空标签表示静默动作 (epsilon)。
 */
@Getter
public final class Action implements Comparable<Action> {

    // 定义 epsilon 动作的常量
    public static final Action EPSILON = new Action("");

    private final String label;
    private final boolean isEpsilon;

    private final int hashCode;

    private Action(String label) {
        this.label = Objects.requireNonNull(label, "Action label cannot be null");
        this.isEpsilon = label.isEmpty();
        this.hashCode = Objects.hash(label);
    }

    /**
     * 工厂方法：创建一个动作标签，null 或空串返回 {@link #EPSILON}。
     */
    public static Action of(String label) {
        if (label == null || label.isEmpty()) {
            return EPSILON;
        }
        return new Action(label);
    }

    public boolean isEpsilon() {
        return isEpsilon;
    }

    @Override
    public String toString() {
        return label.isEmpty() ? "ε" : label;
    }

    @Override
    public int compareTo(Action other) {
        // epsilon 动作排在最前面，其余按标签字母顺序
        if (this.isEpsilon() && !other.isEpsilon()) {
            return -1;
        }
        if (!this.isEpsilon() && other.isEpsilon()) {
            return 1;
        }
        return this.label.compareTo(other.label);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Action action1 = (Action) o;
        return label.equals(action1.label);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }
}
