package org.tacheck.query;

import lombok.Getter;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 查询中的系统表达式：组件名，或由 &&、//、\\ 组合的子表达式。
 * 此类是不可变的；同一组件在表达式中出现两次时是两个不同的节点。
 */
public abstract class SystemExpression {

    private SystemExpression() {
    }

    public static SystemExpression component(String name) {
        return new Component(name);
    }

    public static SystemExpression conjunction(SystemExpression left, SystemExpression right) {
        return new Binary(Operator.CONJUNCTION, left, right);
    }

    public static SystemExpression composition(SystemExpression left, SystemExpression right) {
        return new Binary(Operator.COMPOSITION, left, right);
    }

    public static SystemExpression quotient(SystemExpression left, SystemExpression right) {
        return new Binary(Operator.QUOTIENT, left, right);
    }

    /**
     * 从左到右列出所有组件名 (可能重复)。
     */
    public List<String> componentNames() {
        List<String> names = new ArrayList<>();
        collectNames(names);
        return names;
    }

    abstract void collectNames(List<String> names);

    public enum Operator {
        CONJUNCTION("&&"),
        COMPOSITION("//"),
        QUOTIENT("\\\\");

        private final String symbol;

        Operator(String symbol) {
            this.symbol = symbol;
        }

        public String getSymbol() {
            return symbol;
        }
    }

    @Getter
    public static final class Component extends SystemExpression {
        private final String name;

        private Component(String name) {
            this.name = Objects.requireNonNull(name, "Component name cannot be null.");
        }

        @Override
        void collectNames(List<String> names) {
            names.add(name);
        }

        @Override
        public String toString() {
            return name;
        }
    }

    @Getter
    public static final class Binary extends SystemExpression {
        private final Operator operator;
        private final SystemExpression left;
        private final SystemExpression right;

        private Binary(Operator operator, SystemExpression left, SystemExpression right) {
            this.operator = operator;
            this.left = Objects.requireNonNull(left, "Left operand cannot be null.");
            this.right = Objects.requireNonNull(right, "Right operand cannot be null.");
        }

        @Override
        void collectNames(List<String> names) {
            left.collectNames(names);
            right.collectNames(names);
        }

        @Override
        public String toString() {
            return "(" + left + " " + operator.getSymbol() + " " + right + ")";
        }
    }
}
