package org.tacheck.automata.systems;

/**
 * 迁移系统的种类。{@link TransitionSystem} 的子类与之一一对应。
 */
public enum CompositionType {
    SIMPLE,
    CONJUNCTION,
    COMPOSITION,
    QUOTIENT,
    PRUNED
}
