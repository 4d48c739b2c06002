package org.tacheck.automata.base;

/**
 * 边上动作的方向。
 */
public enum SyncType {
    INPUT,
    OUTPUT
}
