package org.tacheck.explorer;

import org.tacheck.automata.base.Action;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 按下标寻址的状态存储。每个条目记录状态本身、父状态的下标和产生它的动作，
 * 见证路径通过沿父下标回溯得到；状态之间不直接互相引用。
 *
 * @param <S> 状态类型 ({@link org.tacheck.automata.symbolic.SymbolicState} 或
 *            {@link org.tacheck.automata.symbolic.StatePair})
 */
public final class StateArena<S> {

    /** 初始状态的父下标 */
    public static final int NO_PARENT = -1;

    private final List<S> states = new ArrayList<>();
    private final List<Integer> parents = new ArrayList<>();
    private final List<Action> actions = new ArrayList<>();

    /**
     * @param action 从父状态到此状态的动作，初始状态为 null
     * @return 新状态的下标
     */
    public int add(S state, int parent, Action action) {
        if (parent != NO_PARENT && (parent < 0 || parent >= states.size())) {
            throw new IndexOutOfBoundsException("父状态下标越界: " + parent);
        }
        states.add(state);
        parents.add(parent);
        actions.add(action);
        return states.size() - 1;
    }

    public S get(int index) {
        return states.get(index);
    }

    public int getParent(int index) {
        return parents.get(index);
    }

    public Action getAction(int index) {
        return actions.get(index);
    }

    public int size() {
        return states.size();
    }

    /**
     * @return 从初始状态到 index 的下标序列 (含两端)
     */
    public List<Integer> pathTo(int index) {
        List<Integer> path = new ArrayList<>();
        for (int current = index; current != NO_PARENT; current = parents.get(current)) {
            path.add(current);
        }
        Collections.reverse(path);
        return path;
    }
}
