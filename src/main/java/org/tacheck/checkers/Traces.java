package org.tacheck.checkers;

import org.tacheck.automata.symbolic.SymbolicState;
import org.tacheck.explorer.StateArena;

import java.util.ArrayList;
import java.util.List;

/**
 * 由状态存储中的父下标链构造见证路径。
 */
final class Traces {

    private Traces() {
    }

    static List<TraceStep> pathTo(StateArena<SymbolicState> arena, int index, List<String> clockNames) {
        List<TraceStep> steps = new ArrayList<>();
        for (int i : arena.pathTo(index)) {
            SymbolicState state = arena.get(i);
            steps.add(TraceStep.of(state.getLocation().getId(), state.getZone(), arena.getAction(i), clockNames));
        }
        return steps;
    }
}
