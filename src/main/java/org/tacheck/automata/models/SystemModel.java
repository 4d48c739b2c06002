package org.tacheck.automata.models;

import org.tacheck.exceptions.ModelException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * 已加载的组件集合 (名称到组件)，是每个查询显式传入的模型上下文。
 * 此类是不可变的；保存新组件会得到新的 SystemModel。
 */
public final class SystemModel {

    private final Map<String, TimedAutomaton> components;

    private SystemModel(Map<String, TimedAutomaton> components) {
        this.components = Collections.unmodifiableMap(components);
    }

    /**
     * @throws ModelException 组件名称重复
     */
    public static SystemModel of(List<TimedAutomaton> automata) {
        Map<String, TimedAutomaton> map = new LinkedHashMap<>();
        for (TimedAutomaton automaton : automata) {
            if (map.put(automaton.getName(), automaton) != null) {
                throw new ModelException("组件名称重复: " + automaton.getName());
            }
        }
        return new SystemModel(map);
    }

    /**
     * @throws ModelException 不存在该组件
     */
    public TimedAutomaton getComponent(String name) {
        TimedAutomaton automaton = components.get(name);
        if (automaton == null) {
            throw new ModelException("未知组件: " + name);
        }
        return automaton;
    }

    public boolean hasComponent(String name) {
        return components.containsKey(name);
    }

    public Set<String> getComponentNames() {
        return components.keySet();
    }

    /**
     * 加入或替换一个组件。
     */
    public SystemModel withComponent(TimedAutomaton automaton) {
        Objects.requireNonNull(automaton, "Component cannot be null.");
        Map<String, TimedAutomaton> map = new LinkedHashMap<>(components);
        map.put(automaton.getName(), automaton);
        return new SystemModel(map);
    }

    @Override
    public String toString() {
        return "SystemModel" + components.keySet();
    }
}
