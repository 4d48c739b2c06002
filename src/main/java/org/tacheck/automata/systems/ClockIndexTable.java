package org.tacheck.automata.systems;

import lombok.Getter;
import org.tacheck.automata.models.TimedAutomaton;
import org.tacheck.core.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 一个查询内所有时钟到区域矩阵下标的分配表。下标 0 是零时钟，下标 i 对应 getClocks().get(i - 1)。
 * 同一组件在表达式中出现多次时，每次出现都得到独立的一组时钟，名称加上 "#k" 后缀以示区分。
 * 此类是不可变的，由 {@link Builder} 构造。
 */
@Getter
public final class ClockIndexTable {

    private final List<Clock> clocks;
    private final List<String> clockNames;

    private ClockIndexTable(List<Clock> clocks) {
        this.clocks = Collections.unmodifiableList(new ArrayList<>(clocks));
        List<String> names = new ArrayList<>();
        for (Clock clock : clocks) {
            names.add(clock.getQualifiedName());
        }
        this.clockNames = Collections.unmodifiableList(names);
    }

    public int getDimension() {
        return clocks.size() + 1;
    }

    public Clock getClock(int index) {
        if (index == 0) {
            return Clock.ZERO_CLOCK;
        }
        return clocks.get(index - 1);
    }

    /**
     * @return 名称 (如 "A.x") 对应的下标，不存在时返回 -1
     */
    public int indexOf(String qualifiedName) {
        int position = clockNames.indexOf(qualifiedName);
        return position < 0 ? -1 : position + 1;
    }

    @Override
    public String toString() {
        return "ClockIndexTable" + clockNames;
    }

    /**
     * 组件一次出现的时钟分配结果。
     */
    @Getter
    public static final class Allocation {

        /** 本次出现的名称：第一次出现为组件名，之后为 "组件名#k" */
        private final String instanceName;
        private final Map<Clock, Integer> indices;

        private Allocation(String instanceName, Map<Clock, Integer> indices) {
            this.instanceName = instanceName;
            this.indices = indices;
        }

        public int indexOf(Clock clock) {
            if (clock.isZeroClock()) {
                return 0;
            }
            Integer index = indices.get(clock);
            if (index == null) {
                throw new IllegalArgumentException("时钟 " + clock + " 不属于 " + instanceName);
            }
            return index;
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * 按表达式遍历顺序为每个组件出现与每个商运算的新时钟分配下标。
     */
    public static final class Builder {

        private static final Logger logger = LoggerFactory.getLogger(Builder.class);

        private final List<Clock> clocks = new ArrayList<>();
        private final Map<String, Integer> occurrences = new HashMap<>();

        private Builder() {
        }

        /**
         * 为组件的一次出现分配时钟。
         * @return 本次出现的名称，以及组件中声明的时钟到矩阵下标的映射
         */
        public Allocation allocate(TimedAutomaton automaton) {
            int occurrence = occurrences.merge(automaton.getName(), 1, Integer::sum);
            String owner = occurrence == 1 ? automaton.getName() : automaton.getName() + "#" + occurrence;
            Map<Clock, Integer> indices = new LinkedHashMap<>();
            for (Clock clock : automaton.getClocks()) {
                clocks.add(occurrence == 1 ? clock : Clock.of(owner, clock.getName()));
                indices.put(clock, clocks.size());
            }
            logger.debug("为 {} 分配时钟下标 {}", owner, indices.values());
            return new Allocation(owner, Collections.unmodifiableMap(indices));
        }

        /**
         * 分配一个不属于任何组件的新时钟 (商运算使用)。
         */
        public int allocateFresh(String owner, String name) {
            clocks.add(Clock.of(owner, name));
            return clocks.size();
        }

        public ClockIndexTable build() {
            return new ClockIndexTable(clocks);
        }
    }
}
