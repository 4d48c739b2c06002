package org.tacheck.automata.base;

import org.tacheck.core.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * 代表一条边上的时钟更新集合 (clock := 非负整数常量)。
 * 此类是不可变的。
 * @author Ayalyt
 */
public final class ResetSet {
    private static final Logger logger = LoggerFactory.getLogger(ResetSet.class);

    public static final ResetSet EMPTY = new ResetSet(Collections.emptyMap());

    private final Map<Clock, Integer> resets;

    private final int hashCode;

    /**
     * @param resets 要重置的时钟及其新值，值必须非负。
     * @throws IllegalArgumentException 重置零时钟或值为负
     */
    public ResetSet(Map<Clock, Integer> resets) {
        Map<Clock, Integer> tempMap = new LinkedHashMap<>();
        for (Map.Entry<Clock, Integer> entry : resets.entrySet()) {
            Clock clock = entry.getKey();
            int value = entry.getValue();
            if (clock.isZeroClock()) {
                throw new IllegalArgumentException("零时钟 (x0) 不能被重置");
            }
            if (value < 0) {
                logger.error("时钟 '{}' 的重置值 '{}' 必须是非负数", clock.getName(), value);
                throw new IllegalArgumentException("时钟 '" + clock.getName() + "' 的重置值必须非负: " + value);
            }
            tempMap.put(clock, value);
        }
        this.resets = Collections.unmodifiableMap(tempMap);
        this.hashCode = Objects.hash(tempMap);
    }

    /**
     * @return Map<Clock, Integer>，包含要重置的时钟及其新值 (按声明顺序)。
     */
    public Map<Clock, Integer> getResets() {
        return resets;
    }

    public boolean isEmpty() {
        return resets.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        ResetSet resetSet1 = (ResetSet) o;
        return resets.equals(resetSet1.resets);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        if (resets.isEmpty()) {
            return "{}";
        }
        return "{" +
                resets.entrySet().stream()
                        .map(entry -> entry.getKey().getName() + "=" + entry.getValue())
                        .collect(Collectors.joining(", ")) +
                "}";
    }
}
