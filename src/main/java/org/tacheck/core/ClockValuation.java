package org.tacheck.core;

import lombok.Getter;
import org.tacheck.automata.base.ResetSet;
import org.tacheck.utils.Rational;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.stream.Collectors;

/**
 * 一个具体的时钟赋值。见证路径中的每一步都可以附带一个从区域中采样出的 ClockValuation。
 * 零时钟 (x0) 不在此映射中存储。
 * @author Ayalyt
 */
@Getter
public final class ClockValuation implements Comparable<ClockValuation> {

    private static final Logger logger = LoggerFactory.getLogger(ClockValuation.class);

    private final SortedMap<Clock, Rational> clockValuation;

    private ClockValuation(Map<Clock, Rational> clockValuation) {
        Map<Clock, Rational> values = new TreeMap<>();
        for (Map.Entry<Clock, Rational> entry : clockValuation.entrySet()) {
            Clock clock = entry.getKey();
            Rational value = entry.getValue();
            if (clock.isZeroClock()) {
                logger.warn("零时钟 (x0) 不在此映射中存储。");
                continue;
            }
            if (value.signum() < 0) {
                logger.error("初始化{}时遇到问题：时钟值必须是非负实数。", clockValuation);
                throw new IllegalArgumentException("时钟值必须是非负实数: " + clock + "=" + value);
            }
            values.put(clock, value);
        }
        this.clockValuation = Collections.unmodifiableSortedMap(new TreeMap<>(values));
    }

    public static ClockValuation of(Map<Clock, Rational> clockValuation) {
        return new ClockValuation(clockValuation);
    }

    /**
     * 全零赋值。
     * @param clocks 要创建全零的时钟集合。
     */
    public static ClockValuation zero(Collection<Clock> clocks) {
        Map<Clock, Rational> zeroValues = new HashMap<>();
        for (Clock clock : clocks) {
            zeroValues.put(clock, Rational.ZERO);
        }
        return new ClockValuation(zeroValues);
    }

    /**
     * 所有时钟同时前进 delay。
     */
    public ClockValuation delay(Rational delay) {
        if (delay.signum() < 0) {
            throw new IllegalArgumentException("延迟必须非负: " + delay);
        }
        Map<Clock, Rational> delayedValues = new HashMap<>();
        for (Map.Entry<Clock, Rational> entry : clockValuation.entrySet()) {
            delayedValues.put(entry.getKey(), entry.getValue().add(delay));
        }
        logger.debug("从{}延迟{}，到达{}", clockValuation, delay, delayedValues);
        return new ClockValuation(delayedValues);
    }

    /**
     * 按重置集合把时钟设为给定值。
     **/
    public ClockValuation reset(ResetSet resetSet) {
        Map<Clock, Rational> resetValues = new HashMap<>(clockValuation);
        for (Map.Entry<Clock, Integer> entry : resetSet.getResets().entrySet()) {
            resetValues.put(entry.getKey(), Rational.valueOf(entry.getValue()));
        }
        logger.debug("对{}应用重置{}，得到{}", clockValuation, resetSet, resetValues);
        return new ClockValuation(resetValues);
    }

    /**
     * 获取指定时钟的值。零时钟返回 0。
     */
    public Rational getValue(Clock clock) {
        if (clock.isZeroClock()) {
            return Rational.ZERO;
        }
        Rational value = clockValuation.get(clock);
        if (value == null) {
            throw new IllegalArgumentException("赋值 " + this + " 中不存在时钟 " + clock);
        }
        return value;
    }

    /**
     * 按给定时钟顺序展开为数组，下标 0 为零时钟。
     * @param indexOrder 下标 1..n 对应的时钟。
     */
    public Rational[] toArray(List<Clock> indexOrder) {
        Rational[] values = new Rational[indexOrder.size() + 1];
        values[0] = Rational.ZERO;
        for (int i = 0; i < indexOrder.size(); i++) {
            values[i + 1] = getValue(indexOrder.get(i));
        }
        return values;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        ClockValuation that = (ClockValuation) o;
        return clockValuation.equals(that.clockValuation);
    }

    @Override
    public int hashCode() {
        return Objects.hash(clockValuation);
    }

    @Override
    public String toString() {
        return "{" +
                clockValuation.entrySet().stream()
                        .map(entry -> entry.getKey().getQualifiedName() + "=" + entry.getValue())
                        .collect(Collectors.joining(", ")) +
                "}";
    }

    @Override
    public int compareTo(ClockValuation other) {
        Set<Clock> allClocks = new TreeSet<>(this.clockValuation.keySet());
        allClocks.addAll(other.clockValuation.keySet());
        for (Clock clock : allClocks) {
            Rational thisValue = this.clockValuation.getOrDefault(clock, Rational.ZERO);
            Rational otherValue = other.clockValuation.getOrDefault(clock, Rational.ZERO);
            int comparison = thisValue.compareTo(otherValue);
            if (comparison != 0) {
                return comparison;
            }
        }
        return 0;
    }
}
