package org.tacheck.core;

import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * 组件中声明的一个时钟，由所属组件名与时钟名唯一确定。
 * 零时钟 x0 是所有差分约束的参照时钟，在区域矩阵中固定占据下标 0。
 * @author Ayalyt
 */
@Getter
public final class Clock implements Comparable<Clock> {

    private static final Logger logger = LoggerFactory.getLogger(Clock.class);

    // 零时钟的单例实例
    public static final Clock ZERO_CLOCK = new Clock("", "x0");

    private final String owner;
    private final String name;

    private final int hashCode;

    private Clock(String owner, String name) {
        this.owner = owner;
        this.name = name;
        this.hashCode = Objects.hash(owner, name);
    }

    /**
     * 创建组件 owner 中名为 name 的时钟。
     * @param owner 组件名称。
     * @param name 时钟名称。
     * @return 新的 Clock 实例。
     */
    public static Clock of(String owner, String name) {
        Objects.requireNonNull(owner, "Clock owner cannot be null.");
        Objects.requireNonNull(name, "Clock name cannot be null.");
        if (name.equals("x0") && owner.isEmpty()) {
            logger.warn("名称 'x0' 已被零时钟占用，返回零时钟。");
            return ZERO_CLOCK;
        }
        return new Clock(owner, name);
    }

    /**
     * 检查此时钟是否为零时钟。
     * @return 如果是零时钟则返回 true。
     */
    public boolean isZeroClock() {
        return this == ZERO_CLOCK;
    }

    /**
     * @return "组件.时钟" 形式的全名；零时钟返回 x0。
     */
    public String getQualifiedName() {
        return owner.isEmpty() ? name : owner + "." + name;
    }

    @Override
    public int compareTo(Clock other) {
        if (this.isZeroClock() || other.isZeroClock()) {
            return Boolean.compare(!this.isZeroClock(), !other.isZeroClock());
        }
        int cmp = owner.compareTo(other.owner);
        return cmp != 0 ? cmp : name.compareTo(other.name);
    }

    @Override
    public String toString() {
        return getQualifiedName();
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        Clock clock = (Clock) obj;
        return owner.equals(clock.owner) && name.equals(clock.name);
    }
}
