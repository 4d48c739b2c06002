package org.tacheck.expressions.dcs;

import java.util.Arrays;

/**
 * 每个时钟在守卫与不变量中出现过的最大常量，用于 {@link DBM#extrapolateMaxBounds(MaxBounds)}。
 * 下标与区域矩阵一致，下标 0 (零时钟) 恒为 0；从未被比较过的时钟取 0。
 * 此类是不可变的。
 */
public final class MaxBounds {

    private final int[] bounds;

    private MaxBounds(int[] bounds) {
        this.bounds = bounds;
    }

    public static MaxBounds zeros(int dimension) {
        return new MaxBounds(new int[dimension]);
    }

    public static MaxBounds of(int[] bounds) {
        int[] copy = bounds.clone();
        if (copy.length > 0) {
            copy[0] = 0;
        }
        return new MaxBounds(copy);
    }

    public int getDimension() {
        return bounds.length;
    }

    public int get(int clockIndex) {
        return bounds[clockIndex];
    }

    /**
     * @return 把 clockIndex 的上界提高到至少 value 的新实例
     */
    public MaxBounds raise(int clockIndex, int value) {
        if (clockIndex == 0 || bounds[clockIndex] >= value) {
            return this;
        }
        int[] copy = bounds.clone();
        copy[clockIndex] = value;
        return new MaxBounds(copy);
    }

    /**
     * 逐分量取最大值。
     */
    public MaxBounds merge(MaxBounds other) {
        if (other.bounds.length != bounds.length) {
            throw new IllegalArgumentException("维度不一致: " + bounds.length + " vs " + other.bounds.length);
        }
        int[] merged = new int[bounds.length];
        for (int i = 0; i < bounds.length; i++) {
            merged[i] = Math.max(bounds[i], other.bounds[i]);
        }
        return new MaxBounds(merged);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return Arrays.equals(bounds, ((MaxBounds) o).bounds);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bounds);
    }

    @Override
    public String toString() {
        return "MaxBounds" + Arrays.toString(bounds);
    }
}
