package org.tacheck.automata.systems;

import lombok.Getter;

import java.util.Objects;

/**
 * 编译后的时钟更新：把矩阵下标为 clockIndex 的时钟设为 value。
 */
@Getter
public final class Update {

    private final int clockIndex;
    private final int value;

    public Update(int clockIndex, int value) {
        if (clockIndex <= 0) {
            throw new IllegalArgumentException("不能更新零时钟或负下标: " + clockIndex);
        }
        this.clockIndex = clockIndex;
        this.value = value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Update update = (Update) o;
        return clockIndex == update.clockIndex && value == update.value;
    }

    @Override
    public int hashCode() {
        return Objects.hash(clockIndex, value);
    }

    @Override
    public String toString() {
        return "x" + clockIndex + ":=" + value;
    }
}
