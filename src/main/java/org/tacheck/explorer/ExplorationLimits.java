package org.tacheck.explorer;

import lombok.Getter;
import org.tacheck.exceptions.ExplorationLimitExceededException;

/**
 * 一次查询的探索上限：状态数上限、截止时间 (System.nanoTime) 与线程中断。
 * 此类是不可变的。
 */
@Getter
public final class ExplorationLimits {

    private static final ExplorationLimits UNBOUNDED = new ExplorationLimits(Integer.MAX_VALUE, Long.MAX_VALUE);

    private final int maxStates;
    private final long deadlineNanos;

    private ExplorationLimits(int maxStates, long deadlineNanos) {
        this.maxStates = maxStates;
        this.deadlineNanos = deadlineNanos;
    }

    public static ExplorationLimits unbounded() {
        return UNBOUNDED;
    }

    /**
     * @param maxStates     状态数上限，必须为正
     * @param timeoutMillis 从现在起的时间上限，0 表示不限
     */
    public static ExplorationLimits of(int maxStates, long timeoutMillis) {
        if (maxStates <= 0) {
            throw new IllegalArgumentException("状态数上限必须为正: " + maxStates);
        }
        if (timeoutMillis < 0) {
            throw new IllegalArgumentException("时间上限不能为负: " + timeoutMillis);
        }
        long deadline = timeoutMillis == 0 ? Long.MAX_VALUE : System.nanoTime() + timeoutMillis * 1_000_000L;
        return new ExplorationLimits(maxStates, deadline);
    }

    /**
     * @throws ExplorationLimitExceededException 超出任一上限或当前线程被中断
     */
    public void check(int exploredStates) {
        if (exploredStates > maxStates) {
            throw new ExplorationLimitExceededException("超出状态数上限 " + maxStates, exploredStates);
        }
        if (Thread.currentThread().isInterrupted()) {
            throw new ExplorationLimitExceededException("探索被中断", exploredStates);
        }
        if (deadlineNanos != Long.MAX_VALUE && System.nanoTime() - deadlineNanos > 0) {
            throw new ExplorationLimitExceededException("超出时间上限", exploredStates);
        }
    }
}
