package org.tacheck.exceptions;

import lombok.Getter;

/**
 * 探索超出状态上限、截止时间或线程被中断。由查询分发器转换为 INCONCLUSIVE 结果。
 */
@Getter
public class ExplorationLimitExceededException extends RuntimeException {

    private final int exploredStates;

    public ExplorationLimitExceededException(String message, int exploredStates) {
        super(message);
        this.exploredStates = exploredStates;
    }
}
