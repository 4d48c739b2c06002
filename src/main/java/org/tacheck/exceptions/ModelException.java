package org.tacheck.exceptions;

/**
 * 模型结构错误：悬空位置、未声明的时钟、初始位置缺失或重复、输入输出字母表重叠、
 * 查询引用了不存在的组件等。抛出后终止加载或当前查询的求值。
 */
public class ModelException extends RuntimeException {

    public ModelException(String message) {
        super(message);
    }

    public ModelException(String message, Throwable cause) {
        super(message, cause);
    }
}
