package org.tacheck.exceptions;

import lombok.Getter;

/**
 * 查询文本无法解析。携带出错位置 (从 0 开始的字符偏移)。
 */
@Getter
public class QueryParseException extends RuntimeException {

    private final int position;

    public QueryParseException(String message, int position) {
        super(message + " (at position " + position + ")");
        this.position = position;
    }
}
