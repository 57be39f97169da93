package com.trendradar.exception;

import java.util.List;

/**
 * 数据验证错误：配置值形状正确但取值非法。
 */
public class ValidationException extends TrendRadarException {
    private final List<String> problems;

    public ValidationException(List<String> problems) {
        super("invalid configuration: " + String.join("; ", problems == null ? List.of() : problems));
        this.problems = problems == null ? List.of() : List.copyOf(problems);
    }

    public List<String> problems() {
        return problems;
    }
}
