package com.trendradar.exception;

/**
 * 配置错误：配置缺失或无法解析。
 */
public class ConfigException extends TrendRadarException {

    public ConfigException(String message) {
        super(message);
    }

    public ConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
