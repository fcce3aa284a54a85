package com.adaudit.exception;

/**
 * 规则表或商品配置无法加载；启动阶段抛出，阻止应用以残缺规则表提供服务
 */
public class RuleTableLoadException extends RuntimeException {

    public RuleTableLoadException(String message) {
        super(message);
    }

    public RuleTableLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
