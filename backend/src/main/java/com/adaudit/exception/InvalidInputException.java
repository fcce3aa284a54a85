package com.adaudit.exception;

/**
 * 输入文本为空、超出长度上限或商品 ID 未知
 */
public class InvalidInputException extends RuntimeException {

    public InvalidInputException(String message) {
        super(message);
    }
}
