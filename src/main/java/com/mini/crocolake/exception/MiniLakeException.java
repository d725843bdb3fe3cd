package com.mini.crocolake.exception;

/**
 * Mini CrocoLake 基础异常类
 */
public class MiniLakeException extends RuntimeException {
    
    public MiniLakeException(String message) {
        super(message);
    }
    
    public MiniLakeException(String message, Throwable cause) {
        super(message, cause);
    }
}
