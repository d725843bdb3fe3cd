package com.mini.crocolake.exception;

/**
 * 分区文件之间的列定义不一致
 */
public class SchemaMismatchException extends MiniLakeException {
    
    public SchemaMismatchException(String message) {
        super(message);
    }
    
    public SchemaMismatchException(String message, Throwable cause) {
        super(message, cause);
    }
}
