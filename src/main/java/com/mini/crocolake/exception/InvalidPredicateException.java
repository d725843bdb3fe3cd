package com.mini.crocolake.exception;

/**
 * 谓词常量类型与列类型不匹配
 */
public class InvalidPredicateException extends MiniLakeException {
    
    public InvalidPredicateException(String message) {
        super(message);
    }
}
