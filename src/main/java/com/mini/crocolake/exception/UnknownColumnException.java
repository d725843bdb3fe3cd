package com.mini.crocolake.exception;

/**
 * 谓词或列选择引用了不在可用列集合中的列
 */
public class UnknownColumnException extends MiniLakeException {
    
    private final String columnName;
    
    public UnknownColumnException(String columnName, String message) {
        super(message);
        this.columnName = columnName;
    }
    
    public String getColumnName() {
        return columnName;
    }
}
