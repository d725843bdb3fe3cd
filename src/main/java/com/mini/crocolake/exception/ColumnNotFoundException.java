package com.mini.crocolake.exception;

/**
 * 聚合时引用的列不在行集的 Schema 中
 */
public class ColumnNotFoundException extends MiniLakeException {
    
    private final String columnName;
    
    public ColumnNotFoundException(String columnName) {
        super("Column not found: " + columnName);
        this.columnName = columnName;
    }
    
    public String getColumnName() {
        return columnName;
    }
}
