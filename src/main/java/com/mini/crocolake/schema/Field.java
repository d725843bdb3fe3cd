package com.mini.crocolake.schema;

import java.util.Objects;

/**
 * 字段定义类
 * 表示数据集中的一个列
 */
public class Field {
    /** 字段名 */
    private final String name;
    
    /** 字段类型 */
    private final DataType type;

    public Field(String name, DataType type) {
        this.name = Objects.requireNonNull(name, "Field name cannot be null");
        this.type = Objects.requireNonNull(type, "Field type cannot be null");
    }

    public String getName() {
        return name;
    }

    public DataType getType() {
        return type;
    }
    
    /**
     * 解析 "NAME:TYPE" 形式的表头单元
     */
    public static Field parse(String headerCell) {
        int sep = headerCell.lastIndexOf(':');
        if (sep <= 0 || sep == headerCell.length() - 1) {
            throw new IllegalArgumentException("Invalid column header, expected NAME:TYPE but got: " + headerCell);
        }
        return new Field(headerCell.substring(0, sep).trim(), DataType.of(headerCell.substring(sep + 1)));
    }
    
    /**
     * 转换为 "NAME:TYPE" 形式的表头单元
     */
    public String toHeader() {
        return name + ":" + type.typeName();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Field field = (Field) o;
        return name.equals(field.name) && type.typeName().equals(field.type.typeName());
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, type.typeName());
    }

    @Override
    public String toString() {
        return "Field{" +
                "name='" + name + '\'' +
                ", type=" + type +
                '}';
    }
}
