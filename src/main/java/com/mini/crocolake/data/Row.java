package com.mini.crocolake.data;

import com.mini.crocolake.schema.Field;
import com.mini.crocolake.schema.Schema;

import java.util.Arrays;
import java.util.List;

/**
 * 数据行
 * 表示一行数据，值顺序与所属 Schema 的列顺序一致，null 表示缺测值
 */
public class Row {
    /** 字段值数组 */
    private final Object[] values;

    public Row(Object[] values) {
        this.values = values != null ? values.clone() : new Object[0];
    }
    
    public static Row of(Object... values) {
        return new Row(values);
    }

    /**
     * 获取字段值数组
     * 
     * @return 字段值数组的副本
     */
    public Object[] getValues() {
        return values.clone();
    }

    /**
     * 获取指定索引的字段值
     */
    public Object getValue(int index) {
        if (index < 0 || index >= values.length) {
            return null;
        }
        return values[index];
    }
    
    /**
     * 获取指定索引的数值，缺测值（null 或 NaN）返回 null
     */
    public Double getDouble(int index) {
        Object value = getValue(index);
        if (!(value instanceof Number)) {
            return null;
        }
        double d = ((Number) value).doubleValue();
        return Double.isNaN(d) ? null : d;
    }

    public int getFieldCount() {
        return values.length;
    }
    
    /**
     * 按列索引投影出新行
     */
    public Row project(int[] indices) {
        Object[] projected = new Object[indices.length];
        for (int i = 0; i < indices.length; i++) {
            projected[i] = values[indices[i]];
        }
        return new Row(projected);
    }

    /**
     * 验证行数据与Schema的兼容性
     * 
     * @throws IllegalArgumentException 如果数据不兼容
     */
    public void validate(Schema schema) {
        List<Field> fields = schema.getFields();
        if (values.length != fields.size()) {
            throw new IllegalArgumentException(
                    "Row field count mismatch. Expected: " + fields.size() + ", Actual: " + values.length);
        }

        for (int i = 0; i < fields.size(); i++) {
            Field field = fields.get(i);
            Object value = values[i];
            if (value != null && !field.getType().isCompatible(value)) {
                throw new IllegalArgumentException(
                        "Field '" + field.getName() + "' type mismatch. Expected: " + 
                        field.getType() + ", Actual: " + value.getClass().getSimpleName());
            }
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Row row = (Row) o;
        return Arrays.equals(values, row.values);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return "Row{" + "values=" + Arrays.toString(values) + '}';
    }
}
