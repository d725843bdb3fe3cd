package com.mini.crocolake.schema;

import com.mini.crocolake.exception.UnknownColumnException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Schema 类
 * 表示数据集的列定义（列名 -> 语义类型），列顺序有意义
 */
public class Schema {
    
    /** 字段列表 */
    private final List<Field> fields;

    public Schema(List<Field> fields) {
        this.fields = new ArrayList<>(Objects.requireNonNull(fields, "Fields cannot be null"));
        validate();
    }

    /**
     * 验证Schema的有效性
     */
    private void validate() {
        if (fields.isEmpty()) {
            throw new IllegalArgumentException("Schema must have at least one field");
        }
        
        Set<String> names = new HashSet<>();
        for (Field field : fields) {
            if (!names.add(field.getName())) {
                throw new IllegalArgumentException("Duplicate field name: " + field.getName());
            }
        }
    }

    public List<Field> getFields() {
        return Collections.unmodifiableList(fields);
    }
    
    public List<String> getFieldNames() {
        return fields.stream()
                .map(Field::getName)
                .collect(Collectors.toList());
    }
    
    public int getFieldCount() {
        return fields.size();
    }

    /**
     * 根据字段名获取字段，不存在返回 null
     */
    public Field getField(String name) {
        return fields.stream()
                .filter(f -> f.getName().equals(name))
                .findFirst()
                .orElse(null);
    }

    /**
     * 获取字段索引，不存在返回 -1
     */
    public int getFieldIndex(String name) {
        for (int i = 0; i < fields.size(); i++) {
            if (fields.get(i).getName().equals(name)) {
                return i;
            }
        }
        return -1;
    }
    
    public boolean contains(String name) {
        return getFieldIndex(name) >= 0;
    }

    /**
     * 按给定列名顺序投影出新的 Schema
     * 
     * @throws UnknownColumnException 列名不存在
     */
    public Schema project(List<String> names) {
        List<Field> projected = new ArrayList<>(names.size());
        for (String name : names) {
            Field field = getField(name);
            if (field == null) {
                throw new UnknownColumnException(name, "Column not found in schema: " + name);
            }
            projected.add(field);
        }
        return new Schema(projected);
    }
    
    /**
     * 两个 Schema 是否声明了相同的列集合（列名和类型一致，顺序可以不同）
     */
    public boolean hasSameColumns(Schema other) {
        return fields.size() == other.fields.size()
                && new HashSet<>(fields).equals(new HashSet<>(other.fields));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Schema schema = (Schema) o;
        return fields.equals(schema.fields);
    }

    @Override
    public int hashCode() {
        return Objects.hash(fields);
    }

    @Override
    public String toString() {
        return "Schema{" +
                "fields=" + fields +
                '}';
    }
}
