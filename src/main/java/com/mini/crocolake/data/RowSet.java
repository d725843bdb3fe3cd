package com.mini.crocolake.data;

import com.mini.crocolake.exception.ColumnNotFoundException;
import com.mini.crocolake.predicate.Predicate;
import com.mini.crocolake.schema.Schema;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * 内存中的行集
 * 物化读取的结果，创建后不可修改
 */
public class RowSet implements Iterable<Row> {
    
    private final Schema schema;
    private final List<Row> rows;
    
    public RowSet(Schema schema, List<Row> rows) {
        this.schema = Objects.requireNonNull(schema, "Schema cannot be null");
        this.rows = Collections.unmodifiableList(new ArrayList<>(Objects.requireNonNull(rows, "Rows cannot be null")));
    }
    
    public static RowSet empty(Schema schema) {
        return new RowSet(schema, Collections.emptyList());
    }
    
    public Schema getSchema() {
        return schema;
    }
    
    public List<Row> getRows() {
        return rows;
    }
    
    public Row getRow(int index) {
        return rows.get(index);
    }
    
    public int size() {
        return rows.size();
    }
    
    public boolean isEmpty() {
        return rows.isEmpty();
    }
    
    /**
     * 获取列索引
     * 
     * @throws ColumnNotFoundException 列不存在
     */
    public int columnIndex(String columnName) {
        int index = schema.getFieldIndex(columnName);
        if (index < 0) {
            throw new ColumnNotFoundException(columnName);
        }
        return index;
    }
    
    /**
     * 获取一列的全部值（保持行顺序，缺测值为 null）
     */
    public List<Object> column(String columnName) {
        int index = columnIndex(columnName);
        List<Object> values = new ArrayList<>(rows.size());
        for (Row row : rows) {
            values.add(row.getValue(index));
        }
        return values;
    }
    
    /**
     * 一列中出现过的不同非缺测值，按首次出现顺序
     */
    public Set<Object> distinctValues(String columnName) {
        int index = columnIndex(columnName);
        Set<Object> values = new LinkedHashSet<>();
        for (Row row : rows) {
            Object value = row.getValue(index);
            if (value != null) {
                values.add(value);
            }
        }
        return values;
    }
    
    /**
     * 在内存中筛选满足谓词的行，返回新行集
     */
    public RowSet where(Predicate predicate) {
        predicate.validate(schema);
        List<Row> selected = new ArrayList<>();
        for (Row row : rows) {
            if (predicate.test(row, schema)) {
                selected.add(row);
            }
        }
        return new RowSet(schema, selected);
    }
    
    /**
     * 投影到给定列，返回新行集
     */
    public RowSet project(List<String> columnNames) {
        int[] indices = new int[columnNames.size()];
        for (int i = 0; i < indices.length; i++) {
            indices[i] = columnIndex(columnNames.get(i));
        }
        List<Row> projected = new ArrayList<>(rows.size());
        for (Row row : rows) {
            projected.add(row.project(indices));
        }
        return new RowSet(schema.project(columnNames), projected);
    }
    
    @Override
    public Iterator<Row> iterator() {
        return rows.iterator();
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RowSet)) return false;
        RowSet that = (RowSet) o;
        return schema.equals(that.schema) && rows.equals(that.rows);
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(schema, rows);
    }
    
    @Override
    public String toString() {
        return "RowSet{" +
                "columns=" + schema.getFieldNames() +
                ", rows=" + rows.size() +
                '}';
    }
}
