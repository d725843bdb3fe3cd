package com.mini.crocolake.aggregate;

import com.mini.crocolake.data.Row;
import com.mini.crocolake.data.RowSet;
import com.mini.crocolake.schema.DataType;
import com.mini.crocolake.schema.Field;
import com.mini.crocolake.schema.Schema;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/**
 * 按坐标聚合后的结果，每个不同坐标一行，按坐标首次出现的顺序排列
 */
public class AggregatedRowSet implements Iterable<AggregatedRow> {
    
    private final String latitudeColumn;
    private final String longitudeColumn;
    private final String targetColumn;
    private final List<AggregatedRow> rows;
    
    /** 输入行数 */
    private final int inputRowCount;
    
    AggregatedRowSet(String latitudeColumn, String longitudeColumn, String targetColumn,
                     List<AggregatedRow> rows, int inputRowCount) {
        this.latitudeColumn = latitudeColumn;
        this.longitudeColumn = longitudeColumn;
        this.targetColumn = targetColumn;
        this.rows = Collections.unmodifiableList(new ArrayList<>(rows));
        this.inputRowCount = inputRowCount;
    }
    
    public String getLatitudeColumn() {
        return latitudeColumn;
    }
    
    public String getLongitudeColumn() {
        return longitudeColumn;
    }
    
    public String getTargetColumn() {
        return targetColumn;
    }
    
    public List<AggregatedRow> getRows() {
        return rows;
    }
    
    public int size() {
        return rows.size();
    }
    
    public boolean isEmpty() {
        return rows.isEmpty();
    }
    
    public int getInputRowCount() {
        return inputRowCount;
    }
    
    /**
     * 是否有重复坐标被合并
     */
    public boolean isDeduplicated() {
        return rows.size() < inputRowCount;
    }
    
    /**
     * 查找坐标对应的聚合行，不存在返回 null
     */
    @Nullable
    public AggregatedRow get(LocationKey location) {
        for (AggregatedRow row : rows) {
            if (row.getLocation().equals(location)) {
                return row;
            }
        }
        return null;
    }
    
    /**
     * 转换为 (纬度, 经度, 目标值) 三列的行集，缺测值为 null
     */
    public RowSet toRowSet() {
        Schema schema = new Schema(Arrays.asList(
            new Field(latitudeColumn, DataType.DOUBLE()),
            new Field(longitudeColumn, DataType.DOUBLE()),
            new Field(targetColumn, DataType.DOUBLE())));
        
        List<Row> result = new ArrayList<>(rows.size());
        for (AggregatedRow row : rows) {
            Double value = row.getValue().isPresent() ? row.getValue().getAsDouble() : null;
            result.add(Row.of(row.getLatitude(), row.getLongitude(), value));
        }
        return new RowSet(schema, result);
    }
    
    @Override
    public Iterator<AggregatedRow> iterator() {
        return rows.iterator();
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AggregatedRowSet)) return false;
        AggregatedRowSet that = (AggregatedRowSet) o;
        return latitudeColumn.equals(that.latitudeColumn)
            && longitudeColumn.equals(that.longitudeColumn)
            && targetColumn.equals(that.targetColumn)
            && rows.equals(that.rows);
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(latitudeColumn, longitudeColumn, targetColumn, rows);
    }
    
    @Override
    public String toString() {
        return "AggregatedRowSet{" +
                "target=" + targetColumn +
                ", locations=" + rows.size() +
                ", inputRows=" + inputRowCount +
                '}';
    }
}
