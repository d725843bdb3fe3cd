package com.mini.crocolake.schema;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.mini.crocolake.utils.ValueComparator;

import java.util.Objects;

/**
 * Column Statistics
 * 单个分区文件中某一列的统计信息，用于在读取前跳过整个分区
 * 
 * 统计信息包括:
 * 1. 最小值/最大值 (不含缺测值，用于范围过滤)
 * 2. 缺测值数量
 * 3. 总行数
 */
public class ColumnStatistics {
    
    private final String columnName;
    
    /** 最小值 */
    private final Object minValue;
    
    /** 最大值 */
    private final Object maxValue;
    
    /** 缺测值数量 */
    private final long nullCount;
    
    /** 总行数 */
    private final long rowCount;
    
    @JsonCreator
    public ColumnStatistics(
            @JsonProperty("columnName") String columnName,
            @JsonProperty("minValue") Object minValue,
            @JsonProperty("maxValue") Object maxValue,
            @JsonProperty("nullCount") long nullCount,
            @JsonProperty("rowCount") long rowCount) {
        this.columnName = Objects.requireNonNull(columnName, "Column name cannot be null");
        this.minValue = minValue;
        this.maxValue = maxValue;
        this.nullCount = nullCount;
        this.rowCount = rowCount;
    }
    
    public String getColumnName() {
        return columnName;
    }
    
    public Object getMinValue() {
        return minValue;
    }
    
    public Object getMaxValue() {
        return maxValue;
    }
    
    public long getNullCount() {
        return nullCount;
    }
    
    public long getRowCount() {
        return rowCount;
    }
    
    /**
     * 所有行都是缺测值
     */
    @JsonIgnore
    public boolean isAllNull() {
        return nullCount >= rowCount;
    }
    
    /**
     * JSON 中的 min/max 只保留了宽松类型，按列类型还原
     */
    public ColumnStatistics normalize(DataType dataType) {
        return new ColumnStatistics(
            columnName,
            dataType.normalize(minValue),
            dataType.normalize(maxValue),
            nullCount,
            rowCount);
    }
    
    /**
     * 检查值是否可能在 [min, max] 范围内
     */
    public boolean mightContainValue(Object value) {
        if (value == null) {
            return nullCount > 0;
        }
        
        if (minValue == null || maxValue == null) {
            return !isAllNull(); // 没有统计信息,保守返回 true
        }
        
        try {
            return ValueComparator.compare(value, minValue) >= 0
                && ValueComparator.compare(value, maxValue) <= 0;
        } catch (IllegalArgumentException e) {
            return true; // 类型不匹配,保守返回 true
        }
    }
    
    /**
     * 检查范围是否可能重叠，null 表示该侧无界
     */
    public boolean mightOverlapRange(Object rangeMin, boolean minInclusive,
                                     Object rangeMax, boolean maxInclusive) {
        if (isAllNull()) {
            return false;
        }
        if (minValue == null || maxValue == null) {
            return true;
        }
        
        try {
            if (rangeMin != null) {
                int cmp = ValueComparator.compare(rangeMin, maxValue);
                if (minInclusive ? cmp > 0 : cmp >= 0) {
                    return false;
                }
            }
            if (rangeMax != null) {
                int cmp = ValueComparator.compare(rangeMax, minValue);
                if (maxInclusive ? cmp < 0 : cmp <= 0) {
                    return false;
                }
            }
            return true;
        } catch (IllegalArgumentException e) {
            return true;
        }
    }
    
    /**
     * 是否所有行都取同一个非缺测值
     */
    public boolean isConstant(Object value) {
        if (nullCount > 0 || minValue == null || maxValue == null) {
            return false;
        }
        try {
            return ValueComparator.compare(minValue, value) == 0
                && ValueComparator.compare(maxValue, value) == 0;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ColumnStatistics)) return false;
        ColumnStatistics that = (ColumnStatistics) o;
        return nullCount == that.nullCount &&
               rowCount == that.rowCount &&
               columnName.equals(that.columnName) &&
               Objects.equals(minValue, that.minValue) &&
               Objects.equals(maxValue, that.maxValue);
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(columnName, minValue, maxValue, nullCount, rowCount);
    }
    
    @Override
    public String toString() {
        return String.format(
            "ColumnStatistics{column=%s, min=%s, max=%s, nulls=%d, rows=%d}",
            columnName, minValue, maxValue, nullCount, rowCount
        );
    }
    
    /**
     * 构建器，逐个值累积统计信息
     */
    public static class Builder {
        private final String columnName;
        private Object minValue;
        private Object maxValue;
        private long nullCount = 0;
        private long rowCount = 0;
        
        public Builder(String columnName) {
            this.columnName = columnName;
        }
        
        public Builder update(Object value) {
            rowCount++;
            if (value == null) {
                nullCount++;
                return this;
            }
            if (minValue == null || ValueComparator.compare(value, minValue) < 0) {
                minValue = value;
            }
            if (maxValue == null || ValueComparator.compare(value, maxValue) > 0) {
                maxValue = value;
            }
            return this;
        }
        
        public ColumnStatistics build() {
            return new ColumnStatistics(columnName, minValue, maxValue, nullCount, rowCount);
        }
    }
}
