package com.mini.crocolake.aggregate;

import com.google.common.collect.Maps;
import com.mini.crocolake.data.Row;
import com.mini.crocolake.data.RowSet;
import com.mini.crocolake.exception.ColumnNotFoundException;
import com.mini.crocolake.schema.Field;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.Set;

/**
 * 按坐标去重聚合
 * 
 * 按 (纬度, 经度) 精确分组，每组输出目标值的算术平均。
 * 缺测值不参与均值计算但计入组成员；组内全部缺测时均值也是缺测，坐标不会被丢弃。
 * 所有坐标都不重复时直接投影，不做分组。
 */
public class SpatialAggregator {
    private static final Logger logger = LoggerFactory.getLogger(SpatialAggregator.class);
    
    private SpatialAggregator() {
    }
    
    /**
     * @param rows 输入行集，不会被修改
     * @param latCol 纬度列
     * @param lonCol 经度列
     * @param targetCol 求均值的目标列
     * @throws ColumnNotFoundException 列不存在
     * @throws IllegalArgumentException 列不是数值类型
     */
    public static AggregatedRowSet aggregateMean(RowSet rows, String latCol, String lonCol, String targetCol) {
        int latIndex = numericColumn(rows, latCol);
        int lonIndex = numericColumn(rows, lonCol);
        int targetIndex = numericColumn(rows, targetCol);
        
        List<LocationKey> keys = new ArrayList<>(rows.size());
        Set<LocationKey> distinct = new HashSet<>();
        for (Row row : rows) {
            LocationKey key = LocationKey.of(row.getDouble(latIndex), row.getDouble(lonIndex));
            keys.add(key);
            distinct.add(key);
        }
        
        List<AggregatedRow> result;
        if (distinct.size() == rows.size()) {
            result = project(rows, keys, targetIndex);
        } else {
            result = groupMean(rows, keys, targetIndex);
        }
        
        logger.info("Aggregated {} rows into {} locations by mean of {}",
                   rows.size(), result.size(), targetCol);
        return new AggregatedRowSet(latCol, lonCol, targetCol, result, rows.size());
    }
    
    /**
     * 坐标全部唯一：每行的目标值就是它所在组的均值
     */
    private static List<AggregatedRow> project(RowSet rows, List<LocationKey> keys, int targetIndex) {
        List<AggregatedRow> result = new ArrayList<>(rows.size());
        for (int i = 0; i < rows.size(); i++) {
            Double value = rows.getRow(i).getDouble(targetIndex);
            OptionalDouble mean = value == null ? OptionalDouble.empty() : OptionalDouble.of(value);
            result.add(new AggregatedRow(keys.get(i), mean, 1, value == null ? 0 : 1));
        }
        return result;
    }
    
    private static List<AggregatedRow> groupMean(RowSet rows, List<LocationKey> keys, int targetIndex) {
        Map<LocationKey, MeanAccumulator> groups = Maps.newLinkedHashMap();
        for (int i = 0; i < rows.size(); i++) {
            groups.computeIfAbsent(keys.get(i), k -> new MeanAccumulator())
                  .add(rows.getRow(i).getDouble(targetIndex));
        }
        
        List<AggregatedRow> result = new ArrayList<>(groups.size());
        for (Map.Entry<LocationKey, MeanAccumulator> entry : groups.entrySet()) {
            MeanAccumulator acc = entry.getValue();
            result.add(new AggregatedRow(entry.getKey(), acc.mean(), acc.rowCount, acc.valueCount));
        }
        return result;
    }
    
    private static int numericColumn(RowSet rows, String columnName) {
        int index = rows.columnIndex(columnName);
        Field field = rows.getSchema().getFields().get(index);
        if (!field.getType().isNumeric()) {
            throw new IllegalArgumentException(
                "Column " + columnName + " is " + field.getType() + ", a numeric column is required");
        }
        return index;
    }
    
    /**
     * 组内均值累加器
     */
    private static class MeanAccumulator {
        double mean = 0.0;
        int rowCount = 0;
        int valueCount = 0;
        
        /**
         * 增量更新均值，避免大数求和溢出；单值组的均值与该值逐位相同
         */
        void add(Double value) {
            rowCount++;
            if (value != null) {
                valueCount++;
                mean = valueCount == 1 ? value : mean + (value - mean) / valueCount;
            }
        }
        
        OptionalDouble mean() {
            return valueCount == 0 ? OptionalDouble.empty() : OptionalDouble.of(mean);
        }
    }
}
