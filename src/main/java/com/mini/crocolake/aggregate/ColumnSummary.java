package com.mini.crocolake.aggregate;

import com.mini.crocolake.data.Row;
import com.mini.crocolake.data.RowSet;
import com.mini.crocolake.schema.Field;

import java.util.Arrays;
import java.util.OptionalDouble;

/**
 * 数值列的摘要统计：个数、缺测数、最小值、最大值、中位数、均值和百分位数
 * 
 * 缺测值不参与统计。百分位数按中点插值定义：
 * 第 i 个有序值（从 1 开始）对应百分位 100 * (i - 0.5) / n，两点之间线性插值，
 * 超出两端时取最小值或最大值。
 */
public final class ColumnSummary {
    
    private final String columnName;
    
    /** 升序排列的非缺测值 */
    private final double[] sorted;
    
    private final int missingCount;
    
    private ColumnSummary(String columnName, double[] sorted, int missingCount) {
        this.columnName = columnName;
        this.sorted = sorted;
        this.missingCount = missingCount;
    }
    
    /**
     * 统计行集中的一个数值列
     * 
     * @throws com.mini.crocolake.exception.ColumnNotFoundException 列不存在
     * @throws IllegalArgumentException 列不是数值类型
     */
    public static ColumnSummary of(RowSet rows, String columnName) {
        int index = rows.columnIndex(columnName);
        Field field = rows.getSchema().getFields().get(index);
        if (!field.getType().isNumeric()) {
            throw new IllegalArgumentException(
                "Column " + columnName + " is " + field.getType() + ", a numeric column is required");
        }
        
        double[] values = new double[rows.size()];
        int count = 0;
        for (Row row : rows) {
            Double value = row.getDouble(index);
            if (value != null) {
                values[count++] = value;
            }
        }
        return create(columnName, values, count, rows.size() - count);
    }
    
    /**
     * 统计聚合结果中的目标值
     */
    public static ColumnSummary of(AggregatedRowSet aggregated) {
        double[] values = new double[aggregated.size()];
        int count = 0;
        for (AggregatedRow row : aggregated) {
            if (row.getValue().isPresent()) {
                values[count++] = row.getValue().getAsDouble();
            }
        }
        return create(aggregated.getTargetColumn(), values, count, aggregated.size() - count);
    }
    
    private static ColumnSummary create(String columnName, double[] values, int count, int missing) {
        double[] sorted = Arrays.copyOf(values, count);
        Arrays.sort(sorted);
        return new ColumnSummary(columnName, sorted, missing);
    }
    
    public String getColumnName() {
        return columnName;
    }
    
    public int getCount() {
        return sorted.length;
    }
    
    public int getMissingCount() {
        return missingCount;
    }
    
    public boolean isEmpty() {
        return sorted.length == 0;
    }
    
    public OptionalDouble min() {
        return isEmpty() ? OptionalDouble.empty() : OptionalDouble.of(sorted[0]);
    }
    
    public OptionalDouble max() {
        return isEmpty() ? OptionalDouble.empty() : OptionalDouble.of(sorted[sorted.length - 1]);
    }
    
    public OptionalDouble mean() {
        if (isEmpty()) {
            return OptionalDouble.empty();
        }
        double sum = 0.0;
        for (double value : sorted) {
            sum += value;
        }
        return OptionalDouble.of(sum / sorted.length);
    }
    
    public OptionalDouble median() {
        return percentile(50.0);
    }
    
    /**
     * @param p 百分位，取值 [0, 100]
     */
    public OptionalDouble percentile(double p) {
        if (p < 0.0 || p > 100.0 || Double.isNaN(p)) {
            throw new IllegalArgumentException("Percentile must be in [0, 100]: " + p);
        }
        if (isEmpty()) {
            return OptionalDouble.empty();
        }
        
        int n = sorted.length;
        // 1-based 位置
        double position = n * p / 100.0 + 0.5;
        if (position <= 1.0) {
            return OptionalDouble.of(sorted[0]);
        }
        if (position >= n) {
            return OptionalDouble.of(sorted[n - 1]);
        }
        int lower = (int) Math.floor(position);
        double fraction = position - lower;
        double low = sorted[lower - 1];
        double high = sorted[lower];
        return OptionalDouble.of(low + fraction * (high - low));
    }
    
    @Override
    public String toString() {
        return "ColumnSummary{" +
                "column=" + columnName +
                ", count=" + getCount() +
                ", missing=" + missingCount +
                ", min=" + format(min()) +
                ", max=" + format(max()) +
                ", median=" + format(median()) +
                '}';
    }
    
    private static String format(OptionalDouble value) {
        return value.isPresent() ? String.valueOf(value.getAsDouble()) : "n/a";
    }
}
