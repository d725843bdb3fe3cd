package com.mini.crocolake.aggregate;

import javax.annotation.Nullable;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * 聚合结果行：一个坐标及其目标值的均值
 */
public final class AggregatedRow {
    
    private final LocationKey location;
    
    /** 均值，组内全部为缺测值时为空 */
    private final OptionalDouble value;
    
    /** 组内行数（含缺测值行） */
    private final int rowCount;
    
    /** 参与均值计算的行数 */
    private final int valueCount;
    
    public AggregatedRow(LocationKey location, OptionalDouble value, int rowCount, int valueCount) {
        this.location = Objects.requireNonNull(location, "Location cannot be null");
        this.value = Objects.requireNonNull(value, "Value cannot be null");
        this.rowCount = rowCount;
        this.valueCount = valueCount;
    }
    
    public LocationKey getLocation() {
        return location;
    }
    
    @Nullable
    public Double getLatitude() {
        return location.getLatitude();
    }
    
    @Nullable
    public Double getLongitude() {
        return location.getLongitude();
    }
    
    public OptionalDouble getValue() {
        return value;
    }
    
    public boolean isMissing() {
        return !value.isPresent();
    }
    
    public int getRowCount() {
        return rowCount;
    }
    
    public int getValueCount() {
        return valueCount;
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AggregatedRow)) return false;
        AggregatedRow that = (AggregatedRow) o;
        return rowCount == that.rowCount
            && valueCount == that.valueCount
            && location.equals(that.location)
            && value.equals(that.value);
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(location, value, rowCount, valueCount);
    }
    
    @Override
    public String toString() {
        return "AggregatedRow{" +
                "location=" + location +
                ", value=" + (value.isPresent() ? String.valueOf(value.getAsDouble()) : "missing") +
                ", rows=" + rowCount +
                '}';
    }
}
