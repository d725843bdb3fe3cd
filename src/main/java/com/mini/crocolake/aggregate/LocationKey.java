package com.mini.crocolake.aggregate;

import javax.annotation.Nullable;
import java.util.Objects;

/**
 * 聚合键 (纬度, 经度)
 * 
 * 精确值相等，不做容差或分箱；-0.0 与 0.0 视为同一坐标。
 * 缺测坐标（null 或 NaN）记为 null，所有缺测坐标的行落在同一个键上。
 */
public final class LocationKey {
    
    @Nullable
    private final Double latitude;
    
    @Nullable
    private final Double longitude;
    
    private LocationKey(@Nullable Double latitude, @Nullable Double longitude) {
        this.latitude = latitude;
        this.longitude = longitude;
    }
    
    public static LocationKey of(@Nullable Double latitude, @Nullable Double longitude) {
        return new LocationKey(canonical(latitude), canonical(longitude));
    }
    
    private static Double canonical(@Nullable Double value) {
        if (value == null || value.isNaN()) {
            return null;
        }
        // -0.0 + 0.0 == +0.0
        return value + 0.0;
    }
    
    @Nullable
    public Double getLatitude() {
        return latitude;
    }
    
    @Nullable
    public Double getLongitude() {
        return longitude;
    }
    
    public boolean isComplete() {
        return latitude != null && longitude != null;
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof LocationKey)) return false;
        LocationKey that = (LocationKey) o;
        return Objects.equals(latitude, that.latitude) && Objects.equals(longitude, that.longitude);
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(latitude, longitude);
    }
    
    @Override
    public String toString() {
        return "(" + latitude + ", " + longitude + ")";
    }
}
