package com.mini.crocolake.schema;

import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;

/**
 * 列的语义类型
 * 
 * 观测数据集只用到少量类型:
 * - DOUBLE: 数值观测 (PRES, TEMP, LATITUDE ...)
 * - INT / BIGINT: 质量控制码等整数标记 (xxx_QC)
 * - STRING: 分类值 (DB_NAME, PLATFORM_NUMBER)
 * - TIMESTAMP: 时间 (JULD)
 */
public abstract class DataType {
    
    public abstract String typeName();
    
    /**
     * 是否为数值类型（可参与数值比较和均值计算）
     */
    public abstract boolean isNumeric();
    
    /**
     * 谓词常量是否可以与该类型的列比较
     */
    public abstract boolean isCompatible(Object value);
    
    /**
     * 解析文件中的单元格文本，空单元格返回 null
     */
    public abstract Object parse(String text);
    
    /**
     * 将值转换为文件中的单元格文本，null 写为空单元格
     */
    public String format(Object value) {
        return value == null ? "" : value.toString();
    }
    
    /**
     * 把 JSON 反序列化得到的宽松值（Integer/Double/String）还原为该类型的值
     */
    public abstract Object normalize(Object value);
    
    public static DataType INT() {
        return IntType.INSTANCE;
    }
    
    public static DataType LONG() {
        return LongType.INSTANCE;
    }
    
    public static DataType DOUBLE() {
        return DoubleType.INSTANCE;
    }
    
    public static DataType STRING() {
        return StringType.INSTANCE;
    }
    
    public static DataType TIMESTAMP() {
        return TimestampType.INSTANCE;
    }
    
    /**
     * 根据类型名获取类型，用于解析分区文件表头
     */
    public static DataType of(String typeName) {
        switch (typeName.trim().toUpperCase()) {
            case "INT":
                return INT();
            case "BIGINT":
            case "LONG":
                return LONG();
            case "DOUBLE":
                return DOUBLE();
            case "STRING":
                return STRING();
            case "TIMESTAMP":
                return TIMESTAMP();
            default:
                throw new IllegalArgumentException("Unsupported data type: " + typeName);
        }
    }
    
    @Override
    public String toString() {
        return typeName();
    }
    
    private static boolean isMissingText(String text) {
        return text == null || text.isEmpty();
    }
    
    /**
     * 整数列只接受整数值，NaN 视为缺测值
     * 
     * @throws IllegalArgumentException 值带小数部分或超出范围
     */
    private static Long integralValue(Number value, long min, long max, String typeName) {
        if (value instanceof Double || value instanceof Float) {
            double d = value.doubleValue();
            if (Double.isNaN(d)) {
                return null;
            }
            if (d != Math.rint(d) || d < min || d > max) {
                throw new IllegalArgumentException("Value " + value + " is not a valid " + typeName);
            }
            return (long) d;
        }
        long l = value.longValue();
        if (l < min || l > max) {
            throw new IllegalArgumentException("Value " + value + " is not a valid " + typeName);
        }
        return l;
    }
    
    public static class IntType extends DataType {
        public static final IntType INSTANCE = new IntType();
        
        private IntType() {}
        
        @Override
        public String typeName() {
            return "INT";
        }
        
        @Override
        public boolean isNumeric() {
            return true;
        }
        
        @Override
        public boolean isCompatible(Object value) {
            return value instanceof Number;
        }
        
        @Override
        public Object parse(String text) {
            if (isMissingText(text)) {
                return null;
            }
            return Integer.parseInt(text.trim());
        }
        
        @Override
        public Object normalize(Object value) {
            if (value == null) {
                return null;
            }
            if (value instanceof Number) {
                Long l = integralValue((Number) value, Integer.MIN_VALUE, Integer.MAX_VALUE, "INT");
                return l == null ? null : l.intValue();
            }
            return parse(value.toString());
        }
    }
    
    public static class LongType extends DataType {
        public static final LongType INSTANCE = new LongType();
        
        private LongType() {}
        
        @Override
        public String typeName() {
            return "BIGINT";
        }
        
        @Override
        public boolean isNumeric() {
            return true;
        }
        
        @Override
        public boolean isCompatible(Object value) {
            return value instanceof Number;
        }
        
        @Override
        public Object parse(String text) {
            if (isMissingText(text)) {
                return null;
            }
            return Long.parseLong(text.trim());
        }
        
        @Override
        public Object normalize(Object value) {
            if (value == null) {
                return null;
            }
            if (value instanceof Number) {
                return integralValue((Number) value, Long.MIN_VALUE, Long.MAX_VALUE, "BIGINT");
            }
            return parse(value.toString());
        }
    }
    
    public static class DoubleType extends DataType {
        public static final DoubleType INSTANCE = new DoubleType();
        
        private DoubleType() {}
        
        @Override
        public String typeName() {
            return "DOUBLE";
        }
        
        @Override
        public boolean isNumeric() {
            return true;
        }
        
        @Override
        public boolean isCompatible(Object value) {
            return value instanceof Number;
        }
        
        /**
         * 空单元格和 NaN 都视为缺测值
         */
        @Override
        public Object parse(String text) {
            if (isMissingText(text)) {
                return null;
            }
            double value = Double.parseDouble(text.trim());
            return Double.isNaN(value) ? null : value;
        }
        
        @Override
        public Object normalize(Object value) {
            if (value == null) {
                return null;
            }
            if (value instanceof Number) {
                double d = ((Number) value).doubleValue();
                return Double.isNaN(d) ? null : d;
            }
            return parse(value.toString());
        }
    }
    
    public static class StringType extends DataType {
        public static final StringType INSTANCE = new StringType();
        
        private StringType() {}
        
        @Override
        public String typeName() {
            return "STRING";
        }
        
        @Override
        public boolean isNumeric() {
            return false;
        }
        
        @Override
        public boolean isCompatible(Object value) {
            return value instanceof String;
        }
        
        @Override
        public Object parse(String text) {
            return isMissingText(text) ? null : text;
        }
        
        @Override
        public Object normalize(Object value) {
            return value == null ? null : value.toString();
        }
    }
    
    public static class TimestampType extends DataType {
        public static final TimestampType INSTANCE = new TimestampType();
        
        private TimestampType() {}
        
        @Override
        public String typeName() {
            return "TIMESTAMP";
        }
        
        @Override
        public boolean isNumeric() {
            return false;
        }
        
        @Override
        public boolean isCompatible(Object value) {
            return value instanceof LocalDateTime;
        }
        
        @Override
        public Object parse(String text) {
            if (isMissingText(text)) {
                return null;
            }
            try {
                return LocalDateTime.parse(text.trim());
            } catch (DateTimeParseException e) {
                throw new IllegalArgumentException("Invalid timestamp: " + text, e);
            }
        }
        
        @Override
        public Object normalize(Object value) {
            if (value == null || value instanceof LocalDateTime) {
                return value;
            }
            return parse(value.toString());
        }
    }
}
