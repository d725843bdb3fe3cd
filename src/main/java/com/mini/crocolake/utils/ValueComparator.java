package com.mini.crocolake.utils;

import java.time.LocalDateTime;

/**
 * 列值比较工具
 * 
 * 数值之间按数值比较：两边都是整数时按 long 比较，否则按 double 比较，
 * 因此 INT 列可以与 1 或 1.0 比较，DOUBLE 列可以与 50 比较。
 * 浮点比较 -0.0 与 0.0 相等；调用方保证不传入 NaN。
 */
public final class ValueComparator {
    
    private ValueComparator() {
    }
    
    /**
     * 比较两个非空值
     * 
     * @throws IllegalArgumentException 两个值不可比较
     */
    public static int compare(Object left, Object right) {
        if (left instanceof Number && right instanceof Number) {
            Number l = (Number) left;
            Number r = (Number) right;
            if (isIntegral(l) && isIntegral(r)) {
                return Long.compare(l.longValue(), r.longValue());
            }
            double a = l.doubleValue();
            double b = r.doubleValue();
            return a < b ? -1 : (a > b ? 1 : 0);
        }
        if (left instanceof LocalDateTime && right instanceof LocalDateTime) {
            return ((LocalDateTime) left).compareTo((LocalDateTime) right);
        }
        if (left instanceof String && right instanceof String) {
            return ((String) left).compareTo((String) right);
        }
        throw new IllegalArgumentException(
            "Cannot compare " + describe(left) + " with " + describe(right));
    }
    
    private static boolean isIntegral(Number number) {
        return number instanceof Integer || number instanceof Long
            || number instanceof Short || number instanceof Byte;
    }
    
    private static String describe(Object value) {
        return value == null ? "null" : value.getClass().getSimpleName() + "(" + value + ")";
    }
}
