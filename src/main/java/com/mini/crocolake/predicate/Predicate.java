package com.mini.crocolake.predicate;

import com.mini.crocolake.data.Row;
import com.mini.crocolake.exception.InvalidPredicateException;
import com.mini.crocolake.exception.UnknownColumnException;
import com.mini.crocolake.schema.ColumnStatistics;
import com.mini.crocolake.schema.DataType;
import com.mini.crocolake.schema.Field;
import com.mini.crocolake.schema.Schema;
import com.mini.crocolake.utils.ValueComparator;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Predicate
 * 行过滤条件：单列与常量的比较，或用 AND / OR 组合的谓词树
 * 
 * 缺测值（null 或 NaN）与任何常量比较都不成立，只有 NE 成立。
 */
public abstract class Predicate {
    
    /**
     * 测试行是否满足条件
     * 
     * @param row 行数据
     * @param schema 行对应的 Schema
     */
    public abstract boolean test(Row row, Schema schema);
    
    /**
     * 根据分区的列统计信息判断分区内是否可能有行满足条件
     * 缺少某列的统计信息时保守返回 true
     */
    public abstract boolean mightMatch(Map<String, ColumnStatistics> statistics);
    
    /**
     * 收集谓词引用的全部列名
     */
    public abstract void collectFieldNames(Set<String> fieldNames);
    
    /**
     * 检查谓词是否能作用于给定 Schema
     * 
     * @throws UnknownColumnException 引用了 Schema 中不存在的列
     * @throws InvalidPredicateException 常量类型与列类型不匹配
     */
    public abstract void validate(Schema schema);
    
    public Set<String> referencedFields() {
        Set<String> names = new LinkedHashSet<>();
        collectFieldNames(names);
        return names;
    }
    
    /**
     * AND 组合
     */
    public Predicate and(Predicate other) {
        return new AndPredicate(this, other);
    }
    
    /**
     * OR 组合
     */
    public Predicate or(Predicate other) {
        return new OrPredicate(this, other);
    }
    
    /**
     * 比较操作符
     */
    public enum CompareOp {
        EQ("=="),
        NE("!="),
        GT(">"),
        GE(">="),
        LT("<"),
        LE("<=");
        
        private final String symbol;
        
        CompareOp(String symbol) {
            this.symbol = symbol;
        }
        
        public String symbol() {
            return symbol;
        }
        
        boolean accept(int cmp) {
            switch (this) {
                case EQ: return cmp == 0;
                case NE: return cmp != 0;
                case GT: return cmp > 0;
                case GE: return cmp >= 0;
                case LT: return cmp < 0;
                case LE: return cmp <= 0;
                default: throw new IllegalArgumentException("Unsupported operator: " + this);
            }
        }
    }
    
    /**
     * 字段比较谓词
     */
    public static class FieldPredicate extends Predicate {
        private final String fieldName;
        private final CompareOp op;
        private final Object value;
        
        public FieldPredicate(String fieldName, CompareOp op, Object value) {
            this.fieldName = Objects.requireNonNull(fieldName, "Field name cannot be null");
            this.op = Objects.requireNonNull(op, "Operator cannot be null");
            this.value = value;
        }
        
        public String getFieldName() {
            return fieldName;
        }
        
        public CompareOp getOp() {
            return op;
        }
        
        public Object getValue() {
            return value;
        }
        
        @Override
        public boolean test(Row row, Schema schema) {
            int fieldIndex = schema.getFieldIndex(fieldName);
            if (fieldIndex == -1) {
                throw new UnknownColumnException(fieldName, "Field not found: " + fieldName);
            }
            
            Object fieldValue = row.getValue(fieldIndex);
            if (isMissing(fieldValue)) {
                return op == CompareOp.NE;
            }
            
            return op.accept(ValueComparator.compare(fieldValue, value));
        }
        
        @Override
        public boolean mightMatch(Map<String, ColumnStatistics> statistics) {
            ColumnStatistics stats = statistics.get(fieldName);
            if (stats == null) {
                return true;
            }
            if (stats.getRowCount() == 0) {
                return false;
            }
            
            switch (op) {
                case EQ:
                    return stats.mightContainValue(value);
                case NE:
                    return !stats.isConstant(value);
                case GT:
                    return stats.mightOverlapRange(value, false, null, false);
                case GE:
                    return stats.mightOverlapRange(value, true, null, false);
                case LT:
                    return stats.mightOverlapRange(null, false, value, false);
                case LE:
                    return stats.mightOverlapRange(null, false, value, true);
                default:
                    return true;
            }
        }
        
        @Override
        public void collectFieldNames(Set<String> fieldNames) {
            fieldNames.add(fieldName);
        }
        
        @Override
        public void validate(Schema schema) {
            Field field = schema.getField(fieldName);
            if (field == null) {
                throw new UnknownColumnException(fieldName,
                    "Predicate references column '" + fieldName + "' which is not selected");
            }
            if (value == null) {
                throw new InvalidPredicateException(
                    "Predicate on '" + fieldName + "' compares against null");
            }
            DataType type = field.getType();
            if (!type.isCompatible(value) || isMissing(value)) {
                throw new InvalidPredicateException(String.format(
                    "Cannot compare %s column '%s' with %s value %s",
                    type, fieldName, value.getClass().getSimpleName(), value));
            }
        }
        
        private static boolean isMissing(Object value) {
            if (value == null) {
                return true;
            }
            return (value instanceof Double && ((Double) value).isNaN())
                || (value instanceof Float && ((Float) value).isNaN());
        }
        
        @Override
        public String toString() {
            return fieldName + " " + op.symbol() + " " + value;
        }
    }
    
    /**
     * AND 谓词
     */
    public static class AndPredicate extends Predicate {
        private final Predicate left;
        private final Predicate right;
        
        public AndPredicate(Predicate left, Predicate right) {
            this.left = Objects.requireNonNull(left);
            this.right = Objects.requireNonNull(right);
        }
        
        @Override
        public boolean test(Row row, Schema schema) {
            return left.test(row, schema) && right.test(row, schema);
        }
        
        @Override
        public boolean mightMatch(Map<String, ColumnStatistics> statistics) {
            return left.mightMatch(statistics) && right.mightMatch(statistics);
        }
        
        @Override
        public void collectFieldNames(Set<String> fieldNames) {
            left.collectFieldNames(fieldNames);
            right.collectFieldNames(fieldNames);
        }
        
        @Override
        public void validate(Schema schema) {
            left.validate(schema);
            right.validate(schema);
        }
        
        @Override
        public String toString() {
            return "(" + left + " AND " + right + ")";
        }
    }
    
    /**
     * OR 谓词
     */
    public static class OrPredicate extends Predicate {
        private final Predicate left;
        private final Predicate right;
        
        public OrPredicate(Predicate left, Predicate right) {
            this.left = Objects.requireNonNull(left);
            this.right = Objects.requireNonNull(right);
        }
        
        @Override
        public boolean test(Row row, Schema schema) {
            return left.test(row, schema) || right.test(row, schema);
        }
        
        @Override
        public boolean mightMatch(Map<String, ColumnStatistics> statistics) {
            return left.mightMatch(statistics) || right.mightMatch(statistics);
        }
        
        @Override
        public void collectFieldNames(Set<String> fieldNames) {
            left.collectFieldNames(fieldNames);
            right.collectFieldNames(fieldNames);
        }
        
        @Override
        public void validate(Schema schema) {
            left.validate(schema);
            right.validate(schema);
        }
        
        @Override
        public String toString() {
            return "(" + left + " OR " + right + ")";
        }
    }
    
    public static Predicate equal(String field, Object value) {
        return new FieldPredicate(field, CompareOp.EQ, value);
    }
    
    public static Predicate notEqual(String field, Object value) {
        return new FieldPredicate(field, CompareOp.NE, value);
    }
    
    public static Predicate greaterThan(String field, Object value) {
        return new FieldPredicate(field, CompareOp.GT, value);
    }
    
    public static Predicate greaterOrEqual(String field, Object value) {
        return new FieldPredicate(field, CompareOp.GE, value);
    }
    
    public static Predicate lessThan(String field, Object value) {
        return new FieldPredicate(field, CompareOp.LT, value);
    }
    
    public static Predicate lessOrEqual(String field, Object value) {
        return new FieldPredicate(field, CompareOp.LE, value);
    }
    
    /**
     * 闭区间 [lower, upper]
     */
    public static Predicate between(String field, Object lower, Object upper) {
        return greaterOrEqual(field, lower).and(lessOrEqual(field, upper));
    }
    
    /**
     * 把多个谓词用 AND 连接
     */
    public static Predicate allOf(Predicate... predicates) {
        return combine(Arrays.asList(predicates), true);
    }
    
    /**
     * 把多个谓词用 OR 连接
     */
    public static Predicate anyOf(Predicate... predicates) {
        return combine(Arrays.asList(predicates), false);
    }
    
    private static Predicate combine(List<Predicate> predicates, boolean conjunction) {
        if (predicates.isEmpty()) {
            throw new IllegalArgumentException("At least one predicate is required");
        }
        Predicate result = predicates.get(0);
        for (Predicate next : predicates.subList(1, predicates.size())) {
            result = conjunction ? result.and(next) : result.or(next);
        }
        return result;
    }
}
