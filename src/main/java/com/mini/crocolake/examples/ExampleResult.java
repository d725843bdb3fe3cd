package com.mini.crocolake.examples;

import com.mini.crocolake.aggregate.AggregatedRowSet;
import com.mini.crocolake.aggregate.ColumnSummary;
import com.mini.crocolake.data.RowSet;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 示例管线的运行结果
 */
public class ExampleResult {
    
    private final RowSet rows;
    private final AggregatedRowSet aggregated;
    private final ColumnSummary summary;
    private final Map<String, ColumnSummary> summariesBySource;
    private final long parallelReadMillis;
    private final long serialReadMillis;
    
    public ExampleResult(RowSet rows, AggregatedRowSet aggregated, ColumnSummary summary,
                         Map<String, ColumnSummary> summariesBySource,
                         long parallelReadMillis, long serialReadMillis) {
        this.rows = rows;
        this.aggregated = aggregated;
        this.summary = summary;
        this.summariesBySource = Collections.unmodifiableMap(new LinkedHashMap<>(summariesBySource));
        this.parallelReadMillis = parallelReadMillis;
        this.serialReadMillis = serialReadMillis;
    }
    
    /** 过滤后读入内存的行 */
    public RowSet getRows() {
        return rows;
    }
    
    /** 按坐标去重后的目标值 */
    public AggregatedRowSet getAggregated() {
        return aggregated;
    }
    
    /** 读入行中目标列的摘要 */
    public ColumnSummary getSummary() {
        return summary;
    }
    
    /** 按数据来源（DB_NAME）拆分的摘要，单一来源的数据库为空 */
    public Map<String, ColumnSummary> getSummariesBySource() {
        return summariesBySource;
    }
    
    /** 并行读取耗时，未执行时为 -1 */
    public long getParallelReadMillis() {
        return parallelReadMillis;
    }
    
    /** 串行读取耗时，未执行时为 -1 */
    public long getSerialReadMillis() {
        return serialReadMillis;
    }
}
