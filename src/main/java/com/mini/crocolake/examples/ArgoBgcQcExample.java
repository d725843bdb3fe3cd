package com.mini.crocolake.examples;

import com.mini.crocolake.aggregate.AggregatedRowSet;
import com.mini.crocolake.aggregate.ColumnSummary;
import com.mini.crocolake.aggregate.SpatialAggregator;
import com.mini.crocolake.catalog.DatabaseCodename;
import com.mini.crocolake.catalog.LakeDatabase;
import com.mini.crocolake.data.RowSet;
import com.mini.crocolake.predicate.Predicate;
import com.mini.crocolake.read.DatasetHandle;
import com.mini.crocolake.read.DatasetReader;
import com.mini.crocolake.read.ReadOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Argo BGC 质控数据示例
 * 
 * 读取 2023 年内 50 dbar 以浅、溶解氧质控码为 1 的观测，
 * 按坐标求溶解氧均值，并输出最小值、最大值和中位数。
 */
public class ArgoBgcQcExample {
    private static final Logger logger = LoggerFactory.getLogger(ArgoBgcQcExample.class);
    
    static final String TARGET = "DOXY";
    
    static final List<String> COLUMNS = Arrays.asList(
        "PLATFORM_NUMBER",
        "LATITUDE",
        "LONGITUDE",
        "JULD",
        "PRES",
        "TEMP",
        "DOXY",
        "DOXY_QC"
    );
    
    static Predicate filter() {
        Predicate pres = Predicate.lessOrEqual("PRES", 50);
        Predicate doxyQc = Predicate.equal("DOXY_QC", 1);
        Predicate time = Predicate.between("JULD",
            LocalDateTime.of(2023, 1, 1, 0, 0, 0),
            LocalDateTime.of(2024, 1, 1, 0, 0, 0));
        return Predicate.allOf(pres, time, doxyQc);
    }
    
    /**
     * 在给定数据集上运行示例，先并行读取再串行读取并各自计时
     */
    public static ExampleResult run(Path datasetPath, ReadOptions options) throws IOException {
        DatasetReader reader = new DatasetReader(options);
        DatasetHandle handle = reader.open(datasetPath, COLUMNS);
        handle = reader.attachFilter(handle, filter());
        
        long start = System.currentTimeMillis();
        RowSet parallelRows = reader.materialize(handle, true);
        long parallelMillis = System.currentTimeMillis() - start;
        
        start = System.currentTimeMillis();
        RowSet rows = reader.materialize(handle, false);
        long serialMillis = System.currentTimeMillis() - start;
        
        if (parallelRows.size() != rows.size()) {
            logger.warn("Parallel read returned {} rows but serial read returned {}",
                       parallelRows.size(), rows.size());
        }
        
        AggregatedRowSet aggregated = SpatialAggregator.aggregateMean(rows, "LATITUDE", "LONGITUDE", TARGET);
        ColumnSummary summary = ColumnSummary.of(rows, TARGET);
        return new ExampleResult(rows, aggregated, summary, Collections.emptyMap(), parallelMillis, serialMillis);
    }
    
    public static void main(String[] args) throws IOException {
        Path dataRoot = Paths.get(args.length > 0 ? args[0] : "./data");
        Path datasetPath = DatabaseCodename.of(LakeDatabase.ARGO, LakeDatabase.Domain.BGC, true, false)
            .localPath(dataRoot);
        
        ExampleResult result = run(datasetPath, ReadOptions.defaults());
        
        logger.info("Elapsed time to read data into memory in parallel: {} ms", result.getParallelReadMillis());
        logger.info("Elapsed time to read data into memory serially: {} ms", result.getSerialReadMillis());
        logger.info("Read {} rows, {} distinct locations", result.getRows().size(), result.getAggregated().size());
        
        ColumnSummary summary = result.getSummary();
        logger.info("Minimum dissolved oxygen = {} micromole/kg", summary.min());
        logger.info("Maximum dissolved oxygen = {} micromole/kg", summary.max());
        logger.info("Median dissolved oxygen = {} micromole/kg", summary.median());
    }
}
