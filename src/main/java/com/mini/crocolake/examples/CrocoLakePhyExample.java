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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * CrocoLake 物理参数示例
 * 
 * 读取北大西洋 [0,60]N x [-90,0]E 范围内 2010-2021 年、20 dbar 以浅的温度观测，
 * 按坐标求均值，并按数据来源（ARGO / GLODAP / SprayGliders）分别统计。
 */
public class CrocoLakePhyExample {
    private static final Logger logger = LoggerFactory.getLogger(CrocoLakePhyExample.class);
    
    static final String TARGET = "TEMP";
    
    static final List<String> SOURCES = Arrays.asList("ARGO", "GLODAP", "SprayGliders");
    
    static final List<String> COLUMNS = Arrays.asList(
        "DB_NAME",
        "LATITUDE",
        "LONGITUDE",
        "JULD",
        "PRES",
        "TEMP"
    );
    
    static Predicate filter() {
        Predicate pres = Predicate.lessOrEqual("PRES", 20);
        Predicate lat = Predicate.between("LATITUDE", 0, 60);
        Predicate lon = Predicate.between("LONGITUDE", -90, 0);
        Predicate time = Predicate.between("JULD",
            LocalDateTime.of(2010, 1, 1, 0, 0, 0),
            LocalDateTime.of(2022, 1, 1, 0, 0, 0));
        return Predicate.allOf(pres, time, lat, lon);
    }
    
    /**
     * 在给定数据集上运行示例，只做并行读取
     */
    public static ExampleResult run(Path datasetPath, ReadOptions options) throws IOException {
        DatasetReader reader = new DatasetReader(options);
        DatasetHandle handle = reader.attachFilter(reader.open(datasetPath, COLUMNS), filter());
        
        long start = System.currentTimeMillis();
        RowSet rows = reader.materialize(handle, true);
        long parallelMillis = System.currentTimeMillis() - start;
        
        AggregatedRowSet aggregated = SpatialAggregator.aggregateMean(rows, "LATITUDE", "LONGITUDE", TARGET);
        
        Map<String, ColumnSummary> bySource = new LinkedHashMap<>();
        for (String source : SOURCES) {
            RowSet sourceRows = rows.where(Predicate.equal("DB_NAME", source));
            bySource.put(source, ColumnSummary.of(sourceRows, TARGET));
        }
        
        return new ExampleResult(rows, aggregated, ColumnSummary.of(rows, TARGET), bySource, parallelMillis, -1L);
    }
    
    public static void main(String[] args) throws IOException {
        Path dataRoot = Paths.get(args.length > 0 ? args[0] : "./data");
        Path datasetPath = DatabaseCodename.of(LakeDatabase.CROCOLAKE, LakeDatabase.Domain.PHY, true, false)
            .localPath(dataRoot);
        
        ExampleResult result = run(datasetPath, ReadOptions.defaults());
        logger.info("Elapsed time to read data into memory in parallel: {} ms", result.getParallelReadMillis());
        
        // 色标范围取聚合值的 10% 和 90% 分位
        ColumnSummary aggregatedSummary = ColumnSummary.of(result.getAggregated());
        OptionalDouble low = aggregatedSummary.percentile(10);
        OptionalDouble high = aggregatedSummary.percentile(90);
        logger.info("{} locations, color limits [{}, {}]", result.getAggregated().size(), low, high);
        
        for (Map.Entry<String, ColumnSummary> entry : result.getSummariesBySource().entrySet()) {
            ColumnSummary summary = entry.getValue();
            logger.info("Minimum temperature in {} dataset: {} Celsius", entry.getKey(), summary.min());
            logger.info("Maximum temperature in {} dataset: {} Celsius", entry.getKey(), summary.max());
            logger.info("Median temperature in {} dataset: {} Celsius", entry.getKey(), summary.median());
        }
        
        ColumnSummary summary = result.getSummary();
        logger.info("Minimum temperature = {} Celsius", summary.min());
        logger.info("Maximum temperature = {} Celsius", summary.max());
        logger.info("Median temperature = {} Celsius", summary.median());
    }
}
