package com.mini.crocolake.format;

import com.mini.crocolake.exception.SchemaMismatchException;
import com.mini.crocolake.schema.ColumnStatistics;
import com.mini.crocolake.schema.Field;
import com.mini.crocolake.schema.Schema;

import javax.annotation.Nullable;
import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 分区文件元信息
 * 
 * 一个分区文件保存数据集的一段连续行，首行为带类型的表头（NAME:TYPE,...）。
 * 打开时只读取表头和统计信息，不读取数据行。
 */
public class PartitionFile {
    
    /** 在数据集中的序号（按文件名排序） */
    private final int index;
    
    private final Path path;
    
    /** 文件自身声明的 Schema */
    private final Schema schema;
    
    /** 列统计信息，没有统计文件时为空 */
    private final Map<String, ColumnStatistics> statistics;
    
    public PartitionFile(int index, Path path, Schema schema,
                         Map<String, ColumnStatistics> statistics) {
        this.index = index;
        this.path = Objects.requireNonNull(path, "Path cannot be null");
        this.schema = Objects.requireNonNull(schema, "Schema cannot be null");
        this.statistics = statistics != null ? statistics : Collections.emptyMap();
    }
    
    /**
     * 打开分区文件，读取表头和统计信息
     * 
     * @param index 分区序号
     * @param path 数据文件路径
     * @param loadStatistics 是否加载统计信息
     * @throws SchemaMismatchException 表头缺失或无法解析
     */
    public static PartitionFile open(int index, Path path, boolean loadStatistics) throws IOException {
        Schema schema = readSchema(path);
        Map<String, ColumnStatistics> statistics = Collections.emptyMap();
        if (loadStatistics) {
            PartitionStats stats = PartitionStats.readIfExists(path);
            if (stats != null) {
                statistics = stats.toMap(schema);
            }
        }
        return new PartitionFile(index, path, schema, statistics);
    }
    
    /**
     * 读取表头中的 Schema
     */
    public static Schema readSchema(Path path) throws IOException {
        String header;
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            header = reader.readLine();
        }
        if (header == null || header.trim().isEmpty()) {
            throw new SchemaMismatchException("Partition file has no header: " + path);
        }
        
        List<Field> fields = new ArrayList<>();
        try {
            for (String cell : CsvLines.split(header)) {
                fields.add(Field.parse(cell));
            }
            return new Schema(fields);
        } catch (IllegalArgumentException e) {
            throw new SchemaMismatchException("Invalid header in partition file " + path + ": " + e.getMessage(), e);
        }
    }
    
    public Path getPath() {
        return path;
    }
    
    public Schema getSchema() {
        return schema;
    }
    
    public Map<String, ColumnStatistics> getStatistics() {
        return statistics;
    }
    
    @Nullable
    public ColumnStatistics getStatistics(String columnName) {
        return statistics.get(columnName);
    }
    
    public boolean hasStatistics() {
        return !statistics.isEmpty();
    }
    
    @Override
    public String toString() {
        return "PartitionFile{" +
                "index=" + index +
                ", path=" + path +
                ", columns=" + schema.getFieldCount() +
                ", statistics=" + hasStatistics() +
                '}';
    }
}
