package com.mini.crocolake.format;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.mini.crocolake.schema.ColumnStatistics;
import com.mini.crocolake.schema.Field;
import com.mini.crocolake.schema.Schema;
import com.mini.crocolake.utils.SerializationUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 分区文件的统计信息
 * 以 JSON 形式保存在数据文件旁边的 {@code <file>.stats.json} 中
 */
public class PartitionStats {
    
    public static final String SUFFIX = ".stats.json";
    
    /** 数据文件名 */
    private final String fileName;
    
    /** 行数 */
    private final long rowCount;
    
    /** 各列统计信息 */
    private final List<ColumnStatistics> columns;
    
    @JsonCreator
    public PartitionStats(
            @JsonProperty("fileName") String fileName,
            @JsonProperty("rowCount") long rowCount,
            @JsonProperty("columns") List<ColumnStatistics> columns) {
        this.fileName = Objects.requireNonNull(fileName, "File name cannot be null");
        this.rowCount = rowCount;
        this.columns = columns != null ? new ArrayList<>(columns) : new ArrayList<>();
    }
    
    public String getFileName() {
        return fileName;
    }
    
    public long getRowCount() {
        return rowCount;
    }
    
    public List<ColumnStatistics> getColumns() {
        return Collections.unmodifiableList(columns);
    }
    
    /**
     * 按列名索引统计信息，并按 Schema 中的列类型还原 min/max
     */
    public Map<String, ColumnStatistics> toMap(Schema schema) {
        Map<String, ColumnStatistics> map = new HashMap<>();
        for (ColumnStatistics stats : columns) {
            Field field = schema.getField(stats.getColumnName());
            if (field != null) {
                map.put(stats.getColumnName(), stats.normalize(field.getType()));
            }
        }
        return map;
    }
    
    public static Path sidecarPath(Path dataFile) {
        return dataFile.resolveSibling(dataFile.getFileName().toString() + SUFFIX);
    }
    
    public void write(Path dataFile) throws IOException {
        SerializationUtils.writeToFile(sidecarPath(dataFile), this);
    }
    
    /**
     * 读取数据文件旁的统计信息，不存在时返回 null
     */
    public static PartitionStats readIfExists(Path dataFile) throws IOException {
        Path sidecar = sidecarPath(dataFile);
        if (!Files.exists(sidecar)) {
            return null;
        }
        return SerializationUtils.readFromFile(sidecar, PartitionStats.class);
    }
    
    @Override
    public String toString() {
        return "PartitionStats{" +
                "fileName='" + fileName + '\'' +
                ", rowCount=" + rowCount +
                ", columns=" + columns.size() +
                '}';
    }
}
