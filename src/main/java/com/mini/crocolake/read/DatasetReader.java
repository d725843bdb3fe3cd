package com.mini.crocolake.read;

import com.mini.crocolake.data.Row;
import com.mini.crocolake.data.RowSet;
import com.mini.crocolake.exception.PathNotFoundException;
import com.mini.crocolake.exception.SchemaMismatchException;
import com.mini.crocolake.exception.UnknownColumnException;
import com.mini.crocolake.format.PartitionFile;
import com.mini.crocolake.format.PartitionStats;
import com.mini.crocolake.predicate.Predicate;
import com.mini.crocolake.schema.Field;
import com.mini.crocolake.schema.Schema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * 带过滤的数据集读取器
 * 
 * 使用流程:
 * <pre>
 * DatasetReader reader = new DatasetReader(ReadOptions.defaults());
 * DatasetHandle handle = reader.open(path, Arrays.asList("LATITUDE", "LONGITUDE", "PRES", "DOXY", "DOXY_QC"));
 * handle = reader.attachFilter(handle, Predicate.lessOrEqual("PRES", 50).and(Predicate.equal("DOXY_QC", 1)));
 * RowSet rows = reader.materialize(handle, true);
 * </pre>
 */
public class DatasetReader {
    private static final Logger logger = LoggerFactory.getLogger(DatasetReader.class);
    
    private final ReadOptions options;
    
    public DatasetReader() {
        this(ReadOptions.defaults());
    }
    
    public DatasetReader(ReadOptions options) {
        this.options = Objects.requireNonNull(options, "Options cannot be null");
    }
    
    public ReadOptions getOptions() {
        return options;
    }
    
    /**
     * 打开数据集，选中全部列
     */
    public DatasetHandle open(Path path) throws IOException {
        return open(path, null);
    }
    
    /**
     * 打开数据集
     * 
     * @param path 分区文件所在目录
     * @param selectedColumns 要物化的列（按输出顺序），null 表示全部列
     * @throws PathNotFoundException 目录不存在或没有分区文件
     * @throws SchemaMismatchException 分区文件的列定义不一致
     * @throws UnknownColumnException 选中的列不在 Schema 中
     */
    public DatasetHandle open(Path path, @Nullable List<String> selectedColumns) throws IOException {
        Objects.requireNonNull(path, "Path cannot be null");
        if (!Files.isDirectory(path)) {
            throw new PathNotFoundException(path, "Dataset directory does not exist");
        }
        
        List<Path> files = listPartitionFiles(path);
        if (files.isEmpty()) {
            throw new PathNotFoundException(path,
                "No partition files with extension " + options.getFileExtension() + " found");
        }
        
        List<PartitionFile> partitions = new ArrayList<>(files.size());
        for (int i = 0; i < files.size(); i++) {
            partitions.add(PartitionFile.open(i, files.get(i), options.isUseStatistics()));
        }
        
        Schema schema = partitions.get(0).getSchema();
        for (PartitionFile partition : partitions) {
            checkSameSchema(schema, partition);
        }
        
        Schema selectedSchema;
        if (selectedColumns == null) {
            selectedSchema = schema;
        } else {
            if (selectedColumns.isEmpty()) {
                throw new IllegalArgumentException("At least one column must be selected");
            }
            Set<String> unique = new HashSet<>(selectedColumns);
            if (unique.size() != selectedColumns.size()) {
                throw new IllegalArgumentException("Duplicate selected columns: " + selectedColumns);
            }
            selectedSchema = schema.project(selectedColumns);
        }
        
        logger.info("Opened dataset {} with {} partitions, {} columns selected",
                   path, partitions.size(), selectedSchema.getFieldCount());
        return new DatasetHandle(path, partitions, schema, selectedSchema, null);
    }
    
    /**
     * 绑定过滤条件，返回新句柄
     * 新的过滤条件替换句柄上已有的过滤条件，不与之合并；需要多个条件时请先用 and/or 组合
     * 
     * @param predicate 过滤条件，null 表示清除过滤
     * @throws UnknownColumnException 谓词引用了未选中的列
     * @throws com.mini.crocolake.exception.InvalidPredicateException 常量类型与列类型不匹配
     */
    public DatasetHandle attachFilter(DatasetHandle handle, @Nullable Predicate predicate) {
        Objects.requireNonNull(handle, "Handle cannot be null");
        if (predicate != null) {
            predicate.validate(handle.getSelectedSchema());
        }
        if (handle.hasFilter()) {
            logger.debug("Replacing filter {} with {}", handle.getPredicate(), predicate);
        }
        return handle.withPredicate(predicate);
    }
    
    /**
     * 物化读取满足过滤条件的行
     * 
     * @param parallel 是否用线程池并行读取分区，结果与串行读取一致
     * @return 选中列上的行集，按分区序号拼接
     * @throws IOException 读取分区失败，不返回部分结果
     */
    public RowSet materialize(DatasetHandle handle, boolean parallel) throws IOException {
        Objects.requireNonNull(handle, "Handle cannot be null");
        List<Row> rows;
        try (ParallelPartitionReader reader = new ParallelPartitionReader(
                handle.getSelectedSchema(),
                handle.getPredicate(),
                options.isUseStatistics(),
                options.getParallelism())) {
            rows = parallel
                ? reader.readParallel(handle.getPartitions())
                : reader.readSerial(handle.getPartitions());
        }
        return new RowSet(handle.getSelectedSchema(), rows);
    }
    
    private List<Path> listPartitionFiles(Path path) throws IOException {
        int maxDepth = options.isIncludeSubfolders() ? Integer.MAX_VALUE : 1;
        String extension = options.getFileExtension();
        try (Stream<Path> stream = Files.walk(path, maxDepth)) {
            return stream
                .filter(Files::isRegularFile)
                .filter(p -> {
                    String name = p.getFileName().toString();
                    return name.endsWith(extension) && !name.endsWith(PartitionStats.SUFFIX);
                })
                .sorted()
                .collect(Collectors.toList());
        }
    }
    
    private static void checkSameSchema(Schema expected, PartitionFile partition) {
        Schema actual = partition.getSchema();
        for (Field field : actual.getFields()) {
            Field reference = expected.getField(field.getName());
            if (reference != null && !reference.getType().typeName().equals(field.getType().typeName())) {
                throw new SchemaMismatchException(String.format(
                    "Column %s is %s in %s but %s in first partition",
                    field.getName(), field.getType(), partition.getPath(), reference.getType()));
            }
        }
        if (!expected.hasSameColumns(actual)) {
            throw new SchemaMismatchException(String.format(
                "Partition %s declares columns %s, expected %s",
                partition.getPath(), actual.getFieldNames(), expected.getFieldNames()));
        }
    }
}
