package com.mini.crocolake.read;

import com.mini.crocolake.format.PartitionFile;
import com.mini.crocolake.predicate.Predicate;
import com.mini.crocolake.schema.Schema;

import javax.annotation.Nullable;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 数据集句柄
 * 
 * 一个目录下的全部分区文件组成的逻辑表。句柄不可变：
 * 绑定过滤条件会返回新句柄，且新的过滤条件替换旧的（不做隐式 AND）。
 */
public class DatasetHandle {
    
    private final Path basePath;
    
    /** 按文件名排序的分区文件 */
    private final List<PartitionFile> partitions;
    
    /** 数据集声明的完整 Schema */
    private final Schema schema;
    
    /** 选中物化的列，按输出顺序 */
    private final Schema selectedSchema;
    
    @Nullable
    private final Predicate predicate;
    
    DatasetHandle(Path basePath, List<PartitionFile> partitions, Schema schema,
                  Schema selectedSchema, @Nullable Predicate predicate) {
        this.basePath = Objects.requireNonNull(basePath, "Base path cannot be null");
        this.partitions = Collections.unmodifiableList(new ArrayList<>(partitions));
        this.schema = Objects.requireNonNull(schema, "Schema cannot be null");
        this.selectedSchema = Objects.requireNonNull(selectedSchema, "Selected schema cannot be null");
        this.predicate = predicate;
    }
    
    /**
     * 返回绑定了新过滤条件的句柄，调用方需要保证谓词已经校验
     */
    DatasetHandle withPredicate(@Nullable Predicate newPredicate) {
        return new DatasetHandle(basePath, partitions, schema, selectedSchema, newPredicate);
    }
    
    public List<PartitionFile> getPartitions() {
        return partitions;
    }
    
    public int getPartitionCount() {
        return partitions.size();
    }
    
    public Schema getSchema() {
        return schema;
    }
    
    public Schema getSelectedSchema() {
        return selectedSchema;
    }
    
    public List<String> getSelectedColumns() {
        return selectedSchema.getFieldNames();
    }
    
    @Nullable
    public Predicate getPredicate() {
        return predicate;
    }
    
    public boolean hasFilter() {
        return predicate != null;
    }
    
    @Override
    public String toString() {
        return "DatasetHandle{" +
                "basePath=" + basePath +
                ", partitions=" + partitions.size() +
                ", selected=" + selectedSchema.getFieldNames() +
                ", predicate=" + predicate +
                '}';
    }
}
