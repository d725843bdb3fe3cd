package com.mini.crocolake.format;

import com.mini.crocolake.data.Row;
import com.mini.crocolake.predicate.Predicate;
import com.mini.crocolake.schema.Field;
import com.mini.crocolake.schema.Schema;

import javax.annotation.Nullable;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.List;

/**
 * 分区文件读取器
 * 
 * 逐行解析分区文件，先在文件自身的 Schema 上求值谓词，
 * 再按选中列的顺序投影，只返回满足谓词的行。
 */
public class PartitionFileReader implements RecordReader<Row> {
    
    private final PartitionFile file;
    private final Schema fileSchema;
    private final Predicate predicate;
    private final int[] projection;
    private final BufferedReader reader;
    
    private long lineNumber = 0;
    private long scannedRows = 0;
    private long returnedRows = 0;
    
    /**
     * @param file 分区文件
     * @param selectedSchema 选中列（按输出顺序）
     * @param predicate 过滤条件，null 表示不过滤
     */
    public PartitionFileReader(PartitionFile file, Schema selectedSchema, @Nullable Predicate predicate)
            throws IOException {
        this.file = file;
        this.fileSchema = file.getSchema();
        this.predicate = predicate;
        this.projection = new int[selectedSchema.getFieldCount()];
        List<Field> selected = selectedSchema.getFields();
        for (int i = 0; i < projection.length; i++) {
            int index = fileSchema.getFieldIndex(selected.get(i).getName());
            if (index < 0) {
                throw new IOException("Column " + selected.get(i).getName() + " missing in " + file.getPath());
            }
            projection[i] = index;
        }
        
        this.reader = Files.newBufferedReader(file.getPath(), StandardCharsets.UTF_8);
        // 跳过表头
        reader.readLine();
        lineNumber++;
    }
    
    /**
     * 读取下一条满足谓词的行
     * 
     * @throws InterruptedIOException 读取线程被中断
     */
    @Override
    public Row readRecord() throws IOException {
        String line;
        while ((line = reader.readLine()) != null) {
            if (Thread.currentThread().isInterrupted()) {
                throw new InterruptedIOException("Read of " + file.getPath() + " interrupted at line " + lineNumber);
            }
            lineNumber++;
            if (line.isEmpty()) {
                continue;
            }
            
            Row row = convertToRow(CsvLines.split(line));
            scannedRows++;
            
            if (predicate != null && !predicate.test(row, fileSchema)) {
                continue;
            }
            returnedRows++;
            return row.project(projection);
        }
        return null;
    }
    
    /**
     * 将单元格文本转换为 Row 对象
     */
    private Row convertToRow(List<String> cells) throws IOException {
        List<Field> fields = fileSchema.getFields();
        if (cells.size() != fields.size()) {
            throw new IOException(String.format(
                "Column count mismatch at %s:%d: expected %d, got %d",
                file.getPath(), lineNumber, fields.size(), cells.size()));
        }
        
        Object[] values = new Object[fields.size()];
        for (int i = 0; i < fields.size(); i++) {
            Field field = fields.get(i);
            try {
                values[i] = field.getType().parse(cells.get(i));
            } catch (IllegalArgumentException e) {
                throw new IOException(String.format(
                    "Failed to convert value '%s' of column %s to %s at %s:%d",
                    cells.get(i), field.getName(), field.getType(), file.getPath(), lineNumber), e);
            }
        }
        return new Row(values);
    }
    
    public long getScannedRows() {
        return scannedRows;
    }
    
    public long getReturnedRows() {
        return returnedRows;
    }
    
    @Override
    public void close() throws IOException {
        reader.close();
    }
}
