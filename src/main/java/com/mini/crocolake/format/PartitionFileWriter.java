package com.mini.crocolake.format;

import com.mini.crocolake.data.Row;
import com.mini.crocolake.schema.ColumnStatistics;
import com.mini.crocolake.schema.DataType;
import com.mini.crocolake.schema.Field;
import com.mini.crocolake.schema.Schema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;

/**
 * 分区文件写入器
 * 
 * 写入带类型表头的 CSV 数据，同时累积各列统计信息，
 * 关闭时在数据文件旁写出统计文件（可关闭）。
 */
public class PartitionFileWriter implements AutoCloseable {
    
    private static final Logger logger = LoggerFactory.getLogger(PartitionFileWriter.class);
    
    private static final String LINE_DELIMITER = "\n";
    
    private final Schema schema;
    private final Path filePath;
    private final BufferedWriter writer;
    private final boolean writeStatistics;
    private final List<ColumnStatistics.Builder> statistics;
    
    private long rowCount = 0;
    private boolean closed = false;
    
    public PartitionFileWriter(Schema schema, Path filePath) throws IOException {
        this(schema, filePath, true);
    }
    
    public PartitionFileWriter(Schema schema, Path filePath, boolean writeStatistics) throws IOException {
        this.schema = schema;
        this.filePath = filePath;
        this.writeStatistics = writeStatistics;
        this.statistics = new ArrayList<>();
        for (Field field : schema.getFields()) {
            statistics.add(new ColumnStatistics.Builder(field.getName()));
        }
        
        Path parent = filePath.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        
        this.writer = Files.newBufferedWriter(
            filePath, 
            StandardCharsets.UTF_8,
            StandardOpenOption.CREATE,
            StandardOpenOption.WRITE,
            StandardOpenOption.TRUNCATE_EXISTING
        );
        
        writeHeader();
        logger.debug("Created PartitionFileWriter for file: {}", filePath);
    }
    
    private void writeHeader() throws IOException {
        List<Field> fields = schema.getFields();
        StringBuilder header = new StringBuilder();
        for (int i = 0; i < fields.size(); i++) {
            if (i > 0) {
                header.append(CsvLines.DELIMITER);
            }
            header.append(CsvLines.escape(fields.get(i).toHeader()));
        }
        writer.write(header.toString());
        writer.write(LINE_DELIMITER);
    }
    
    /**
     * 写入一行数据
     * 
     * @throws IllegalArgumentException 行与 Schema 不兼容，或单元格含换行符
     */
    public void write(Row row) throws IOException {
        row.validate(schema);
        
        List<Field> fields = schema.getFields();
        Object[] values = new Object[fields.size()];
        String[] cells = new String[fields.size()];
        for (int i = 0; i < fields.size(); i++) {
            DataType type = fields.get(i).getType();
            values[i] = type.normalize(row.getValue(i));
            cells[i] = type.format(values[i]);
            if (CsvLines.hasLineBreak(cells[i])) {
                throw new IllegalArgumentException(
                    "Field '" + fields.get(i).getName() + "' contains a line break, which partition files cannot store");
            }
        }
        
        // 整行校验通过后才计入统计信息
        StringBuilder line = new StringBuilder();
        for (int i = 0; i < fields.size(); i++) {
            if (i > 0) {
                line.append(CsvLines.DELIMITER);
            }
            statistics.get(i).update(values[i]);
            line.append(CsvLines.escape(cells[i]));
        }
        
        writer.write(line.toString());
        writer.write(LINE_DELIMITER);
        rowCount++;
    }
    
    public void writeAll(Iterable<Row> rows) throws IOException {
        for (Row row : rows) {
            write(row);
        }
    }
    
    public long getRowCount() {
        return rowCount;
    }
    
    public Path getFilePath() {
        return filePath;
    }
    
    @Override
    public void close() throws IOException {
        if (closed) {
            return;
        }
        closed = true;
        writer.flush();
        writer.close();
        
        if (writeStatistics) {
            List<ColumnStatistics> columns = new ArrayList<>(statistics.size());
            for (ColumnStatistics.Builder builder : statistics) {
                columns.add(builder.build());
            }
            new PartitionStats(filePath.getFileName().toString(), rowCount, columns).write(filePath);
        }
        logger.debug("Closed PartitionFileWriter, wrote {} rows to {}", rowCount, filePath);
    }
}
