package com.mini.crocolake;

import com.mini.crocolake.data.Row;
import com.mini.crocolake.format.PartitionFileWriter;
import com.mini.crocolake.schema.DataType;
import com.mini.crocolake.schema.Field;
import com.mini.crocolake.schema.Schema;

import java.io.IOException;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.List;

/**
 * 测试数据集生成工具
 */
public final class TestDatasets {
    
    public static final Schema ARGO_SCHEMA = new Schema(Arrays.asList(
        new Field("PLATFORM_NUMBER", DataType.STRING()),
        new Field("LATITUDE", DataType.DOUBLE()),
        new Field("LONGITUDE", DataType.DOUBLE()),
        new Field("JULD", DataType.TIMESTAMP()),
        new Field("PRES", DataType.DOUBLE()),
        new Field("TEMP", DataType.DOUBLE()),
        new Field("DOXY", DataType.DOUBLE()),
        new Field("DOXY_QC", DataType.INT())
    ));
    
    private TestDatasets() {
    }
    
    public static Row argoRow(String platform, double lat, double lon, LocalDateTime juld,
                              double pres, Double temp, Double doxy, Integer doxyQc) {
        return Row.of(platform, lat, lon, juld, pres, temp, doxy, doxyQc);
    }
    
    public static Path writePartition(Path dir, String fileName, Schema schema, List<Row> rows) throws IOException {
        return writePartition(dir, fileName, schema, rows, true);
    }
    
    public static Path writePartition(Path dir, String fileName, Schema schema, List<Row> rows,
                                      boolean withStatistics) throws IOException {
        Path file = dir.resolve(fileName);
        try (PartitionFileWriter writer = new PartitionFileWriter(schema, file, withStatistics)) {
            writer.writeAll(rows);
        }
        return file;
    }
    
    /**
     * 生成三个分区的 Argo BGC 数据集
     * 
     * part-0: 2023 年浅层观测（含一个重复坐标）
     * part-1: 2022 年观测，时间过滤后全部被排除
     * part-2: 2023 年观测，含质控码 2 和深层观测
     */
    public static void writeArgoDataset(Path dir) throws IOException {
        LocalDateTime t2023 = LocalDateTime.of(2023, 6, 1, 12, 0);
        writePartition(dir, "part-0.csv", ARGO_SCHEMA, Arrays.asList(
            argoRow("6901", 10.0, -20.0, t2023, 5.0, 15.0, 200.0, 1),
            argoRow("6901", 10.0, -20.0, t2023.plusHours(1), 10.0, 14.5, 210.0, 1),
            argoRow("6902", 30.0, 40.0, t2023, 20.0, 12.0, 180.0, 1)
        ));
        LocalDateTime t2022 = LocalDateTime.of(2022, 3, 1, 0, 0);
        writePartition(dir, "part-1.csv", ARGO_SCHEMA, Arrays.asList(
            argoRow("6903", -5.0, 100.0, t2022, 5.0, 28.0, 190.0, 1),
            argoRow("6903", -5.5, 100.5, t2022.plusDays(10), 8.0, 27.5, 195.0, 1)
        ));
        writePartition(dir, "part-2.csv", ARGO_SCHEMA, Arrays.asList(
            argoRow("6904", 50.0, -30.0, t2023.plusMonths(2), 15.0, 9.0, 300.0, 2),
            argoRow("6904", 50.0, -30.0, t2023.plusMonths(2), 800.0, 4.0, 250.0, 1),
            argoRow("6905", 45.0, -35.0, t2023.plusMonths(3), 40.0, 10.0, 280.0, 1)
        ));
    }
}
