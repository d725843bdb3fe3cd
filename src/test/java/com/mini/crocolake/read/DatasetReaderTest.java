package com.mini.crocolake.read;

import com.mini.crocolake.TestDatasets;
import com.mini.crocolake.data.Row;
import com.mini.crocolake.data.RowSet;
import com.mini.crocolake.exception.InvalidPredicateException;
import com.mini.crocolake.exception.PathNotFoundException;
import com.mini.crocolake.exception.SchemaMismatchException;
import com.mini.crocolake.exception.UnknownColumnException;
import com.mini.crocolake.predicate.Predicate;
import com.mini.crocolake.schema.DataType;
import com.mini.crocolake.schema.Field;
import com.mini.crocolake.schema.Schema;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * DatasetReader 测试
 */
public class DatasetReaderTest {
    
    private static final List<String> COLUMNS =
        Arrays.asList("LATITUDE", "LONGITUDE", "JULD", "PRES", "DOXY", "DOXY_QC");
    
    private static final LocalDateTime START = LocalDateTime.of(2023, 1, 1, 0, 0);
    private static final LocalDateTime END = LocalDateTime.of(2024, 1, 1, 0, 0);
    
    @TempDir
    Path tempDir;
    
    private DatasetReader reader;
    
    @BeforeEach
    public void setUp() throws IOException {
        TestDatasets.writeArgoDataset(tempDir);
        reader = new DatasetReader(ReadOptions.builder().parallelism(3).build());
    }
    
    private static Predicate argoFilter() {
        return Predicate.allOf(
            Predicate.lessOrEqual("PRES", 50),
            Predicate.equal("DOXY_QC", 1),
            Predicate.between("JULD", START, END));
    }
    
    @Test
    public void testOpen() throws IOException {
        DatasetHandle handle = reader.open(tempDir, COLUMNS);
        
        assertEquals(3, handle.getPartitionCount());
        assertEquals(COLUMNS, handle.getSelectedColumns());
        assertEquals(TestDatasets.ARGO_SCHEMA, handle.getSchema());
        assertFalse(handle.hasFilter());
    }
    
    @Test
    public void testReadWithoutFilter() throws IOException {
        DatasetHandle handle = reader.open(tempDir, Arrays.asList("PRES", "PLATFORM_NUMBER"));
        RowSet rows = reader.materialize(handle, true);
        
        assertEquals(8, rows.size());
        assertEquals(Arrays.asList("PRES", "PLATFORM_NUMBER"), rows.getSchema().getFieldNames());
        assertEquals(Row.of(5.0, "6901"), rows.getRow(0));
        assertEquals(Row.of(40.0, "6905"), rows.getRow(7));
    }
    
    @Test
    public void testFilteredRead() throws IOException {
        DatasetHandle handle = reader.attachFilter(reader.open(tempDir, COLUMNS), argoFilter());
        RowSet rows = reader.materialize(handle, true);
        
        assertEquals(4, rows.size());
        assertEquals(Arrays.asList(200.0, 210.0, 180.0, 280.0), rows.column("DOXY"));
        for (Row row : rows) {
            assertTrue(row.getDouble(3) <= 50.0);
            assertEquals(1, row.getValue(5));
            LocalDateTime juld = (LocalDateTime) row.getValue(2);
            assertFalse(juld.isBefore(START) || juld.isAfter(END));
        }
    }
    
    @Test
    public void testParallelMatchesSerial() throws IOException {
        DatasetHandle handle = reader.attachFilter(reader.open(tempDir, COLUMNS), argoFilter());
        
        RowSet parallel = reader.materialize(handle, true);
        RowSet serial = reader.materialize(handle, false);
        assertEquals(serial, parallel);
        
        DatasetReader single = new DatasetReader(ReadOptions.builder().parallelism(1).build());
        assertEquals(serial, single.materialize(handle, true));
    }
    
    @Test
    public void testUnsatisfiableFilter() throws IOException {
        DatasetHandle handle = reader.attachFilter(reader.open(tempDir, COLUMNS),
            Predicate.greaterThan("PRES", 10000));
        RowSet rows = reader.materialize(handle, true);
        
        assertTrue(rows.isEmpty());
        assertEquals(COLUMNS, rows.getSchema().getFieldNames());
    }
    
    @Test
    public void testInclusiveTimestampBounds() throws IOException {
        LocalDateTime exact = LocalDateTime.of(2022, 3, 1, 0, 0);
        DatasetHandle handle = reader.open(tempDir, COLUMNS);
        
        RowSet closed = reader.materialize(reader.attachFilter(handle,
            Predicate.between("JULD", exact, exact)), true);
        assertEquals(1, closed.size());
        
        RowSet open = reader.materialize(reader.attachFilter(handle,
            Predicate.greaterThan("JULD", exact).and(Predicate.lessThan("JULD", exact.plusDays(1)))), true);
        assertTrue(open.isEmpty());
    }
    
    @Test
    public void testAttachFilterReplacesExisting() throws IOException {
        DatasetHandle handle = reader.open(tempDir, COLUMNS);
        DatasetHandle first = reader.attachFilter(handle, Predicate.equal("DOXY_QC", 2));
        DatasetHandle second = reader.attachFilter(first, Predicate.greaterOrEqual("PRES", 800));
        
        RowSet rows = reader.materialize(second, false);
        assertEquals(1, rows.size());
        assertEquals(1, rows.getRow(0).getValue(5));
        
        assertFalse(handle.hasFilter());
        assertEquals(1, reader.materialize(first, false).size());
        
        DatasetHandle cleared = reader.attachFilter(second, null);
        assertEquals(8, reader.materialize(cleared, false).size());
    }
    
    @Test
    public void testAttachFilterValidation() throws IOException {
        DatasetHandle handle = reader.open(tempDir, COLUMNS);
        
        assertThrows(UnknownColumnException.class,
            () -> reader.attachFilter(handle, Predicate.equal("PLATFORM_NUMBER", "6901")));
        assertThrows(UnknownColumnException.class,
            () -> reader.attachFilter(handle, Predicate.lessOrEqual("TEMP_QC", 1)));
        assertThrows(InvalidPredicateException.class,
            () -> reader.attachFilter(handle, Predicate.greaterOrEqual("JULD", 20230101)));
        assertThrows(InvalidPredicateException.class,
            () -> reader.attachFilter(handle, Predicate.lessOrEqual("PRES", "50")));
    }
    
    @Test
    public void testOpenMissingPath() {
        Path missing = tempDir.resolve("nope");
        PathNotFoundException e = assertThrows(PathNotFoundException.class, () -> reader.open(missing));
        assertEquals(missing, e.getPath());
    }
    
    @Test
    public void testOpenWithoutPartitions() throws IOException {
        Path empty = Files.createDirectory(tempDir.resolve("empty"));
        Files.write(empty.resolve("notes.txt"), Collections.singletonList("nothing"), StandardCharsets.UTF_8);
        
        assertThrows(PathNotFoundException.class, () -> reader.open(empty));
    }
    
    @Test
    public void testOpenUnknownColumn() {
        UnknownColumnException e = assertThrows(UnknownColumnException.class,
            () -> reader.open(tempDir, Arrays.asList("PRES", "CHLA")));
        assertEquals("CHLA", e.getColumnName());
        
        assertThrows(IllegalArgumentException.class, () -> reader.open(tempDir, Collections.emptyList()));
        assertThrows(IllegalArgumentException.class, () -> reader.open(tempDir, Arrays.asList("PRES", "PRES")));
    }
    
    @Test
    public void testSchemaMismatch() throws IOException {
        Path typeMismatch = Files.createDirectory(tempDir.resolve("types"));
        TestDatasets.writePartition(typeMismatch, "a.csv", schema("PRES", DataType.DOUBLE()),
            Collections.singletonList(Row.of(1.0)));
        TestDatasets.writePartition(typeMismatch, "b.csv", schema("PRES", DataType.STRING()),
            Collections.singletonList(Row.of("1.0")));
        assertThrows(SchemaMismatchException.class, () -> reader.open(typeMismatch));
        
        Path columnMismatch = Files.createDirectory(tempDir.resolve("columns"));
        TestDatasets.writePartition(columnMismatch, "a.csv", schema("PRES", DataType.DOUBLE()),
            Collections.singletonList(Row.of(1.0)));
        TestDatasets.writePartition(columnMismatch, "b.csv", schema("TEMP", DataType.DOUBLE()),
            Collections.singletonList(Row.of(1.0)));
        assertThrows(SchemaMismatchException.class, () -> reader.open(columnMismatch));
    }
    
    @Test
    public void testColumnOrderMayDiffer() throws IOException {
        Path dir = Files.createDirectory(tempDir.resolve("reordered"));
        TestDatasets.writePartition(dir, "a.csv", new Schema(Arrays.asList(
                new Field("PRES", DataType.DOUBLE()), new Field("TEMP", DataType.DOUBLE()))),
            Collections.singletonList(Row.of(1.0, 20.0)));
        TestDatasets.writePartition(dir, "b.csv", new Schema(Arrays.asList(
                new Field("TEMP", DataType.DOUBLE()), new Field("PRES", DataType.DOUBLE()))),
            Collections.singletonList(Row.of(21.0, 2.0)));
        
        RowSet rows = reader.materialize(reader.open(dir, Arrays.asList("PRES", "TEMP")), true);
        assertEquals(Arrays.asList(Row.of(1.0, 20.0), Row.of(2.0, 21.0)), rows.getRows());
    }
    
    @Test
    public void testStatisticsSkipPartition() throws IOException {
        // part-1 只含 2022 年数据，统计信息足以跳过它
        Files.write(tempDir.resolve("part-1.csv"), Collections.singletonList("corrupt,row"),
            StandardCharsets.UTF_8, StandardOpenOption.APPEND);
        
        DatasetHandle handle = reader.attachFilter(reader.open(tempDir, COLUMNS), argoFilter());
        assertEquals(4, reader.materialize(handle, true).size());
        
        DatasetReader noStats = new DatasetReader(ReadOptions.builder()
            .parallelism(3)
            .useStatistics(false)
            .build());
        DatasetHandle fullScan = noStats.attachFilter(noStats.open(tempDir, COLUMNS), argoFilter());
        assertThrows(IOException.class, () -> noStats.materialize(fullScan, true));
        assertThrows(IOException.class, () -> noStats.materialize(fullScan, false));
    }
    
    @Test
    public void testIncludeSubfolders() throws IOException {
        Path nested = Files.createDirectory(tempDir.resolve("2024"));
        TestDatasets.writePartition(nested, "part-3.csv", TestDatasets.ARGO_SCHEMA, Collections.singletonList(
            TestDatasets.argoRow("6906", 0.0, 0.0, END, 1.0, 20.0, 150.0, 1)));
        
        assertEquals(3, reader.open(tempDir).getPartitionCount());
        
        DatasetReader recursive = new DatasetReader(ReadOptions.builder().includeSubfolders(true).build());
        DatasetHandle handle = recursive.open(tempDir, COLUMNS);
        assertEquals(4, handle.getPartitionCount());
        assertEquals(5, recursive.materialize(recursive.attachFilter(handle, argoFilter()), true).size());
    }
    
    private static Schema schema(String name, DataType type) {
        return new Schema(Collections.singletonList(new Field(name, type)));
    }
    
    @Test
    public void testNegativeZeroSurvivesRangeFilter() throws IOException {
        Path dir = Files.createDirectory(tempDir.resolve("zero"));
        Schema schema = new Schema(Arrays.asList(
            new Field("LATITUDE", DataType.DOUBLE()), new Field("LONGITUDE", DataType.DOUBLE())));
        TestDatasets.writePartition(dir, "a.csv", schema, Arrays.asList(Row.of(-0.0, -0.0)));
        
        DatasetHandle handle = reader.attachFilter(reader.open(dir),
            Predicate.between("LATITUDE", 0, 60).and(Predicate.between("LONGITUDE", -90, 0)));
        assertEquals(1, reader.materialize(handle, false).size());
        assertEquals(1, reader.materialize(handle, true).size());
    }
}
