package com.mini.crocolake.schema;

import com.mini.crocolake.exception.UnknownColumnException;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Schema、Field 和 DataType 测试
 */
public class SchemaTest {
    
    @Test
    public void testFieldParse() {
        Field field = Field.parse("JULD:TIMESTAMP");
        assertEquals("JULD", field.getName());
        assertEquals(DataType.TIMESTAMP(), field.getType());
        assertEquals("JULD:TIMESTAMP", field.toHeader());
        
        assertEquals(DataType.LONG(), Field.parse("N:BIGINT").getType());
        assertThrows(IllegalArgumentException.class, () -> Field.parse("PRES"));
        assertThrows(IllegalArgumentException.class, () -> Field.parse("PRES:"));
        assertThrows(IllegalArgumentException.class, () -> Field.parse("PRES:FLOAT128"));
    }
    
    @Test
    public void testSchemaValidation() {
        assertThrows(IllegalArgumentException.class, () -> new Schema(Collections.emptyList()));
        assertThrows(IllegalArgumentException.class, () -> new Schema(Arrays.asList(
            new Field("PRES", DataType.DOUBLE()),
            new Field("PRES", DataType.DOUBLE()))));
    }
    
    @Test
    public void testProjectAndLookup() {
        Schema schema = new Schema(Arrays.asList(
            new Field("LATITUDE", DataType.DOUBLE()),
            new Field("LONGITUDE", DataType.DOUBLE()),
            new Field("TEMP", DataType.DOUBLE())));
        
        assertEquals(2, schema.getFieldIndex("TEMP"));
        assertEquals(-1, schema.getFieldIndex("PSAL"));
        assertNull(schema.getField("PSAL"));
        
        Schema projected = schema.project(Arrays.asList("TEMP", "LATITUDE"));
        assertEquals(Arrays.asList("TEMP", "LATITUDE"), projected.getFieldNames());
        
        UnknownColumnException e = assertThrows(UnknownColumnException.class,
            () -> schema.project(Arrays.asList("TEMP", "PSAL")));
        assertEquals("PSAL", e.getColumnName());
    }
    
    @Test
    public void testHasSameColumnsIgnoresOrder() {
        Schema a = new Schema(Arrays.asList(
            new Field("PRES", DataType.DOUBLE()), new Field("TEMP", DataType.DOUBLE())));
        Schema b = new Schema(Arrays.asList(
            new Field("TEMP", DataType.DOUBLE()), new Field("PRES", DataType.DOUBLE())));
        Schema c = new Schema(Arrays.asList(new Field("PRES", DataType.DOUBLE())));
        
        assertTrue(a.hasSameColumns(b));
        assertFalse(a.hasSameColumns(c));
        assertNotEquals(a, b);
    }
    
    @Test
    public void testDataTypeParse() {
        assertNull(DataType.DOUBLE().parse(""));
        assertNull(DataType.DOUBLE().parse("NaN"));
        assertEquals(12.5, DataType.DOUBLE().parse("12.5"));
        assertEquals(3, DataType.INT().parse("3"));
        assertEquals(LocalDateTime.of(2023, 1, 1, 0, 0), DataType.TIMESTAMP().parse("2023-01-01T00:00"));
        assertNull(DataType.STRING().parse(""));
        
        assertThrows(IllegalArgumentException.class, () -> DataType.INT().parse("1.5"));
        assertThrows(IllegalArgumentException.class, () -> DataType.TIMESTAMP().parse("2023-13-01"));
    }
    
    @Test
    public void testDataTypeCompatibility() {
        assertTrue(DataType.DOUBLE().isCompatible(1));
        assertTrue(DataType.INT().isCompatible(1.0));
        assertFalse(DataType.DOUBLE().isCompatible("1"));
        assertFalse(DataType.TIMESTAMP().isCompatible(LocalDateTime.now().toLocalDate()));
        assertFalse(DataType.STRING().isCompatible(1));
        assertTrue(DataType.DOUBLE().isNumeric());
        assertFalse(DataType.TIMESTAMP().isNumeric());
    }
    
    @Test
    public void testStatisticsBuilder() {
        ColumnStatistics stats = new ColumnStatistics.Builder("PRES")
            .update(20.0)
            .update(null)
            .update(5.0)
            .update(12.0)
            .build();
        
        assertEquals(5.0, stats.getMinValue());
        assertEquals(20.0, stats.getMaxValue());
        assertEquals(1, stats.getNullCount());
        assertEquals(4, stats.getRowCount());
        assertFalse(stats.isAllNull());
        
        assertTrue(stats.mightContainValue(12));
        assertFalse(stats.mightContainValue(25));
        assertTrue(stats.mightOverlapRange(20.0, true, null, false));
        assertFalse(stats.mightOverlapRange(20.0, false, null, false));
        assertFalse(stats.isConstant(5.0));
    }
    
    @Test
    public void testAllNullStatistics() {
        ColumnStatistics stats = new ColumnStatistics.Builder("DOXY").update(null).update(null).build();
        
        assertTrue(stats.isAllNull());
        assertNull(stats.getMinValue());
        assertFalse(stats.mightContainValue(1.0));
        assertFalse(stats.mightOverlapRange(null, false, 100.0, true));
    }
    
    @Test
    public void testIntegerNormalize() {
        assertEquals(2, DataType.INT().normalize(2.0));
        assertEquals(7, DataType.INT().normalize(7L));
        assertNull(DataType.INT().normalize(Double.NaN));
        assertEquals(5L, DataType.LONG().normalize(5));
        
        assertThrows(IllegalArgumentException.class, () -> DataType.INT().normalize(1.7));
        assertThrows(IllegalArgumentException.class, () -> DataType.INT().normalize(3_000_000_000L));
        assertThrows(IllegalArgumentException.class, () -> DataType.LONG().normalize(0.5));
    }
}
