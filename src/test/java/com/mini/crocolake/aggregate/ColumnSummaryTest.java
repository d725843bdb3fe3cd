package com.mini.crocolake.aggregate;

import com.mini.crocolake.data.Row;
import com.mini.crocolake.data.RowSet;
import com.mini.crocolake.schema.DataType;
import com.mini.crocolake.schema.Field;
import com.mini.crocolake.schema.Schema;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.OptionalDouble;

import static org.junit.jupiter.api.Assertions.*;

public class ColumnSummaryTest {
    
    private static final Schema SCHEMA = new Schema(Arrays.asList(
        new Field("DOXY", DataType.DOUBLE()),
        new Field("DB_NAME", DataType.STRING())
    ));
    
    private static final RowSet ROWS = new RowSet(SCHEMA, Arrays.asList(
        Row.of(210.0, "ARGO"),
        Row.of(180.0, "ARGO"),
        Row.of(null, "ARGO"),
        Row.of(280.0, "ARGO"),
        Row.of(200.0, "ARGO")
    ));
    
    @Test
    public void testBasicStatistics() {
        ColumnSummary summary = ColumnSummary.of(ROWS, "DOXY");
        
        assertEquals(4, summary.getCount());
        assertEquals(1, summary.getMissingCount());
        assertEquals(OptionalDouble.of(180.0), summary.min());
        assertEquals(OptionalDouble.of(280.0), summary.max());
        assertEquals(OptionalDouble.of(217.5), summary.mean());
        assertEquals(OptionalDouble.of(205.0), summary.median());
    }
    
    @Test
    public void testPercentiles() {
        ColumnSummary summary = ColumnSummary.of(ROWS, "DOXY");
        
        assertEquals(180.0, summary.percentile(0).getAsDouble());
        assertEquals(180.0, summary.percentile(10).getAsDouble());
        assertEquals(190.0, summary.percentile(25).getAsDouble(), 1e-9);
        assertEquals(280.0, summary.percentile(90).getAsDouble());
        assertEquals(280.0, summary.percentile(100).getAsDouble());
        
        assertThrows(IllegalArgumentException.class, () -> summary.percentile(-1));
        assertThrows(IllegalArgumentException.class, () -> summary.percentile(100.5));
        assertThrows(IllegalArgumentException.class, () -> summary.percentile(Double.NaN));
    }
    
    @Test
    public void testOddCountMedian() {
        RowSet rows = new RowSet(SCHEMA, Arrays.asList(
            Row.of(3.0, "A"), Row.of(1.0, "A"), Row.of(2.0, "A")));
        assertEquals(OptionalDouble.of(2.0), ColumnSummary.of(rows, "DOXY").median());
    }
    
    @Test
    public void testEmpty() {
        ColumnSummary summary = ColumnSummary.of(new RowSet(SCHEMA, Collections.singletonList(Row.of(null, "A"))), "DOXY");
        
        assertTrue(summary.isEmpty());
        assertEquals(1, summary.getMissingCount());
        assertFalse(summary.min().isPresent());
        assertFalse(summary.median().isPresent());
        assertFalse(summary.mean().isPresent());
    }
    
    @Test
    public void testNonNumericColumn() {
        assertThrows(IllegalArgumentException.class, () -> ColumnSummary.of(ROWS, "DB_NAME"));
    }
    
    @Test
    public void testOfAggregated() {
        Schema schema = new Schema(Arrays.asList(
            new Field("LATITUDE", DataType.DOUBLE()),
            new Field("LONGITUDE", DataType.DOUBLE()),
            new Field("DOXY", DataType.DOUBLE())));
        RowSet rows = new RowSet(schema, Arrays.asList(
            Row.of(1.0, 1.0, 10.0),
            Row.of(1.0, 1.0, 20.0),
            Row.of(2.0, 2.0, null),
            Row.of(3.0, 3.0, 40.0)));
        
        ColumnSummary summary = ColumnSummary.of(SpatialAggregator.aggregateMean(rows, "LATITUDE", "LONGITUDE", "DOXY"));
        assertEquals("DOXY", summary.getColumnName());
        assertEquals(2, summary.getCount());
        assertEquals(1, summary.getMissingCount());
        assertEquals(OptionalDouble.of(15.0), summary.min());
        assertEquals(OptionalDouble.of(40.0), summary.max());
    }
}
