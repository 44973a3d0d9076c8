package com.eia.api.data;

import static org.junit.jupiter.api.Assertions.*;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.eia.api.exceptions.EmptyResultException;
import com.eia.api.exceptions.TypeMismatchException;
import com.eia.api.fetch.RawRowSet;
import com.eia.api.query.Frequency;

public class DatasetAssemblerTest {

    private final DatasetAssembler assembler = new DatasetAssembler();

    @Test
    public void testHourlyPeriodsParseAsUtc() {
        RawRowSet rows = rowSet(0, row("2024-01-01T05", "12.5", "CISO", "SDGE"));

        Dataset dataset = assembler.assemble(Collections.singletonList(rows), Frequency.HOURLY);

        DatasetRow first = dataset.getRows().get(0);
        assertEquals(OffsetDateTime.of(2024, 1, 1, 5, 0, 0, 0, ZoneOffset.UTC), first.getPeriod());
        assertEquals(12.5, first.getValue());
        assertEquals("SDGE", first.getAttribute("subba"));
        assertEquals(Arrays.asList("period", "value", "parent", "subba"), dataset.getColumns());
    }

    @Test
    public void testDailyPeriodsParseAsDates() {
        RawRowSet rows = rowSet(0, row("2024-02-29", 7, "CISO", "PGAE"));

        Dataset dataset = assembler.assemble(Collections.singletonList(rows), Frequency.DAILY);

        assertEquals(LocalDate.of(2024, 2, 29), dataset.getRows().get(0).getPeriod());
        assertEquals(7.0, dataset.getValues().get(0));
    }

    @Test
    public void testRowsAreSortedByPeriodAcrossChunks() {
        RawRowSet late = rowSet(1, row("2024-01-01T03", 3, "CISO", "SCE"), row("2024-01-01T02", 2, "CISO", "SCE"));
        RawRowSet early = rowSet(0, row("2024-01-01T01", 1, "CISO", "SCE"), row("2024-01-01T00", 0, "CISO", "SCE"));

        Dataset dataset = assembler.assemble(Arrays.asList(late, early), Frequency.HOURLY);

        assertEquals(Arrays.asList(0.0, 1.0, 2.0, 3.0), dataset.getValues());
    }

    @Test
    public void testSortIsStableForEqualPeriods() {
        RawRowSet rows = rowSet(0,
                row("2024-01-01T01", 1, "CISO", "PGAE"),
                row("2024-01-01T00", 2, "CISO", "SCE"),
                row("2024-01-01T00", 3, "CISO", "SDGE"),
                row("2024-01-01T00", 4, "CISO", "PGAE"));

        Dataset dataset = assembler.assemble(Collections.singletonList(rows), Frequency.HOURLY);

        List<Object> subbas = new ArrayList<>();
        for (DatasetRow row : dataset.getRows()) {
            subbas.add(row.getAttribute("subba"));
        }
        assertEquals(Arrays.asList("SCE", "SDGE", "PGAE", "PGAE"), subbas);
    }

    @Test
    public void testNullValueIsKept() {
        RawRowSet rows = rowSet(0, row("2024-01-01", null, "CISO", "SCE"));

        Dataset dataset = assembler.assemble(Collections.singletonList(rows), Frequency.DAILY);

        assertNull(dataset.getRows().get(0).getValue());
    }

    @Test
    public void testNonNumericValueIsTypeMismatch() {
        RawRowSet rows = rowSet(0, row("2024-01-01", "n/a", "CISO", "SCE"));

        TypeMismatchException e = assertThrows(TypeMismatchException.class,
                () -> assembler.assemble(Collections.singletonList(rows), Frequency.DAILY));
        assertEquals("value", e.getColumn());
        assertEquals("n/a", e.getRawValue());
    }

    @Test
    public void testJavaNumberLiteralsAreNotValues() {
        for (String text : new String[] {"12d", "0x1p3", "1f", "NaN", "Infinity", ""}) {
            RawRowSet rows = rowSet(0, row("2024-01-01", text, "CISO", "SCE"));

            TypeMismatchException e = assertThrows(TypeMismatchException.class,
                    () -> assembler.assemble(Collections.singletonList(rows), Frequency.DAILY), text);
            assertEquals(text, e.getRawValue());
        }
    }

    @Test
    public void testDecimalTextIsParsed() {
        assertEquals(1500.0, DatasetAssembler.castValue("1.5E3"));
        assertEquals(-42.25, DatasetAssembler.castValue(" -42.25 "));
        assertEquals(7.0, DatasetAssembler.castValue(7));
        assertNull(DatasetAssembler.castValue(null));
    }

    @Test
    public void testUnparseablePeriodIsTypeMismatch() {
        RawRowSet hourlyInDaily = rowSet(0, row("2024-01-01T05", 1, "CISO", "SCE"));
        RawRowSet garbage = rowSet(0, row("yesterday", 1, "CISO", "SCE"));

        assertThrows(TypeMismatchException.class,
                () -> assembler.assemble(Collections.singletonList(hourlyInDaily), Frequency.DAILY));
        assertThrows(TypeMismatchException.class,
                () -> assembler.assemble(Collections.singletonList(garbage), Frequency.HOURLY));
    }

    @Test
    public void testNoRowsIsEmptyResult() {
        assertThrows(EmptyResultException.class,
                () -> assembler.assemble(Arrays.asList(rowSet(0), rowSet(1)), Frequency.HOURLY));
        assertThrows(EmptyResultException.class,
                () -> assembler.assemble(Collections.emptyList(), Frequency.HOURLY));
    }

    @Test
    public void testSeriesKeysSkipDescriptiveColumns() {
        Map<String, Object> raw = row("2024-01-01T00", 1, "CISO", "SCE");
        raw.put("subba-name", "Southern California Edison");
        raw.put("value-units", "megawatthours");
        Map<String, Object> other = row("2024-01-01T00", 2, "CISO", "SDGE");

        Dataset dataset = assembler.assemble(Collections.singletonList(rowSet(0, raw, other)), Frequency.HOURLY);

        assertEquals(Arrays.asList("parent", "subba"), dataset.getIdentifierColumns());
        assertEquals(Arrays.asList("CISO/SCE", "CISO/SDGE"), new ArrayList<>(dataset.groupBySeries().keySet()));
    }

    @SafeVarargs
    private static RawRowSet rowSet(int index, Map<String, Object>... rows) {
        return new RawRowSet(index, "chunk-" + index, new ArrayList<>(Arrays.asList(rows)));
    }

    static Map<String, Object> row(String period, Object value, String parent, String subba) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("period", period);
        row.put("parent", parent);
        row.put("subba", subba);
        row.put("value", value);
        return row;
    }
}
