package com.poc.typeaudit.service;

import com.poc.typeaudit.config.ReportProperties;
import com.poc.typeaudit.config.ReportProperties.SummaryScope;
import com.poc.typeaudit.dto.AnalysisResult;
import com.poc.typeaudit.dto.CellValue;
import com.poc.typeaudit.dto.Dataset;
import com.poc.typeaudit.dto.RowData;
import com.poc.typeaudit.dto.SummaryEntry;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static com.poc.typeaudit.service.TestWorkbooks.dataset;
import static com.poc.typeaudit.service.TestWorkbooks.row;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConsistencyAnalyzerTest {

    private static ConsistencyAnalyzer analyzer(SummaryScope scope) {
        ReportProperties properties = new ReportProperties();
        properties.setSummaryScope(scope);
        return new ConsistencyAnalyzer(properties);
    }

    private static List<Boolean> flags(AnalysisResult result) {
        return result.getRows().stream().map(RowData::isFlagged).collect(Collectors.toList());
    }

    @Test
    void shouldFlagMinorityTypeAndReportOnlyDeviationsInDeviationScope() {
        Dataset data = dataset(row("x", "int"), row("x", "int"), row("x", "str"));

        AnalysisResult result = analyzer(SummaryScope.DEVIATIONS_ONLY).analyze(data);

        assertEquals(CellValue.text("int"), result.getDominantTypes().get(CellValue.text("x")));
        assertEquals(List.of(false, false, true), flags(result));
        assertEquals(List.of(new SummaryEntry(CellValue.text("x"), CellValue.text("str"), 1)), result.getSummary());
    }

    @Test
    void shouldCountEveryTypeOfInconsistentNameByDefault() {
        Dataset data = dataset(row("x", "int"), row("x", "int"), row("x", "str"));

        AnalysisResult result = analyzer(SummaryScope.ALL_TYPES).analyze(data);

        assertEquals(List.of(
                new SummaryEntry(CellValue.text("x"), CellValue.text("int"), 2),
                new SummaryEntry(CellValue.text("x"), CellValue.text("str"), 1)
        ), result.getSummary());
    }

    @Test
    void shouldNotFlagAnythingWhenEveryNameHasOneType() {
        Dataset data = dataset(row("a", "int"), row("a", "int"), row("b", "date"), row("a", "int"));

        AnalysisResult result = analyzer(SummaryScope.ALL_TYPES).analyze(data);

        assertEquals(0, result.getFlaggedCount());
        assertTrue(result.getInconsistentNames().isEmpty());
        assertTrue(result.getSummary().isEmpty());
    }

    @Test
    void shouldBreakTiesByFirstSeenValue() {
        Dataset data = dataset(row("k", "str"), row("k", "int"), row("k", "int"), row("k", "str"));

        AnalysisResult result = analyzer(SummaryScope.ALL_TYPES).analyze(data);

        assertEquals(CellValue.text("str"), result.getDominantTypes().get(CellValue.text("k")));
        assertEquals(List.of(false, true, true, false), flags(result));
    }

    @Test
    void shouldDropRowsWithoutNameOrDataType() {
        Dataset data = dataset(row("a", "int"), row(null, "str"), row("a", " "), row("a", "str"), row("a", "int"));

        AnalysisResult result = analyzer(SummaryScope.ALL_TYPES).analyze(data);

        assertEquals(List.of(1, 4, 5), result.getRows().stream()
                .map(RowData::getOriginalRowIndex).collect(Collectors.toList()));
        assertEquals(1, result.getFlaggedCount());
        assertFalse(data.getRows().get(1).isFlagged());
    }

    @Test
    void shouldKeepTextAndNumericTypesApart() {
        Dataset data = dataset(row(7, "int"), row("7", "str"), row(7, "int"));

        AnalysisResult result = analyzer(SummaryScope.ALL_TYPES).analyze(data);

        assertEquals(0, result.getFlaggedCount());
        assertEquals(2, result.getDominantTypes().size());
    }

    @Test
    void flaggedCountsAndSummaryTotalsMatchGroupSizes() {
        Dataset data = dataset(
                row("id", "int"), row("id", "int"), row("id", "bigint"), row("id", "str"),
                row("ts", "date"), row("ts", "datetime"), row("ts", "date"),
                row("flag", "bool"));

        AnalysisResult result = analyzer(SummaryScope.ALL_TYPES).analyze(data);

        Map<CellValue, Long> flaggedPerName = result.getRows().stream()
                .filter(RowData::isFlagged)
                .collect(Collectors.groupingBy(r -> r.get(Dataset.NAME_COLUMN), Collectors.counting()));
        assertEquals(2L, flaggedPerName.get(CellValue.text("id")));
        assertEquals(1L, flaggedPerName.get(CellValue.text("ts")));
        assertFalse(flaggedPerName.containsKey(CellValue.text("flag")));

        Map<CellValue, Long> summaryTotals = result.getSummary().stream()
                .collect(Collectors.groupingBy(SummaryEntry::getName, Collectors.summingLong(SummaryEntry::getCount)));
        assertEquals(Map.of(CellValue.text("id"), 4L, CellValue.text("ts"), 3L), summaryTotals);
        assertEquals(List.of(CellValue.text("id"), CellValue.text("ts")), List.copyOf(result.getInconsistentNames()));
    }
}
