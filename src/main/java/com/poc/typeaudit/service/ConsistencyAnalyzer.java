package com.poc.typeaudit.service;

import com.poc.typeaudit.config.ReportProperties;
import com.poc.typeaudit.config.ReportProperties.SummaryScope;
import com.poc.typeaudit.dto.AnalysisResult;
import com.poc.typeaudit.dto.CellValue;
import com.poc.typeaudit.dto.Dataset;
import com.poc.typeaudit.dto.RowData;
import com.poc.typeaudit.dto.SummaryEntry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.*;

/**
 * Finds rows whose Data Type disagrees with the most common Data Type of their Name.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ConsistencyAnalyzer {

    private final ReportProperties properties;

    public AnalysisResult analyze(Dataset dataset) {
        // 1. Rows without a Name or Data Type take no part in the analysis
        List<RowData> rows = new ArrayList<>();
        for (RowData row : dataset.getRows()) {
            if (row.get(Dataset.NAME_COLUMN).isBlank() || row.get(Dataset.DATA_TYPE_COLUMN).isBlank()) {
                row.setFlagged(false);
                continue;
            }
            rows.add(row);
        }

        // 2. Dominant Data Type per Name
        Map<CellValue, CellValue> dominantTypes = dominantTypes(rows);

        // 3. Flag deviations
        Set<CellValue> inconsistentNames = new LinkedHashSet<>();
        for (RowData row : rows) {
            CellValue name = row.get(Dataset.NAME_COLUMN);
            boolean flagged = !row.get(Dataset.DATA_TYPE_COLUMN).equals(dominantTypes.get(name));
            row.setFlagged(flagged);
            if (flagged) {
                inconsistentNames.add(name);
            }
        }

        // 4. Count Name / Data Type pairs of the inconsistent Names
        List<SummaryEntry> summary = summarize(rows, inconsistentNames, properties.getSummaryScope());

        AnalysisResult result = new AnalysisResult(dataset.getHeaders(), rows, dominantTypes, inconsistentNames, summary);
        log.info("Analysis of '{}' complete: {} rows analyzed, {} dropped, {} flagged, {} inconsistent names",
                dataset.getSheetName(), rows.size(), dataset.getRows().size() - rows.size(),
                result.getFlaggedCount(), inconsistentNames.size());
        return result;
    }

    /**
     * Mode of Data Type per Name. On a tie the value seen first in row order wins.
     */
    private Map<CellValue, CellValue> dominantTypes(List<RowData> rows) {
        Map<CellValue, Map<CellValue, Integer>> counts = new LinkedHashMap<>();
        for (RowData row : rows) {
            counts.computeIfAbsent(row.get(Dataset.NAME_COLUMN), k -> new LinkedHashMap<>())
                    .merge(row.get(Dataset.DATA_TYPE_COLUMN), 1, Integer::sum);
        }

        Map<CellValue, CellValue> dominant = new LinkedHashMap<>();
        counts.forEach((name, typeCounts) -> {
            CellValue best = null;
            int bestCount = 0;
            for (Map.Entry<CellValue, Integer> entry : typeCounts.entrySet()) {
                // strictly greater keeps the earliest value on ties
                if (entry.getValue() > bestCount) {
                    best = entry.getKey();
                    bestCount = entry.getValue();
                }
            }
            dominant.put(name, best);
        });
        return dominant;
    }

    private List<SummaryEntry> summarize(List<RowData> rows, Set<CellValue> inconsistentNames, SummaryScope scope) {
        Map<List<CellValue>, SummaryEntry> groups = new LinkedHashMap<>();
        for (RowData row : rows) {
            CellValue name = row.get(Dataset.NAME_COLUMN);
            if (!inconsistentNames.contains(name)) continue;
            if (scope == SummaryScope.DEVIATIONS_ONLY && !row.isFlagged()) continue;

            CellValue dataType = row.get(Dataset.DATA_TYPE_COLUMN);
            SummaryEntry entry = groups.computeIfAbsent(List.of(name, dataType),
                    k -> new SummaryEntry(name, dataType, 0));
            entry.setCount(entry.getCount() + 1);
        }
        return new ArrayList<>(groups.values());
    }
}
