package com.derbyresults.service;

import com.derbyresults.model.CanonicalRecord;
import com.derbyresults.model.TabularView;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Flat audit view of the canonical table with a fixed column order.
 */
@Service
public class CanonicalTableExporter {

    public static final List<String> COLUMNS = List.of(
        "Year", "FirstName", "LastName", "CarNumber", "CarName", "Class", "OriginalClass",
        "RoundID", "Heat", "Lane", "Completed", "FinishTime", "FinishPlace",
        "FullName", "RacerClassId"
    );

    public TabularView toView(List<CanonicalRecord> records) {
        List<List<Object>> rows = new ArrayList<>(records.size());
        for (CanonicalRecord r : records) {
            rows.add(Arrays.asList(
                r.year(), r.firstName(), r.lastName(), r.carNumber(), r.carName(),
                r.standardClassName(), r.originalClassLabel(),
                r.roundId(), r.heat(), r.lane(), r.completed(), r.finishTime(), r.finishPlace(),
                r.fullName(), r.racerClassId()
            ));
        }
        return new TabularView(COLUMNS, rows);
    }

    /** CSV with a header line; nulls are empty, fields with comma, quote or newline are quoted. */
    public String toCsv(List<CanonicalRecord> records) {
        TabularView view = toView(records);
        StringBuilder csv = new StringBuilder(String.join(",", view.columns()));
        for (List<Object> row : view.rows()) {
            csv.append('\n');
            for (int i = 0; i < row.size(); i++) {
                if (i > 0) csv.append(',');
                csv.append(escape(row.get(i)));
            }
        }
        return csv.toString();
    }

    private static String escape(Object value) {
        if (value == null) return "";
        String s = String.valueOf(value);
        if (s.contains(",") || s.contains("\"") || s.contains("\n")) {
            return "\"" + s.replace("\"", "\"\"") + "\"";
        }
        return s;
    }
}
