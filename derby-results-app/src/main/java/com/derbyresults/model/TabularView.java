package com.derbyresults.model;

import java.util.List;

/**
 * Flat table with a fixed column order.
 */
public record TabularView(List<String> columns, List<List<Object>> rows) {

    public TabularView {
        columns = List.copyOf(columns);
        rows = List.copyOf(rows);
    }
}
