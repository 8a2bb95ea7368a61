package dev.jobwatch.model;

import java.util.List;

/**
 * Raw cell texts of a table body row plus the resolved link of its first anchor.
 */
public record TableRow(List<String> cells, String link) {

    public TableRow {
        cells = cells == null ? List.of() : List.copyOf(cells);
        link = link == null ? "" : link;
    }

    public int size() {
        return cells.size();
    }

    public String cell(int index) {
        return cells.get(index);
    }
}
