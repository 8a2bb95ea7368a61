package dev.jobwatch.service;

import dev.jobwatch.model.JobListing;
import dev.jobwatch.model.TableRow;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Objects;

/**
 * Turns the listing table into {@link JobListing} records.
 * Columns are positional; rows narrower than {@link #MIN_CELLS} are skipped.
 */
@Slf4j
@Service
public class ExtractionService {

    public static final int MIN_CELLS = 19;

    private static final int COL_SERIAL_NUMBER = 0;
    private static final int COL_POST_NAME = 1;
    private static final int COL_DEPARTMENT = 2;
    private static final int COL_CASE_NUMBER = 3;
    private static final int COL_ADVERTISEMENT_NUMBER = 4;
    private static final int COL_CLOSING_DATE = 7;
    private static final int COL_STATUS = 18;

    /**
     * Read body rows from the table markup.
     *
     * @param tableHtml outer HTML of the listing table, may be blank
     * @param baseUri   page URL used to resolve relative links
     */
    public List<TableRow> parseRows(String tableHtml, String baseUri) {
        if (tableHtml == null || tableHtml.isBlank()) {
            return List.of();
        }
        Document document = Jsoup.parse(tableHtml, baseUri == null ? "" : baseUri);
        return document.select("tbody tr").stream()
                .map(this::toTableRow)
                .toList();
    }

    /**
     * Map rows to listings, dropping rows that do not have every column.
     */
    public List<JobListing> extract(List<TableRow> rows) {
        List<JobListing> listings = rows.stream()
                .map(this::toListing)
                .filter(Objects::nonNull)
                .toList();

        int skipped = rows.size() - listings.size();
        if (skipped > 0) {
            log.debug("Skipped {} rows with fewer than {} cells", skipped, MIN_CELLS);
        }
        log.info("Found {} jobs. Filtering...", listings.size());
        if (!listings.isEmpty()) {
            log.debug("First job sample: {}", listings.get(0));
        }
        return listings;
    }

    private TableRow toTableRow(Element row) {
        List<String> cells = row.select("td").stream()
                .map(Element::text)
                .toList();
        Element anchor = row.selectFirst("a");
        String link = anchor != null ? anchor.absUrl("href") : "";
        return new TableRow(cells, link);
    }

    private JobListing toListing(TableRow row) {
        if (row == null || row.size() < MIN_CELLS) {
            return null;
        }
        return JobListing.builder()
                .serialNumber(clean(row.cell(COL_SERIAL_NUMBER)))
                .postName(clean(row.cell(COL_POST_NAME)))
                .department(clean(row.cell(COL_DEPARTMENT)))
                .caseNumber(clean(row.cell(COL_CASE_NUMBER)))
                .advertisementNumber(clean(row.cell(COL_ADVERTISEMENT_NUMBER)))
                .closingDate(clean(row.cell(COL_CLOSING_DATE)))
                .status(clean(row.cell(COL_STATUS)))
                .detailLink(clean(row.link()))
                .build();
    }

    private String clean(String value) {
        return value == null ? "" : value.strip();
    }
}
