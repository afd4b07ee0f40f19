package com.handelsregister.scraper.parser;

import com.handelsregister.scraper.model.Company;
import com.handelsregister.scraper.model.HistoryEntry;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * <h2>Register result grid parser</h2>
 *
 * <p>The portal renders its hits in a PrimeFaces data table
 * ({@code <table role="grid">}). Every hit is a {@code <tr data-ri="n">};
 * header, footer and spacer rows carry no {@code data-ri} and are ignored.</p>
 *
 * <p>Cell layout of a hit row (trimmed text; the status cell keeps its inner
 * whitespace as served):</p>
 * <pre>
 *  0  (expander)
 *  1  court + register number
 *  2  name
 *  3  state
 *  4  status
 *  5  documents
 *  6,7 (layout)
 *  8… history block: (name, location, spacer) triples, optionally followed
 *     by a branches section
 * </pre>
 *
 * <p>Rows with fewer than {@value #MIN_CELLS} cells are logged and skipped so
 * one broken row never voids the rest of the page.</p>
 */
@Slf4j
@Component("registerGridParser")
public final class RegisterResultGridParser implements ResultGridParser {

    static final int MIN_CELLS = 6;

    private static final String ROW_INDEX_ATTR = "data-ri";

    private static final int COL_COURT = 1;
    private static final int COL_NAME = 2;
    private static final int COL_STATE = 3;
    private static final int COL_STATUS = 4;
    private static final int COL_DOCUMENTS = 5;

    /** First cell of the history block. */
    static final int HISTORY_OFFSET = 8;

    /** Each history entry occupies name, location and one spacer cell. */
    static final int HISTORY_STRIDE = 3;

    private static final List<String> SECTION_MARKERS = List.of("Branches", "Niederlassungen");

    /** Position in the cell sequence while reading a row. */
    enum RowSection {
        READING_COURT_BLOCK,
        READING_HISTORY_PAIR,
        DONE
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public List<Company> parse(final String html) {
        if (StringUtils.isBlank(html)) {
            return List.of();
        }
        Document doc = Jsoup.parse(html);
        Element grid = doc.selectFirst("table[role=grid]");
        if (grid == null) {
            log.debug("No result grid in document, zero hits");
            return List.of();
        }

        List<Company> companies = new ArrayList<>();
        for (Element tr : grid.select("tr")) {
            if (!isResultRow(tr)) {
                continue;
            }
            List<String> cells = readCells(tr);
            if (cells.size() < MIN_CELLS) {
                log.debug("Skipping malformed result row {} with {} cells",
                        tr.attr(ROW_INDEX_ATTR), cells.size());
                continue;
            }
            companies.add(toCompany(cells));
        }
        log.debug("Parsed {} companies from result grid", companies.size());
        return Collections.unmodifiableList(companies);
    }

    private static List<String> readCells(final Element tr) {
        List<Element> tds = tr.select("td");
        List<String> cells = new ArrayList<>(tds.size());
        for (int j = 0; j < tds.size(); j++) {
            Element td = tds.get(j);
            cells.add(j == COL_STATUS ? td.wholeText().trim() : td.text().trim());
        }
        return cells;
    }

    private static boolean isResultRow(final Element tr) {
        String index = tr.attr(ROW_INDEX_ATTR).trim();
        return !index.isEmpty() && StringUtils.isNumeric(index);
    }

    private static Company toCompany(final List<String> cells) {
        String court = cells.get(COL_COURT);
        String state = cells.get(COL_STATE);
        String status = cells.get(COL_STATUS);

        return new Company(
                court,
                RegisterNumbers.extract(court, state).orElse(null),
                cells.get(COL_NAME),
                state,
                status,
                normalizeStatus(status),
                cells.get(COL_DOCUMENTS),
                readHistory(cells));
    }

    static String normalizeStatus(final String status) {
        return status.trim().toUpperCase(Locale.ROOT).replace(' ', '_');
    }

    /**
     * Walk the history block up to the first cell holding a section marker,
     * or the end of the row.
     */
    static List<HistoryEntry> readHistory(final List<String> cells) {
        List<HistoryEntry> history = new ArrayList<>();
        RowSection section = RowSection.READING_COURT_BLOCK;
        int i = 0;
        int end = cells.size();

        while (section != RowSection.DONE) {
            switch (section) {
                case READING_COURT_BLOCK -> {
                    i = HISTORY_OFFSET;
                    end = firstMarker(cells, HISTORY_OFFSET);
                    section = RowSection.READING_HISTORY_PAIR;
                }
                case READING_HISTORY_PAIR -> {
                    if (i + 1 >= end) {
                        section = RowSection.DONE;
                    } else {
                        history.add(new HistoryEntry(cells.get(i), cells.get(i + 1)));
                        i += HISTORY_STRIDE;
                    }
                }
                default -> section = RowSection.DONE;
            }
        }
        return history;
    }

    private static int firstMarker(final List<String> cells, final int from) {
        for (int j = from; j < cells.size(); j++) {
            if (startsOtherSection(cells.get(j))) {
                return j;
            }
        }
        return cells.size();
    }

    private static boolean startsOtherSection(final String cell) {
        return SECTION_MARKERS.stream().anyMatch(cell::contains);
    }
}
