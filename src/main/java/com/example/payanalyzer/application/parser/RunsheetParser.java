package com.example.payanalyzer.application.parser;

import com.example.payanalyzer.domain.model.ConsignmentCount;
import com.example.payanalyzer.domain.model.DocumentType;
import com.example.payanalyzer.domain.model.ExtractedText;
import com.example.payanalyzer.domain.model.PageText;
import com.example.payanalyzer.domain.model.RunsheetDay;
import com.example.payanalyzer.domain.model.RunsheetRecord;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts per-date consignment counts from delivery runsheets. Each page carries one
 * delivery date; consignments are recognised from the token layout of the job table.
 */
public class RunsheetParser extends PdfParserBase<RunsheetRecord> {

    private static final Logger log = LoggerFactory.getLogger(RunsheetParser.class);

    private static final Pattern LABELLED_DATE = Pattern.compile("Date:\\s*(\\d{2})[-/](\\d{2})[-/](\\d{4})");
    private static final Pattern DAY_FIRST_DATE = Pattern.compile("(\\d{2})[-/](\\d{2})[-/](\\d{4})");
    private static final Pattern YEAR_FIRST_DATE = Pattern.compile("(\\d{4})[-/](\\d{2})[-/](\\d{2})");
    private static final Pattern LOOSE_LABELLED_DATE =
            Pattern.compile("Date[\\s:]*(\\d{1,2})[-/](\\d{1,2})[-/](\\d{2,4})", Pattern.CASE_INSENSITIVE);
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern JOB_NUMBER = Pattern.compile("\\d+");
    private static final Pattern CONSIGNMENT_ID = Pattern.compile("\\d{7}|AH\\d+");
    private static final int JOB_WINDOW = 10;

    private static final List<String> FILE_IDENTIFIERS = List.of("runsheet", "dv_");
    private static final List<String> CONTENT_INDICATORS =
            List.of("runsheet", "delivery", "collection", "consignment", "dv_");

    private final int highConsignmentCount;
    private final Clock clock;

    /**
     * @param highConsignmentCount per-day count above which a warning is raised
     * @param clock                source of "today" for pages without any date
     */
    public RunsheetParser(int highConsignmentCount, Clock clock) {
        this.highConsignmentCount = highConsignmentCount;
        this.clock = clock;
    }

    @Override
    public DocumentType documentType() {
        return DocumentType.RUNSHEET;
    }

    @Override
    protected List<String> fileTypeIdentifiers() {
        return FILE_IDENTIFIERS;
    }

    @Override
    protected RunsheetRecord extractData(ExtractedText text, String fileName) {
        Map<LocalDate, List<String>> idsByDate = new TreeMap<>();
        for (PageText page : text.pages()) {
            List<String> consignments = extractConsignments(page.text());
            if (consignments.isEmpty()) {
                continue;
            }
            LocalDate date = extractDate(page.text())
                    .or(() -> dateFromFileName(fileName))
                    .orElseGet(() -> {
                        log.warn("No date on page {} of {}; using today's date.", page.pageNumber(), fileName);
                        return LocalDate.now(clock);
                    });
            idsByDate.computeIfAbsent(date, key -> new ArrayList<>()).addAll(consignments);
        }

        List<RunsheetDay> days = new ArrayList<>();
        int total = 0;
        for (Map.Entry<LocalDate, List<String>> entry : idsByDate.entrySet()) {
            List<String> ids = entry.getValue();
            days.add(new RunsheetDay(entry.getKey(), ConsignmentCount.of(ids.size()), ids));
            total += ids.size();
        }
        return new RunsheetRecord(days, total);
    }

    @Override
    protected DataCheck validateData(RunsheetRecord data) {
        if (data.days().isEmpty()) {
            return DataCheck.rejected("No dates found in runsheet");
        }
        if (data.totalConsignments() == 0) {
            return DataCheck.rejected("No consignments found in runsheet");
        }
        List<String> warnings = new ArrayList<>();
        for (RunsheetDay day : data.days()) {
            if (day.consignments().isGreaterThan(highConsignmentCount)) {
                warnings.add("Very high consignment count (" + day.consignments().value() + ") on " + day.date());
            }
        }
        if (data.days().stream().anyMatch(day -> day.date().getDayOfWeek() == DayOfWeek.SUNDAY)) {
            warnings.add("Sunday deliveries detected");
        }
        return DataCheck.accepted(warnings);
    }

    @Override
    protected boolean checkContentPatterns(String content) {
        return containsAny(content, CONTENT_INDICATORS);
    }

    /**
     * Finds the page date. Patterns are tried in order; a match that is not a real calendar
     * date moves on to the next pattern.
     *
     * @param pageText text of one page
     * @return the page date, empty when no pattern yields one
     */
    Optional<LocalDate> extractDate(String pageText) {
        Optional<LocalDate> date = dayFirst(LABELLED_DATE.matcher(pageText), false);
        if (date.isEmpty()) {
            date = dayFirst(DAY_FIRST_DATE.matcher(pageText), false);
        }
        if (date.isEmpty()) {
            date = yearFirst(YEAR_FIRST_DATE.matcher(pageText));
        }
        if (date.isEmpty()) {
            date = dayFirst(LOOSE_LABELLED_DATE.matcher(pageText), true);
        }
        return date;
    }

    /**
     * Recognises consignments: a job number followed by a seven digit or {@code AH} prefixed
     * identifier, with {@code Delivery} or {@code Collection} within the next few tokens.
     *
     * @param pageText text of one page
     * @return consignment identifiers in page order
     */
    List<String> extractConsignments(String pageText) {
        String[] tokens = WHITESPACE.split(pageText.strip());
        List<String> ids = new ArrayList<>();
        for (int i = 0; i < tokens.length - 1; i++) {
            if (!JOB_NUMBER.matcher(tokens[i]).matches() || !CONSIGNMENT_ID.matcher(tokens[i + 1]).matches()) {
                continue;
            }
            String window = String.join(" ", Arrays.copyOfRange(tokens, i, Math.min(i + JOB_WINDOW, tokens.length)));
            if (window.contains("Delivery") || window.contains("Collection")) {
                ids.add(tokens[i + 1]);
            }
        }
        return ids;
    }

    private Optional<LocalDate> dateFromFileName(String fileName) {
        if (fileName == null) {
            return Optional.empty();
        }
        return yearFirst(YEAR_FIRST_DATE.matcher(fileName));
    }

    private static Optional<LocalDate> dayFirst(Matcher matcher, boolean allowShortYear) {
        if (!matcher.find()) {
            return Optional.empty();
        }
        int year = Integer.parseInt(matcher.group(3));
        if (allowShortYear && year < 100) {
            year += year < 50 ? 2000 : 1900;
        }
        return toDate(year, Integer.parseInt(matcher.group(2)), Integer.parseInt(matcher.group(1)));
    }

    private static Optional<LocalDate> yearFirst(Matcher matcher) {
        if (!matcher.find()) {
            return Optional.empty();
        }
        return toDate(Integer.parseInt(matcher.group(1)), Integer.parseInt(matcher.group(2)),
                Integer.parseInt(matcher.group(3)));
    }

    private static Optional<LocalDate> toDate(int year, int month, int day) {
        try {
            return Optional.of(LocalDate.of(year, month, day));
        } catch (DateTimeException ex) {
            return Optional.empty();
        }
    }
}
