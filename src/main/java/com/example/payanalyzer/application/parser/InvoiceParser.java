package com.example.payanalyzer.application.parser;

import com.example.payanalyzer.domain.model.DocumentType;
import com.example.payanalyzer.domain.model.ExtractedText;
import com.example.payanalyzer.domain.model.InvoiceEntry;
import com.example.payanalyzer.domain.model.InvoiceRecord;
import com.example.payanalyzer.domain.model.Money;
import com.example.payanalyzer.domain.model.ServiceType;
import com.example.payanalyzer.domain.model.TotalVerification;

import java.math.BigDecimal;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts dated payment lines and the printed total from invoices.
 */
public class InvoiceParser extends PdfParserBase<InvoiceRecord> {

    private static final Pattern DOCKET_TOTAL =
            Pattern.compile("docket\\s+total:\\s*£(\\d+(?:,\\d{3})*\\.?\\d{0,2})", Pattern.CASE_INSENSITIVE);
    private static final Pattern TOTAL_GBP =
            Pattern.compile("total:\\s*gbp\\s*£(\\d+(?:,\\d{3})*\\.?\\d{0,2})", Pattern.CASE_INSENSITIVE);
    private static final Pattern GBP_TOTAL =
            Pattern.compile("gbp\\s*£(\\d+(?:,\\d{3})*\\.?\\d{0,2})\\s*total:", Pattern.CASE_INSENSITIVE);
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern ENTRY_DATE = Pattern.compile("(\\d{2})/(\\d{2})/(\\d{2})");
    private static final Pattern ENTRY_TIME = Pattern.compile("\\d{2}:\\d{2}");
    private static final Pattern DECIMAL_PREFIX = Pattern.compile("\\d+\\.\\d+");
    private static final Pattern AMOUNT_PREFIX = Pattern.compile("(\\d+\\.\\d{2})");
    private static final String PICKUP_MARKER = "-PickUp";
    private static final int AMOUNT_SEARCH_WINDOW = 30;
    private static final Money TOTAL_TOLERANCE = Money.of(new BigDecimal("0.01"));

    private static final List<String> FILE_IDENTIFIERS = List.of("self", "invoice", "bill");
    private static final List<String> CONTENT_INDICATORS = List.of("invoice", "docket total", "gbp", "total:", "£");

    private final Money minAmount;
    private final Money maxAmount;
    private final Money highAmount;

    /**
     * @param minAmount  smallest amount accepted as a payment line, inclusive
     * @param maxAmount  largest amount accepted as a payment line, inclusive
     * @param highAmount line amount above which a warning is raised
     */
    public InvoiceParser(Money minAmount, Money maxAmount, Money highAmount) {
        this.minAmount = minAmount;
        this.maxAmount = maxAmount;
        this.highAmount = highAmount;
    }

    @Override
    public DocumentType documentType() {
        return DocumentType.INVOICE;
    }

    @Override
    protected List<String> fileTypeIdentifiers() {
        return FILE_IDENTIFIERS;
    }

    @Override
    protected InvoiceRecord extractData(ExtractedText text, String fileName) {
        String fullText = text.text();
        Money declaredTotal = extractDeclaredTotal(fullText);
        List<InvoiceEntry> extracted = extractEntries(fullText);

        List<InvoiceEntry> standard = new ArrayList<>();
        List<InvoiceEntry> pickups = new ArrayList<>();
        List<InvoiceEntry> extraDrops = new ArrayList<>();
        for (InvoiceEntry entry : extracted) {
            if (entry.serviceType() == ServiceType.PICKUP) {
                pickups.add(entry);
            } else if (entry.description().toLowerCase(Locale.ROOT).contains("extra drop")) {
                extraDrops.add(entry);
            } else {
                standard.add(entry);
            }
        }
        standard.sort(Comparator.comparing(InvoiceEntry::date));

        Money computedTotal = extracted.stream().map(InvoiceEntry::amount).reduce(Money.ZERO, Money::add);
        TotalVerification verification = verify(computedTotal, declaredTotal);
        List<LocalDate> dates = extracted.stream().map(InvoiceEntry::date).distinct().sorted().toList();

        return new InvoiceRecord(standard, pickups, extraDrops, declaredTotal, computedTotal, verification,
                validationMessage(verification, computedTotal, declaredTotal), dates);
    }

    @Override
    protected DataCheck validateData(InvoiceRecord data) {
        if (data.dataPoints() == 0) {
            return DataCheck.rejected("No payment entries found in invoice");
        }
        List<String> warnings = new ArrayList<>();
        if (data.verification() == TotalVerification.MISMATCHED) {
            warnings.add(data.validationMessage());
        }
        List<InvoiceEntry> all = data.allEntries();
        long high = all.stream().filter(entry -> entry.amount().isGreaterThan(highAmount)).count();
        if (high > 0) {
            warnings.add(high + " entries with amounts over " + highAmount + " detected");
        }
        long zero = all.stream().filter(entry -> entry.amount().isZero()).count();
        if (zero > 0) {
            warnings.add(zero + " entries with zero amounts detected");
        }
        return DataCheck.accepted(warnings);
    }

    @Override
    protected boolean checkContentPatterns(String content) {
        return containsAny(content, CONTENT_INDICATORS);
    }

    /**
     * @param text full invoice text
     * @return the printed total or {@code null} when none of the known layouts is present
     */
    Money extractDeclaredTotal(String text) {
        for (Pattern pattern : List.of(DOCKET_TOTAL, TOTAL_GBP, GBP_TOTAL)) {
            Matcher matcher = pattern.matcher(text);
            if (matcher.find()) {
                return Money.parse(matcher.group(1));
            }
        }
        return null;
    }

    /**
     * Walks the token stream. A {@code DD/MM/YY HH:MM} pair opens a line whose amount is the
     * first two-decimal token within the search window; amounts outside the accepted band end
     * the search without producing a line.
     *
     * @param text full invoice text
     * @return lines in document order
     */
    List<InvoiceEntry> extractEntries(String text) {
        String[] tokens = WHITESPACE.split(text.strip());
        List<InvoiceEntry> entries = new ArrayList<>();
        for (int i = 0; i < tokens.length; i++) {
            if ("Docket".equals(tokens[i]) && i + 1 < tokens.length && "Total:".equals(tokens[i + 1])) {
                break;
            }
            Matcher dateMatcher = ENTRY_DATE.matcher(tokens[i]);
            if (!dateMatcher.matches() || i + 1 >= tokens.length || !ENTRY_TIME.matcher(tokens[i + 1]).matches()) {
                continue;
            }
            LocalDate date = toDate(dateMatcher);
            if (date == null) {
                continue;
            }
            String time = tokens[i + 1];
            boolean pickup = i + 2 < tokens.length && PICKUP_MARKER.equals(tokens[i + 2]);

            int end = Math.min(i + AMOUNT_SEARCH_WINDOW, tokens.length);
            for (int j = i + 2; j < end; j++) {
                if (!DECIMAL_PREFIX.matcher(tokens[j]).lookingAt()) {
                    continue;
                }
                Matcher amountMatcher = AMOUNT_PREFIX.matcher(tokens[j]);
                if (!amountMatcher.lookingAt()) {
                    continue;
                }
                Money amount = Money.parse(amountMatcher.group(1));
                if (amount.compareTo(minAmount) >= 0 && amount.compareTo(maxAmount) <= 0) {
                    String description = String.join(" ", Arrays.copyOfRange(tokens, i + 2, j));
                    ServiceType serviceType = pickup ? ServiceType.PICKUP : ServiceType.fromDescription(description);
                    entries.add(new InvoiceEntry(date, time, amount, serviceType, description));
                }
                break;
            }
        }
        return entries;
    }

    private static LocalDate toDate(Matcher dateMatcher) {
        try {
            return LocalDate.of(2000 + Integer.parseInt(dateMatcher.group(3)),
                    Integer.parseInt(dateMatcher.group(2)), Integer.parseInt(dateMatcher.group(1)));
        } catch (DateTimeException ex) {
            return null;
        }
    }

    private static TotalVerification verify(Money computed, Money declared) {
        if (declared == null) {
            return TotalVerification.UNVERIFIED;
        }
        return computed.subtract(declared).abs().compareTo(TOTAL_TOLERANCE) <= 0
                ? TotalVerification.MATCHED
                : TotalVerification.MISMATCHED;
    }

    private static String validationMessage(TotalVerification verification, Money computed, Money declared) {
        return switch (verification) {
            case UNVERIFIED -> "Could not find document total for validation";
            case MATCHED -> "Totals match - validation successful";
            case MISMATCHED -> "Total mismatch: calculated " + computed + ", document shows " + declared
                    + " (difference: " + computed.subtract(declared) + ")";
        };
    }
}
