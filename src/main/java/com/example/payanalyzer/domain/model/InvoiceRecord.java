package com.example.payanalyzer.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Payment lines extracted from an invoice, split by category.
 *
 * @param entries           standard lines, chronological
 * @param pickupServices    pickup lines
 * @param extraDrops        extra drop lines
 * @param declaredTotal     total printed on the document, {@code null} when absent
 * @param computedTotal     sum of every captured line
 * @param verification      printed total check outcome
 * @param validationMessage human readable summary of the total check
 * @param dates             distinct dates of every captured line, chronological
 */
public record InvoiceRecord(
        List<InvoiceEntry> entries,
        List<InvoiceEntry> pickupServices,
        List<InvoiceEntry> extraDrops,
        Money declaredTotal,
        Money computedTotal,
        TotalVerification verification,
        String validationMessage,
        List<LocalDate> dates
) implements ExtractedDocument {

    public InvoiceRecord {
        entries = List.copyOf(entries);
        pickupServices = List.copyOf(pickupServices);
        extraDrops = List.copyOf(extraDrops);
        dates = List.copyOf(dates);
    }

    /**
     * @return {@code true} unless a printed total exists and disagrees with the computed one
     */
    @JsonProperty("valid")
    public boolean valid() {
        return verification != TotalVerification.MISMATCHED;
    }

    public List<InvoiceEntry> allEntries() {
        List<InvoiceEntry> all = new ArrayList<>(entries);
        all.addAll(pickupServices);
        all.addAll(extraDrops);
        return all;
    }

    @Override
    public DocumentType documentType() {
        return DocumentType.INVOICE;
    }

    @Override
    public int dataPoints() {
        return entries.size() + pickupServices.size() + extraDrops.size();
    }
}
