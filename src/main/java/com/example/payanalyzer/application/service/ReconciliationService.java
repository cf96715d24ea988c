package com.example.payanalyzer.application.service;

import com.example.payanalyzer.domain.model.ConsignmentCount;
import com.example.payanalyzer.domain.model.DailyEntry;
import com.example.payanalyzer.domain.model.InvoiceEntry;
import com.example.payanalyzer.domain.model.InvoiceRecord;
import com.example.payanalyzer.domain.model.ManualEntry;
import com.example.payanalyzer.domain.model.MergeStrategy;
import com.example.payanalyzer.domain.model.Money;
import com.example.payanalyzer.domain.model.ProcessedFile;
import com.example.payanalyzer.domain.model.ProcessingResult;
import com.example.payanalyzer.domain.model.RunsheetDay;
import com.example.payanalyzer.domain.model.RunsheetRecord;
import com.example.payanalyzer.domain.service.PaymentCalculator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Turns extracted runsheet and invoice data into per-day payment entries.
 */
@Service
public class ReconciliationService {

    private static final Logger log = LoggerFactory.getLogger(ReconciliationService.class);

    /**
     * Builds one entry per date found in any successful extraction, chronologically.
     * Consignments come from runsheets, paid amounts from standard and extra drop invoice lines,
     * pickup figures from pickup lines.
     *
     * @param analysisId owning analysis
     * @param result     processed batch
     * @param calculator calculator holding the rules to apply
     * @return daily entries, possibly empty
     */
    public List<DailyEntry> buildDailyEntries(String analysisId, ProcessingResult result, PaymentCalculator calculator) {
        Map<LocalDate, ConsignmentCount> consignments = new TreeMap<>();
        Map<LocalDate, Money> paid = new TreeMap<>();
        Map<LocalDate, ConsignmentCount> pickups = new TreeMap<>();
        Map<LocalDate, Money> pickupTotals = new TreeMap<>();

        for (ProcessedFile file : result.files()) {
            if (!file.isSuccess()) {
                continue;
            }
            file.runsheet().map(RunsheetRecord::days).orElse(List.of()).forEach(day -> addConsignments(consignments, day));
            Optional<InvoiceRecord> invoice = file.invoice();
            if (invoice.isPresent()) {
                for (InvoiceEntry entry : invoice.get().entries()) {
                    paid.merge(entry.date(), entry.amount(), Money::add);
                }
                for (InvoiceEntry entry : invoice.get().extraDrops()) {
                    paid.merge(entry.date(), entry.amount(), Money::add);
                }
                for (InvoiceEntry entry : invoice.get().pickupServices()) {
                    pickups.merge(entry.date(), ConsignmentCount.of(1), ConsignmentCount::add);
                    pickupTotals.merge(entry.date(), entry.amount(), Money::add);
                }
            }
        }

        SortedSet<LocalDate> dates = new TreeSet<>(consignments.keySet());
        dates.addAll(paid.keySet());
        dates.addAll(pickups.keySet());

        List<DailyEntry> entries = new ArrayList<>();
        for (LocalDate date : dates) {
            entries.add(calculator.calculateDailyPayment(
                    analysisId,
                    date,
                    consignments.getOrDefault(date, ConsignmentCount.ZERO),
                    pickups.getOrDefault(date, ConsignmentCount.ZERO),
                    pickupTotals.getOrDefault(date, Money.ZERO),
                    paid.getOrDefault(date, Money.ZERO)));
        }
        log.debug("Built {} daily entries for analysis {}", entries.size(), analysisId);
        return entries;
    }

    /**
     * Builds entries for manually entered days, chronologically; a later entry for the same date wins.
     *
     * @param analysisId owning analysis
     * @param manual     entered days
     * @param calculator calculator holding the rules to apply
     * @return daily entries
     */
    public List<DailyEntry> buildManualEntries(String analysisId, List<ManualEntry> manual, PaymentCalculator calculator) {
        Map<LocalDate, ManualEntry> byDate = new TreeMap<>();
        manual.forEach(entry -> byDate.put(entry.date(), entry));
        return byDate.values().stream()
                .map(entry -> calculator.calculateDailyPayment(analysisId, entry.date(), entry.consignments(),
                        ConsignmentCount.ZERO, Money.ZERO, entry.paidAmount()))
                .toList();
    }

    /**
     * Standard and extra drop invoice amounts of a batch, grouped by date.
     *
     * @param result processed batch
     * @return amounts per date, chronological
     */
    public Map<LocalDate, List<Money>> invoiceAmountsByDate(ProcessingResult result) {
        Map<LocalDate, List<Money>> amounts = new TreeMap<>();
        result.files().stream()
                .filter(ProcessedFile::isSuccess)
                .flatMap(file -> file.invoice().stream())
                .flatMap(invoice -> {
                    List<InvoiceEntry> paidLines = new ArrayList<>(invoice.entries());
                    paidLines.addAll(invoice.extraDrops());
                    return paidLines.stream();
                })
                .forEach(entry -> amounts.computeIfAbsent(entry.date(), key -> new ArrayList<>()).add(entry.amount()));
        return amounts;
    }

    /**
     * Applies newly extracted amounts to existing entries. Entries without incoming amounts are
     * left untouched; dates without an entry are ignored.
     *
     * @param entries  existing entries, updated in place
     * @param incoming new amounts per date
     * @param strategy how existing and incoming amounts combine
     * @return number of entries whose paid amount was updated
     */
    public int mergePaidAmounts(List<DailyEntry> entries, Map<LocalDate, List<Money>> incoming, MergeStrategy strategy) {
        int updated = 0;
        for (DailyEntry entry : entries) {
            List<Money> amounts = incoming.get(entry.getDate());
            if (amounts == null || amounts.isEmpty()) {
                continue;
            }
            entry.updatePaidAmount(strategy.merge(entry.getPaidAmount(), amounts));
            updated++;
        }
        log.debug("Merged paid amounts into {} entries using {}", updated, strategy);
        return updated;
    }

    private static void addConsignments(Map<LocalDate, ConsignmentCount> consignments, RunsheetDay day) {
        consignments.merge(day.date(), day.consignments(), ConsignmentCount::add);
    }
}
