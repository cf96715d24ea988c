package com.example.payanalyzer.domain.model;

/**
 * Batch counters.
 *
 * @param totalFiles          files supplied
 * @param successfulFiles     files whose extraction succeeded
 * @param failedFiles         every other file
 * @param runsheetCount       files recognised as runsheets
 * @param successfulRunsheets runsheets whose extraction succeeded
 * @param invoiceCount        files recognised as invoices
 * @param successfulInvoices  invoices whose extraction succeeded
 * @param inferredCount       files whose type was chosen by comparing both extractions
 */
public record ProcessingSummary(
        int totalFiles,
        int successfulFiles,
        int failedFiles,
        int runsheetCount,
        int successfulRunsheets,
        int invoiceCount,
        int successfulInvoices,
        int inferredCount
) {
}
