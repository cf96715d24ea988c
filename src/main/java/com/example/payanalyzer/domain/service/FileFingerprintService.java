package com.example.payanalyzer.domain.service;

import com.example.payanalyzer.domain.exception.EmptyFileSetException;
import com.example.payanalyzer.domain.exception.FingerprintComputationException;
import com.example.payanalyzer.domain.model.DateRange;
import com.example.payanalyzer.domain.model.FileInfo;
import com.example.payanalyzer.domain.model.FileMetadata;
import com.example.payanalyzer.domain.model.FileSetMetadata;
import com.example.payanalyzer.domain.model.FileVerdict;
import com.example.payanalyzer.domain.model.FingerprintComparison;
import com.example.payanalyzer.domain.model.FingerprintResult;
import com.example.payanalyzer.domain.model.FingerprintVerdict;
import com.example.payanalyzer.domain.model.ManualEntry;
import com.example.payanalyzer.domain.model.ManualSubmission;
import com.example.payanalyzer.domain.model.PriorSubmission;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Identifies file sets and manual submissions by content so repeated or updated submissions
 * can be recognised. Fingerprints are SHA-256 digests of canonical JSON payloads; they do not
 * depend on the order in which files are supplied.
 */
public class FileFingerprintService {

    static final int CONTENT_PREFIX_LENGTH = 1000;

    private static final List<Pattern> FILE_NAME_DATE_PATTERNS = List.of(
            Pattern.compile("(?<!\\d)(\\d{1,2})[/\\-](\\d{1,2})[/\\-](\\d{4})(?!\\d)"),
            Pattern.compile("(?<!\\d)(\\d{4})[/\\-](\\d{1,2})[/\\-](\\d{1,2})(?!\\d)"),
            Pattern.compile("(?<!\\d)(\\d{1,2})[/\\-](\\d{1,2})[/\\-](\\d{2})(?!\\d)")
    );

    private final ObjectMapper canonicalMapper;

    public FileFingerprintService() {
        this.canonicalMapper = new ObjectMapper()
                .disable(SerializationFeature.INDENT_OUTPUT);
    }

    @JsonPropertyOrder({"name", "size", "lastModified", "contentPrefix"})
    record FilePayload(String name, long size, long lastModified, String contentPrefix) {
    }

    @JsonPropertyOrder({"fileHashes", "metadata"})
    record FileSetPayload(List<String> fileHashes, FileSetMetadata metadata) {
    }

    @JsonPropertyOrder({"start", "end"})
    record PeriodPayload(String start, String end) {
    }

    @JsonPropertyOrder({"date", "consignments", "paidAmount"})
    record ManualEntryPayload(String date, int consignments, long paidAmount) {
    }

    @JsonPropertyOrder({"source", "userId", "period", "entries"})
    record ManualPayload(String source, String userId, PeriodPayload period, List<ManualEntryPayload> entries) {
    }

    /**
     * Fingerprints a set of files.
     *
     * @param files files in any order
     * @return fingerprint with its per-file hashes and aggregate metadata
     * @throws EmptyFileSetException when {@code files} is empty
     */
    public FingerprintResult createFingerprint(List<FileInfo> files) {
        if (files == null || files.isEmpty()) {
            throw new EmptyFileSetException();
        }
        List<FileInfo> sorted = files.stream()
                .sorted(Comparator.comparing((FileInfo file) -> file.name().toLowerCase(Locale.ROOT))
                        .thenComparing(FileInfo::name))
                .toList();

        List<String> fileHashes = sorted.stream()
                .map(this::hashFile)
                .sorted()
                .toList();

        FileSetMetadata metadata = new FileSetMetadata(
                sorted.size(),
                sorted.stream().mapToLong(FileInfo::size).sum(),
                sorted.stream().map(file -> getFileType(file.name())).distinct().sorted().toList()
        );

        String fingerprint = Sha256.hex(toCanonicalJson(new FileSetPayload(fileHashes, metadata)));
        return new FingerprintResult(fingerprint, fileHashes, metadata);
    }

    /**
     * Fingerprints manually entered data. Entries are ordered by date and amounts are taken in
     * whole pence, so equal submissions hash equally whatever order they were typed in.
     *
     * @param submission manual submission
     * @return SHA-256 hex digest
     */
    public String createManualFingerprint(ManualSubmission submission) {
        List<ManualEntryPayload> entries = submission.entries().stream()
                .sorted(Comparator.comparing(ManualEntry::date))
                .map(entry -> new ManualEntryPayload(
                        entry.date().toString(),
                        entry.consignments().value(),
                        entry.paidAmount().toPence()))
                .toList();
        ManualPayload payload = new ManualPayload(
                "manual",
                submission.userId(),
                new PeriodPayload(submission.period().start().toString(), submission.period().end().toString()),
                entries);
        return Sha256.hex(toCanonicalJson(payload));
    }

    public boolean areSimilar(String first, String second) {
        return first != null && first.equals(second);
    }

    /**
     * Relates a submission to earlier ones without touching them.
     * <ul>
     *     <li>{@code DUPLICATE}: the fingerprint equals an earlier fingerprint.</li>
     *     <li>{@code MODIFIED}: some file matches an earlier file by name and size but not by last-modified time.</li>
     *     <li>{@code UNCHANGED}: every file matches an earlier file by name, size and last-modified time.</li>
     *     <li>{@code NEW}: anything else.</li>
     * </ul>
     * Earlier submissions are searched most recent first.
     *
     * @param fingerprint fingerprint of the current submission
     * @param files       files of the current submission, empty for manual entry
     * @param priors      earlier submissions
     * @return overall and per-file verdicts
     */
    public FingerprintComparison compareFingerprint(String fingerprint,
                                                    List<FileMetadata> files,
                                                    List<PriorSubmission> priors) {
        List<PriorSubmission> history = priors.stream()
                .sorted(Comparator.comparing(PriorSubmission::recordedAt,
                        Comparator.nullsLast(Comparator.reverseOrder())))
                .toList();

        List<FileVerdict> fileVerdicts = new ArrayList<>();
        for (FileMetadata file : files) {
            fileVerdicts.add(compareFile(file, history));
        }

        Optional<PriorSubmission> duplicate = history.stream()
                .filter(prior -> areSimilar(fingerprint, prior.fingerprint()))
                .findFirst();
        if (duplicate.isPresent()) {
            return new FingerprintComparison(FingerprintVerdict.DUPLICATE, duplicate.get().analysisId(), fileVerdicts);
        }

        Optional<FileVerdict> modified = fileVerdicts.stream()
                .filter(verdict -> verdict.verdict() == FingerprintVerdict.MODIFIED)
                .findFirst();
        if (modified.isPresent()) {
            return new FingerprintComparison(FingerprintVerdict.MODIFIED, modified.get().matchedAnalysisId(), fileVerdicts);
        }

        boolean allUnchanged = !fileVerdicts.isEmpty()
                && fileVerdicts.stream().allMatch(verdict -> verdict.verdict() == FingerprintVerdict.UNCHANGED);
        if (allUnchanged) {
            return new FingerprintComparison(FingerprintVerdict.UNCHANGED, fileVerdicts.get(0).matchedAnalysisId(), fileVerdicts);
        }
        return new FingerprintComparison(FingerprintVerdict.NEW, null, fileVerdicts);
    }

    /**
     * Finds the earliest and latest date mentioned in the file names
     * ({@code DD-MM-YYYY}, {@code YYYY-MM-DD} or {@code DD-MM-YY}, slashes accepted too).
     *
     * @param files files to inspect
     * @return covered period, empty when no file name carries a valid date
     */
    public Optional<DateRange> extractDateRange(List<FileInfo> files) {
        LocalDate earliest = null;
        LocalDate latest = null;
        for (FileInfo file : files) {
            for (LocalDate date : extractDatesFromFileName(file.name())) {
                if (earliest == null || date.isBefore(earliest)) {
                    earliest = date;
                }
                if (latest == null || date.isAfter(latest)) {
                    latest = date;
                }
            }
        }
        return earliest == null ? Optional.empty() : Optional.of(DateRange.of(earliest, latest));
    }

    /**
     * Classifies a file by name: {@code runsheet}, {@code invoice}, otherwise its extension.
     *
     * @param fileName file name
     * @return file type label
     */
    public String getFileType(String fileName) {
        String lower = fileName.toLowerCase(Locale.ROOT);
        if (lower.contains("runsheet") || lower.contains("dv_")) {
            return "runsheet";
        }
        if (lower.contains("self") || lower.contains("invoice") || lower.contains("bill")) {
            return "invoice";
        }
        int dot = lower.lastIndexOf('.');
        String extension = dot >= 0 ? lower.substring(dot + 1) : lower;
        return extension.isEmpty() ? "unknown" : extension;
    }

    private FileVerdict compareFile(FileMetadata file, List<PriorSubmission> history) {
        FileVerdict modified = null;
        for (PriorSubmission prior : history) {
            for (FileMetadata previous : prior.files()) {
                if (!file.sameSignature(previous)) {
                    continue;
                }
                if (previous.lastModified() == file.lastModified()) {
                    return new FileVerdict(file.name(), FingerprintVerdict.UNCHANGED, prior.analysisId(), previous.lastModified());
                }
                if (modified == null) {
                    modified = new FileVerdict(file.name(), FingerprintVerdict.MODIFIED, prior.analysisId(), previous.lastModified());
                }
            }
        }
        return modified != null ? modified : new FileVerdict(file.name(), FingerprintVerdict.NEW, null, null);
    }

    private String hashFile(FileInfo file) {
        String content = file.content() != null ? file.content() : "";
        String prefix = content.length() > CONTENT_PREFIX_LENGTH ? content.substring(0, CONTENT_PREFIX_LENGTH) : content;
        return Sha256.hex(toCanonicalJson(new FilePayload(
                file.name().toLowerCase(Locale.ROOT), file.size(), file.lastModified(), prefix)));
    }

    private String toCanonicalJson(Object payload) {
        try {
            return canonicalMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new FingerprintComputationException("Unable to serialize fingerprint payload", e);
        }
    }

    private List<LocalDate> extractDatesFromFileName(String fileName) {
        List<LocalDate> dates = new ArrayList<>();
        for (Pattern pattern : FILE_NAME_DATE_PATTERNS) {
            Matcher matcher = pattern.matcher(fileName);
            while (matcher.find()) {
                toDate(matcher).ifPresent(dates::add);
            }
        }
        return dates;
    }

    private Optional<LocalDate> toDate(Matcher matcher) {
        String first = matcher.group(1);
        String third = matcher.group(3);
        int year;
        int month = Integer.parseInt(matcher.group(2));
        int day;
        if (third.length() == 4) {
            day = Integer.parseInt(first);
            year = Integer.parseInt(third);
        } else if (first.length() == 4) {
            year = Integer.parseInt(first);
            day = Integer.parseInt(third);
        } else {
            day = Integer.parseInt(first);
            int shortYear = Integer.parseInt(third);
            year = shortYear + (shortYear <= 30 ? 2000 : 1900);
        }
        try {
            return Optional.of(LocalDate.of(year, month, day));
        } catch (DateTimeException ex) {
            return Optional.empty();
        }
    }
}
