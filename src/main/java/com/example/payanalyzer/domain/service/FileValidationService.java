package com.example.payanalyzer.domain.service;

import com.example.payanalyzer.domain.model.FileMetadata;
import com.example.payanalyzer.domain.model.FileValidationOptions;
import com.example.payanalyzer.domain.model.FileValidationResult;
import com.example.payanalyzer.domain.model.PriorSubmission;
import com.example.payanalyzer.domain.model.UploadedPdf;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Batch-level checks run before any file is parsed: limits, PDF signature, repeated files
 * inside the batch and relation to earlier submissions.
 */
public class FileValidationService {

    private static final byte[] PDF_MAGIC = {0x25, 0x50, 0x44, 0x46};

    private final FileValidationOptions options;

    public FileValidationService(FileValidationOptions options) {
        this.options = Objects.requireNonNull(options, "options");
    }

    public FileValidationOptions getOptions() {
        return options;
    }

    /**
     * @param content file bytes
     * @return {@code true} when the bytes start with {@code %PDF}
     */
    public static boolean hasPdfHeader(byte[] content) {
        if (content == null || content.length < PDF_MAGIC.length) {
            return false;
        }
        for (int i = 0; i < PDF_MAGIC.length; i++) {
            if (content[i] != PDF_MAGIC[i]) {
                return false;
            }
        }
        return true;
    }

    /**
     * Validates a batch.
     *
     * @param files  batch in submission order
     * @param priors earlier submissions of the same user, may be empty
     * @return errors, warnings and the relation to earlier submissions
     */
    public FileValidationResult validateFiles(List<UploadedPdf> files, List<PriorSubmission> priors) {
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        if (files == null || files.isEmpty()) {
            errors.add("No files selected");
            return new FileValidationResult(errors, warnings, false, List.of(), List.of(), null);
        }

        validateBasicRequirements(files, errors);
        validatePdfSignatures(files, errors);
        findIdenticalContent(files, errors);

        List<FileMetadata> duplicates = List.of();
        if (options.checkForDuplicates()) {
            duplicates = findDuplicateSignatures(files);
            if (!duplicates.isEmpty()) {
                warnings.add("Duplicate files detected: " + duplicates.stream()
                        .map(FileMetadata::name)
                        .collect(Collectors.joining(", ")));
            }
        }

        List<String> updatedFiles = List.of();
        String existingAnalysisId = null;
        if (options.checkForUpdates() && priors != null && !priors.isEmpty()) {
            updatedFiles = findUpdatedFiles(files, priors);
            if (!updatedFiles.isEmpty()) {
                warnings.add("File updates detected: " + String.join(", ", updatedFiles)
                        + ". Consider re-processing to get latest data.");
            }
            existingAnalysisId = findExistingAnalysis(files, priors);
            if (existingAnalysisId != null) {
                warnings.add("Files match existing analysis: " + existingAnalysisId);
            }
        }

        return new FileValidationResult(errors, warnings, !updatedFiles.isEmpty(), updatedFiles, duplicates, existingAnalysisId);
    }

    /**
     * Finds an earlier submission made of exactly the same files by name and size, in any order.
     *
     * @param files  current batch
     * @param priors earlier submissions
     * @return identifier of the matching analysis or {@code null}
     */
    public String findExistingAnalysis(List<UploadedPdf> files, List<PriorSubmission> priors) {
        List<String> current = files.stream()
                .map(file -> signature(file.name(), file.size()))
                .sorted()
                .toList();
        return priors.stream()
                .filter(prior -> !prior.files().isEmpty())
                .filter(prior -> current.equals(prior.files().stream()
                        .map(file -> signature(file.name(), file.size()))
                        .sorted()
                        .toList()))
                .map(PriorSubmission::analysisId)
                .findFirst()
                .orElse(null);
    }

    private void validateBasicRequirements(List<UploadedPdf> files, List<String> errors) {
        if (files.size() > options.maxFiles()) {
            errors.add("Too many files selected (" + files.size() + "). Maximum is " + options.maxFiles());
        }
        for (UploadedPdf file : files) {
            if (file.name() == null || file.name().isBlank()) {
                errors.add("File has no name");
            }
            if (file.size() > options.maxFileSize()) {
                errors.add("File \"" + file.name() + "\" is too large (" + formatFileSize(file.size())
                        + "). Maximum size is " + formatFileSize(options.maxFileSize()));
            }
            if (file.size() == 0) {
                errors.add("File \"" + file.name() + "\" is empty");
            }
            if (file.contentType() == null || !options.allowedTypes().contains(file.contentType())) {
                errors.add("File \"" + file.name() + "\" has invalid type ("
                        + (file.contentType() != null ? file.contentType() : "unknown")
                        + "). Allowed types: " + String.join(", ", options.allowedTypes()));
            }
        }
    }

    private void validatePdfSignatures(List<UploadedPdf> files, List<String> errors) {
        for (UploadedPdf file : files) {
            if (file.size() > 0 && "application/pdf".equals(file.contentType()) && !hasPdfHeader(file.content())) {
                errors.add("File \"" + file.name() + "\" is not a valid PDF file");
            }
        }
    }

    private void findIdenticalContent(List<UploadedPdf> files, List<String> errors) {
        Map<String, List<String>> namesByHash = new LinkedHashMap<>();
        for (UploadedPdf file : files) {
            if (file.size() == 0) {
                continue;
            }
            namesByHash.computeIfAbsent(Sha256.hex(file.content()), hash -> new ArrayList<>()).add(file.name());
        }
        namesByHash.values().stream()
                .filter(names -> names.size() > 1)
                .forEach(names -> errors.add("Identical files selected: " + String.join(", ", names)));
    }

    private List<FileMetadata> findDuplicateSignatures(List<UploadedPdf> files) {
        List<String> seen = new ArrayList<>();
        List<FileMetadata> duplicates = new ArrayList<>();
        for (UploadedPdf file : files) {
            String signature = signature(file.name(), file.size());
            if (seen.contains(signature)) {
                duplicates.add(file.toMetadata(null));
            } else {
                seen.add(signature);
            }
        }
        return duplicates;
    }

    private List<String> findUpdatedFiles(List<UploadedPdf> files, List<PriorSubmission> priors) {
        List<String> updated = new ArrayList<>();
        for (UploadedPdf file : files) {
            FileMetadata current = file.toMetadata(null);
            priors.stream()
                    .flatMap(prior -> prior.files().stream())
                    .filter(current::sameSignature)
                    .max(Comparator.comparingLong(FileMetadata::lastModified))
                    .filter(previous -> current.lastModified() > previous.lastModified())
                    .ifPresent(previous -> updated.add(file.name()));
        }
        return updated;
    }

    private static String signature(String name, long size) {
        return name + "_" + size;
    }

    static String formatFileSize(long bytes) {
        if (bytes == 0) {
            return "0 Bytes";
        }
        String[] units = {"Bytes", "KB", "MB", "GB"};
        int unit = Math.min(units.length - 1, (int) (Math.log(bytes) / Math.log(1024)));
        double value = bytes / Math.pow(1024, unit);
        String formatted = BigDecimal.valueOf(value)
                .setScale(2, RoundingMode.HALF_UP)
                .stripTrailingZeros()
                .toPlainString();
        return formatted + " " + units[unit];
    }
}
