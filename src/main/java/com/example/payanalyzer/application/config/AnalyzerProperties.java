package com.example.payanalyzer.application.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Tunable thresholds and limits, bound from {@code payanalyzer.*}.
 */
@Component
@ConfigurationProperties(prefix = "payanalyzer")
public class AnalyzerProperties {

	private Extraction extraction = new Extraction();
	private Validation validation = new Validation();
	private Upload upload = new Upload();
	private Rules rules = new Rules();
	private Worker worker = new Worker();
	private History history = new History();

	public Extraction getExtraction() {
		return extraction;
	}

	public void setExtraction(Extraction extraction) {
		this.extraction = extraction;
	}

	public Validation getValidation() {
		return validation;
	}

	public void setValidation(Validation validation) {
		this.validation = validation;
	}

	public Upload getUpload() {
		return upload;
	}

	public void setUpload(Upload upload) {
		this.upload = upload;
	}

	public Rules getRules() {
		return rules;
	}

	public void setRules(Rules rules) {
		this.rules = rules;
	}

	public Worker getWorker() {
		return worker;
	}

	public void setWorker(Worker worker) {
		this.worker = worker;
	}

	public History getHistory() {
		return history;
	}

	public void setHistory(History history) {
		this.history = history;
	}

	/**
	 * Text extraction heuristics.
	 */
	public static class Extraction {
		private BigDecimal minInvoiceAmount = new BigDecimal("3.00"); // smaller tokens are reference numbers, not payments
		private BigDecimal maxInvoiceAmount = new BigDecimal("500.00");
		private BigDecimal highInvoiceAmount = new BigDecimal("500.00");
		private int highConsignmentCount = 200;
		private int previewLength = 1000;

		public BigDecimal getMinInvoiceAmount() {
			return minInvoiceAmount;
		}

		public void setMinInvoiceAmount(BigDecimal minInvoiceAmount) {
			this.minInvoiceAmount = minInvoiceAmount;
		}

		public BigDecimal getMaxInvoiceAmount() {
			return maxInvoiceAmount;
		}

		public void setMaxInvoiceAmount(BigDecimal maxInvoiceAmount) {
			this.maxInvoiceAmount = maxInvoiceAmount;
		}

		public BigDecimal getHighInvoiceAmount() {
			return highInvoiceAmount;
		}

		public void setHighInvoiceAmount(BigDecimal highInvoiceAmount) {
			this.highInvoiceAmount = highInvoiceAmount;
		}

		public int getHighConsignmentCount() {
			return highConsignmentCount;
		}

		public void setHighConsignmentCount(int highConsignmentCount) {
			this.highConsignmentCount = highConsignmentCount;
		}

		public int getPreviewLength() {
			return previewLength;
		}

		public void setPreviewLength(int previewLength) {
			this.previewLength = previewLength;
		}
	}

	/**
	 * Business-rule warning thresholds.
	 */
	public static class Validation {
		private int highConsignmentCount = 200;
		private BigDecimal highPaymentAmount = new BigDecimal("1000.00");
		private BigDecimal largeDiscrepancy = new BigDecimal("50.00");
		private BigDecimal highWeekdayRate = new BigDecimal("10.00");
		private BigDecimal highSaturdayRate = new BigDecimal("15.00");

		public int getHighConsignmentCount() {
			return highConsignmentCount;
		}

		public void setHighConsignmentCount(int highConsignmentCount) {
			this.highConsignmentCount = highConsignmentCount;
		}

		public BigDecimal getHighPaymentAmount() {
			return highPaymentAmount;
		}

		public void setHighPaymentAmount(BigDecimal highPaymentAmount) {
			this.highPaymentAmount = highPaymentAmount;
		}

		public BigDecimal getLargeDiscrepancy() {
			return largeDiscrepancy;
		}

		public void setLargeDiscrepancy(BigDecimal largeDiscrepancy) {
			this.largeDiscrepancy = largeDiscrepancy;
		}

		public BigDecimal getHighWeekdayRate() {
			return highWeekdayRate;
		}

		public void setHighWeekdayRate(BigDecimal highWeekdayRate) {
			this.highWeekdayRate = highWeekdayRate;
		}

		public BigDecimal getHighSaturdayRate() {
			return highSaturdayRate;
		}

		public void setHighSaturdayRate(BigDecimal highSaturdayRate) {
			this.highSaturdayRate = highSaturdayRate;
		}
	}

	/**
	 * Batch upload limits.
	 */
	public static class Upload {
		private long maxFileSize = 50L * 1024 * 1024;
		private int maxFiles = 50;
		private List<String> allowedTypes = new ArrayList<>(List.of("application/pdf"));
		private boolean checkForUpdates = true;
		private boolean checkForDuplicates = true;

		public long getMaxFileSize() {
			return maxFileSize;
		}

		public void setMaxFileSize(long maxFileSize) {
			this.maxFileSize = maxFileSize;
		}

		public int getMaxFiles() {
			return maxFiles;
		}

		public void setMaxFiles(int maxFiles) {
			this.maxFiles = maxFiles;
		}

		public List<String> getAllowedTypes() {
			return allowedTypes;
		}

		public void setAllowedTypes(List<String> allowedTypes) {
			this.allowedTypes = allowedTypes;
		}

		public boolean isCheckForUpdates() {
			return checkForUpdates;
		}

		public void setCheckForUpdates(boolean checkForUpdates) {
			this.checkForUpdates = checkForUpdates;
		}

		public boolean isCheckForDuplicates() {
			return checkForDuplicates;
		}

		public void setCheckForDuplicates(boolean checkForDuplicates) {
			this.checkForDuplicates = checkForDuplicates;
		}
	}

	/**
	 * Rates and bonuses used when a request does not carry its own.
	 */
	public static class Rules {
		private BigDecimal weekdayRate = new BigDecimal("2.00");
		private BigDecimal saturdayRate = new BigDecimal("3.00");
		private BigDecimal unloadingBonus = new BigDecimal("30.00");
		private BigDecimal attendanceBonus = new BigDecimal("25.00");
		private BigDecimal earlyBonus = new BigDecimal("50.00");

		public BigDecimal getWeekdayRate() {
			return weekdayRate;
		}

		public void setWeekdayRate(BigDecimal weekdayRate) {
			this.weekdayRate = weekdayRate;
		}

		public BigDecimal getSaturdayRate() {
			return saturdayRate;
		}

		public void setSaturdayRate(BigDecimal saturdayRate) {
			this.saturdayRate = saturdayRate;
		}

		public BigDecimal getUnloadingBonus() {
			return unloadingBonus;
		}

		public void setUnloadingBonus(BigDecimal unloadingBonus) {
			this.unloadingBonus = unloadingBonus;
		}

		public BigDecimal getAttendanceBonus() {
			return attendanceBonus;
		}

		public void setAttendanceBonus(BigDecimal attendanceBonus) {
			this.attendanceBonus = attendanceBonus;
		}

		public BigDecimal getEarlyBonus() {
			return earlyBonus;
		}

		public void setEarlyBonus(BigDecimal earlyBonus) {
			this.earlyBonus = earlyBonus;
		}
	}

	/**
	 * Background processing worker.
	 */
	public static class Worker {
		private String threadName = "pdf-processing-worker";

		public String getThreadName() {
			return threadName;
		}

		public void setThreadName(String threadName) {
			this.threadName = threadName;
		}
	}

	/**
	 * Submission history storage. Without a file, history lives in memory only.
	 */
	public static class History {
		private String file = "";

		public String getFile() {
			return file;
		}

		public void setFile(String file) {
			this.file = file;
		}
	}
}
