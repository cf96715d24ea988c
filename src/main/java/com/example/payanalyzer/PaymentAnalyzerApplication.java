package com.example.payanalyzer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Application entry point for the payment analyzer.
 * Only wires the application context; the HTTP surface lives under the interfaces layer.
 */
@SpringBootApplication
public class PaymentAnalyzerApplication {

	/**
	 * Boots the Spring container and exposes the analysis endpoints.
	 *
	 * @param args optional command line arguments passed by the JVM
	 */
	public static void main(String[] args) {
		SpringApplication.run(PaymentAnalyzerApplication.class, args);
	}

}
