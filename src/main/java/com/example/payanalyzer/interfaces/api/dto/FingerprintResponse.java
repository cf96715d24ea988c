package com.example.payanalyzer.interfaces.api.dto;

public record FingerprintResponse(String fingerprint) {
}
