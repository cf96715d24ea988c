package com.example.payanalyzer.domain.model;

/**
 * Outcome of revising a rule set: the retired version and its successor.
 *
 * @param retired previous version, inactive and closed at the revision instant
 * @param current new active version
 */
public record RulesRevision(PaymentRules retired, PaymentRules current) {
}
