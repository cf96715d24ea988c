package com.example.payanalyzer.infrastructure.json;

import com.example.payanalyzer.domain.model.DailyEntry;
import com.example.payanalyzer.domain.model.DailyEntrySnapshot;
import com.example.payanalyzer.infrastructure.exception.EntrySerializationException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import org.springframework.stereotype.Component;

/**
 * JSON form of daily entries, written through {@link DailyEntrySnapshot}. Reading recomputes the
 * derived amounts, so a round trip preserves expected total and difference.
 */
@Component
public class DailyEntryJsonCodec {

    private final ObjectMapper objectMapper;

    public DailyEntryJsonCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper.copy()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    public String toJson(DailyEntry entry) {
        try {
            return objectMapper.writeValueAsString(entry.toSnapshot());
        } catch (JsonProcessingException e) {
            throw new EntrySerializationException("Unable to serialize daily entry for " + entry.getDate() + ".", e);
        }
    }

    public DailyEntry fromJson(String json) {
        try {
            return DailyEntry.fromSnapshot(objectMapper.readValue(json, DailyEntrySnapshot.class));
        } catch (JsonProcessingException e) {
            throw new EntrySerializationException("Unable to read daily entry JSON.", e);
        }
    }
}
