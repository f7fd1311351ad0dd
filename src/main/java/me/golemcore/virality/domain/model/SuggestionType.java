package me.golemcore.virality.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Category of an improvement suggestion, in the order suggestions are emitted.
 */
public enum SuggestionType {

    CONTENT,
    ENGAGEMENT,
    HASHTAGS,
    TIMING,
    SAFETY;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<SuggestionType> fromWireName(String value) {
        return Arrays.stream(values())
                .filter(type -> type.wireName().equals(value))
                .findFirst();
    }
}
