package me.golemcore.virality.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record TrendingTopic(String hashtag, long tweetVolume, Category category, Sentiment sentiment) {

    public enum Category {
        @JsonProperty("technology")
        TECHNOLOGY,
        @JsonProperty("business")
        BUSINESS,
        @JsonProperty("entertainment")
        ENTERTAINMENT,
        @JsonProperty("sports")
        SPORTS,
        @JsonProperty("politics")
        POLITICS,
        @JsonProperty("general")
        GENERAL
    }

    public enum Sentiment {
        @JsonProperty("positive")
        POSITIVE,
        @JsonProperty("neutral")
        NEUTRAL,
        @JsonProperty("negative")
        NEGATIVE
    }
}
