package me.golemcore.virality.domain.model;

import java.time.Instant;
import java.util.List;

public record TrendingData(List<TrendingTopic> topics, Instant lastUpdated, String region) {

    public TrendingData {
        topics = topics == null ? List.of() : List.copyOf(topics);
    }
}
