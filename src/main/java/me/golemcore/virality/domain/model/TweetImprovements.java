package me.golemcore.virality.domain.model;

import java.util.List;

public record TweetImprovements(List<ImprovedVersion> improvedVersions, List<String> alternativeApproaches) {

    public TweetImprovements {
        improvedVersions = improvedVersions == null ? List.of() : List.copyOf(improvedVersions);
        alternativeApproaches = alternativeApproaches == null ? List.of() : List.copyOf(alternativeApproaches);
    }
}
