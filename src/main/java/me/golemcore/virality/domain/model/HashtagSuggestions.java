package me.golemcore.virality.domain.model;

import java.util.List;

/**
 * Hashtags grouped by intent: broad trending reach, niche targeting, and
 * engagement prompts.
 */
public record HashtagSuggestions(List<String> trending, List<String> niche, List<String> engagement) {

    public HashtagSuggestions {
        trending = trending == null ? List.of() : List.copyOf(trending);
        niche = niche == null ? List.of() : List.copyOf(niche);
        engagement = engagement == null ? List.of() : List.copyOf(engagement);
    }
}
