package me.golemcore.virality.domain.model;

import java.util.List;

/**
 * Rewritten post proposed by the completion collaborator.
 */
public record ImprovedVersion(String text, List<String> changes, int expectedScoreIncrease, String reasoning) {

    public ImprovedVersion {
        changes = changes == null ? List.of() : List.copyOf(changes);
    }
}
