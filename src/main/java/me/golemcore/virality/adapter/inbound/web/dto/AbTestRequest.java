package me.golemcore.virality.adapter.inbound.web.dto;

/**
 * @param numVariants
 *            total variants including the original; {@code null} for the
 *            default
 */
public record AbTestRequest(String originalTweet, Integer numVariants) {
}
