package me.golemcore.virality.adapter.inbound.web.dto;

public record ClearExpiredResponse(int cleared) {
}
