package me.golemcore.virality.adapter.inbound.web.dto;

public record AnalyzeRequest(String text) {
}
