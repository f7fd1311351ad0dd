/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

package me.golemcore.virality.adapter.outbound.trending;

import me.golemcore.virality.domain.model.TrendingTopic;
import me.golemcore.virality.infrastructure.config.ViralityProperties;
import me.golemcore.virality.port.outbound.TrendingSourcePort;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Trending topics read from a bundled JSON catalog.
 *
 * <p>
 * The catalog is an object with a {@code default} topic list and optional
 * per-region lists keyed by upper-case region code. It is read on every fetch;
 * freshness is handled by the caller's cache.
 */
@Component
@Slf4j
public class ClasspathTrendingSourceAdapter implements TrendingSourcePort {

    private static final String DEFAULT_SECTION = "default";

    private final ObjectMapper objectMapper;
    private final String catalogPath;

    public ClasspathTrendingSourceAdapter(ObjectMapper objectMapper, ViralityProperties properties) {
        this.objectMapper = objectMapper;
        this.catalogPath = properties.getTrending().getCatalog();
    }

    @Override
    public List<TrendingTopic> fetchTopics(String region) {
        JsonNode catalog = readCatalog();
        JsonNode section = region != null ? catalog.get(region.toUpperCase(Locale.ROOT)) : null;
        if (section == null || !section.isArray()) {
            section = catalog.get(DEFAULT_SECTION);
        }
        if (section == null || !section.isArray()) {
            throw new IllegalStateException("Trending catalog " + catalogPath + " has no '" + DEFAULT_SECTION
                    + "' list");
        }

        List<TrendingTopic> topics = new ArrayList<>();
        for (JsonNode node : section) {
            topics.add(objectMapper.convertValue(node, TrendingTopic.class));
        }
        log.debug("[Trending] Loaded {} topics for region {}", topics.size(), region);
        return topics;
    }

    private JsonNode readCatalog() {
        ClassPathResource resource = new ClassPathResource(catalogPath);
        try (InputStream in = resource.getInputStream()) {
            return objectMapper.readTree(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read trending catalog " + catalogPath, e);
        }
    }
}
