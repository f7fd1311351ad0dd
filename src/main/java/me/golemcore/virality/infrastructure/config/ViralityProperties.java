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

package me.golemcore.virality.infrastructure.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Centralized configuration properties for the service, bound from
 * application.properties.
 *
 * <p>
 * All configuration is organized under the {@code virality.*} prefix:
 * <ul>
 * <li>{@link ScorerProperties} - external heavy-scorer process</li>
 * <li>{@link CacheProperties} - expiry sweep and per-purpose TTLs</li>
 * <li>{@link LlmProperties} - completion API used for content insight</li>
 * <li>{@link TrendingProperties} - trending topic catalog</li>
 * </ul>
 *
 * @since 1.0
 */
@ConfigurationProperties(prefix = "virality")
@Data
public class ViralityProperties {

    private ScorerProperties scorer = new ScorerProperties();
    private CacheProperties cache = new CacheProperties();
    private LlmProperties llm = new LlmProperties();
    private TrendingProperties trending = new TrendingProperties();

    @Data
    public static class ScorerProperties {
        private boolean enabled = true;
        /**
         * Program and leading arguments. The post text is appended as the last
         * argument.
         */
        private List<String> command = new ArrayList<>(List.of("python3", "python/twitter_algorithm_service.py"));
        private String workingDirectory;
        private long timeoutMs = 4000;
        private int maxOutputChars = 1_000_000;
    }

    @Data
    public static class CacheProperties {
        private Duration sweepInterval = Duration.ofMinutes(5);
        private TtlProperties ttl = new TtlProperties();
    }

    @Data
    public static class TtlProperties {
        private Duration analysis = Duration.ofMinutes(30);
        private Duration insight = Duration.ofMinutes(30);
        private Duration suggestions = Duration.ofMinutes(15);
        private Duration hashtags = Duration.ofMinutes(10);
        private Duration trending = Duration.ofMinutes(5);
        private Duration abTest = Duration.ofMinutes(10);
    }

    @Data
    public static class LlmProperties {
        private String apiKey;
        private String baseUrl = "https://openrouter.ai/api/v1";
        private String model = "openai/gpt-4o";
        private long timeoutMs = 20000;
    }

    @Data
    public static class TrendingProperties {
        private String defaultRegion = "US";
        private String catalog = "trending/topics.json";
    }
}
