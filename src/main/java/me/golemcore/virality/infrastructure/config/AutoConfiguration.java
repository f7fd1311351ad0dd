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

import me.golemcore.virality.cache.CacheStore;
import me.golemcore.virality.cache.InMemoryCacheStore;
import me.golemcore.virality.port.outbound.CompletionPort;
import me.golemcore.virality.port.outbound.HeavyScorerPort;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.event.EventListener;

import java.time.Clock;

/**
 * Spring configuration for the shared infrastructure beans and startup
 * logging.
 *
 * <p>
 * The cache store is a single process-wide bean; its expiry sweep starts with
 * the bean and stops when the context closes.
 *
 * @since 1.0
 */
@Configuration
@Slf4j
public class AutoConfiguration {

    @Bean
    public static Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @Bean(destroyMethod = "shutdown")
    public InMemoryCacheStore<Object> cacheStore(Clock clock, ViralityProperties properties) {
        return new InMemoryCacheStore<>(clock, properties.getCache().getSweepInterval());
    }

    @EventListener(ApplicationReadyEvent.class)
    public void logStartup(ApplicationReadyEvent event) {
        ViralityProperties properties = event.getApplicationContext().getBean(ViralityProperties.class);
        HeavyScorerPort heavyScorer = event.getApplicationContext().getBean(HeavyScorerPort.class);
        CompletionPort completion = event.getApplicationContext().getBean(CompletionPort.class);
        CacheStore<?> cache = event.getApplicationContext().getBean(CacheStore.class);
        log.info("Virality service starting...");
        log.info("Heavy scorer: {} (timeout {}ms)",
                heavyScorer.isAvailable() ? String.join(" ", properties.getScorer().getCommand()) : "disabled",
                properties.getScorer().getTimeoutMs());
        log.info("Completion API: {}", completion.isAvailable() ? properties.getLlm().getModel() : "not configured");
        log.info("Cache sweep interval: {}, entries: {}", properties.getCache().getSweepInterval(),
                cache.getStats().getTotalEntries());
    }
}
