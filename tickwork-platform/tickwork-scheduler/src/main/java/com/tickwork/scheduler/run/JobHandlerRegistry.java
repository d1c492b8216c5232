package com.tickwork.scheduler.run;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Handlers by key, fixed at startup.
 */
@Component
public class JobHandlerRegistry {

    private static final Logger log = LoggerFactory.getLogger(JobHandlerRegistry.class);

    private final Map<String, JobHandler> handlers;

    public JobHandlerRegistry(List<JobHandler> handlers) {
        Map<String, JobHandler> byKey = new LinkedHashMap<>();
        for (JobHandler handler : handlers) {
            String key = handler.key();
            if (key == null || key.isBlank()) {
                throw new IllegalStateException("Handler " + handler.getClass().getName() + " has no key");
            }
            JobHandler previous = byKey.putIfAbsent(key, handler);
            if (previous != null) {
                throw new IllegalStateException("Duplicate job handler key '" + key + "': "
                        + previous.getClass().getName() + " and " + handler.getClass().getName());
            }
        }
        this.handlers = Collections.unmodifiableMap(byKey);
        log.info("Job handler registry initialized with {} handler(s): {}", byKey.size(), byKey.keySet());
    }

    public Optional<JobHandler> find(String key) {
        return Optional.ofNullable(handlers.get(key));
    }

    public Set<String> keys() {
        return handlers.keySet();
    }
}
