package com.tickwork.scheduler.trigger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Event feeds by source type.
 */
@Component
public class EventFeedRegistry {

    private static final Logger log = LoggerFactory.getLogger(EventFeedRegistry.class);

    private final Map<String, EventFeed> feeds = new ConcurrentHashMap<>();

    @Autowired
    public EventFeedRegistry(ObjectProvider<EventFeed> feeds) {
        feeds.orderedStream().forEach(this::register);
    }

    private EventFeedRegistry() {
    }

    public static EventFeedRegistry of(EventFeed... feeds) {
        EventFeedRegistry registry = new EventFeedRegistry();
        for (EventFeed feed : feeds) {
            registry.register(feed);
        }
        return registry;
    }

    public void register(EventFeed feed) {
        EventFeed previous = feeds.putIfAbsent(feed.sourceType(), feed);
        if (previous != null && previous != feed) {
            throw new IllegalStateException("Duplicate event feed for source type: " + feed.sourceType());
        }
        log.info("Registered event feed: {}", feed.sourceType());
    }

    public Optional<EventFeed> find(String sourceType) {
        return Optional.ofNullable(feeds.get(sourceType));
    }
}
