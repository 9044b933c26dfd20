package com.phillippitts.voicegraph.service.event;

import org.springframework.context.ApplicationEventPublisher;

/**
 * Utility for publishing pipeline and node notifications.
 *
 * <p>Centralizes the null check on the publisher so nodes and pipelines work without an
 * event bus in unit tests or when used outside a Spring context.
 *
 * @since 1.0
 */
public final class EventPublishing {

    private EventPublishing() {
        // Utility class - prevent instantiation
    }

    /**
     * Publishes {@code event} if a publisher is available; does nothing otherwise.
     *
     * @param publisher the Spring event publisher (may be null)
     * @param event the notification record
     */
    public static void publish(ApplicationEventPublisher publisher, Object event) {
        if (publisher != null && event != null) {
            publisher.publishEvent(event);
        }
    }
}
