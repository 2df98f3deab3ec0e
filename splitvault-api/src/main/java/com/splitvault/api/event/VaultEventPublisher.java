package com.splitvault.api.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Hands committed vault events to the Spring application event bus.
 *
 * The operation behind the events has already committed, so a failing listener is logged
 * and never surfaces to the vault caller; the remaining events are still delivered.
 */
@Component
public class VaultEventPublisher {

    private static final Logger log = LoggerFactory.getLogger(VaultEventPublisher.class);

    private final ApplicationEventPublisher delegate;

    public VaultEventPublisher(ApplicationEventPublisher delegate) {
        this.delegate = delegate;
    }

    public void publishAll(List<VaultEvent> events) {
        for (VaultEvent event : events) {
            log.debug("Publishing {}", event);
            try {
                delegate.publishEvent(event);
            } catch (RuntimeException e) {
                log.error("Listener failed on committed event {}", event, e);
            }
        }
    }
}
