package de.bsommerfeld.pluginmarket.core.event;

import com.google.common.eventbus.EventBus;
import com.google.common.eventbus.SubscriberExceptionContext;
import com.google.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Thin wrapper around Guava's EventBus so that the market core can notify
 * front ends (CLI, UI) without knowing them.
 *
 * <p>
 * Delivery is synchronous on the posting thread. Lifecycle operations post
 * from worker threads, so subscribers must hand off to their own thread if
 * they touch thread-confined state. A subscriber that throws is logged and
 * does not keep the event from reaching the remaining subscribers or fail
 * the operation that posted it.
 */
@Singleton
public class ApplicationEventBus {

    private static final Logger LOG = LoggerFactory.getLogger(ApplicationEventBus.class);
    private final EventBus eventBus;

    public ApplicationEventBus() {
        this.eventBus = new EventBus(ApplicationEventBus::logSubscriberFailure);
    }

    public void post(Object event) {
        LOG.debug("Posting event: {}", event);
        eventBus.post(event);
    }

    public void register(Object listener) {
        LOG.trace("Registering listener: {}", listener.getClass().getName());
        eventBus.register(listener);
    }

    public void unregister(Object listener) {
        LOG.trace("Unregistering listener: {}", listener.getClass().getName());
        eventBus.unregister(listener);
    }

    private static void logSubscriberFailure(Throwable exception, SubscriberExceptionContext context) {
        LOG.warn("Subscriber {}.{} failed on {}", context.getSubscriber().getClass().getName(),
                context.getSubscriberMethod().getName(), context.getEvent(), exception);
    }
}
