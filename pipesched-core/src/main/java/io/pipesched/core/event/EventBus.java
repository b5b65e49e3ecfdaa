package io.pipesched.core.event;

import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ArrayListMultimap;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ListMultimap;
import com.google.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Single-threaded cooperative event dispatcher.
 *
 * Handlers are registered per event and invoked in registration order.
 * {@link #signal} runs them immediately on the calling thread.
 * {@link #post} is the only method other threads may call; it queues the
 * activation for the thread blocked in {@link #enterLoop}.
 */
public class EventBus
{
    private static final Logger logger = LoggerFactory.getLogger(EventBus.class);

    private static class Activation<T>
    {
        private final Event<T> event;
        private final T payload;

        Activation(Event<T> event, T payload)
        {
            this.event = event;
            this.payload = payload;
        }
    }

    private final ListMultimap<Event<?>, EventHandler<?>> handlers = ArrayListMultimap.create();
    private final BlockingQueue<Activation<?>> queue = new LinkedBlockingQueue<>();
    private volatile boolean terminated = false;

    @Inject
    public EventBus()
    { }

    public synchronized <T> void register(Event<T> event, EventHandler<T> handler)
    {
        handlers.put(event, handler);
    }

    public synchronized int handlerCount(Event<?> event)
    {
        return handlers.get(event).size();
    }

    /**
     * Runs every handler of the event in order. An exception thrown by a
     * handler is logged and the remaining handlers still run.
     */
    @SuppressWarnings("unchecked")
    public <T> void signal(Event<T> event, T payload)
    {
        List<EventHandler<?>> list;
        synchronized (this) {
            list = ImmutableList.copyOf(handlers.get(event));
        }
        logger.trace("Event {} fired with {} handlers", event, list.size());
        for (EventHandler<?> handler : list) {
            try {
                ((EventHandler<T>) handler).handle(payload);
            }
            catch (Throwable t) {
                logger.error("Uncaught exception in a handler of event {}. Ignoring.", event, t);
            }
        }
    }

    /**
     * Queues an activation for the loop thread. Safe from any thread.
     * The payload must not be modified after this call.
     */
    public <T> void post(Event<T> event, T payload)
    {
        queue.add(new Activation<>(event, payload));
    }

    /**
     * Blocks the calling thread processing activations until
     * {@link #terminate()} is called. The tick handler runs after every
     * activation.
     */
    public void enterLoop(Runnable tickHandler)
        throws InterruptedException
    {
        terminated = false;
        while (!terminated) {
            Activation<?> activation = queue.take();
            run(activation, tickHandler);
        }
        logger.debug("Event loop terminated");
    }

    /**
     * Processes activations already queued without blocking.
     */
    @VisibleForTesting
    public int dispatchPending(Runnable tickHandler)
    {
        int count = 0;
        Activation<?> activation;
        while (!terminated && (activation = queue.poll()) != null) {
            run(activation, tickHandler);
            count++;
        }
        return count;
    }

    public void terminate()
    {
        terminated = true;
    }

    public boolean isTerminated()
    {
        return terminated;
    }

    public int pendingCount()
    {
        return queue.size();
    }

    private <T> void run(Activation<T> activation, Runnable tickHandler)
    {
        signal(activation.event, activation.payload);
        if (terminated) {
            return;
        }
        try {
            tickHandler.run();
        }
        catch (Throwable t) {
            logger.error("Uncaught exception in the tick handler. Ignoring.", t);
        }
    }
}
