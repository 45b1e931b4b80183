package com.lbg.markets.surveillance.tail.orchestration;

import com.lbg.markets.surveillance.tail.domain.PollResult;
import com.lbg.markets.surveillance.tail.sink.Sink;
import com.lbg.markets.surveillance.tail.source.FileFinder;
import com.lbg.markets.surveillance.tail.tracker.CheckpointStore;
import io.quarkus.runtime.ShutdownEvent;
import io.quarkus.runtime.StartupEvent;
import io.quarkus.scheduler.Scheduled;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

/**
 * Owns the {@link FileConsumer} for the configured input and drives its poll cycles.
 * The scheduler never overlaps cycles; a trigger that fires mid-cycle is skipped.
 */
@ApplicationScoped
public class TailService {

    private static final Logger LOG = Logger.getLogger(TailService.class);

    @Inject
    InputConfig config;

    @Inject
    FileFinder finder;

    @Inject
    Sink sink;

    @Inject
    CheckpointStore store;

    private volatile FileConsumer consumer;

    void onStart(@Observes StartupEvent event) {
        start();
    }

    void onStop(@Observes ShutdownEvent event) {
        stop();
    }

    /**
     * @throws com.lbg.markets.surveillance.tail.domain.ConfigurationException if the input
     *         configuration is invalid
     */
    public synchronized void start() {
        if (consumer != null) {
            return;
        }
        FileConsumer created = new FileConsumer(config, finder, sink, store);
        created.start();
        consumer = created;
        LOG.infof("Tailing %s (start at %s)", config.include(), config.startAt());
    }

    @Scheduled(every = "{tail.poll-interval}", concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    void scheduledPoll() {
        if (consumer == null) {
            LOG.debug("Poll triggered before start, skipping");
            return;
        }
        poll();
    }

    public PollResult poll() {
        FileConsumer current = consumer;
        if (current == null) {
            throw new IllegalStateException("Tail service is not started");
        }
        return current.poll();
    }

    public synchronized void stop() {
        if (consumer == null) {
            return;
        }
        consumer.close();
        consumer = null;
        LOG.info("Tailing stopped");
    }
}
