package tollgate.core.service.audit;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import tollgate.core.config.GatewayConfig;
import tollgate.core.model.audit.AuditEvent;
import tollgate.core.port.out.AuditSink;
import tollgate.core.port.out.ValidationMetrics;

/**
 * Asynchronous, append-only audit trail.
 *
 * <p>Events are queued on a bounded queue and written to the {@link AuditSink}
 * in batches by a single daemon thread, so recording never waits on the sink.
 *
 * <p>Backpressure:
 * <ul>
 *   <li>ordinary events wait briefly for space, then are dropped and counted</li>
 *   <li>critical events wait a little longer, then are written on the caller thread</li>
 * </ul>
 * Critical events are never dropped. Queued events are flushed on shutdown.
 */
@ApplicationScoped
public class AuditLogger {

    private static final Logger LOG = Logger.getLogger(AuditLogger.class);

    private static final long POLL_MILLIS = 50;

    private final AuditSink sink;
    private final ValidationMetrics metrics;
    private final GatewayConfig.AuditConfig config;
    private final BlockingQueue<AuditEvent> queue;
    private final AtomicLong dropped = new AtomicLong();
    private final AtomicLong written = new AtomicLong();

    private volatile boolean running;
    private Thread flusher;

    @Inject
    public AuditLogger(AuditSink sink, ValidationMetrics metrics, GatewayConfig config) {
        this.sink = sink;
        this.metrics = metrics;
        this.config = config.audit();
        this.queue = new ArrayBlockingQueue<>(this.config.queueCapacity());
    }

    @PostConstruct
    public synchronized void start() {
        if (running) {
            return;
        }
        running = true;
        flusher = new Thread(this::drainLoop, "audit-flusher");
        flusher.setDaemon(true);
        flusher.start();
        LOG.infof("Audit logger started (capacity: %d, batch: %d)", config.queueCapacity(), config.batchSize());
    }

    @PreDestroy
    public synchronized void close() {
        if (!running) {
            flushRemaining();
            return;
        }
        running = false;
        flusher.interrupt();
        try {
            flusher.join(TimeUnit.SECONDS.toMillis(5));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        flushRemaining();
        LOG.infof("Audit logger stopped (written: %d, dropped: %d)", written.get(), dropped.get());
    }

    /**
     * Record an event.
     *
     * @param event the event to record
     * @return false if an ordinary event was dropped under backpressure
     */
    public boolean record(AuditEvent event) {
        try {
            if (event.isCritical()) {
                if (!queue.offer(event, config.criticalEnqueueTimeout().toNanos(), TimeUnit.NANOSECONDS)) {
                    LOG.warnf("Audit queue full, writing critical %s event inline", event.type());
                    writeBatch(List.of(event));
                }
                return true;
            }
            if (queue.offer(event, config.enqueueTimeout().toNanos(), TimeUnit.NANOSECONDS)) {
                return true;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            if (event.isCritical()) {
                writeBatch(List.of(event));
                return true;
            }
        }
        long total = dropped.incrementAndGet();
        metrics.recordAuditDropped();
        LOG.debugf("Audit queue full, dropped %s event (total dropped: %d)", event.type(), total);
        return false;
    }

    public long droppedCount() {
        return dropped.get();
    }

    public long writtenCount() {
        return written.get();
    }

    public int pendingCount() {
        return queue.size();
    }

    private void drainLoop() {
        var batch = new ArrayList<AuditEvent>(config.batchSize());
        while (running) {
            try {
                var first = queue.poll(POLL_MILLIS, TimeUnit.MILLISECONDS);
                if (first == null) {
                    continue;
                }
                batch.add(first);
                queue.drainTo(batch, config.batchSize() - 1);
                writeBatch(batch);
                batch.clear();
            } catch (InterruptedException e) {
                if (running) {
                    LOG.debug("Audit flusher interrupted while running");
                }
            }
        }
    }

    private synchronized void flushRemaining() {
        var batch = new ArrayList<AuditEvent>(config.batchSize());
        while (queue.drainTo(batch, config.batchSize()) > 0) {
            writeBatch(batch);
            batch.clear();
        }
    }

    private void writeBatch(List<AuditEvent> batch) {
        try {
            sink.write(List.copyOf(batch));
            written.addAndGet(batch.size());
        } catch (RuntimeException e) {
            metrics.recordAuditSinkFailure();
            LOG.warnf(e, "Audit sink failed to write %d event(s)", batch.size());
        }
    }
}
