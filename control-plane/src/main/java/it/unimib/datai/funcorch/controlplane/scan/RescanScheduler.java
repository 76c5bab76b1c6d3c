package it.unimib.datai.funcorch.controlplane.scan;

import it.unimib.datai.funcorch.controlplane.config.ScanProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Periodically rescans the containers of registered remote functions.
 */
@Component
@ConditionalOnProperty(prefix = "funcorch.scan", name = "rescan-enabled", havingValue = "true")
public class RescanScheduler implements SmartLifecycle {
    private static final Logger log = LoggerFactory.getLogger(RescanScheduler.class);

    private final IndexingService indexingService;
    private final ScanProperties properties;
    private final ScheduledExecutorService executor = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "funcorch-rescan");
        t.setDaemon(true);
        return t;
    });
    private final AtomicBoolean running = new AtomicBoolean(false);

    public RescanScheduler(IndexingService indexingService, ScanProperties properties) {
        this.indexingService = indexingService;
        this.properties = properties;
    }

    @Override
    public void start() {
        if (running.compareAndSet(false, true)) {
            long intervalMs = properties.rescanInterval().toMillis();
            executor.scheduleWithFixedDelay(this::tickOnce, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
            log.info("Rescanning registered containers every {}", properties.rescanInterval());
        }
    }

    @Override
    public void stop() {
        running.set(false);
        executor.shutdown();
        try {
            if (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException ex) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    void tickOnce() {
        try {
            int scanned = indexingService.rescanAll();
            log.debug("Periodic rescan examined {} entries", scanned);
        } catch (Exception ex) {
            log.error("Periodic rescan failed: {}", ex.getMessage(), ex);
        }
    }
}
