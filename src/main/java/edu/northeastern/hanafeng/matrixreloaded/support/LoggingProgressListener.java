package edu.northeastern.hanafeng.matrixreloaded.support;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Logs phase progress, at most one line per phase every {@value #LOG_INTERVAL_MS}ms.
 */
@Slf4j
@Component
public class LoggingProgressListener implements ProgressListener {

    static final long LOG_INTERVAL_MS = 5000;

    private final Map<String, Phase> phases = new ConcurrentHashMap<>();

    @Override
    public void started(String phase, long total) {
        phases.put(phase, new Phase(total, System.currentTimeMillis()));
        log.info("{}: started ({} total)", phase, total);
    }

    @Override
    public void advanced(String phase, long delta) {
        Phase progress = phases.get(phase);
        if (progress == null) {
            return;
        }
        long done = progress.done.addAndGet(delta);
        long now = System.currentTimeMillis();
        long last = progress.lastLogTime.get();
        if (now - last >= LOG_INTERVAL_MS && progress.lastLogTime.compareAndSet(last, now)) {
            log.info("{}: {}/{}", phase, done, progress.total);
        }
    }

    @Override
    public void finished(String phase) {
        Phase progress = phases.remove(phase);
        if (progress != null) {
            log.info("{}: finished {}/{} in {}ms", phase, progress.done.get(), progress.total,
                    System.currentTimeMillis() - progress.startTime);
        }
    }

    long completed(String phase) {
        Phase progress = phases.get(phase);
        return progress == null ? 0 : progress.done.get();
    }

    private static final class Phase {
        private final long total;
        private final long startTime;
        private final AtomicLong done = new AtomicLong();
        private final AtomicLong lastLogTime;

        private Phase(long total, long startTime) {
            this.total = total;
            this.startTime = startTime;
            this.lastLogTime = new AtomicLong(startTime);
        }
    }
}
