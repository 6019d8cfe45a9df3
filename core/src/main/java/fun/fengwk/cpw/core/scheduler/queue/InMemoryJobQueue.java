package fun.fengwk.cpw.core.scheduler.queue;

import fun.fengwk.cpw.core.scheduler.SchedulerProperties;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.DelayQueue;
import java.util.concurrent.Delayed;
import java.util.concurrent.PriorityBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Process-local job queue with a single worker, so at most one job executes at a time.
 *
 * <p>Ready jobs are ordered by priority then enqueue order. Failed attempts wait in a delay queue
 * for {@code backoff x 2^(attempt-1)} before they become ready again.
 *
 * @author fengwk
 */
@Slf4j
@Component
public class InMemoryJobQueue implements JobQueue {

    private final Map<String, JobHandler> handlers = new HashMap<>();
    private final SchedulerProperties schedulerProperties;
    private final Map<String, JobRecord> jobs = new LinkedHashMap<>();
    private final PriorityBlockingQueue<QueueEntry> ready = new PriorityBlockingQueue<>(16,
        Comparator.comparingInt(QueueEntry::priority).thenComparingLong(QueueEntry::sequence));
    private final DelayQueue<QueueEntry> delayed = new DelayQueue<>();
    private final List<JobListener> listeners = new CopyOnWriteArrayList<>();
    private final AtomicLong sequence = new AtomicLong();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile Thread worker;

    @Autowired
    public InMemoryJobQueue(List<JobHandler> handlers, SchedulerProperties schedulerProperties) {
        for (JobHandler handler : handlers) {
            JobHandler previous = this.handlers.put(handler.type(), handler);
            if (previous != null) {
                throw new IllegalStateException("duplicate job handler for type " + handler.type());
            }
        }
        this.schedulerProperties = schedulerProperties;
    }

    @PostConstruct
    public void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        Thread thread = new Thread(this::workLoop, "cpw-job-worker");
        thread.setDaemon(true);
        worker = thread;
        thread.start();
        log.info("job queue worker started, handlers={}", handlers.keySet());
    }

    @PreDestroy
    public void shutdown() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        Thread thread = worker;
        if (thread != null) {
            thread.interrupt();
        }
        log.info("job queue worker stopped");
    }

    @Override
    public boolean enqueue(JobSpec spec) {
        if (spec.getJobId() == null || spec.getType() == null) {
            throw new IllegalArgumentException("jobId and type are required");
        }
        JobRecord record;
        synchronized (this) {
            JobRecord existing = jobs.get(spec.getJobId());
            if (existing != null && !existing.state.isFinished()) {
                log.debug("job already queued, jobId={}, state={}", spec.getJobId(), existing.state);
                return false;
            }
            if (existing != null) {
                jobs.remove(spec.getJobId());
            }
            record = new JobRecord(spec, System.currentTimeMillis());
            jobs.put(spec.getJobId(), record);
        }
        ready.add(new QueueEntry(record, spec.getPriority(), sequence.incrementAndGet(), 0));
        log.info("job enqueued, jobId={}, type={}, priority={}", spec.getJobId(), spec.getType(), spec.getPriority());
        return true;
    }

    @Override
    public synchronized Optional<JobView> findJob(String jobId) {
        JobRecord record = jobs.get(jobId);
        return record == null ? Optional.empty() : Optional.of(record.view());
    }

    @Override
    public synchronized List<JobView> listJobs() {
        List<JobView> views = new ArrayList<>(jobs.size());
        for (JobRecord record : jobs.values()) {
            views.add(record.view());
        }
        return views;
    }

    @Override
    public void addListener(JobListener listener) {
        listeners.add(listener);
    }

    /**
     * Take one ready job and process it on the calling thread.
     *
     * @return whether a job was processed
     */
    public boolean runOnce(long waitMs) throws InterruptedException {
        delayed.drainTo(ready);
        QueueEntry entry = ready.poll(waitMs, TimeUnit.MILLISECONDS);
        if (entry == null) {
            return false;
        }
        process(entry.record());
        return true;
    }

    private void workLoop() {
        while (running.get()) {
            try {
                runOnce(schedulerProperties.getWorkerPollMs());
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                return;
            } catch (RuntimeException ex) {
                log.error("job worker loop failed", ex);
            }
        }
    }

    private void process(JobRecord record) throws InterruptedException {
        JobView activeView;
        synchronized (this) {
            if (jobs.get(record.jobId) != record) {
                return;
            }
            record.state = JobState.ACTIVE;
            record.attemptsMade++;
            record.updatedAt = System.currentTimeMillis();
            activeView = record.view();
        }
        notifyListeners(activeView, true);

        JobHandler handler = handlers.get(record.type);
        JobContext context = new JobContext(record.jobId, record.type, record.payload, record.attemptsMade, line -> appendLog(record, line));
        long startedAt = System.currentTimeMillis();
        try {
            if (handler == null) {
                throw new NonRetryableJobException("no handler for job type " + record.type);
            }
            Object result = handler.handle(context);
            complete(record, result);
            log.info("job completed, jobId={}, type={}, ms={}", record.jobId, record.type, System.currentTimeMillis() - startedAt);
        } catch (NonRetryableJobException ex) {
            fail(record, ex, false);
        } catch (InterruptedException ex) {
            fail(record, ex, false);
            throw ex;
        } catch (Exception ex) {
            fail(record, ex, true);
        }
    }

    private void complete(JobRecord record, Object result) {
        JobView view;
        synchronized (this) {
            record.state = JobState.COMPLETED;
            record.result = result;
            record.lastError = null;
            record.updatedAt = System.currentTimeMillis();
            view = record.view();
            trimFinished();
        }
        notifyListeners(view, false);
    }

    private void fail(JobRecord record, Exception error, boolean retryable) {
        String message = error.getMessage() == null ? error.getClass().getSimpleName() : error.getMessage();
        boolean retry = retryable && record.attemptsMade < record.maxAttempts;
        JobView view;
        QueueEntry retryEntry = null;
        synchronized (this) {
            record.lastError = message;
            record.updatedAt = System.currentTimeMillis();
            if (retry) {
                long delayMs = record.backoffMs * (1L << Math.min(20, record.attemptsMade - 1));
                record.state = JobState.DELAYED;
                retryEntry = new QueueEntry(record, record.priority, sequence.incrementAndGet(), System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(delayMs));
                log.warn("job attempt failed, retrying, jobId={}, attempt={}/{}, delayMs={}, error={}",
                    record.jobId, record.attemptsMade, record.maxAttempts, delayMs, message);
            } else {
                record.state = JobState.FAILED;
                log.warn("job failed, jobId={}, attempt={}/{}, error={}", record.jobId, record.attemptsMade, record.maxAttempts, message);
            }
            record.logs.add("error: " + message);
            view = record.view();
            trimFinished();
        }
        if (retryEntry != null) {
            delayed.add(retryEntry);
        }
        notifyListeners(view, false);
    }

    private synchronized void appendLog(JobRecord record, String line) {
        if (record.logs.size() >= Math.max(1, schedulerProperties.getJobLogLimit())) {
            record.logs.remove(0);
        }
        record.logs.add(line);
    }

    private void trimFinished() {
        int finished = 0;
        for (JobRecord record : jobs.values()) {
            if (record.state.isFinished()) {
                finished++;
            }
        }
        int excess = finished - Math.max(0, schedulerProperties.getJobRetention());
        Iterator<JobRecord> iterator = jobs.values().iterator();
        while (excess > 0 && iterator.hasNext()) {
            if (iterator.next().state.isFinished()) {
                iterator.remove();
                excess--;
            }
        }
    }

    private void notifyListeners(JobView view, boolean active) {
        for (JobListener listener : listeners) {
            try {
                if (active) {
                    listener.onActive(view);
                } else {
                    listener.onAttemptFinished(view);
                }
            } catch (RuntimeException ex) {
                log.warn("job listener failed, jobId={}, error={}", view.jobId(), ex.getMessage());
            }
        }
    }

    private static class JobRecord {

        private final String jobId;
        private final String type;
        private final Map<String, Object> payload;
        private final int priority;
        private final int maxAttempts;
        private final long backoffMs;
        private final long createdAt;
        private final List<String> logs = new ArrayList<>();
        private JobState state = JobState.PENDING;
        private int attemptsMade;
        private String lastError;
        private Object result;
        private long updatedAt;

        JobRecord(JobSpec spec, long now) {
            this.jobId = spec.getJobId();
            this.type = spec.getType();
            this.payload = spec.getPayload() == null ? Map.of() : Map.copyOf(spec.getPayload());
            this.priority = spec.getPriority();
            this.maxAttempts = Math.max(1, spec.getAttempts());
            this.backoffMs = Math.max(0, spec.getBackoffMs());
            this.createdAt = now;
            this.updatedAt = now;
        }

        JobView view() {
            return new JobView(jobId, type, payload, state, priority, attemptsMade, maxAttempts, lastError, result,
                List.copyOf(logs), createdAt, updatedAt);
        }

    }

    private record QueueEntry(JobRecord record, int priority, long sequence, long readyAtNanos) implements Delayed {

        @Override
        public long getDelay(TimeUnit unit) {
            return unit.convert(readyAtNanos - System.nanoTime(), TimeUnit.NANOSECONDS);
        }

        @Override
        public int compareTo(Delayed other) {
            if (other instanceof QueueEntry entry) {
                return Long.compare(readyAtNanos, entry.readyAtNanos);
            }
            return Long.compare(getDelay(TimeUnit.NANOSECONDS), other.getDelay(TimeUnit.NANOSECONDS));
        }

    }

}
