/*
 * Where: digest pipeline
 * What: runs one job firing: claims its window, fans users out to the worker pool, records counters
 * Why: a firing runs at most once per window and one slow or failing user never stalls the batch
 */
package com.worksync.collaboration.digest;

import com.worksync.collaboration.config.DigestProperties;
import com.worksync.collaboration.model.DigestRecipient;
import com.worksync.collaboration.repository.DigestJobRunRepository;
import com.worksync.collaboration.repository.UserDirectoryRepository;
import com.worksync.collaboration.service.CollaborationMetrics;
import com.worksync.common.TraceIds;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.temporal.ChronoUnit;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

@Service
public class DigestGenerator {

    private static final Logger logger = LoggerFactory.getLogger(DigestGenerator.class);
    static final String MDC_JOB = "digest_job";
    static final String MDC_USER = "user_id";
    private static final long POLL_MILLIS = 25;

    private final DigestJobRunRepository jobRunRepository;
    private final UserDirectoryRepository userDirectoryRepository;
    private final UserDigestProcessor processor;
    private final Executor executor;
    private final DigestProperties properties;
    private final CollaborationMetrics metrics;
    private final Clock clock;

    public DigestGenerator(
            DigestJobRunRepository jobRunRepository,
            UserDirectoryRepository userDirectoryRepository,
            UserDigestProcessor processor,
            @Qualifier("digestExecutor") Executor executor,
            DigestProperties properties,
            CollaborationMetrics metrics,
            Clock clock) {
        this.jobRunRepository = jobRunRepository;
        this.userDirectoryRepository = userDirectoryRepository;
        this.processor = processor;
        this.executor = executor;
        this.properties = properties;
        this.metrics = metrics;
        this.clock = clock;
    }

    /** Window a firing belongs to: the firing time truncated to the hour, in the job zone. */
    public static String windowKey(Instant firedAt, ZoneId zone) {
        return firedAt.atZone(zone).truncatedTo(ChronoUnit.HOURS).toLocalDateTime().toString();
    }

    public String windowKey(Instant firedAt) {
        return windowKey(firedAt, properties.zoneId());
    }

    public DigestRunResult run(DigestJob job, Instant firedAt) {
        final String windowKey = windowKey(firedAt);
        if (!jobRunRepository.claimWindow(job.jobName(), windowKey, firedAt)) {
            logger.info("digest window already claimed job={} window={}", job.jobName(), windowKey);
            return DigestRunResult.notClaimed(job, windowKey);
        }
        final String traceId = TraceIds.newTraceId();
        MDC.put(TraceIds.MDC_KEY, traceId);
        MDC.put(MDC_JOB, job.jobName());
        final long startedAt = System.nanoTime();
        try {
            final List<DigestRecipient> recipients = userDirectoryRepository.findDigestRecipients().stream()
                    .filter(recipient -> job.isEnabledFor(recipient.preferences()))
                    .toList();
            logger.info("digest run started job={} window={} recipients={}",
                    job.jobName(), windowKey, recipients.size());

            final Counts counts = processAll(job, recipients, windowKey, traceId, startedAt);
            final Instant completedAt = Instant.now(clock);
            jobRunRepository.complete(
                    job.jobName(), windowKey, completedAt, counts.processed, counts.failed, counts.skipped);
            metrics.recordDigestUsers(job.jobName(), "processed", counts.processed);
            metrics.recordDigestUsers(job.jobName(), "failed", counts.failed);
            metrics.recordDigestUsers(job.jobName(), "skipped", counts.skipped);
            metrics.recordDigestRun(job.jobName(), Duration.ofNanos(System.nanoTime() - startedAt));
            logger.info("digest run completed job={} window={} processed={} failed={} skipped={}",
                    job.jobName(), windowKey, counts.processed, counts.failed, counts.skipped);
            return new DigestRunResult(
                    job, windowKey, true, counts.processed, counts.failed, counts.skipped, completedAt);
        } finally {
            MDC.remove(MDC_JOB);
            MDC.remove(TraceIds.MDC_KEY);
        }
    }

    private Counts processAll(
            DigestJob job, List<DigestRecipient> recipients, String windowKey, String traceId, long startedAt) {
        final Counts counts = new Counts();
        if (recipients.isEmpty()) {
            return counts;
        }
        final Instant now = Instant.now(clock);
        final ExecutorCompletionService<UserDigestResult> completion = new ExecutorCompletionService<>(executor);
        final Map<Future<UserDigestResult>, UserTask> pending = new HashMap<>();
        for (DigestRecipient recipient : recipients) {
            final UserTask task = new UserTask(job, recipient, windowKey, now, traceId);
            pending.put(completion.submit(task), task);
        }

        final long deadline = startedAt + properties.runDeadline().toNanos();
        final long perUserTimeout = properties.perUserTimeout().toNanos();
        while (!pending.isEmpty()) {
            final long current = System.nanoTime();
            if (current - deadline >= 0) {
                logger.warn("digest run deadline reached job={} window={} unfinished={}",
                        job.jobName(), windowKey, pending.size());
                counts.skipped += cancelAll(pending);
                break;
            }
            counts.failed += cancelTimedOut(job, pending, current, perUserTimeout);

            final Future<UserDigestResult> done;
            try {
                done = completion.poll(Math.min(POLL_MILLIS, TimeUnit.NANOSECONDS.toMillis(deadline - current) + 1),
                        TimeUnit.MILLISECONDS);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                logger.warn("digest run interrupted job={} window={} unfinished={}",
                        job.jobName(), windowKey, pending.size());
                counts.skipped += cancelAll(pending);
                break;
            }
            if (done == null) {
                continue;
            }
            final UserTask task = pending.remove(done);
            if (task == null) {
                // already cancelled and counted
                continue;
            }
            try {
                done.get();
                counts.processed++;
            } catch (ExecutionException ex) {
                counts.failed++;
                logger.error("digest failed for user job={} userId={}",
                        job.jobName(), task.recipient.userId(), ex.getCause());
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                counts.failed++;
            }
        }
        return counts;
    }

    private int cancelTimedOut(
            DigestJob job, Map<Future<UserDigestResult>, UserTask> pending, long current, long perUserTimeout) {
        int cancelled = 0;
        final Iterator<Map.Entry<Future<UserDigestResult>, UserTask>> it = pending.entrySet().iterator();
        while (it.hasNext()) {
            final Map.Entry<Future<UserDigestResult>, UserTask> entry = it.next();
            final long taskStartedAt = entry.getValue().startedAt;
            if (taskStartedAt != 0 && current - taskStartedAt >= perUserTimeout && !entry.getKey().isDone()) {
                entry.getKey().cancel(true);
                it.remove();
                cancelled++;
                logger.warn("digest user timed out job={} userId={} timeout={}",
                        job.jobName(), entry.getValue().recipient.userId(), properties.perUserTimeout());
            }
        }
        return cancelled;
    }

    private static int cancelAll(Map<Future<UserDigestResult>, UserTask> pending) {
        final int count = pending.size();
        pending.keySet().forEach(future -> future.cancel(true));
        pending.clear();
        return count;
    }

    private static final class Counts {
        int processed;
        int failed;
        int skipped;
    }

    private final class UserTask implements Callable<UserDigestResult> {

        private final DigestJob job;
        private final DigestRecipient recipient;
        private final String windowKey;
        private final Instant now;
        private final String traceId;
        // 0 until a worker thread picks the task up
        private volatile long startedAt;

        private UserTask(DigestJob job, DigestRecipient recipient, String windowKey, Instant now, String traceId) {
            this.job = job;
            this.recipient = recipient;
            this.windowKey = windowKey;
            this.now = now;
            this.traceId = traceId;
        }

        @Override
        public UserDigestResult call() {
            startedAt = System.nanoTime();
            MDC.put(TraceIds.MDC_KEY, traceId);
            MDC.put(MDC_JOB, job.jobName());
            MDC.put(MDC_USER, recipient.userId());
            try {
                return processor.process(job, recipient, windowKey, now);
            } finally {
                MDC.remove(MDC_USER);
                MDC.remove(MDC_JOB);
                MDC.remove(TraceIds.MDC_KEY);
            }
        }
    }
}
