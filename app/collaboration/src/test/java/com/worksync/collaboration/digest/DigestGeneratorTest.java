package com.worksync.collaboration.digest;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.worksync.collaboration.config.DigestProperties;
import com.worksync.collaboration.model.DigestRecipient;
import com.worksync.collaboration.model.UserPreferences;
import com.worksync.collaboration.realtime.ConnectionRegistry;
import com.worksync.collaboration.repository.DigestJobRunRepository;
import com.worksync.collaboration.repository.UserDirectoryRepository;
import com.worksync.collaboration.service.CollaborationMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class DigestGeneratorTest {

    private static final Instant FIRED_AT = Instant.parse("2026-03-10T07:00:03Z");
    private static final String WINDOW = "2026-03-10T07:00";

    private DigestJobRunRepository jobRunRepository;
    private UserDirectoryRepository userDirectoryRepository;
    private UserDigestProcessor processor;
    private SimpleMeterRegistry meterRegistry;
    private ExecutorService executor;
    private final CountDownLatch release = new CountDownLatch(1);

    @BeforeEach
    void setUp() {
        jobRunRepository = mock(DigestJobRunRepository.class);
        userDirectoryRepository = mock(UserDirectoryRepository.class);
        processor = mock(UserDigestProcessor.class);
        meterRegistry = new SimpleMeterRegistry();
        executor = Executors.newFixedThreadPool(2);
    }

    @AfterEach
    void tearDown() {
        release.countDown();
        executor.shutdownNow();
    }

    @Test
    void windowKeyIsFiringHourInJobZone() {
        assertThat(DigestGenerator.windowKey(FIRED_AT, ZoneId.of("UTC"))).isEqualTo(WINDOW);
        assertThat(DigestGenerator.windowKey(FIRED_AT, ZoneId.of("Asia/Tokyo"))).isEqualTo("2026-03-10T16:00");
    }

    @Test
    void alreadyClaimedWindowIsSkipped() {
        when(jobRunRepository.claimWindow("morning_digest", WINDOW, FIRED_AT)).thenReturn(false);

        final DigestRunResult result = generator(DigestTestProperties.digest()).run(DigestJob.MORNING_DIGEST, FIRED_AT);

        assertThat(result.claimed()).isFalse();
        verifyNoInteractions(userDirectoryRepository, processor);
        verify(jobRunRepository, never()).complete(anyString(), anyString(), any(), anyInt(), anyInt(), anyInt());
    }

    @Test
    void failingUserDoesNotAbortTheBatch() {
        claimWindow();
        when(userDirectoryRepository.findDigestRecipients())
                .thenReturn(List.of(recipient("u-1"), recipient("u-2"), recipient("u-3")));
        when(processor.process(eq(DigestJob.MORNING_DIGEST), any(DigestRecipient.class), eq(WINDOW), any(Instant.class)))
                .thenAnswer(invocation -> {
                    final DigestRecipient recipient = invocation.getArgument(1);
                    if (recipient.userId().equals("u-2")) {
                        throw new IllegalStateException("smtp down");
                    }
                    return new UserDigestResult(recipient.userId(), 0, 0, 0, false);
                });

        final DigestRunResult result = generator(DigestTestProperties.digest()).run(DigestJob.MORNING_DIGEST, FIRED_AT);

        assertThat(result.claimed()).isTrue();
        assertThat(result.processed()).isEqualTo(2);
        assertThat(result.failed()).isEqualTo(1);
        assertThat(result.skipped()).isZero();
        verify(jobRunRepository).complete("morning_digest", WINDOW, FIRED_AT, 2, 1, 0);
        assertThat(meterRegistry.counter("collaboration.digest.users.total", "job", "morning_digest", "result", "failed")
                .count()).isEqualTo(1.0);
    }

    @Test
    void recipientsWithJobDisabledAreNotProcessed() {
        claimWindow();
        final DigestRecipient noLunch = new DigestRecipient(
                "u-2", "u-2@example.com", "U2", new UserPreferences(true, false, true, true, true, false));
        when(userDirectoryRepository.findDigestRecipients()).thenReturn(List.of(recipient("u-1"), noLunch));
        when(processor.process(any(), any(), any(), any())).thenReturn(new UserDigestResult("u-1", 0, 0, 0, false));

        final DigestRunResult result = generator(DigestTestProperties.digest()).run(DigestJob.LUNCH_REMINDER, FIRED_AT);

        assertThat(result.total()).isEqualTo(1);
        verify(processor, never()).process(any(), eq(noLunch), any(), any());
    }

    @Test
    void slowUserTimesOutAndCountsAsFailed() {
        claimWindow();
        when(userDirectoryRepository.findDigestRecipients()).thenReturn(List.of(recipient("slow"), recipient("fast")));
        when(processor.process(any(), any(), any(), any())).thenAnswer(invocation -> {
            final DigestRecipient recipient = invocation.getArgument(1);
            if (recipient.userId().equals("slow")) {
                release.await(10, TimeUnit.SECONDS);
            }
            return new UserDigestResult(recipient.userId(), 0, 0, 0, false);
        });

        final DigestRunResult result = generator(
                DigestTestProperties.digest(Duration.ofMillis(200), Duration.ofSeconds(10)))
                .run(DigestJob.MORNING_DIGEST, FIRED_AT);

        assertThat(result.processed()).isEqualTo(1);
        assertThat(result.failed()).isEqualTo(1);
        assertThat(result.skipped()).isZero();
    }

    @Test
    void runDeadlineSkipsUnfinishedUsers() {
        claimWindow();
        when(userDirectoryRepository.findDigestRecipients())
                .thenReturn(List.of(recipient("u-1"), recipient("u-2"), recipient("u-3")));
        when(processor.process(any(), any(), any(), any())).thenAnswer(invocation -> {
            release.await(10, TimeUnit.SECONDS);
            return new UserDigestResult("ignored", 0, 0, 0, false);
        });

        final DigestRunResult result = generator(
                DigestTestProperties.digest(Duration.ofSeconds(10), Duration.ofMillis(300)))
                .run(DigestJob.MORNING_DIGEST, FIRED_AT);

        assertThat(result.processed()).isZero();
        assertThat(result.skipped()).isEqualTo(3);
        verify(jobRunRepository).complete("morning_digest", WINDOW, FIRED_AT, 0, 0, 3);
    }

    private void claimWindow() {
        when(jobRunRepository.claimWindow(anyString(), eq(WINDOW), eq(FIRED_AT))).thenReturn(true);
    }

    private DigestGenerator generator(DigestProperties properties) {
        return new DigestGenerator(
                jobRunRepository,
                userDirectoryRepository,
                processor,
                executor,
                properties,
                new CollaborationMetrics(meterRegistry, new ConnectionRegistry()),
                Clock.fixed(FIRED_AT, ZoneOffset.UTC));
    }

    private static DigestRecipient recipient(String userId) {
        return new DigestRecipient(userId, userId + "@example.com", userId, UserPreferences.defaults());
    }
}
