package com.bbthechange.watcher.runner;

import com.bbthechange.watcher.config.WatcherProperties;
import com.bbthechange.watcher.dto.poll.CycleResult;
import com.bbthechange.watcher.service.CycleOptions;
import com.bbthechange.watcher.service.PollerService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.DefaultApplicationArguments;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class PollerRunnerTest {

    @Mock
    private PollerService pollerService;

    private PollerRunner runner;

    @BeforeEach
    void setUp() {
        WatcherProperties properties = new WatcherProperties();
        properties.getPoller().setInterval(Duration.ofHours(1));
        properties.getPoller().setShutdownTimeout(Duration.ofSeconds(5));
        lenient().when(pollerService.runCycle(any(CycleOptions.class))).thenReturn(CycleResult.skipped(1));
        runner = new PollerRunner(pollerService, properties);
    }

    private static DefaultApplicationArguments args(String... args) {
        return new DefaultApplicationArguments(args);
    }

    @Nested
    @DisplayName("single cycle")
    class SingleCycleTests {

        @Test
        @DisplayName("should run exactly one cycle when no mode is given")
        void run_NoArgs_RunsOnce() {
            // When
            runner.run(args());

            // Then
            verify(pollerService, times(1)).runCycle(any(CycleOptions.class));
        }

        @Test
        @DisplayName("should pass the lock bypass through to the cycle")
        void run_NoLock_BypassesLock() {
            // When
            runner.run(args("--once", "--no-lock"));

            // Then
            ArgumentCaptor<CycleOptions> captor = ArgumentCaptor.forClass(CycleOptions.class);
            verify(pollerService).runCycle(captor.capture());
            assertThat(captor.getValue().bypassLock()).isTrue();
            assertThat(captor.getValue().isCancelled()).isFalse();
        }

        @Test
        @DisplayName("should accept Spring property overrides alongside runner options")
        void run_PropertyOverride_Accepted() {
            runner.run(args("--once", "--watcher.lock.type=dynamodb"));

            verify(pollerService).runCycle(any(CycleOptions.class));
        }
    }

    @Nested
    @DisplayName("argument validation")
    class ValidationTests {

        @Test
        void run_OnceAndContinuous_Rejected() {
            assertThatThrownBy(() -> runner.run(args("--once", "--continuous")))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("cannot be combined");
            verify(pollerService, never()).runCycle(any(CycleOptions.class));
        }

        @Test
        void run_IntervalWithoutContinuous_Rejected() {
            assertThatThrownBy(() -> runner.run(args("--interval=60")))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        void run_UnknownOption_Rejected() {
            assertThatThrownBy(() -> runner.run(args("--forever")))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("--forever");
        }

        @Test
        void run_PositionalArgument_Rejected() {
            assertThatThrownBy(() -> runner.run(args("watchexchange")))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        void run_NonNumericInterval_Rejected() {
            assertThatThrownBy(() -> runner.run(args("--continuous", "--interval=soon")))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("whole number");
        }

        @Test
        void run_ZeroInterval_Rejected() {
            assertThatThrownBy(() -> runner.run(args("--continuous", "--interval=0")))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("at least 1 second");
        }
    }

    @Nested
    @DisplayName("continuous mode")
    class ContinuousTests {

        @Test
        @DisplayName("should keep cycling until stopped and then return promptly")
        void run_Continuous_StopsOnRequest() throws Exception {
            // Given
            CompletableFuture<Void> loop = CompletableFuture.runAsync(
                    () -> runner.run(args("--continuous", "--interval=3600")));
            await().atMost(5, TimeUnit.SECONDS)
                    .untilAsserted(() -> verify(pollerService, atLeastOnce()).runCycle(any(CycleOptions.class)));

            // When
            runner.stop();

            // Then
            loop.get(5, TimeUnit.SECONDS);
            assertThat(loop).isCompleted();
            verify(pollerService, times(1)).runCycle(any(CycleOptions.class));
        }

        @Test
        @DisplayName("should signal cancellation to the in-flight cycle")
        void stop_SetsCancellationFlag() {
            // Given
            runner.run(args("--once"));
            ArgumentCaptor<CycleOptions> captor = ArgumentCaptor.forClass(CycleOptions.class);
            verify(pollerService).runCycle(captor.capture());

            // When
            runner.stop();

            // Then
            assertThat(captor.getValue().isCancelled()).isTrue();
        }
    }
}
