package com.ocibiz.observability;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link LoggingConfigurer}: level filtering, format selection, replacement on
 * reconfiguration, noise policy and line integrity under concurrency.
 */
@DisplayName("LoggingConfigurer")
class LoggingConfigurerTest {

    private final StructuredLogger log = StructuredLogger.getLogger("svc");

    @AfterEach
    void restore() {
        LoggingConfigurer.configure(new LoggingSettings(LogLevel.INFO, LogFormat.JSON));
    }

    private static List<String> lines(ByteArrayOutputStream out) {
        return out.toString(StandardCharsets.UTF_8).lines().toList();
    }

    @Nested
    @DisplayName("Level filtering")
    class LevelFiltering {

        @Test
        @DisplayName("drops DEBUG and emits exactly one line for INFO at minimum INFO")
        void dropsBelowMinimum() {
            var out = new ByteArrayOutputStream();
            LoggingConfigurer.configure(new LoggingSettings(LogLevel.INFO, LogFormat.JSON), out);

            log.debug("hidden");
            assertThat(lines(out)).isEmpty();

            log.info("visible");
            assertThat(lines(out)).hasSize(1).first().asString().contains("\"message\":\"visible\"");
        }

        @Test
        @DisplayName("emits DEBUG when the minimum is DEBUG")
        void emitsDebugAtDebug() {
            var out = new ByteArrayOutputStream();
            LoggingConfigurer.configure(new LoggingSettings(LogLevel.DEBUG, LogFormat.JSON), out);

            log.debug("shown");

            assertThat(lines(out)).hasSize(1);
        }

        @Test
        @DisplayName("noise channels configured at INFO still respect a WARNING minimum")
        void noiseChannelsRespectMinimum() {
            var out = new ByteArrayOutputStream();
            LoggingConfigurer.configure(new LoggingSettings(LogLevel.WARNING, LogFormat.JSON), out);

            LoggerFactory.getLogger("org.apache.catalina.core.StandardService").info("Starting service");

            assertThat(lines(out)).isEmpty();
        }

        @Test
        @DisplayName("access-type channels are raised above the general minimum")
        void accessChannelsAreRaised() {
            var out = new ByteArrayOutputStream();
            LoggingConfigurer.configure(new LoggingSettings(LogLevel.DEBUG, LogFormat.JSON), out);

            LoggerFactory.getLogger("org.apache.catalina.valves.AccessLogValve").info("GET / 200");
            LoggerFactory.getLogger("org.apache.catalina.core.StandardService").info("Starting service");

            assertThat(lines(out)).hasSize(1).first().asString().contains("Starting service");
        }
    }

    @Nested
    @DisplayName("Reconfiguration")
    class Reconfiguration {

        @Test
        @DisplayName("second configuration fully replaces the first destination and format")
        void secondConfigurationReplacesFirst() {
            var first = new ByteArrayOutputStream();
            var second = new ByteArrayOutputStream();
            LoggingConfigurer.configure(new LoggingSettings(LogLevel.INFO, LogFormat.JSON), first);
            LoggingConfigurer.configure(new LoggingSettings(LogLevel.INFO, LogFormat.TEXT), second);

            log.info("started");

            assertThat(lines(first)).isEmpty();
            assertThat(lines(second)).hasSize(1).first().asString().endsWith(" - svc - INFO - started");
        }

        @Test
        @DisplayName("configuring twice with the same destination does not duplicate lines")
        void sameDestinationTwiceDoesNotDuplicate() {
            var out = new ByteArrayOutputStream();
            var settings = new LoggingSettings(LogLevel.INFO, LogFormat.JSON);
            LoggingConfigurer.configure(settings, out);
            LoggingConfigurer.configure(settings, out);

            log.info("once");

            assertThat(lines(out)).hasSize(1);
        }

        @Test
        @DisplayName("reconfiguring does not close the previous destination")
        void doesNotClosePreviousDestination() {
            var closeTracking = new CloseTrackingStream();
            LoggingConfigurer.configure(new LoggingSettings(LogLevel.INFO, LogFormat.JSON), closeTracking);
            LoggingConfigurer.configure(new LoggingSettings(LogLevel.INFO, LogFormat.JSON), new ByteArrayOutputStream());

            assertThat(closeTracking.closed).isFalse();
        }

        @Test
        @DisplayName("exposes the installed settings")
        void exposesCurrentSettings() {
            var settings = new LoggingSettings(LogLevel.ERROR, LogFormat.TEXT);
            LoggingConfigurer.configure(settings, new ByteArrayOutputStream());

            assertThat(LoggingConfigurer.currentSettings()).contains(settings);
        }

        @Test
        @DisplayName("rejects missing settings or destination")
        void rejectsNulls() {
            assertThatThrownBy(() -> LoggingConfigurer.configure(null, new ByteArrayOutputStream()))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> LoggingConfigurer.configure(LoggingSettings.parse("INFO", "json"), null))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("Sink behaviour")
    class SinkBehaviour {

        @Test
        @DisplayName("concurrent writers never interleave partial lines")
        void concurrentWritersProduceWholeLines() throws Exception {
            var out = new ByteArrayOutputStream();
            LoggingConfigurer.configure(new LoggingSettings(LogLevel.INFO, LogFormat.JSON), out);
            int writers = 8;
            int perWriter = 50;
            CountDownLatch start = new CountDownLatch(1);
            ExecutorService pool = Executors.newFixedThreadPool(writers);
            try {
                for (int w = 0; w < writers; w++) {
                    int writer = w;
                    pool.submit(() -> {
                        start.await();
                        for (int i = 0; i < perWriter; i++) {
                            log.info("line " + writer + "-" + i);
                        }
                        return null;
                    });
                }
                start.countDown();
                pool.shutdown();
                assertThat(pool.awaitTermination(10, TimeUnit.SECONDS)).isTrue();
            } finally {
                pool.shutdownNow();
            }

            assertThat(lines(out))
                    .hasSize(writers * perWriter)
                    .allSatisfy(line -> assertThat(line).startsWith("{\"timestamp\":").endsWith("}"));
        }

        @Test
        @DisplayName("a failing destination never throws into the caller")
        void failingDestinationDoesNotThrow() {
            LoggingConfigurer.configure(new LoggingSettings(LogLevel.INFO, LogFormat.JSON), new FailingStream());

            assertThatCode(() -> log.info("lost")).doesNotThrowAnyException();
        }
    }

    private static final class CloseTrackingStream extends OutputStream {
        private boolean closed;

        @Override
        public void write(int b) {
            // discard
        }

        @Override
        public void close() {
            closed = true;
        }
    }

    private static final class FailingStream extends OutputStream {
        @Override
        public void write(int b) throws IOException {
            throw new IOException("stream closed");
        }

        @Override
        public void write(byte[] b, int off, int len) throws IOException {
            throw new IOException("stream closed");
        }
    }
}
