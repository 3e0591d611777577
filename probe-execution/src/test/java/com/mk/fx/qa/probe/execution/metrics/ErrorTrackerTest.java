package com.mk.fx.qa.probe.execution.metrics;

import static org.junit.jupiter.api.Assertions.*;

import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.net.http.HttpTimeoutException;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import javax.net.ssl.SSLException;
import org.junit.jupiter.api.Test;

class ErrorTrackerTest {

  @Test
  void recordFailure_classifiesCommonNetworkErrors_andSamplesCapped() {
    ErrorTracker t = new ErrorTracker();
    t.recordFailure(new ConnectException("refused"));
    t.recordFailure(new SocketTimeoutException("so slow"));
    t.recordFailure(new UnknownHostException("nohost"));
    t.recordFailure(new SSLException("ssl"));
    t.recordFailure(new HttpTimeoutException("http timeout"));
    t.recordFailure(new IllegalStateException("other"));

    assertEquals(6, t.totalErrors());
    var breakdown = t.breakdownSnapshot();
    assertEquals(1L, breakdown.get("CONNECTION_REFUSED"));
    assertEquals(1L, breakdown.get("SOCKET_TIMEOUT"));
    assertEquals(1L, breakdown.get("UNKNOWN_HOST"));
    assertEquals(1L, breakdown.get("SSL_ERROR"));
    assertEquals(1L, breakdown.get("HTTP_TIMEOUT"));
    assertEquals(1L, breakdown.get("IllegalStateException"));

    assertEquals(5, t.samplesSnapshot().size());
  }

  @Test
  void recordFailure_usesRootCauseOfWrappedExceptions() {
    ErrorTracker t = new ErrorTracker();
    var wrapped = new RuntimeException("Error executing request", new ConnectException(null));

    assertEquals("CONNECTION_REFUSED", t.recordFailure(wrapped));
    assertEquals("Error executing request", t.samplesSnapshot().get(0).message());
    assertEquals("UNKNOWN", t.recordFailure(null));
  }

  @Test
  void recordHttpFailure_groupsByStatusClass() {
    ErrorTracker t = new ErrorTracker();
    t.recordHttpFailure(500);
    t.recordHttpFailure(503);
    t.recordHttpFailure(404);

    var breakdown = t.breakdownSnapshot();
    assertEquals(2L, breakdown.get("HTTP_5xx"));
    assertEquals(1L, breakdown.get("HTTP_4xx"));
    assertEquals("HTTP_3xx", ErrorTracker.httpCategory(301));
  }

  @Test
  void samples_skipDuplicates() {
    ErrorTracker t = new ErrorTracker();
    t.recordHttpFailure(500);
    t.recordHttpFailure(500);

    assertEquals(2, t.totalErrors());
    assertEquals(1, t.samplesSnapshot().size());
    var expected = new ErrorTracker.ErrorSample("HTTP_5xx", "HTTP status 500");
    assertEquals(expected, t.samplesSnapshot().get(0));
  }

  @Test
  void samples_stayCappedAndDistinctUnderConcurrentFailures() throws Exception {
    ErrorTracker t = new ErrorTracker();
    int threads = 16;
    var start = new CountDownLatch(1);
    var pool = Executors.newFixedThreadPool(threads);
    try {
      for (int i = 0; i < threads; i++) {
        final int worker = i;
        pool.execute(
            () -> {
              try {
                start.await();
              } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
              }
              for (int n = 0; n < 200; n++) {
                t.recordFailure(new ConnectException("refused " + (worker + n) % 8));
              }
            });
      }
      start.countDown();
      pool.shutdown();
      assertTrue(pool.awaitTermination(10, TimeUnit.SECONDS));
    } finally {
      pool.shutdownNow();
    }

    var samples = t.samplesSnapshot();
    assertEquals(threads * 200L, t.totalErrors());
    assertEquals(5, samples.size());
    assertEquals(5, Set.copyOf(samples).size());
  }
}
