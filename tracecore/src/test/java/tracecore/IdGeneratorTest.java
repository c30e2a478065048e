/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tracecore;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static tracecore.FixedIds.sequence;

class IdGeneratorTest {

  @Test void nextId_skipsZero() {
    IdGenerator generator = sequence(0L, 0L, 7L);

    assertThat(generator.nextId()).isEqualTo(7L);
  }

  @Test void nextTraceId_64bit() {
    TraceId traceId = sequence(5L).nextTraceId(false);

    assertThat(traceId.hasHigh()).isFalse();
    assertThat(traceId.low()).isEqualTo(5L);
  }

  @Test void nextTraceId_128bitDrawsHighFirst() {
    TraceId traceId = sequence(1L, 2L).nextTraceId(true);

    assertThat(traceId.hasHigh()).isTrue();
    assertThat(traceId.high()).isEqualTo(1L);
    assertThat(traceId.low()).isEqualTo(2L);
  }

  @Test void random_noRepeatsInLargeSample() {
    Set<Long> ids = new HashSet<>();
    for (int i = 0; i < 100_000; i++) {
      long id = IdGenerator.RANDOM.nextId();
      assertThat(id).isNotZero();
      ids.add(id);
    }
    assertThat(ids).hasSize(100_000);
  }

  @Test void random_safeForConcurrentUse() throws Exception {
    Set<Long> ids = Collections.newSetFromMap(new ConcurrentHashMap<>());
    ExecutorService executor = Executors.newFixedThreadPool(4);
    try {
      List<Future<?>> futures = new ArrayList<>();
      for (int t = 0; t < 4; t++) {
        futures.add(executor.submit(() -> {
          for (int i = 0; i < 10_000; i++) ids.add(IdGenerator.RANDOM.nextId());
        }));
      }
      for (Future<?> future : futures) future.get(10, TimeUnit.SECONDS);
    } finally {
      executor.shutdownNow();
    }
    assertThat(ids).hasSize(40_000);
  }

  @Test void create_nullRandom() {
    assertThatThrownBy(() -> IdGenerator.create(null))
      .isInstanceOf(NullPointerException.class)
      .hasMessage("random == null");
  }
}
