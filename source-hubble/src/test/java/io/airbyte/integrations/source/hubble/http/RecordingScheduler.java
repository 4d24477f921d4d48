/*
 * Copyright (c) 2020-2025 Airbyte, Inc., all rights reserved.
 */

package io.airbyte.integrations.source.hubble.http;

import dev.failsafe.spi.Scheduler;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Failsafe scheduler for tests: remembers every retry wait it is asked for and runs the task right
 * away.
 */
public class RecordingScheduler implements Scheduler, AutoCloseable {

  private final ScheduledExecutorService executor = Executors.newSingleThreadScheduledExecutor();
  private final List<Duration> waits = new CopyOnWriteArrayList<>();

  @Override
  public ScheduledFuture<?> schedule(final Callable<?> callable, final long delay, final TimeUnit unit) {
    if (delay > 0) {
      waits.add(Duration.ofNanos(unit.toNanos(delay)));
    }
    return executor.schedule(callable, 0, TimeUnit.MILLISECONDS);
  }

  public List<Duration> getWaits() {
    return List.copyOf(waits);
  }

  @Override
  public void close() {
    executor.shutdownNow();
  }

}
