/*
 * Copyright (c) 2020-2025 Airbyte, Inc., all rights reserved.
 */

package io.airbyte.integrations.source.hubble.logging;

import java.util.Map;
import org.slf4j.MDC;

/**
 * Tags every log line written on the current thread with the stream being extracted. Closing the
 * scope restores the previous MDC, which matters when streams run one after another on the same
 * thread.
 *
 * <pre>
 * try (final StreamMdcScope ignored = StreamMdcScope.forStream("vacancies")) {
 *   ...
 * }
 * </pre>
 */
public final class StreamMdcScope implements AutoCloseable {

  public static final String STREAM_KEY = "stream_name";

  private final Map<String, String> previousContext;

  private StreamMdcScope(final String streamName) {
    previousContext = MDC.getCopyOfContextMap();
    MDC.put(STREAM_KEY, streamName);
  }

  public static StreamMdcScope forStream(final String streamName) {
    return new StreamMdcScope(streamName);
  }

  @Override
  public void close() {
    if (previousContext == null) {
      MDC.clear();
    } else {
      MDC.setContextMap(previousContext);
    }
  }

}
