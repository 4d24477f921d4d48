/*
 * Copyright (c) 2020-2025 Airbyte, Inc., all rights reserved.
 */

package io.airbyte.integrations.source.hubble;

import io.micronaut.context.ApplicationContext;
import java.lang.invoke.MethodHandles;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point of the Hubble source. Messages go to stdout, logs to stderr.
 */
public class Application {

  private static final Logger log = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

  public static void main(final String[] args) {
    var exitCode = 1;
    try (final ApplicationContext ctx = ApplicationContext.run()) {
      exitCode = ctx.getBean(HubbleSourceRunner.class).run(args, System.out::println);
    } catch (final Throwable t) {
      log.error("Could not start the connector: {}", t.getMessage(), t);
    } finally {
      System.out.flush();
      System.exit(exitCode);
    }
  }

}
