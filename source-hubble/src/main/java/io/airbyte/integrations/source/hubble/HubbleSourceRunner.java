/*
 * Copyright (c) 2020-2025 Airbyte, Inc., all rights reserved.
 */

package io.airbyte.integrations.source.hubble;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.annotations.VisibleForTesting;
import io.airbyte.integrations.source.hubble.exception.FailureType;
import io.airbyte.integrations.source.hubble.exception.HubbleConfigurationException;
import io.airbyte.integrations.source.hubble.exception.HubbleException;
import io.airbyte.integrations.source.hubble.exception.HubbleSyncException;
import io.airbyte.integrations.source.hubble.json.Jsons;
import io.airbyte.integrations.source.hubble.protocol.ConnectorMessage;
import jakarta.inject.Singleton;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;
import lombok.extern.slf4j.Slf4j;

/**
 * Command line front of the connector. Understands
 *
 * <pre>
 * spec
 * check    --config CONFIG
 * discover --config CONFIG
 * read     --config CONFIG [--catalog CATALOG] [--state STATE]
 * </pre>
 *
 * and writes one JSON message per line. Failures are reported as error trace messages and a
 * non-zero exit code.
 */
@Slf4j
@Singleton
public class HubbleSourceRunner {

  static final String CONFIG = "--config";
  static final String CATALOG = "--catalog";
  static final String STATE = "--state";

  private static final Map<String, Set<String>> COMMAND_OPTIONS = Map.of(
      "spec", Set.of(),
      "check", Set.of(CONFIG),
      "discover", Set.of(CONFIG),
      "read", Set.of(CONFIG, CATALOG, STATE));

  private final HubbleSource source;
  private final Clock clock;

  public HubbleSourceRunner(final HubbleSource source, final Clock clock) {
    this.source = source;
    this.clock = clock;
  }

  /**
   * @param args command and options
   * @param stdout receives each serialized message
   * @return process exit code
   */
  public int run(final String[] args, final Consumer<String> stdout) {
    final Consumer<ConnectorMessage> output = message -> stdout.accept(message.serialize());
    try {
      final String command = args.length == 0 ? "" : args[0];
      final Map<String, String> options = parseOptions(command, List.of(args).subList(Math.min(1, args.length), args.length));
      log.info("Running {}.", command);
      switch (command) {
        case "spec" -> output.accept(source.spec());
        case "check" -> output.accept(source.check(readJson(options, CONFIG)));
        case "discover" -> output.accept(source.discover(readJson(options, CONFIG)));
        case "read" -> source.read(readJson(options, CONFIG), readJson(options, CATALOG), readJson(options, STATE), output);
        default -> throw new IllegalStateException("Unhandled command " + command);
      }
      log.info("Completed {}.", command);
      return 0;
    } catch (final HubbleSyncException e) {
      // each failed stream already has its own trace
      log.error(e.getMessage());
      return 1;
    } catch (final HubbleException e) {
      log.error("Connector failed: {}", e.getMessage(), e);
      output.accept(ConnectorMessage.error(null, e.getMessage(), e, e.getFailureType(), clock.instant()));
      return 1;
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
      log.error("Connector interrupted.", e);
      output.accept(ConnectorMessage.error(null, "Interrupted", e, FailureType.TRANSIENT_ERROR, clock.instant()));
      return 1;
    } catch (final RuntimeException e) {
      log.error("Connector failed unexpectedly.", e);
      output.accept(ConnectorMessage.error(null, "Something went wrong in the connector. See the logs for more details.", e,
          FailureType.SYSTEM_ERROR, clock.instant()));
      return 1;
    }
  }

  @VisibleForTesting
  static Map<String, String> parseOptions(final String command, final List<String> arguments) {
    final Set<String> allowed = COMMAND_OPTIONS.get(command);
    if (allowed == null) {
      throw new HubbleConfigurationException(
          String.format("Unknown command '%s', expected one of spec, check, discover, read", command));
    }
    final Map<String, String> options = new HashMap<>();
    for (int i = 0; i < arguments.size(); i += 2) {
      final String option = arguments.get(i);
      if (!allowed.contains(option)) {
        throw new HubbleConfigurationException(String.format("Option '%s' is not supported by %s", option, command));
      }
      if (i + 1 >= arguments.size()) {
        throw new HubbleConfigurationException(String.format("Option '%s' needs a file path", option));
      }
      options.put(option, arguments.get(i + 1));
    }
    if (allowed.contains(CONFIG) && !options.containsKey(CONFIG)) {
      throw new HubbleConfigurationException(String.format("%s requires %s", command, CONFIG));
    }
    return options;
  }

  private static JsonNode readJson(final Map<String, String> options, final String option) {
    final String location = options.get(option);
    if (location == null) {
      return null;
    }
    final Path path = Path.of(location);
    if (!Files.isRegularFile(path)) {
      throw new HubbleConfigurationException(String.format("File %s given to %s does not exist", location, option));
    }
    try {
      return Jsons.readFile(path);
    } catch (final IllegalArgumentException e) {
      throw new HubbleConfigurationException(String.format("File %s given to %s is not valid JSON", location, option), e);
    }
  }

}
