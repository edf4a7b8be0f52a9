package ca.gc.cra.sconv.api;

import ca.gc.cra.sconv.application.conversion.ConversionProfile;
import ca.gc.cra.sconv.application.conversion.ConversionProfileRegistry;
import ca.gc.cra.sconv.config.CompositionRoot;
import ca.gc.cra.sconv.config.ConversionConfig;
import ca.gc.cra.sconv.domain.conversion.UnsupportedConversionException;
import ca.gc.cra.sconv.logging.LoggingConfigurator;
import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Prints the flags and stages a conversion profile would use, without converting anything.
 *
 * @since 0.1.0
 */
public final class InspectCli {
  private static final Logger log = LoggerFactory.getLogger(InspectCli.class);
  private static final String SUMMARY_USAGE =
      "usage: inspect from=CHARSET to=CHARSET [direction=read|write] [bestEffort=true|false] "
          + "[backend=NAME] [config=YAML] [properties=FILE]";
  private static final String HELP_TEXT = """
      sconv inspect

      Usage:
        inspect from=UTF-8 to=ISO-8859-1 [options]

      Accepts the charset, direction and engine options of convert and prints:
        profile, direction, backend, systemCharset, flags and stages.
      """;

  private InspectCli() {}

  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
    }

    Map<String, String> effective;
    try {
      Map<String, String> kv = new LinkedHashMap<>(CliArgsParser.toMap(input.keyValueArgs()));
      effective = ConfigCliUtils.effectiveConfig("inspect", kv, log::warn);
    } catch (NoSuchFileException ex) {
      log.error("Configuration file does not exist: {}", ex.getFile());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    } catch (IllegalArgumentException ex) {
      log.error("Invalid inspect arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    } catch (IOException ex) {
      log.error("Unable to read configuration", ex);
      return ExitCode.IO_ERROR;
    }

    ConversionConfig config;
    try {
      config = ConversionConfig.fromMap(effective);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid configuration: {}", ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    }
    ProfileArgs profileArgs;
    try {
      profileArgs = ProfileArgs.fromMap(effective, input.bestEffort());
    } catch (IllegalArgumentException ex) {
      log.error("Invalid inspect arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    try (CompositionRoot root = new CompositionRoot(config);
        ConversionProfileRegistry registry = root.newRegistry()) {
      ConversionProfile profile = profileArgs.open(registry);
      CliPrinter.printLines(
          "profile: " + profile.sourceCharset() + " -> " + profile.targetCharset(),
          "direction: " + profile.direction(),
          "backend: " + root.charsetBackend().name(),
          "systemCharset: " + registry.systemCharset(),
          "flags: " + profile.flags(),
          "stages: " + profile.stages());
      return ExitCode.SUCCESS;
    } catch (UnsupportedConversionException ex) {
      log.error("{}", ex.getMessage());
      return ExitCode.UNSUPPORTED_CONVERSION;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in inspect", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }
}
