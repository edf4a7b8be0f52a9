package ca.gc.cra.sconv.api;

import ca.gc.cra.sconv.application.conversion.ConversionProfile;
import ca.gc.cra.sconv.application.conversion.ConversionProfileRegistry;
import ca.gc.cra.sconv.config.CompositionRoot;
import ca.gc.cra.sconv.config.ConversionConfig;
import ca.gc.cra.sconv.domain.buffer.ByteTextBuffer;
import ca.gc.cra.sconv.domain.conversion.BufferExhaustedException;
import ca.gc.cra.sconv.domain.conversion.ConversionResult;
import ca.gc.cra.sconv.domain.conversion.UnsupportedConversionException;
import ca.gc.cra.sconv.logging.LoggingConfigurator;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Converts the text of one file between charsets, the way an archive entry name is converted.
 *
 * @since 0.1.0
 */
public final class ConvertCli {
  private static final Logger log = LoggerFactory.getLogger(ConvertCli.class);
  private static final String SUMMARY_USAGE =
      "usage: convert from=CHARSET to=CHARSET in=PATH [out=PATH] [direction=read|write] "
          + "[bestEffort=true|false] [config=YAML] [properties=FILE] [--best-effort]";
  private static final String HELP_TEXT = """
      sconv convert

      Usage:
        convert from=CP932 to=UTF-8 in=./name.bin [options]

      Required:
        from=CHARSET             Charset of the input (may be omitted when direction=write)
        to=CHARSET               Charset of the output (may be omitted when direction=read)
        in=PATH                  File whose bytes are converted; input stops at the first NUL

      Optional:
        out=PATH                 Write converted bytes here instead of stdout
        direction=read|write     read normalizes Unicode input (default read)
        bestEffort=true|false    Substitute instead of failing when no converter exists
        backend=NAME             NONE, EXTERNAL_CODEC, PLATFORM_CODEPAGE, PLATFORM_DECOMPOSITION
        systemCharset=CHARSET    Override the discovered system charset
        legacyUtf8=true|false    Read UTF-8 written by old archivers
        normalization=NFC|NFD    Normalization applied when reading Unicode
        normalizationRunLimit=N  Longest combining run recomposed (2-64, default 10)
        allocationPolicy=RECOVERABLE|FATAL
        maxBufferCapacity=BYTES  Largest buffer a conversion may allocate
        metricsExporter=otlp|none  Metrics exporter (default none)
        otelEndpoint=URL           OTLP metrics endpoint when exporter=otlp
        otelResourceAttributes=K=V Comma-separated OTel resource attributes
        config=PATH              YAML file (common + convert sections)
        properties=PATH          Properties file with the same keys
        --best-effort            Same as bestEffort=true
        --verbose                Enable DEBUG logging
        --help                   Show this message

      Exit codes:
        0 converted exactly, 1 characters substituted, 6 unsupported charset pair
      """;

  private ConvertCli() {}

  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  /**
   * Executes the convert command.
   *
   * @param args raw CLI arguments, command name excluded
   * @return exit code capturing the outcome
   */
  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for convert CLI");
    }

    Map<String, String> effective;
    try {
      Map<String, String> kv = new LinkedHashMap<>(CliArgsParser.toMap(input.keyValueArgs()));
      effective = ConfigCliUtils.effectiveConfig("convert", kv, log::warn);
    } catch (NoSuchFileException ex) {
      log.error("Configuration file does not exist: {}", ex.getFile());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    } catch (IllegalArgumentException ex) {
      log.error("Invalid convert arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    } catch (IOException ex) {
      log.error("Unable to read configuration", ex);
      return ExitCode.IO_ERROR;
    }

    ConversionConfig config;
    ProfileArgs profileArgs;
    try {
      config = ConversionConfig.fromMap(effective);
      TelemetryConfigurator.configureMetrics(effective);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid configuration: {}", ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    }
    if (config.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
    }
    String in = effective.getOrDefault("in", "").trim();
    try {
      profileArgs = ProfileArgs.fromMap(effective, input.bestEffort());
      if (in.isEmpty()) {
        throw new IllegalArgumentException("in is required");
      }
    } catch (IllegalArgumentException ex) {
      log.error("Invalid convert arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    byte[] data;
    try {
      data = Files.readAllBytes(Path.of(in));
    } catch (IOException ex) {
      log.error("Unable to read input {}", in, ex);
      return ExitCode.IO_ERROR;
    }

    String out = effective.getOrDefault("out", "").trim();
    try (CompositionRoot root = new CompositionRoot(config);
        ConversionProfileRegistry registry = root.newRegistry()) {
      ConversionProfile profile = profileArgs.open(registry);
      log.debug("Converting {} bytes with {}", data.length, profile);
      ByteTextBuffer converted = new ByteTextBuffer(config.maxBufferCapacity());
      ConversionResult result = profile.convert(data, converted);
      if (out.isEmpty()) {
        CliPrinter.writeBytes(converted.array(), 0, converted.length());
      } else {
        Files.write(Path.of(out), converted.toByteArray());
      }
      if (result.isComplete()) {
        log.info("Converted {} bytes to {} bytes", data.length, converted.length());
        return ExitCode.SUCCESS;
      }
      log.warn("Converted with substitutions {}", result.issues());
      return ExitCode.SUBSTITUTED;
    } catch (UnsupportedConversionException ex) {
      log.error("{}", ex.getMessage());
      return ExitCode.UNSUPPORTED_CONVERSION;
    } catch (BufferExhaustedException ex) {
      log.error("Conversion ran out of buffer space: {}", ex.getMessage());
      return ExitCode.OUT_OF_MEMORY;
    } catch (IOException ex) {
      log.error("Unable to write converted output", ex);
      return ExitCode.IO_ERROR;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in convert", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }
}
