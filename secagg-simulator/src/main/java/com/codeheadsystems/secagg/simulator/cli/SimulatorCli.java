package com.codeheadsystems.secagg.simulator.cli;

import com.codeheadsystems.secagg.masking.ExchangeCurve;
import com.codeheadsystems.secagg.simulator.CsvExperimentLog;
import com.codeheadsystems.secagg.simulator.Experiment;
import com.codeheadsystems.secagg.simulator.ExperimentRunner;
import com.codeheadsystems.secagg.simulator.RingDimensionPolicy;
import com.codeheadsystems.secagg.simulator.SimulatorConfig;
import com.codeheadsystems.secagg.simulator.model.ClientTimings;
import com.codeheadsystems.secagg.simulator.model.CommunicationReport;
import com.codeheadsystems.secagg.simulator.model.ExperimentResult;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Command-line driver for the secure aggregation simulator.
 *
 * <pre>
 * Usage:
 *   java -cp &lt;classpath&gt; com.codeheadsystems.secagg.simulator.cli.SimulatorCli
 *        [--suite single|scaling-clients|scaling-data|all] [--clients N] [--data-size D]
 *        [--min-ring-dimension M] [--curve P-384] [--threads T] [--seed S] [--output-dir DIR]
 *
 * Examples:
 *   SimulatorCli --clients 10 --data-size 128
 *   SimulatorCli --suite scaling-clients --output-dir log_files
 * </pre>
 *
 * <p>Every run is verified against the plaintext sum; the process exits with status 2 when any run
 * exceeds the tolerance.
 */
public class SimulatorCli {

  static final int[] CLIENT_COUNTS = {10, 50, 100, 200, 350};
  static final int FIXED_DATA_SIZE_FOR_CLIENT_SCALING = 65536;
  static final int FIXED_CLIENT_COUNT_FOR_DATA_SCALING = 500;
  static final int[] DATA_SIZES = {4095, 8192, 16384, 32768, 50000, 65536};

  private static final String DEFAULT_OUTPUT_DIR = "log_files";

  /**
   * Main entry point.
   *
   * @param args command-line arguments
   */
  public static void main(String[] args) {
    final Options options;
    try {
      options = Options.parse(args);
    } catch (IllegalArgumentException e) {
      System.err.println("Error: " + e.getMessage());
      usage();
      System.exit(1);
      return;
    }
    if (options.help()) {
      usage();
      return;
    }

    try {
      List<ExperimentResult> results = run(options);
      boolean allVerified = results.stream().allMatch(ExperimentResult::verified);
      System.out.println();
      System.out.println(allVerified ? "All experiments verified." : "Some experiments exceeded the tolerance.");
      System.out.println("Logs written to " + options.outputDir().toAbsolutePath());
      if (!allVerified) {
        System.exit(2);
      }
    } catch (Exception e) {
      System.err.println("Error: " + e.getMessage());
      System.exit(1);
    }
  }

  /**
   * Runs the selected suite and writes the CSV logs.
   *
   * @param options the parsed options
   * @return one result per experiment
   * @throws Exception if an experiment or the logs fail
   */
  static List<ExperimentResult> run(Options options) throws Exception {
    SimulatorConfig config = SimulatorConfig.defaults()
        .withRingDimensionPolicy(new RingDimensionPolicy(options.minRingDimension()))
        .withExchangeCurve(options.curve());
    if (options.threads() != null) {
      config = config.withThreads(options.threads());
    }
    if (options.seed() != null) {
      config = config.withSeed(options.seed());
    }
    ExperimentRunner runner = new ExperimentRunner(config, new ObjectMapper());
    List<ExperimentResult> results = new ArrayList<>();
    try (CsvExperimentLog csv = new CsvExperimentLog(options.outputDir())) {
      for (Experiment experiment : experiments(options)) {
        System.out.println("--- Running " + experiment.name() + " with N=" + experiment.numClients()
            + ", d=" + experiment.dataSize() + " ---");
        ExperimentResult result = runner.run(experiment);
        csv.record(result);
        printSummary(result);
        results.add(result);
      }
    }
    return results;
  }

  static List<Experiment> experiments(Options options) {
    List<Experiment> experiments = new ArrayList<>();
    String suite = options.suite();
    if ("single".equals(suite)) {
      experiments.add(new Experiment("Single", options.clients(), options.dataSize()));
    }
    if ("scaling-clients".equals(suite) || "all".equals(suite)) {
      for (int clients : CLIENT_COUNTS) {
        experiments.add(new Experiment("ScalingClients", clients, FIXED_DATA_SIZE_FOR_CLIENT_SCALING));
      }
    }
    if ("scaling-data".equals(suite) || "all".equals(suite)) {
      for (int dataSize : DATA_SIZES) {
        experiments.add(new Experiment("ScalingDataSize", FIXED_CLIENT_COUNT_FOR_DATA_SCALING, dataSize));
      }
    }
    return experiments;
  }

  private static void printSummary(ExperimentResult result) {
    CommunicationReport c = result.communication();
    List<ClientTimings> timings = result.clientTimings();
    ClientTimings last = timings.get(timings.size() - 1);
    System.out.println("  Computation Summary (Last Client):");
    System.out.println("    - T_Encrypt: " + String.format(Locale.ROOT, "%.3f", last.encryptMs()) + " ms");
    System.out.println("    - T_MaskGen: " + String.format(Locale.ROOT, "%.3f", last.maskGenMs()) + " ms");
    System.out.println("  Communication Cost Summary:");
    System.out.println("    - Client Uplink Share Size: " + String.format(Locale.ROOT, "%.2f", c.clientUplinkBytes() / 1024.0) + " KB");
    System.out.println("    - Ciphertext Expansion Factor: " + String.format(Locale.ROOT, "%.2f", c.ciphertextExpansion()) + "x");
    System.out.println("    - Communication Expansion Factor: " + String.format(Locale.ROOT, "%.2f", c.commExpansion()) + "x");
    System.out.println("  Max error: " + result.maxError() + (result.verified() ? " (ok)" : " (EXCEEDS TOLERANCE)"));
  }

  private static void usage() {
    System.err.println("Usage: SimulatorCli [options]");
    System.err.println();
    System.err.println("  --suite <name>             single | scaling-clients | scaling-data | all (default: single)");
    System.err.println("  --clients <n>              clients for the single suite (default: 10)");
    System.err.println("  --data-size <d>            values per client for the single suite (default: 128)");
    System.err.println("  --min-ring-dimension <m>   smallest ring dimension (default: " + RingDimensionPolicy.DEFAULT_MINIMUM_RING_DIMENSION + ")");
    System.err.println("  --curve <name>             P-256 | P-384 | P-521 (default: P-384)");
    System.err.println("  --threads <t>              worker threads (default: available processors)");
    System.err.println("  --seed <s>                 seed for the client data");
    System.err.println("  --output-dir <dir>         CSV output directory (default: " + DEFAULT_OUTPUT_DIR + ")");
  }

  /**
   * Parsed command-line options.
   */
  record Options(String suite, int clients, int dataSize, int minRingDimension, ExchangeCurve curve,
                 Integer threads, Long seed, Path outputDir, boolean help) {

    private static final List<String> VALUED_OPTIONS = List.of("--suite", "--clients", "--data-size",
        "--min-ring-dimension", "--curve", "--threads", "--seed", "--output-dir");

    static Options parse(String[] args) {
      String suite = "single";
      int clients = 10;
      int dataSize = 128;
      int minRingDimension = RingDimensionPolicy.DEFAULT_MINIMUM_RING_DIMENSION;
      ExchangeCurve curve = ExchangeCurve.DEFAULT;
      Integer threads = null;
      Long seed = null;
      Path outputDir = Path.of(DEFAULT_OUTPUT_DIR);
      boolean help = false;

      for (int i = 0; i < args.length; i++) {
        String arg = args[i];
        if ("--help".equals(arg) || "-h".equals(arg)) {
          help = true;
        } else if (!VALUED_OPTIONS.contains(arg)) {
          throw new IllegalArgumentException("Unknown option: " + arg);
        } else if (i + 1 >= args.length) {
          throw new IllegalArgumentException("Missing value for " + arg);
        } else if ("--suite".equals(arg)) {
          suite = args[++i];
        } else if ("--clients".equals(arg)) {
          clients = parseInt(arg, args[++i]);
        } else if ("--data-size".equals(arg)) {
          dataSize = parseInt(arg, args[++i]);
        } else if ("--min-ring-dimension".equals(arg)) {
          minRingDimension = parseInt(arg, args[++i]);
        } else if ("--curve".equals(arg)) {
          curve = ExchangeCurve.fromName(args[++i]);
        } else if ("--threads".equals(arg)) {
          threads = parseInt(arg, args[++i]);
        } else if ("--seed".equals(arg)) {
          String value = args[++i];
          try {
            seed = Long.parseLong(value);
          } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid number for --seed: " + value, e);
          }
        } else {
          outputDir = Path.of(args[++i]);
        }
      }
      if (!List.of("single", "scaling-clients", "scaling-data", "all").contains(suite)) {
        throw new IllegalArgumentException("Unknown suite: " + suite);
      }
      return new Options(suite, clients, dataSize, minRingDimension, curve, threads, seed, outputDir, help);
    }

    private static int parseInt(String option, String value) {
      try {
        return Integer.parseInt(value);
      } catch (NumberFormatException e) {
        throw new IllegalArgumentException("Invalid number for " + option + ": " + value, e);
      }
    }
  }
}
