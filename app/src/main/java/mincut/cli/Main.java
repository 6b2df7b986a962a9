package mincut.cli;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.NoSuchFileException;
import java.util.Locale;
import mincut.io.GraphFormatException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command line entry point.
 *
 * <p>Usage:
 *
 * <ul>
 *   <li>{@code mincut <graph.col>} runs Karger and Karger-Stein on the file
 *   <li>{@code mincut run [--file <graph.col> | --example <name>] [options]}
 *   <li>{@code mincut batch --graphs <dir> [--json-dir <dir>] [options]}
 *   <li>{@code mincut generate --out <graph.col> [--cluster-size k] [--density p] [--crossing c]}
 * </ul>
 */
public final class Main {
  private static final Logger LOG = LoggerFactory.getLogger(Main.class);

  static final int EXIT_INPUT_NOT_FOUND = 2;
  static final int EXIT_MALFORMED_INPUT = 3;
  static final int EXIT_USAGE = 64;

  private Main() {}

  public static void main(String[] args) {
    int exit = run(args, System.out, System.err);
    if (exit != 0) {
      System.exit(exit);
    }
  }

  static int run(String[] args, PrintStream out, PrintStream err) {
    if (args == null || args.length == 0) {
      printUsage(err);
      return EXIT_USAGE;
    }
    try {
      return switch (args[0].toLowerCase(Locale.ROOT)) {
        case "batch" -> new BatchCommand(out).execute(args);
        case "generate" -> new GenerateCommand(out).execute(args);
        case "help", "--help", "-h" -> {
          printUsage(out);
          yield 0;
        }
        default -> new RunCommand(out).execute(args);
      };
    } catch (NoSuchFileException ex) {
      LOG.error("Input not found: {}", ex.getFile());
      err.println("error: input not found: " + ex.getFile());
      return EXIT_INPUT_NOT_FOUND;
    } catch (GraphFormatException ex) {
      LOG.error("Malformed input: {}", ex.getMessage());
      err.println("error: malformed input: " + ex.getMessage());
      return EXIT_MALFORMED_INPUT;
    } catch (IOException ex) {
      LOG.error("Could not read input: {}", ex.getMessage(), ex);
      err.println("error: could not read input: " + ex.getMessage());
      return EXIT_INPUT_NOT_FOUND;
    } catch (IllegalArgumentException ex) {
      err.println("error: " + ex.getMessage());
      printUsage(err);
      return EXIT_USAGE;
    }
  }

  private static void printUsage(PrintStream stream) {
    stream.println("Usage: mincut <graph.col>");
    stream.println("       mincut run [--file <graph.col> | --example <name>] [options]");
    stream.println("       mincut batch --graphs <dir|file> [--json-dir <dir>] [options]");
    stream.println(
        "       mincut generate --out <graph.col> [--cluster-size k] [--density p]"
            + " [--crossing c] [--seed s]");
    stream.println("Options:");
    stream.println("  --algorithms karger,karger-stein   algorithms to run (default: both)");
    stream.println("  --repeat <n>                       trials per algorithm");
    stream.println("  --seed <long>                      base seed for reproducible runs");
    stream.println("  --parallelism <n>                  worker threads (default: 1)");
    stream.println("  --time-budget-ms <ms>              stop starting new trials after this long");
    stream.println("  --partitions                       print both sides of each best cut");
    stream.println("  --json <file>                      write a JSON report (run only)");
  }
}
