package com.rapid.analyzer;

import com.rapid.analyzer.core.AnalysisOrchestrator;
import com.rapid.analyzer.core.AnalysisResult;
import com.rapid.analyzer.core.AnalyzerConfig;
import com.rapid.analyzer.naming.CachingWordOracle;
import com.rapid.analyzer.naming.LexicalOracleException;
import com.rapid.analyzer.naming.WordNetOracle;
import com.rapid.analyzer.naming.WordOracle;
import com.rapid.analyzer.report.CallTreeRenderer;
import com.rapid.analyzer.report.ConsoleReporter;
import com.rapid.analyzer.report.CsvReporter;
import com.rapid.analyzer.report.WaitTimeReporter;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Scanner;
import java.util.function.Supplier;

/**
 * RAPID Code Analyzer - complexity, reachability and naming scores for ABB RAPID programs.
 *
 * Usage: rapid-analyzer [folder] [--include-nostepin] [--first-variant-only]
 * [--config file] [--csv file] [--call-tree] [--waittimes] [--unreachable] [--summary-tsv]
 */
public class App {

    static final int EXIT_OK = 0;
    static final int EXIT_USAGE = 1;
    static final int EXIT_DICTIONARY = 2;

    public static void main(String[] args) {
        System.exit(run(args));
    }

    static int run(String[] args) {
        return run(args, WordNetOracle::load);
    }

    static int run(String[] args, Supplier<WordOracle> dictionaryLoader) {
        System.out.println("=== RAPID Code Analyzer ===");

        CliArgs cliArgs = parseArgs(args);
        if (cliArgs == null) {
            printUsage();
            return EXIT_USAGE;
        }

        Path folder = cliArgs.folder() != null ? cliArgs.folder() : promptForFolder();
        if (!Files.isDirectory(folder)) {
            System.err.println("Error: '" + folder + "' is not a valid directory.");
            return EXIT_USAGE;
        }

        AnalyzerConfig config;
        try {
            config = cliArgs.configFile() != null
                    ? AnalyzerConfig.loadFile(cliArgs.configFile())
                    : AnalyzerConfig.load(folder);
        } catch (IOException e) {
            System.err.println("Error: cannot read config file " + cliArgs.configFile() + ": " + e.getMessage());
            return EXIT_USAGE;
        }
        if (cliArgs.includeNoStepIn()) {
            config.withExcludeNoStepInModules(false);
        }
        if (cliArgs.firstVariantOnly()) {
            config.withDynamicDispatchMode(AnalyzerConfig.DynamicDispatchMode.FIRST_VARIANT);
        }

        // The dictionary must load before any file is scanned
        CachingWordOracle oracle;
        try {
            oracle = new CachingWordOracle(dictionaryLoader.get());
        } catch (LexicalOracleException e) {
            System.err.println("Error: " + e.getMessage());
            return EXIT_DICTIONARY;
        }

        try {
            AnalysisResult result = new AnalysisOrchestrator(config, oracle).analyze(folder);
            report(result, cliArgs);
            return EXIT_OK;
        } catch (IOException e) {
            System.err.println("Error: " + e.getMessage());
            return EXIT_USAGE;
        }
    }

    private static void report(AnalysisResult result, CliArgs cliArgs) throws IOException {
        ConsoleReporter console = new ConsoleReporter(System.out);
        console.print(result);

        if (cliArgs.showUnreachable()) {
            console.printUnreachableCode(result);
        }
        if (cliArgs.showCallTree()) {
            System.out.println();
            System.out.println(new CallTreeRenderer().render(result.callGraph()));
        }
        if (cliArgs.showWaitTimes()) {
            System.out.println("\n=== WAITTIME CALLS ===");
            System.out.print(new WaitTimeReporter().render(result.files()));
        }
        if (cliArgs.showSummaryTsv()) {
            System.out.println("\n=== SUMMARY (tab-separated) ===");
            System.out.print(console.summaryTsv(result));
        }
        if (cliArgs.csvFile() != null) {
            new CsvReporter().generate(result.files(), cliArgs.csvFile());
        }
    }

    private static void printUsage() {
        System.err.println("""
                Usage: rapid-analyzer [folder] [options]

                Arguments:
                  folder                 Folder containing RAPID files (.mod, .prg, .sys, .cfg);
                                         prompted for when omitted
                  --include-nostepin     Include modules marked NOSTEPIN in the analysis
                  --first-variant-only   Resolve each CallByVar prefix to a single procedure
                  --config <file>        YAML configuration (default: <folder>/rapid-analyzer.yaml)
                  --csv <file>           Also write the per-file results as CSV
                  --call-tree            Print the call tree from MAIN
                  --waittimes            List WaitTime calls with surrounding lines
                  --unreachable          Print the code of unreachable procedures
                  --summary-tsv          Print a tab-separated project summary for spreadsheets
                """);
    }

    record CliArgs(
            Path folder,
            boolean includeNoStepIn,
            boolean firstVariantOnly,
            Path configFile,
            Path csvFile,
            boolean showCallTree,
            boolean showWaitTimes,
            boolean showUnreachable,
            boolean showSummaryTsv) {
    }

    static CliArgs parseArgs(String[] args) {
        Path folder = null;
        boolean includeNoStepIn = false;
        boolean firstVariantOnly = false;
        Path configFile = null;
        Path csvFile = null;
        boolean showCallTree = false;
        boolean showWaitTimes = false;
        boolean showUnreachable = false;
        boolean showSummaryTsv = false;

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--include-nostepin" -> includeNoStepIn = true;
                case "--first-variant-only" -> firstVariantOnly = true;
                case "--config" -> {
                    if (i + 1 >= args.length)
                        return null;
                    configFile = Path.of(args[++i]);
                }
                case "--csv" -> {
                    if (i + 1 >= args.length)
                        return null;
                    csvFile = Path.of(args[++i]);
                }
                case "--call-tree" -> showCallTree = true;
                case "--waittimes" -> showWaitTimes = true;
                case "--unreachable" -> showUnreachable = true;
                case "--summary-tsv" -> showSummaryTsv = true;
                case "-h", "--help" -> {
                    return null;
                }
                default -> {
                    if (args[i].startsWith("--") || folder != null)
                        return null;
                    folder = Path.of(args[i]);
                }
            }
        }

        return new CliArgs(folder, includeNoStepIn, firstVariantOnly, configFile, csvFile,
                showCallTree, showWaitTimes, showUnreachable, showSummaryTsv);
    }

    private static Path promptForFolder() {
        System.out.print("Enter folder path containing RAPID files: ");
        Scanner in = new Scanner(System.in);
        String input = in.hasNextLine() ? in.nextLine().strip() : "";
        return input.isEmpty() ? Path.of(".") : Path.of(input);
    }
}
