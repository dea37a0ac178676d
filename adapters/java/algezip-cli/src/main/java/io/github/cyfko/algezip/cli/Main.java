package io.github.cyfko.algezip.cli;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.util.logging.LogManager;

/**
 * Command line entry point.
 *
 * @author AlgeZip contributors
 * @since 1.0
 */
public final class Main {

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    private Main() {}

    public static void main(String[] args) {
        configureLogging();
        int status = run(args, System.in, System.out, System.err);
        if (status != EXIT_OK) {
            System.exit(status);
        }
    }

    static int run(String[] args, InputStream in, PrintStream out, PrintStream err) {
        for (String arg : args) {
            if (arg.equals("-h") || arg.equals("--help")) {
                HelpText.printUsage(out);
                return EXIT_OK;
            }
        }
        if (args.length > 0) {
            err.println(HelpText.USAGE);
            err.println("algezip: error: unrecognized arguments: " + String.join(" ", args));
            return EXIT_USAGE;
        }

        try {
            new AlgeZipShell(in, out).run();
            return EXIT_OK;
        } catch (IOException e) {
            err.println("algezip: error: failed to read input: " + e.getMessage());
            return EXIT_FAILURE;
        }
    }

    // An explicit -Djava.util.logging.config.file wins over the bundled configuration.
    private static void configureLogging() {
        if (System.getProperty("java.util.logging.config.file") != null) {
            return;
        }
        try (InputStream config = Main.class.getResourceAsStream("/logging.properties")) {
            if (config != null) {
                LogManager.getLogManager().readConfiguration(config);
            }
        } catch (IOException e) {
            System.err.println("algezip: warning: could not load logging configuration: " + e.getMessage());
        }
    }
}
