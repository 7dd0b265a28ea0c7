package io.certmanifest.cli;

import io.certmanifest.CertManifest;
import io.certmanifest.config.ConfigLoader;
import io.certmanifest.config.GeneratorConfig;
import io.certmanifest.config.StatePolicy;
import io.certmanifest.exception.CertManifestException;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.io.PrintWriter;
import java.util.HashMap;
import java.util.Map;

/**
 * Command line front end.
 *
 * <pre>
 * certmanifest [-d DIR] [-s FILE] [-c FILE] [--retain-state] [MANIFEST]
 * </pre>
 *
 * Settings from the config file are overridden by {@code CERTMANIFEST_*} environment
 * variables, which are overridden by command line flags.
 */
public class CertManifestCli {

    private static final Logger logger = LoggerFactory.getLogger(CertManifestCli.class);

    static final int EXIT_OK = 0;
    static final int EXIT_ERROR = 1;
    static final int EXIT_USAGE = 2;

    private static final String USAGE = "certmanifest [options] [MANIFEST]";

    private final ConfigLoader configLoader;
    private final CertManifest certManifest;
    private final boolean loadEnvironment;
    private final PrintStream out;
    private final PrintStream err;

    public CertManifestCli() {
        this(new ConfigLoader(), new CertManifest(), true, System.out, System.err);
    }

    CertManifestCli(ConfigLoader configLoader, CertManifest certManifest, boolean loadEnvironment,
                    PrintStream out, PrintStream err) {
        this.configLoader = configLoader;
        this.certManifest = certManifest;
        this.loadEnvironment = loadEnvironment;
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        System.exit(new CertManifestCli().run(args));
    }

    static Options options() {
        Options options = new Options();
        options.addOption(Option.builder("d").longOpt("destination").hasArg().argName("DIR")
            .desc("directory the certificates are written to (default: current directory)").build());
        options.addOption(Option.builder("s").longOpt("state").hasArg().argName("FILE")
            .desc("state file (default: state.json in the destination directory)").build());
        options.addOption(Option.builder("c").longOpt("config").hasArg().argName("FILE")
            .desc("JSON configuration file").build());
        options.addOption(Option.builder().longOpt("retain-state")
            .desc("keep state entries of certificates removed from the manifest").build());
        options.addOption(Option.builder("h").longOpt("help").desc("print this help").build());
        return options;
    }

    /**
     * Parse arguments and run the generator.
     *
     * @param args command line arguments
     * @return process exit code
     */
    public int run(String[] args) {
        Options options = options();
        CommandLine cli;
        try {
            cli = new DefaultParser().parse(options, args);
        } catch (ParseException e) {
            err.println("Error: " + e.getMessage());
            printUsage(err, options);
            return EXIT_USAGE;
        }

        if (cli.hasOption("h")) {
            printUsage(out, options);
            return EXIT_OK;
        }
        String[] positional = cli.getArgs();
        if (positional.length > 1) {
            err.println("Error: expected at most one manifest, got " + positional.length);
            printUsage(err, options);
            return EXIT_USAGE;
        }

        Map<String, Object> overrides = new HashMap<>();
        if (positional.length == 1) {
            overrides.put("manifestPath", positional[0]);
        }
        if (cli.hasOption("d")) {
            overrides.put("destinationDir", cli.getOptionValue("d"));
        }
        if (cli.hasOption("s")) {
            overrides.put("stateFile", cli.getOptionValue("s"));
        }
        if (cli.hasOption("retain-state")) {
            overrides.put("statePolicy", StatePolicy.RETAIN);
        }

        try {
            GeneratorConfig config = configLoader.load(cli.getOptionValue("c"), loadEnvironment, overrides);
            logger.debug("Running with {}", config);
            certManifest.run(config);
            return EXIT_OK;
        } catch (CertManifestException e) {
            logger.debug("Generation failed", e);
            err.println("Error [" + e.getCode() + "]: " + e.getMessage());
            return EXIT_ERROR;
        }
    }

    private static void printUsage(PrintStream stream, Options options) {
        PrintWriter writer = new PrintWriter(stream);
        new HelpFormatter().printHelp(writer, HelpFormatter.DEFAULT_WIDTH, USAGE, null, options,
            HelpFormatter.DEFAULT_LEFT_PAD, HelpFormatter.DEFAULT_DESC_PAD, null);
        writer.flush();
    }
}
