package imelatticecli;

import imelattice.DictionaryLookup;
import imelattice.Lattice;
import imelattice.LatticeSnapshot;
import imelattice.ReadingDictionary;
import picocli.CommandLine.*;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.concurrent.Callable;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Subcommand that builds the lattice for one key and prints it as JSON.
 */
@Command(name = "build", description = "\033[1;34mBuild a lattice for a reading and dump it as JSON\033[0m", mixinStandardHelpOptions = true)
public class BuildCommand implements Callable<Integer> {
    @Option(names = {"-d", "--dict"}, paramLabel = "<file>", description = "Reading dictionary (.txt or .json)", required = true)
    private File dict;

    @Option(names = {"-k", "--key"}, paramLabel = "<reading>", description = "Reading to build the lattice for", required = true)
    private String key;

    @Option(names = {"-o", "--output"}, paramLabel = "<file>", description = "Output file (default: stdout)")
    private File output;

    @Option(names = {"--unknown-cost"}, paramLabel = "<cost>", defaultValue = "" + DictionaryLookup.DEFAULT_UNKNOWN_COST,
            description = "Word cost of unknown-word nodes (default: ${DEFAULT-VALUE})")
    private int unknownCost;

    @Option(names = {"--compact"}, description = "Print compact JSON instead of indented")
    private boolean compact;

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose logging")
    private boolean verbose;

    private static final Logger LOGGER = Logger.getLogger(BuildCommand.class.getName());
    private static final String BLUE = "\033[1;34m";
    private static final String RESET = "\033[0m";

    @Override
    public Integer call() {
        try {
            if (verbose) {
                Lattice.setVerboseLogging(true);
                DictionaryLookup.setVerboseLogging(true);
            }

            ReadingDictionary dictionary = ReadingDictionary.load(dict.toPath());
            Lattice lattice = new Lattice();
            int inserted = new DictionaryLookup(dictionary, unknownCost).fill(lattice, key);

            LatticeSnapshot snapshot = LatticeSnapshot.of(lattice);
            String json = compact ? snapshot.toJson() : snapshot.toPrettyJson();
            lattice.clear();

            if (output != null) {
                Files.writeString(output.toPath(), json, StandardCharsets.UTF_8);
            } else {
                System.out.println(json);
            }

            if (System.console() != null) {
                String outTo = (output != null) ? output.getPath() : "stdout";
                System.err.println(BLUE + "Lattice built (" + inserted + " nodes): " + key + " → " + outTo + RESET);
            }
            return 0;
        } catch (Exception e) {
            LOGGER.log(Level.SEVERE, "Error while building lattice", e);
            System.err.println("❌ Exception occurred: " + e.getMessage());
            return 1;
        }
    }
}
