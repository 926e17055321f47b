package imelatticecli;

import imelattice.ReadingDictionary;
import picocli.CommandLine.*;

import java.io.File;
import java.nio.file.Paths;
import java.util.concurrent.Callable;
import java.util.logging.Level;
import java.util.logging.Logger;

@Command(name = "dictgen", description = "\033[1;34mCompile a text reading dictionary\033[0m", mixinStandardHelpOptions = true)
public class DictgenCommand implements Callable<Integer> {

    @Option(names = {"-i", "--input"}, paramLabel = "<file>", description = "Tab-separated reading dictionary", required = true)
    private File input;

    @Option(names = {"-f", "--format"}, description = "Dictionary format: [json]", defaultValue = "json")
    private String format;

    @Option(names = {"-o", "--output"}, paramLabel = "<filename>", description = "Output filename")
    private String output;

    private static final Logger LOGGER = Logger.getLogger(DictgenCommand.class.getName());
    private static final String BLUE = "\033[1;34m";
    private static final String RESET = "\033[0m";

    @Override
    public Integer call() {
        try {
            String defaultOutput = "json".equals(format) ? "reading_dictionary.json" : null;
            if (defaultOutput == null) {
                LOGGER.severe("Unsupported format: " + format);
                return 1;
            }

            String outputFile = (output != null) ? output : defaultOutput;
            File outputPath = Paths.get(outputFile).toAbsolutePath().toFile();

            ReadingDictionary dictionary = ReadingDictionary.fromText(input.toPath());
            dictionary.serializeToJson(outputPath.getAbsolutePath());
            System.out.println(BLUE + "Dictionary (" + dictionary.size() + " readings) saved in JSON format at: "
                    + outputPath + RESET);
            return 0;
        } catch (Exception e) {
            LOGGER.log(Level.SEVERE, "Exception during dictionary generation", e);
            return 1;
        }
    }
}
