package imelatticecli;

import picocli.CommandLine;
import picocli.CommandLine.Command;

@Command(
        name = "imelatticecli",
        mixinStandardHelpOptions = true,
        version = "1.0.0",
        description = "\033[1;34mConversion lattice tools: build and inspect lattices, compile dictionaries\033[0m",
        subcommands = {
                BuildCommand.class,
                DictgenCommand.class
        }
)
public class Main implements Runnable {

    @Override
    public void run() {
        // Called when no subcommand is provided
        System.out.println("Use --help or a subcommand (build / dictgen)");
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }
}
