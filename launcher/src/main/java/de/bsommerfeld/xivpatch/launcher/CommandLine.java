package de.bsommerfeld.xivpatch.launcher;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Parsed arguments of {@code xivpatch [--check-only] [--yes] [game-root]}.
 *
 * @param checkOnly  print the plan without applying it
 * @param assumeYes  apply without asking for confirmation
 * @param help       print usage and exit
 * @param gameRoot   installation root; detected when absent
 */
record CommandLine(boolean checkOnly, boolean assumeYes, boolean help, Optional<Path> gameRoot) {

    static final String USAGE = String.join(System.lineSeparator(),
            "Usage: xivpatch [--check-only] [--yes] [game-root]",
            "",
            "  --check-only  list the patches the installation needs and exit",
            "  -y, --yes     apply updates without asking",
            "  -h, --help    show this help",
            "",
            "Without game-root the configured install paths are searched.");

    /**
     * @throws IllegalArgumentException on unknown options or more than one root
     */
    static CommandLine parse(String... args) {
        boolean checkOnly = false;
        boolean assumeYes = false;
        boolean help = false;
        Path root = null;

        for (String arg : args) {
            switch (arg) {
                case "--check-only" -> checkOnly = true;
                case "-y", "--yes" -> assumeYes = true;
                case "-h", "--help" -> help = true;
                default -> {
                    if (arg.startsWith("-")) {
                        throw new IllegalArgumentException("Unknown option: " + arg);
                    }
                    if (root != null) {
                        throw new IllegalArgumentException("More than one game root given: " + arg);
                    }
                    root = Path.of(arg);
                }
            }
        }
        return new CommandLine(checkOnly, assumeYes, help, Optional.ofNullable(root));
    }
}
