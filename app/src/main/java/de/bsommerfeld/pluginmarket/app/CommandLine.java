package de.bsommerfeld.pluginmarket.app;

import de.bsommerfeld.pluginmarket.core.mode.ModeProfile;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Parsed arguments of {@link MarketMain}.
 *
 * <pre>
 * [--hpm | --edgeless | --select] [--root &lt;dir&gt;] &lt;command&gt; [args...]
 * </pre>
 *
 * @param mode      selected ecosystem, Cloud-PE when no mode flag is given
 * @param bootRoot  explicit boot root, {@code null} to use the configured one
 * @param command   command name, lower-case
 * @param arguments remaining positional arguments
 */
public record CommandLine(ModeProfile mode, Path bootRoot, String command, List<String> arguments) {

    public static final String USAGE = String.join(System.lineSeparator(),
            "Usage: market [--hpm|--edgeless|--select] [--root <dir>] <command> [args]",
            "",
            "Commands:",
            "  categories                       list catalog categories",
            "  list [category]                  list plugins of a category",
            "  search <keyword>                 search the catalog",
            "  installed                        list local plugins",
            "  status <name> <author>           show install state of a plugin",
            "  install <name> <author>          install a plugin",
            "  update <name> <author>           update an installed plugin",
            "  enable <file>                    enable a local plugin",
            "  disable <file>                   disable a local plugin",
            "  delete <file>                    delete a local plugin",
            "  download <name> <author> [dir]   download a plugin to a directory",
            "",
            "With --select the command is ignored and all sources are checked.");

    public CommandLine {
        arguments = List.copyOf(arguments);
    }

    /**
     * @throws IllegalArgumentException on unknown options or a missing
     *                                  command
     */
    public static CommandLine parse(String... args) {
        ModeProfile mode = ModeProfile.CLOUD_PE;
        Path root = null;
        String command = null;
        List<String> positional = new ArrayList<>();

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if (command == null && arg.startsWith("--")) {
                if ("--root".equals(arg)) {
                    if (i + 1 >= args.length) {
                        throw new IllegalArgumentException("--root needs a directory");
                    }
                    root = Paths.get(args[++i]);
                } else if (ModeProfile.fromFlag(arg).flag().equals(arg)) {
                    mode = ModeProfile.fromFlag(arg);
                } else {
                    throw new IllegalArgumentException("Unknown option " + arg);
                }
            } else if (command == null) {
                command = arg.toLowerCase(Locale.ROOT);
            } else {
                positional.add(arg);
            }
        }

        if (command == null) {
            if (mode.isSelector()) {
                return new CommandLine(mode, root, "select", positional);
            }
            throw new IllegalArgumentException("No command given");
        }
        return new CommandLine(mode, root, command, positional);
    }

    public Optional<Path> explicitBootRoot() {
        return Optional.ofNullable(bootRoot);
    }

    /** Positional argument at {@code index}, or a usage error if missing. */
    public String argument(int index, String name) {
        if (index >= arguments.size()) {
            throw new IllegalArgumentException(command + " needs <" + name + ">");
        }
        return arguments.get(index);
    }

    public Optional<String> optionalArgument(int index) {
        return index < arguments.size() ? Optional.of(arguments.get(index)) : Optional.empty();
    }
}
