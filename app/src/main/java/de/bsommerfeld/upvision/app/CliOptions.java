package de.bsommerfeld.upvision.app;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Parsed command line.
 *
 * <pre>
 * upvision [options] &lt;image|folder&gt;...
 *   -o, --out &lt;dir&gt;          output directory (default: next to the first input)
 *   -c, --checkpoint &lt;name&gt;  checkpoint name (default: first discovered)
 *   -d, --device &lt;device&gt;    cpu | cuda | gpu | auto (default: from config)
 *       --config &lt;file&gt;      configuration file
 *       --env-check          print the runtime environment and exit
 *       --list               list discovered checkpoints and exit
 *       --results &lt;dir&gt;     pair enhanced images in dir with their originals
 *       --skip-self-check    do not run the first-run self-check
 *   -h, --help               show this help
 * </pre>
 */
public final class CliOptions {

    static final String USAGE = String.join(System.lineSeparator(),
            "Usage: upvision [options] <image|folder>...",
            "  -o, --out <dir>          output directory (default: next to the first input)",
            "  -c, --checkpoint <name>  checkpoint name (default: first discovered)",
            "  -d, --device <device>    cpu | cuda | gpu | auto (default: from config)",
            "      --config <file>      configuration file",
            "      --env-check          print the runtime environment and exit",
            "      --list               list discovered checkpoints and exit",
            "      --results <dir>      pair enhanced images in dir with their originals",
            "      --skip-self-check    do not run the first-run self-check",
            "  -h, --help               show this help");

    private final List<Path> inputs = new ArrayList<>();
    private Path output;
    private String checkpoint;
    private String device;
    private Path configFile;
    private Path resultsDirectory;
    private boolean envCheck;
    private boolean listCheckpoints;
    private boolean skipSelfCheck;
    private boolean help;

    private CliOptions() {
    }

    /**
     * @throws IllegalArgumentException on unknown options or missing values
     */
    public static CliOptions parse(String... args) {
        CliOptions options = new CliOptions();
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "-o":
                case "--out":
                    options.output = Path.of(valueOf(args, ++i, arg));
                    break;
                case "-c":
                case "--checkpoint":
                    options.checkpoint = valueOf(args, ++i, arg);
                    break;
                case "-d":
                case "--device":
                    options.device = valueOf(args, ++i, arg);
                    break;
                case "--config":
                    options.configFile = Path.of(valueOf(args, ++i, arg));
                    break;
                case "--results":
                    options.resultsDirectory = Path.of(valueOf(args, ++i, arg));
                    break;
                case "--env-check":
                    options.envCheck = true;
                    break;
                case "--list":
                    options.listCheckpoints = true;
                    break;
                case "--skip-self-check":
                    options.skipSelfCheck = true;
                    break;
                case "-h":
                case "--help":
                    options.help = true;
                    break;
                default:
                    if (arg.startsWith("-")) {
                        throw new IllegalArgumentException("Unknown option: " + arg);
                    }
                    options.inputs.add(Path.of(arg));
            }
        }
        return options;
    }

    private static String valueOf(String[] args, int index, String option) {
        if (index >= args.length || args[index].startsWith("-")) {
            throw new IllegalArgumentException("Missing value for " + option);
        }
        return args[index];
    }

    public List<Path> inputs() {
        return Collections.unmodifiableList(inputs);
    }

    public Path output() {
        return output;
    }

    public String checkpoint() {
        return checkpoint;
    }

    public String device() {
        return device;
    }

    public Path configFile() {
        return configFile;
    }

    public Path resultsDirectory() {
        return resultsDirectory;
    }

    public boolean envCheck() {
        return envCheck;
    }

    public boolean listCheckpoints() {
        return listCheckpoints;
    }

    public boolean skipSelfCheck() {
        return skipSelfCheck;
    }

    public boolean help() {
        return help;
    }
}
