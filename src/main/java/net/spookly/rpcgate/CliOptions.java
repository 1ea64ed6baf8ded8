package net.spookly.rpcgate;

/**
 * Parsed command line: {@code rpcgate [--config|-c <path>] [<path>] [--dry-run] [--print-effective-config]}.
 */
public record CliOptions(String configPath, boolean dryRun, boolean printEffectiveConfig) {
    public static final String DEFAULT_CONFIG = "rpcgate.yaml";

    public static CliOptions parse(String[] args) {
        String configPath = null;
        boolean dryRun = false;
        boolean printEffectiveConfig = false;
        if (args == null) {
            return new CliOptions(DEFAULT_CONFIG, false, false);
        }
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if ("--config".equals(arg) || "-c".equals(arg)) {
                if (i + 1 >= args.length) {
                    throw new IllegalArgumentException(arg + " requires a path");
                }
                configPath = args[++i];
                continue;
            }
            if ("--dry-run".equals(arg)) {
                dryRun = true;
                continue;
            }
            if ("--print-effective-config".equals(arg)) {
                printEffectiveConfig = true;
                continue;
            }
            if (arg.startsWith("-")) {
                throw new IllegalArgumentException("unknown option: " + arg);
            }
            if (configPath != null) {
                throw new IllegalArgumentException("only one config path may be given, got " + configPath + " and " + arg);
            }
            configPath = arg;
        }
        return new CliOptions(configPath == null ? DEFAULT_CONFIG : configPath, dryRun, printEffectiveConfig);
    }
}
