package com.harvester.core.crawl;

import com.harvester.core.config.ConfigManager;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses command line arguments into a {@link RunRequest}.
 */
public class RunRequestParser {

    public static final String USAGE = """
            Usage: harvester [options] <entries...>
              entries: @usernames, channel names, t.me/c/<channel>/<post> links,
                       telegra.ph / graph.org links, or 'all' for every channel and group.
                       Separate with spaces or commas.
            Options:
              --config <file>         configuration file (default config/harvester.json)
              --dir <folder>          save directory (overrides downloadPath)
              --full                  walk the entire history of every channel
              --latest                only the newest message with links per channel
              --import-ledger <file>  import a legacy list of processed links first
            Examples:
              harvester https://telegra.ph/Example-01-01
              harvester --full @somechannel,@otherchannel
              harvester all""";

    /**
     * @throws IllegalArgumentException if the arguments are invalid
     */
    public static RunRequest parse(String[] args) throws IllegalArgumentException {
        List<String> entries = new ArrayList<>();
        Boolean fullCrawl = null;
        String downloadDir = null;
        String configFile = ConfigManager.DEFAULT_CONFIG_FILE;
        String importLedger = null;

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "--config" -> configFile = valueOf(args, ++i, arg);
                case "--dir" -> downloadDir = valueOf(args, ++i, arg);
                case "--import-ledger" -> importLedger = valueOf(args, ++i, arg);
                case "--full" -> fullCrawl = requireUnset(fullCrawl, Boolean.TRUE);
                case "--latest" -> fullCrawl = requireUnset(fullCrawl, Boolean.FALSE);
                case "-h", "--help" -> throw new IllegalArgumentException(USAGE);
                default -> {
                    if (arg.startsWith("--")) {
                        throw new IllegalArgumentException("Unknown option: " + arg + "\n" + USAGE);
                    }
                    for (String part : arg.split(",")) {
                        String entry = part.trim();
                        if (!entry.isEmpty()) entries.add(entry);
                    }
                }
            }
        }

        if (entries.isEmpty() && importLedger == null) {
            throw new IllegalArgumentException("No entries given.\n" + USAGE);
        }
        if (entries.size() > 1 && entries.stream().anyMatch(e -> e.equalsIgnoreCase("all"))) {
            throw new IllegalArgumentException("'all' cannot be combined with other entries");
        }

        return new RunRequest(List.copyOf(entries), fullCrawl, downloadDir, configFile, importLedger);
    }

    private static String valueOf(String[] args, int index, String option) {
        if (index >= args.length || args[index].startsWith("--")) {
            throw new IllegalArgumentException("Missing value for " + option);
        }
        return args[index];
    }

    private static Boolean requireUnset(Boolean current, Boolean value) {
        if (current != null && !current.equals(value)) {
            throw new IllegalArgumentException("--full and --latest are mutually exclusive");
        }
        return value;
    }
}
