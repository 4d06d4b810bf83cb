package com.stationpath.analysis;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;

import java.io.PrintStream;
import java.io.PrintWriter;
import java.util.List;

/** Options and positional arguments of the command line planner. */
class PlannerCommandLine {

    private static final boolean OPTION_UNKNOWN_THEN_FAIL = false;

    static final String SYNTAX = "plan ORIGIN_STOP_ID DESTINATION_STOP_ID | import FEED.zip";

    private static final String CONFIG_OPT = "c";
    private static final String JSON_OPT = "j";
    private static final String HELP_OPT = "h";

    private final CommandLine cmd;

    PlannerCommandLine (String... args) throws ParseException {
        cmd = new DefaultParser().parse(options(), args, OPTION_UNKNOWN_THEN_FAIL);
    }

    static Options options () {
        Options options = new Options();
        options.addOption(CONFIG_OPT, "config", true, "Configuration properties file. (Default: "
                + PlannerConfig.PLANNER_CONFIG_FILE + ")");
        options.addOption(JSON_OPT, "json", false, "Print the route search outcome as JSON.");
        options.addOption(HELP_OPT, "help", false, "Print all command line options, then exit.");
        return options;
    }

    String configFile () {
        return cmd.getOptionValue(CONFIG_OPT, PlannerConfig.PLANNER_CONFIG_FILE);
    }

    boolean json () {
        return cmd.hasOption(JSON_OPT);
    }

    boolean help () {
        return cmd.hasOption(HELP_OPT);
    }

    /** The command followed by its arguments. */
    List<String> arguments () {
        return cmd.getArgList();
    }

    static void printHelp (PrintStream out) {
        PrintWriter writer = new PrintWriter(out);
        HelpFormatter formatter = new HelpFormatter();
        formatter.printHelp(writer, 100, SYNTAX, null, options(), formatter.getLeftPadding(),
                formatter.getDescPadding(), null);
        writer.flush();
    }

}
