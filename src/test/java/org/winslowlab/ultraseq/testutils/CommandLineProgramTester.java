package org.winslowlab.ultraseq.testutils;

import htsjdk.samtools.util.Log;
import org.winslowlab.ultraseq.Main;
import org.winslowlab.ultraseq.cmdline.StandardArgumentDefinitions;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Utility interface for CommandLine Program testing.
 */
public interface CommandLineProgramTester {

    /**
     * Returns the name for the tested tool.
     */
    String getTestedToolName();

    /**
     * Builds the arguments for calling the tested tool through Main: "toolname args", with a default verbosity.
     */
    default String[] makeCommandLineArgs(final List<String> args, final String toolname) {
        final List<String> curatedArgs = injectDefaultVerbosity(args);
        final String[] commandLineArgs = new String[curatedArgs.size() + 1];
        commandLineArgs[0] = toolname;
        int i = 1;
        for (final String arg : curatedArgs) {
            commandLineArgs[i++] = arg;
        }
        return commandLineArgs;
    }

    /**
     * Look for the --verbosity argument; if not found, supply a value that minimizes the amount of logging output.
     */
    default List<String> injectDefaultVerbosity(final List<String> args) {
        for (String arg : args) {
            if (arg.equalsIgnoreCase("--" + StandardArgumentDefinitions.VERBOSITY_NAME)) {
                return args;
            }
        }
        final List<String> argsWithVerbosity = new ArrayList<>(args);
        argsWithVerbosity.add("--" + StandardArgumentDefinitions.VERBOSITY_NAME);
        argsWithVerbosity.add(Log.LogLevel.ERROR.name());
        return argsWithVerbosity;
    }

    default Object runCommandLine(final List<String> args) {
        return new Main().instanceMain(makeCommandLineArgs(args, getTestedToolName()));
    }

    /**
     * Lets you explicitly specify a tool to run with the provided arguments
     */
    default Object runCommandLine(final List<String> args, final String toolName) {
        return new Main().instanceMain(makeCommandLineArgs(args, toolName));
    }

    default Object runCommandLine(final String[] args) {
        return runCommandLine(Arrays.asList(args));
    }

    default Object runCommandLine(final ArgumentsBuilder args) {
        return runCommandLine(args.getArgsList());
    }
}
