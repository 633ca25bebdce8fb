package org.winslowlab.ultraseq.cmdline;

/**
 * A set of String constants in which the name of the argument (for the command line) is specified by its long name
 * or short name, shared by all tools.
 */
public final class StandardArgumentDefinitions {
    private StandardArgumentDefinitions(){}

    public static final String INPUT_LONG_NAME = "input";
    public static final String OUTPUT_LONG_NAME = "output";
    public static final String VERBOSITY_NAME = "verbosity";
    public static final String QUIET_NAME = "QUIET";
    public static final String METRICS_FILE_LONG_NAME = "metrics-file";
    public static final String SAMPLE_ID_LONG_NAME = "sample-id";

    public static final String INPUT_SHORT_NAME = "I";
    public static final String OUTPUT_SHORT_NAME = "O";
    public static final String METRICS_FILE_SHORT_NAME = "M";

    /**
     * Configuration file option, read by {@link org.winslowlab.ultraseq.Main} before any tool is created.
     */
    public static final String ULTRASEQ_CONFIG_FILE_OPTION = "ultraseq-config-file";
}
