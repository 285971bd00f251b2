package org.nanopolishcomp.cmdline;

/**
 * A set of String constants in which the name of the constant (minus the _SHORT_NAME suffix)
 * is the standard long Name for a commonly used argument, and the value of the constant is the
 * standard shortName.
 */
public final class StandardArgumentDefinitions {
    private StandardArgumentDefinitions(){}

    public static final String INPUT_LONG_NAME = "input";
    public static final String OUTPUT_DIRECTORY_LONG_NAME = "output-dir";
    public static final String OUTPUT_PREFIX_LONG_NAME = "output-prefix";
    public static final String MAX_READS_LONG_NAME = "max-reads";
    public static final String WRITE_SAMPLES_LONG_NAME = "write-samples";
    public static final String STAT_FIELDS_LONG_NAME = "stat-fields";
    public static final String THREADS_LONG_NAME = "threads";
    public static final String QUEUE_CAPACITY_LONG_NAME = "queue-capacity";
    public static final String PROGRESS_LONG_NAME = "progress";
    public static final String VERBOSITY_NAME = "verbosity";
    public static final String QUIET_NAME = "QUIET";

    public static final String INPUT_SHORT_NAME = "I";
    public static final String OUTPUT_DIRECTORY_SHORT_NAME = "O";
    public static final String OUTPUT_PREFIX_SHORT_NAME = "P";
    public static final String STAT_FIELDS_SHORT_NAME = "f";
    public static final String THREADS_SHORT_NAME = "t";
}
