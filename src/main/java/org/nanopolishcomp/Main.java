package org.nanopolishcomp;

import htsjdk.samtools.util.StringUtil;
import org.broadinstitute.barclay.argparser.ClassFinder;
import org.broadinstitute.barclay.argparser.CommandLineException;
import org.broadinstitute.barclay.argparser.CommandLineProgramGroup;
import org.broadinstitute.barclay.argparser.CommandLineProgramProperties;
import org.nanopolishcomp.cmdline.CommandLineProgram;
import org.nanopolishcomp.exceptions.UserException;
import org.nanopolishcomp.utils.Utils;

import java.io.PrintStream;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * This is the main class of the toolkit and is the way of executing individual command line programs.
 *
 * CommandLinePrograms are listed in a single command line interface based on the java package specified to instanceMain.
 *
 * If you want your own single command line program, extend this class and override if required:
 *
 * - {@link #getPackageList()} to return a list of java packages in which to search for classes that extend CommandLineProgram.
 * - {@link #getCommandLineName()} for the name of the toolkit.
 */
public class Main {

    static {
        Utils.forceJVMLocaleToUSEnglish();
    }

    /**
     * exit value when an issue with the commandline is detected, ie CommandLineException.
     */
    private static final int COMMANDLINE_EXCEPTION_EXIT_VALUE = 1;

    /**
     * exit value when an unrecoverable {@link UserException} occurs
     */
    public static final int USER_EXCEPTION_EXIT_VALUE = 2;

    /**
     * exit value when any unrecoverable exception other than {@link UserException} occurs
     */
    private static final int ANY_OTHER_EXCEPTION_EXIT_VALUE = 3;

    private static final String STACK_TRACE_ON_USER_EXCEPTION_PROPERTY = "NANOPOLISHCOMP_STACKTRACE_ON_USER_EXCEPTION";

    /**
     * Prints the given message (may be null) to the provided stream, adding adornments and formatting.
     */
    protected static void printDecoratedExceptionMessage(final PrintStream ps, final Exception e, String prefix){
        Utils.nonNull(ps, "stream");
        Utils.nonNull(e, "exception");
        ps.println("***********************************************************************");
        ps.println();
        ps.println(prefix + e.getMessage());
        ps.println();
        ps.println("***********************************************************************") ;
    }

    /**
     * The packages we wish to include in our command line.
     */
    protected List<String> getPackageList() {
        return Collections.singletonList("org.nanopolishcomp");
    }

    /**
     * Return the name of the command line, printed in the usage.
     */
    protected String getCommandLineName() {
        return "nanopolishcomp";
    }

    /**
     * The main method.
     * <p/>
     * Give a list of java packages in which to search for classes that extend CommandLineProgram.  Those will be included
     * in the list of command line programs.
     *
     * @return the result of the program, or null if no program was run.
     */
    public Object instanceMain(final String[] args, final List<String> packageList, final String commandLineName) {
        final CommandLineProgram program = extractCommandLineProgram(args, packageList, commandLineName);
        return runCommandLineProgram(program, args);
    }

    /**
     * Run the given command line program with the raw arguments from the command line
     * @param rawArgs thes are the raw arguments from the command line, the first will be stripped off
     * @return the result of running {code program} with the given args, possibly null
     */
    protected static Object runCommandLineProgram(final CommandLineProgram program, final String[] rawArgs) {

        if (null == program) return null; // no program found!  This will happen if help was specified with no other arguments
        final String[] mainArgs = Arrays.copyOfRange(rawArgs, 1, rawArgs.length);
        return program.instanceMain(mainArgs);
    }

    /**
     * This method is not intended to be used outside of the toolkit, as it uses the package list and command line name
     * of this class. Tests use it to run tools in process.
     */
    public Object instanceMain(final String[] args) {
        return instanceMain(args, getPackageList(), getCommandLineName());
    }

    /**
     * The entry point to the toolkit from commandline: it uses {@link #instanceMain(String[])} to run the command line
     * program and handle the returned object with {@link #handleResult(Object)}, and exit with 0 if no error was thrown.
     */
    protected final void mainEntry(final String[] args) {

        CommandLineProgram program = null;
        try {
            program = extractCommandLineProgram(args, getPackageList(), getCommandLineName());
            final Object result = runCommandLineProgram(program, args);
            handleResult(result);
        } catch (final CommandLineException e){
            if (program != null) {
                System.err.println(program.getUsage());
            }
            handleUserException(e);
            System.exit(COMMANDLINE_EXCEPTION_EXIT_VALUE);
        } catch (final UserException e){
            handleUserException(e);
            System.exit(USER_EXCEPTION_EXIT_VALUE);
        } catch (final Exception e){
            handleNonUserException(e);
            System.exit(ANY_OTHER_EXCEPTION_EXIT_VALUE);
        }
    }

    /**
     * Handle the result returned for a tool.
     */
    protected void handleResult(final Object result) {
        if (result != null) {
            System.out.println("Tool returned:\n" + result);
        }
    }

    /**
     * Handle a {@link UserException}: print its message, and the stack trace only if requested through a system property.
     */
    protected void handleUserException(Exception e) {
        printDecoratedExceptionMessage(System.err, e, "A USER ERROR has occurred: ");

        if(printStackTraceOnUserExceptions()) {
            e.printStackTrace();
        } else {
            System.err.println(String.format(
                    "Set the system property %s (-D%s=true) to print the stack trace.",
                    STACK_TRACE_ON_USER_EXCEPTION_PROPERTY,
                    STACK_TRACE_ON_USER_EXCEPTION_PROPERTY));
        }
    }

    protected void handleNonUserException(final Exception exception) {
        exception.printStackTrace();
    }

    /** The entry point to the toolkit from commandline. */
    public static void main(final String[] args) {
        new Main().mainEntry(args);
    }

    private static boolean printStackTraceOnUserExceptions() {
        return "true".equals(System.getenv(STACK_TRACE_ON_USER_EXCEPTION_PROPERTY)) || Boolean.getBoolean(STACK_TRACE_ON_USER_EXCEPTION_PROPERTY);
    }

    private static boolean canMakeInstances(final Class<?> clazz) {
        return !clazz.isInterface()
                && !clazz.isSynthetic()
                && !clazz.isPrimitive()
                && !clazz.isLocalClass()
                && !clazz.isAnonymousClass()
                && !Modifier.isAbstract(clazz.getModifiers())
                && Modifier.isPublic(clazz.getModifiers());
    }

    /**
     * Returns the command line program specified, or prints the usage and exits with exit code 1
     */
    private CommandLineProgram extractCommandLineProgram(final String[] args, final List<String> packageList, final String commandLineName) {
        final ClassFinder classFinder = new ClassFinder();
        for (final String pkg : packageList) {
            classFinder.find(pkg, CommandLineProgram.class);
        }
        final Map<String, Class<?>> simpleNameToClass = new LinkedHashMap<>();
        final List<String> missingAnnotationClasses = new ArrayList<>();
        for (final Class<?> clazz : classFinder.getClasses()) {
            if (!canMakeInstances(clazz)) {
                continue;
            }
            if (getProgramProperty(clazz) == null) {
                missingAnnotationClasses.add(clazz.getSimpleName());
            } else {
                if (simpleNameToClass.containsKey(clazz.getSimpleName())) {
                    throw new IllegalStateException("Simple class name collision: " + clazz.getName());
                }
                simpleNameToClass.put(clazz.getSimpleName(), clazz);
            }
        }
        if (!missingAnnotationClasses.isEmpty()) {
            throw new IllegalStateException("The following classes are missing the required CommandLineProgramProperties annotation: "
                    + String.join(", ", missingAnnotationClasses));
        }

        final Set<Class<?>> classes = new LinkedHashSet<>(simpleNameToClass.values());

        if (args.length < 1 || args[0].equals("-h") || args[0].equals("--help")) {
            printUsage(System.out, classes, commandLineName);
        } else {
            if (simpleNameToClass.containsKey(args[0])) {
                final Class<?> clazz = simpleNameToClass.get(args[0]);
                try {
                    return (CommandLineProgram) clazz.getDeclaredConstructor().newInstance();
                } catch (final InstantiationException | IllegalAccessException | NoSuchMethodException | InvocationTargetException e) {
                    throw new IllegalStateException("Could not instantiate " + clazz.getName(), e);
                }
            }
            printUsage(System.err, classes, commandLineName);
            throw new UserException(getSuggestedAlternateCommand(classes, args[0]));
        }
        return null;
    }

    public static CommandLineProgramProperties getProgramProperty(Class<?> clazz) {
        return clazz.getAnnotation(CommandLineProgramProperties.class);
    }

    private void printUsage(final PrintStream destinationStream, final Set<Class<?>> classes, final String commandLineName) {
        final StringBuilder builder = new StringBuilder();
        builder.append("USAGE: ").append(commandLineName).append(" <program name> [-h]\n\n")
                .append("Available Programs:\n");

        final Map<String, CommandLineProgramGroup> groupsByName = new LinkedHashMap<>();
        final Map<String, List<Class<?>>> programsByGroup = new TreeMap<>();
        for (final Class<?> clazz : classes) {
            final CommandLineProgramProperties property = getProgramProperty(clazz);
            if (property.omitFromCommandLine()) {
                continue;
            }
            final CommandLineProgramGroup programGroup;
            try {
                programGroup = property.programGroup().getDeclaredConstructor().newInstance();
            } catch (final InstantiationException | IllegalAccessException | NoSuchMethodException | InvocationTargetException e) {
                throw new IllegalStateException("Could not instantiate " + property.programGroup().getName(), e);
            }
            groupsByName.putIfAbsent(programGroup.getName(), programGroup);
            programsByGroup.computeIfAbsent(programGroup.getName(), name -> new ArrayList<>()).add(clazz);
        }

        for (final Map.Entry<String, List<Class<?>>> entry : programsByGroup.entrySet()) {
            final CommandLineProgramGroup programGroup = groupsByName.get(entry.getKey());

            builder.append("--------------------------------------------------------------------------------------\n");
            builder.append(String.format("%-48s %-45s\n", programGroup.getName() + ":", programGroup.getDescription()));

            final List<Class<?>> sortedClasses = new ArrayList<>(entry.getValue());
            sortedClasses.sort(Comparator.comparing(Class::getSimpleName));

            for (final Class<?> clazz : sortedClasses) {
                builder.append(String.format("    %-45s%s\n", clazz.getSimpleName(), getProgramProperty(clazz).oneLineSummary()));
            }
            builder.append("\n");
        }
        builder.append("--------------------------------------------------------------------------------------\n");
        destinationStream.println(builder.toString());
    }

    private static final int HELP_SIMILARITY_FLOOR = 7;
    private static final int MINIMUM_SUBSTRING_LENGTH = 5;

    /**
     * When a command does not match any known command, searches for similar commands, using the same method as GIT
     * @return returns an error message including the closes match if relevant.
     */
    public String getSuggestedAlternateCommand(final Set<Class<?>> classes, final String command) {
        final Map<Class<?>, Integer> distances = new LinkedHashMap<>();

        int bestDistance = Integer.MAX_VALUE;
        int bestN = 0;

        // Score against all classes
        for (final Class<?> clazz : classes) {
            final String name = clazz.getSimpleName();
            final int distance;
            if (name.startsWith(command) || (MINIMUM_SUBSTRING_LENGTH <= command.length() && name.contains(command))) {
                distance = 0;
            } else {
                distance = StringUtil.levenshteinDistance(command, name, 0, 2, 1, 4);
            }
            distances.put(clazz, distance);

            if (distance < bestDistance) {
                bestDistance = distance;
                bestN = 1;
            } else if (distance == bestDistance) {
                bestN++;
            }
        }

        // Upper bound on the similarity score
        if (0 == bestDistance && bestN == classes.size()) {
            bestDistance = HELP_SIMILARITY_FLOOR + 1;
        }

        final StringBuilder message = new StringBuilder();
        // Output similar matches
        message.append(String.format("'%s' is not a valid command.", command));
        message.append(System.lineSeparator());
        if (bestDistance < HELP_SIMILARITY_FLOOR) {
            message.append(String.format("Did you mean %s?", (bestN < 2) ? "this" : "one of these"));
            message.append(System.lineSeparator());
            for (final Class<?> clazz : classes) {
                if (bestDistance == distances.get(clazz)) {
                    message.append(String.format("        %s", clazz.getSimpleName()));
                }
            }
        }
        return message.toString();
    }
}
