package org.nanopolishcomp.exceptions;

import java.io.File;
import java.nio.file.Path;
import java.util.Collection;

/**
 * <p/>
 * Class UserException.
 * <p/>
 * This exception is for errors that are due to user mistakes, such as non-existent or malformed files.
 */
public class UserException extends RuntimeException {
    private static final long serialVersionUID = 0L;

    public UserException() {
        super();
    }

    public UserException(final String msg) {
        super(msg);
    }

    public UserException(final String message, final Throwable throwable) {
        super(message, throwable);
    }

    protected static String getMessage(final Throwable t) {
        final String message = t.getMessage();
        return message != null ? message : t.getClass().getName();
    }

    /**
     * Subtypes of UserException for common kinds of errors
     */

    /**
     * <p/>
     * Class UserException.CouldNotReadInputFile
     * <p/>
     * For generic errors opening/reading from input files
     */
    public static class CouldNotReadInputFile extends UserException {
        private static final long serialVersionUID = 0L;

        public CouldNotReadInputFile(String message, Exception e) {
            super(String.format("Couldn't read file. Error was: %s with exception: %s", message, getMessage(e)), e);
        }

        public CouldNotReadInputFile(Path file, String message) {
            super(String.format("Couldn't read file %s. Error was: %s", file.toAbsolutePath().toUri(), message));
        }

        public CouldNotReadInputFile(Path file, String message, Throwable cause) {
            super(String.format("Couldn't read file %s. Error was: %s", file.toAbsolutePath().toUri(), message), cause);
        }

        public CouldNotReadInputFile(String source, String message, Throwable cause) {
            super(String.format("Couldn't read file %s. Error was: %s", source, message), cause);
        }

        public CouldNotReadInputFile(String file, String message) {
            super(String.format("Couldn't read file %s. Error was: %s", file, message));
        }

        public CouldNotReadInputFile(Path path, Exception e) {
            this(path, getMessage(e), e);
        }
    }

    /**
     * <p/>
     * Class UserException.CouldNotCreateOutputFile
     * <p/>
     * For generic errors writing to output files
     */
    public static class CouldNotCreateOutputFile extends UserException {
        private static final long serialVersionUID = 0L;

        public CouldNotCreateOutputFile(File file, String message) {
            super(String.format("Couldn't write file %s because %s", file.getAbsolutePath(), message));
        }

        public CouldNotCreateOutputFile(String file, String message) {
            super(String.format("Couldn't write file %s because %s", file, message));
        }

        public CouldNotCreateOutputFile(String filename, String message, Exception e) {
            super(String.format("Couldn't write file %s because %s with exception %s", filename, message, getMessage(e)), e);
        }

        public CouldNotCreateOutputFile(File file, Exception e) {
            super(String.format("Couldn't write file %s because exception %s", file.getAbsolutePath(), getMessage(e)), e);
        }
    }

    public static class BadInput extends UserException {
        private static final long serialVersionUID = 0L;

        public BadInput(String message, Throwable cause){
            super(String.format("Bad input: %s", message), cause);
        }

        public BadInput(String message) {
            super(String.format("Bad input: %s", message));
        }
    }

    /**
     * <p/>
     * Class UserException.MalformedFile
     * <p/>
     * For errors parsing files
     */
    public static class MalformedFile extends UserException {
        private static final long serialVersionUID = 0L;

        public MalformedFile(String message) {
            super(String.format("Unknown file is malformed: %s", message));
        }

        public MalformedFile(String source, String message) {
            super(String.format("File %s is malformed: %s", source, message));
        }

        public MalformedFile(Path p, String message, Exception e) {
            super(String.format("File %s is malformed: %s caused by %s", p.toUri(), message, getMessage(e)), e);
        }
    }

    /**
     * An eventalign table header lacks columns the collapse cannot do without, or disagrees with the
     * header of the first input.
     */
    public static final class MissingColumns extends MalformedFile {
        private static final long serialVersionUID = 0L;

        public MissingColumns(final String source, final Collection<String> missing) {
            super(source, String.format("the header is missing the required column(s): %s", String.join(", ", missing)));
        }

        public MissingColumns(final String source, final String message) {
            super(source, message);
        }
    }

    /**
     * Settings that cannot drive a run; detected before any work starts.
     */
    public static final class InvalidConfiguration extends UserException {
        private static final long serialVersionUID = 0L;

        public InvalidConfiguration(final String message) {
            super(String.format("Invalid configuration: %s", message));
        }
    }
}
