package org.nanopolishcomp.utils.io;

import htsjdk.samtools.util.BlockCompressedInputStream;
import htsjdk.samtools.util.IOUtil;
import org.nanopolishcomp.exceptions.UserException;
import org.nanopolishcomp.utils.Utils;

import java.io.BufferedInputStream;
import java.io.BufferedWriter;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.zip.GZIPInputStream;

/**
 * Opening of inputs (standard input, plain or gzipped files), output directories and temporary files.
 * <p>
 * Files are unzipped when their name ends with '.gz'; the stream is then read as bgzip if it carries the
 * BGZF block header, and as plain gzip otherwise.
 * </p>
 */
public final class IOUtils {

    /**
     * Input name standing for the process standard input.
     */
    public static final String STDIN_NAME = "-";

    private IOUtils(){}

    /**
     * Opens a named input for reading: {@value #STDIN_NAME} is the standard input, anything else a local
     * file path which gets unzipped if its name ends with '.gz'.
     *
     * @throws UserException.CouldNotReadInputFile if the file does not exist or cannot be opened
     */
    public static Reader openInputSource(final String source) {
        Utils.nonNull(source, "input source");
        if (STDIN_NAME.equals(source)) {
            return new InputStreamReader(System.in, StandardCharsets.UTF_8);
        }
        final Path path = getPath(source);
        assertFileIsReadable(path);
        try {
            return makeReaderMaybeGzipped(path);
        } catch (final IOException e) {
            throw new UserException.CouldNotReadInputFile(path, e);
        }
    }

    /**
     * Makes a reader for a file, unzipping if the file's name ends with '.gz'.
     */
    public static Reader makeReaderMaybeGzipped(Path path) throws IOException {
        final InputStream in = new BufferedInputStream(Files.newInputStream(path));
        // toString because path.endsWith only checks whole path components, not substrings.
        return makeReaderMaybeGzipped(in, path.toString().endsWith(".gz"));
    }

    /**
     * makes a reader for an inputStream wrapping it in an appropriate unzipper if necessary
     * @param zipped is this stream zipped
     */
    public static Reader makeReaderMaybeGzipped(InputStream in, boolean zipped) throws IOException {
        if (zipped) {
            return new InputStreamReader(makeZippedInputStream(in), StandardCharsets.UTF_8);
        } else {
            return new InputStreamReader(in, StandardCharsets.UTF_8);
        }
    }

    /**
     * creates an input stream from a zipped stream
     * @return tries to create a block gzipped input stream and if it's not block gzipped it produces to a gzipped stream instead
     */
    public static InputStream makeZippedInputStream(InputStream in) throws IOException {
        Utils.nonNull(in);
        if (BlockCompressedInputStream.isValidFile(in)) {
            return new BlockCompressedInputStream(in);
        } else {
            return new GZIPInputStream(in);
        }
    }

    /**
     * Wraps an output stream in a buffered UTF-8 writer.
     */
    public static Writer makeWriter(final OutputStream out) {
        return new BufferedWriter(new OutputStreamWriter(Utils.nonNull(out), StandardCharsets.UTF_8));
    }

    /**
     * @param path Path to test
     * @throws UserException.CouldNotReadInputFile if the file isn't readable and a regular file
     */
    public static void assertFileIsReadable(final Path path) {
        Utils.nonNull(path);

        if ( ! Files.exists(path) ) {
            throw new UserException.CouldNotReadInputFile(path, "It doesn't exist.");
        }
        if ( ! Files.isRegularFile(path) ) {
            throw new UserException.CouldNotReadInputFile(path, "It isn't a regular file");
        }
        if ( ! Files.isReadable(path) ) {
            throw new UserException.CouldNotReadInputFile(path, "It is not readable, check the file permissions");
        }
    }

    /**
     * Makes sure {@code dir} exists as a directory, creating it and any missing parents.
     * @throws UserException.CouldNotCreateOutputFile if it cannot be created or is a regular file
     */
    public static Path createDirectory(final Path dir) {
        Utils.nonNull(dir);
        if (Files.exists(dir) && !Files.isDirectory(dir)) {
            throw new UserException.CouldNotCreateOutputFile(dir.toString(), "it exists and is not a directory");
        }
        try {
            return Files.createDirectories(dir);
        } catch (final IOException e) {
            throw new UserException.CouldNotCreateOutputFile(dir.toString(), "the directory could not be created", e);
        }
    }

    /**
     * Creates a temp directory with the given prefix.
     *
     * The directory and any contents will be automatically deleted at shutdown.
     *
     * @param prefix       Prefix for the directory name.
     * @return The created temporary directory.
     */
    public static File createTempDir(String prefix) {
        try {
            final Path tmpDir = Files.createTempDirectory(prefix).normalize();
            deleteOnExit(tmpDir);
            return tmpDir.toFile();
        } catch (final IOException e) {
            throw new UserException.CouldNotCreateOutputFile(prefix, "a temporary directory could not be created", e);
        }
    }

    /**
     * Creates a temp file that will be deleted on exit
     * @param name Prefix of the file.
     * @param extension Extension to concat to the end of the file.
     */
    public static File createTempFile(String name, String extension) {
        try {
            final File file = File.createTempFile(name, extension);
            file.deleteOnExit();
            return file;
        } catch (final IOException e) {
            throw new UserException.CouldNotCreateOutputFile(name + extension, "a temporary file could not be created", e);
        }
    }

    /**
     * Schedule a file or directory to be deleted on JVM shutdown.
     */
    public static void deleteOnExit(final Path fileToDelete){
        Runtime.getRuntime().addShutdownHook(new Thread(() -> deleteRecursively(fileToDelete)));
    }

    /**
     * Delete rootPath recursively
     * @param rootPath is the file/directory to be deleted
     */
    public static void deleteRecursively(final Path rootPath) {
        IOUtil.recursiveDelete(rootPath);
    }

    public static Path getPath(final String pathString) {
        Utils.nonNull(pathString);
        return Paths.get(pathString);
    }
}
