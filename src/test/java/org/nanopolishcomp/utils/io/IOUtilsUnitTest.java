package org.nanopolishcomp.utils.io;

import htsjdk.samtools.util.BlockCompressedOutputStream;
import org.nanopolishcomp.exceptions.UserException;
import org.nanopolishcomp.testutils.BaseTest;
import org.testng.Assert;
import org.testng.annotations.Test;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.OutputStream;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Collectors;
import java.util.zip.GZIPOutputStream;

public final class IOUtilsUnitTest extends BaseTest {

    private static final String CONTENT = "contig\tposition\nchr1\t10\n";

    private static String readAll(final Reader reader) throws IOException {
        try (final BufferedReader buffered = new BufferedReader(reader)) {
            return buffered.lines().collect(Collectors.joining("\n", "", "\n"));
        }
    }

    @Test
    public void testOpenPlainFile() throws IOException {
        final Path path = writeTempFile("plain", ".tsv", CONTENT);
        Assert.assertEquals(readAll(IOUtils.openInputSource(path.toString())), CONTENT);
    }

    @Test
    public void testOpenGzippedFile() throws IOException {
        final Path path = createTempFile("zipped", ".tsv.gz").toPath();
        try (final OutputStream out = new GZIPOutputStream(Files.newOutputStream(path))) {
            out.write(CONTENT.getBytes(StandardCharsets.UTF_8));
        }
        Assert.assertEquals(readAll(IOUtils.openInputSource(path.toString())), CONTENT);
    }

    @Test
    public void testOpenBlockCompressedFile() throws IOException {
        final Path path = createTempFile("bgzipped", ".tsv.gz").toPath();
        try (final OutputStream out = new BlockCompressedOutputStream(path.toFile())) {
            out.write(CONTENT.getBytes(StandardCharsets.UTF_8));
        }
        Assert.assertEquals(readAll(IOUtils.openInputSource(path.toString())), CONTENT);
    }

    @Test(expectedExceptions = UserException.CouldNotReadInputFile.class)
    public void testOpenMissingFile() {
        IOUtils.openInputSource(new File(createTempDir("missing"), "nothing.tsv").getPath());
    }

    @Test(expectedExceptions = UserException.CouldNotReadInputFile.class)
    public void testOpenDirectory() {
        IOUtils.openInputSource(createTempDir("directory").getPath());
    }

    @Test
    public void testCreateDirectory() throws IOException {
        final Path nested = createTempDir("parent").toPath().resolve("a").resolve("b");
        IOUtils.createDirectory(nested);
        Assert.assertTrue(Files.isDirectory(nested));
        // already there
        IOUtils.createDirectory(nested);
    }

    @Test(expectedExceptions = UserException.CouldNotCreateOutputFile.class)
    public void testCreateDirectoryOverFile() {
        IOUtils.createDirectory(writeTempFile("file", ".txt", "x"));
    }

    @Test
    public void testMakeWriterIsUtf8() throws IOException {
        final Path path = createTempFile("utf8", ".txt").toPath();
        try (final Writer writer = IOUtils.makeWriter(Files.newOutputStream(path))) {
            writer.write("é");
        }
        Assert.assertEquals(Files.readAllBytes(path), "é".getBytes(StandardCharsets.UTF_8));
    }

    @Test
    public void testDeleteRecursively() throws IOException {
        final Path dir = createTempDir("delete").toPath();
        Files.createDirectories(dir.resolve("sub"));
        Files.write(dir.resolve("sub").resolve("file.txt"), new byte[]{1});
        IOUtils.deleteRecursively(dir);
        Assert.assertFalse(Files.exists(dir));
    }
}
