package org.nanopolishcomp.exceptions;

import org.nanopolishcomp.testutils.BaseTest;
import org.testng.Assert;
import org.testng.annotations.Test;

import java.io.IOException;
import java.util.Arrays;

public final class UserExceptionUnitTest extends BaseTest {

    @Test
    public void testMessages() {
        Assert.assertEquals(new UserException.BadInput("oops").getMessage(), "Bad input: oops");
        Assert.assertEquals(new UserException.InvalidConfiguration("no threads").getMessage(), "Invalid configuration: no threads");
        Assert.assertEquals(new UserException.MissingColumns("in.tsv", Arrays.asList("contig", "position")).getMessage(),
                "File in.tsv is malformed: the header is missing the required column(s): contig, position");
    }

    @Test
    public void testMissingColumnsIsMalformedFile() {
        Assert.assertTrue(new UserException.MissingColumns("in.tsv", "different header") instanceof UserException.MalformedFile);
    }

    @Test
    public void testCauseWithoutMessage() {
        final IOException cause = new IOException();
        final UserException.CouldNotCreateOutputFile e = new UserException.CouldNotCreateOutputFile("out.tsv", "it failed", cause);
        assertContains(e.getMessage(), IOException.class.getName());
        Assert.assertSame(e.getCause(), cause);
    }

    @Test
    public void testStageFailure() {
        final InterruptedException cause = new InterruptedException("stop");
        final NanopolishCompException.StageFailure failure = new NanopolishCompException.StageFailure("worker-0", cause);
        Assert.assertEquals(failure.getMessage(), "Stage worker-0 failed: stop");
        Assert.assertSame(failure.getCause(), cause);
    }
}
