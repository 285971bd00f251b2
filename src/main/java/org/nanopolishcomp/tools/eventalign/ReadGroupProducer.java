package org.nanopolishcomp.tools.eventalign;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.nanopolishcomp.exceptions.UserException;
import org.nanopolishcomp.utils.Utils;
import org.nanopolishcomp.utils.io.IOUtils;
import org.nanopolishcomp.utils.tsv.DataLine;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;

/**
 * Reader stage: splits the eventalign inputs into read groups.
 * <p>
 * Inputs are read one after the other. Consecutive lines with the same read id and reference id form a group,
 * which is queued for the workers as soon as the key changes or the input ends; groups never span two inputs.
 * The column layout comes from the header of the first input and every later input must have the same header.
 * </p>
 * <p>
 * When the stage stops, for whatever reason, it queues one {@link ReadGroup#END_OF_INPUT} per worker.
 * </p>
 */
final class ReadGroupProducer extends PipelineStage {
    private static final Logger logger = LogManager.getLogger(ReadGroupProducer.class);

    private final List<String> inputs;
    private final long maxReads;
    private final BlockingQueue<ReadGroup> workQueue;
    private final int workerCount;

    private EventalignColumns columns;
    private String firstInput;
    private long groupsEmitted = 0;

    ReadGroupProducer(final List<String> inputs, final long maxReads, final BlockingQueue<ReadGroup> workQueue,
                      final int workerCount, final PipelineSignals signals) {
        super("reader", signals);
        this.inputs = Utils.nonEmpty(new ArrayList<>(inputs), "inputs");
        Utils.validateArg(maxReads >= 0, "the read ceiling cannot be negative");
        Utils.validateArg(workerCount > 0, "there must be at least one worker");
        this.maxReads = maxReads;
        this.workQueue = Utils.nonNull(workQueue, "work queue cannot be null");
        this.workerCount = workerCount;
    }

    @Override
    protected void process() throws IOException, InterruptedException {
        for (final String input : inputs) {
            if (ceilingReached() || signals.hasFault()) {
                break;
            }
            logger.debug("Reading {}", input);
            try (final EventalignReader reader = new EventalignReader(input, IOUtils.openInputSource(input))) {
                checkColumns(input, reader);
                readGroups(reader);
            }
        }
        logger.debug("End of input after {} read groups", groupsEmitted);
    }

    private void checkColumns(final String input, final EventalignReader reader) {
        if (columns == null) {
            columns = EventalignColumns.resolve(input, reader.columns());
            firstInput = input;
        } else if (!columns.getHeader().equals(reader.columns())) {
            throw new UserException.MissingColumns(input, String.format("the header differs from the header of %s", firstInput));
        }
    }

    private void readGroups(final EventalignReader reader) throws IOException, InterruptedException {
        final int readIdIndex = columns.getReadIdIndex();
        final int contigIndex = columns.getContigIndex();
        String readId = null;
        String refId = null;
        List<DataLine> lines = new ArrayList<>();
        DataLine line;
        while ((line = reader.readRecord()) != null) {
            final String lineReadId = line.get(readIdIndex);
            final String lineRefId = line.get(contigIndex);
            if (!lines.isEmpty() && (!lineReadId.equals(readId) || !lineRefId.equals(refId))) {
                emit(new ReadGroup(readId, refId, lines, columns));
                if (ceilingReached() || signals.hasFault()) {
                    return;
                }
                lines = new ArrayList<>();
            }
            readId = lineReadId;
            refId = lineRefId;
            lines.add(line);
        }
        if (!lines.isEmpty()) {
            emit(new ReadGroup(readId, refId, lines, columns));
        }
    }

    private void emit(final ReadGroup group) throws InterruptedException {
        workQueue.put(group);
        groupsEmitted++;
    }

    private boolean ceilingReached() {
        return maxReads > 0 && groupsEmitted >= maxReads;
    }

    @Override
    protected void onExit() throws InterruptedException {
        if (Thread.currentThread().isInterrupted()) {
            return;
        }
        for (int i = 0; i < workerCount; i++) {
            workQueue.put(ReadGroup.END_OF_INPUT);
        }
        logger.debug("Sent {} end of input markers", workerCount);
    }

    long getGroupsEmitted() {
        return groupsEmitted;
    }
}
