package org.nanopolishcomp.engine.progressmeter;

/**
 * Progress meter over collapsed reads, keyed by read id.
 */
public final class ReadProgressMeter extends ProgressMeter<String> {

    private static final int MAX_READ_ID_LENGTH = 36;

    public ReadProgressMeter(final double secondsBetweenUpdates, final boolean disabled) {
        super(secondsBetweenUpdates, disabled);
        setRecordLabel("reads");
    }

    @Override
    protected String formatRecord(final String readId) {
        if (readId == null) {
            return "unknown";
        }
        return readId.length() <= MAX_READ_ID_LENGTH ? readId : readId.substring(0, MAX_READ_ID_LENGTH);
    }
}
