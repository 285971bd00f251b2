package org.nanopolishcomp.exceptions;

/**
 * <p/>
 * Class NanopolishCompException.
 * <p/>
 * This exception is for errors that are beyond the user's control, such as internal pre/post condition failures
 * and "this should never happen" kinds of scenarios.
 */
public class NanopolishCompException extends RuntimeException {
    private static final long serialVersionUID = 0L;

    public NanopolishCompException( String msg ) {
        super(msg);
    }

    public NanopolishCompException( String message, Throwable throwable ) {
        super(message, throwable);
    }

    /*
      Subtypes of NanopolishCompException for common kinds of errors
     */

    /**
     * <p/>
     * For wrapping errors that are believed to never be reachable
     */
    public static class ShouldNeverReachHereException extends NanopolishCompException {
        private static final long serialVersionUID = 0L;
        public ShouldNeverReachHereException( final String s ) {
            super(s);
        }
        public ShouldNeverReachHereException( final String s, final Throwable throwable ) {
            super(s, throwable);
        }
        public ShouldNeverReachHereException( final Throwable throwable) {this("Should never reach here.", throwable);}
    }

    /**
     * A pipeline stage failed with a checked exception that has no user-facing counterpart.
     */
    public static class StageFailure extends NanopolishCompException {
        private static final long serialVersionUID = 0L;

        public StageFailure( final String stageName, final Throwable throwable ) {
            super(String.format("Stage %s failed: %s", stageName, throwable.getMessage() != null ? throwable.getMessage() : throwable.getClass().getName()), throwable);
        }
    }
}
