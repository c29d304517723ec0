package io.silowatch.cluster.membership;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Helpers for classifying failures coming out of futures.
 */
public final class Failures {

    private Failures() {
    }

    /** Strips {@link CompletionException} and {@link ExecutionException} wrappers. */
    public static Throwable unwrap(final Throwable error) {
        Throwable t = error;
        while ((t instanceof CompletionException || t instanceof ExecutionException) && t.getCause() != null) {
            t = t.getCause();
        }
        return t;
    }

    public static String describe(final Throwable error) {
        final Throwable t = unwrap(error);
        final String message = t.getMessage();
        return message == null
                ? t.getClass().getName()
                : t.getClass().getName() + ": " + message;
    }
}
