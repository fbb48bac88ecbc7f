package io.reposync.sync;

import java.util.ArrayList;
import java.util.List;

/**
 * Aggregate of the failures recorded during one sync pass. A single failure becomes the cause;
 * several are attached as suppressed exceptions.
 */
public final class SyncException extends RuntimeException {
    private final List<Throwable> errors;

    private SyncException(String message, Throwable cause, List<Throwable> errors) {
        super(message, cause);
        this.errors = List.copyOf(errors);
    }

    public static SyncException of(List<? extends Throwable> errors) {
        if (errors == null || errors.isEmpty()) {
            throw new IllegalArgumentException("SyncException needs at least one error");
        }
        if (errors.size() == 1) {
            Throwable only = errors.get(0);
            return new SyncException(only.getMessage(), only, List.of(only));
        }
        StringBuilder sb = new StringBuilder();
        sb.append(errors.size()).append(" errors occurred:");
        for (Throwable t : errors) {
            sb.append("\n\t* ").append(t.getMessage());
        }
        SyncException out = new SyncException(sb.toString(), null, new ArrayList<>(errors));
        for (Throwable t : errors) {
            out.addSuppressed(t);
        }
        return out;
    }

    public List<Throwable> errors() {
        return errors;
    }
}
