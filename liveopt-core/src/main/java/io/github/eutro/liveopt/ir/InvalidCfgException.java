package io.github.eutro.liveopt.ir;

/**
 * Thrown when a {@link Cfg} is structurally malformed, e.g. a control transfer
 * names a block index that is not in the graph.
 * <p>
 * This indicates a bug in whatever built the graph, not a recoverable condition.
 */
public class InvalidCfgException extends RuntimeException {
    public InvalidCfgException(String message) {
        super(message);
    }
}
