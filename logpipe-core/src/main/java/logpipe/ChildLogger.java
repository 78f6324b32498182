package logpipe;

/**
 * Logger carrying a fixed context merged into every entry's metadata.
 *
 * @see StructuredLogger#child(java.util.Map)
 */
public interface ChildLogger extends ScopedLogger {

    /**
     * Returns a logger with this context and the given scope.
     *
     * @param scope sub-component tag
     * @return the scoped logger
     */
    ScopedLogger scope(String scope);
}
