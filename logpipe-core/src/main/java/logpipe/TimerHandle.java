package logpipe;

import java.util.Map;

/**
 * Running measurement started by {@link StructuredLogger#time(String)}.
 */
public interface TimerHandle {

    /** Logs {@code "<label> completed in <ms>ms"} at debug level. */
    default void end() {
        end(null);
    }

    void end(Map<String, ?> metadata);
}
