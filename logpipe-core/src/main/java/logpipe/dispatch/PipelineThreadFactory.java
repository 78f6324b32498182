package logpipe.dispatch;

import java.util.Objects;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Creates the dispatcher's writer and timer threads: daemons named {@code <prefix>1},
 * {@code <prefix>2}, and so on, so a pipeline that is never closed cannot keep the JVM alive.
 *
 * <p>A task that escapes the slot's own error handling is reported to the dispatcher logger
 * at SEVERE instead of the default handler's stderr dump.
 */
final class PipelineThreadFactory implements ThreadFactory {
  private static final Logger logger = Logger.getLogger(LogDispatcher.class.getName());

  private final String prefix;
  private final AtomicInteger counter = new AtomicInteger(1);

  PipelineThreadFactory(String prefix) {
    this.prefix = Objects.requireNonNull(prefix, "prefix");
  }

  @Override
  public Thread newThread(Runnable runnable) {
    Thread thread = new Thread(runnable, prefix + counter.getAndIncrement());
    thread.setDaemon(true);
    thread.setUncaughtExceptionHandler(PipelineThreadFactory::reportUncaught);
    return thread;
  }

  static void reportUncaught(Thread thread, Throwable error) {
    logger.log(Level.SEVERE, "Uncaught failure on pipeline thread " + thread.getName(), error);
  }
}
