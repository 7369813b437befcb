package hookrelay.util;

import java.util.Objects;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Thread factory for the relay's worker pools and timers.
 *
 * <p>Threads are daemons named {@code <prefix>1}, {@code <prefix>2}, ... so a thread dump
 * shows which pool a delivery is running on. A throwable escaping a worker is logged at
 * {@code SEVERE} instead of going to {@code System.err}.
 */
public final class DaemonThreadFactory implements ThreadFactory {
  private static final Logger logger = Logger.getLogger(DaemonThreadFactory.class.getName());

  private final String prefix;
  private final AtomicInteger sequence = new AtomicInteger();

  public DaemonThreadFactory(String prefix) {
    this.prefix = Objects.requireNonNull(prefix, "prefix");
  }

  @Override
  public Thread newThread(Runnable task) {
    Thread worker = new Thread(task, prefix + sequence.incrementAndGet());
    worker.setDaemon(true);
    worker.setUncaughtExceptionHandler((t, e) ->
        logger.log(Level.SEVERE, "Uncaught failure on " + t.getName(), e));
    return worker;
  }
}
