package io.docstore.spring.boot;

import java.util.Objects;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Thread factory for closing the application context off the starting thread.
 *
 * <p>Threads are named {@code prefix + N} and are not daemons, so the JVM waits for the context
 * close to finish even if every other thread has already ended.
 */
public final class ShutdownThreadFactory implements ThreadFactory {
  private final String prefix;
  private final AtomicInteger counter = new AtomicInteger(1);

  public ShutdownThreadFactory(String prefix) {
    this.prefix = Objects.requireNonNull(prefix, "prefix");
  }

  @Override
  public Thread newThread(Runnable runnable) {
    Thread thread = new Thread(runnable, prefix + counter.getAndIncrement());
    thread.setDaemon(false);
    return thread;
  }
}
