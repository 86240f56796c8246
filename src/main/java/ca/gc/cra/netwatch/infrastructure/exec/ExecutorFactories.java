package ca.gc.cra.netwatch.infrastructure.exec;

import java.lang.Thread.UncaughtExceptionHandler;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Factory helpers for the NETWATCH ingestion and render threads.
 */
public final class ExecutorFactories {
  /** Thread name of the dashboard-mode ingestion thread. */
  public static final String CAPTURE_THREAD = "netwatch-capture";
  /** Thread name of the dashboard render ticker. */
  public static final String RENDER_THREAD = "netwatch-render";

  private ExecutorFactories() {}

  /**
   * Builds the single-threaded executor that runs the capture loop in dashboard mode.
   *
   * @param handler uncaught exception handler installed on the thread; {@code null} keeps the JVM default
   * @return executor with exactly one worker
   */
  public static ExecutorService newCaptureExecutor(UncaughtExceptionHandler handler) {
    return new ThreadPoolExecutor(
        1,
        1,
        0L,
        TimeUnit.MILLISECONDS,
        new LinkedBlockingQueue<>(),
        namedFactory(CAPTURE_THREAD, false, handler),
        new ThreadPoolExecutor.AbortPolicy());
  }

  /**
   * Builds the scheduler driving periodic dashboard renders.
   *
   * @param handler uncaught exception handler installed on the thread; {@code null} keeps the JVM default
   * @return single-threaded scheduler; its thread is a daemon so a hung render never blocks exit
   */
  public static ScheduledExecutorService newRenderScheduler(UncaughtExceptionHandler handler) {
    ScheduledThreadPoolExecutor scheduler =
        new ScheduledThreadPoolExecutor(1, namedFactory(RENDER_THREAD, true, handler));
    scheduler.setRemoveOnCancelPolicy(true);
    scheduler.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
    return scheduler;
  }

  static ThreadFactory namedFactory(String name, boolean daemon, UncaughtExceptionHandler handler) {
    AtomicInteger index = new AtomicInteger();
    return runnable -> {
      Thread thread = new Thread(runnable);
      int n = index.getAndIncrement();
      thread.setName(n == 0 ? name : name + "-" + n);
      thread.setDaemon(daemon);
      if (handler != null) {
        thread.setUncaughtExceptionHandler(handler);
      }
      return thread;
    };
  }
}
