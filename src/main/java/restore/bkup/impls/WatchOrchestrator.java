package restore.bkup.impls;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import restore.bkup.types.BackupRecord;
import restore.prim.QuietAutoCloseable;
import restore.prim.fs.Filesystem;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.Comparator;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

/**
 * Turns bursts of filesystem changes into serialized backups, one state machine per
 * watched directory:
 *
 * <pre>
 *   IDLE --change--&gt; PENDING_CHANGE --quiet for the debounce window--&gt; BACKING_UP
 *   PENDING_CHANGE --change--&gt; PENDING_CHANGE (window restarts)
 *   BACKING_UP --change--&gt; BACKING_UP (one follow-up is remembered)
 *   BACKING_UP --done--&gt; PENDING_CHANGE if a follow-up was remembered, else IDLE
 * </pre>
 *
 * At most one backup per directory runs at a time and at most one more is pending,
 * however many changes arrive.  Directories do not wait for each other.  A failed backup
 * is logged and its directory goes back to IDLE.
 *
 * <p>Each directory's state is owned by a dedicated thread that consumes a queue of
 * signals.  Change notifications, timer expirations and backup completions all arrive
 * through that queue, so no state is shared between threads.
 */
public class WatchOrchestrator implements QuietAutoCloseable {

  private static final Logger LOG = LoggerFactory.getLogger(WatchOrchestrator.class);

  /** How long {@link #stop()} waits for running backups before interrupting them. */
  public static final Duration DEFAULT_GRACE_PERIOD = Duration.ofSeconds(30);

  public enum PathState {
    IDLE,
    PENDING_CHANGE,
    BACKING_UP,
  }

  /**
   * The work done when a directory settles.
   */
  @FunctionalInterface
  public interface BackupAction {
    void backup(Path directory) throws IOException;
  }

  private enum SignalKind {
    CHANGE,
    DEBOUNCE_ELAPSED,
    BACKUP_DONE,
    STOP,
  }

  private record Signal(SignalKind kind, long generation) {
    static final Signal CHANGE = new Signal(SignalKind.CHANGE, 0);
    static final Signal BACKUP_DONE = new Signal(SignalKind.BACKUP_DONE, 0);
    static final Signal STOP = new Signal(SignalKind.STOP, 0);
  }

  private final Duration debounce;
  private final Duration gracePeriod;
  private final Set<PathMatcher> exclusions;
  private final BackupAction action;
  private final @Nullable ChangeSource changes;
  private final @Nullable StateStore records;
  private final Filesystem filesystem;

  private final ImmutableMap<Path, PathWorker> workers;
  private final ScheduledExecutorService timers;
  private final ExecutorService backups;

  private final AtomicBoolean started = new AtomicBoolean(false);
  private final AtomicBoolean stopping = new AtomicBoolean(false);
  private final CountDownLatch stopped = new CountDownLatch(1);

  /**
   * @param roots the directories to watch
   * @param debounce how long a directory must be quiet before it is backed up
   * @param exclusions changes to matching paths are ignored
   * @param action the backup to run
   * @param changes where change notifications come from, or null to rely on
   *                {@link #notifyChange(Path)} alone
   * @param state if non-null, directories that changed since their last recorded backup
   *              are backed up at startup
   */
  public WatchOrchestrator(
          Collection<Path> roots,
          Duration debounce,
          Set<PathMatcher> exclusions,
          BackupAction action,
          @Nullable ChangeSource changes,
          @Nullable StateStore state,
          Filesystem filesystem) {
    this(roots, debounce, DEFAULT_GRACE_PERIOD, exclusions, action, changes, state, filesystem);
  }

  public WatchOrchestrator(
          Collection<Path> roots,
          Duration debounce,
          Duration gracePeriod,
          Set<PathMatcher> exclusions,
          BackupAction action,
          @Nullable ChangeSource changes,
          @Nullable StateStore state,
          Filesystem filesystem) {
    if (debounce.isNegative()) {
      throw new IllegalArgumentException("debounce window must not be negative");
    }
    this.debounce = debounce;
    this.gracePeriod = gracePeriod;
    this.exclusions = ImmutableSet.copyOf(exclusions);
    this.action = action;
    this.changes = changes;
    this.records = state;
    this.filesystem = filesystem;

    ImmutableMap.Builder<Path, PathWorker> builder = ImmutableMap.builder();
    for (Path root : ImmutableSet.copyOf(roots.stream().map(p -> p.toAbsolutePath().normalize()).collect(Collectors.toList()))) {
      builder.put(root, new PathWorker(root));
    }
    this.workers = builder.build();
    this.timers = Executors.newSingleThreadScheduledExecutor(daemon("watch-timer"));
    this.backups = Executors.newCachedThreadPool(daemon("watch-backup"));
  }

  private static ThreadFactory daemon(String name) {
    return r -> {
      Thread t = new Thread(r, name);
      t.setDaemon(true);
      return t;
    };
  }

  /**
   * Start the per-directory threads, schedule startup backups for directories that
   * changed while nobody was watching, and subscribe to the change source.
   */
  public void start() throws IOException {
    if (!started.compareAndSet(false, true)) {
      throw new IllegalStateException("already started");
    }
    for (PathWorker worker : workers.values()) {
      worker.thread.start();
    }
    if (records != null) {
      for (PathWorker worker : workers.values()) {
        if (needsBackup(worker.root)) {
          LOG.info("{} changed since its last backup", worker.root);
          worker.post(Signal.CHANGE);
        }
      }
    }
    if (changes != null) {
      try {
        changes.subscribe(workers.keySet(), this::notifyChange);
      } catch (IOException | RuntimeException e) {
        stop();
        throw e;
      }
    }
    LOG.info("watching {} directories", workers.size());
  }

  private boolean needsBackup(Path root) {
    @Nullable BackupRecord latest = records == null ? null : records.latest(BackupEngine.sourceKey(root));
    if (latest == null) {
      return true;
    }
    Instant since = latest.timestamp();
    boolean[] changed = { false };
    try {
      filesystem.scan(root, exclusions,
              dir -> { },
              f -> changed[0] |= f.modTime().isAfter(since));
    } catch (IOException e) {
      LOG.warn("cannot scan {} at startup; backing it up to be safe: {}", root, e.toString());
      return true;
    }
    return changed[0];
  }

  /**
   * Report that something under a watched directory changed.  Changes under nested
   * watched directories go to the innermost one.  Ignored after {@link #stop()}.
   */
  public void notifyChange(Path changed) {
    if (stopping.get()) {
      return;
    }
    Path p = changed.toAbsolutePath().normalize();
    if (Filesystem.isExcluded(exclusions, p)) {
      LOG.trace("ignoring change to excluded {}", p);
      return;
    }
    @Nullable PathWorker worker = workers.values().stream()
            .filter(w -> p.startsWith(w.root))
            .max(Comparator.comparingInt(w -> w.root.getNameCount()))
            .orElse(null);
    if (worker == null) {
      LOG.debug("ignoring change outside watched directories: {}", p);
      return;
    }
    worker.post(Signal.CHANGE);
  }

  /**
   * Stop accepting changes, cancel pending timers, let running backups finish within the
   * grace period (interrupting them after it), and release the change source.  Safe to
   * call more than once and from any thread.
   */
  public void stop() {
    if (!stopping.compareAndSet(false, true)) {
      return;
    }
    LOG.info("stopping watch");
    try {
      if (changes != null) {
        changes.close();
      }
      for (PathWorker worker : workers.values()) {
        worker.post(Signal.STOP);
      }
      timers.shutdownNow();
      backups.shutdown();
      try {
        if (!backups.awaitTermination(gracePeriod.toMillis(), TimeUnit.MILLISECONDS)) {
          LOG.warn("backups still running after {}; interrupting them", gracePeriod);
          backups.shutdownNow();
          backups.awaitTermination(gracePeriod.toMillis(), TimeUnit.MILLISECONDS);
        }
        for (PathWorker worker : workers.values()) {
          if (worker.thread.isAlive()) {
            worker.thread.join();
          }
        }
      } catch (InterruptedException e) {
        backups.shutdownNow();
        Thread.currentThread().interrupt();
      }
    } finally {
      stopped.countDown();
    }
  }

  /**
   * Block until {@link #stop()} completes.  If the waiting thread is interrupted, stop
   * the orchestrator and return normally with the interrupt flag set.
   */
  public void awaitShutdown() {
    try {
      stopped.await();
    } catch (InterruptedException e) {
      stop();
      Thread.currentThread().interrupt();
    }
  }

  @Override
  public void close() {
    stop();
  }

  public Set<Path> roots() {
    return workers.keySet();
  }

  @VisibleForTesting
  public PathState stateOf(Path root) {
    PathWorker worker = workers.get(root.toAbsolutePath().normalize());
    if (worker == null) {
      throw new IllegalArgumentException(root + " is not watched");
    }
    return worker.state;
  }

  /**
   * Owns the state of one watched directory.  Every field except {@link #state} and the
   * inbox is touched only by {@link #thread}.
   */
  private final class PathWorker implements Runnable {
    final Path root;
    final Thread thread;
    final BlockingQueue<Signal> inbox = new LinkedBlockingQueue<>();

    volatile PathState state = PathState.IDLE;
    boolean followUp = false;
    long generation = 0;
    @Nullable ScheduledFuture<?> timer;

    PathWorker(Path root) {
      this.root = root;
      Path name = root.getFileName();
      this.thread = new Thread(this, "watch-" + (name == null ? root : name));
      this.thread.setDaemon(true);
    }

    void post(Signal signal) {
      inbox.add(signal);
    }

    @Override
    public void run() {
      for (;;) {
        Signal signal;
        try {
          signal = inbox.take();
        } catch (InterruptedException e) {
          LOG.debug("watch thread for {} interrupted", root);
          cancelTimer();
          return;
        }
        switch (signal.kind()) {
          case CHANGE:
            onChange();
            break;
          case DEBOUNCE_ELAPSED:
            onDebounceElapsed(signal.generation());
            break;
          case BACKUP_DONE:
            onBackupDone();
            break;
          case STOP:
            cancelTimer();
            return;
        }
      }
    }

    private void onChange() {
      switch (state) {
        case IDLE:
        case PENDING_CHANGE:
          state = PathState.PENDING_CHANGE;
          arm();
          break;
        case BACKING_UP:
          followUp = true;
          break;
      }
    }

    private void onDebounceElapsed(long gen) {
      if (state != PathState.PENDING_CHANGE || gen != generation) {
        return;
      }
      timer = null;
      state = PathState.BACKING_UP;
      try {
        backups.submit(this::runBackup);
      } catch (RejectedExecutionException e) {
        LOG.debug("not backing up {}: shutting down", root);
        state = PathState.IDLE;
      }
    }

    private void runBackup() {
      try {
        LOG.info("changes in {} settled; backing up", root);
        action.backup(root);
      } catch (IOException | RuntimeException e) {
        LOG.error("backup of {} failed", root, e);
      } finally {
        post(Signal.BACKUP_DONE);
      }
    }

    private void onBackupDone() {
      if (followUp) {
        followUp = false;
        state = PathState.PENDING_CHANGE;
        arm();
      } else {
        state = PathState.IDLE;
      }
    }

    private void arm() {
      cancelTimer();
      long gen = ++generation;
      try {
        timer = timers.schedule(() -> post(new Signal(SignalKind.DEBOUNCE_ELAPSED, gen)), debounce.toMillis(), TimeUnit.MILLISECONDS);
      } catch (RejectedExecutionException e) {
        LOG.debug("not scheduling a backup of {}: shutting down", root);
      }
    }

    private void cancelTimer() {
      if (timer != null) {
        timer.cancel(false);
        timer = null;
      }
    }
  }

}
