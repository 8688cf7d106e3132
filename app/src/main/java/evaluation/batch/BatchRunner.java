package evaluation.batch;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import evaluation.archive.InMemoryResultArchive;
import evaluation.archive.ResultArchive;
import evaluation.core.ExecutionConfig;
import evaluation.core.ResultKey;
import evaluation.core.ResultRecord;
import evaluation.core.ScenarioInstance;
import evaluation.core.payload.RawPayload;
import evaluation.solve.AlgorithmAdapter;
import evaluation.solve.AlgorithmAdapters;
import evaluation.util.Timing;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs every (scenario, execution config) pair against its algorithm adapter on a bounded worker
 * pool.
 *
 * <p>Each worker handles one task at a time. The adapter call itself runs on a separate solver
 * thread so the worker can give up after the per-task timeout: the call is then interrupted and
 * abandoned, a {@code TIMEOUT} record is archived, and the worker moves on. Adapter failures become
 * {@code ERROR} records; neither outcome affects sibling tasks. Records are appended to the archive
 * as soon as they exist, and tasks whose key is already archived are skipped, so an interrupted
 * batch resumes by running it again against the same archive.
 */
public final class BatchRunner {
  private static final Logger LOG = LoggerFactory.getLogger(BatchRunner.class);

  private final AlgorithmAdapters adapters;

  public BatchRunner(AlgorithmAdapters adapters) {
    this.adapters = Objects.requireNonNull(adapters, "adapters");
  }

  /** Runs the full cross product into a fresh in-memory archive. */
  public ResultArchive run(
      Collection<ScenarioInstance> scenarios,
      Collection<ExecutionConfig> configs,
      int concurrency,
      Duration perTaskTimeout)
      throws InterruptedException {
    InMemoryResultArchive archive = new InMemoryResultArchive();
    try {
      run(scenarios, configs, new BatchOptions(concurrency, perTaskTimeout), archive);
    } catch (IOException ex) {
      throw new UncheckedIOException("In-memory archive failed", ex);
    }
    return archive;
  }

  /**
   * Runs every task missing from {@code archive} and appends its record.
   *
   * @throws IOException if the archive cannot be written; completed records stay archived
   * @throws InterruptedException if the calling thread is interrupted; dispatch stops and tasks
   *     without a record are left for the next run
   */
  public BatchSummary run(
      Collection<ScenarioInstance> scenarios,
      Collection<ExecutionConfig> configs,
      BatchOptions options,
      ResultArchive archive)
      throws IOException, InterruptedException {
    Objects.requireNonNull(options, "options");
    Objects.requireNonNull(archive, "archive");
    List<Task> tasks = crossProduct(scenarios, configs);
    List<Task> pending = new ArrayList<>();
    for (Task task : tasks) {
      if (!archive.contains(task.key())) {
        pending.add(task);
      }
    }
    int skipped = tasks.size() - pending.size();
    LOG.info(
        "Batch of {} task(s): {} already archived, {} to run on {} worker(s), timeout {}",
        tasks.size(),
        skipped,
        pending.size(),
        options.concurrency(),
        options.perTaskTimeout());

    Timing timer = Timing.start();
    ExecutorService workers =
        Executors.newFixedThreadPool(
            options.concurrency(),
            new ThreadFactoryBuilder().setNameFormat("batch-worker-%d").build());
    ExecutorService solvers =
        Executors.newCachedThreadPool(
            new ThreadFactoryBuilder().setNameFormat("solver-%d").setDaemon(true).build());
    AtomicInteger completed = new AtomicInteger();
    int succeeded = 0;
    int timedOut = 0;
    int errored = 0;
    try {
      List<Future<ResultRecord>> futures = new ArrayList<>(pending.size());
      for (Task task : pending) {
        futures.add(
            workers.submit(
                () -> {
                  ResultRecord record = execute(task, options, solvers);
                  if (record != null) {
                    archive.append(record);
                    logCompletion(record, completed.incrementAndGet(), pending.size());
                  }
                  return record;
                }));
      }
      for (Future<ResultRecord> future : futures) {
        ResultRecord record = awaitWorker(future);
        if (record == null) {
          continue;
        }
        switch (record.status()) {
          case SUCCESS -> succeeded++;
          case TIMEOUT -> timedOut++;
          case ERROR -> errored++;
        }
      }
    } finally {
      workers.shutdownNow();
      solvers.shutdownNow();
    }

    BatchSummary summary =
        new BatchSummary(
            tasks.size(), skipped, succeeded, timedOut, errored, timer.elapsedMillis());
    LOG.info("Batch finished: {}", summary);
    return summary;
  }

  private ResultRecord awaitWorker(Future<ResultRecord> future)
      throws IOException, InterruptedException {
    try {
      return future.get();
    } catch (ExecutionException ex) {
      Throwable cause = ex.getCause();
      if (cause instanceof IOException io) {
        throw io;
      }
      if (cause instanceof RuntimeException runtime) {
        throw runtime;
      }
      if (cause instanceof Error error) {
        throw error;
      }
      throw new IllegalStateException("Batch worker failed", cause);
    }
  }

  /** Executes one task; returns {@code null} only when the worker itself was interrupted. */
  private ResultRecord execute(Task task, BatchOptions options, ExecutorService solvers) {
    ResultKey key = task.key();
    Optional<AlgorithmAdapter> adapter = adapters.find(task.config().algorithmId());
    if (adapter.isEmpty()) {
      return ResultRecord.error(
          key, 0.0, "No adapter registered for algorithm " + task.config().algorithmId());
    }

    Timing timer = Timing.start();
    Future<RawPayload> call =
        solvers.submit(() -> adapter.get().solve(task.scenario(), task.config()));
    try {
      RawPayload payload = call.get(options.perTaskTimeout().toNanos(), TimeUnit.NANOSECONDS);
      if (payload == null) {
        return ResultRecord.error(key, timer.elapsedSeconds(), "Adapter returned no payload");
      }
      return ResultRecord.success(key, payload, timer.elapsedSeconds());
    } catch (TimeoutException ex) {
      call.cancel(true);
      LOG.warn("Task {} exceeded {}; abandoning it", key, options.perTaskTimeout());
      return ResultRecord.timeout(key, options.perTaskTimeoutSeconds());
    } catch (ExecutionException ex) {
      Throwable cause = ex.getCause() != null ? ex.getCause() : ex;
      LOG.warn("Task {} failed: {}", key, describe(cause), cause);
      return ResultRecord.error(key, timer.elapsedSeconds(), describe(cause));
    } catch (InterruptedException ex) {
      call.cancel(true);
      Thread.currentThread().interrupt();
      LOG.info("Task {} interrupted before completion; it stays pending", key);
      return null;
    }
  }

  private void logCompletion(ResultRecord record, int done, int total) {
    LOG.info(
        "[{}/{}] {} -> {} ({} s)",
        done,
        total,
        record.key(),
        record.status(),
        String.format("%.3f", record.runtimeSeconds()));
  }

  private static String describe(Throwable cause) {
    String message = cause.getMessage();
    return message == null || message.isBlank()
        ? cause.getClass().getName()
        : cause.getClass().getName() + ": " + message;
  }

  /** Tasks ordered by (scenario id, algorithm id, config index). */
  static List<Task> crossProduct(
      Collection<ScenarioInstance> scenarios, Collection<ExecutionConfig> configs) {
    Objects.requireNonNull(scenarios, "scenarios");
    Objects.requireNonNull(configs, "configs");
    Set<String> scenarioIds = new HashSet<>();
    for (ScenarioInstance scenario : scenarios) {
      if (!scenarioIds.add(scenario.scenarioId())) {
        throw new IllegalArgumentException("Duplicate scenario id: " + scenario.scenarioId());
      }
    }
    Set<String> configIds = new HashSet<>();
    for (ExecutionConfig config : configs) {
      if (!configIds.add(config.algorithmId() + "#" + config.configIndex())) {
        throw new IllegalArgumentException(
            "Duplicate execution config: " + config.algorithmId() + "#" + config.configIndex());
      }
    }
    List<Task> tasks = new ArrayList<>(scenarios.size() * configs.size());
    for (ScenarioInstance scenario : scenarios) {
      for (ExecutionConfig config : configs) {
        tasks.add(new Task(scenario, config));
      }
    }
    tasks.sort(Comparator.comparing(Task::key));
    return tasks;
  }

  record Task(ScenarioInstance scenario, ExecutionConfig config) {
    ResultKey key() {
      return ResultKey.of(scenario, config);
    }
  }
}
