package evaluation.batch;

import static evaluation.testing.TestData.config;
import static evaluation.testing.TestData.scenario;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import evaluation.archive.InMemoryResultArchive;
import evaluation.archive.ResultArchive;
import evaluation.core.ExecutionConfig;
import evaluation.core.ResultKey;
import evaluation.core.ResultRecord;
import evaluation.core.ScenarioInstance;
import evaluation.core.TaskStatus;
import evaluation.core.payload.RawPayload;
import evaluation.solve.AlgorithmAdapter;
import evaluation.solve.AlgorithmAdapters;
import evaluation.solve.SolverException;
import evaluation.testing.TestData;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

final class BatchRunnerTest {

  private static final List<ScenarioInstance> SCENARIOS =
      List.of(
          scenario("S1", "number_of_requests", 20),
          scenario("S2", "number_of_requests", 40),
          scenario("S3", "number_of_requests", 60));
  private static final List<ExecutionConfig> CONFIGS =
      List.of(config("MIP_MCF", 0), config("MIP_MCF", 1), config("MIP_MCF", 2));

  @Test
  void everyPairProducesExactlyOneRecord() throws Exception {
    for (int concurrency : new int[] {1, 4}) {
      CountingAdapter adapter = new CountingAdapter();
      ResultArchive archive =
          new BatchRunner(AlgorithmAdapters.of(adapter))
              .run(SCENARIOS, CONFIGS, concurrency, Duration.ofSeconds(30));

      assertEquals(9, archive.size(), "3 scenarios x 3 configs at concurrency " + concurrency);
      assertEquals(9, adapter.calls.get(), "Each task solved once");
      for (ScenarioInstance s : SCENARIOS) {
        for (ExecutionConfig c : CONFIGS) {
          ResultRecord record = archive.find(ResultKey.of(s, c)).orElseThrow();
          assertEquals(TaskStatus.SUCCESS, record.status(), "Task " + record.key() + " succeeded");
        }
      }
    }
  }

  @Test
  void archivedTasksAreNotExecutedAgain() throws Exception {
    CountingAdapter adapter = new CountingAdapter();
    BatchRunner runner = new BatchRunner(AlgorithmAdapters.of(adapter));
    InMemoryResultArchive archive = new InMemoryResultArchive();
    BatchOptions options = new BatchOptions(2, Duration.ofSeconds(30));

    BatchSummary first = runner.run(SCENARIOS, CONFIGS, options, archive);
    List<ResultRecord> before = archive.records();
    BatchSummary second = runner.run(SCENARIOS, CONFIGS, options, archive);

    assertEquals(9, first.succeeded(), "First run executes everything");
    assertEquals(9, second.skipped(), "Second run skips everything");
    assertEquals(0, second.executed(), "Nothing executed twice");
    assertEquals(9, adapter.calls.get(), "Adapter invoked once per task overall");
    assertEquals(before, archive.records(), "Archive unchanged by the second run");
  }

  @Test
  void resumeRunsOnlyMissingTasks() throws Exception {
    CountingAdapter adapter = new CountingAdapter();
    InMemoryResultArchive archive = new InMemoryResultArchive();
    archive.append(
        ResultRecord.success(new ResultKey("S1", "MIP_MCF", 0), TestData.mipPayload(1.0), 1.0));

    BatchSummary summary =
        new BatchRunner(AlgorithmAdapters.of(adapter))
            .run(SCENARIOS, CONFIGS, new BatchOptions(3, Duration.ofSeconds(30)), archive);

    assertEquals(1, summary.skipped(), "Pre-archived task skipped");
    assertEquals(8, adapter.calls.get(), "Only missing tasks executed");
    assertEquals(9, archive.size(), "Archive complete after resume");
  }

  @Test
  void slowTaskTimesOutWithoutBlockingSiblings() throws Exception {
    CountDownLatch never = new CountDownLatch(1);
    ResultKey slow = new ResultKey("S1", "MIP_MCF", 0);
    AlgorithmAdapter adapter =
        new FunctionAdapter(
            "MIP_MCF",
            (scenario, cfg) -> {
              if (scenario.scenarioId().equals("S1") && cfg.configIndex() == 0) {
                never.await();
              }
              return TestData.mipPayload(10.0);
            });

    ResultArchive archive =
        new BatchRunner(AlgorithmAdapters.of(adapter))
            .run(SCENARIOS, CONFIGS, 2, Duration.ofMillis(300));

    ResultRecord timedOut = archive.find(slow).orElseThrow();
    assertEquals(TaskStatus.TIMEOUT, timedOut.status(), "Slow task recorded as timeout");
    assertEquals(0.3, timedOut.runtimeSeconds(), 1e-9, "Runtime equals the timeout");
    assertEquals(9, archive.size(), "Siblings still complete");
    assertEquals(
        8,
        archive.records().stream().filter(ResultRecord::succeeded).count(),
        "All other tasks succeed");
  }

  @Test
  void unresponsiveAdapterIsAbandoned() throws Exception {
    AtomicInteger spinning = new AtomicInteger();
    Map<String, Boolean> release = new ConcurrentHashMap<>();
    AlgorithmAdapter adapter =
        new FunctionAdapter(
            "MIP_MCF",
            (scenario, cfg) -> {
              if (cfg.configIndex() == 1) {
                spinning.incrementAndGet();
                while (!release.containsKey("go")) {
                  Thread.onSpinWait();
                }
              }
              return TestData.mipPayload(10.0);
            });
    try {
      ResultArchive archive =
          new BatchRunner(AlgorithmAdapters.of(adapter))
              .run(SCENARIOS, CONFIGS, 1, Duration.ofMillis(200));

      assertEquals(9, archive.size(), "Batch finishes although solver threads ignore interrupts");
      assertEquals(
          3,
          archive.records().stream().filter(r -> r.status() == TaskStatus.TIMEOUT).count(),
          "Every config-1 task timed out");
      assertEquals(3, spinning.get(), "Each stuck task was started once");
    } finally {
      release.put("go", Boolean.TRUE);
    }
  }

  @Test
  void adapterFailureBecomesErrorRecord() throws Exception {
    AlgorithmAdapter adapter =
        new FunctionAdapter(
            "MIP_MCF",
            (scenario, cfg) -> {
              if (cfg.configIndex() == 2) {
                throw new SolverException("infeasible model");
              }
              if (scenario.scenarioId().equals("S3") && cfg.configIndex() == 1) {
                throw new IllegalStateException("adapter bug");
              }
              return TestData.mipPayload(10.0);
            });
    InMemoryResultArchive archive = new InMemoryResultArchive();

    BatchSummary summary =
        new BatchRunner(AlgorithmAdapters.of(adapter))
            .run(SCENARIOS, CONFIGS, new BatchOptions(4, Duration.ofSeconds(30)), archive);

    assertEquals(5, summary.succeeded(), "Unaffected tasks succeed");
    assertEquals(4, summary.errored(), "Three solver errors and one runtime failure");
    assertTrue(summary.hasFailures(), "Summary flags the failures");
    ResultRecord error = archive.find(new ResultKey("S1", "MIP_MCF", 2)).orElseThrow();
    assertEquals(TaskStatus.ERROR, error.status(), "Solver exception recorded as error");
    assertEquals(
        SolverException.class.getName() + ": infeasible model",
        error.diagnostic(),
        "Diagnostic carries exception class and message");
    assertTrue(
        archive
            .find(new ResultKey("S3", "MIP_MCF", 1))
            .orElseThrow()
            .diagnostic()
            .contains("adapter bug"),
        "Runtime exceptions are diagnosed too");
  }

  @Test
  void missingAdapterYieldsErrorRecords() throws Exception {
    List<ExecutionConfig> configs = List.of(config("MIP_MCF", 0), config("RR", 0));
    ResultArchive archive =
        new BatchRunner(AlgorithmAdapters.of(new CountingAdapter()))
            .run(SCENARIOS, configs, 2, Duration.ofSeconds(30));

    ResultRecord rr = archive.find(new ResultKey("S2", "RR", 0)).orElseThrow();
    assertEquals(TaskStatus.ERROR, rr.status(), "No adapter, no result");
    assertNotNull(rr.diagnostic(), "Diagnostic explains the missing adapter");
    assertEquals(6, archive.size(), "Both algorithms produce records");
  }

  @Test
  void rejectsInvalidOptions() {
    BatchRunner runner = new BatchRunner(AlgorithmAdapters.of());
    assertThrows(
        IllegalArgumentException.class,
        () -> runner.run(SCENARIOS, CONFIGS, 0, Duration.ofSeconds(1)));
    assertThrows(
        IllegalArgumentException.class, () -> runner.run(SCENARIOS, CONFIGS, 1, Duration.ZERO));
    assertThrows(
        IllegalArgumentException.class,
        () ->
            runner.run(
                SCENARIOS, List.of(config("RR", 0), config("RR", 0)), 1, Duration.ofSeconds(1)));
  }

  @Test
  void emptyInputsProduceEmptyArchive() throws Exception {
    ResultArchive archive =
        new BatchRunner(AlgorithmAdapters.of()).run(List.of(), CONFIGS, 2, Duration.ofSeconds(1));
    assertEquals(0, archive.size(), "No scenarios, no tasks");
  }

  @FunctionalInterface
  private interface Solve {
    RawPayload apply(ScenarioInstance scenario, ExecutionConfig config)
        throws SolverException, InterruptedException;
  }

  private static final class FunctionAdapter implements AlgorithmAdapter {
    private final String algorithmId;
    private final Solve solve;

    FunctionAdapter(String algorithmId, Solve solve) {
      this.algorithmId = algorithmId;
      this.solve = solve;
    }

    @Override
    public String algorithmId() {
      return algorithmId;
    }

    @Override
    public RawPayload solve(ScenarioInstance scenario, ExecutionConfig config)
        throws SolverException, InterruptedException {
      return solve.apply(scenario, config);
    }
  }

  private static final class CountingAdapter implements AlgorithmAdapter {
    final AtomicInteger calls = new AtomicInteger();

    @Override
    public String algorithmId() {
      return "MIP_MCF";
    }

    @Override
    public RawPayload solve(ScenarioInstance scenario, ExecutionConfig config) {
      calls.incrementAndGet();
      return TestData.mipPayload(scenario.generationParameters().size() * 10.0);
    }
  }
}
