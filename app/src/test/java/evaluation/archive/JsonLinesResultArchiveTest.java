package evaluation.archive;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import evaluation.core.ResultKey;
import evaluation.core.ResultRecord;
import evaluation.core.TaskStatus;
import evaluation.core.payload.MipPayload;
import evaluation.core.payload.RandRoundPayload;
import evaluation.testing.TestData;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

final class JsonLinesResultArchiveTest {

  @TempDir Path tempDir;

  private static final ResultKey MIP = new ResultKey("s1", "MIP_MCF", 0);
  private static final ResultKey RR = new ResultKey("s1", "RR", 0);
  private static final ResultKey FAILED = new ResultKey("s2", "RR", 0);

  @Test
  void reopenedArchiveHoldsEveryAppendedRecord() throws IOException {
    Path file = tempDir.resolve("nested/archive.jsonl");
    try (JsonLinesResultArchive archive = JsonLinesResultArchive.open(file)) {
      archive.append(ResultRecord.success(MIP, TestData.mipPayload(42.0), 3.5));
      archive.append(ResultRecord.success(RR, TestData.randRoundPayload(50.0), 1.0));
      archive.append(ResultRecord.error(FAILED, 0.2, "java.lang.IllegalStateException: boom"));
    }

    try (JsonLinesResultArchive archive = JsonLinesResultArchive.open(file)) {
      assertEquals(3, archive.size(), "All records survive a reopen");
      assertEquals(
          List.of(MIP, RR, FAILED),
          archive.records().stream().map(ResultRecord::key).toList(),
          "Records enumerate in key order");
      ResultRecord mip = archive.find(MIP).orElseThrow();
      assertInstanceOf(MipPayload.class, mip.payload(), "Payload variant restored from its tag");
      assertEquals(TestData.mipPayload(42.0), mip.payload(), "Payload content restored");
      assertInstanceOf(RandRoundPayload.class, archive.find(RR).orElseThrow().payload());
      ResultRecord failed = archive.find(FAILED).orElseThrow();
      assertEquals(TaskStatus.ERROR, failed.status(), "Status restored");
      assertNull(failed.payload(), "Failed record has no payload");
      assertEquals(1, archive.statusCounts().get(TaskStatus.ERROR), "One error counted");
    }
  }

  @Test
  void truncatedFinalLineIsDroppedAndArchiveStaysAppendable() throws IOException {
    Path file = tempDir.resolve("archive.jsonl");
    try (JsonLinesResultArchive archive = JsonLinesResultArchive.open(file)) {
      archive.append(ResultRecord.timeout(MIP, 5.0));
    }
    Files.writeString(
        file,
        "{\"key\":{\"scenario_id\":\"s1\",\"algorithm_id\":\"RR\"",
        StandardCharsets.UTF_8,
        StandardOpenOption.APPEND);

    try (JsonLinesResultArchive archive = JsonLinesResultArchive.open(file)) {
      assertEquals(1, archive.size(), "Only the complete record remains");
      assertFalse(archive.contains(RR), "Partial record is not archived");
      archive.append(ResultRecord.error(RR, 0.1, "retry"));
    }

    try (JsonLinesResultArchive archive = JsonLinesResultArchive.open(file)) {
      assertEquals(2, archive.size(), "Append after recovery starts on a clean line");
      assertTrue(archive.contains(RR), "Re-run record present");
    }
  }

  @Test
  void readLeavesTruncatedArchiveUntouched() throws IOException {
    Path file = tempDir.resolve("archive.jsonl");
    try (JsonLinesResultArchive archive = JsonLinesResultArchive.open(file)) {
      archive.append(ResultRecord.timeout(RR, 5.0));
      archive.append(ResultRecord.success(MIP, TestData.mipPayload(7.0), 1.0));
    }
    Files.writeString(
        file,
        "{\"key\":{\"scenario_id\":\"s2\"",
        StandardCharsets.UTF_8,
        StandardOpenOption.APPEND);
    byte[] before = Files.readAllBytes(file);

    List<ResultRecord> records = JsonLinesResultArchive.read(file);

    assertEquals(List.of(MIP, RR), records.stream().map(ResultRecord::key).toList(), "Key order");
    assertArrayEquals(before, Files.readAllBytes(file), "Reading never repairs the file");
  }

  @Test
  void readOfMissingArchiveFails() {
    Path missing = tempDir.resolve("absent.jsonl");
    assertThrows(NoSuchFileException.class, () -> JsonLinesResultArchive.read(missing));
    assertFalse(Files.exists(missing), "Reading creates nothing");
  }

  @Test
  void malformedInteriorLineIsCorruption() throws IOException {
    Path file = tempDir.resolve("archive.jsonl");
    try (JsonLinesResultArchive archive = JsonLinesResultArchive.open(file)) {
      archive.append(ResultRecord.timeout(MIP, 5.0));
    }
    List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
    Files.writeString(file, "not json\n" + lines.get(0) + "\n", StandardCharsets.UTF_8);

    ArchiveCorruptedException ex =
        assertThrows(ArchiveCorruptedException.class, () -> JsonLinesResultArchive.open(file));
    assertEquals(1, ex.lineNumber(), "Reports the offending line");
  }

  @Test
  void duplicateKeysInFileAreCorruption() throws IOException {
    Path file = tempDir.resolve("archive.jsonl");
    try (JsonLinesResultArchive archive = JsonLinesResultArchive.open(file)) {
      archive.append(ResultRecord.timeout(MIP, 5.0));
    }
    String line = Files.readAllLines(file, StandardCharsets.UTF_8).get(0);
    Files.writeString(file, line + "\n" + line + "\n", StandardCharsets.UTF_8);

    assertThrows(ArchiveCorruptedException.class, () -> JsonLinesResultArchive.open(file));
  }

  @Test
  void appendingAnExistingKeyFails() throws IOException {
    try (JsonLinesResultArchive archive =
        JsonLinesResultArchive.open(tempDir.resolve("archive.jsonl"))) {
      archive.append(ResultRecord.timeout(MIP, 5.0));
      assertThrows(
          IllegalStateException.class, () -> archive.append(ResultRecord.timeout(MIP, 6.0)));
      assertEquals(1, archive.size(), "The first record wins");
    }
  }
}
