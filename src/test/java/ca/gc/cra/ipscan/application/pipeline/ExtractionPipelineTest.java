package ca.gc.cra.ipscan.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.ipscan.domain.address.AddressClassifier;
import ca.gc.cra.ipscan.domain.address.ChunkResult;
import ca.gc.cra.ipscan.domain.address.ChunkScanner;
import ca.gc.cra.ipscan.domain.address.ClassificationRules;
import ca.gc.cra.ipscan.domain.address.ExtractionResult;
import ca.gc.cra.ipscan.testutil.LogCapture;
import ca.gc.cra.ipscan.testutil.RecordingMetricsPort;
import ch.qos.logback.classic.Level;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ExtractionPipelineTest {
  private static final int LINE_WIDTH = 40;

  @TempDir Path tempDir;

  private final RecordingMetricsPort metrics = new RecordingMetricsPort();

  @Test
  void extractsClassifiesAndSortsAccessLog() throws IOException {
    Path log = Files.writeString(tempDir.resolve("access.log"),
        "192.168.1.10 - - [10/Oct/2024:13:55:36] \"GET / HTTP/1.1\" 200\n"
            + "8.8.8.8 - - [10/Oct/2024:13:55:37] \"GET /a HTTP/1.1\" 404\n"
            + "10.0.0.5 forwarded-for 203.0.113.7\n"
            + "192.168.1.10 - - [10/Oct/2024:13:55:38] \"GET /b HTTP/1.1\" 200\n"
            + "bogus 999.1.1.1 and 0.0.0.0 and 224.0.0.1\n",
        StandardCharsets.US_ASCII);

    ExtractionResult result = pipeline(1024, 2).extract(log);

    assertEquals(List.of("10.0.0.5", "192.168.1.10"), result.privateAddresses());
    assertEquals(List.of("203.0.113.7", "8.8.8.8"), result.publicAddresses());
    assertEquals(List.of("0.0.0.0", "224.0.0.1"), result.excludedAddresses());
    assertEquals(1, metrics.count("scan.chunks.submitted"));
    assertEquals(List.of(Files.size(log)), metrics.observed("scan.bytes.read"));
    assertEquals(1, metrics.observed("scan.run.latencyNanos").size());
  }

  @Test
  void repeatedPrivateAddressOnOneLineIsStoredOnce() throws IOException {
    Path log = Files.writeString(tempDir.resolve("single.log"),
        "req from 10.0.0.5 and 8.8.8.8 and 10.0.0.5 failed", StandardCharsets.US_ASCII);

    ExtractionResult result = pipeline(1024, 2).extract(log);

    assertEquals(List.of("10.0.0.5"), result.privateAddresses());
    assertEquals(List.of("8.8.8.8"), result.publicAddresses());
    assertEquals(List.of(), result.excludedAddresses());
  }

  @Test
  void resultDoesNotDependOnChunkSizeOrWorkers() throws IOException {
    Path log = fixedWidthLog(200);

    ExtractionResult reference = pipeline(LINE_WIDTH * 1000, 1).extract(log);
    for (int lines : new int[] {1, 3, 7, 64}) {
      for (int workers : new int[] {1, 2, 4}) {
        ExtractionResult result = pipeline(LINE_WIDTH * lines, workers).extract(log);
        assertEquals(reference, result, "lines=" + lines + ", workers=" + workers);
      }
    }
    assertEquals(100, reference.privateAddresses().size());
    assertEquals(100, reference.publicAddresses().size());
  }

  @Test
  void manyChunksWithFewWorkersAllMerge() throws IOException {
    Path log = fixedWidthLog(500);

    ExtractionResult result = pipeline(LINE_WIDTH, 1).extract(log);

    assertEquals(500, result.privateAddresses().size() + result.publicAddresses().size());
    assertEquals(500, metrics.count("scan.chunks.submitted"));
  }

  @Test
  void literalSplitAcrossChunksIsNotRecovered() throws IOException {
    Path log = Files.writeString(tempDir.resolve("split.log"), "8.8.8.8 ", StandardCharsets.US_ASCII);

    assertTrue(pipeline(4, 1).extract(log).isEmpty());
  }

  @Test
  void missingFileLogsInvalidFileAndReturnsEmpty() {
    Path missing = tempDir.resolve("missing.log");
    try (LogCapture capture = LogCapture.attach(ExtractionPipeline.class)) {
      ExtractionResult result = pipeline(1024, 2).extract(missing);

      assertTrue(result.isEmpty());
      assertTrue(capture.contains(Level.ERROR, "Invalid file: " + missing));
    }
    assertEquals(1, metrics.count("scan.input.invalid"));
  }

  @Test
  void emptyFileAndDirectoryAreInvalidInputs() throws IOException {
    Path empty = Files.createFile(tempDir.resolve("empty.log"));
    Path directory = Files.createDirectory(tempDir.resolve("logs"));

    assertTrue(pipeline(1024, 2).extract(empty).isEmpty());
    assertTrue(pipeline(1024, 2).extract(directory).isEmpty());
    assertEquals(2, metrics.count("scan.input.invalid"));
  }

  @Test
  void interruptedCallerGetsEmptyResultAndKeepsFlag() throws IOException {
    Path log = fixedWidthLog(50);

    Thread.currentThread().interrupt();
    try {
      ExtractionResult result = pipeline(LINE_WIDTH, 1).extract(log);

      assertTrue(result.isEmpty());
      assertTrue(Thread.currentThread().isInterrupted());
      assertEquals(1, metrics.count("scan.run.failed"));
    } finally {
      Thread.interrupted();
    }
  }

  @Test
  void classifyChunkPartitionsLiterals() {
    ChunkResult chunk = pipeline(16, 1).classifyChunk(
        "10.1.1.1 1.1.1.1 255.255.255.255 10.1.1.1".getBytes(StandardCharsets.US_ASCII));

    assertEquals(Set.of("10.1.1.1"), chunk.privateAddresses());
    assertEquals(Set.of("1.1.1.1"), chunk.publicAddresses());
    assertEquals(Set.of("255.255.255.255"), chunk.excludedAddresses());
  }

  @Test
  void rejectsNonPositiveSizes() {
    assertThrows(IllegalArgumentException.class, () -> pipeline(0, 1));
    assertThrows(IllegalArgumentException.class, () -> pipeline(1, 0));
  }

  private ExtractionPipeline pipeline(int chunkSize, int workers) {
    return new ExtractionPipeline(
        new ChunkScanner(ChunkScanner.defaultPattern()),
        new AddressClassifier(ClassificationRules.defaults()),
        chunkSize,
        workers,
        metrics);
  }

  private Path fixedWidthLog(int lines) throws IOException {
    StringBuilder content = new StringBuilder();
    for (int i = 0; i < lines; i++) {
      String address = i % 2 == 0
          ? "10.0." + (i / 256) + "." + (i % 256)
          : "81.2." + (i / 256) + "." + (i % 256);
      String line = address + " GET /item/" + i;
      content.append(String.format("%-" + (LINE_WIDTH - 1) + "s", line)).append('\n');
    }
    return Files.writeString(tempDir.resolve("fixed-" + lines + ".log"), content, StandardCharsets.US_ASCII);
  }
}
