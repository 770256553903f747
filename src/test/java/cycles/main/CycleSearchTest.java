package cycles.main;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import config.CycleSearchConfig;
import io.IOPath;
import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import org.apache.commons.io.FileUtils;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class CycleSearchTest {

  @Rule public TemporaryFolder folder = new TemporaryFolder();

  private File edges(String... rows) throws IOException {
    File file = folder.newFile("edges.csv");
    FileUtils.writeStringToFile(
        file, "source;target\n" + String.join("\n", rows) + "\n", StandardCharsets.UTF_8);
    return file;
  }

  @Test
  public void writesCyclesAndDiagnostics() throws IOException {
    File input = edges("A-1;B-1", "B-1;A-1", "C-1;D-1", "D-1;E-1", "E-1;F-1", "F-1;C-1");
    File output = new File(folder.getRoot(), "out/cycles.txt");

    int status = CycleSearch.run(new IOPath(input.getPath(), output.getPath()), "-1", null);
    assertEquals(0, status);

    List<String> cycles = FileUtils.readLines(output, StandardCharsets.UTF_8);
    assertEquals(2, cycles.size());
    assertTrue(cycles.contains("[\"A-1\",\"B-1\"]"));
    assertTrue(cycles.contains("[\"C-1\",\"D-1\",\"E-1\",\"F-1\"]"));

    String log = FileUtils.readFileToString(new File(output.getPath() + ".log"), StandardCharsets.UTF_8);
    assertTrue(log.contains("graph created (6 vertices, 6 edges"));
    assertTrue(log.contains("TOTAL = 2 cycles"));
    assertTrue(log.contains("Processing finished!"));
    assertTrue(log.contains("Elapsed time: "));
  }

  @Test
  public void lengthLimitFromArguments() throws IOException {
    File input = edges("A-1;B-1", "B-1;A-1", "C-1;D-1", "D-1;E-1", "E-1;F-1", "F-1;C-1");
    File output = new File(folder.getRoot(), "cycles.txt");

    assertEquals(0, CycleSearch.run(new IOPath(input.getPath(), output.getPath()), "2", null));
    assertEquals(
        Arrays.asList("[\"A-1\",\"B-1\"]"), FileUtils.readLines(output, StandardCharsets.UTF_8));
  }

  @Test
  public void typeLimitFromArguments() throws IOException {
    File input = edges("P-1;Q-1", "Q-1;Q-2", "Q-2;P-1", "P-1;P-2", "P-2;P-3", "P-3;P-1");
    File output = new File(folder.getRoot(), "cycles.txt");

    assertEquals(0, CycleSearch.run(new IOPath(input.getPath(), output.getPath()), "1", "P"));
    assertEquals(
        Arrays.asList("[\"P-1\",\"Q-1\",\"Q-2\"]"),
        FileUtils.readLines(output, StandardCharsets.UTF_8));
  }

  @Test
  public void invalidLimitAbortsBeforeSearch() throws IOException {
    File input = edges("A-1;B-1", "B-1;A-1");
    File output = new File(folder.getRoot(), "cycles.txt");

    assertEquals(1, CycleSearch.run(new IOPath(input.getPath(), output.getPath()), "two", null));
    assertFalse(output.exists());
    String log = FileUtils.readFileToString(new File(output.getPath() + ".log"), StandardCharsets.UTF_8);
    assertTrue(log.contains("Exception: GraphConfigurationException: limit 'two' is not an integer"));
    assertTrue(log.contains("Processing aborted!"));
  }

  @Test
  public void misspelledConfigKeyAbortsTheRun() throws IOException {
    File input = edges("A-1;B-1", "B-1;A-1");
    File output = new File(folder.getRoot(), "cycles.txt");
    File config = folder.newFile("typo.yml");
    FileUtils.writeStringToFile(config, "outputFromat: ids\n", StandardCharsets.UTF_8);

    System.setProperty(CycleSearchConfig.CONFIG_PROPERTY, config.getPath());
    try {
      assertEquals(1, CycleSearch.run(new IOPath(input.getPath(), output.getPath()), "-1", null));
    } finally {
      System.clearProperty(CycleSearchConfig.CONFIG_PROPERTY);
    }
    assertFalse(output.exists());
    String log = FileUtils.readFileToString(new File(output.getPath() + ".log"), StandardCharsets.UTF_8);
    assertTrue(log.contains("Exception: GraphConfigurationException: invalid config: "));
    assertTrue(log.contains("Processing aborted!"));
  }

  @Test
  public void upperCaseOutputFormatIsAccepted() throws IOException {
    File input = edges("A-1;B-1", "B-1;A-1");
    File output = new File(folder.getRoot(), "cycles.txt");
    File config = folder.newFile("ids.yml");
    FileUtils.writeStringToFile(config, "outputFormat: IDS\n", StandardCharsets.UTF_8);

    System.setProperty(CycleSearchConfig.CONFIG_PROPERTY, config.getPath());
    try {
      assertEquals(0, CycleSearch.run(new IOPath(input.getPath(), output.getPath()), "-1", null));
    } finally {
      System.clearProperty(CycleSearchConfig.CONFIG_PROPERTY);
    }
    assertEquals(Arrays.asList("[0,1]"), FileUtils.readLines(output, StandardCharsets.UTF_8));
  }

  @Test
  public void missingInputIsReported() {
    File output = new File(folder.getRoot(), "cycles.txt");
    String missing = new File(folder.getRoot(), "nope.csv").getPath();
    assertEquals(1, CycleSearch.run(new IOPath(missing, output.getPath()), "-1", null));
  }

  @Test
  public void elapsedFormat() {
    assertEquals("Elapsed time: 3723.250 s (01:02:03.250)", CycleSearch.elapsed(3_723_250_000_000L));
  }
}
