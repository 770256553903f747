package cycles.diagnostics;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.apache.commons.io.FileUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.core.LogEvent;
import org.apache.logging.log4j.core.LoggerContext;
import org.apache.logging.log4j.core.appender.AbstractAppender;
import org.apache.logging.log4j.core.config.LoggerConfig;
import org.apache.logging.log4j.core.config.Property;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class TimestampedFileSinkTest {

  private static final LocalDateTime NOW = LocalDateTime.of(2021, 10, 5, 14, 3, 9, 123456000);

  @Rule public TemporaryFolder folder = new TemporaryFolder();

  @Test
  public void appendsTimestampedLines() throws IOException {
    File log = new File(folder.getRoot(), "cycles.txt.log");
    TimestampedFileSink sink = new TimestampedFileSink(log, () -> NOW);
    sink.recordEvent("graph created");
    sink.recordEvent("TOTAL = 3 cycles");

    List<String> lines = FileUtils.readLines(log, StandardCharsets.UTF_8);
    assertEquals(
        Arrays.asList("[05/10/2021 14:03:09] graph created", "[05/10/2021 14:03:09] TOTAL = 3 cycles"),
        lines);
  }

  /** 收集日志消息的appender */
  private static class CollectingAppender extends AbstractAppender {
    private final List<String> messages = new ArrayList<>();

    CollectingAppender() {
      super("collecting", null, null, true, Property.EMPTY_ARRAY);
    }

    @Override
    public void append(LogEvent event) {
      messages.add(event.getMessage().getFormattedMessage());
    }
  }

  @Test
  public void logsMessageWithoutTimestamp() throws IOException {
    LoggerContext ctx = (LoggerContext) LogManager.getContext(false);
    LoggerConfig loggerConfig =
        ctx.getConfiguration().getLoggerConfig(TimestampedFileSink.class.getName());
    CollectingAppender appender = new CollectingAppender();
    appender.start();
    loggerConfig.addAppender(appender, null, null);
    ctx.updateLoggers();
    try {
      File log = new File(folder.getRoot(), "cycles.txt.log");
      new TimestampedFileSink(log, () -> NOW).recordEvent("TOTAL = 3 cycles");

      assertEquals(Arrays.asList("TOTAL = 3 cycles"), appender.messages);
      assertEquals(
          Arrays.asList("[05/10/2021 14:03:09] TOTAL = 3 cycles"),
          FileUtils.readLines(log, StandardCharsets.UTF_8));
    } finally {
      loggerConfig.removeAppender(appender.getName());
      ctx.updateLoggers();
      appender.stop();
    }
  }

  @Test
  public void fallsBackToErrorFile() throws IOException {
    File log = folder.newFolder("blocked.log");
    TimestampedFileSink sink = new TimestampedFileSink(log, () -> NOW);
    sink.recordEvent("intended message");

    File errorFile = new File(folder.getRoot(), "blocked.log.2021.10.05.14.03.09.123456.err");
    assertTrue(errorFile.exists());
    List<String> lines = FileUtils.readLines(errorFile, StandardCharsets.UTF_8);
    assertEquals(2, lines.size());
    assertEquals("[05/10/2021 14:03:09] intended message", lines.get(1));
  }

  @Test(expected = UncheckedIOException.class)
  public void failsWhenErrorFileCannotBeWrittenEither() throws IOException {
    File notADirectory = folder.newFile("plain");
    TimestampedFileSink sink =
        new TimestampedFileSink(new File(notADirectory, "sub/cycles.log"), () -> NOW);
    sink.recordEvent("lost");
  }

  @Test
  public void blankPathOnlyLogs() {
    TimestampedFileSink sink = new TimestampedFileSink(" ");
    sink.recordEvent("console only");
    assertEquals(null, sink.getLogFile());
  }
}
