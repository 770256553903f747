package cycles.diagnostics;

import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.function.Supplier;
import lombok.Getter;
import org.apache.commons.io.FileUtils;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * 将诊断事件输出到log4j，并加上时间戳追加写入诊断文件。
 *
 * <p>如果诊断文件无法写入，失败原因和原本要写的消息会写入同目录下的 {@code <file>.<时间戳>.err} 文件；如果这个文件也无法写入，抛出 {@link
 * UncheckedIOException}。
 */
public class TimestampedFileSink implements DiagnosticsSink {

  private static final Logger logger = LogManager.getLogger(TimestampedFileSink.class);

  static final DateTimeFormatter MESSAGE_TIME = DateTimeFormatter.ofPattern("dd/MM/yyyy HH:mm:ss");
  static final DateTimeFormatter ERROR_FILE_TIME =
      DateTimeFormatter.ofPattern("yyyy.MM.dd.HH.mm.ss.SSSSSS");

  /** 诊断文件，为null时只输出到log4j */
  @Getter private final File logFile;

  private final Supplier<LocalDateTime> clock;

  public TimestampedFileSink(String logFile) {
    this(StringUtils.isBlank(logFile) ? null : new File(logFile), LocalDateTime::now);
  }

  TimestampedFileSink(File logFile, Supplier<LocalDateTime> clock) {
    this.logFile = logFile;
    this.clock = clock;
  }

  @Override
  public void recordEvent(String message) {
    // log4j的输出格式里已经带有时间
    logger.info(message);
    String line = String.format("[%s] %s", clock.get().format(MESSAGE_TIME), message);

    if (logFile == null) {
      return;
    }
    try {
      FileUtils.writeStringToFile(logFile, line + System.lineSeparator(), StandardCharsets.UTF_8, true);
    } catch (IOException e) {
      writeFallback(e, line);
    }
  }

  private void writeFallback(IOException cause, String line) {
    File errorFile =
        new File(logFile.getPath() + "." + clock.get().format(ERROR_FILE_TIME) + ".err");
    logger.warn("cannot write diagnostics to {}, falling back to {}", logFile, errorFile);
    try {
      FileUtils.writeStringToFile(
          errorFile,
          cause + System.lineSeparator() + line + System.lineSeparator(),
          StandardCharsets.UTF_8,
          true);
    } catch (IOException e) {
      e.addSuppressed(cause);
      throw new UncheckedIOException("cannot write diagnostics error file " + errorFile, e);
    }
  }
}
