package cycles.main;

import config.CycleSearchConfig;
import cycles.diagnostics.DiagnosticsSink;
import cycles.diagnostics.TimestampedFileSink;
import cycles.graph.TypedGraph;
import cycles.output.CycleWriter;
import cycles.search.Cycle;
import cycles.search.JohnsonSimpleCycles;
import cycles.search.PathLimit;
import exception.CycleSearchException;
import exception.GraphConfigurationException;
import io.EdgeListReader;
import io.IOPath;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Iterator;
import java.util.Locale;
import java.util.concurrent.TimeUnit;
import lombok.Cleanup;
import org.apache.commons.lang3.time.DurationFormatUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import util.log.ExceptionLogger;
import util.log.LogUtils;

/** 命令行入口：读取边表，搜索所有简单环，逐个追加写入输出文件 */
public class CycleSearch {

  private static final Logger logger = LogManager.getLogger(CycleSearch.class);

  public static void main(String[] args) {
    // 0.解析命令行参数
    if (args.length < 2) {
      printUsageAndExit();
    }
    IOPath ioPath = new IOPath(args[0], args[1]);
    String limitLength = args.length >= 3 ? args[2] : "-1";
    String limitType = args.length >= 4 ? args[3] : null;

    int status = run(ioPath, limitLength, limitType);
    if (status != 0) {
      System.exit(status);
    }
  }

  public static void printUsageAndExit() {
    System.err.println(
        "Usage: java -jar $jarfile edges_csv cycles_output [cycle_limit_length [cycle_limit_node_type]]");
    System.err.println("Description:");
    System.err.println("       edges_csv: edge list with a header line, e.g. source;target");
    System.err.println("       cycles_output: file the cycles are appended to, one per line");
    System.err.println("       cycle_limit_length: maximum number of vertices in a cycle, -1 (default) for no limit");
    System.err.println("       cycle_limit_node_type: only vertices of this type count against the limit");
    System.err.println("Example: java -jar $jarfile ./edges.csv ./cycles.txt 8");
    System.exit(-1);
  }

  /**
   * 执行一次完整的环路搜索，诊断信息写入输出文件旁边的.log文件
   *
   * @return 进程退出码，0表示成功
   */
  public static int run(IOPath ioPath, String limitLength, String limitType) {
    DiagnosticsSink diagnostics = new TimestampedFileSink(ioPath.logFile);
    int status = 0;
    long startTS = System.nanoTime();

    try {
      diagnostics.recordEvent("Start of cycle search");
      diagnostics.recordEvent("edges input: " + ioPath.edgesInput);
      diagnostics.recordEvent("cycles output: " + ioPath.cyclesOutput);
      diagnostics.recordEvent("cycle limit length: " + limitLength);
      diagnostics.recordEvent("cycle limit node type: " + limitType);

      // 1.初始化配置信息，所有配置错误都在搜索开始之前报告
      CycleSearchConfig config = CycleSearchConfig.load();
      LogUtils.setAllLoggerLevel(config.getLogLevel());
      PathLimit limit = PathLimit.parse(limitLength, limitType);

      // 2.搜索并输出
      search(ioPath, limit, config, diagnostics);
    } catch (GraphConfigurationException
        | IOException
        | UncheckedIOException
        | CycleSearchException e) {
      ExceptionLogger.error("cycle search aborted", e);
      try {
        diagnostics.recordEvent("Exception: " + ExceptionLogger.describe(e));
      } catch (UncheckedIOException suppressed) {
        logger.error("cannot record the failure in the diagnostics file", suppressed);
      }
      status = 1;
    }

    long elapsedNanos = System.nanoTime() - startTS;
    try {
      diagnostics.recordEvent(status == 0 ? "Processing finished!" : "Processing aborted!");
      diagnostics.recordEvent(elapsed(elapsedNanos));
    } catch (UncheckedIOException e) {
      logger.error("cannot record the summary in the diagnostics file", e);
      status = 1;
    }
    return status;
  }

  /**
   * 读取边表构建图，然后把找到的每个环追加写入输出文件
   *
   * @return 找到的环数目
   */
  static long search(
      IOPath ioPath, PathLimit limit, CycleSearchConfig config, DiagnosticsSink diagnostics)
      throws IOException, GraphConfigurationException {
    TypedGraph graph = new EdgeListReader(config).read(ioPath.edgesInput);
    diagnostics.recordEvent(
        String.format(
            "graph created (%d vertices, %d edges, %d self-loops dropped, %d duplicate edges merged)",
            graph.vertexCount(),
            graph.edgeCount(),
            graph.getDroppedSelfLoops(),
            graph.getDuplicateEdges()));

    ioPath.prepareOutput();
    @Cleanup
    CycleWriter writer =
        new CycleWriter(
            ioPath.cyclesOutput, CycleWriter.Format.of(config.getOutputFormat()), graph);

    JohnsonSimpleCycles finder = new JohnsonSimpleCycles(graph, limit, diagnostics);
    Iterator<Cycle> cycles = finder.cycles();
    while (cycles.hasNext()) {
      Cycle cycle = cycles.next();
      writer.write(cycle);
      if (config.isLogCycles()) {
        diagnostics.recordEvent(
            String.format("%d. cycle = %s", finder.getIteration(), writer.render(cycle)));
      }
    }

    diagnostics.recordEvent(String.format("TOTAL = %d cycles", finder.getCycleCount()));
    return finder.getCycleCount();
  }

  static String elapsed(long elapsedNanos) {
    long millis = TimeUnit.NANOSECONDS.toMillis(elapsedNanos);
    return String.format(
        Locale.ROOT,
        "Elapsed time: %.3f s (%s)",
        elapsedNanos / 1e9,
        DurationFormatUtils.formatDuration(millis, "HH:mm:ss.SSS"));
  }
}
