package io;

import config.CycleSearchConfig;
import cycles.graph.TypedGraph;
import exception.GraphConfigurationException;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.function.Function;
import java.util.regex.Pattern;
import lombok.Cleanup;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * 从分隔符文本文件中读取有向边表，构建 {@link TypedGraph}。
 *
 * <p>文件第一行是表头，按列名找到起点列和终点列，其他列被忽略；字段不支持引号。顶点id按第一次出现的顺序分配，顶点类型是顶点名中第一个类型分隔符之前的部分。
 */
public class EdgeListReader {

  private static final Logger logger = LogManager.getLogger(EdgeListReader.class);

  private static final char BYTE_ORDER_MARK = '\uFEFF';

  private final String delimiter;
  private final String typeDelimiter;
  private final String sourceColumn;
  private final String targetColumn;

  public EdgeListReader(CycleSearchConfig config) {
    this(
        config.getCsvDelimiter(),
        config.getTypeDelimiter(),
        config.getSourceColumn(),
        config.getTargetColumn());
  }

  public EdgeListReader(
      String delimiter, String typeDelimiter, String sourceColumn, String targetColumn) {
    this.delimiter = delimiter;
    this.typeDelimiter = typeDelimiter;
    this.sourceColumn = sourceColumn;
    this.targetColumn = targetColumn;
  }

  /** 顶点名到顶点类型的映射：第一个分隔符之前的部分，没有分隔符时就是顶点名本身 */
  public Function<String, String> typeFunction() {
    return name -> StringUtils.substringBefore(name, typeDelimiter);
  }

  public TypedGraph read(String path) throws IOException, GraphConfigurationException {
    @Cleanup
    Reader reader =
        new InputStreamReader(Files.newInputStream(Paths.get(path)), StandardCharsets.UTF_8);
    return read(reader, path);
  }

  /**
   * @param source 边表内容
   * @param sourceName 用于错误信息的来源名
   */
  public TypedGraph read(Reader source, String sourceName)
      throws IOException, GraphConfigurationException {
    BufferedReader br = new BufferedReader(source);
    String[] header = split(stripByteOrderMark(br.readLine()));
    if (header.length == 0 || (header.length == 1 && header[0].isEmpty())) {
      throw new GraphConfigurationException(sourceName + ": missing header line");
    }
    int sourceIndex = columnIndex(header, sourceColumn, sourceName);
    int targetIndex = columnIndex(header, targetColumn, sourceName);
    int required = Math.max(sourceIndex, targetIndex) + 1;

    TypedGraph.Builder builder = TypedGraph.builder(typeFunction());
    String line;
    int lineNumber = 1;
    while ((line = br.readLine()) != null) {
      lineNumber++;
      if (StringUtils.isBlank(line)) {
        continue;
      }
      String[] fields = split(line);
      if (fields.length < required) {
        throw new GraphConfigurationException(
            String.format(
                "%s:%d: expected at least %d fields but found %d",
                sourceName, lineNumber, required, fields.length));
      }
      builder.edge(fields[sourceIndex].trim(), fields[targetIndex].trim());
    }

    TypedGraph graph = builder.build();
    logger.debug("read {} edge rows from {}: {}", builder.edgeRows(), sourceName, graph);
    return graph;
  }

  private String[] split(String line) {
    if (line == null) {
      return new String[0];
    }
    return line.split(Pattern.quote(delimiter), -1);
  }

  private static String stripByteOrderMark(String line) {
    if (line != null && !line.isEmpty() && line.charAt(0) == BYTE_ORDER_MARK) {
      return line.substring(1);
    }
    return line;
  }

  private static int columnIndex(String[] header, String column, String sourceName)
      throws GraphConfigurationException {
    for (int i = 0; i < header.length; i++) {
      if (header[i].trim().equals(column)) {
        return i;
      }
    }
    throw new GraphConfigurationException(
        String.format(
            "%s: column '%s' not found in header %s", sourceName, column, Arrays.toString(header)));
  }
}
