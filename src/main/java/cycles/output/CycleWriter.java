package cycles.output;

import com.google.gson.Gson;
import cycles.graph.TypedGraph;
import cycles.search.Cycle;
import java.io.BufferedWriter;
import java.io.Closeable;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * 将找到的环追加写入文本文件，每行一个环，格式为JSON数组。
 *
 * <ul>
 *   <li>{@link Format#NAMES}：{@code ["A-1","B-2"]}
 *   <li>{@link Format#IDS}：{@code [0,1]}
 * </ul>
 *
 * 写names格式时需要在环被输出的那一刻查询顶点名，所以要在搜索把顶点删除之前构建一份名字表。
 */
public class CycleWriter implements Closeable {

  public enum Format {
    NAMES,
    IDS;

    public static Format of(String name) {
      return valueOf(name.trim().toUpperCase(Locale.ROOT));
    }
  }

  /** 将对象按json格式输出 */
  private final Gson gson = new Gson();

  private final BufferedWriter writer;
  private final Format format;

  /** 顶点id -> 顶点名，id是稠密分配的，直接用列表保存 */
  private final List<String> names;

  private long written = 0;

  /**
   * @param targetPath 输出文件，不存在时创建，存在时追加
   * @param format 输出格式
   * @param graph 在搜索开始之前的图，用于查询顶点名
   */
  public CycleWriter(String targetPath, Format format, TypedGraph graph) throws IOException {
    this.writer =
        Files.newBufferedWriter(
            Paths.get(targetPath),
            StandardCharsets.UTF_8,
            StandardOpenOption.CREATE,
            StandardOpenOption.APPEND);
    this.format = format;
    this.names = snapshotNames(graph);
  }

  private static List<String> snapshotNames(TypedGraph graph) {
    List<String> names = new ArrayList<>();
    for (int v : graph.vertexSet()) {
      while (names.size() <= v) {
        names.add(null);
      }
      names.set(v, graph.nameOf(v));
    }
    return names;
  }

  public String render(Cycle cycle) {
    if (format == Format.IDS) {
      return gson.toJson(cycle.getVertices());
    }
    List<String> rendered = new ArrayList<>(cycle.size());
    for (int v : cycle.getVertices()) {
      rendered.add(v < names.size() && names.get(v) != null ? names.get(v) : String.valueOf(v));
    }
    return gson.toJson(rendered);
  }

  public void write(Cycle cycle) throws IOException {
    writer.write(render(cycle));
    writer.newLine();
    written++;
  }

  public long getWritten() {
    return written;
  }

  @Override
  public void close() throws IOException {
    writer.close();
  }
}
