package cycles.search;

import cycles.graph.TypedGraph;
import exception.GraphConfigurationException;
import java.util.Objects;
import lombok.Getter;
import org.apache.commons.lang3.StringUtils;

/**
 * 环路长度限制。
 *
 * <ul>
 *   <li>limitLength &lt; 0：不限制
 *   <li>limitType为null：路径上的顶点数超过limitLength之后不再扩展
 *   <li>limitType不为null：只统计类型等于limitType的顶点，其数目超过limitLength之后不再扩展，其他类型的顶点不受限制
 * </ul>
 */
@Getter
public final class PathLimit {

  public static final PathLimit UNLIMITED = new PathLimit(-1, null);

  private final int limitLength;
  private final String limitType;

  public PathLimit(int limitLength, String limitType) {
    this.limitLength = limitLength;
    this.limitType = limitType;
  }

  public static PathLimit ofLength(int limitLength) {
    return new PathLimit(limitLength, null);
  }

  /**
   * 解析命令行传入的长度限制
   *
   * @param limitLength 整数形式的字符串，null或空串表示不限制
   * @param limitType 计数的顶点类型，null或空串表示统计所有顶点
   * @throws GraphConfigurationException limitLength不是整数
   */
  public static PathLimit parse(String limitLength, String limitType)
      throws GraphConfigurationException {
    int length = -1;
    if (StringUtils.isNotBlank(limitLength)) {
      try {
        length = Integer.parseInt(limitLength.trim());
      } catch (NumberFormatException e) {
        throw new GraphConfigurationException(
            String.format("limit '%s' is not an integer", limitLength), e);
      }
    }
    return new PathLimit(length, StringUtils.isBlank(limitType) ? null : limitType);
  }

  public boolean isUnlimited() {
    return limitLength < 0;
  }

  /** 顶点是否计入限制 */
  public boolean counts(TypedGraph graph, int vertex) {
    return limitType == null || limitType.equals(graph.typeOf(vertex));
  }

  /**
   * 当前路径是否还允许继续扩展
   *
   * @param counted 路径上计入限制的顶点数
   */
  public boolean permits(int counted) {
    return isUnlimited() || counted <= limitLength;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof PathLimit)) {
      return false;
    }
    PathLimit other = (PathLimit) o;
    return limitLength == other.limitLength && Objects.equals(limitType, other.limitType);
  }

  @Override
  public int hashCode() {
    return Objects.hash(limitLength, limitType);
  }

  @Override
  public String toString() {
    if (isUnlimited()) {
      return "unlimited";
    }
    return limitType == null
        ? String.format("at most %d vertices", limitLength)
        : String.format("at most %d vertices of type '%s'", limitLength, limitType);
  }
}
