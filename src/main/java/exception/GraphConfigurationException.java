package exception;

/**
 * 输入图或搜索参数不合法时抛出，例如无向图、非整数的环长度限制、缺失的边表列。
 *
 * <p>Always raised before any cycle search starts.
 */
public class GraphConfigurationException extends Exception {
  public GraphConfigurationException() {
    super();
  }

  public GraphConfigurationException(String message) {
    super(message);
  }

  public GraphConfigurationException(String message, Throwable cause) {
    super(message, cause);
  }

  public GraphConfigurationException(Throwable cause) {
    super(cause);
  }
}
