package util.log;

import org.apache.commons.lang3.exception.ExceptionUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/** 输出致命错误，附带完整的异常栈 */
public class ExceptionLogger {
  private static final Logger logger = LogManager.getLogger(ExceptionLogger.class);

  public static void error(String msg, Throwable e) {
    logger.error("{}\n{}", msg, ExceptionUtils.getStackTrace(e));
  }

  /** 异常及其所有cause的消息，用于写入诊断文件 */
  public static String describe(Throwable e) {
    return ExceptionUtils.getThrowableList(e).stream()
        .map(ExceptionUtils::getMessage)
        .reduce((outer, inner) -> outer + " <- " + inner)
        .orElse("");
  }
}
