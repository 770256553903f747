package util.log;

import exception.GraphConfigurationException;
import java.util.Locale;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.core.LoggerContext;
import org.apache.logging.log4j.core.config.Configuration;

public class LogUtils {
  /**
   * 把配置中的日志级别名解析成log4j的Level
   *
   * @param levelName 级别名，不区分大小写
   * @throws GraphConfigurationException 不认识的级别名
   */
  public static Level parseLevel(String levelName) throws GraphConfigurationException {
    Level level = levelName == null ? null : Level.getLevel(levelName.trim().toUpperCase(Locale.ROOT));
    if (level == null) {
      throw new GraphConfigurationException("unknown log level: " + levelName);
    }
    return level;
  }

  /**
   * 设置所有 Logger 的 level，包括 root logger
   *
   * @param newLevel 目标level
   */
  public static void setAllLoggerLevel(String newLevel) throws GraphConfigurationException {
    Level level = parseLevel(newLevel);
    LoggerContext ctx = (LoggerContext) LogManager.getContext(false);

    Configuration config = ctx.getConfiguration();
    config.getRootLogger().setLevel(level);
    config.getLoggers().values().forEach(loggerConfig -> loggerConfig.setLevel(level));
    ctx.updateLoggers(config);
  }
}
