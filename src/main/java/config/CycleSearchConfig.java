package config;

import exception.GraphConfigurationException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Paths;
import cycles.output.CycleWriter;
import lombok.Cleanup;
import lombok.Data;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

/** 环路搜索工具的配置项，从yml文件中读入，未配置的项使用默认值 */
@Data
public class CycleSearchConfig {

  /** classpath上的默认配置文件 */
  public static final String DEFAULT_RESOURCE = "cycles.yml";

  /** 指定外部配置文件的系统属性 */
  public static final String CONFIG_PROPERTY = "cycles.config";

  /** 边表文件的列分隔符 */
  private String csvDelimiter = ";";

  /** 顶点名中类型前缀的分隔符 */
  private String typeDelimiter = "-";

  private String sourceColumn = "source";
  private String targetColumn = "target";

  /** 环的输出格式：names输出顶点名，ids输出顶点id */
  private String outputFormat = "names";

  private String logLevel = "info";

  /** 是否在诊断文件中记录每一个找到的环 */
  private boolean logCycles = false;

  public static CycleSearchConfig parse(String configPath)
      throws IOException, GraphConfigurationException {
    if (configPath.endsWith("yml") || configPath.endsWith("yaml")) {
      @Cleanup InputStream is = Files.newInputStream(Paths.get(configPath));
      return parseYAML(is);
    } else {
      throw new GraphConfigurationException("unsupported config file format: " + configPath);
    }
  }

  /**
   * 读取配置：系统属性cycles.config指定了文件就读取该文件，否则读取classpath上的cycles.yml，都没有时使用默认值
   */
  public static CycleSearchConfig load() throws IOException, GraphConfigurationException {
    String configPath = System.getProperty(CONFIG_PROPERTY);
    if (configPath != null) {
      return parse(configPath);
    }
    InputStream is = CycleSearchConfig.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE);
    if (is == null) {
      return new CycleSearchConfig();
    }
    try (InputStream resource = is) {
      return parseYAML(resource);
    }
  }

  /**
   * @throws GraphConfigurationException yml语法错误、配置项名字拼错或者配置项取值不合法
   */
  private static CycleSearchConfig parseYAML(InputStream is) throws GraphConfigurationException {
    Yaml yaml = new Yaml(new Constructor(CycleSearchConfig.class, new LoaderOptions()));
    CycleSearchConfig config;
    try {
      config = yaml.load(is);
    } catch (YAMLException e) {
      throw new GraphConfigurationException("invalid config: " + e.getMessage(), e);
    }
    if (config == null) {
      config = new CycleSearchConfig();
    }
    config.validate();
    return config;
  }

  public void validate() throws GraphConfigurationException {
    if (csvDelimiter == null || csvDelimiter.isEmpty()) {
      throw new GraphConfigurationException("csvDelimiter must not be empty");
    }
    if (typeDelimiter == null || typeDelimiter.isEmpty()) {
      throw new GraphConfigurationException("typeDelimiter must not be empty");
    }
    if (outputFormat == null) {
      throw new GraphConfigurationException("outputFormat must be 'names' or 'ids'");
    }
    try {
      CycleWriter.Format.of(outputFormat);
    } catch (IllegalArgumentException e) {
      throw new GraphConfigurationException(
          "outputFormat must be 'names' or 'ids', got '" + outputFormat + "'", e);
    }
  }
}
