package io;

import java.io.File;

/** 一次环路搜索涉及的文件路径 */
public class IOPath {

  public final String edgesInput;
  public final String cyclesOutput;

  /** 诊断文件，位于输出文件旁边 */
  public final String logFile;

  public IOPath(String edgesInput, String cyclesOutput) {
    super();
    this.edgesInput = edgesInput;
    this.cyclesOutput = cyclesOutput;
    this.logFile = String.format("%s.log", cyclesOutput);
  }

  /** 确保输出文件所在的目录存在 */
  public void prepareOutput() {
    File parentFile = new File(cyclesOutput).getAbsoluteFile().getParentFile();
    if (parentFile != null && !parentFile.exists()) {
      parentFile.mkdirs();
    }
  }
}
