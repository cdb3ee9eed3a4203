package com.mk.fx.qa.load.bench.cli;

import com.mk.fx.qa.load.bench.cfg.LoadRunProperties;
import com.mk.fx.qa.load.bench.model.InvalidConfigurationException;
import com.mk.fx.qa.load.bench.model.LoadRun;
import com.mk.fx.qa.load.bench.processors.LoadRunProcessor;
import com.mk.fx.qa.load.bench.processors.LoadRunValidator;
import com.mk.fx.qa.load.bench.report.LoadReportWriter;
import com.mk.fx.qa.load.bench.resource.RunMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * One-shot run driven by {@code load.run.*} properties. Active only when {@code load.run.url} is
 * set. Exit code is 0 after a completed run, 2 for invalid configuration and 1 if the run was
 * interrupted.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "load.run", name = "url")
public class LoadRunCommandLineRunner implements ApplicationRunner, ExitCodeGenerator {

  static final int EXIT_OK = 0;
  static final int EXIT_INTERRUPTED = 1;
  static final int EXIT_INVALID_CONFIGURATION = 2;

  private final LoadRunProperties properties;
  private final RunMapper runMapper;
  private final LoadRunProcessor processor;
  private final LoadReportWriter reportWriter;

  private volatile int exitCode = EXIT_OK;

  public LoadRunCommandLineRunner(
      LoadRunProperties properties,
      RunMapper runMapper,
      LoadRunProcessor processor,
      LoadReportWriter reportWriter) {
    this.properties = properties;
    this.runMapper = runMapper;
    this.processor = processor;
    this.reportWriter = reportWriter;
  }

  @Override
  public void run(ApplicationArguments args) {
    LoadRun run;
    try {
      var definition = runMapper.toDefinition(properties);
      LoadRunValidator.validate(definition);
      run = LoadRun.of(definition);
    } catch (InvalidConfigurationException ex) {
      log.error("Invalid load run configuration: {}", ex.getMessage());
      exitCode = EXIT_INVALID_CONFIGURATION;
      return;
    }

    try {
      var report = processor.execute(run);
      reportWriter.write(report.summary, properties.getOutput(), properties.isVerbose());
      exitCode = EXIT_OK;
    } catch (InterruptedException interrupted) {
      Thread.currentThread().interrupt();
      log.warn("Run {} interrupted before it started", run.getId());
      exitCode = EXIT_INTERRUPTED;
    }
  }

  @Override
  public int getExitCode() {
    return exitCode;
  }
}
