package com.mk.fx.qa.load.bench;

import com.mk.fx.qa.load.bench.cli.LoadRunCommandLineRunner;
import java.util.Arrays;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.context.ApplicationContext;

/**
 * Starts the run API, or performs a single command-line run and exits when {@code load.run.url}
 * is given.
 */
@SpringBootApplication
public class LoadBenchApplication {

  public static void main(String[] args) {
    var builder = new SpringApplicationBuilder(LoadBenchApplication.class);
    if (isCommandLineRun(args)) {
      builder.web(WebApplicationType.NONE);
    }
    var context = builder.run(args);
    // load.run.url may also be set by a config file
    if (hasCommandLineRun(context)) {
      System.exit(SpringApplication.exit(context));
    }
  }

  static boolean isCommandLineRun(String[] args) {
    return isSet(System.getenv("LOAD_RUN_URL"))
        || isSet(System.getProperty("load.run.url"))
        || Arrays.stream(args).anyMatch(arg -> arg.startsWith("--load.run.url="));
  }

  static boolean hasCommandLineRun(ApplicationContext context) {
    return context.getBeanNamesForType(LoadRunCommandLineRunner.class).length > 0;
  }

  private static boolean isSet(String value) {
    return value != null && !value.isBlank();
  }
}
