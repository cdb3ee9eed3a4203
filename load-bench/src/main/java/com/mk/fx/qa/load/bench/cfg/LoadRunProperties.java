package com.mk.fx.qa.load.bench.cfg;

import com.mk.fx.qa.load.bench.model.LoadRunDefinition;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Settings of the one-shot command-line run. The run happens only when {@code load.run.url} is
 * set; value checks happen when the settings are mapped onto a {@link LoadRunDefinition}.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "load.run")
public class LoadRunProperties {

  private String url;
  private String method = "GET";
  private Double qps;
  private int durationSeconds = LoadRunDefinition.DEFAULT_DURATION_SECONDS;
  private int concurrency = LoadRunDefinition.DEFAULT_CONCURRENCY;
  private int timeoutSeconds = LoadRunDefinition.DEFAULT_TIMEOUT_SECONDS;
  private Map<String, String> headers = new LinkedHashMap<>();
  private String body;
  private int expectedStatus = LoadRunDefinition.DEFAULT_EXPECTED_STATUS;
  private String auth;

  /** Summary file path; blank disables writing. */
  private String output = "test_report";

  private boolean verbose = true;
}
