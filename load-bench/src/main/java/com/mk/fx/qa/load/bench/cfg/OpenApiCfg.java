package com.mk.fx.qa.load.bench.cfg;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.tags.Tag;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiCfg {

  @Bean
  public OpenAPI loadBenchOpenApi(
      @Value("${spring.application.name:qps-load-bench}") String applicationName,
      @Value("${load.runs.concurrency:1}") int runConcurrency) {
    var description =
        "Submit, monitor and cancel rate-controlled HTTP load runs. "
            + "At most "
            + runConcurrency
            + " run(s) execute at once; further submissions are queued.";
    return new OpenAPI()
        .info(new Info().title(applicationName + " API").version("v1").description(description))
        .addTagsItem(
            new Tag().name("Load Runs").description("Run lifecycle, live metrics and reports"));
  }
}
