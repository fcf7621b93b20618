package dev.compass.fetch;

import java.time.Duration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/** HTTP client used for page fetches. It has no base URL; callers pass absolute URLs. */
@Configuration
public class FetchConfig {

  @Bean
  public RestClient fetchRestClient(RestClient.Builder builder, FetchProperties properties) {
    var requestFactory = new SimpleClientHttpRequestFactory();
    requestFactory.setConnectTimeout(Duration.ofMillis(properties.timeoutMs()));
    requestFactory.setReadTimeout(Duration.ofMillis(properties.timeoutMs()));
    return builder.clone().requestFactory(requestFactory).build();
  }
}
