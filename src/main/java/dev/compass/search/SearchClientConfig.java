package dev.compass.search;

import dev.compass.search.provider.SyntheticSearchProvider;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/**
 * Wires the outbound HTTP clients for the search providers and assembles the {@link SearchChain}.
 *
 * <p>Each provider gets its own {@link RestClient} qualified by name, sharing the connect and read
 * timeouts from {@code compass.search.*}.
 */
@Configuration
public class SearchClientConfig {

  @Bean
  public RestClient tavilyRestClient(RestClient.Builder builder, SearchProperties properties) {
    return client(builder, properties, properties.tavilyBaseUrl(), MediaType.APPLICATION_JSON);
  }

  @Bean
  public RestClient wikipediaRestClient(RestClient.Builder builder, SearchProperties properties) {
    return client(builder, properties, properties.wikipediaBaseUrl(), MediaType.APPLICATION_JSON);
  }

  @Bean
  public RestClient arxivRestClient(RestClient.Builder builder, SearchProperties properties) {
    return client(builder, properties, properties.arxivBaseUrl(), MediaType.APPLICATION_ATOM_XML);
  }

  @Bean
  public RestClient googleRestClient(RestClient.Builder builder, SearchProperties properties) {
    return client(builder, properties, properties.googleBaseUrl(), MediaType.APPLICATION_JSON);
  }

  @Bean
  public RestClient bingRestClient(RestClient.Builder builder, SearchProperties properties) {
    return client(builder, properties, properties.bingBaseUrl(), MediaType.APPLICATION_JSON);
  }

  @Bean
  public SearchChain searchChain(
      List<SearchProvider> providers,
      Clock clock,
      @Qualifier("searchExecutor") ExecutorService searchExecutor,
      SearchProperties properties) {
    return new SearchChain(
        providers,
        new SyntheticSearchProvider(clock),
        searchExecutor,
        properties.providerTimeout(),
        properties.backoff());
  }

  private static RestClient client(
      RestClient.Builder builder, SearchProperties properties, String baseUrl, MediaType accept) {
    var requestFactory = new SimpleClientHttpRequestFactory();
    requestFactory.setConnectTimeout(Duration.ofMillis(properties.connectTimeoutMs()));
    requestFactory.setReadTimeout(Duration.ofMillis(properties.readTimeoutMs()));

    return builder
        .clone()
        .baseUrl(baseUrl)
        .requestFactory(requestFactory)
        .defaultHeader(HttpHeaders.ACCEPT, accept.toString())
        .defaultHeader(HttpHeaders.USER_AGENT, "compass-router/0.1")
        .build();
  }
}
