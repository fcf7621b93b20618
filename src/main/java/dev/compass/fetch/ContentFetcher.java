package dev.compass.fetch;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * Downloads a page and reduces it to plain text.
 *
 * <p>Non-content markup (scripts, styles, navigation, footers, meta tags) is removed, whitespace is
 * collapsed and the text is cut to {@code compass.fetch.max-chars}. The body is read up to {@code
 * compass.fetch.max-bytes} and for at most {@code compass.fetch.timeout-ms}; whatever arrived by
 * then is parsed. Every failure, including a non-http URL, yields {@link Optional#empty()}.
 */
@Component
public class ContentFetcher {

  private static final Logger log = LoggerFactory.getLogger(ContentFetcher.class);

  static final String NON_CONTENT = "script,noscript,style,nav,footer,header,aside,meta";

  static final int BUFFER_SIZE = 8192;

  private static final String ACCEPT =
      "text/html,application/xhtml+xml,application/xml;q=0.9,*/*;q=0.8";

  private final RestClient restClient;
  private final int maxChars;
  private final int maxBytes;
  private final Duration readBudget;
  private final List<String> userAgents;
  private final AtomicInteger nextAgent = new AtomicInteger();

  public ContentFetcher(
      @Qualifier("fetchRestClient") RestClient restClient, FetchProperties properties) {
    this.restClient = restClient;
    this.maxChars = properties.maxChars();
    this.maxBytes = properties.maxBytes();
    this.readBudget = Duration.ofMillis(properties.timeoutMs());
    this.userAgents = properties.userAgents();
  }

  /**
   * Fetches {@code url} and returns its visible text.
   *
   * @param url absolute http or https URL
   * @return the page text, or empty when the URL is unusable, the request fails or the page has no
   *     text
   */
  public Optional<String> fetchText(@Nullable String url) {
    URI uri = httpUri(url);
    if (uri == null) {
      return Optional.empty();
    }

    String html;
    try {
      html =
          restClient
              .get()
              .uri(uri)
              .header(HttpHeaders.USER_AGENT, nextUserAgent())
              .header(HttpHeaders.ACCEPT, ACCEPT)
              .header(HttpHeaders.ACCEPT_LANGUAGE, "en-US,en;q=0.5")
              .exchange((request, response) -> readBody(response));
    } catch (RestClientException | IllegalArgumentException e) {
      log.debug("Content fetch failed for {}: {}", url, e.getMessage());
      return Optional.empty();
    }

    if (html == null || html.isBlank()) {
      return Optional.empty();
    }
    String text = extractText(html, uri.toString(), maxChars);
    if (text.isEmpty()) {
      return Optional.empty();
    }
    log.debug("Extracted {} characters from {}", text.length(), url);
    return Optional.of(text);
  }

  private @Nullable String readBody(ClientHttpResponse response) throws IOException {
    if (!response.getStatusCode().is2xxSuccessful()) {
      log.debug("Content fetch returned {}", response.getStatusCode());
      return null;
    }
    long deadline = System.nanoTime() + readBudget.toNanos();
    byte[] body = readBounded(response.getBody(), maxBytes, deadline);
    MediaType contentType = response.getHeaders().getContentType();
    Charset charset =
        contentType != null && contentType.getCharset() != null
            ? contentType.getCharset()
            : StandardCharsets.UTF_8;
    return new String(body, charset);
  }

  /** Reads until end of stream, {@code maxBytes}, or the deadline, whichever comes first. */
  static byte[] readBounded(InputStream in, int maxBytes, long deadlineNanos) throws IOException {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    byte[] buffer = new byte[BUFFER_SIZE];
    while (out.size() < maxBytes) {
      int read = in.read(buffer, 0, Math.min(buffer.length, maxBytes - out.size()));
      if (read == -1) {
        break;
      }
      out.write(buffer, 0, read);
      if (System.nanoTime() - deadlineNanos > 0) {
        log.debug("Read budget exhausted after {} bytes", out.size());
        break;
      }
    }
    return out.toByteArray();
  }

  static String extractText(String html, String baseUri, int maxChars) {
    Document document = Jsoup.parse(html, baseUri);
    document.select(NON_CONTENT).remove();
    String text = document.text().replace('\u00A0', ' ').replaceAll("\\s+", " ").strip();
    return text.length() <= maxChars ? text : text.substring(0, maxChars);
  }

  static @Nullable URI httpUri(@Nullable String url) {
    if (url == null || url.isBlank()) {
      return null;
    }
    try {
      URI uri = URI.create(url.strip());
      String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
      if ((!scheme.equals("http") && !scheme.equals("https")) || uri.getHost() == null) {
        return null;
      }
      return uri;
    } catch (IllegalArgumentException e) {
      log.debug("Rejected malformed URL {}: {}", url, e.getMessage());
      return null;
    }
  }

  private String nextUserAgent() {
    return userAgents.get(Math.floorMod(nextAgent.getAndIncrement(), userAgents.size()));
  }
}
