package dev.compass.fetch;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withResourceNotFound;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

class ContentFetcherTest {

  private static final String PAGE =
      """
      <html>
        <head><title>Ignored title</title><meta name="description" content="meta"><style>p{}</style></head>
        <body>
          <header>Site header</header>
          <nav>Home | About</nav>
          <article><h1>Tokyo weather</h1><p>Sunny&nbsp;and   warm.</p></article>
          <aside>Ads</aside>
          <script>track()</script>
          <footer>Copyright</footer>
        </body>
      </html>
      """;

  private final RestClient.Builder builder = RestClient.builder();
  private final MockRestServiceServer server = MockRestServiceServer.bindTo(builder).build();

  private ContentFetcher fetcher(int maxChars, List<String> userAgents) {
    return fetcher(maxChars, 2_097_152, userAgents);
  }

  private ContentFetcher fetcher(int maxChars, int maxBytes, List<String> userAgents) {
    return new ContentFetcher(
        builder.build(),
        new FetchProperties(true, maxChars, maxBytes, 1000, Duration.ZERO, userAgents));
  }

  @Test
  void returnsVisibleTextWithoutNonContentMarkup() {
    server
        .expect(requestTo("https://weather.example/tokyo"))
        .andExpect(header("User-Agent", "agent-a"))
        .andRespond(withSuccess(PAGE, MediaType.TEXT_HTML));

    assertThat(fetcher(3000, List.of("agent-a")).fetchText("https://weather.example/tokyo"))
        .hasValue("Ignored title Tokyo weather Sunny and warm.");
  }

  @Test
  void textIsTruncatedToMaxChars() {
    server
        .expect(requestTo("https://weather.example/tokyo"))
        .andRespond(withSuccess(PAGE, MediaType.TEXT_HTML));

    assertThat(fetcher(13, List.of("agent-a")).fetchText("https://weather.example/tokyo"))
        .hasValue("Ignored title");
  }

  @Test
  void userAgentsAreRotatedPerRequest() {
    server
        .expect(requestTo("https://a.example/1"))
        .andExpect(header("User-Agent", "agent-a"))
        .andRespond(withSuccess("<p>one</p>", MediaType.TEXT_HTML));
    server
        .expect(requestTo("https://a.example/2"))
        .andExpect(header("User-Agent", "agent-b"))
        .andRespond(withSuccess("<p>two</p>", MediaType.TEXT_HTML));
    server
        .expect(requestTo("https://a.example/3"))
        .andExpect(header("User-Agent", "agent-a"))
        .andRespond(withSuccess("<p>three</p>", MediaType.TEXT_HTML));

    ContentFetcher fetcher = fetcher(3000, List.of("agent-a", "agent-b"));
    fetcher.fetchText("https://a.example/1");
    fetcher.fetchText("https://a.example/2");
    fetcher.fetchText("https://a.example/3");

    server.verify();
  }

  @Test
  void httpErrorYieldsEmpty() {
    server.expect(requestTo("https://gone.example/")).andRespond(withResourceNotFound());

    assertThat(fetcher(3000, List.of("agent-a")).fetchText("https://gone.example/")).isEmpty();
  }

  @Test
  void pageWithoutTextYieldsEmpty() {
    server
        .expect(requestTo("https://blank.example/"))
        .andRespond(withSuccess("<script>only()</script>", MediaType.TEXT_HTML));

    assertThat(fetcher(3000, List.of("agent-a")).fetchText("https://blank.example/")).isEmpty();
  }

  @Test
  void bodyIsReadOnlyUpToMaxBytes() {
    String page = "<p>" + "a".repeat(10) + "b".repeat(100_000) + "</p>";
    server
        .expect(requestTo("https://huge.example/"))
        .andRespond(withSuccess(page, MediaType.TEXT_HTML));

    assertThat(fetcher(50, 13, List.of("agent-a")).fetchText("https://huge.example/"))
        .hasValue("aaaaaaaaaa");
  }

  @Test
  void readStopsAtMaxBytes() throws IOException {
    byte[] body = new byte[50_000];

    byte[] read =
        ContentFetcher.readBounded(
            new ByteArrayInputStream(body), 100, System.nanoTime() + Duration.ofSeconds(5).toNanos());

    assertThat(read).hasSize(100);
  }

  @Test
  void readStopsOnceDeadlinePasses() throws IOException {
    byte[] body = new byte[50_000];

    byte[] read =
        ContentFetcher.readBounded(new ByteArrayInputStream(body), 1_000_000, System.nanoTime() - 1);

    assertThat(read).hasSize(ContentFetcher.BUFFER_SIZE);
  }

  @Test
  void bodyIsDecodedWithDeclaredCharset() {
    server
        .expect(requestTo("https://latin.example/"))
        .andRespond(
            withSuccess(
                "<p>caf\u00e9</p>".getBytes(StandardCharsets.ISO_8859_1),
                MediaType.parseMediaType("text/html;charset=ISO-8859-1")));

    assertThat(fetcher(3000, List.of("agent-a")).fetchText("https://latin.example/"))
        .hasValue("caf\u00e9");
  }

  @ParameterizedTest
  @NullAndEmptySource
  @ValueSource(strings = {"ftp://files.example/a", "mailto:someone@example.com", "not a url", "/relative"})
  void unusableUrlsAreNotRequested(String url) {
    assertThat(fetcher(3000, List.of("agent-a")).fetchText(url)).isEmpty();

    server.verify();
  }
}
