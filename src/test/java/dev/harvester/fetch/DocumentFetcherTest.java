package dev.harvester.fetch;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.RestClient;

/** Exercises fetching and parsing without the retry proxy. */
class DocumentFetcherTest {

  private static final String URL = "https://example.org/ldes/page/1";

  private MockRestServiceServer server;
  private DocumentFetcher fetcher;

  @BeforeEach
  void setUp() {
    RestClient.Builder builder = RestClient.builder();
    server = MockRestServiceServer.bindTo(builder).build();
    fetcher = new DocumentFetcher(builder.build(), new ObjectMapper());
  }

  @Test
  void fetchReturnsParsedObjectKeyedByUrl() {
    server
        .expect(requestTo(URL))
        .andExpect(method(HttpMethod.GET))
        .andRespond(
            withSuccess(
                "{\"@id\": \"https://example.org/ldes/page/1\", \"member\": []}",
                MediaType.valueOf("application/ld+json")));

    PageDocument document = fetcher.fetch(URL);

    assertThat(document.url()).isEqualTo(URL);
    assertThat(document.body().path("@id").asText()).isEqualTo(URL);
    assertThat(document.body().path("member").isArray()).isTrue();
    server.verify();
  }

  @Test
  void emptyBodyIsAParseFailure() {
    server.expect(requestTo(URL)).andRespond(withSuccess("", MediaType.APPLICATION_JSON));

    assertThatThrownBy(() -> fetcher.fetch(URL))
        .isInstanceOf(DocumentParseException.class)
        .hasMessageContaining("empty body");
  }

  @Test
  void malformedJsonIsAParseFailure() {
    server.expect(requestTo(URL)).andRespond(withSuccess("{not json", MediaType.APPLICATION_JSON));

    assertThatThrownBy(() -> fetcher.fetch(URL))
        .isInstanceOf(DocumentParseException.class)
        .satisfies(e -> assertThat(((DocumentFetchException) e).getUrl()).isEqualTo(URL));
  }

  @Test
  void topLevelArrayIsAParseFailure() {
    server.expect(requestTo(URL)).andRespond(withSuccess("[{}]", MediaType.APPLICATION_JSON));

    assertThatThrownBy(() -> fetcher.fetch(URL))
        .isInstanceOf(DocumentParseException.class)
        .hasMessageContaining("expected a JSON object");
  }

  @Test
  void serverErrorPropagatesForTheRetryLayer() {
    server.expect(requestTo(URL)).andRespond(withServerError());

    assertThatThrownBy(() -> fetcher.fetch(URL)).isInstanceOf(HttpServerErrorException.class);
  }

  @Test
  void malformedUrlFailsWithoutRequest() {
    assertThatThrownBy(() -> fetcher.fetch("https://example.org/bad path"))
        .isInstanceOf(DocumentFetchException.class)
        .isNotInstanceOf(DocumentParseException.class);
    server.verify();
  }
}
