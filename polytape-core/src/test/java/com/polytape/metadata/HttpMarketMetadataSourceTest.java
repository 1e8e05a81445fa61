package com.polytape.metadata;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.polytape.http.HttpStatusException;
import com.polytape.http.JsonHttpTransport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.ArgumentMatchers;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class HttpMarketMetadataSourceTest {

  @Mock
  private HttpClient httpClient;

  @Mock
  private HttpResponse<String> response;

  private final ObjectMapper objectMapper = new ObjectMapper();
  private HttpMarketMetadataSource source;

  @BeforeEach
  void setUp() {
    source = new HttpMarketMetadataSource(URI.create("http://localhost:9000/markets"),
        new JsonHttpTransport(httpClient, objectMapper));
  }

  @Test
  void postsBatchAndReadsMarkets() throws Exception {
    when(response.statusCode()).thenReturn(200);
    when(response.body()).thenReturn("""
        {"markets":[
          {"conditionId":"0xc1","image":"https://img/1.png","volume":123},
          {"slug":"election-2028"}
        ]}
        """);
    when(httpClient.send(any(HttpRequest.class), ArgumentMatchers.<HttpResponse.BodyHandler<String>>any()))
        .thenReturn(response);

    List<MarketMetadata> markets = source.lookup(new MetadataRequest(List.of("0xc1"), List.of("election-2028")));

    assertThat(markets).hasSize(2);
    assertThat(markets.get(0).conditionId()).isEqualTo("0xc1");
    assertThat(markets.get(0).hasImage()).isTrue();
    assertThat(markets.get(1).hasImage()).isFalse();

    ArgumentCaptor<HttpRequest> captor = ArgumentCaptor.forClass(HttpRequest.class);
    verify(httpClient).send(captor.capture(), ArgumentMatchers.<HttpResponse.BodyHandler<String>>any());
    assertThat(captor.getValue().method()).isEqualTo("POST");
    assertThat(captor.getValue().uri()).isEqualTo(URI.create("http://localhost:9000/markets"));
  }

  @Test
  void emptyRequestSkipsUpstream() throws Exception {
    assertThat(source.lookup(new MetadataRequest(List.of(), null))).isEmpty();
    verifyNoInteractions(httpClient);
  }

  @Test
  void nonSuccessStatusRaises() throws Exception {
    when(response.statusCode()).thenReturn(503);
    when(response.body()).thenReturn("unavailable");
    when(httpClient.send(any(HttpRequest.class), ArgumentMatchers.<HttpResponse.BodyHandler<String>>any()))
        .thenReturn(response);

    assertThatThrownBy(() -> source.lookup(new MetadataRequest(List.of("0xc1"), List.of())))
        .isInstanceOf(HttpStatusException.class)
        .satisfies(e -> assertThat(((HttpStatusException) e).getStatusCode()).isEqualTo(503));
  }

  @Test
  void requestSerializesBothKeyLists() throws Exception {
    JsonNode json = objectMapper.readTree(new JsonHttpTransport(httpClient, objectMapper)
        .writeJson(new MetadataRequest(List.of("0xc1"), List.of("slug-a"))));

    assertThat(json.path("conditionIds").get(0).asText()).isEqualTo("0xc1");
    assertThat(json.path("eventSlugs").get(0).asText()).isEqualTo("slug-a");
  }
}
