package com.rackspace.promread.app.web;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.rackspace.promread.app.exceptions.QuerierException;
import com.rackspace.promread.app.exceptions.UnknownMetricException;
import com.rackspace.promread.app.model.Label;
import com.rackspace.promread.app.model.LabelMatcher;
import com.rackspace.promread.app.model.MatchType;
import com.rackspace.promread.app.model.QueryResult;
import com.rackspace.promread.app.model.ReadRequest;
import com.rackspace.promread.app.model.ReadResponse;
import com.rackspace.promread.app.model.Sample;
import com.rackspace.promread.app.model.TimeSeries;
import com.rackspace.promread.app.services.RemoteReadService;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.AutoConfigureWebFlux;
import org.springframework.boot.test.autoconfigure.web.reactive.AutoConfigureWebTestClient;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.HttpHeaders;
import org.springframework.test.annotation.DirtiesContext;
import org.springframework.test.annotation.DirtiesContext.ClassMode;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.reactive.server.WebTestClient;
import org.xerial.snappy.Snappy;
import reactor.core.publisher.Mono;

@ActiveProfiles("test")
@SpringBootTest(classes = {RemoteReadController.class, RestWebExceptionHandler.class,
    SimpleMeterRegistry.class})
@AutoConfigureWebTestClient
@AutoConfigureWebFlux
@DirtiesContext(classMode = ClassMode.BEFORE_EACH_TEST_METHOD)
public class RemoteReadControllerTest {

  @MockBean
  RemoteReadService remoteReadService;

  @Autowired
  MeterRegistry meterRegistry;

  @Autowired
  private WebTestClient webTestClient;

  @Test
  public void testRead() throws Exception {
    final ReadResponse response = new ReadResponse().setResults(List.of(
        new QueryResult().setTimeseries(List.of(new TimeSeries()
            .setLabels(List.of(new Label("__name__", "up")))
            .setSamples(List.of(new Sample(1, 30_000)))))));
    when(remoteReadService.read(any())).thenReturn(Mono.just(response));

    final byte[] body = webTestClient.post()
        .uri("/prom/api/v1/read")
        .contentType(RemoteReadController.PROTOBUF)
        .header(HttpHeaders.CONTENT_ENCODING, "snappy")
        .bodyValue(RemoteReadCodecTest.encodedRequest(0, 60_000,
            new LabelMatcher(MatchType.EQ, "__name__", "up")))
        .exchange()
        .expectStatus().isOk()
        .expectHeader().contentType(RemoteReadController.PROTOBUF)
        .expectHeader().valueEquals(HttpHeaders.CONTENT_ENCODING, "snappy")
        .expectBody(byte[].class)
        .returnResult().getResponseBody();

    assertThat(body).isEqualTo(RemoteReadCodec.encodeResponse(response));
    assertThat(Snappy.isValidCompressedBuffer(body)).isTrue();

    final ArgumentCaptor<ReadRequest> captor = ArgumentCaptor.forClass(ReadRequest.class);
    verify(remoteReadService).read(captor.capture());
    assertThat(captor.getValue().getQueries().get(0).getMatchers())
        .containsExactly(new LabelMatcher(MatchType.EQ, "__name__", "up"));
    assertThat(meterRegistry.get("promread.requests").tag("type", "read").counter().count())
        .isEqualTo(1);
  }

  @Test
  public void testReadUnknownMetric() throws Exception {
    when(remoteReadService.read(any()))
        .thenReturn(Mono.error(new UnknownMetricException("zz__t__m")));

    webTestClient.post()
        .uri("/prom/api/v1/read")
        .contentType(RemoteReadController.PROTOBUF)
        .bodyValue(RemoteReadCodecTest.encodedRequest(0, 60_000,
            new LabelMatcher(MatchType.EQ, "__name__", "zz__t__m")))
        .exchange()
        .expectStatus().isBadRequest()
        .expectBody()
        .jsonPath("$.status").isEqualTo(400)
        .jsonPath("$.message").isEqualTo("unknown metrics zz__t__m");
  }

  @Test
  public void testReadMalformedBody() {
    webTestClient.post()
        .uri("/prom/api/v1/read")
        .contentType(RemoteReadController.PROTOBUF)
        .bodyValue(new byte[]{(byte) 0xff, 0x01, 0x02})
        .exchange()
        .expectStatus().isBadRequest();

    verifyNoInteractions(remoteReadService);
  }

  @Test
  public void testReadQuerierFailure() throws Exception {
    when(remoteReadService.read(any()))
        .thenReturn(Mono.error(new QuerierException("Querier answered FAILED: boom")));

    webTestClient.post()
        .uri("/prom/api/v1/read")
        .contentType(RemoteReadController.PROTOBUF)
        .bodyValue(RemoteReadCodecTest.encodedRequest(0, 60_000,
            new LabelMatcher(MatchType.EQ, "__name__", "up")))
        .exchange()
        .expectStatus().is5xxServerError()
        .expectBody()
        .jsonPath("$.message").value(message ->
            assertThat((String) message).doesNotContain("boom"));
  }
}
