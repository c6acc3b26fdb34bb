package com.example.perks.service;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.http.HttpMethod.POST;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import com.example.perks.config.PerksBillingProperties;
import com.example.perks.model.PeriodKey;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;

class HttpBillingSyncPortTest {

  private static final String REFRESH_URL = "http://billing.test/v1/subscribers/sub-1/refreshes";
  private static final PeriodKey PERIOD = new PeriodKey(2024, 2);

  @Test
  void onRefreshPostsSubscriberAndPeriod() {
    final PortFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo(REFRESH_URL))
        .andExpect(method(POST))
        .andExpect(content().json("{\"subscriber_id\":\"sub-1\",\"period\":\"2024-02\"}"))
        .andRespond(withSuccess());

    assertThatCode(() -> fixture.port.onRefresh("sub-1", PERIOD)).doesNotThrowAnyException();

    fixture.server.verify();
  }

  @Test
  void onRefreshMaps404ToNotFound() {
    final PortFixture fixture = newFixture();
    fixture.server.expect(requestTo(REFRESH_URL)).andRespond(withStatus(HttpStatus.NOT_FOUND));

    assertThatThrownBy(() -> fixture.port.onRefresh("sub-1", PERIOD))
        .isInstanceOf(BillingSyncException.class)
        .extracting(ex -> ((BillingSyncException) ex).reason())
        .isEqualTo(BillingSyncException.Reason.NOT_FOUND);
  }

  @Test
  void onRefreshMaps5xxToBadGateway() {
    final PortFixture fixture = newFixture();
    fixture.server.expect(requestTo(REFRESH_URL)).andRespond(withServerError());

    assertThatThrownBy(() -> fixture.port.onRefresh("sub-1", PERIOD))
        .isInstanceOf(BillingSyncException.class)
        .extracting(ex -> ((BillingSyncException) ex).reason())
        .isEqualTo(BillingSyncException.Reason.BAD_GATEWAY);
  }

  @Test
  void onRefreshMapsTimeoutToTimeout() {
    final PortFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo(REFRESH_URL))
        .andRespond(
            request -> {
              throw new ResourceAccessException(
                  "read timeout", new SocketTimeoutException("Read timed out"));
            });

    assertThatThrownBy(() -> fixture.port.onRefresh("sub-1", PERIOD))
        .isInstanceOf(BillingSyncException.class)
        .extracting(ex -> ((BillingSyncException) ex).reason())
        .isEqualTo(BillingSyncException.Reason.TIMEOUT);
  }

  @Test
  void onRefreshMapsConnectionFailureToBadGateway() {
    final PortFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo(REFRESH_URL))
        .andRespond(
            request -> {
              throw new ResourceAccessException(
                  "connection refused", new ConnectException("Connection refused"));
            });

    assertThatThrownBy(() -> fixture.port.onRefresh("sub-1", PERIOD))
        .isInstanceOf(BillingSyncException.class)
        .extracting(ex -> ((BillingSyncException) ex).reason())
        .isEqualTo(BillingSyncException.Reason.BAD_GATEWAY);
  }

  private PortFixture newFixture() {
    final RestClient.Builder builder = RestClient.builder();
    final MockRestServiceServer server = MockRestServiceServer.bindTo(builder).build();
    final RestClient restClient = builder.baseUrl("http://billing.test").build();
    final PerksBillingProperties properties =
        new PerksBillingProperties(
            true, "http://billing.test", "/v1/subscribers/{subscriberId}/refreshes");
    return new PortFixture(new HttpBillingSyncPort(restClient, properties), server);
  }

  private record PortFixture(HttpBillingSyncPort port, MockRestServiceServer server) {}
}
