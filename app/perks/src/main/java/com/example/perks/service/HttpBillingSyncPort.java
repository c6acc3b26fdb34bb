/*
 * どこで: Perks サービス層
 * 何を: リフレッシュ発生を課金プロバイダの HTTP API へ同期する
 * なぜ: 課金側の請求期間と特典付与月を揃えるため
 */
package com.example.perks.service;

import com.example.perks.config.PerksBillingProperties;
import com.example.perks.model.PeriodKey;
import com.example.perks.service.dto.BillingRefreshRequest;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.net.SocketTimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

@Component
@ConditionalOnProperty(name = "perks.billing.enabled", havingValue = "true")
public class HttpBillingSyncPort implements BillingSyncPort {

  private static final Logger logger = LoggerFactory.getLogger(HttpBillingSyncPort.class);

  private final RestClient billingRestClient;
  private final PerksBillingProperties properties;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "RestClient は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  public HttpBillingSyncPort(
      @Qualifier("billingRestClient") RestClient billingRestClient,
      PerksBillingProperties properties) {
    this.billingRestClient = billingRestClient;
    this.properties = properties;
  }

  @Override
  public void onRefresh(String subscriberId, PeriodKey period) {
    try {
      billingRestClient
          .post()
          .uri(properties.refreshPath(), subscriberId)
          .contentType(MediaType.APPLICATION_JSON)
          .body(new BillingRefreshRequest(subscriberId, period.toString()))
          .retrieve()
          .toBodilessEntity();
      logger.info("billing sync completed subscriberId={} period={}", subscriberId, period);
    } catch (RestClientResponseException ex) {
      throw mapResponseException(ex);
    } catch (ResourceAccessException ex) {
      throw mapResourceException(ex);
    }
  }

  private BillingSyncException mapResponseException(RestClientResponseException ex) {
    logger.warn(
        "billing sync failed with http status={} statusText={}",
        ex.getStatusCode().value(),
        ex.getStatusText());
    if (ex.getStatusCode().value() == 404) {
      return new BillingSyncException(
          BillingSyncException.Reason.NOT_FOUND, "billing subscriber not found", ex);
    }
    if (ex.getStatusCode().is5xxServerError()) {
      return new BillingSyncException(
          BillingSyncException.Reason.BAD_GATEWAY, "billing server error", ex);
    }
    return new BillingSyncException(
        BillingSyncException.Reason.BAD_GATEWAY, "billing request failed", ex);
  }

  private BillingSyncException mapResourceException(ResourceAccessException ex) {
    if (isTimeout(ex)) {
      logger.warn("billing sync timed out");
      return new BillingSyncException(
          BillingSyncException.Reason.TIMEOUT, "billing request timeout", ex);
    }
    logger.warn("billing sync connection failed", ex);
    return new BillingSyncException(
        BillingSyncException.Reason.BAD_GATEWAY, "billing connection failed", ex);
  }

  private boolean isTimeout(ResourceAccessException ex) {
    Throwable current = ex;
    while (current != null) {
      if (current instanceof SocketTimeoutException) {
        return true;
      }
      current = current.getCause();
    }
    return false;
  }
}
