/*
 * どこで: Perks サービス層 DTO
 * 何を: 課金プロバイダへ送るリフレッシュ同期リクエストを表す
 */
package com.example.perks.service.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record BillingRefreshRequest(String subscriberId, String period) {}
