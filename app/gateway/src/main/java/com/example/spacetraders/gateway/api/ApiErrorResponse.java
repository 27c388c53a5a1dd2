/*
 * どこで: Gateway API
 * 何を: エラー応答の標準フォーマットを定義する
 * なぜ: 下流のステータスとメッセージを呼び出し元へ同じ形で返すため
 */
package com.example.spacetraders.gateway.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiErrorResponse(String code, String message, Integer remoteStatus) {

  public ApiErrorResponse(String code, String message) {
    this(code, message, null);
  }
}
