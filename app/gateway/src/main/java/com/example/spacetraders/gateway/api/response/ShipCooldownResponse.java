/*
 * どこで: Gateway API DTO
 * 何を: 船のクールダウン状態を返す
 * なぜ: 204(クールダウンなし)をエラーではなく active=false として表現するため
 */
package com.example.spacetraders.gateway.api.response;

import com.example.spacetraders.gateway.model.ShipCooldown;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ShipCooldownResponse(
    boolean active,
    String shipSymbol,
    Long totalSeconds,
    Long remainingSeconds,
    String expiration) {

  public static ShipCooldownResponse inactive(String shipSymbol) {
    return new ShipCooldownResponse(false, shipSymbol, null, null, null);
  }

  public static ShipCooldownResponse from(ShipCooldown cooldown) {
    return new ShipCooldownResponse(
        true,
        cooldown.shipSymbol(),
        cooldown.totalSeconds(),
        cooldown.remainingSeconds(),
        cooldown.expiration());
  }
}
