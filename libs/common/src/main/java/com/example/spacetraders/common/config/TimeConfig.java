/*
 * どこで: Common 共通設定
 * 何を: Clock と Sleeper を DI 可能にする
 * なぜ: 待機を伴う処理をテストで手動時計に差し替えるため
 */
package com.example.spacetraders.common.config;

import com.example.spacetraders.common.time.Sleeper;
import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class TimeConfig {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  public Sleeper sleeper() {
    return Sleeper.blocking();
  }
}
