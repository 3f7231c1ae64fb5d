/*
 * どこで: Common 共通設定
 * 何を: Clock と RandomGenerator を DI 可能にする
 * なぜ: 時刻と乱数をテストから固定できるようにするため
 */
package com.skillswap.common.config;

import java.security.SecureRandom;
import java.time.Clock;
import java.util.random.RandomGenerator;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class RuntimeConfig {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  // デモデータ生成用。暗号用途ではないが、共有インスタンスでもスレッド安全な実装を選ぶ
  @Bean
  public RandomGenerator randomGenerator() {
    return new SecureRandom();
  }
}
