/*
 * どこで: Matching アプリのエントリポイント
 * 何を: Spring Boot の起動と設定プロパティのスキャンを行う
 * なぜ: マッチング/ミーティング/デモ生成の API を単一アプリとして起動するため
 */
package com.skillswap.matching;

import com.skillswap.common.config.RuntimeConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.annotation.Import;

@SpringBootApplication
@ConfigurationPropertiesScan
@Import(RuntimeConfig.class)
public class MatchingApplication {

  public static void main(String[] args) {
    SpringApplication.run(MatchingApplication.class, args);
  }
}
