/*
 * どこで: Matching 設定
 * 何を: 有効なスキル名の一覧 (順序付き) を保持する
 * なぜ: スキルカタログを外部設定として差し替え可能にするため
 */
package com.skillswap.matching.config;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import jakarta.validation.constraints.NotEmpty;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "skillswap.skills")
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP",
    justification = "起動時にバインドされる設定値で、SkillCatalog 側で不変コピーを取るため")
public record SkillCatalogProperties(@NotEmpty List<String> catalog) {}
