/*
 * どこで: Matching サービス
 * 何を: 有効なスキル名の固定リスト (順序付き) を提供し、入力スキルを検証する
 * なぜ: カタログ外のスキルを変更前に 400 として弾くため
 */
package com.skillswap.matching.service;

import com.skillswap.matching.api.InvalidSkillSwapRequestException;
import com.skillswap.matching.config.SkillCatalogProperties;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.springframework.stereotype.Component;

@Component
public class SkillCatalog {

  private final List<String> skills;
  private final Set<String> skillSet;

  public SkillCatalog(SkillCatalogProperties properties) {
    final Set<String> distinct = new LinkedHashSet<>();
    for (String skill : properties.catalog()) {
      if (skill == null || skill.isBlank()) {
        throw new IllegalStateException("skill catalog must not contain blank names");
      }
      distinct.add(skill.trim());
    }
    this.skills = List.copyOf(distinct);
    this.skillSet = Set.copyOf(distinct);
  }

  public List<String> skills() {
    return skills;
  }

  public int size() {
    return skills.size();
  }

  public boolean contains(String skill) {
    return skill != null && skillSet.contains(skill);
  }

  /**
   * 役割: 入力されたスキル名を検証し、重複を除いた集合を返す。
   * 動作: カタログ外の名前があれば field を付けてまとめて報告する。
   */
  public Set<String> requireValid(String field, Collection<String> requested) {
    if (requested == null) {
      throw new InvalidSkillSwapRequestException(field, "is required");
    }
    final List<String> invalid = new ArrayList<>();
    final Set<String> valid = new LinkedHashSet<>();
    for (String skill : requested) {
      if (contains(skill)) {
        valid.add(skill);
      } else {
        invalid.add(String.valueOf(skill));
      }
    }
    if (!invalid.isEmpty()) {
      throw new InvalidSkillSwapRequestException(
          field, "unknown skills " + String.join(", ", invalid));
    }
    return valid;
  }

  /** カタログ順に並べ替える。カタログ外の名前は落とす。 */
  public List<String> inCatalogOrder(Collection<String> values) {
    return skills.stream().filter(values::contains).toList();
  }
}
