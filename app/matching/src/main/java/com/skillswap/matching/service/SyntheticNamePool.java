/*
 * どこで: Matching サービス補助
 * 何を: 合成ユーザー用の表示名プールを提供する
 * なぜ: 同一オーナーのコホート内で名前が重複しないようにするため
 */
package com.skillswap.matching.service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.random.RandomGenerator;
import org.springframework.stereotype.Component;

@Component
public class SyntheticNamePool {

  static final List<String> FIRST_NAMES =
      List.of(
          "Alex", "Jordan", "Taylor", "Morgan", "Casey", "Riley", "Quinn", "Avery", "Parker",
          "Sage", "Sam", "Jamie", "Drew", "Cameron", "Logan", "Emma", "Liam", "Olivia", "Noah",
          "Sophia", "James", "Mia", "Lucas", "Ava", "Ethan", "Isabella", "Mason", "Charlotte",
          "Oliver", "Amelia");

  static final List<String> SURNAMES =
      List.of(
          "Smith", "Johnson", "Williams", "Brown", "Jones", "Garcia", "Miller", "Davis",
          "Rodriguez", "Martinez", "Anderson", "Taylor", "Thomas", "Moore", "Jackson", "Martin",
          "Lee", "Thompson", "White", "Harris", "Clark", "Lewis", "Robinson", "Walker", "Young",
          "Allen", "King", "Wright", "Scott", "Green");

  private final List<String> baseNames;

  public SyntheticNamePool() {
    this(buildFullNames());
  }

  SyntheticNamePool(List<String> baseNames) {
    if (baseNames.isEmpty()) {
      throw new IllegalArgumentException("name pool must not be empty");
    }
    this.baseNames = List.copyOf(baseNames);
  }

  public int size() {
    return baseNames.size();
  }

  /**
   * 役割: count 件の名前を、既存の名前 (taken) と重複しないように払い出す。
   * 動作: プールをシャッフルして先頭から使い、尽きたら "Name 2", "Name 3" ... と接尾辞付きで再利用する。
   */
  public List<String> draw(int count, Collection<String> taken, RandomGenerator random) {
    final List<String> shuffled = RandomSelections.shuffled(baseNames, random);
    final Set<String> used = new HashSet<>(taken);
    final List<String> result = new ArrayList<>(count);
    int suffix = 1;
    int index = 0;
    while (result.size() < count) {
      if (index == shuffled.size()) {
        index = 0;
        suffix++;
      }
      final String base = shuffled.get(index++);
      final String name = suffix == 1 ? base : base + " " + suffix;
      if (used.add(name)) {
        result.add(name);
      }
    }
    return result;
  }

  private static List<String> buildFullNames() {
    final List<String> names = new ArrayList<>(FIRST_NAMES.size() * SURNAMES.size());
    for (String first : FIRST_NAMES) {
      for (String last : SURNAMES) {
        names.add(first + " " + last);
      }
    }
    return names;
  }
}
