package com.skillswap.matching.service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.random.RandomGenerator;

/** RandomGenerator を使ったシャッフル/抽出の小道具。乱数源を注入してテストで固定できるようにする。 */
final class RandomSelections {

  private RandomSelections() {}

  /** Fisher-Yates でシャッフルした新しいリストを返す。 */
  static <T> List<T> shuffled(Collection<T> values, RandomGenerator random) {
    final List<T> list = new ArrayList<>(values);
    for (int i = list.size() - 1; i > 0; i--) {
      final int j = random.nextInt(i + 1);
      final T tmp = list.get(i);
      list.set(i, list.get(j));
      list.set(j, tmp);
    }
    return list;
  }

  static <T> T pick(List<T> values, RandomGenerator random) {
    if (values.isEmpty()) {
      throw new IllegalArgumentException("cannot pick from an empty list");
    }
    return values.get(random.nextInt(values.size()));
  }

  /** [min, max] の一様な整数。 */
  static int between(int min, int max, RandomGenerator random) {
    return min + random.nextInt(max - min + 1);
  }
}
