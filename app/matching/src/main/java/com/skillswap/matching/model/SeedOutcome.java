package com.skillswap.matching.model;

public enum SeedOutcome {
  /** デモモード無効のため何もしていない。 */
  SKIPPED,
  SEEDED,
  RELOCATED
}
