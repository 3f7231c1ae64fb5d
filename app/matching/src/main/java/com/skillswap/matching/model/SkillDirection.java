package com.skillswap.matching.model;

public enum SkillDirection {
  OFFER,
  NEED
}
