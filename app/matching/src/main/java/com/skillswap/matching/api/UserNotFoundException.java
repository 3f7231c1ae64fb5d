package com.skillswap.matching.api;

public class UserNotFoundException extends RuntimeException {
  public UserNotFoundException(long userId) {
    super("user not found: " + userId);
  }
}
