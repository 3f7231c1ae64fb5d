package com.skillswap.matching.model;

import java.time.Instant;

/** 双方向の興味が成立している相手ユーザーと、自分側の興味表明時刻。 */
public record MutualInterestRecord(UserRecord otherUser, Instant matchedAt) {}
