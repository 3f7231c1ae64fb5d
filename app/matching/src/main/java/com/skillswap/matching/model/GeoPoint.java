package com.skillswap.matching.model;

public record GeoPoint(double latitude, double longitude) {}
