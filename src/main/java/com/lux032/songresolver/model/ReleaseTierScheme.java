package com.lux032.songresolver.model;

/**
 * 发行分级方案
 * FIVE_TIER: NONE < MIX < COMPILATION < SINGLE < ALBUM
 * TWO_TIER: NONE < SINGLE < ALBUM
 */
public enum ReleaseTierScheme {
    FIVE_TIER,
    TWO_TIER
}
