package com.lux032.songresolver.model;

import lombok.Value;

import java.util.List;

/**
 * 指纹查询响应中的一个顶层结果
 * audioScore 为 AcoustID 给出的声学匹配度 (0-1)，与元数据质量无关
 */
@Value
public class LookupResult {
    double audioScore;
    List<Recording> recordings;
}
