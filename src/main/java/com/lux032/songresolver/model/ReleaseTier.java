package com.lux032.songresolver.model;

/**
 * 发行类型的可信度等级，按声明顺序由低到高
 */
public enum ReleaseTier {
    NONE,
    MIX,
    COMPILATION,
    SINGLE,
    ALBUM;

    public boolean isAtLeast(ReleaseTier other) {
        return compareTo(other) >= 0;
    }

    /**
     * 解析配置中的等级名称，大小写不敏感
     */
    public static ReleaseTier fromName(String name) {
        return valueOf(name.trim().toUpperCase());
    }
}
