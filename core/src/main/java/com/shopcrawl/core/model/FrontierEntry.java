package com.shopcrawl.core.model;

import java.net.URI;
import java.util.Objects;

/** 프론티어 대기열 원소: 정규화된 절대 URL + 발견 깊이(0 = 시드) */
public record FrontierEntry(URI url, int depth) {
    public FrontierEntry {
        Objects.requireNonNull(url, "url");
        if (depth < 0) throw new IllegalArgumentException("depth must be >= 0");
    }
}
