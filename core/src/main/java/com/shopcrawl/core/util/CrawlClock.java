package com.shopcrawl.core.util;

/** 벽시계 추상화(데드라인/스크롤 타임아웃 판정용). */
@FunctionalInterface
public interface CrawlClock {
    long nowMillis();

    CrawlClock SYSTEM = System::currentTimeMillis;
}
