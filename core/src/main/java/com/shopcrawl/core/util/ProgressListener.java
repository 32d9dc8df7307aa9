package com.shopcrawl.core.util;

@FunctionalInterface
public interface ProgressListener {
    /**
     * @param progress 0.0~1.0 (모르면 0.0)
     * @param phase    "crawl" | "export" 또는 막 끝난 도메인 이름
     * @param done     종료된 도메인 수(모르면 -1)
     * @param total    전체 도메인 수(모르면 -1)
     */
    void onProgress(double progress, String phase, long done, long total);

    ProgressListener NONE = (p, phase, d, t) -> {};
}
