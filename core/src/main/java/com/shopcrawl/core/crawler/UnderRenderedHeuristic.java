package com.shopcrawl.core.crawler;

import com.shopcrawl.core.model.ContentSignals;
import com.shopcrawl.core.model.CrawlConfig;

/**
 * 정적 HTML 이 JS 렌더링 전 껍데기로 보이는지 판정.
 * links &lt; minLinks 이거나 links &lt; pageKb * linksPerKb 이면 true.
 */
public final class UnderRenderedHeuristic {
    private final int minLinks;
    private final double linksPerKb;

    public UnderRenderedHeuristic(int minLinks, double linksPerKb) {
        if (minLinks < 0 || linksPerKb < 0) throw new IllegalArgumentException("thresholds must be >= 0");
        this.minLinks = minLinks;
        this.linksPerKb = linksPerKb;
    }

    public static UnderRenderedHeuristic from(CrawlConfig cfg) {
        return new UnderRenderedHeuristic(cfg.dynamic().getMinLinks(), cfg.dynamic().getLinksPerKb());
    }

    public boolean isUnderRendered(ContentSignals s) {
        int links = s.getLinks().size();
        if (links < minLinks) return true;
        double pageKb = s.getPageWeight() / 1024.0;
        return links < pageKb * linksPerKb;
    }

    public int getMinLinks() { return minLinks; }
    public double getLinksPerKb() { return linksPerKb; }
}
