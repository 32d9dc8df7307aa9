package com.shopcrawl.core.api;

import com.shopcrawl.core.model.CrawlResult;

/** 크롤러 최소 계약: 한 도메인을 끝까지(또는 종료 조건까지) 돌고 결과를 돌려준다. */
public interface ICrawler {
    String domain();

    CrawlResult crawl();
}
