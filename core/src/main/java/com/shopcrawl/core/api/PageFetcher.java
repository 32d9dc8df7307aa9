package com.shopcrawl.core.api;

import com.shopcrawl.core.http.FetchException;
import com.shopcrawl.core.model.FetchMode;
import com.shopcrawl.core.model.FetchedPage;

import java.net.URI;

/**
 * 페이지 취득 능력(1회 시도). 모드별로 구현이 하나씩 있고
 * RetryingFetcher 가 모드 플래그로 골라 쓴다.
 * 일시 오류는 TransientFetchException, 재시도 무의미한 오류는 PermanentFetchException.
 */
public interface PageFetcher extends AutoCloseable {
    FetchMode mode();

    FetchedPage fetch(URI url) throws FetchException, InterruptedException;

    @Override default void close() throws Exception {}
}
