package com.shopcrawl.core.http;

import java.net.URI;

/** 429 를 제외한 4xx, 잘못된 URL 등. 재시도하지 않고 URL 을 건너뛴다. */
public class PermanentFetchException extends FetchException {

    public PermanentFetchException(URI url, int statusCode, String message) {
        super(url, statusCode, message, null);
    }

    public PermanentFetchException(URI url, String message, Throwable cause) {
        super(url, -1, message, cause);
    }

    @Override public Kind kind() { return Kind.PERMANENT; }
}
