package com.shopcrawl.core.render;

/** 드라이버 대기 시간 초과 */
public class RenderTimeoutException extends RenderException {
    public RenderTimeoutException(String message) { super(message); }
    public RenderTimeoutException(String message, Throwable cause) { super(message, cause); }
}
