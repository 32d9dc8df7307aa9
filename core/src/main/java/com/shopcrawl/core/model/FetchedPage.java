package com.shopcrawl.core.model;

import com.shopcrawl.core.api.RenderHandle;

import java.util.Objects;
import java.util.Optional;

/**
 * 한 번의 취득 결과. DYNAMIC 모드에서는 렌더 핸들을 함께 들고 있으며
 * close() 가 핸들(및 빌린 브라우저)을 반납한다. 반드시 try-with-resources 로 사용.
 */
public final class FetchedPage implements AutoCloseable {
    private final FetchMode mode;
    private final PageContent content;
    private final RenderHandle handle;   // STATIC 이면 null

    private FetchedPage(FetchMode mode, PageContent content, RenderHandle handle) {
        this.mode = Objects.requireNonNull(mode, "mode");
        this.content = Objects.requireNonNull(content, "content");
        this.handle = handle;
    }

    public static FetchedPage ofStatic(PageContent content) {
        return new FetchedPage(FetchMode.STATIC, content, null);
    }

    public static FetchedPage rendered(PageContent initial, RenderHandle handle) {
        return new FetchedPage(FetchMode.DYNAMIC, initial, Objects.requireNonNull(handle, "handle"));
    }

    public FetchMode mode() { return mode; }
    public PageContent content() { return content; }
    public Optional<RenderHandle> renderHandle() { return Optional.ofNullable(handle); }

    @Override
    public void close() {
        if (handle != null) handle.close();
    }
}
