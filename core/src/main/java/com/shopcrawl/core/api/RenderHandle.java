package com.shopcrawl.core.api;

import com.shopcrawl.core.model.PageContent;

import java.util.Optional;

/**
 * 렌더링된 페이지를 조작하는 핸들. 모든 조작은 실패 시 RenderException(비검사)을 던진다.
 * close() 는 여러 번 불려도 안전해야 한다.
 */
public interface RenderHandle extends AutoCloseable {
    void scrollToBottom();

    void waitMillis(long millis);

    /** 현재 DOM 스냅샷 */
    PageContent extractContent();

    /** "load more"/"show more" 류 버튼이 보이면 반환 */
    Optional<Affordance> findLoadMoreAffordance();

    void click(Affordance affordance);

    @Override void close();
}
