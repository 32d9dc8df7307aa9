package com.shopcrawl.core.render;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.BlockingDeque;
import java.util.concurrent.LinkedBlockingDeque;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * 도메인 간 공유하는 렌더 드라이버(브라우저) 풀. 크기 상한 고정, 슬롯은 처음 빌릴 때 띄운다.
 * 한 슬롯은 한 번에 한 스레드만 쓴다(Playwright 객체는 스레드 세이프가 아님).
 * 반납은 {@link Lease#release()} 로 하며 두 번 불러도 안전하다.
 */
public final class RenderDriverPool<D extends AutoCloseable> implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(RenderDriverPool.class);

    private final Supplier<? extends D> launcher;
    private final Predicate<? super D> alive;
    private final BlockingDeque<Slot> idle;   // 앞쪽 = 최근 반납(기동된) 슬롯
    private final List<Slot> all = new ArrayList<>();
    private volatile boolean closed;

    public RenderDriverPool(int size, Supplier<? extends D> launcher, Predicate<? super D> alive) {
        if (size < 1) throw new IllegalArgumentException("pool size must be >= 1");
        this.launcher = Objects.requireNonNull(launcher, "launcher");
        this.alive = Objects.requireNonNull(alive, "alive");
        this.idle = new LinkedBlockingDeque<>(size);
        for (int i = 0; i < size; i++) {
            Slot s = new Slot(i);
            all.add(s);
            idle.addLast(s);
        }
    }

    public int size() { return all.size(); }

    /** 빈 슬롯이 날 때까지 대기. 드라이버 기동 실패는 RenderException */
    public Lease acquire() throws InterruptedException {
        if (closed) throw new IllegalStateException("pool closed");
        Slot slot = idle.takeFirst();
        try {
            slot.ensureLaunched();
        } catch (RuntimeException e) {
            idle.addLast(slot);
            throw (e instanceof RenderException re) ? re : new RenderException("driver launch failed", e);
        }
        return new Lease(slot);
    }

    @Override
    public void close() {
        closed = true;
        for (Slot s : all) s.shutdown();
    }

    /** 빌린 드라이버 */
    public final class Lease {
        private final Slot slot;
        private final AtomicBoolean released = new AtomicBoolean(false);

        private Lease(Slot slot) { this.slot = slot; }

        public D driver() {
            if (released.get()) throw new IllegalStateException("lease already released");
            return slot.driver;
        }

        public void release() {
            if (!released.compareAndSet(false, true)) return;
            if (slot.driver != null && !alive.test(slot.driver)) {
                LOG.warn("Render driver #{} is dead; relaunching on next checkout", slot.id);
                slot.shutdown();
            }
            if (closed) slot.shutdown();
            // 살아 있는 드라이버는 다음 acquire 가 먼저 가져가도록 앞에 둔다
            if (slot.driver != null) idle.addFirst(slot);
            else idle.addLast(slot);
        }
    }

    private final class Slot {
        final int id;
        D driver;

        Slot(int id) { this.id = id; }

        void ensureLaunched() {
            if (driver == null) {
                driver = Objects.requireNonNull(launcher.get(), "launcher returned null");
                LOG.debug("Render driver #{} launched", id);
            }
        }

        synchronized void shutdown() {
            D d = driver;
            driver = null;
            if (d == null) return;
            try {
                d.close();
            } catch (Exception e) {
                LOG.warn("Render driver #{} close failed: {}", id, e.toString());
            }
        }
    }
}
