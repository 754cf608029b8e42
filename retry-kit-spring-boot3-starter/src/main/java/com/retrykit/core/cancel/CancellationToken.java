package com.retrykit.core.cancel;

import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 外部取消信号
 * - 可被多个并发的 execute 同时观察, 各自独立响应
 * - 订阅者在取消时最多被回调一次, 取消后再订阅立即回调
 */
public class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    private final CopyOnWriteArrayList<Subscription> subscriptions = new CopyOnWriteArrayList<>();

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * 发出取消信号, 重复调用无副作用
     */
    public void cancel() {
        if (!cancelled.compareAndSet(false, true)) {
            return;
        }
        for (Subscription s : subscriptions) {
            s.fire();
        }
    }

    /**
     * 订阅取消通知
     */
    public Subscription subscribe(Runnable onCancel) {
        Subscription s = new Subscription(onCancel);
        subscriptions.add(s);
        // 与 cancel() 竞争时由先移除者负责回调
        if (cancelled.get()) {
            s.fire();
        }
        return s;
    }

    /** 当前订阅数 */
    public int subscriberCount() {
        return subscriptions.size();
    }

    public final class Subscription implements AutoCloseable {

        private final Runnable onCancel;

        private Subscription(Runnable onCancel) {
            this.onCancel = onCancel;
        }

        private void fire() {
            if (subscriptions.remove(this)) {
                onCancel.run();
            }
        }

        /** 取消订阅 */
        @Override
        public void close() {
            subscriptions.remove(this);
        }
    }
}
