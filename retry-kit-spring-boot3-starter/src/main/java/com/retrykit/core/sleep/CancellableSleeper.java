package com.retrykit.core.sleep;

import com.retrykit.core.cancel.CancellationToken;
import com.retrykit.exception.RetryAbortedException;
import io.netty.util.Timeout;
import io.netty.util.Timer;
import io.netty.util.TimerTask;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * 可取消的等待
 * 时间轮定时与取消订阅赛跑, 先完成的一方清理另一方, 不轮询
 */
public class CancellableSleeper {

    private static final Logger log = LoggerFactory.getLogger(CancellableSleeper.class);

    /** 时间轮 */
    private final Timer timer;

    public CancellableSleeper(Timer timer) {
        this.timer = timer;
    }

    /**
     * @param delayMillis 等待时长, <= 0 立即完成
     * @param token       取消信号, 可为 null
     * @return 正常到期时完成; 被取消时以 RetryAbortedException 异常完成
     */
    public CompletableFuture<Void> sleep(long delayMillis, CancellationToken token) {
        if (token != null && token.isCancelled()) {
            return CompletableFuture.failedFuture(new RetryAbortedException(RetryAbortedException.RETRY_ABORTED));
        }
        if (delayMillis <= 0) {
            return CompletableFuture.completedFuture(null);
        }

        WakeUp wakeUp = new WakeUp();
        Timeout timeout;
        try {
            timeout = timer.newTimeout(wakeUp, delayMillis, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException | IllegalStateException e) {
            log.warn("[Retry-Sleep] timer rejected timeout of {} ms: {}", delayMillis, e.getMessage());
            return CompletableFuture.failedFuture(e instanceof RejectedExecutionException
                    ? e : new RejectedExecutionException(e.getMessage(), e));
        }

        CompletableFuture<Void> done = wakeUp.done;
        if (token != null) {
            CancellationToken.Subscription subscription = token.subscribe(() -> {
                if (done.completeExceptionally(new RetryAbortedException(RetryAbortedException.RETRY_ABORTED))) {
                    timeout.cancel();
                }
            });
            // 任一方完成后取消订阅
            done.whenComplete((v, e) -> subscription.close());
        }
        return done;
    }

    /**
     * 停止时间轮, 尚未到期的等待以拒绝异常结束, 避免调用方永远挂起
     *
     * @return 被中断的等待数量
     */
    public int shutdown() {
        Set<Timeout> unprocessed = timer.stop();
        int rejected = 0;
        for (Timeout t : unprocessed) {
            if (t.task() instanceof WakeUp) {
                ((WakeUp) t.task()).done.completeExceptionally(
                        new RejectedExecutionException("retry timer stopped"));
                rejected++;
            }
        }
        if (rejected > 0) {
            log.warn("[Retry-Sleep] timer stopped with {} pending backoff waits", rejected);
        }
        return rejected;
    }

    private static final class WakeUp implements TimerTask {

        private final CompletableFuture<Void> done = new CompletableFuture<>();

        @Override
        public void run(Timeout timeout) {
            done.complete(null);
        }
    }
}
