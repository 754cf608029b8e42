package com.retrykit.core.engine;

import com.retrykit.core.backoff.BackoffScheduler;
import com.retrykit.core.failure.PolicyErrorClassifier;
import com.retrykit.core.jitter.JitterStrategies;
import com.retrykit.core.metric.RetryMetrics;
import com.retrykit.core.notify.RetryEventPublisher;
import com.retrykit.core.policy.RetryPolicy;
import com.retrykit.core.sleep.CancellableSleeper;
import com.retrykit.core.spi.ErrorClassifier;
import com.retrykit.core.spi.RetryOperation;
import com.retrykit.exception.MaxAttemptsExceededException;
import com.retrykit.exception.RetryAbortedException;
import com.retrykit.model.ctx.RetryContext;
import com.retrykit.model.ctx.RetryEvent;
import com.retrykit.model.enums.RetryEventType;
import com.retrykit.model.enums.RetryState;
import io.netty.util.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;

/**
 * 重试框架核心引擎
 *
 * 单次执行是严格串行的状态机：调用 → 判定失败 → 退避等待 → 再调用, 调用与等待不重叠。
 * 同一个 RetryPolicy 可被多个并发执行共享, 每次执行的调用记录与抖动状态都在自己的 RetryContext 中。
 */
public class RetryEngine {

    private static final Logger log = LoggerFactory.getLogger(RetryEngine.class);

    /** 可取消等待 */
    private final CancellableSleeper sleeper;

    /** 名义延迟计算 */
    private final BackoffScheduler scheduler;

    /** 失败判定器 */
    private final ErrorClassifier classifier;

    /** 退避结束后继续调用的线程池, 避免在时间轮线程上执行业务调用 */
    private final Executor resumeExecutor;

    /** 指标 */
    private final RetryMetrics meter;

    /** 事件 */
    private final RetryEventPublisher publisher;

    public RetryEngine(CancellableSleeper sleeper,
                       BackoffScheduler scheduler,
                       ErrorClassifier classifier,
                       Executor resumeExecutor,
                       RetryMetrics meter,
                       RetryEventPublisher publisher) {
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.classifier = Objects.requireNonNull(classifier, "classifier");
        this.resumeExecutor = Objects.requireNonNull(resumeExecutor, "resumeExecutor");
        this.meter = meter == null ? RetryMetrics.standalone() : meter;
        this.publisher = publisher == null ? new RetryEventPublisher(List.of()) : publisher;
    }

    /**
     * 不依赖 Spring 容器时的默认装配
     */
    public static RetryEngine standalone(Timer timer, Executor resumeExecutor) {
        return new RetryEngine(new CancellableSleeper(timer), new BackoffScheduler(), new PolicyErrorClassifier(),
                resumeExecutor, RetryMetrics.standalone(), new RetryEventPublisher(List.of()));
    }

    /**
     * 异步执行
     *
     * @return 以操作的成功值完成; 或以 RetryAbortedException / MaxAttemptsExceededException / 原始异常之一异常完成。
     *         调用方取消返回的 future 后不再发起新的调用与等待
     */
    public <C, T> CompletableFuture<T> executeAsync(RetryOperation<C, T> operation, C context,
                                                    Object[] args, RetryPolicy policy) {
        return start(operation, context, args, policy).result;
    }

    private <C, T> Execution<C, T> start(RetryOperation<C, T> operation, C context, Object[] args, RetryPolicy policy) {
        Objects.requireNonNull(operation, "operation");
        Objects.requireNonNull(policy, "policy");
        Execution<C, T> ex = new Execution<>(operation, context, args == null ? new Object[0] : args, policy);
        run(ex);
        return ex;
    }

    /**
     * 同步执行, 阻塞到终态后原样抛出失败
     */
    public <C, T> T execute(RetryOperation<C, T> operation, C context, Object[] args, RetryPolicy policy)
            throws Exception {
        Execution<C, T> ex = start(operation, context, args, policy);
        try {
            return ex.result.get();
        } catch (InterruptedException ie) {
            ex.result.cancel(true);
            Thread.currentThread().interrupt();
            throw ie;
        } catch (ExecutionException ee) {
            // get() 会剥掉 CompletionException, 这里取结束时记录的原始失败
            Throwable cause = ex.failure != null ? ex.failure : ee.getCause();
            if (cause instanceof Exception) {
                throw (Exception) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw ee;
        }
    }

    /**
     * 无接收者、无参数的同步调用
     */
    public <T> T call(Callable<T> task, RetryPolicy policy) throws Exception {
        Objects.requireNonNull(task, "task");
        return execute(RetryOperation.<Object, T>of((c, a) -> task.call()), null, null, policy);
    }

    /**
     * 状态机主循环
     * 同步完成的调用与零延迟等待在当前线程内循环推进, 真正挂起时才注册回调后返回
     */
    private <C, T> void run(Execution<C, T> ex) {
        try {
            loop(ex);
        } catch (Throwable t) {
            crashed(ex, t);
        }
    }

    private <C, T> void loop(Execution<C, T> ex) {
        for (;;) {
            if (ex.result.isDone()) {
                return;
            }
            // 调用前检查取消, 首次调用前已取消则一次都不调用
            if (ex.policy.isCancelled()) {
                abort(ex);
                return;
            }

            CompletableFuture<T> call = invoke(ex);
            if (!call.isDone()) {
                call.whenComplete((v, err) -> resumeAfter(ex, settleSafely(ex, v, err)));
                return;
            }

            CompletableFuture<Void> wait = call.handle((v, err) -> settleSafely(ex, v, err)).join();
            if (wait == null) {
                return;
            }
            if (!wait.isDone()) {
                resumeAfter(ex, wait);
                return;
            }
            if (wait.isCompletedExceptionally()) {
                wait.whenComplete((v, err) -> onSleepFailed(ex, err));
                return;
            }
            advance(ex);
        }
    }

    /**
     * 等待结束后切到 resumeExecutor 继续下一次调用
     */
    private <C, T> void resumeAfter(Execution<C, T> ex, CompletableFuture<Void> wait) {
        if (wait == null) {
            return;
        }
        wait.whenComplete((v, err) -> dispatch(ex, () -> {
            if (err != null) {
                try {
                    onSleepFailed(ex, err);
                } catch (Throwable t) {
                    crashed(ex, t);
                }
                return;
            }
            advance(ex);
            run(ex);
        }));
    }

    /**
     * 提交到 resumeExecutor, 被拒绝时以拒绝异常结束本次执行
     */
    private <C, T> void dispatch(Execution<C, T> ex, Runnable step) {
        if (resumeExecutor instanceof ExecutorService && ((ExecutorService) resumeExecutor).isShutdown()) {
            // CallerRuns 在关闭后会静默丢弃任务
            rejected(ex, new RejectedExecutionException("retry executor is shut down"));
            return;
        }
        try {
            resumeExecutor.execute(step);
        } catch (RejectedExecutionException re) {
            rejected(ex, re);
        }
    }

    private <C, T> void rejected(Execution<C, T> ex, RejectedExecutionException re) {
        log.warn("[Retry-Engine] execution={} resume rejected: {}", ex.ctx.getExecutionId(), re.getMessage());
        ex.ctx.setState(RetryState.ABORTED);
        meter.recordInvocations(ex.ctx.getInvocations());
        fail(ex, re);
    }

    private <C, T> CompletableFuture<T> invoke(Execution<C, T> ex) {
        RetryContext ctx = ex.ctx;
        ctx.setState(RetryState.ATTEMPTING);
        meter.incAttempts();
        log.debug("[Retry-Engine] execution={} attempt {}/{}", ctx.getExecutionId(), ctx.getAttempt(), ctx.getMaxAttempts());
        ex.thrown = null;
        try {
            CompletionStage<T> stage = ex.operation.invoke(ex.context, ex.args);
            return stage == null ? CompletableFuture.completedFuture(null) : stage.toCompletableFuture();
        } catch (Throwable t) {
            // 同步抛出的异常原样保留, 不做任何拆包
            ex.thrown = t;
            return CompletableFuture.failedFuture(t);
        }
    }

    /**
     * settle 自身抛出的任何异常（监听器/判定器的 Error 等）都以该异常结束本次执行
     */
    private <C, T> CompletableFuture<Void> settleSafely(Execution<C, T> ex, T value, Throwable err) {
        try {
            return settle(ex, value, err);
        } catch (Throwable t) {
            crashed(ex, t);
            return null;
        }
    }

    /**
     * 处理一次调用的结果
     *
     * @return 需要等待的退避; null 表示已到终态
     */
    private <C, T> CompletableFuture<Void> settle(Execution<C, T> ex, T value, Throwable err) {
        RetryContext ctx = ex.ctx;
        RetryPolicy policy = ex.policy;

        if (err == null) {
            ctx.recordSuccess();
            finish(ex, RetryState.SUCCEEDED, null);
            meter.incSuccess();
            ex.result.complete(value);
            return null;
        }

        Throwable e = err == ex.thrown ? err : unwrapStage(err);
        ctx.recordFailure(e);
        publisher.fire(RetryEvent.of(RetryEventType.ATTEMPT_FAILED, ctx, e));

        // 耗尽判断先于分类：最后一次调用的不可重试异常同样包装/重抛
        if (ctx.isFinalAttempt()) {
            finish(ex, RetryState.EXHAUSTED, e);
            meter.incExhausted();
            fail(ex, policy.isReraiseOriginal() ? e : new MaxAttemptsExceededException(e, ctx.getAttempt()));
            return null;
        }

        boolean retryable;
        try {
            retryable = classifier.canRetry(e, policy);
        } catch (Throwable classifierError) {
            log.warn("[Retry-Engine] execution={} classifier failed: {}", ctx.getExecutionId(), classifierError.toString());
            fail(ex, classifierError);
            finish(ex, RetryState.NOT_RETRYABLE, classifierError);
            return null;
        }
        if (!retryable) {
            finish(ex, RetryState.NOT_RETRYABLE, e);
            meter.incNonRetryable();
            fail(ex, e);
            return null;
        }

        if (policy.isCancelled()) {
            abort(ex);
            return null;
        }
        if (ex.result.isDone()) {
            return null;
        }

        long nominal = scheduler.nominalDelay(ctx.getAttempt(), policy);
        long delay = JitterStrategies.of(policy.getJitterType()).apply(nominal, ctx, policy);
        ctx.setState(RetryState.BACKOFF);
        meter.recordBackoffMillis(delay);
        log.debug("[Retry-Engine] execution={} retry {} nominal={}ms actual={}ms",
                ctx.getExecutionId(), ctx.getAttempt(), nominal, delay);
        publisher.fire(RetryEvent.scheduled(ctx, delay));
        return sleeper.sleep(delay, policy.getCancellationToken());
    }

    private <C, T> void advance(Execution<C, T> ex) {
        ex.ctx.setAttempt(ex.ctx.getAttempt() + 1);
    }

    private <C, T> void onSleepFailed(Execution<C, T> ex, Throwable err) {
        Throwable e = unwrapStage(err);
        if (e instanceof RetryAbortedException) {
            abort(ex);
            return;
        }
        log.warn("[Retry-Engine] execution={} backoff failed: {}", ex.ctx.getExecutionId(), e.toString());
        ex.ctx.setState(RetryState.ABORTED);
        meter.recordInvocations(ex.ctx.getInvocations());
        fail(ex, e);
    }

    private <C, T> void abort(Execution<C, T> ex) {
        finish(ex, RetryState.ABORTED, null);
        meter.incAborted();
        fail(ex, new RetryAbortedException(RetryAbortedException.RETRY_ABORTED));
    }

    /**
     * 引擎内部意外失败, 保证返回的 future 不会挂起
     */
    private <C, T> void crashed(Execution<C, T> ex, Throwable t) {
        if (ex.result.isDone()) {
            log.warn("[Retry-Engine] execution={} failure after completion: {}", ex.ctx.getExecutionId(), t.toString());
            return;
        }
        log.error("[Retry-Engine] execution={} failed unexpectedly", ex.ctx.getExecutionId(), t);
        ex.ctx.setState(RetryState.ABORTED);
        fail(ex, t);
    }

    private <C, T> void fail(Execution<C, T> ex, Throwable error) {
        if (ex.failure == null) {
            ex.failure = error;
        }
        ex.result.completeExceptionally(error);
    }

    private <C, T> void finish(Execution<C, T> ex, RetryState state, Throwable error) {
        RetryContext ctx = ex.ctx;
        ctx.setState(state);
        meter.recordInvocations(ctx.getInvocations());
        log.debug("[Retry-Engine] execution={} {} after {} invocation(s) in {} ms",
                ctx.getExecutionId(), state.getDesc(), ctx.getInvocations(), ctx.getElapsed().toMillis());
        RetryEventType type = switch (state) {
            case SUCCEEDED -> RetryEventType.SUCCEEDED;
            case NOT_RETRYABLE -> RetryEventType.NON_RETRYABLE_FAILED;
            case EXHAUSTED -> RetryEventType.MAX_ATTEMPTS_REACHED;
            default -> RetryEventType.ABORTED;
        };
        publisher.fire(RetryEvent.of(type, ctx, error));
    }

    /**
     * 只剥掉异步 stage 链路加上的一层 CompletionException
     */
    private static Throwable unwrapStage(Throwable t) {
        if (t instanceof CompletionException && t.getCause() != null) {
            return t.getCause();
        }
        return t;
    }

    /**
     * 一次 execute 的全部私有状态
     */
    private static final class Execution<C, T> {
        final RetryOperation<C, T> operation;
        final C context;
        final Object[] args;
        final RetryPolicy policy;
        final RetryContext ctx;
        final CompletableFuture<T> result = new CompletableFuture<>();
        /** 本次调用同步抛出的异常 */
        volatile Throwable thrown;
        /** 结束时的原始失败 */
        volatile Throwable failure;

        Execution(RetryOperation<C, T> operation, C context, Object[] args, RetryPolicy policy) {
            this.operation = operation;
            this.context = context;
            this.args = args;
            this.policy = policy;
            this.ctx = new RetryContext(policy.getMaxAttempts(), policy.baseDelayMillis());
        }
    }
}
