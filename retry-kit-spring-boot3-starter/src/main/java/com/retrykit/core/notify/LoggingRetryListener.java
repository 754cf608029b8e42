package com.retrykit.core.notify;

import com.retrykit.core.spi.RetryListener;
import com.retrykit.model.ctx.RetryEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 日志监听, 默认启用
 */
public class LoggingRetryListener implements RetryListener {

    private static final Logger log = LoggerFactory.getLogger(LoggingRetryListener.class);

    @Override
    public String name() {
        return "log";
    }

    @Override
    public void onEvent(RetryEvent e) {
        switch (e.getType()) {
            case MAX_ATTEMPTS_REACHED -> log.error("[Retry-{}] execution={}, attempt={}/{}, err={}",
                    e.getType(), e.getExecutionId(), e.getAttempt(), e.getMaxAttempts(), describe(e.getError()));
            case NON_RETRYABLE_FAILED, ABORTED -> log.warn("[Retry-{}] execution={}, attempt={}/{}, err={}",
                    e.getType(), e.getExecutionId(), e.getAttempt(), e.getMaxAttempts(), describe(e.getError()));
            case RETRY_SCHEDULED -> log.info("[Retry-{}] execution={}, attempt={}/{}, delay={}ms, err={}",
                    e.getType(), e.getExecutionId(), e.getAttempt(), e.getMaxAttempts(), e.getDelayMillis(),
                    describe(e.getError()));
            default -> log.debug("[Retry-{}] execution={}, attempt={}", e.getType(), e.getExecutionId(), e.getAttempt());
        }
    }

    private String describe(Throwable t) {
        if (t == null) {
            return null;
        }
        String s = t.toString();
        return s.length() > 2000 ? s.substring(0, 2000) : s;
    }
}
