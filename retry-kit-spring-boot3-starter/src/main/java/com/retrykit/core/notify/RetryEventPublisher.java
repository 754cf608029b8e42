package com.retrykit.core.notify;

import com.retrykit.core.spi.RetryListener;
import com.retrykit.model.ctx.RetryEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * 同步派发事件, 单个监听器失败不影响其他监听器和执行结果
 */
public class RetryEventPublisher {

    private static final Logger log = LoggerFactory.getLogger(RetryEventPublisher.class);

    private final List<RetryListener> listeners;

    public RetryEventPublisher(List<RetryListener> listeners) {
        this.listeners = listeners == null ? List.of() : List.copyOf(listeners);
    }

    public void fire(RetryEvent event) {
        for (RetryListener l : listeners) {
            try {
                if (l.supports(event)) {
                    l.onEvent(event);
                }
            } catch (VirtualMachineError fatal) {
                throw fatal;
            } catch (Throwable e) {
                log.warn("[Retry-Notify] listener {} failed on {} (execution={}): {}",
                        l.name(), event.getType(), event.getExecutionId(), e.toString());
            }
        }
    }

    public boolean isEmpty() {
        return listeners.isEmpty();
    }
}
