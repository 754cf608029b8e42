package com.retrykit.core.cancel;

import static org.junit.jupiter.api.Assertions.*;

import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("CancellationToken")
class CancellationTokenTest {

    @Test
    @DisplayName("subscribers are notified once, however often cancel is called")
    void notifiesOnce() {
        CancellationToken token = new CancellationToken();
        AtomicInteger fired = new AtomicInteger();
        token.subscribe(fired::incrementAndGet);

        token.cancel();
        token.cancel();

        assertTrue(token.isCancelled());
        assertEquals(1, fired.get());
        assertEquals(0, token.subscriberCount());
    }

    @Test
    @DisplayName("subscribing after cancellation fires immediately")
    void lateSubscriber() {
        CancellationToken token = new CancellationToken();
        token.cancel();
        AtomicInteger fired = new AtomicInteger();

        token.subscribe(fired::incrementAndGet);

        assertEquals(1, fired.get());
        assertEquals(0, token.subscriberCount());
    }

    @Test
    @DisplayName("closed subscriptions are not notified")
    void closedSubscription() {
        CancellationToken token = new CancellationToken();
        AtomicInteger fired = new AtomicInteger();
        CancellationToken.Subscription s = token.subscribe(fired::incrementAndGet);
        assertEquals(1, token.subscriberCount());

        s.close();
        token.cancel();

        assertEquals(0, fired.get());
    }
}
