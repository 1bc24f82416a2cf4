package com.eyelevel.dispatcher.storage;

import lombok.extern.slf4j.Slf4j;
import org.springframework.retry.RetryCallback;
import org.springframework.retry.RetryContext;
import org.springframework.retry.RetryListener;
import org.springframework.stereotype.Component;

@Slf4j
@Component("objectStoreRetryListener")
public class ObjectStoreRetryListener implements RetryListener {

    /**
     * Called after a failed transfer attempt.
     */
    @Override
    public <T, E extends Throwable> void onError(RetryContext context, RetryCallback<T, E> callback,
                                                 Throwable throwable) {
        log.warn("Object store operation '{}' failed on attempt {}. Retrying... Error: {}",
                 context.getAttribute(RetryContext.NAME), context.getRetryCount(), throwable.getMessage());
    }

    @Override
    public <T, E extends Throwable> void close(RetryContext context, RetryCallback<T, E> callback,
                                               Throwable throwable) {
        if (throwable != null) {
            log.error("Object store operation '{}' gave up after {} attempts.", context.getAttribute(RetryContext.NAME),
                      context.getRetryCount(), throwable);
        }
    }
}
