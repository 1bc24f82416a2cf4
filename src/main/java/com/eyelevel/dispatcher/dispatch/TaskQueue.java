package com.eyelevel.dispatcher.dispatch;

import com.eyelevel.dispatcher.dto.message.ServiceTask;

import java.time.Duration;
import java.util.Optional;

/**
 * Per-service work queues. Delivery is at least once.
 */
public interface TaskQueue {

    /**
     * Places the task on the queue of {@link ServiceTask#serviceName()}, visible after {@code delay}.
     */
    void push(ServiceTask task, Duration delay);

    /**
     * Takes the next task for a service, waiting at most {@code timeout}.
     */
    Optional<ServiceTask> pop(String serviceName, Duration timeout);
}
