package com.eyelevel.dispatcher.dispatch;

import com.eyelevel.dispatcher.config.DispatchConfig;
import com.eyelevel.dispatcher.dto.message.ServiceTask;
import io.awspring.cloud.sqs.operations.SqsTemplate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.Message;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.Duration;
import java.util.Optional;

/**
 * {@link TaskQueue} with one SQS queue per service, named by the configured prefix and the service name.
 * Tasks pushed inside a transaction are sent once it commits, so a worker never sees a task whose state
 * was rolled back.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SqsTaskQueue implements TaskQueue {

    /**
     * Longest delivery delay SQS accepts.
     */
    private static final long MAX_DELAY_SECONDS = 900;

    private final SqsTemplate sqsTemplate;
    private final DispatchConfig dispatchConfig;

    @Override
    public void push(final ServiceTask task, final Duration delay) {
        final String queueName = queueName(task.serviceName());
        final int delaySeconds = (int) Math.min(MAX_DELAY_SECONDS, Math.max(0, delay.toSeconds()));

        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCommit() {
                    send(queueName, task, delaySeconds);
                }
            });
        } else {
            send(queueName, task, delaySeconds);
        }
    }

    @Override
    public Optional<ServiceTask> pop(final String serviceName, final Duration timeout) {
        return sqsTemplate.receive(from -> from.queue(queueName(serviceName)).pollTimeout(timeout), ServiceTask.class)
                          .map(Message::getPayload);
    }

    private void send(final String queueName, final ServiceTask task, final int delaySeconds) {
        sqsTemplate.send(to -> to.queue(queueName).payload(task).delaySeconds(delaySeconds));
        log.info("[{}] Queued task for file {} on '{}' (attempt {}, delay {}s).", task.sid(), task.sha256(),
                 queueName, task.attempt(), delaySeconds);
    }

    private String queueName(final String serviceName) {
        return dispatchConfig.getQueues().getServicePrefix() + serviceName;
    }
}
