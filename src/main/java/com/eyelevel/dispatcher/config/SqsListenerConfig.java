package com.eyelevel.dispatcher.config;

import io.awspring.cloud.sqs.config.SqsMessageListenerContainerFactory;
import io.awspring.cloud.sqs.listener.acknowledgement.handler.AcknowledgementMode;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.services.sqs.SqsAsyncClient;

import java.time.Duration;

@Configuration
public class SqsListenerConfig {

    /**
     * Container factory shared by the submission, signal and archive listeners. The poll timeout bounds
     * how long a listener thread blocks waiting for the next message, so shutdown is observed promptly.
     */
    @Bean("dispatchContainerFactory")
    public SqsMessageListenerContainerFactory<Object> dispatchContainerFactory(SqsAsyncClient sqsAsyncClient,
                                                                               DispatchConfig dispatchConfig) {
        final DispatchConfig.Listener listener = dispatchConfig.getListener();

        SqsMessageListenerContainerFactory<Object> factory = new SqsMessageListenerContainerFactory<>();
        factory.setSqsAsyncClient(sqsAsyncClient);
        factory.configure(options -> options.acknowledgementMode(AcknowledgementMode.ON_SUCCESS)
                                            .maxConcurrentMessages(listener.getConcurrencyLimit())
                                            .maxMessagesPerPoll(listener.getMaxMessagesPerPoll())
                                            .pollTimeout(Duration.ofSeconds(listener.getPollTimeoutSeconds())));
        return factory;
    }
}
