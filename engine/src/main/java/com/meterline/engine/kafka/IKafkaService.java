package com.meterline.engine.kafka;

import com.meterline.core.msg.ControlMessages.DeadLetterNotice;
import com.meterline.core.msg.ControlMessages.LimitBreached;
import com.meterline.engine.MeterRouter;
import com.meterline.provisioner.ProvisioningQueue;
import reactor.core.publisher.Mono;

/**
 * Kafka ingest of metric and control messages, and publication of engine events.
 */
public interface IKafkaService {
    /**
     * Creates the topics when missing and starts the inbound consumers.
     *
     * @return Mono completing when consumers are subscribed
     */
    Mono<Void> start(MeterRouter router, ProvisioningQueue queue);

    Mono<Void> publishBreach(LimitBreached event);

    Mono<Void> publishDeadLetter(DeadLetterNotice notice);

    /**
     * Stops consumers, producer and admin client.
     */
    Mono<Void> stop();
}
