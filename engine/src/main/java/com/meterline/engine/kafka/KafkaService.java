package com.meterline.engine.kafka;

import com.meterline.core.msg.ControlMessages.DeadLetterNotice;
import com.meterline.core.msg.ControlMessages.LimitBreached;
import com.meterline.core.msg.Topics;
import com.meterline.core.util.JsonUtils;
import com.meterline.engine.MeterRouter;
import com.meterline.engine.config.EngineConfig;
import com.meterline.engine.metrics.EngineMetrics;
import com.meterline.provisioner.ProvisioningQueue;
import org.apache.kafka.clients.admin.AdminClient;
import org.apache.kafka.clients.admin.NewTopic;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.errors.TopicExistsException;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.apache.kafka.common.serialization.StringSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import reactor.kafka.receiver.KafkaReceiver;
import reactor.kafka.receiver.ReceiverOptions;
import reactor.kafka.receiver.ReceiverRecord;
import reactor.kafka.sender.KafkaSender;
import reactor.kafka.sender.SenderOptions;
import reactor.kafka.sender.SenderRecord;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

public class KafkaService implements IKafkaService {
    private static final Logger log = LoggerFactory.getLogger(KafkaService.class);

    private static final int DEFAULT_PARTITIONS = 3;
    private static final short REPLICATION_FACTOR = 1;

    private final EngineConfig config;
    private final EngineMetrics metrics;

    private final KafkaSender<String, String> sender;
    private final AdminClient adminClient;
    private Disposable consumer;

    public KafkaService(EngineConfig config, EngineMetrics metrics) {
        this.config = config;
        this.metrics = metrics;

        Map<String, Object> producerProps = new HashMap<>();
        producerProps.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, config.getKafkaBootstrap());
        producerProps.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
        producerProps.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
        producerProps.put(ProducerConfig.ACKS_CONFIG, "all");
        producerProps.put(ProducerConfig.MAX_IN_FLIGHT_REQUESTS_PER_CONNECTION, "5");
        producerProps.put(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, "true");
        producerProps.put(ProducerConfig.RETRIES_CONFIG, Integer.MAX_VALUE);

        this.sender = KafkaSender.create(SenderOptions.create(producerProps));

        Map<String, Object> adminProps = new HashMap<>();
        adminProps.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, config.getKafkaBootstrap());
        this.adminClient = AdminClient.create(adminProps);

        log.info("Kafka producer and admin client initialized ({})", config.getKafkaBootstrap());
    }

    /**
     * Subscribes one consumer group to every inbound topic. Records are handled in order per
     * partition and acknowledged after hand-over; malformed records are logged and skipped.
     */
    @Override
    public Mono<Void> start(MeterRouter router, ProvisioningQueue queue) {
        ControlDispatcher dispatcher = new ControlDispatcher(router, queue);
        List<String> topics = new ArrayList<>(ControlDispatcher.INBOUND_TOPICS);
        topics.add(Topics.EVENTS_BREACH);
        topics.add(Topics.EVENTS_DEAD_LETTER);

        return createTopicsIfNotExist(topics)
            .publishOn(Schedulers.boundedElastic())
            .doOnSuccess(v -> {
                Map<String, Object> consumerProps = new HashMap<>();
                consumerProps.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, config.getKafkaBootstrap());
                consumerProps.put(ConsumerConfig.GROUP_ID_CONFIG, config.getKafkaGroupId());
                consumerProps.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class);
                consumerProps.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class);
                consumerProps.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "earliest");
                consumerProps.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, "false");

                ReceiverOptions<String, String> options = ReceiverOptions.<String, String>create(consumerProps)
                    .subscription(ControlDispatcher.INBOUND_TOPICS);

                consumer = KafkaReceiver.create(options).receive()
                    .concatMap(record -> handle(dispatcher, record))
                    .onErrorContinue((err, obj) -> log.error("Error in inbound consumer loop", err))
                    .subscribe();

                log.info("Kafka consumers started for {} (group {})",
                    ControlDispatcher.INBOUND_TOPICS, config.getKafkaGroupId());
            });
    }

    private Mono<Void> handle(ControlDispatcher dispatcher, ReceiverRecord<String, String> record) {
        return dispatcher.dispatch(record.topic(), record.value())
            .doOnSuccess(v -> record.receiverOffset().acknowledge())
            .onErrorResume(err -> {
                log.error("Failed to process message on {} (offset {}): {}",
                    record.topic(), record.offset(), err.getMessage(), err);
                metrics.recordConsumeError(record.topic());
                record.receiverOffset().acknowledge();
                return Mono.empty();
            });
    }

    @Override
    public Mono<Void> publishBreach(LimitBreached event) {
        String key = event.getCustomerId() != null
            ? event.getBusinessId() + ":" + event.getCustomerId()
            : event.getBusinessId();
        return publish(Topics.EVENTS_BREACH, key, JsonUtils.writeValueAsString(event));
    }

    @Override
    public Mono<Void> publishDeadLetter(DeadLetterNotice notice) {
        return publish(Topics.EVENTS_DEAD_LETTER, notice.getTaskId(), JsonUtils.writeValueAsString(notice));
    }

    private Mono<Void> publish(String topic, String key, String json) {
        long startNanos = System.nanoTime();
        ProducerRecord<String, String> record = new ProducerRecord<>(topic, key, json);
        return sender.send(Mono.just(SenderRecord.create(record, null)))
            .retry(3)
            .doOnNext(result -> {
                metrics.recordKafkaPublishLatency(topic, startNanos);
                log.debug("Published to {} (key {})", topic, key);
            })
            .then()
            .onErrorResume(err -> {
                log.warn("Failed to publish to {} (key {}): {}", topic, key, err.getMessage(), err);
                return Mono.empty();
            });
    }

    private Mono<Void> createTopicsIfNotExist(List<String> topicNames) {
        return Mono.fromFuture(() -> adminClient.listTopics().names().toCompletionStage().toCompletableFuture())
            .flatMap(existing -> {
                Set<NewTopic> missing = topicNames.stream()
                    .filter(name -> !existing.contains(name))
                    .map(name -> new NewTopic(name, DEFAULT_PARTITIONS, REPLICATION_FACTOR))
                    .collect(Collectors.toSet());
                if (missing.isEmpty()) {
                    return Mono.empty();
                }
                log.info("Creating Kafka topics: {}", missing.stream().map(NewTopic::name).collect(Collectors.toList()));
                return Mono.fromFuture(() -> adminClient.createTopics(missing)
                    .all()
                    .toCompletionStage()
                    .toCompletableFuture());
            })
            .onErrorResume(error -> {
                if (error.getCause() instanceof TopicExistsException) {
                    log.info("Kafka topics already exist");
                    return Mono.empty();
                }
                log.error("Failed to create Kafka topics: {}", error.getMessage(), error);
                return Mono.error(error);
            })
            .then();
    }

    @Override
    public Mono<Void> stop() {
        if (consumer != null) {
            consumer.dispose();
        }
        sender.close();
        adminClient.close();
        log.info("Kafka service stopped");
        return Mono.empty();
    }
}
