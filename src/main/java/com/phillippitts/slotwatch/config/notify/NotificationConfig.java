package com.phillippitts.slotwatch.config.notify;

import com.phillippitts.slotwatch.config.properties.NotifierProperties;
import com.phillippitts.slotwatch.config.properties.SubscriberProperties;
import com.phillippitts.slotwatch.service.monitor.BroadcastDispatcher;
import com.phillippitts.slotwatch.service.notify.LoggingNotifier;
import com.phillippitts.slotwatch.service.notify.Notifier;
import com.phillippitts.slotwatch.service.notify.TelegramNotifier;
import com.phillippitts.slotwatch.service.subscriber.FileSubscriberStore;
import com.phillippitts.slotwatch.service.subscriber.InMemorySubscriberStore;
import com.phillippitts.slotwatch.service.subscriber.SubscriberStore;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.Executor;

/**
 * Wires the notifier, the subscriber store and the broadcast dispatcher.
 * Backends are selected by {@code notifier.backend} and {@code subscribers.backend}.
 */
@Configuration
public class NotificationConfig {

    private static final Logger LOG = LogManager.getLogger(NotificationConfig.class);

    @Bean
    @ConditionalOnProperty(prefix = "notifier", name = "backend", havingValue = "telegram")
    public Notifier telegramNotifier(NotifierProperties props, RestTemplateBuilder restTemplateBuilder) {
        NotifierProperties.Telegram telegram = props.telegram();
        Duration timeout = Duration.ofSeconds(telegram.timeoutSeconds());
        return new TelegramNotifier(
                restTemplateBuilder.setConnectTimeout(timeout).setReadTimeout(timeout).build(),
                telegram.apiBaseUrl(),
                telegram.token());
    }

    /**
     * Offline notifier (default).
     */
    @Bean
    @ConditionalOnProperty(prefix = "notifier", name = "backend", havingValue = "log", matchIfMissing = true)
    public Notifier loggingNotifier() {
        LOG.info("Notifier backend: log (messages are not delivered)");
        return new LoggingNotifier();
    }

    @Bean
    @ConditionalOnProperty(prefix = "subscribers", name = "backend", havingValue = "file", matchIfMissing = true)
    public SubscriberStore fileSubscriberStore(SubscriberProperties props) {
        return new FileSubscriberStore(Path.of(props.file()));
    }

    @Bean
    @ConditionalOnProperty(prefix = "subscribers", name = "backend", havingValue = "memory")
    public SubscriberStore inMemorySubscriberStore() {
        LOG.info("Subscriber backend: memory (subscriptions are lost on restart)");
        return new InMemorySubscriberStore();
    }

    @Bean
    public BroadcastDispatcher broadcastDispatcher(Notifier notifier,
                                                   SubscriberStore subscriberStore,
                                                   @Qualifier("notifyExecutor") Executor notifyExecutor) {
        return new BroadcastDispatcher(notifier, subscriberStore, notifyExecutor);
    }
}
