package com.alerthub.autoconfig;

import com.alerthub.config.AlertHubProperties;
import com.alerthub.core.channel.LoggingAlertChannel;
import com.alerthub.core.notify.SpringEventLifecyclePublisher;
import com.alerthub.core.serializer.JacksonAlertSerializer;
import com.alerthub.core.spi.AlertSerializer;
import com.alerthub.core.spi.notify.AlertLifecyclePublisher;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;

/**
 * 默认渠道、序列化与生命周期事件发布
 */
@AutoConfiguration
@EnableConfigurationProperties(AlertHubProperties.class)
public class AlertNotifierAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean(AlertSerializer.class)
    public AlertSerializer alertSerializer() {
        return new JacksonAlertSerializer();
    }

    @Bean
    @ConditionalOnMissingBean(AlertLifecyclePublisher.class)
    public AlertLifecyclePublisher alertLifecyclePublisher(ApplicationEventPublisher publisher) {
        return new SpringEventLifecyclePublisher(publisher);
    }

    @Bean
    @ConditionalOnMissingBean(name = "loggingAlertChannel")
    @ConditionalOnProperty(prefix = "alert.channel.logging", name = "enabled", matchIfMissing = true)
    public LoggingAlertChannel loggingAlertChannel(AlertHubProperties props, AlertSerializer serializer) {
        AlertHubProperties.Channel.Logging cfg = props.getChannel().getLogging();
        return new LoggingAlertChannel(cfg.getMinimumSeverity(), cfg.isJson() ? serializer : null);
    }
}
