package com.alerthub.autoconfig;

import com.alerthub.annotation.EnableAlertHub;
import com.alerthub.config.AlertHubProperties;
import com.alerthub.core.AlertPipeline;
import com.alerthub.core.AlertPipelineLifecycle;
import com.alerthub.core.channel.LoggingAlertChannel;
import com.alerthub.core.filter.SourceAlertFilter;
import com.alerthub.core.spi.AlertFilter;
import com.alerthub.core.spi.SuppressionRule;
import com.alerthub.core.suppression.RateLimitSuppressionRule;
import com.alerthub.model.Alert;
import com.alerthub.model.enums.AlertSeverity;
import com.alerthub.model.enums.LifecycleEventType;
import com.alerthub.model.event.AlertLifecycleEvent;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.ApplicationListener;
import org.springframework.context.PayloadApplicationEvent;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("alert hub auto-configuration")
class AlertHubAutoConfigurationTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(
                    AlertHubMetricsAutoConfiguration.class,
                    AlertNotifierAutoConfiguration.class,
                    AlertHubAutoConfiguration.class));

    @Test
    @DisplayName("wires a pipeline with the logging channel and properties applied")
    void defaultWiring() {
        runner.withPropertyValues(
                        "alert.minimum-severity=WARNING",
                        "alert.source-minimum-severity.disk-monitor=ERROR",
                        "alert.history.capacity=50",
                        "alert.channel.logging.minimum-severity=ERROR")
                .run(ctx -> {
                    assertThat(ctx).hasSingleBean(AlertPipeline.class);
                    assertThat(ctx).hasSingleBean(AlertPipelineLifecycle.class);
                    assertThat(ctx).hasSingleBean(LoggingAlertChannel.class);

                    AlertPipeline pipeline = ctx.getBean(AlertPipeline.class);
                    assertThat(pipeline.getMinimumSeverity()).isEqualTo(AlertSeverity.WARNING);
                    assertThat(pipeline.getMinimumSeverity("disk-monitor")).isEqualTo(AlertSeverity.ERROR);
                    assertThat(pipeline.getRegisteredChannels())
                            .extracting(c -> c.name())
                            .containsExactly("log");
                    assertThat(pipeline.getRegisteredChannels().get(0).minimumSeverity()).isEqualTo(AlertSeverity.ERROR);
                    assertThat(ctx.getBean(AlertHubProperties.class).getHistory().getCapacity()).isEqualTo(50);
                });
    }

    @Test
    void failureThresholdBound() {
        runner.withPropertyValues("alert.health.failure-threshold=3")
                .run(ctx -> {
                    AlertPipeline pipeline = ctx.getBean(AlertPipeline.class);
                    assertThat(pipeline.getDiagnostics().getFailureThreshold()).isEqualTo(3);
                    assertThat(pipeline.performHealthCheck().isHealthy()).isTrue();
                });
    }

    @Test
    void loggingChannelCanBeTurnedOff() {
        runner.withPropertyValues("alert.channel.logging.enabled=false")
                .run(ctx -> {
                    assertThat(ctx).doesNotHaveBean(LoggingAlertChannel.class);
                    assertThat(ctx.getBean(AlertPipeline.class).getRegisteredChannels()).isEmpty();
                });
    }

    @Test
    void disabledHubCreatesNoPipeline() {
        runner.withPropertyValues("alert.enabled=false")
                .run(ctx -> assertThat(ctx).doesNotHaveBean(AlertPipeline.class));
    }

    @Test
    @DisplayName("filter and suppression rule beans are registered on the pipeline")
    void contextBeansRegistered() {
        runner.withUserConfiguration(PolicyConfig.class)
                .run(ctx -> {
                    AlertPipeline pipeline = ctx.getBean(AlertPipeline.class);
                    assertThat(pipeline.getFilters()).extracting(AlertFilter::name).containsExactly("sources");
                    assertThat(pipeline.getSuppressionRules()).extracting(SuppressionRule::name).containsExactly("rate-limit");

                    pipeline.raise("blocked", AlertSeverity.ERROR, "noisy-job");
                    pipeline.raise("kept", AlertSeverity.ERROR, "api");

                    assertThat(pipeline.getActiveAlerts()).extracting(Alert::getSource).containsExactly("api");
                    assertThat(pipeline.validateConfiguration().isValid()).isTrue();
                });
    }

    @Test
    @DisplayName("lifecycle events reach Spring listeners")
    void lifecycleEventsPublished() {
        runner.withUserConfiguration(ListenerConfig.class)
                .run(ctx -> {
                    AlertPipeline pipeline = ctx.getBean(AlertPipeline.class);
                    pipeline.raise("disk full", AlertSeverity.CRITICAL, "disk-monitor");
                    Alert raised = pipeline.getActiveAlerts().get(0);
                    pipeline.acknowledge(raised.getId(), "cid-ack");

                    List<AlertLifecycleEvent> events = ctx.getBean(ListenerConfig.class).events;
                    assertThat(events).extracting(AlertLifecycleEvent::getType)
                            .containsExactly(LifecycleEventType.RAISED, LifecycleEventType.ACKNOWLEDGED);
                    assertThat(events.get(1).getCorrelationId()).isEqualTo("cid-ack");
                });
    }

    @Test
    @DisplayName("@EnableAlertHub(maintenance = false) turns scheduled maintenance off")
    void enableAnnotationDisablesMaintenance() {
        runner.withUserConfiguration(NoMaintenanceConfig.class)
                .run(ctx -> assertThat(ctx.getBean(AlertHubProperties.class).getMaintenance().isEnabled()).isFalse());
    }

    @Test
    void maintenanceStaysOnWithoutAnnotation() {
        runner.run(ctx -> assertThat(ctx.getBean(AlertHubProperties.class).getMaintenance().isEnabled()).isTrue());
    }

    @Configuration(proxyBeanMethods = false)
    static class PolicyConfig {

        @Bean
        SourceAlertFilter sourceAlertFilter() {
            SourceAlertFilter filter = new SourceAlertFilter("sources", null, false);
            filter.addSource("noisy-*", false);
            return filter;
        }

        @Bean
        RateLimitSuppressionRule rateLimitSuppressionRule() {
            return new RateLimitSuppressionRule(Duration.ofMinutes(1), 100);
        }
    }

    @Configuration(proxyBeanMethods = false)
    static class ListenerConfig implements ApplicationListener<PayloadApplicationEvent<AlertLifecycleEvent>> {

        final List<AlertLifecycleEvent> events = new CopyOnWriteArrayList<>();

        @Override
        public void onApplicationEvent(PayloadApplicationEvent<AlertLifecycleEvent> event) {
            events.add(event.getPayload());
        }
    }

    @EnableAlertHub(maintenance = false)
    @Configuration(proxyBeanMethods = false)
    static class NoMaintenanceConfig {
    }
}
