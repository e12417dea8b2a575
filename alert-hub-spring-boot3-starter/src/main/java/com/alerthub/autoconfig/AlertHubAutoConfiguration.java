package com.alerthub.autoconfig;

import com.alerthub.annotation.EnableAlertHub;
import com.alerthub.config.AlertHubProperties;
import com.alerthub.core.AlertPipeline;
import com.alerthub.core.AlertPipelineLifecycle;
import com.alerthub.core.metric.AlertMetrics;
import com.alerthub.core.spi.AlertChannel;
import com.alerthub.core.spi.AlertFilter;
import com.alerthub.core.spi.SuppressionRule;
import com.alerthub.core.spi.notify.AlertLifecyclePublisher;
import io.micrometer.core.instrument.util.NamedThreadFactory;
import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ApplicationContext;
import org.springframework.context.annotation.Bean;
import org.springframework.core.annotation.AnnotationUtils;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingDeque;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * 告警管道、线程池及生命周期
 */
@AutoConfiguration(after = {AlertHubMetricsAutoConfiguration.class, AlertNotifierAutoConfiguration.class})
@EnableConfigurationProperties(AlertHubProperties.class)
@ConditionalOnProperty(prefix = "alert", name = "enabled", matchIfMissing = true)
public class AlertHubAutoConfiguration {

    /**
     * 渠道投递线程池
     */
    @Bean("alertDeliveryExecutor")
    public ExecutorService alertDeliveryExecutor(AlertHubProperties props) {
        return newPool(props.getDelivery(), "alert-delivery-exec");
    }

    /**
     * raiseAsync 与批量操作线程池
     */
    @Bean("alertDispatchExecutor")
    public ExecutorService alertDispatchExecutor(AlertHubProperties props) {
        return newPool(props.getDispatch(), "alert-dispatch-exec");
    }

    @Bean
    @ConditionalOnMissingBean
    public Clock alertClock() {
        return Clock.systemUTC();
    }

    /**
     * 告警管道, 容器中的渠道/过滤器/抑制规则在此注册
     */
    @Bean
    @ConditionalOnMissingBean
    public AlertPipeline alertPipeline(AlertHubProperties props,
                                       @Qualifier("alertDispatchExecutor") ExecutorService dispatchExecutor,
                                       @Qualifier("alertDeliveryExecutor") ExecutorService deliveryExecutor,
                                       AlertMetrics metrics,
                                       ObjectProvider<AlertLifecyclePublisher> publisher,
                                       Clock alertClock,
                                       ObjectProvider<AlertChannel> channels,
                                       ObjectProvider<AlertFilter> filters,
                                       ObjectProvider<SuppressionRule> rules) {
        AlertPipeline pipeline = new AlertPipeline(
                props.getMinimumSeverity(),
                props.getHistory().getCapacity(),
                props.getMaintenance().getInterval(),
                props.getMaintenance().getRetention(),
                dispatchExecutor,
                deliveryExecutor,
                metrics,
                publisher.getIfAvailable(),
                alertClock);
        pipeline.setFailureThreshold(props.getHealth().getFailureThreshold());
        props.getSourceMinimumSeverity().forEach(pipeline::setMinimumSeverity);
        channels.orderedStream().forEach(pipeline::registerChannel);
        filters.orderedStream().forEach(pipeline::addFilter);
        rules.orderedStream().forEach(pipeline::addSuppressionRule);
        return pipeline;
    }

    /**
     * 管道启停与定时维护
     */
    @Bean
    public AlertPipelineLifecycle alertPipelineLifecycle(AlertPipeline pipeline,
                                                         AlertHubProperties props,
                                                         @Qualifier("alertDispatchExecutor") ExecutorService dispatchExecutor,
                                                         @Qualifier("alertDeliveryExecutor") ExecutorService deliveryExecutor,
                                                         ApplicationContext applicationContext) {
        EnableAlertHub enableAlertHub = findEnableAlertHub(applicationContext);
        if (enableAlertHub != null) {
            props.getMaintenance().setEnabled(props.getMaintenance().isEnabled() && enableAlertHub.maintenance());
        }
        return new AlertPipelineLifecycle(pipeline, props, dispatchExecutor, deliveryExecutor);
    }

    private ExecutorService newPool(AlertHubProperties.Exec exec, String name) {
        return new ThreadPoolExecutor(
                exec.getCorePoolSize(),
                exec.getMaxPoolSize(),
                exec.getKeepAlive().toSeconds(),
                TimeUnit.SECONDS,
                new LinkedBlockingDeque<>(exec.getQueueCapacity()),
                new NamedThreadFactory(name),
                exec.getRejectedHandler().toHandler()
        );
    }

    private EnableAlertHub findEnableAlertHub(ListableBeanFactory factory) {
        String[] names = factory.getBeanDefinitionNames();
        for (String n : names) {
            Class<?> type = factory.getType(n);
            if (type == null) continue;
            EnableAlertHub an = AnnotationUtils.findAnnotation(type, EnableAlertHub.class);
            if (an != null) return an;
        }
        return null;
    }
}
