package com.alerthub.core.notify;

import com.alerthub.core.spi.notify.AlertLifecyclePublisher;
import com.alerthub.model.event.AlertLifecycleEvent;
import org.springframework.context.ApplicationEventPublisher;

/**
 * 通过 Spring 应用事件发布生命周期事件, 业务方使用 @EventListener 订阅
 */
public class SpringEventLifecyclePublisher implements AlertLifecyclePublisher {

    private final ApplicationEventPublisher delegate;

    public SpringEventLifecyclePublisher(ApplicationEventPublisher delegate) {
        this.delegate = delegate;
    }

    @Override
    public void publish(AlertLifecycleEvent event) {
        delegate.publishEvent(event);
    }
}
