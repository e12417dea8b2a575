package com.alerthub.core.spi.notify;

import com.alerthub.model.event.AlertLifecycleEvent;

/**
 * 生命周期事件发布, 由外部传输层实现
 * 发布失败不影响管道主流程
 */
public interface AlertLifecyclePublisher {

    void publish(AlertLifecycleEvent event);
}
