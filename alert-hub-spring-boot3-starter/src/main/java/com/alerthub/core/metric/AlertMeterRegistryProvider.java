package com.alerthub.core.metric;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.composite.CompositeMeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

/**
 * 告警指标注册表
 * 内置一个 Simple 注册表供统计快照读数, 宿主应用的注册表 (含嵌套组合注册表) 展开后挂到同一个组合注册表上
 */
public class AlertMeterRegistryProvider {

    private static final Logger log = LoggerFactory.getLogger(AlertMeterRegistryProvider.class);

    private final CompositeMeterRegistry composite = new CompositeMeterRegistry();

    private final Set<MeterRegistry> attached = Collections.newSetFromMap(new IdentityHashMap<>());

    public AlertMeterRegistryProvider(List<MeterRegistry> discovered) {
        attach(new SimpleMeterRegistry());
        if (discovered != null) {
            discovered.forEach(this::attach);
        }
        log.info("[Alert-Metrics] {} meter registr(ies) attached", attached.size());
    }

    public MeterRegistry getRegistry() {
        return composite;
    }

    /**
     * 已挂载的叶子注册表数量, 含内置 Simple
     */
    public int attachedCount() {
        return attached.size();
    }

    private void attach(MeterRegistry registry) {
        if (registry == null || registry == composite) {
            return;
        }
        if (registry instanceof CompositeMeterRegistry nested) {
            Collection<MeterRegistry> children = nested.getRegistries();
            children.forEach(this::attach);
            return;
        }
        // 同一注册表经多条路径发现时只挂一次, 避免重复计数
        if (attached.add(registry)) {
            composite.add(registry);
        }
    }
}
