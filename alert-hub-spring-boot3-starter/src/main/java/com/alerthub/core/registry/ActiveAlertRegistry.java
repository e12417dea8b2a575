package com.alerthub.core.registry;

import com.alerthub.model.Alert;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * 活跃告警注册表：告警 id -> 当前状态
 * 非线程安全, 调用方持有管道锁
 */
public class ActiveAlertRegistry {

    private final Map<UUID, Alert> alerts = new LinkedHashMap<>();

    /**
     * 首次出现直接登记, 重复 id 则计数 +1 并返回合并后的告警
     */
    public Alert upsert(Alert alert) {
        return alerts.merge(alert.getId(), alert, (existing, incoming) -> existing.incrementCount());
    }

    public Optional<Alert> acknowledge(UUID id, String actor, Instant at) {
        Alert alert = alerts.get(id);
        // 已确认或已解决均为 no-op
        if (alert == null || alert.isAcknowledged()) {
            return Optional.empty();
        }
        Alert acked = alert.acknowledge(actor, at);
        alerts.put(id, acked);
        return Optional.of(acked);
    }

    public Optional<Alert> resolve(UUID id, String actor, Instant at) {
        Alert alert = alerts.get(id);
        if (alert == null || alert.isResolved()) {
            return Optional.empty();
        }
        Alert resolved = alert.resolve(actor, at);
        alerts.put(id, resolved);
        return Optional.of(resolved);
    }

    public Optional<Alert> get(UUID id) {
        return Optional.ofNullable(alerts.get(id));
    }

    /**
     * 仅 ACTIVE 状态的告警, 按首次登记顺序
     */
    public List<Alert> getActive() {
        List<Alert> active = new ArrayList<>();
        for (Alert a : alerts.values()) {
            if (a.isActive()) {
                active.add(a);
            }
        }
        return active;
    }

    public int size() {
        return alerts.size();
    }

    /**
     * 清理解决时间早于 cutoff 的已解决告警, 返回清理数量
     */
    public int sweep(Instant cutoff) {
        int removed = 0;
        Iterator<Alert> it = alerts.values().iterator();
        while (it.hasNext()) {
            Alert a = it.next();
            if (a.isResolved() && a.getResolvedAt() != null && a.getResolvedAt().isBefore(cutoff)) {
                it.remove();
                removed++;
            }
        }
        return removed;
    }

    public void clear() {
        alerts.clear();
    }
}
