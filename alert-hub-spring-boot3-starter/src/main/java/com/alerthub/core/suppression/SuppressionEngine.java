package com.alerthub.core.suppression;

import com.alerthub.core.StageOutcome;
import com.alerthub.core.spi.SuppressionRule;
import com.alerthub.model.Alert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * 抑制规则引擎
 * 按注册顺序执行, 不重新排序
 */
public class SuppressionEngine {

    private static final Logger log = LoggerFactory.getLogger(SuppressionEngine.class);

    private volatile List<SuppressionRule> rules = List.of();

    /**
     * 注册规则, 重名返回 false
     */
    public boolean add(SuppressionRule rule) {
        if (find(rule.name()).isPresent()) {
            return false;
        }
        List<SuppressionRule> next = new ArrayList<>(rules);
        next.add(rule);
        rules = List.copyOf(next);
        return true;
    }

    public Optional<SuppressionRule> remove(String name) {
        Optional<SuppressionRule> found = find(name);
        found.ifPresent(r -> {
            List<SuppressionRule> next = new ArrayList<>(rules);
            next.remove(r);
            rules = List.copyOf(next);
        });
        return found;
    }

    public List<SuppressionRule> rules() {
        return rules;
    }

    public int size() {
        return rules.size();
    }

    public StageOutcome apply(Alert alert) {
        Alert current = alert;
        for (SuppressionRule rule : rules) {
            if (!rule.isEnabled() || !rule.matches(current)) {
                continue;
            }
            Alert next = rule.applyActions(current);
            if (next == null) {
                log.debug("[Suppression] alert {} suppressed by rule={}, correlationId={}",
                        current.getId(), rule.name(), current.getCorrelationId());
                return StageOutcome.suppressed(rule.name());
            }
            current = next;
        }
        return StageOutcome.pass(current);
    }

    private Optional<SuppressionRule> find(String name) {
        return rules.stream().filter(r -> Objects.equals(r.name(), name)).findFirst();
    }
}
