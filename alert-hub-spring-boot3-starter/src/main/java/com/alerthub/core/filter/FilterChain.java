package com.alerthub.core.filter;

import com.alerthub.core.StageOutcome;
import com.alerthub.core.spi.AlertFilter;
import com.alerthub.model.Alert;
import com.alerthub.model.FilterResult;
import com.alerthub.model.ctx.FilterContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * 过滤链
 * 按 priority 升序执行, 同优先级保持注册顺序
 * 评估读取不可变快照, 写操作由管道写锁串行化
 */
public class FilterChain {

    private static final Logger log = LoggerFactory.getLogger(FilterChain.class);

    private volatile List<AlertFilter> filters = List.of();

    /**
     * 注册过滤器, 重名返回 false
     */
    public boolean add(AlertFilter filter) {
        if (find(filter.name()).isPresent()) {
            return false;
        }
        List<AlertFilter> next = new ArrayList<>(filters);
        next.add(filter);
        // List.sort 是稳定排序
        next.sort(Comparator.comparingInt(AlertFilter::priority));
        filters = List.copyOf(next);
        return true;
    }

    public Optional<AlertFilter> remove(String name) {
        Optional<AlertFilter> found = find(name);
        found.ifPresent(f -> {
            List<AlertFilter> next = new ArrayList<>(filters);
            next.remove(f);
            filters = List.copyOf(next);
        });
        return found;
    }

    public List<AlertFilter> filters() {
        return filters;
    }

    public int size() {
        return filters.size();
    }

    /**
     * 依次执行过滤器, 过滤器抛出的异常直接上抛给管道
     */
    public StageOutcome apply(Alert alert, FilterContext ctx) {
        Alert current = alert;
        List<AlertFilter> snapshot = filters;
        for (int i = 0; i < snapshot.size(); i++) {
            AlertFilter filter = snapshot.get(i);
            if (!filter.isEnabled() || !filter.canHandle(current)) {
                continue;
            }
            ctx.setChainPosition(i);
            FilterResult result = filter.evaluate(current, ctx);
            if (result == null) {
                continue;
            }
            switch (result.getDecision()) {
                case SUPPRESS -> {
                    log.debug("[Filter-Chain] alert {} suppressed by filter={}, reason={}, correlationId={}",
                            current.getId(), filter.name(), result.getReason(), ctx.getCorrelationId());
                    return StageOutcome.suppressed(filter.name());
                }
                case MODIFY -> {
                    if (result.getModifiedAlert() != null) {
                        current = result.getModifiedAlert();
                    }
                }
                // DEFER 暂按 ALLOW 处理
                case ALLOW, DEFER -> {
                }
            }
        }
        return StageOutcome.pass(current);
    }

    private Optional<AlertFilter> find(String name) {
        return filters.stream().filter(f -> Objects.equals(f.name(), name)).findFirst();
    }
}
