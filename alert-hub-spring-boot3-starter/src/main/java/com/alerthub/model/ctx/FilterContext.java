package com.alerthub.model.ctx;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * 过滤链上下文, 一次过滤链执行内共享
 */
public class FilterContext {

    private final String correlationId;

    private final Instant startedAt;

    /** 当前过滤器在链中的位置 */
    private int chainPosition;

    /** 过滤器之间传递的自定义属性 */
    private final Map<String, Object> properties = new HashMap<>();

    public FilterContext(String correlationId, Instant startedAt) {
        this.correlationId = correlationId;
        this.startedAt = startedAt;
    }

    public static FilterContext withCorrelation(String correlationId) {
        return new FilterContext(correlationId, Instant.now());
    }

    public String getCorrelationId() {
        return correlationId;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public int getChainPosition() {
        return chainPosition;
    }

    public void setChainPosition(int chainPosition) {
        this.chainPosition = chainPosition;
    }

    public Map<String, Object> getProperties() {
        return properties;
    }
}
