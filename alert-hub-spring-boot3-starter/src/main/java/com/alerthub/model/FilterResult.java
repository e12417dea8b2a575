package com.alerthub.model;

import com.alerthub.model.enums.FilterDecision;
import lombok.Getter;

/**
 * 过滤器评估结果
 */
@Getter
public final class FilterResult {

    private static final FilterResult ALLOW = new FilterResult(FilterDecision.ALLOW, "Filter passed", null);

    private final FilterDecision decision;

    private final String reason;

    /** 仅 MODIFY 时有值 */
    private final Alert modifiedAlert;

    private FilterResult(FilterDecision decision, String reason, Alert modifiedAlert) {
        this.decision = decision;
        this.reason = reason;
        this.modifiedAlert = modifiedAlert;
    }

    public static FilterResult allow() { return ALLOW; }

    public static FilterResult allow(String reason) { return new FilterResult(FilterDecision.ALLOW, reason, null); }

    public static FilterResult suppress(String reason) { return new FilterResult(FilterDecision.SUPPRESS, reason, null); }

    public static FilterResult modify(Alert modifiedAlert, String reason) {
        return new FilterResult(FilterDecision.MODIFY, reason, modifiedAlert);
    }

    public static FilterResult defer(String reason) { return new FilterResult(FilterDecision.DEFER, reason, null); }
}
