package com.alerthub.core;

import com.alerthub.model.Alert;

import java.util.Objects;

/**
 * 过滤链/抑制规则的执行结果：放行后的告警, 或抑制它的过滤器/规则名
 */
public final class StageOutcome {

    public static final String UNNAMED = "unnamed";

    private final Alert alert;

    private final String suppressedBy;

    private StageOutcome(Alert alert, String suppressedBy) {
        this.alert = alert;
        this.suppressedBy = suppressedBy;
    }

    public static StageOutcome pass(Alert alert) {
        return new StageOutcome(alert, null);
    }

    /**
     * 名称为 null 的过滤器/规则记为 unnamed, 保证抑制结果不会被当作放行
     */
    public static StageOutcome suppressed(String by) {
        return new StageOutcome(null, Objects.requireNonNullElse(by, UNNAMED));
    }

    public boolean isSuppressed() {
        return suppressedBy != null;
    }

    public Alert getAlert() {
        return alert;
    }

    public String getSuppressedBy() {
        return suppressedBy;
    }
}
