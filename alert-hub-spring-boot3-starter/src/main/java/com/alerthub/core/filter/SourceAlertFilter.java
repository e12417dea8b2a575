package com.alerthub.core.filter;

import com.alerthub.core.spi.AlertFilter;
import com.alerthub.model.Alert;
import com.alerthub.model.FilterResult;
import com.alerthub.model.ctx.FilterContext;

import java.util.Collection;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * 来源过滤
 * 黑名单命中直接抑制; 白名单模式下白名单非空且未命中时抑制
 * 支持 * 与 ? 通配符, 大小写不敏感
 */
public class SourceAlertFilter implements AlertFilter {

    private final String name;

    private final boolean useWhitelist;

    private final Set<String> allowed = ConcurrentHashMap.newKeySet();

    private final Set<String> blocked = ConcurrentHashMap.newKeySet();

    /** 通配符 -> 正则 缓存 */
    private final ConcurrentHashMap<String, Pattern> patterns = new ConcurrentHashMap<>();

    private volatile int priority = 20;

    private volatile boolean enabled = true;

    public SourceAlertFilter(String name, Collection<String> allowedSources, boolean useWhitelist) {
        this.name = name;
        this.useWhitelist = useWhitelist;
        if (allowedSources != null) {
            allowedSources.forEach(s -> addSource(s, true));
        }
    }

    public void addSource(String source, boolean allow) {
        if (source == null || source.isBlank()) {
            return;
        }
        String key = source.trim().toLowerCase(Locale.ROOT);
        if (allow) {
            allowed.add(key);
            blocked.remove(key);
        } else {
            blocked.add(key);
            allowed.remove(key);
        }
    }

    public boolean removeSource(String source) {
        if (source == null) return false;
        String key = source.trim().toLowerCase(Locale.ROOT);
        return allowed.remove(key) | blocked.remove(key);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public int priority() {
        return priority;
    }

    public void setPriority(int priority) {
        this.priority = priority;
    }

    @Override
    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    @Override
    public FilterResult evaluate(Alert alert, FilterContext ctx) {
        String source = alert.getSource() == null ? "" : alert.getSource().toLowerCase(Locale.ROOT);
        if (matchesAny(blocked, source)) {
            return FilterResult.suppress("Source " + alert.getSource() + " is blocked");
        }
        if (useWhitelist && !allowed.isEmpty() && !matchesAny(allowed, source)) {
            return FilterResult.suppress("Source " + alert.getSource() + " is not allowed");
        }
        return FilterResult.allow();
    }

    private boolean matchesAny(Set<String> entries, String source) {
        for (String e : entries) {
            if (e.indexOf('*') >= 0 || e.indexOf('?') >= 0) {
                if (patterns.computeIfAbsent(e, SourceAlertFilter::toPattern).matcher(source).matches()) {
                    return true;
                }
            } else if (e.equals(source)) {
                return true;
            }
        }
        return false;
    }

    private static Pattern toPattern(String wildcard) {
        StringBuilder sb = new StringBuilder();
        for (char ch : wildcard.toCharArray()) {
            switch (ch) {
                case '*' -> sb.append(".*");
                case '?' -> sb.append('.');
                default -> sb.append(Pattern.quote(String.valueOf(ch)));
            }
        }
        return Pattern.compile(sb.toString());
    }
}
