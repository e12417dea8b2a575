package com.alerthub.config;

import com.alerthub.model.enums.AlertSeverity;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * 告警中心配置（绑定前缀：alert）
 *
 * YAML 示例：
 * alert:
 *   enabled: true
 *   minimum-severity: INFO
 *   source-minimum-severity:
 *     disk-monitor: WARNING
 *   history:
 *     capacity: 1000
 *   maintenance:
 *     enabled: true
 *     interval: 5m
 *     retention: 24h
 *   health:
 *     failure-threshold: 5
 *   delivery:
 *     core-pool-size: 4
 *     max-pool-size: 8
 *     queue-capacity: 2000
 *     keep-alive: 60s
 *     rejected-handler: CALLER_RUNS
 *   dispatch:
 *     core-pool-size: 2
 *     max-pool-size: 4
 *   channel:
 *     logging:
 *       enabled: true
 *       minimum-severity: INFO
 *       json: false
 *   shutdown:
 *     await: 10s
 */
@ConfigurationProperties(prefix = "alert")
public class AlertHubProperties {

    /** 总开关 */
    private boolean enabled = true;

    /** 全局最小级别 */
    private AlertSeverity minimumSeverity = AlertSeverity.INFO;

    /** 按来源覆盖的最小级别 */
    private Map<String, AlertSeverity> sourceMinimumSeverity = new LinkedHashMap<>();

    private History history = new History();

    private Maintenance maintenance = new Maintenance();

    private Health health = new Health();

    /** 渠道投递线程池 */
    private Exec delivery = new Exec(4, 8, 2000);

    /** raiseAsync / 批量操作线程池 */
    private Exec dispatch = new Exec(2, 4, 1000);

    private Channel channel = new Channel();

    private Shutdown shutdown = new Shutdown();

    // ----------------- 嵌套配置对象 -----------------

    public static class History {
        /** 历史环形缓冲容量, 必须 >= 1 */
        private int capacity = 1000;

        public int getCapacity() { return capacity; }
        public void setCapacity(int capacity) { this.capacity = capacity; }
    }

    public static class Maintenance {
        /** 是否定时执行维护 */
        private boolean enabled = true;

        /** 两次维护的最小间隔 */
        private Duration interval = Duration.ofMinutes(5);

        /** 已解决告警在登记表中的保留时长 */
        private Duration retention = Duration.ofHours(24);

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public Duration getInterval() { return interval; }
        public void setInterval(Duration interval) { this.interval = interval; }
        public Duration getRetention() { return retention; }
        public void setRetention(Duration retention) { this.retention = retention; }
    }

    public static class Health {
        /** 连续处理失败达到该值时管道报告不健康 */
        private int failureThreshold = 5;

        public int getFailureThreshold() { return failureThreshold; }
        public void setFailureThreshold(int failureThreshold) { this.failureThreshold = failureThreshold; }
    }

    public static class Exec {
        private int corePoolSize;

        private int maxPoolSize;

        /** 任务队列容量 */
        private int queueCapacity;

        /** 线程空闲存活时间 */
        private Duration keepAlive = Duration.ofSeconds(60);

        /** 拒绝策略：ABORT | CALLER_RUNS | DISCARD | DISCARD_OLDEST */
        private RejectedHandlerPolicy rejectedHandler = RejectedHandlerPolicy.CALLER_RUNS;

        public Exec() {
            this(2, 4, 1000);
        }

        Exec(int corePoolSize, int maxPoolSize, int queueCapacity) {
            this.corePoolSize = corePoolSize;
            this.maxPoolSize = maxPoolSize;
            this.queueCapacity = queueCapacity;
        }

        public int getCorePoolSize() { return corePoolSize; }
        public void setCorePoolSize(int corePoolSize) { this.corePoolSize = corePoolSize; }
        public int getMaxPoolSize() { return maxPoolSize; }
        public void setMaxPoolSize(int maxPoolSize) { this.maxPoolSize = maxPoolSize; }
        public int getQueueCapacity() { return queueCapacity; }
        public void setQueueCapacity(int queueCapacity) { this.queueCapacity = queueCapacity; }
        public Duration getKeepAlive() { return keepAlive; }
        public void setKeepAlive(Duration keepAlive) { this.keepAlive = keepAlive; }
        public RejectedHandlerPolicy getRejectedHandler() { return rejectedHandler; }
        public void setRejectedHandler(RejectedHandlerPolicy rejectedHandler) { this.rejectedHandler = rejectedHandler; }
    }

    public static class Channel {
        private Logging logging = new Logging();

        public Logging getLogging() { return logging; }
        public void setLogging(Logging logging) { this.logging = logging; }

        public static class Logging {
            private boolean enabled = true;

            private AlertSeverity minimumSeverity = AlertSeverity.INFO;

            /** 以 JSON 输出整条告警 */
            private boolean json = false;

            public boolean isEnabled() { return enabled; }
            public void setEnabled(boolean enabled) { this.enabled = enabled; }
            public AlertSeverity getMinimumSeverity() { return minimumSeverity; }
            public void setMinimumSeverity(AlertSeverity minimumSeverity) { this.minimumSeverity = minimumSeverity; }
            public boolean isJson() { return json; }
            public void setJson(boolean json) { this.json = json; }
        }
    }

    public static class Shutdown {
        /** 优雅停机等待时长 */
        private Duration await = Duration.ofSeconds(10);

        public Duration getAwait() { return await; }
        public void setAwait(Duration await) { this.await = await; }
    }

    // ----------------- 公共枚举 -----------------

    /** 线程池拒绝策略枚举（YAML 中大小写均可） */
    public enum RejectedHandlerPolicy {
        ABORT, CALLER_RUNS, DISCARD, DISCARD_OLDEST;

        public RejectedExecutionHandler toHandler() {
            return switch (this) {
                case ABORT -> new ThreadPoolExecutor.AbortPolicy();
                case CALLER_RUNS -> new ThreadPoolExecutor.CallerRunsPolicy();
                case DISCARD -> new ThreadPoolExecutor.DiscardPolicy();
                case DISCARD_OLDEST -> new ThreadPoolExecutor.DiscardOldestPolicy();
            };
        }
    }

    // ----------------- getters/setters 顶层 -----------------

    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }

    public AlertSeverity getMinimumSeverity() { return minimumSeverity; }
    public void setMinimumSeverity(AlertSeverity minimumSeverity) { this.minimumSeverity = minimumSeverity; }

    public Map<String, AlertSeverity> getSourceMinimumSeverity() { return sourceMinimumSeverity; }
    public void setSourceMinimumSeverity(Map<String, AlertSeverity> sourceMinimumSeverity) { this.sourceMinimumSeverity = sourceMinimumSeverity; }

    public History getHistory() { return history; }
    public void setHistory(History history) { this.history = history; }

    public Maintenance getMaintenance() { return maintenance; }
    public void setMaintenance(Maintenance maintenance) { this.maintenance = maintenance; }

    public Health getHealth() { return health; }
    public void setHealth(Health health) { this.health = health; }

    public Exec getDelivery() { return delivery; }
    public void setDelivery(Exec delivery) { this.delivery = delivery; }

    public Exec getDispatch() { return dispatch; }
    public void setDispatch(Exec dispatch) { this.dispatch = dispatch; }

    public Channel getChannel() { return channel; }
    public void setChannel(Channel channel) { this.channel = channel; }

    public Shutdown getShutdown() { return shutdown; }
    public void setShutdown(Shutdown shutdown) { this.shutdown = shutdown; }
}
