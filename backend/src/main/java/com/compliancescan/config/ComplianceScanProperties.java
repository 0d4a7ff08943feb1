package com.compliancescan.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * 合规扫描配置，对应 application.yml 中的 {@code compliance-scan.*}
 */
@Data
@ConfigurationProperties(prefix = "compliance-scan")
public class ComplianceScanProperties {

    private Target target = new Target();
    private Scan scan = new Scan();
    private Validator validator = new Validator();
    private Scheduler scheduler = new Scheduler();
    private Translator translator = new Translator();

    /**
     * 目标数据库连接
     */
    @Data
    public static class Target {
        private String jdbcUrl;
        private String username;
        private String password;
        /** 获取连接的超时时间 */
        private Duration connectTimeout = Duration.ofSeconds(10);
    }

    @Data
    public static class Scan {
        /** 单条查询超时 */
        private Duration queryTimeout = Duration.ofSeconds(30);
        /** 整次扫描超时，超时后未开始的规则记为跳过 */
        private Duration runTimeout = Duration.ofMinutes(30);
        /** 单条规则返回的最大行数 */
        private int maxRows = 1000;
        /** 规则并发执行数，同时也是目标库连接池大小 */
        private int workerThreads = 2;
        /** 结构快照最长缓存时间 */
        private Duration schemaMaxAge = Duration.ofHours(1);
        /** 已校验查询的最大缓存条数 */
        private long queryCacheSize = 1000;
    }

    @Data
    public static class Validator {
        private int maxSubqueryDepth = 3;
        private int maxJoins = 8;
        private int maxTokens = 2000;
    }

    @Data
    public static class Scheduler {
        /** 后台检查定时任务的间隔（毫秒） */
        private long tickMillis = 30_000;
        private int defaultIntervalMinutes = 360;
        private boolean enabledOnStartup = false;
        private int maxRetries = 3;
        private Duration baseRetryDelay = Duration.ofMinutes(1);
        private Duration maxRetryDelay = Duration.ofMinutes(30);
    }

    /**
     * 规则翻译服务（OpenAI 兼容接口）；未配置 apiKey 时禁用
     */
    @Data
    public static class Translator {
        private String baseUrl = "https://api.openai.com/v1";
        private String apiKey;
        private String model = "gpt-4o-mini";
        private Duration timeout = Duration.ofSeconds(60);
        private int threads = 2;
        /** 每次扫描最多为多少条新增违规生成说明与整改建议，其余使用模板 */
        private int maxExplanationsPerRun = 20;
    }
}
