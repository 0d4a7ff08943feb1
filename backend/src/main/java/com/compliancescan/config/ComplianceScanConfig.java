package com.compliancescan.config;

import com.compliancescan.rule.checker.QueryChecker;
import com.compliancescan.rule.checker.ValidationLimits;
import com.compliancescan.scheduler.ScanStateMachine;
import com.compliancescan.service.QuerySynthesizer;
import com.compliancescan.service.QueryValidator;
import com.compliancescan.service.ScanCoordinator;
import com.compliancescan.service.ScanExecutor;
import com.compliancescan.service.SchemaSnapshotService;
import com.compliancescan.service.TargetDatabase;
import com.compliancescan.service.ViolationDiffEngine;
import com.compliancescan.service.ViolationExplanationService;
import com.compliancescan.service.ViolationMaterializer;
import com.compliancescan.store.ReviewQueue;
import com.compliancescan.store.RuleCatalog;
import com.compliancescan.store.ScanRunStore;
import com.compliancescan.store.ViolationStore;
import com.compliancescan.translator.OpenAiRuleTranslator;
import com.compliancescan.translator.RuleTranslator;
import com.compliancescan.translator.UnavailableRuleTranslator;
import com.compliancescan.translator.ViolationExplainer;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 扫描引擎组件装配
 */
@Configuration
@EnableConfigurationProperties(ComplianceScanProperties.class)
public class ComplianceScanConfig {

    private static final Logger log = LoggerFactory.getLogger(ComplianceScanConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * 目标库连接池，大小与规则并发数一致；启动时不要求目标库可用
     */
    @Bean(destroyMethod = "close")
    public HikariDataSource targetDataSource(ComplianceScanProperties properties) {
        ComplianceScanProperties.Target target = properties.getTarget();
        HikariConfig config = new HikariConfig();
        config.setPoolName("compliance-scan-target");
        config.setJdbcUrl(target.getJdbcUrl());
        config.setUsername(target.getUsername());
        config.setPassword(target.getPassword());
        config.setMaximumPoolSize(Math.max(1, properties.getScan().getWorkerThreads()));
        config.setMinimumIdle(0);
        config.setReadOnly(true);
        config.setConnectionTimeout(target.getConnectTimeout().toMillis());
        config.setInitializationFailTimeout(-1);
        log.info("目标库连接池: {} (最大连接数 {})", target.getJdbcUrl(), config.getMaximumPoolSize());
        return new HikariDataSource(config);
    }

    @Bean
    public TargetDatabase targetDatabase(HikariDataSource targetDataSource) {
        return new TargetDatabase(targetDataSource);
    }

    @Bean
    public SchemaSnapshotService schemaSnapshotService(TargetDatabase targetDatabase, Clock clock,
                                                       ComplianceScanProperties properties) {
        return new SchemaSnapshotService(targetDatabase, clock, properties.getScan().getSchemaMaxAge());
    }

    @Bean
    public RuleTranslator ruleTranslator(RestTemplateBuilder restTemplateBuilder, ObjectMapper objectMapper,
                                         ComplianceScanProperties properties) {
        ComplianceScanProperties.Translator translator = properties.getTranslator();
        if (translator.getApiKey() == null || translator.getApiKey().isBlank()) {
            log.warn("未配置规则翻译服务 apiKey，只有带预置查询的规则会被执行");
            return new UnavailableRuleTranslator();
        }
        return new OpenAiRuleTranslator(
                restTemplateBuilder
                        .setConnectTimeout(translator.getTimeout())
                        .setReadTimeout(translator.getTimeout())
                        .build(),
                objectMapper, translator.getBaseUrl(), translator.getApiKey(), translator.getModel());
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService translatorExecutor(ComplianceScanProperties properties) {
        return Executors.newFixedThreadPool(Math.max(1, properties.getTranslator().getThreads()),
                namedThreads("rule-translator"));
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService scanWorkers(ComplianceScanProperties properties) {
        return Executors.newFixedThreadPool(Math.max(1, properties.getScan().getWorkerThreads()),
                namedThreads("scan-worker"));
    }

    @Bean
    public QuerySynthesizer querySynthesizer(RuleTranslator ruleTranslator,
                                             @Qualifier("translatorExecutor") ExecutorService translatorExecutor,
                                             ReviewQueue reviewQueue, Clock clock,
                                             ComplianceScanProperties properties) {
        return new QuerySynthesizer(ruleTranslator, translatorExecutor, properties.getTranslator().getTimeout(),
                reviewQueue, clock);
    }

    /**
     * 检查器按 {@link org.springframework.core.annotation.Order} 排序注入
     */
    @Bean
    public QueryValidator queryValidator(List<QueryChecker> checkers, ComplianceScanProperties properties) {
        ComplianceScanProperties.Validator validator = properties.getValidator();
        ValidationLimits limits = new ValidationLimits(validator.getMaxSubqueryDepth(), validator.getMaxJoins(),
                validator.getMaxTokens(), properties.getScan().getMaxRows());
        return new QueryValidator(checkers, limits);
    }

    @Bean
    public ScanExecutor scanExecutor(TargetDatabase targetDatabase, SchemaSnapshotService schemaSnapshotService,
                                     QuerySynthesizer querySynthesizer, QueryValidator queryValidator,
                                     ViolationMaterializer violationMaterializer, ReviewQueue reviewQueue,
                                     @Qualifier("scanWorkers") ExecutorService scanWorkers, Clock clock,
                                     ComplianceScanProperties properties) {
        return new ScanExecutor(targetDatabase, schemaSnapshotService, querySynthesizer, queryValidator,
                violationMaterializer, reviewQueue, scanWorkers, properties.getScan().getQueryTimeout(),
                properties.getScan().getQueryCacheSize(), clock);
    }

    /**
     * 翻译服务同时提供违规说明时使用它，否则只保留模板文本
     */
    @Bean
    public ViolationExplanationService violationExplanationService(
            RuleTranslator ruleTranslator, @Qualifier("translatorExecutor") ExecutorService translatorExecutor,
            ComplianceScanProperties properties) {
        ComplianceScanProperties.Translator translator = properties.getTranslator();
        ViolationExplainer explainer = ruleTranslator instanceof ViolationExplainer available
                ? available
                : new UnavailableRuleTranslator();
        return new ViolationExplanationService(explainer, translatorExecutor, translator.getTimeout(),
                translator.getMaxExplanationsPerRun());
    }

    @Bean
    public ScanStateMachine scanStateMachine(Clock clock, ComplianceScanProperties properties) {
        ComplianceScanProperties.Scheduler scheduler = properties.getScheduler();
        return new ScanStateMachine(clock, scheduler.getDefaultIntervalMinutes(), scheduler.isEnabledOnStartup(),
                scheduler.getMaxRetries(), scheduler.getBaseRetryDelay(), scheduler.getMaxRetryDelay());
    }

    @Bean
    public ScanCoordinator scanCoordinator(ScanStateMachine scanStateMachine,
                                           SchemaSnapshotService schemaSnapshotService, RuleCatalog ruleCatalog,
                                           ScanExecutor scanExecutor, ViolationDiffEngine violationDiffEngine,
                                           ViolationExplanationService violationExplanationService,
                                           ViolationStore violationStore, ScanRunStore scanRunStore, Clock clock,
                                           ComplianceScanProperties properties) {
        return new ScanCoordinator(scanStateMachine, schemaSnapshotService, ruleCatalog, scanExecutor,
                violationDiffEngine, violationExplanationService, violationStore, scanRunStore, clock,
                properties.getScan().getRunTimeout());
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
