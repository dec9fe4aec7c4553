package it.berlink.querywatch.spring.config;

import it.berlink.querywatch.QueryWatchEngine;
import it.berlink.querywatch.aggregate.PatternAggregator;
import it.berlink.querywatch.analysis.StatementAnalyzer;
import it.berlink.querywatch.classifier.QueryClassifier;
import it.berlink.querywatch.config.ThresholdConfig;
import it.berlink.querywatch.log.StatementLog;
import it.berlink.querywatch.log.ThreadLocalStatementLog;
import it.berlink.querywatch.normalizer.SqlNormalizer;
import it.berlink.querywatch.reporter.LiveReporter;
import it.berlink.querywatch.scope.ScopeTracker;
import it.berlink.querywatch.spring.web.QueryMonitoringFilter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.Ordered;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Auto-configuration for QueryWatch.
 *
 * Every bean backs off when the application defines its own. The request
 * filter is only registered in servlet web applications.
 */
@Slf4j
@AutoConfiguration
@EnableConfigurationProperties(QueryWatchProperties.class)
public class QueryWatchAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public ThresholdConfig thresholdConfig(QueryWatchProperties properties) {
        ThresholdConfig config = properties.toThresholdConfig();
        log.info("QueryWatch thresholds: {}", config);
        return config;
    }

    @Bean
    @ConditionalOnMissingBean(StatementLog.class)
    public ThreadLocalStatementLog statementLog(QueryWatchProperties properties) {
        ThreadLocalStatementLog statementLog = ThreadLocalStatementLog.getInstance();
        statementLog.setCapacity(properties.getLogCapacity());
        return statementLog;
    }

    @Bean
    @ConditionalOnMissingBean
    public SqlNormalizer sqlNormalizer(ThresholdConfig config) {
        return new SqlNormalizer(config.getMaxPatternLength());
    }

    @Bean
    @ConditionalOnMissingBean
    public PatternAggregator patternAggregator(SqlNormalizer sqlNormalizer) {
        return new PatternAggregator(sqlNormalizer);
    }

    @Bean
    @ConditionalOnMissingBean
    public QueryClassifier queryClassifier() {
        return new QueryClassifier();
    }

    @Bean
    @ConditionalOnMissingBean
    public StatementAnalyzer statementAnalyzer(PatternAggregator patternAggregator,
                                               QueryClassifier queryClassifier,
                                               ThresholdConfig config) {
        return new StatementAnalyzer(patternAggregator, queryClassifier, config);
    }

    @Bean
    @ConditionalOnMissingBean
    public LiveReporter liveReporter(ThresholdConfig config) {
        return new LiveReporter(config);
    }

    @Bean
    @ConditionalOnMissingBean
    public QueryWatchEngine queryWatchEngine(StatementLog statementLog,
                                             StatementAnalyzer statementAnalyzer,
                                             LiveReporter liveReporter,
                                             QueryWatchProperties properties) {
        return new QueryWatchEngine(new ScopeTracker(statementLog), statementAnalyzer, liveReporter,
            properties.isEnabled());
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnWebApplication(type = ConditionalOnWebApplication.Type.SERVLET)
    @ConditionalOnClass(OncePerRequestFilter.class)
    @ConditionalOnProperty(prefix = "querywatch", name = "enabled", havingValue = "true", matchIfMissing = true)
    static class ServletFilterConfiguration {

        @Bean
        @ConditionalOnMissingBean(name = "queryMonitoringFilterRegistration")
        public FilterRegistrationBean<QueryMonitoringFilter> queryMonitoringFilterRegistration(
                QueryWatchEngine engine,
                StatementLog statementLog,
                QueryWatchProperties properties) {
            QueryMonitoringFilter filter = new QueryMonitoringFilter(engine, statementLog,
                properties.getIgnoredPathPrefixes(), properties.isExposeHeaders());

            FilterRegistrationBean<QueryMonitoringFilter> registration = new FilterRegistrationBean<>(filter);
            registration.setName("queryMonitoringFilter");
            registration.setOrder(Ordered.HIGHEST_PRECEDENCE + 10);
            return registration;
        }
    }
}
