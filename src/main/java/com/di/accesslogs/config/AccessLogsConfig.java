package com.di.accesslogs.config;

import com.di.accesslogs.source.AccessLogSource;
import com.di.accesslogs.source.AccessLogSourceRegistry;
import com.di.accesslogs.source.LogSourceProfile;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Builds the validated settings and the active log source profile once at startup.
 * A {@link ConfigurationException} here aborts context refresh, so no job ever runs half-configured.
 */
@Slf4j
@Configuration
public class AccessLogsConfig {

    @Bean
    public AccessLogsSettings accessLogsSettings(AccessLogsProperties properties,
                                                 AccessLogSourceRegistry registry) {
        AccessLogsSettings settings = properties.toSettings(registry.getRegisteredTypes());
        log.info("[CONFIG] logSource={} groupedFolder={} workgroup={} database={} sourceTable={} targetTable={}",
                settings.logSource(), settings.groupedFolder(), settings.query().workgroup(),
                settings.query().database(), settings.query().sourceTable(), settings.query().targetTable());
        return settings;
    }

    @Bean
    public LogSourceProfile logSourceProfile(AccessLogsSettings settings, AccessLogSourceRegistry registry) {
        AccessLogSource source = registry.getSource(settings.logSource());
        LogSourceProfile profile = LogSourceProfile.of(
                source, settings.rawKeyPattern(), settings.transformationOptions());
        log.info("[CONFIG] rawKeyPattern={} filter={} columnRules={}",
                profile.rawKeyPattern(), profile.objectFilter(), profile.columnTransformationRules());
        return profile;
    }

    @Bean
    @ConditionalOnMissingBean(Clock.class)
    public Clock clock() {
        return Clock.systemUTC();
    }
}
