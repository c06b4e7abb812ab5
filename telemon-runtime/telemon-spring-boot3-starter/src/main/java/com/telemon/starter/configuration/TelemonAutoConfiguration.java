package com.telemon.starter.configuration;

import com.telemon.api.monitor.Monitor;
import com.telemon.core.monitor.DefaultMonitor;
import com.telemon.starter.config.TelemonProperties;
import com.telemon.starter.filter.TraceHeaderFilter;
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
import org.springframework.core.env.Environment;

@Slf4j
@AutoConfiguration
@EnableConfigurationProperties(TelemonProperties.class)
@ConditionalOnProperty(prefix = "telemon", name = "enabled", havingValue = "true", matchIfMissing = true)
public class TelemonAutoConfiguration {

    static final String DEFAULT_SERVICE_NAME = "application";

    // 1. 遥测门面，容器关闭时排空
    @Bean(destroyMethod = "shutdown")
    @ConditionalOnMissingBean(Monitor.class)
    public DefaultMonitor telemonMonitor(TelemonProperties properties, Environment environment) {
        String applicationName = environment.getProperty("spring.application.name", DEFAULT_SERVICE_NAME);
        DefaultMonitor monitor = new DefaultMonitor(properties.toConfig(applicationName));
        log.info("Telemon monitor registered for service {}", monitor.getConfig().getServiceName());
        return monitor;
    }

    // 2. Servlet 应用的入站追踪头
    @Configuration(proxyBeanMethods = false)
    @ConditionalOnWebApplication(type = ConditionalOnWebApplication.Type.SERVLET)
    @ConditionalOnClass(name = "jakarta.servlet.Filter")
    @ConditionalOnProperty(prefix = "telemon.web", name = "trace-propagation", havingValue = "true",
            matchIfMissing = true)
    static class WebTraceConfiguration {

        @Bean
        public FilterRegistrationBean<TraceHeaderFilter> telemonTraceHeaderFilter(Monitor monitor,
                                                                                  TelemonProperties properties) {
            FilterRegistrationBean<TraceHeaderFilter> registration = new FilterRegistrationBean<>(
                    new TraceHeaderFilter(monitor, properties.getWeb().isRequestSpans()));
            registration.setName("telemonTraceHeaderFilter");
            registration.setOrder(Ordered.HIGHEST_PRECEDENCE + 10);
            registration.addUrlPatterns("/*");
            return registration;
        }
    }
}
