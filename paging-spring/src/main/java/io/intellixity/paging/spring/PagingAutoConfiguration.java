package io.intellixity.paging.spring;

import io.intellixity.paging.paging.PagingSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import java.util.List;

@AutoConfiguration
@EnableConfigurationProperties(PagingProperties.class)
public class PagingAutoConfiguration {
  private static final Logger log = LoggerFactory.getLogger(PagingAutoConfiguration.class);

  @Bean
  @ConditionalOnMissingBean
  public PagingSettings pagingSettings(PagingProperties props) {
    PagingSettings settings = props.toSettings();
    log.info("paging.settings pageSize={} ignoredParams={} paramNames={}",
        settings.pageSize(), settings.ignoredParams(), settings.paramNames());
    return settings;
  }

  @Configuration(proxyBeanMethods = false)
  @ConditionalOnWebApplication(type = ConditionalOnWebApplication.Type.SERVLET)
  @ConditionalOnClass(WebMvcConfigurer.class)
  static class WebConfiguration {
    @Bean
    public RequestParamsArgumentResolver requestParamsArgumentResolver() {
      return new RequestParamsArgumentResolver();
    }

    @Bean
    public WebMvcConfigurer pagingWebMvcConfigurer(RequestParamsArgumentResolver resolver) {
      return new WebMvcConfigurer() {
        @Override
        public void addArgumentResolvers(List<HandlerMethodArgumentResolver> resolvers) {
          resolvers.add(resolver);
        }
      };
    }

    @Bean
    @ConditionalOnMissingBean
    public PagingExceptionHandler pagingExceptionHandler() {
      return new PagingExceptionHandler();
    }
  }
}
