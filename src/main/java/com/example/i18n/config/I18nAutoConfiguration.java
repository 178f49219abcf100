package com.example.i18n.config;

import com.example.i18n.catalog.CatalogLoader;
import com.example.i18n.catalog.MessageCatalog;
import com.example.i18n.resolve.DebugPolicy;
import com.example.i18n.resolve.MessageResolver;
import com.example.i18n.response.EnvelopeAssembler;
import com.example.i18n.web.EnvelopeExceptionHandler;
import com.example.i18n.web.EnvelopeWriter;
import com.example.i18n.web.I18nResponder;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;

import java.nio.file.Path;

/**
 * Loads the message catalog at startup and wires the resolver and responder.
 * A missing, empty or malformed language directory fails context startup.
 */
@AutoConfiguration(after = JacksonAutoConfiguration.class)
@EnableConfigurationProperties(I18nProperties.class)
public class I18nAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(I18nAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public MessageCatalog messageCatalog(I18nProperties properties) {
        return CatalogLoader.load(Path.of(properties.getLangDir()));
    }

    @Bean
    @ConditionalOnMissingBean
    public MessageResolver messageResolver(MessageCatalog catalog, I18nProperties properties) {
        return new MessageResolver(catalog, properties.getDefaultLang());
    }

    @Bean
    @ConditionalOnMissingBean
    public DebugPolicy debugPolicy(I18nProperties properties, Environment environment) {
        String runEnv = environment.getProperty(properties.getEnvKey(), "");
        log.info("i18n run mode {}={}, debug mode {}", properties.getEnvKey(), runEnv, properties.isDebugMode());
        return new DebugPolicy(runEnv, properties.isDebugMode());
    }

    @Bean
    @ConditionalOnMissingBean
    public EnvelopeAssembler envelopeAssembler(MessageResolver resolver, DebugPolicy debugPolicy) {
        return new EnvelopeAssembler(resolver, debugPolicy);
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnWebApplication(type = ConditionalOnWebApplication.Type.SERVLET)
    static class WebConfiguration {

        @Bean
        @ConditionalOnMissingBean
        public EnvelopeWriter envelopeWriter(ObjectProvider<ObjectMapper> objectMapper) {
            return new EnvelopeWriter(objectMapper.getIfAvailable(ObjectMapper::new));
        }

        @Bean
        @ConditionalOnMissingBean
        public I18nResponder i18nResponder(EnvelopeAssembler assembler, EnvelopeWriter writer,
                                           I18nProperties properties) {
            return new I18nResponder(assembler, writer, properties);
        }

        @Bean
        @ConditionalOnMissingBean
        @ConditionalOnProperty(prefix = "i18n", name = "exception-handler", havingValue = "true", matchIfMissing = true)
        public EnvelopeExceptionHandler envelopeExceptionHandler(I18nResponder responder, I18nProperties properties) {
            return new EnvelopeExceptionHandler(responder, properties.getErrorCode());
        }
    }
}
