package com.jfind.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
public class JFindConfig implements WebMvcConfigurer {
    private final JFindProperties properties;

    public JFindConfig(JFindProperties properties) {
        this.properties = properties;
    }

    @Bean(name = "submitTransactionTemplate")
    public TransactionTemplate submitTransactionTemplate(PlatformTransactionManager transactionManager) {
        TransactionTemplate template = new TransactionTemplate(transactionManager);
        template.setIsolationLevel(TransactionDefinition.ISOLATION_READ_COMMITTED);
        template.setName("scan-submit");
        return template;
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        JFindProperties.Cors cors = properties.getCors();
        registry.addMapping("/api/**")
            .allowedOriginPatterns(cors.getAllowedOrigins().toArray(new String[0]))
            .allowedMethods("*")
            .allowedHeaders("*")
            .allowCredentials(cors.isAllowCredentials());
    }
}
