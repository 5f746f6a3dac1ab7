package com.churnmetrics.api;

import com.fasterxml.jackson.databind.SerializationFeature;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.Banner;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.jackson.Jackson2ObjectMapperBuilderCustomizer;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.boot.info.BuildProperties;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.context.annotation.Bean;
import org.springframework.stereotype.Component;

@SpringBootApplication
@EnableCaching
@ConfigurationPropertiesScan(basePackageClasses = Application.class)
public class Application {

    public static void main(String[] args) {
        new SpringApplicationBuilder(Application.class)
            .bannerMode(Banner.Mode.OFF)
            .run(args);
    }

    @NonNull
    @Bean
    Jackson2ObjectMapperBuilderCustomizer objectMapperBuilderCustomizer() {
        // report days are calendar dates, write them as 'yyyy-MM-dd'.
        return builder -> builder.featuresToDisable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    @NonNull
    @Bean
    OpenAPI openAPI(@NonNull BuildProperties buildProperties) {
        return new OpenAPI()
            .info(
                new Info()
                    .title("Churn Analytics API")
                    .version(String.format("v%s", buildProperties.getVersion())));
    }

    @Component
    @Slf4j
    static class ApplicationVersionLogger implements ApplicationRunner {

        @Autowired
        private BuildProperties buildProperties;

        @Override
        public void run(ApplicationArguments args) {
            log.info("Running {} version: v{}", buildProperties.getName(), buildProperties.getVersion());
        }
    }
}
