package com.clusterscope.cloud;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.context.annotation.Bean;

@SpringBootApplication
public class ClusterScopeApplication {

    private static volatile ConfigurableApplicationContext context;
    private static String[] launchArgs = new String[0];

    public static void main(String[] args) {
        System.setProperty("user.timezone", "UTC");
        launchArgs = args;
        context = SpringApplication.run(ClusterScopeApplication.class, args);
    }

    /**
     * Closes the running context and starts a fresh one with the launch arguments.
     */
    public static void restart() {
        ConfigurableApplicationContext running = context;
        Thread thread = new Thread(() -> {
            if (running != null) {
                running.close();
            }
            context = SpringApplication.run(ClusterScopeApplication.class, launchArgs);
        }, "app-restart");
        thread.setDaemon(false);
        thread.start();
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
        return mapper;
    }
}
