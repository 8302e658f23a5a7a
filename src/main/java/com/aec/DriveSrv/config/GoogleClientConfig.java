package com.aec.DriveSrv.config;

import com.google.api.client.googleapis.javanet.GoogleNetHttpTransport;
import com.google.api.client.http.HttpTransport;
import com.google.api.client.json.JsonFactory;
import com.google.api.client.json.jackson2.JacksonFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.security.GeneralSecurityException;
import java.time.Clock;

/**
 * Process-wide HTTP transport, JSON factory and clock shared by the Google clients.
 */
@Configuration
public class GoogleClientConfig {

    @Bean
    public HttpTransport googleHttpTransport() throws GeneralSecurityException, IOException {
        return GoogleNetHttpTransport.newTrustedTransport();
    }

    @Bean
    public JsonFactory googleJsonFactory() {
        return JacksonFactory.getDefaultInstance();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
