package com.example;

import com.example.enrollment.config.PgProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.retry.annotation.EnableRetry;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.web.client.RestTemplate;

@EnableScheduling
@SpringBootApplication
@EnableAsync
@EnableRetry
@ConfigurationPropertiesScan
public class EnrollmentSystemApplication {

	public static void main(String[] args) {
		SpringApplication.run(EnrollmentSystemApplication.class, args);
	}

	@Bean
	public RestTemplate restTemplate(RestTemplateBuilder builder, PgProperties pgProperties) {
		return builder
			.rootUri(pgProperties.getBaseUrl())
			.setConnectTimeout(pgProperties.getConnectTimeout())
			.setReadTimeout(pgProperties.getReadTimeout())
			.build();
	}
}
