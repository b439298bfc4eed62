package org.smileyface.pageextractor;

import org.smileyface.pageextractor.config.ExtractorProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(ExtractorProperties.class)
public class PageExtractorApplication {

	public static void main(String[] args) {
		SpringApplication.run(PageExtractorApplication.class, args);
	}
}
