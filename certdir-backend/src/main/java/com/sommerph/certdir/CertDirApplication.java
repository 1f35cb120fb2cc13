package com.sommerph.certdir;

import com.sommerph.certdir.config.StorageProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(StorageProperties.class)
public class CertDirApplication {

	public static void main(String[] args) {
		SpringApplication.run(CertDirApplication.class, args);
	}

}
