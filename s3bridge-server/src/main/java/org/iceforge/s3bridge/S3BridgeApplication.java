package org.iceforge.s3bridge;

import org.iceforge.s3bridge.config.S3BridgeProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(S3BridgeProperties.class)
public class S3BridgeApplication {

	public static void main(String[] args) {
		SpringApplication.run(S3BridgeApplication.class, args);
	}

}
