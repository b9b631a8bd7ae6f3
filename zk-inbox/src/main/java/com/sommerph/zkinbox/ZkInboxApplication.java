package com.sommerph.zkinbox;

import com.sommerph.zkinbox.config.InboxProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@EnableScheduling
@SpringBootApplication
@EnableConfigurationProperties(InboxProperties.class)
public class ZkInboxApplication {

	public static void main(String[] args) {
		SpringApplication.run(ZkInboxApplication.class, args);
	}

}
