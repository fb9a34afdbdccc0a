package com.dev.watchsync;

import com.dev.watchsync.config.SyncProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(SyncProperties.class)
public class WatchsyncApplication {

	public static void main(String[] args) {
		SpringApplication.run(WatchsyncApplication.class, args);
	}

}
