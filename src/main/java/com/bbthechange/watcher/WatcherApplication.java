package com.bbthechange.watcher;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class WatcherApplication {

	public static void main(String[] args) {
		SpringApplication app = new SpringApplication(WatcherApplication.class);
		System.exit(SpringApplication.exit(app.run(args)));
	}
}
