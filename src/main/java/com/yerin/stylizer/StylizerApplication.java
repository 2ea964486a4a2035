package com.yerin.stylizer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class StylizerApplication {

	public static void main(String[] args) {
		SpringApplication.run(StylizerApplication.class, args);
	}

}
