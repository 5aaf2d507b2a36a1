package com.study.webflux.voice;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class VoicePipelineApplication {

	public static void main(String[] args) {
		SpringApplication.run(VoicePipelineApplication.class, args);
	}
}
