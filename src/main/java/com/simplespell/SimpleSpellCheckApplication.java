package com.simplespell;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SimpleSpellCheckApplication {

	public static void main(String[] args) {
		SpringApplication.run(SimpleSpellCheckApplication.class, args);
	}

}
