package com.lctp.trio;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LctpTrioApplication {

	public static void main(String[] args) {
		SpringApplication.run(LctpTrioApplication.class, args);
	}

}
