package com.bountypipe.screener;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class BountyScreenerApplication {

	public static void main(String[] args) {
		SpringApplication.run(BountyScreenerApplication.class, args);
	}

}
