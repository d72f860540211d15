package com.retail.billkeeper;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class BillKeeperApplication {

	public static void main(String[] args) {
		SpringApplication.run(BillKeeperApplication.class, args);
	}

}
