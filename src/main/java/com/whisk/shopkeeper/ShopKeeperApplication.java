package com.whisk.shopkeeper;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class ShopKeeperApplication {

	public static void main(String[] args) {
		SpringApplication.run(ShopKeeperApplication.class, args);
	}

}
