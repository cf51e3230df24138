package com.nft.marketplace.nft_marketplace;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class NftMarketplaceApplication {

	public static void main(String[] args) {
		SpringApplication.run(NftMarketplaceApplication.class, args);
	}

}
