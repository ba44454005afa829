package com.whisk.shopkeeper.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "shop")
public class ShopProperties {

    private final Invoice invoice = new Invoice();
    private final Auth auth = new Auth();
    private final Seed seed = new Seed();

    @Data
    public static class Invoice {
        private String prefix = "WHISK";

        // latest-invoice | counter
        private String numbering = "latest-invoice";
    }

    @Data
    public static class Auth {
        private Duration tokenTtl = Duration.ofHours(24);
    }

    @Data
    public static class Seed {
        private boolean enabled = true;
    }
}
