package org.assetlink;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;

@SpringBootApplication
@EnableAsync
public class AssetLinkApplication {
    public static void main(String[] args) {
        SpringApplication.run(AssetLinkApplication.class, args);
    }
}
