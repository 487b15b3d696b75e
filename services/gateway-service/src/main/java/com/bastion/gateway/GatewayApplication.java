package com.bastion.gateway;

import com.bastion.gateway.config.GatewayProperties;
import com.bastion.gateway.config.ServiceProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Bastion gateway: authenticates bearer credentials, applies the path and device policy and
 * relays allowed requests to the protected or default backend.
 */
@SpringBootApplication
@EnableConfigurationProperties({ServiceProperties.class, GatewayProperties.class})
public class GatewayApplication {

    public static void main(String[] args) {
        SpringApplication.run(GatewayApplication.class, args);
    }
}
