package com.proxy.link;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ProxyLinkApplication {

    public static void main(String[] args) {
        SpringApplication.run(ProxyLinkApplication.class, args);
    }
}
