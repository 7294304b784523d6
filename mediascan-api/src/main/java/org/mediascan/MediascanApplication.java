package org.mediascan;

import org.mediascan.config.NamingProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@EnableConfigurationProperties(NamingProperties.class)
@SpringBootApplication
public class MediascanApplication {

    public static void main(String[] args) {
        SpringApplication.run(MediascanApplication.class, args);
    }
}
