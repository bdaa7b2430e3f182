package org.certforge;

import org.certforge.config.TemplateProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@EnableConfigurationProperties(TemplateProperties.class)
@SpringBootApplication
public class CertforgeApplication {

    public static void main(String[] args) {
        System.setProperty("java.awt.headless", "true");
        SpringApplication.run(CertforgeApplication.class, args);
    }
}
