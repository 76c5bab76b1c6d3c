package it.unimib.datai.funcorch.controlplane;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Handlers annotated with {@code @OrchestratedFunction} anywhere under {@code it.unimib.datai.funcorch}
 * are picked up from the classpath.
 */
@SpringBootApplication(scanBasePackages = "it.unimib.datai.funcorch")
@ConfigurationPropertiesScan
public class ControlPlaneApplication {

    public static void main(String[] args) {
        SpringApplication.run(ControlPlaneApplication.class, args);
    }
}
