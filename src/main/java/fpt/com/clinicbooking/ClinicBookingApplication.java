package fpt.com.clinicbooking;

import fpt.com.clinicbooking.common.config.ClinicProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.event.EventListener;
import org.springframework.core.env.Environment;

@Slf4j
@SpringBootApplication
@EnableConfigurationProperties(ClinicProperties.class)
public class ClinicBookingApplication {

    private final Environment env;

    public ClinicBookingApplication(Environment env) {
        this.env = env;
    }

    public static void main(String[] args) {
        SpringApplication.run(ClinicBookingApplication.class, args);
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        String port = env.getProperty("local.server.port", env.getProperty("server.port", "8080"));
        log.info("Clinic booking service started on port {}", port);
    }
}
