package fpt.com.clinicbooking.common.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "clinic")
public class ClinicProperties {

    private Pagination pagination = new Pagination();
    private Bootstrap bootstrap = new Bootstrap();

    @Data
    public static class Pagination {
        private int defaultSize = 10;
        private int maxSize = 100;
    }

    @Data
    public static class Bootstrap {
        private Admin admin = new Admin();
    }

    /**
     * Account provisioned at start-up when no user with {@code username} exists yet.
     */
    @Data
    public static class Admin {
        private boolean enabled = false;
        private String username = "admin";
        private String email = "admin@clinic.local";
        private String password;
        private String fullName = "System Administrator";
    }
}
