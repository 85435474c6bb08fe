package ai.bundlewatch.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class BundleWatchApplication {

    public static void main(String[] args) {
        SpringApplication.run(BundleWatchApplication.class, args);
    }
}
