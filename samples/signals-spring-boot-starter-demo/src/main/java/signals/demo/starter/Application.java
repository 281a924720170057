package signals.demo.starter;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Spring Boot Starter demo: zero-config signal hub.
 *
 * <p>The starter creates the {@code SignalHub} bean and registers every
 * {@code @SignalListener} component on it. {@link DemoRunner} then dispatches a few
 * signals to show consuming, pausing and resuming.
 *
 * <p>Run with: mvn install -DskipTests && mvn -f samples/signals-spring-boot-starter-demo/pom.xml spring-boot:run
 */
@SpringBootApplication
public class Application {

    public static void main(String[] args) {
        SpringApplication.run(Application.class, args);
    }
}
