package chatfeed.demo.starter;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Chat backend demo for the change feed starter.
 *
 * <p>The starter installs the trigger on {@code messages}, connects the listener on
 * startup and subscribes every {@code @MessageChangeHandler} bean. Point
 * {@code spring.datasource.*} at a PostgreSQL database and run with:
 * mvn install -DskipTests && mvn -f samples/chatfeed-spring-boot-starter-demo/pom.xml spring-boot:run
 *
 * <p>Endpoints:
 * GET  /api/health                     - database and listener status
 * GET  /api/health/detailed            - adds database latency and listener state
 * GET  /api/test/listener-status       - listener status only
 * POST /api/test/notification          - send a TEST notification through the feed
 * POST /api/test/simulate-message      - insert a message so the trigger fires
 */
@SpringBootApplication
public class Application {

    public static void main(String[] args) {
        SpringApplication.run(Application.class, args);
    }
}
