package dao.bridge.dataworker;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class DataworkerApplication {

    public static void main(String[] args) {
        SpringApplication.run(DataworkerApplication.class, args);
    }
}
