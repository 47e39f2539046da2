package logwatcher;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LogWatcherServApplication {

    public static void main(String[] args) {
        SpringApplication.run(LogWatcherServApplication.class, args);
    }

}
