package dev.univer.reportdispatcher;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ReportDispatcherApplication {
    public static void main(String[] args) {
        SpringApplication.run(ReportDispatcherApplication.class, args);
    }
}
