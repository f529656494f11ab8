package com.planmarshall;

import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;

@SpringBootApplication
public class PlanMarshallApplication {

    public static void main(String[] args) {
        // Library-style host: no web server, plans are driven through PlanOrchestrator.
        new SpringApplicationBuilder(PlanMarshallApplication.class)
                .web(WebApplicationType.NONE)
                .properties("spring.main.banner-mode=off")
                .run(args);
    }
}
