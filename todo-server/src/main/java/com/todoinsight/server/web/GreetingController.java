package com.todoinsight.server.web;

import com.todoinsight.server.web.dto.GreetingResponse;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class GreetingController {

    private final GreetingResponse greeting;

    public GreetingController(@Value("${todo.greeting:Hello world!}") String greeting) {
        this.greeting = new GreetingResponse(greeting);
    }

    @GetMapping("/api/greeting")
    public GreetingResponse greeting() {
        return greeting;
    }
}
