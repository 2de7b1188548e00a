package com.id.swl.modules.health.rest;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("v1")
public class HealthRest {

    @GetMapping("health")
    public Map<String, String> health() {
        return Map.of("status", "ok");
    }
}
