package com.williamcallahan.agentbridge.web;

import com.williamcallahan.agentbridge.config.AppProperties;
import com.williamcallahan.agentbridge.domain.status.ServiceStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class StatusController {

    private final AppProperties appProperties;

    public StatusController(AppProperties appProperties) {
        this.appProperties = appProperties;
    }

    @GetMapping("/")
    public ServiceStatus status() {
        return ServiceStatus.ok(appProperties.getServiceName(), appProperties.getServiceVersion());
    }
}
