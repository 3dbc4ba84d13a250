package com.propertyintel.hydrant.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Sends pipeline alerts as WARN lines on the dedicated alerts logger.
 */
@Component
@Slf4j(topic = "com.propertyintel.hydrant.alerts")
public class AlertNotifier {

    public void notify(String message) {
        log.warn("ALERT: {}", message);
    }
}
