package com.jasmin.floodguard.services;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.jasmin.floodguard.models.DetectionVerdict;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.Map;

@Service
@RequiredArgsConstructor
@Slf4j
public class SecurityAlertPublisher {

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;

    public void publishAlert(DetectionVerdict verdict) {
        Map<String, Object> alert = new HashMap<>();
        alert.put("source", verdict.getSourceKey());
        alert.put("action", verdict.getAction());
        alert.put("score", verdict.getScore());
        alert.put("threats", verdict.getThreats());
        alert.put("details", verdict.getDetails());
        alert.put("timestamp", String.valueOf(verdict.getDecidedAt()));

        try {
            String alertJson = objectMapper.writeValueAsString(alert);
            redisTemplate.convertAndSend(KeyManager.ALERT_CHANNEL, alertJson);
        } catch (Exception e) {
            log.error("Failed to publish alert for {}", verdict.getSourceKey(), e);
        }
    }
}
