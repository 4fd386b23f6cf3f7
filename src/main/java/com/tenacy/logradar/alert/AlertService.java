package com.tenacy.logradar.alert;

public interface AlertService {
    void sendAlert(String subject, String message);
}
