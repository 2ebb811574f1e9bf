package com.example.techsewa.health;

@FunctionalInterface
public interface HealthAlertListener {

    void onAlert(String message, int code);
}
