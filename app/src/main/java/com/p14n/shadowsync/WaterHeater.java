package com.p14n.shadowsync;

/**
 * Simulated water heater. Each step moves the tank temperature one degree
 * towards the target, heating while below it.
 */
public class WaterHeater {

    public static final int DEFAULT_TARGET = 120;

    private final String deviceId;
    private int temperature;
    private int target = DEFAULT_TARGET;

    public WaterHeater(String deviceId, int temperature) {
        this.deviceId = deviceId;
        this.temperature = temperature;
    }

    public String deviceId() {
        return deviceId;
    }

    public int temperature() {
        return temperature;
    }

    public int target() {
        return target;
    }

    public boolean heating() {
        return temperature < target;
    }

    /**
     * @return true if the target changed
     */
    public boolean applyTarget(int newTarget) {
        if (newTarget == target) {
            return false;
        }
        target = newTarget;
        return true;
    }

    public void step() {
        if (temperature < target) {
            temperature++;
        } else if (temperature > target) {
            temperature--;
        }
    }
}
