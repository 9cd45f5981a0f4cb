package io.sendshield.model;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record SafetyDecision(boolean safe, String reason) {
    private static final SafetyDecision SAFE = new SafetyDecision(true, null);

    public static SafetyDecision allow() {
        return SAFE;
    }

    public static SafetyDecision deny(String reason) {
        return new SafetyDecision(false, reason);
    }
}
