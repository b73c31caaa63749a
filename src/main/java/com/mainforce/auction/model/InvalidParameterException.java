package com.mainforce.auction.model;

/**
 * A caller-supplied tunable is out of its contract range. Raised at the boundary instead of
 * clamping so operator mistakes stay visible.
 */
public class InvalidParameterException extends IllegalArgumentException {
    private final String parameter;
    private final String rejectedValue;
    private final String allowed;

    public InvalidParameterException(String parameter, Object rejectedValue, String allowed) {
        super("Invalid " + parameter + " parameter: " + rejectedValue + " (allowed: " + allowed + ")");
        this.parameter = parameter;
        this.rejectedValue = String.valueOf(rejectedValue);
        this.allowed = allowed;
    }

    public String parameter() {
        return parameter;
    }

    public String rejectedValue() {
        return rejectedValue;
    }

    public String allowed() {
        return allowed;
    }
}
