package com.venturegate.boundary;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "venturegate.boundary")
public class BoundaryProperties {

    private String source = "evidence-boundary";
    private ValidationMode mode = ValidationMode.OPEN;
    private boolean strict = false;
    private double sampleRate = 1.0;
    private int maxLoggedIssues = BoundaryValidationPolicy.DEFAULT_MAX_LOGGED_ISSUES;

    public BoundaryValidationPolicy toPolicy() {
        return new BoundaryValidationPolicy(source, mode, strict, sampleRate, maxLoggedIssues);
    }

    public String getSource() {
        return source;
    }

    public void setSource(String source) {
        this.source = source;
    }

    public ValidationMode getMode() {
        return mode;
    }

    public void setMode(ValidationMode mode) {
        this.mode = mode;
    }

    public boolean isStrict() {
        return strict;
    }

    public void setStrict(boolean strict) {
        this.strict = strict;
    }

    public double getSampleRate() {
        return sampleRate;
    }

    public void setSampleRate(double sampleRate) {
        this.sampleRate = sampleRate;
    }

    public int getMaxLoggedIssues() {
        return maxLoggedIssues;
    }

    public void setMaxLoggedIssues(int maxLoggedIssues) {
        this.maxLoggedIssues = maxLoggedIssues;
    }
}
