package com.jay.dcf.exception;

/**
 * Exception thrown when a named scenario is not present in valuation.yaml.
 */
public class ScenarioNotFoundException extends RuntimeException {

    private final String scenario;

    public ScenarioNotFoundException(String scenario) {
        super("Unknown scenario: " + scenario);
        this.scenario = scenario;
    }

    public String getScenario() {
        return scenario;
    }
}
