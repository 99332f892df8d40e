package com.ryuqq.circuitbreaker.registry;

/**
 * 이름으로 찾은 설정이 Registry에 없을 때 발생하는 예외.
 *
 * @author CircuitBreaker Team
 * @since 1.0.0
 */
public class ConfigurationNotFoundException extends RuntimeException {

    private final String configurationName;

    public ConfigurationNotFoundException(String configurationName) {
        super(String.format("Configuration with name '%s' does not exist", configurationName));
        this.configurationName = configurationName;
    }

    public String getConfigurationName() {
        return configurationName;
    }
}
