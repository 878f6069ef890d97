package com.solverhub.adapter.spring;

import com.solverhub.LaunchMode;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Spring Boot configuration properties for the solver hub.
 */
@ConfigurationProperties(prefix = "solverhub")
public class SolverHubProperties {

    /**
     * Whether the solver hub is enabled.
     */
    private boolean enabled = true;

    /**
     * Path to the solver hub configuration file.
     * Supports classpath: prefix for classpath resources.
     */
    private String configPath = "classpath:solverhub.yaml";

    private LaunchMode mode = LaunchMode.SERVE;

    /**
     * Endpoint address, overrides endpoint.address of the configuration file.
     */
    private String address;

    /**
     * Problem to solve in one-shot mode.
     */
    private String filePath;

    /**
     * Solver executable for the harness; when unset the harness builds it.
     */
    private String executable;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getConfigPath() {
        return configPath;
    }

    public void setConfigPath(String configPath) {
        this.configPath = configPath;
    }

    public LaunchMode getMode() {
        return mode;
    }

    public void setMode(LaunchMode mode) {
        this.mode = mode;
    }

    public String getAddress() {
        return address;
    }

    public void setAddress(String address) {
        this.address = address;
    }

    public String getFilePath() {
        return filePath;
    }

    public void setFilePath(String filePath) {
        this.filePath = filePath;
    }

    public String getExecutable() {
        return executable;
    }

    public void setExecutable(String executable) {
        this.executable = executable;
    }
}
