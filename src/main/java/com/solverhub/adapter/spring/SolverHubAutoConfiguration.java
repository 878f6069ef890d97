package com.solverhub.adapter.spring;

import com.solverhub.config.ConfigLoader;
import com.solverhub.config.HarnessConfig;
import com.solverhub.config.SolverHubConfig;
import com.solverhub.endpoint.OneShotRunner;
import com.solverhub.endpoint.SolverEndpoint;
import com.solverhub.exception.ConfigurationException;
import com.solverhub.harness.HarnessRunner;
import com.solverhub.harness.ValidationHarness;
import com.solverhub.problem.ProblemLoader;
import com.solverhub.process.DefaultProcessLauncher;
import com.solverhub.process.ProcessLauncher;
import com.solverhub.protocol.EndpointAddress;
import com.solverhub.solver.AddressLeaseRegistry;
import com.solverhub.solver.SolverFactory;
import com.solverhub.solver.SolverRegistry;
import com.solverhub.solver.SolverRegistryFactory;
import com.solverhub.solver.process.ProcessSolverFactory;
import com.solverhub.solver.remote.RemoteSolverFactory;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.server.ConfigurableWebServerFactory;
import org.springframework.boot.web.server.WebServerFactoryCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.List;

/**
 * Spring Boot auto-configuration for the solver hub.
 */
@Configuration
@ConditionalOnProperty(prefix = "solverhub", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(SolverHubProperties.class)
public class SolverHubAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(SolverHubAutoConfiguration.class);

    private static final String ENDPOINT_MODE = "'${solverhub.mode:serve}'.toLowerCase() != 'harness'";

    private SolverRegistry solverRegistry;

    @Bean
    @ConditionalOnMissingBean
    public SolverHubConfig solverHubConfig(SolverHubProperties properties) {
        log.info("Loading solver hub configuration from: {}", properties.getConfigPath());
        return ConfigLoader.load(properties.getConfigPath());
    }

    @Bean
    @ConditionalOnMissingBean
    public ProcessLauncher processLauncher() {
        return new DefaultProcessLauncher();
    }

    @Bean
    @ConditionalOnMissingBean
    public AddressLeaseRegistry addressLeaseRegistry() {
        return new AddressLeaseRegistry();
    }

    @Bean
    public ProcessSolverFactory processSolverFactory(ProcessLauncher launcher, AddressLeaseRegistry leases) {
        return new ProcessSolverFactory(launcher, leases);
    }

    @Bean
    public RemoteSolverFactory remoteSolverFactory(AddressLeaseRegistry leases) {
        return new RemoteSolverFactory(leases);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnExpression(ENDPOINT_MODE)
    public SolverRegistry solverRegistry(SolverHubConfig config, List<SolverFactory> factories) {
        log.info("Creating solver registry with {} solvers", config.solvers().size());
        this.solverRegistry = SolverRegistryFactory.create(config.solvers(), factories);
        return this.solverRegistry;
    }

    @Bean
    @ConditionalOnMissingBean
    public ProblemLoader problemLoader() {
        return new ProblemLoader();
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnExpression(ENDPOINT_MODE)
    public SolverEndpoint solverEndpoint(SolverHubConfig config, SolverRegistry registry, ProblemLoader loader) {
        return new SolverEndpoint(registry, loader, config.endpoint().backend());
    }

    @Bean
    @ConditionalOnWebApplication
    public WebServerFactoryCustomizer<ConfigurableWebServerFactory> endpointAddressCustomizer(
            SolverHubConfig config, SolverHubProperties properties) {
        EndpointAddress address = properties.getAddress() != null
                ? EndpointAddress.parse(properties.getAddress())
                : config.endpoint().address();
        return factory -> {
            try {
                factory.setAddress(InetAddress.getByName(address.host()));
            } catch (UnknownHostException e) {
                throw new ConfigurationException("Cannot resolve endpoint host: " + address.host(), e);
            }
            factory.setPort(address.port());
            log.info("Serving plan endpoint on {}", address);
        };
    }

    @Bean
    @ConditionalOnProperty(prefix = "solverhub", name = "mode", havingValue = "oneshot")
    public OneShotRunner oneShotRunner(SolverEndpoint endpoint, SolverHubProperties properties) {
        if (properties.getFilePath() == null) {
            throw new ConfigurationException("One-shot mode requires solverhub.file-path");
        }
        return new OneShotRunner(endpoint, properties.getFilePath(), System.out);
    }

    @Bean
    @ConditionalOnProperty(prefix = "solverhub", name = "mode", havingValue = "harness")
    public HarnessRunner harnessRunner(SolverHubConfig config, SolverHubProperties properties,
                                       ProcessLauncher launcher) {
        HarnessConfig harness = config.harness();
        if (harness == null) {
            throw new ConfigurationException("Harness mode requires a harness section in the configuration");
        }
        if (properties.getExecutable() != null) {
            harness = harness.withExecutable(properties.getExecutable());
        }
        return new HarnessRunner(new ValidationHarness(harness, launcher));
    }

    @PreDestroy
    public void shutdown() {
        if (solverRegistry != null) {
            log.info("Destroying solvers");
            solverRegistry.destroyAll();
        }
    }
}
