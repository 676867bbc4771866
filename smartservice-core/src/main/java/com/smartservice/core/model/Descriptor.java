package com.smartservice.core.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * All entities extracted from one descriptor, in declaration order.
 *
 * <p>This is the output of entity extraction and the input of reference resolution and
 * query compilation.
 *
 * @param service service preamble
 * @param application application settings
 * @param dataSources data sources
 * @param visualizations visualizations
 * @param roles declared roles
 * @param deploymentEnvs deployment environments
 */
public record Descriptor(
    ServiceMeta service,
    ApplicationSettings application,
    List<DataSource> dataSources,
    List<Visualization> visualizations,
    List<Role> roles,
    List<DeploymentEnv> deploymentEnvs
) {
    /**
     * Compact constructor with validation.
     */
    public Descriptor {
        Objects.requireNonNull(service, "service must not be null");
        Objects.requireNonNull(application, "application must not be null");
        dataSources = dataSources == null ? List.of() : List.copyOf(dataSources);
        visualizations = visualizations == null ? List.of() : List.copyOf(visualizations);
        roles = roles == null ? List.of() : List.copyOf(roles);
        deploymentEnvs = deploymentEnvs == null ? List.of() : List.copyOf(deploymentEnvs);
    }

    public Optional<DataSource> findDataSource(String name) {
        return dataSources.stream().filter(ds -> ds.name().equals(name)).findFirst();
    }

    public Optional<Role> findRole(String name) {
        return roles.stream().filter(role -> role.name().equals(name)).findFirst();
    }
}
