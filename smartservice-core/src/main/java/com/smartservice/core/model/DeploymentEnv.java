package com.smartservice.core.model;

import java.net.URI;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A deployment target.
 *
 * @param name unique provisioning key
 * @param uri target URI
 * @param port port in [0, 65535]
 * @param type deployment target tag (Docker, Kubernetes, ...)
 * @param roles roles allowed to operate the environment (empty = unrestricted)
 * @param credentials provisioning credentials, in declaration order
 */
public record DeploymentEnv(
    String name,
    URI uri,
    int port,
    String type,
    List<String> roles,
    Map<String, String> credentials
) {
    public static final int MAX_PORT = 65535;

    /**
     * Compact constructor with validation.
     */
    public DeploymentEnv {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(uri, "uri must not be null");
        Objects.requireNonNull(type, "type must not be null");
        if (port < 0 || port > MAX_PORT) {
            throw new IllegalArgumentException("port out of range [0, " + MAX_PORT + "]: " + port);
        }
        roles = roles == null ? List.of() : List.copyOf(roles);
        credentials = credentials == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(credentials));
    }

    public DeploymentEnv(String name, URI uri, int port, String type, List<String> roles) {
        this(name, uri, port, type, roles, Map.of());
    }

    public String path() {
        return "deployment.env." + name;
    }
}
