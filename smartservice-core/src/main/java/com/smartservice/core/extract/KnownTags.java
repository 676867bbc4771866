package com.smartservice.core.extract;

import java.util.Set;

/**
 * Recognised values of the descriptor's free-text tags.
 *
 * <p>Values outside these vocabularies are accepted but raise an
 * {@link com.smartservice.core.diagnostic.DiagnosticKind#UNKNOWN_VALUE} warning. Matching is
 * case-sensitive.
 */
public final class KnownTags {

    private KnownTags() {
        // Utility class
    }

    /**
     * {@code service.scope}. {@code Manifacturing} is kept next to the correct spelling
     * because published descriptors use it.
     */
    public static final Set<String> SCOPES = Set.of(
        "Service", "Industry", "Manifacturing", "Manufacturing", "Education", "Healthcare",
        "SocialPrograms", "Government", "Energy", "Water", "Environment", "Transportation",
        "Communication", "PublicSafety", "UrbanPlanning", "Infrastructure"
    );

    /**
     * Data source {@code type}.
     */
    public static final Set<String> SOURCE_TYPES = Set.of(
        "Sensor", "Actuator", "Device", "Application", "Person", "Vehicle", "Animal", "Robot", "Other"
    );

    /**
     * {@code application.type}, short and {@code ...App} forms.
     */
    public static final Set<String> APPLICATION_TYPES = Set.of(
        "Web", "Mobile", "Desktop", "IoT",
        "WebApp", "MobileApp", "DesktopApp", "IoTApp"
    );

    /**
     * {@code application.layout}.
     */
    public static final Set<String> LAYOUTS = Set.of(
        "SinglePage", "MultiPage", "MultiWindow", "Pwa"
    );

    /**
     * Deployment environment {@code type}.
     */
    public static final Set<String> DEPLOYMENT_TYPES = Set.of(
        "Docker", "DockerCompose", "Kubernetes", "Helm", "Swarm", "Mesos", "Nomad",
        "Ansible", "Terraform", "CloudFormation", "Serverless", "Other"
    );
}
