package com.smartservice.core.parser;

import com.smartservice.core.model.RoleHierarchy;
import com.smartservice.core.model.ScalarValue;
import com.smartservice.core.model.SemanticVersion;

import java.net.URI;
import java.util.List;
import java.util.Map;

/**
 * Typed document tree produced by the {@link StructuralParser}.
 *
 * <p>Every node is shape-checked but still carries its map key and path, since key/name
 * consistency and uniqueness are checked later by the entity extractor.
 *
 * @param service service preamble
 * @param dataSources data sources of every category, in declaration order
 * @param application application section
 * @param deploymentEnvs deployment environments, in declaration order
 */
public record DescriptorTree(
    ServiceNode service,
    List<DataSourceNode> dataSources,
    ApplicationNode application,
    List<EnvNode> deploymentEnvs
) {
    public DescriptorTree {
        dataSources = List.copyOf(dataSources);
        deploymentEnvs = List.copyOf(deploymentEnvs);
    }

    /**
     * @param name service name
     * @param scope application domain
     * @param version declared version
     */
    public record ServiceNode(String name, String scope, SemanticVersion version) {}

    /**
     * @param path dotted path of the entry
     * @param category grouping key under {@code data_sources}
     * @param key map key of the entry
     * @param name declared name (the key when omitted)
     * @param provider provider tag
     * @param type entity-type tag
     * @param uri provider endpoint
     * @param queryType queried record kind
     * @param select field projection
     */
    public record DataSourceNode(
        String path,
        String category,
        String key,
        String name,
        String provider,
        String type,
        URI uri,
        String queryType,
        List<String> select
    ) {}

    /**
     * @param type application type tag
     * @param layout layout tag
     * @param roles declared roles
     * @param visualizations visualizations in declaration order
     */
    public record ApplicationNode(
        String type,
        String layout,
        List<RoleNode> roles,
        List<VisualizationNode> visualizations
    ) {}

    /**
     * @param path dotted path of the declaration
     * @param name role name
     * @param hierarchy explicit hierarchy, or null when the role was declared by name only
     */
    public record RoleNode(String path, String name, RoleHierarchy hierarchy) {}

    /**
     * @param path dotted path of the entry
     * @param key map key of the entry
     * @param name declared name (the key when omitted)
     * @param type visualization type tag
     * @param source referenced data source name
     * @param data requested fields
     * @param extra scalar settings, including unknown scalar keys
     * @param roles role references
     */
    public record VisualizationNode(
        String path,
        String key,
        String name,
        String type,
        String source,
        List<String> data,
        Map<String, ScalarValue> extra,
        List<String> roles
    ) {}

    /**
     * @param path dotted path of the entry
     * @param key map key of the entry
     * @param name declared name (the key when omitted)
     * @param uri target URI
     * @param port target port
     * @param type deployment target tag
     * @param roles role references
     * @param credentials credential entries
     */
    public record EnvNode(
        String path,
        String key,
        String name,
        URI uri,
        int port,
        String type,
        List<String> roles,
        Map<String, String> credentials
    ) {}
}
