package com.smartservice.core.ir;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import com.smartservice.core.diagnostic.Diagnostic;
import com.smartservice.core.model.DataSource;
import com.smartservice.core.model.DeploymentEnv;
import com.smartservice.core.model.Role;
import com.smartservice.core.model.ScalarValue;
import com.smartservice.core.model.ServiceMeta;
import com.smartservice.core.model.Visualization;
import com.smartservice.core.query.ProviderCapability;
import com.smartservice.core.query.QueryPlan;
import com.smartservice.core.resolve.FieldBinding;
import com.smartservice.core.resolve.ResolvedVisualization;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Serializes a {@link CompiledDescriptor} to JSON or YAML.
 *
 * <p>The document is built as an explicit node tree in declaration order, so writing the
 * same IR twice yields identical bytes. Every input field of every entity is kept; the
 * compiler adds version compatibility, field origins, query plans and warnings.
 */
public class IrWriter {

    /**
     * Output formats.
     */
    public enum Format {
        JSON,
        YAML;

        /**
         * Parses a format name, ignoring case.
         *
         * @param text "json" or "yaml"
         * @return format
         * @throws IllegalArgumentException for any other name
         */
        public static Format parse(String text) {
            return Format.valueOf(text.toUpperCase(Locale.ROOT));
        }
    }

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private final ObjectMapper jsonMapper;
    private final ObjectMapper yamlMapper;

    public IrWriter() {
        this.jsonMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
        this.yamlMapper = new ObjectMapper(YAMLFactory.builder()
            .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
            .build());
    }

    public String toJson(CompiledDescriptor ir) {
        return write(jsonMapper, ir);
    }

    public String toYaml(CompiledDescriptor ir) {
        return write(yamlMapper, ir);
    }

    public String serialize(CompiledDescriptor ir, Format format) {
        return format == Format.YAML ? toYaml(ir) : toJson(ir);
    }

    /**
     * Writes the IR to a file, creating parent directories as needed.
     *
     * @param ir compiled descriptor
     * @param target output file
     * @param format output format
     * @throws IOException if the file cannot be written
     */
    public void write(CompiledDescriptor ir, Path target, Format format) throws IOException {
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(target, serialize(ir, format), StandardCharsets.UTF_8);
    }

    /**
     * Builds the document tree of an IR.
     *
     * @param ir compiled descriptor
     * @return root node with {@code service}, {@code application}, {@code dataSources},
     *     {@code visualizations}, {@code roles}, {@code deploymentEnvs} and {@code diagnostics}
     */
    public ObjectNode toTree(CompiledDescriptor ir) {
        ObjectNode root = NODES.objectNode();
        root.set("service", service(ir.service()));

        ObjectNode application = root.putObject("application");
        application.put("type", ir.application().type());
        application.put("layout", ir.application().layout());

        ObjectNode dataSources = root.putObject("dataSources");
        ir.dataSources().forEach((name, compiled) -> dataSources.set(name, dataSource(compiled)));

        ObjectNode visualizations = root.putObject("visualizations");
        ir.visualizations().forEach((name, resolved) -> visualizations.set(name, visualization(resolved)));

        ArrayNode roles = root.putArray("roles");
        for (Role role : ir.roles()) {
            ObjectNode node = roles.addObject();
            node.put("name", role.name());
            node.put("hierarchy", role.hierarchy().label());
        }

        ObjectNode envs = root.putObject("deploymentEnvs");
        ir.deploymentEnvs().forEach((name, env) -> envs.set(name, deploymentEnv(env)));

        ArrayNode diagnostics = root.putArray("diagnostics");
        for (Diagnostic warning : ir.warnings()) {
            ObjectNode node = diagnostics.addObject();
            node.put("kind", warning.kind().displayName());
            node.put("severity", warning.severity().name().toLowerCase(Locale.ROOT));
            node.put("path", warning.path());
            node.put("message", warning.message());
        }
        return root;
    }

    private String write(ObjectMapper mapper, CompiledDescriptor ir) {
        try {
            return mapper.writeValueAsString(toTree(ir));
        } catch (JsonProcessingException e) {
            // In-memory node trees always serialize
            throw new IllegalStateException("Failed to serialize compiled descriptor", e);
        }
    }

    private static ObjectNode service(CompiledService compiled) {
        ServiceMeta meta = compiled.meta();
        ObjectNode node = NODES.objectNode();
        node.put("name", meta.name());
        node.put("scope", meta.scope());
        node.put("version", meta.version().toString());
        node.put("compatibility", compiled.compatibility().name());
        return node;
    }

    private static ObjectNode dataSource(CompiledDataSource compiled) {
        DataSource dataSource = compiled.dataSource();
        ObjectNode node = NODES.objectNode();
        node.put("name", dataSource.name());
        node.put("category", dataSource.category());
        node.put("provider", dataSource.provider());
        node.put("type", dataSource.type());
        node.put("uri", dataSource.uri().toString());
        ObjectNode query = node.putObject("query");
        query.put("type", dataSource.query().type());
        strings(query.putArray("select"), dataSource.query().select());
        node.set("plan", plan(compiled.plan()));
        return node;
    }

    private static ObjectNode plan(QueryPlan plan) {
        ObjectNode node = NODES.objectNode();
        node.put("provider", plan.provider());
        node.put("entityType", plan.entityType());
        node.put("method", plan.method());
        node.put("endpoint", plan.endpoint().toString());
        strings(node.putArray("attributes"), plan.attributes());
        ObjectNode parameters = node.putObject("parameters");
        plan.parameters().forEach(parameters::put);
        ArrayNode capabilities = node.putArray("capabilities");
        for (ProviderCapability capability : plan.capabilities()) {
            capabilities.add(capability.name());
        }
        if (plan.geoAttribute() != null) {
            node.put("geoAttribute", plan.geoAttribute());
        }
        if (plan.timeAttribute() != null) {
            node.put("timeAttribute", plan.timeAttribute());
        }
        return node;
    }

    private static ObjectNode visualization(ResolvedVisualization resolved) {
        Visualization visualization = resolved.visualization();
        ObjectNode node = NODES.objectNode();
        node.put("name", visualization.name());
        node.put("type", visualization.type());
        node.put("source", visualization.source());
        strings(node.putArray("data"), visualization.data());
        ObjectNode extra = node.putObject("extra");
        for (Map.Entry<String, ScalarValue> entry : visualization.extra().entrySet()) {
            scalar(extra, entry.getKey(), entry.getValue());
        }
        strings(node.putArray("roles"), visualization.roles());
        ArrayNode fields = node.putArray("fields");
        for (FieldBinding binding : resolved.fields()) {
            ObjectNode field = fields.addObject();
            field.put("name", binding.name());
            field.put("origin", binding.origin().name());
        }
        return node;
    }

    private static ObjectNode deploymentEnv(DeploymentEnv env) {
        ObjectNode node = NODES.objectNode();
        node.put("name", env.name());
        node.put("uri", env.uri().toString());
        node.put("port", env.port());
        node.put("type", env.type());
        strings(node.putArray("roles"), env.roles());
        if (!env.credentials().isEmpty()) {
            ObjectNode credentials = node.putObject("credentials");
            env.credentials().forEach(credentials::put);
        }
        return node;
    }

    private static void scalar(ObjectNode target, String key, ScalarValue value) {
        switch (value.type()) {
            case NUMBER -> target.put(key, (BigDecimal) value.value());
            case BOOLEAN -> target.put(key, (Boolean) value.value());
            default -> target.put(key, value.asString());
        }
    }

    private static void strings(ArrayNode target, List<String> values) {
        values.forEach(target::add);
    }
}
