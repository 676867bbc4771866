package com.smartservice.core.parser;

import com.fasterxml.jackson.databind.JsonNode;
import com.smartservice.core.diagnostic.DiagnosticCollector;
import com.smartservice.core.diagnostic.DiagnosticKind;
import com.smartservice.core.model.DeploymentEnv;
import com.smartservice.core.model.RoleHierarchy;
import com.smartservice.core.model.ScalarValue;
import com.smartservice.core.model.SemanticVersion;
import com.smartservice.core.parser.DescriptorTree.ApplicationNode;
import com.smartservice.core.parser.DescriptorTree.DataSourceNode;
import com.smartservice.core.parser.DescriptorTree.EnvNode;
import com.smartservice.core.parser.DescriptorTree.RoleNode;
import com.smartservice.core.parser.DescriptorTree.ServiceNode;
import com.smartservice.core.parser.DescriptorTree.VisualizationNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import static com.smartservice.core.parser.DescriptorPath.child;
import static com.smartservice.core.parser.DescriptorPath.index;

/**
 * Turns a raw descriptor tree into a typed {@link DescriptorTree}.
 *
 * <p>Checks shapes only: required keys, primitive types, value ranges and non-empty
 * containers. The whole document is scanned and every problem reported, so a single run
 * surfaces all parse errors. Cross-entity checks (duplicate names, references) belong to
 * later stages.
 *
 * <p>Unknown top-level sections are ignored. Unknown scalar keys of a visualization are kept
 * in its {@code extra} mapping; other unknown keys inside known entities raise an
 * {@link DiagnosticKind#UNKNOWN_KEY} warning.
 */
public class StructuralParser {

    private static final Logger log = LoggerFactory.getLogger(StructuralParser.class);

    private static final Set<String> TOP_LEVEL_SECTIONS = Set.of("service", "data_sources", "application", "deployment");
    private static final Set<String> SERVICE_KEYS = Set.of("name", "version", "scope");
    private static final Set<String> VERSION_KEYS = Set.of("major", "minor", "patch");
    private static final Set<String> DATA_SOURCE_KEYS = Set.of("name", "provider", "type", "uri", "query");
    private static final Set<String> QUERY_KEYS = Set.of("type", "select");
    private static final Set<String> APPLICATION_KEYS = Set.of("type", "layout", "roles", "visualizations");
    private static final Set<String> ROLE_KEYS = Set.of("name", "hierarchy");
    private static final Set<String> VISUALIZATION_KEYS = Set.of("name", "type", "source", "data", "extra", "roles");
    private static final Set<String> DEPLOYMENT_KEYS = Set.of("env");
    private static final Set<String> ENV_KEYS = Set.of("name", "uri", "port", "type", "roles", "credentials");

    /**
     * Parses a descriptor tree.
     *
     * @param root root node as produced by {@link DescriptorReader}
     * @return outcome with the typed tree (null on any parse error) and all diagnostics
     */
    public ParseOutcome parse(JsonNode root) {
        DiagnosticCollector diagnostics = new DiagnosticCollector();

        if (root == null || !root.isObject()) {
            diagnostics.report(DiagnosticKind.PARSE_ERROR, DescriptorPath.ROOT,
                "expected object but found " + typeOf(root));
            return new ParseOutcome(null, diagnostics.toList());
        }

        root.fieldNames().forEachRemaining(section -> {
            if (!TOP_LEVEL_SECTIONS.contains(section)) {
                log.debug("Ignoring unknown top-level section: {}", section);
            }
        });

        ServiceNode service = parseService(root, diagnostics);
        List<DataSourceNode> dataSources = parseDataSources(root, diagnostics);
        ApplicationNode application = parseApplication(root, diagnostics);
        List<EnvNode> envs = parseDeployment(root, diagnostics);

        if (diagnostics.hasFatal()) {
            log.debug("Structural parsing reported {} diagnostics", diagnostics.size());
            return new ParseOutcome(null, diagnostics.toList());
        }
        return new ParseOutcome(new DescriptorTree(service, dataSources, application, envs), diagnostics.toList());
    }

    // ==================== Service ====================

    private ServiceNode parseService(JsonNode root, DiagnosticCollector d) {
        JsonNode service = requireObject(root, "service", "", d);
        if (service == null) {
            return null;
        }
        warnUnknownKeys(service, SERVICE_KEYS, "service", d);
        String name = requireText(service, "name", "service", d);
        String scope = optionalText(service, "scope", "service", "Service", d);
        SemanticVersion version = parseVersion(service, "service", d);
        if (name == null || scope == null || version == null) {
            return null;
        }
        return new ServiceNode(name, scope, version);
    }

    private SemanticVersion parseVersion(JsonNode service, String parentPath, DiagnosticCollector d) {
        String path = child(parentPath, "version");
        JsonNode node = service.get("version");
        if (isAbsent(node)) {
            missing(path, "version", d);
            return null;
        }
        if (node.isTextual()) {
            try {
                return SemanticVersion.parse(node.asText());
            } catch (IllegalArgumentException e) {
                d.report(DiagnosticKind.PARSE_ERROR, path,
                    "expected semantic version major.minor.patch but found '" + node.asText() + "'");
                return null;
            }
        }
        if (node.isObject()) {
            warnUnknownKeys(node, VERSION_KEYS, path, d);
            Integer major = requireNonNegativeInt(node, "major", path, d);
            Integer minor = requireNonNegativeInt(node, "minor", path, d);
            Integer patch = requireNonNegativeInt(node, "patch", path, d);
            if (major == null || minor == null || patch == null) {
                return null;
            }
            return new SemanticVersion(major, minor, patch);
        }
        d.report(DiagnosticKind.PARSE_ERROR, path,
            "expected version string or {major, minor, patch} object but found " + typeOf(node));
        return null;
    }

    // ==================== Data sources ====================

    private List<DataSourceNode> parseDataSources(JsonNode root, DiagnosticCollector d) {
        JsonNode section = requireObject(root, "data_sources", "", d);
        List<DataSourceNode> result = new ArrayList<>();
        if (section == null) {
            return result;
        }

        int declared = 0;
        for (Iterator<Map.Entry<String, JsonNode>> categories = section.fields(); categories.hasNext(); ) {
            Map.Entry<String, JsonNode> category = categories.next();
            String categoryPath = child("data_sources", category.getKey());
            if (!category.getValue().isObject()) {
                d.report(DiagnosticKind.PARSE_ERROR, categoryPath,
                    "expected object (data source category) but found " + typeOf(category.getValue()));
                continue;
            }
            for (Iterator<Map.Entry<String, JsonNode>> entries = category.getValue().fields(); entries.hasNext(); ) {
                Map.Entry<String, JsonNode> entry = entries.next();
                declared++;
                String path = child(categoryPath, entry.getKey());
                if (!entry.getValue().isObject()) {
                    d.report(DiagnosticKind.PARSE_ERROR, path,
                        "expected object (data source) but found " + typeOf(entry.getValue()));
                    continue;
                }
                DataSourceNode node = parseDataSource(category.getKey(), entry.getKey(), entry.getValue(), path, d);
                if (node != null) {
                    result.add(node);
                }
            }
        }

        if (declared == 0) {
            d.report(DiagnosticKind.PARSE_ERROR, "data_sources", "at least one data source is required");
        }
        return result;
    }

    private DataSourceNode parseDataSource(String category, String key, JsonNode node, String path,
                                           DiagnosticCollector d) {
        warnUnknownKeys(node, DATA_SOURCE_KEYS, path, d);
        String name = optionalText(node, "name", path, key, d);
        String provider = requireText(node, "provider", path, d);
        String type = requireText(node, "type", path, d);
        URI uri = requireUri(node, "uri", path, d);

        String queryType = null;
        List<String> select = null;
        JsonNode query = requireObject(node, "query", path, d);
        if (query != null) {
            String queryPath = child(path, "query");
            warnUnknownKeys(query, QUERY_KEYS, queryPath, d);
            queryType = requireText(query, "type", queryPath, d);
            select = parseSelect(query, queryPath, d);
        }

        if (name == null || provider == null || type == null || uri == null || queryType == null || select == null) {
            return null;
        }
        return new DataSourceNode(path, category, key, name, provider, type, uri, queryType, select);
    }

    private List<String> parseSelect(JsonNode query, String queryPath, DiagnosticCollector d) {
        String path = child(queryPath, "select");
        JsonNode node = query.get("select");
        if (isAbsent(node)) {
            missing(path, "select", d);
            return null;
        }
        if (!node.isArray()) {
            d.report(DiagnosticKind.PARSE_ERROR, path, "expected array but found " + typeOf(node));
            return null;
        }
        if (node.isEmpty()) {
            d.report(DiagnosticKind.PARSE_ERROR, path, "must contain at least one field");
            return null;
        }
        List<String> fields = textElements(node, path, d);
        if (fields == null) {
            return null;
        }
        boolean duplicates = false;
        for (int i = 0; i < fields.size(); i++) {
            int first = fields.indexOf(fields.get(i));
            if (first < i) {
                d.report(DiagnosticKind.PARSE_ERROR, index(path, i),
                    "duplicate field '" + fields.get(i) + "' (first selected at " + index("select", first) + ")");
                duplicates = true;
            }
        }
        return duplicates ? null : fields;
    }

    // ==================== Application ====================

    private ApplicationNode parseApplication(JsonNode root, DiagnosticCollector d) {
        JsonNode application = requireObject(root, "application", "", d);
        if (application == null) {
            return null;
        }
        warnUnknownKeys(application, APPLICATION_KEYS, "application", d);
        String type = requireText(application, "type", "application", d);
        String layout = optionalText(application, "layout", "application", "SinglePage", d);
        List<RoleNode> roles = parseRoles(application, d);
        List<VisualizationNode> visualizations = parseVisualizations(application, d);

        if (type == null || layout == null || roles == null || visualizations == null) {
            return null;
        }
        return new ApplicationNode(type, layout, roles, visualizations);
    }

    private List<RoleNode> parseRoles(JsonNode application, DiagnosticCollector d) {
        String path = "application.roles";
        JsonNode node = application.get("roles");
        if (isAbsent(node)) {
            return List.of();
        }
        if (!node.isArray()) {
            d.report(DiagnosticKind.PARSE_ERROR, path, "expected array but found " + typeOf(node));
            return null;
        }

        List<RoleNode> roles = new ArrayList<>();
        boolean valid = true;
        for (int i = 0; i < node.size(); i++) {
            JsonNode element = node.get(i);
            String elementPath = index(path, i);
            if (element.isTextual() && !element.asText().isBlank()) {
                roles.add(new RoleNode(elementPath, element.asText(), null));
            } else if (element.isObject()) {
                warnUnknownKeys(element, ROLE_KEYS, elementPath, d);
                String name = requireText(element, "name", elementPath, d);
                RoleHierarchy hierarchy = parseHierarchy(element, elementPath, d);
                if (name == null || (!isAbsent(element.get("hierarchy")) && hierarchy == null)) {
                    valid = false;
                    continue;
                }
                roles.add(new RoleNode(elementPath, name, hierarchy));
            } else {
                d.report(DiagnosticKind.PARSE_ERROR, elementPath,
                    "expected role name or {name, hierarchy} object but found " + typeOf(element));
                valid = false;
            }
        }
        return valid ? roles : null;
    }

    private RoleHierarchy parseHierarchy(JsonNode role, String rolePath, DiagnosticCollector d) {
        String text = optionalText(role, "hierarchy", rolePath, null, d);
        if (text == null) {
            return null;
        }
        return RoleHierarchy.fromLabel(text).orElseGet(() -> {
            d.report(DiagnosticKind.PARSE_ERROR, child(rolePath, "hierarchy"),
                "expected one of User, Superuser, Admin but found '" + text + "'");
            return null;
        });
    }

    private List<VisualizationNode> parseVisualizations(JsonNode application, DiagnosticCollector d) {
        String sectionPath = "application.visualizations";
        JsonNode section = application.get("visualizations");
        if (isAbsent(section)) {
            return List.of();
        }
        if (!section.isObject()) {
            d.report(DiagnosticKind.PARSE_ERROR, sectionPath, "expected object but found " + typeOf(section));
            return null;
        }

        List<VisualizationNode> result = new ArrayList<>();
        boolean valid = true;
        for (Iterator<Map.Entry<String, JsonNode>> entries = section.fields(); entries.hasNext(); ) {
            Map.Entry<String, JsonNode> entry = entries.next();
            String path = child(sectionPath, entry.getKey());
            if (!entry.getValue().isObject()) {
                d.report(DiagnosticKind.PARSE_ERROR, path,
                    "expected object (visualization) but found " + typeOf(entry.getValue()));
                valid = false;
                continue;
            }
            VisualizationNode node = parseVisualization(entry.getKey(), entry.getValue(), path, d);
            if (node == null) {
                valid = false;
            } else {
                result.add(node);
            }
        }
        return valid ? result : null;
    }

    private VisualizationNode parseVisualization(String key, JsonNode node, String path, DiagnosticCollector d) {
        String name = optionalText(node, "name", path, key, d);
        String type = requireText(node, "type", path, d);
        String source = requireText(node, "source", path, d);
        List<String> data = requireTextList(node, "data", path, d);
        Map<String, ScalarValue> extra = parseExtra(node, path, d);
        List<String> roles = optionalTextList(node, "roles", path, d);

        if (extra != null) {
            for (Iterator<Map.Entry<String, JsonNode>> fields = node.fields(); fields.hasNext(); ) {
                Map.Entry<String, JsonNode> field = fields.next();
                if (VISUALIZATION_KEYS.contains(field.getKey())) {
                    continue;
                }
                ScalarValue scalar = toScalar(field.getValue());
                if (scalar != null && !extra.containsKey(field.getKey())) {
                    log.debug("Keeping unknown key {} of {} as extra", field.getKey(), path);
                    extra.put(field.getKey(), scalar);
                } else {
                    d.report(DiagnosticKind.UNKNOWN_KEY, child(path, field.getKey()),
                        "ignored unknown key '" + field.getKey() + "'");
                }
            }
        }

        if (name == null || type == null || source == null || data == null || extra == null || roles == null) {
            return null;
        }
        return new VisualizationNode(path, key, name, type, source, data, extra, roles);
    }

    private Map<String, ScalarValue> parseExtra(JsonNode visualization, String visualizationPath, DiagnosticCollector d) {
        Map<String, ScalarValue> extra = new LinkedHashMap<>();
        String path = child(visualizationPath, "extra");
        JsonNode node = visualization.get("extra");
        if (isAbsent(node)) {
            return extra;
        }
        if (!node.isObject()) {
            d.report(DiagnosticKind.PARSE_ERROR, path, "expected object but found " + typeOf(node));
            return null;
        }
        boolean valid = true;
        for (Iterator<Map.Entry<String, JsonNode>> fields = node.fields(); fields.hasNext(); ) {
            Map.Entry<String, JsonNode> field = fields.next();
            ScalarValue scalar = toScalar(field.getValue());
            if (scalar == null && field.getValue().isNumber()) {
                d.report(DiagnosticKind.PARSE_ERROR, child(path, field.getKey()),
                    "number " + field.getValue().asText() + " is not representable");
                valid = false;
            } else if (scalar == null) {
                d.report(DiagnosticKind.PARSE_ERROR, child(path, field.getKey()),
                    "expected scalar (string, number or boolean) but found " + typeOf(field.getValue()));
                valid = false;
            } else {
                extra.put(field.getKey(), scalar);
            }
        }
        return valid ? extra : null;
    }

    /**
     * Converts a scalar node; returns null for containers and for floats that overflowed to
     * infinity or are NaN.
     */
    private static ScalarValue toScalar(JsonNode node) {
        if (node == null) {
            return null;
        }
        if (node.isFloatingPointNumber() && !Double.isFinite(node.doubleValue())) {
            return null;
        }
        if (node.isTextual()) {
            return ScalarValue.ofString(node.asText());
        }
        if (node.isNumber()) {
            return ScalarValue.ofNumber(node.decimalValue());
        }
        if (node.isBoolean()) {
            return ScalarValue.ofBoolean(node.booleanValue());
        }
        return null;
    }

    // ==================== Deployment ====================

    private List<EnvNode> parseDeployment(JsonNode root, DiagnosticCollector d) {
        List<EnvNode> result = new ArrayList<>();
        JsonNode deployment = requireObject(root, "deployment", "", d);
        if (deployment == null) {
            return result;
        }
        warnUnknownKeys(deployment, DEPLOYMENT_KEYS, "deployment", d);
        JsonNode env = requireObject(deployment, "env", "deployment", d);
        if (env == null) {
            return result;
        }
        if (env.isEmpty()) {
            d.report(DiagnosticKind.PARSE_ERROR, "deployment.env", "at least one deployment environment is required");
            return result;
        }

        for (Iterator<Map.Entry<String, JsonNode>> entries = env.fields(); entries.hasNext(); ) {
            Map.Entry<String, JsonNode> entry = entries.next();
            String path = child("deployment.env", entry.getKey());
            if (!entry.getValue().isObject()) {
                d.report(DiagnosticKind.PARSE_ERROR, path,
                    "expected object (deployment environment) but found " + typeOf(entry.getValue()));
                continue;
            }
            EnvNode node = parseEnv(entry.getKey(), entry.getValue(), path, d);
            if (node != null) {
                result.add(node);
            }
        }
        return result;
    }

    private EnvNode parseEnv(String key, JsonNode node, String path, DiagnosticCollector d) {
        warnUnknownKeys(node, ENV_KEYS, path, d);
        String name = optionalText(node, "name", path, key, d);
        URI uri = requireUri(node, "uri", path, d);
        Integer port = requireIntInRange(node, "port", path, 0, DeploymentEnv.MAX_PORT, d);
        String type = requireText(node, "type", path, d);
        List<String> roles = optionalTextList(node, "roles", path, d);
        Map<String, String> credentials = parseCredentials(node, path, d);

        if (name == null || uri == null || port == null || type == null || roles == null || credentials == null) {
            return null;
        }
        return new EnvNode(path, key, name, uri, port, type, roles, credentials);
    }

    private Map<String, String> parseCredentials(JsonNode env, String envPath, DiagnosticCollector d) {
        Map<String, String> credentials = new LinkedHashMap<>();
        String path = child(envPath, "credentials");
        JsonNode node = env.get("credentials");
        if (isAbsent(node)) {
            return credentials;
        }
        if (!node.isObject()) {
            d.report(DiagnosticKind.PARSE_ERROR, path, "expected object but found " + typeOf(node));
            return null;
        }
        boolean valid = true;
        for (Iterator<Map.Entry<String, JsonNode>> fields = node.fields(); fields.hasNext(); ) {
            Map.Entry<String, JsonNode> field = fields.next();
            String value = text(field.getValue(), child(path, field.getKey()), d);
            if (value == null) {
                valid = false;
            } else {
                credentials.put(field.getKey(), value);
            }
        }
        return valid ? credentials : null;
    }

    // ==================== Primitive accessors ====================

    private JsonNode requireObject(JsonNode parent, String key, String parentPath, DiagnosticCollector d) {
        String path = child(parentPath, key);
        JsonNode node = parent.get(key);
        if (isAbsent(node)) {
            missing(path, key, d);
            return null;
        }
        if (!node.isObject()) {
            d.report(DiagnosticKind.PARSE_ERROR, path, "expected object but found " + typeOf(node));
            return null;
        }
        return node;
    }

    private String requireText(JsonNode parent, String key, String parentPath, DiagnosticCollector d) {
        String path = child(parentPath, key);
        JsonNode node = parent.get(key);
        if (isAbsent(node)) {
            missing(path, key, d);
            return null;
        }
        return text(node, path, d);
    }

    private String optionalText(JsonNode parent, String key, String parentPath, String defaultValue,
                                DiagnosticCollector d) {
        JsonNode node = parent.get(key);
        if (isAbsent(node)) {
            return defaultValue;
        }
        return text(node, child(parentPath, key), d);
    }

    private String text(JsonNode node, String path, DiagnosticCollector d) {
        if (!node.isTextual()) {
            d.report(DiagnosticKind.PARSE_ERROR, path, "expected string but found " + typeOf(node));
            return null;
        }
        if (node.asText().isBlank()) {
            d.report(DiagnosticKind.PARSE_ERROR, path, "must not be empty");
            return null;
        }
        return node.asText();
    }

    private Integer requireIntInRange(JsonNode parent, String key, String parentPath, int min, int max,
                                      DiagnosticCollector d) {
        String path = child(parentPath, key);
        JsonNode node = parent.get(key);
        if (isAbsent(node)) {
            missing(path, key, d);
            return null;
        }
        if (!node.isIntegralNumber()) {
            d.report(DiagnosticKind.PARSE_ERROR, path, "expected integer but found " + typeOf(node));
            return null;
        }
        BigInteger value = node.bigIntegerValue();
        if (value.compareTo(BigInteger.valueOf(min)) < 0 || value.compareTo(BigInteger.valueOf(max)) > 0) {
            d.report(DiagnosticKind.PARSE_ERROR, path, key + " " + value + " out of range [" + min + ", " + max + "]");
            return null;
        }
        return value.intValue();
    }

    private Integer requireNonNegativeInt(JsonNode parent, String key, String parentPath, DiagnosticCollector d) {
        Integer value = requireIntInRange(parent, key, parentPath, Integer.MIN_VALUE, Integer.MAX_VALUE, d);
        if (value != null && value < 0) {
            d.report(DiagnosticKind.PARSE_ERROR, child(parentPath, key),
                "expected non-negative integer but found " + value);
            return null;
        }
        return value;
    }

    private URI requireUri(JsonNode parent, String key, String parentPath, DiagnosticCollector d) {
        String path = child(parentPath, key);
        String text = requireText(parent, key, parentPath, d);
        if (text == null) {
            return null;
        }
        try {
            URI uri = new URI(text);
            if (!uri.isAbsolute()) {
                d.report(DiagnosticKind.PARSE_ERROR, path, "expected absolute URI but found '" + text + "'");
                return null;
            }
            return uri;
        } catch (URISyntaxException e) {
            d.report(DiagnosticKind.PARSE_ERROR, path, "invalid URI '" + text + "': " + e.getReason());
            return null;
        }
    }

    private List<String> requireTextList(JsonNode parent, String key, String parentPath, DiagnosticCollector d) {
        String path = child(parentPath, key);
        JsonNode node = parent.get(key);
        if (isAbsent(node)) {
            missing(path, key, d);
            return null;
        }
        if (!node.isArray()) {
            d.report(DiagnosticKind.PARSE_ERROR, path, "expected array but found " + typeOf(node));
            return null;
        }
        return textElements(node, path, d);
    }

    private List<String> optionalTextList(JsonNode parent, String key, String parentPath, DiagnosticCollector d) {
        if (isAbsent(parent.get(key))) {
            return List.of();
        }
        return requireTextList(parent, key, parentPath, d);
    }

    private List<String> textElements(JsonNode array, String path, DiagnosticCollector d) {
        List<String> values = new ArrayList<>();
        boolean valid = true;
        for (int i = 0; i < array.size(); i++) {
            String value = text(array.get(i), index(path, i), d);
            if (value == null) {
                valid = false;
            } else {
                values.add(value);
            }
        }
        return valid ? values : null;
    }

    private void warnUnknownKeys(JsonNode node, Set<String> known, String path, DiagnosticCollector d) {
        node.fieldNames().forEachRemaining(key -> {
            if (!known.contains(key)) {
                d.report(DiagnosticKind.UNKNOWN_KEY, child(path, key), "ignored unknown key '" + key + "'");
            }
        });
    }

    private static void missing(String path, String key, DiagnosticCollector d) {
        d.report(DiagnosticKind.PARSE_ERROR, path, "missing required key '" + key + "'");
    }

    private static boolean isAbsent(JsonNode node) {
        return node == null || node.isNull() || node.isMissingNode();
    }

    static String typeOf(JsonNode node) {
        if (node == null || node.isMissingNode()) {
            return "nothing";
        }
        if (node.isIntegralNumber()) {
            return "integer";
        }
        return node.getNodeType().name().toLowerCase(Locale.ROOT);
    }
}
