package com.smartservice.core.parser;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParseException;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.smartservice.core.diagnostic.Diagnostic;
import com.smartservice.core.diagnostic.DiagnosticKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import static com.smartservice.core.parser.DescriptorPath.child;
import static com.smartservice.core.parser.DescriptorPath.index;

/**
 * Reads descriptor documents (YAML or JSON) into a Jackson tree.
 *
 * <p>A repeated mapping key does not overwrite the earlier entry: the first occurrence is
 * kept, the later one skipped and reported as {@link DiagnosticKind#DUPLICATE_KEY} in the
 * returned {@link DescriptorDocument}, so later stages still see and check the rest of the
 * document.
 *
 * <p>Thread-safe and reusable.
 */
public class DescriptorReader {

    private static final Logger log = LoggerFactory.getLogger(DescriptorReader.class);

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    /**
     * Supported input formats.
     */
    public enum Format {
        YAML,
        JSON;

        /**
         * Picks the format from a file extension; anything but {@code .json} is read as YAML.
         *
         * @param file descriptor file
         * @return detected format
         */
        public static Format fromPath(Path file) {
            String fileName = file.getFileName() == null ? "" : file.getFileName().toString();
            return fileName.toLowerCase(Locale.ROOT).endsWith(".json") ? JSON : YAML;
        }
    }

    private final JsonFactory yamlFactory;
    private final JsonFactory jsonFactory;

    public DescriptorReader() {
        this.yamlFactory = new YAMLFactory();
        this.jsonFactory = new JsonFactory();
    }

    /**
     * Reads a descriptor file.
     *
     * @param file YAML or JSON file
     * @return document with its repeated-key diagnostics
     * @throws DescriptorReadException if the file cannot be read or is not well-formed
     */
    public DescriptorDocument read(Path file) throws DescriptorReadException {
        if (!Files.isRegularFile(file)) {
            throw new DescriptorReadException("Descriptor file not found: " + file);
        }
        String content;
        try {
            content = Files.readString(file);
        } catch (IOException e) {
            throw new DescriptorReadException("Failed to read descriptor " + file + ": " + e.getMessage(), e);
        }
        log.debug("Read {} characters from {}", content.length(), file);
        return read(content, Format.fromPath(file));
    }

    /**
     * Reads descriptor content.
     *
     * @param content document text
     * @param format document format
     * @return document with its repeated-key diagnostics
     * @throws DescriptorReadException if the content is not well-formed
     */
    public DescriptorDocument read(String content, Format format) throws DescriptorReadException {
        JsonFactory factory = format == Format.JSON ? jsonFactory : yamlFactory;
        try (JsonParser parser = factory.createParser(content)) {
            if (parser.nextToken() == null) {
                return new DescriptorDocument(MissingNode.getInstance(), List.of());
            }
            List<Diagnostic> duplicates = new ArrayList<>();
            JsonNode root = readValue(parser, "", duplicates);
            if (!duplicates.isEmpty()) {
                log.debug("Skipped {} repeated keys", duplicates.size());
            }
            return new DescriptorDocument(root, duplicates);
        } catch (JsonProcessingException e) {
            throw new DescriptorReadException("Malformed " + format + " descriptor: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new DescriptorReadException("Malformed " + format + " descriptor: " + e.getMessage(), e);
        }
    }

    // ==================== Tree building ====================

    private static JsonNode readValue(JsonParser p, String path, List<Diagnostic> duplicates) throws IOException {
        return switch (p.currentToken()) {
            case START_OBJECT -> readObject(p, path, duplicates);
            case START_ARRAY -> readArray(p, path, duplicates);
            case VALUE_STRING -> NODES.textNode(p.getText());
            case VALUE_NUMBER_INT -> readInteger(p);
            case VALUE_NUMBER_FLOAT -> NODES.numberNode(p.getDoubleValue());
            case VALUE_TRUE -> NODES.booleanNode(true);
            case VALUE_FALSE -> NODES.booleanNode(false);
            case VALUE_NULL -> NODES.nullNode();
            case VALUE_EMBEDDED_OBJECT -> readEmbedded(p.getEmbeddedObject());
            default -> throw new JsonParseException(p, "Unexpected token " + p.currentToken());
        };
    }

    private static ObjectNode readObject(JsonParser p, String path, List<Diagnostic> duplicates) throws IOException {
        ObjectNode node = NODES.objectNode();
        for (JsonToken token = p.nextToken(); token == JsonToken.FIELD_NAME; token = p.nextToken()) {
            String key = p.currentName();
            String keyPath = child(path, key);
            p.nextToken();
            if (node.has(key)) {
                duplicates.add(Diagnostic.of(DiagnosticKind.DUPLICATE_KEY, keyPath,
                    "key '" + key + "' is declared more than once"));
                p.skipChildren();
            } else {
                node.set(key, readValue(p, keyPath, duplicates));
            }
        }
        return node;
    }

    private static ArrayNode readArray(JsonParser p, String path, List<Diagnostic> duplicates) throws IOException {
        ArrayNode node = NODES.arrayNode();
        for (JsonToken token = p.nextToken(); token != null && token != JsonToken.END_ARRAY; token = p.nextToken()) {
            node.add(readValue(p, index(path, node.size()), duplicates));
        }
        return node;
    }

    private static JsonNode readInteger(JsonParser p) throws IOException {
        return switch (p.getNumberType()) {
            case INT -> NODES.numberNode(p.getIntValue());
            case LONG -> NODES.numberNode(p.getLongValue());
            default -> NODES.numberNode(p.getBigIntegerValue());
        };
    }

    private static JsonNode readEmbedded(Object value) {
        if (value instanceof byte[]) {
            return NODES.binaryNode((byte[]) value);
        }
        return NODES.pojoNode(value);
    }
}
