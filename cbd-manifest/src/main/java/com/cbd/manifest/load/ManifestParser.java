package com.cbd.manifest.load;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.StreamReadFeature;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLParser;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;

/**
 * Parses manifest text (YAML, or JSON as a YAML subset) into a Jackson tree. The tree keeps
 * absent, {@code null} and empty values apart.
 * <p>
 * Parsing is strict: duplicate keys and a second document are errors, and YAML 1.1 words such
 * as {@code yes} or {@code off} stay strings.
 */
public final class ManifestParser {

    private static final ObjectMapper YAML = new ObjectMapper(YAMLFactory.builder()
            .enable(StreamReadFeature.STRICT_DUPLICATE_DETECTION)
            .enable(YAMLParser.Feature.PARSE_BOOLEAN_LIKE_WORDS_AS_STRINGS)
            .build())
            .enable(DeserializationFeature.FAIL_ON_READING_DUP_TREE_KEY);

    /**
     * @param text   manifest content
     * @param source path used in error messages
     * @return the parsed tree; a {@link MissingNode} for empty text
     * @throws ManifestParseException when the text is not well-formed or holds more than one document
     */
    public JsonNode parse(String text, Path source) {
        try (JsonParser parser = YAML.createParser(text)) {
            JsonNode node = YAML.readTree(parser);
            if (parser.nextToken() != null) {
                throw new ManifestParseException(source,
                        "expected a single document, found another at line " + parser.currentLocation().getLineNr(),
                        null);
            }
            return node != null ? node : MissingNode.getInstance();
        } catch (JsonProcessingException e) {
            throw new ManifestParseException(source, e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
