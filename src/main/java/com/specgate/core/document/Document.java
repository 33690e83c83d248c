package com.specgate.core.document;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;

import java.nio.file.Path;
import java.util.Optional;

/**
 * A loaded workflow document. Reloaded fresh on every validation call.
 *
 * @param path        file path
 * @param raw         full normalized text (LF line endings, no BOM)
 * @param header      text between the header delimiters, or null when there is no header block
 * @param body        text after the header block, or the whole text when there is none
 * @param bodyOffset  number of lines preceding the body
 * @param headerError reason the header block could not be split, or null
 */
public record Document(
    Path path,
    String raw,
    String header,
    String body,
    int bodyOffset,
    String headerError
) {

    public boolean hasHeader() {
        return header != null;
    }

    public boolean isBlank() {
        return raw.isBlank();
    }

    /**
     * Parses the header block as YAML. Empty when the document has no header
     * or the header is empty.
     *
     * @throws JsonProcessingException when the header is not valid YAML
     */
    public Optional<JsonNode> headerNode() throws JsonProcessingException {
        if (header == null || header.isBlank()) {
            return Optional.empty();
        }
        JsonNode node = Mappers.yaml().readTree(header);
        return node == null || node.isMissingNode() || node.isNull() ? Optional.empty() : Optional.of(node);
    }

    /** Header node or empty, treating unparsable YAML as absent. */
    public Optional<JsonNode> headerNodeQuietly() {
        try {
            return headerNode();
        } catch (JsonProcessingException e) {
            return Optional.empty();
        }
    }
}
