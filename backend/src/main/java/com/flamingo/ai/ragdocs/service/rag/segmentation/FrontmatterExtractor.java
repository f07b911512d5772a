package com.flamingo.ai.ragdocs.service.rag.segmentation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import com.flamingo.ai.ragdocs.exception.DocumentParseException;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Pulls a YAML frontmatter block off the top of a markdown document.
 *
 * <p>The block must open on the first line with {@code ---} and close on a later line that is
 * exactly {@code ---}. Malformed YAML or a missing closing line leaves the document untouched.
 */
@Component
@Slf4j
public class FrontmatterExtractor {

  private static final String DELIMITER = "---";
  private static final String OPENING = DELIMITER + "\n";
  private static final String CLOSING = "\n" + DELIMITER + "\n";

  private static final ObjectMapper YAML_MAPPER = new YAMLMapper();

  /**
   * Splits {@code text} into frontmatter and body. Expects {@code \n} line endings.
   *
   * @param text the markdown document
   * @return metadata and remaining body; never null
   */
  public ExtractedFrontmatter extract(String text) {
    if (text == null || !text.startsWith(OPENING)) {
      return ExtractedFrontmatter.none(text);
    }

    int closing = text.indexOf(CLOSING, OPENING.length() - 1);
    int bodyStart;
    if (closing >= 0) {
      bodyStart = closing + CLOSING.length();
    } else if (text.endsWith("\n" + DELIMITER) && text.length() > OPENING.length()) {
      closing = text.length() - DELIMITER.length() - 1;
      bodyStart = text.length();
    } else {
      log.debug("Frontmatter opened but never closed, treating whole text as content");
      return ExtractedFrontmatter.none(text);
    }

    String yaml = closing > OPENING.length() ? text.substring(OPENING.length(), closing) : "";
    try {
      Map<String, Object> metadata = parse(yaml);
      return new ExtractedFrontmatter(metadata, text.substring(bodyStart).strip());
    } catch (DocumentParseException e) {
      log.warn("Discarding malformed frontmatter: {}", e.getMessage());
      return ExtractedFrontmatter.none(text);
    }
  }

  private Map<String, Object> parse(String yaml) {
    if (yaml.isBlank()) {
      return Map.of();
    }
    try {
      JsonNode node = YAML_MAPPER.readTree(yaml);
      if (node == null || !node.isObject()) {
        return Map.of();
      }
      Map<String, Object> metadata =
          YAML_MAPPER.convertValue(node, new TypeReference<HashMap<String, Object>>() {});
      metadata.values().removeIf(Objects::isNull);
      return metadata;
    } catch (JsonProcessingException e) {
      throw new DocumentParseException("Malformed frontmatter: " + e.getOriginalMessage(), e);
    }
  }
}
