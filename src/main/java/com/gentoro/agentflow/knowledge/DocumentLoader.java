package com.gentoro.agentflow.knowledge;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.agentflow.exception.IngestionException;
import com.gentoro.agentflow.utility.JacksonUtility;
import java.io.IOException;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;

/**
 * Reads knowledge sources into {@link Document}s.
 *
 * <p>PDF text is extracted with PDFBox. Text, Markdown and CSV are read as UTF-8 (invalid byte
 * sequences are an error, not replaced). JSON and YAML are parsed first so that malformed files
 * fail here instead of producing garbage chunks; the stored text is the pretty-printed content.
 */
public class DocumentLoader {
  private static final org.slf4j.Logger log =
      com.gentoro.agentflow.logging.LoggingService.getLogger(DocumentLoader.class);

  public Document load(Path path) {
    String source = path.toString();
    if (!Files.isRegularFile(path)) {
      throw new IngestionException(source, "Knowledge source does not exist: " + source);
    }
    MediaType type =
        MediaType.fromPath(path)
            .orElseThrow(
                () ->
                    new IngestionException(
                        source, "Unsupported knowledge source type: " + source));
    byte[] bytes;
    try {
      bytes = Files.readAllBytes(path);
    } catch (IOException e) {
      throw new IngestionException(source, "Failed to read knowledge source: " + source, e);
    }
    String text = extract(source, type, bytes);
    if (text.isBlank()) {
      log.warn("Knowledge source {} has no extractable text", source);
    }
    Document document = Document.of(source, type, text);
    log.debug(
        "Loaded {} ({}, {} chars, id={})",
        source,
        type,
        document.text().length(),
        document.id());
    return document;
  }

  String extract(String source, MediaType type, byte[] bytes) {
    return switch (type) {
      case PDF -> pdfText(source, bytes);
      case TEXT, MARKDOWN, CSV -> utf8(source, bytes);
      case JSON -> structured(source, utf8(source, bytes), false);
      case YAML -> structured(source, utf8(source, bytes), true);
    };
  }

  private String pdfText(String source, byte[] bytes) {
    try (PDDocument doc = Loader.loadPDF(bytes)) {
      PDFTextStripper stripper = new PDFTextStripper();
      stripper.setSortByPosition(true);
      return stripper.getText(doc);
    } catch (IOException e) {
      throw new IngestionException(source, "Failed to extract text from PDF: " + source, e);
    }
  }

  private String utf8(String source, byte[] bytes) {
    try {
      return StandardCharsets.UTF_8
          .newDecoder()
          .onMalformedInput(CodingErrorAction.REPORT)
          .onUnmappableCharacter(CodingErrorAction.REPORT)
          .decode(java.nio.ByteBuffer.wrap(bytes))
          .toString();
    } catch (CharacterCodingException e) {
      throw new IngestionException(
          source, "Knowledge source is not valid UTF-8 text: " + source, e);
    }
  }

  private String structured(String source, String content, boolean yaml) {
    try {
      JsonNode node =
          yaml
              ? JacksonUtility.getYamlMapper().readTree(content)
              : JacksonUtility.getJsonMapper().readTree(content);
      if (node == null) return "";
      if (yaml) {
        return JacksonUtility.getYamlMapper().writeValueAsString(node);
      }
      return JacksonUtility.getJsonMapper()
          .writerWithDefaultPrettyPrinter()
          .writeValueAsString(node);
    } catch (IOException e) {
      throw new IngestionException(
          source, "Failed to parse %s source: %s".formatted(yaml ? "YAML" : "JSON", source), e);
    }
  }
}
