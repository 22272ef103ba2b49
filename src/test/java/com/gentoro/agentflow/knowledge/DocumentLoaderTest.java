package com.gentoro.agentflow.knowledge;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.agentflow.exception.IngestionException;
import com.gentoro.agentflow.utility.Fingerprints;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class DocumentLoaderTest {

  private final DocumentLoader loader = new DocumentLoader();

  @Test
  @DisplayName("Markdown is loaded with normalized text and a content based id")
  void loadsMarkdown(@TempDir Path tmp) throws Exception {
    Path a = Files.writeString(tmp.resolve("a.md"), "# Title\r\n\r\n\r\n\r\nBody   \r\n");
    Path b = Files.writeString(tmp.resolve("copy.markdown"), "# Title\n\nBody\n");

    Document doc = loader.load(a);
    assertEquals(MediaType.MARKDOWN, doc.mediaType());
    assertEquals("# Title\n\nBody", doc.text());
    assertEquals(Fingerprints.sha256("# Title\n\nBody"), doc.id());
    assertEquals(a.toString(), doc.sourcePath());

    // same content from another path is the same document
    assertEquals(doc.id(), loader.load(b).id());
  }

  @Test
  @DisplayName("JSON and YAML are parsed and stored pretty printed")
  void loadsStructured(@TempDir Path tmp) throws Exception {
    Path json = Files.writeString(tmp.resolve("data.json"), "{\"product\":\"X\",\"price\":10}");
    Document doc = loader.load(json);
    assertEquals(MediaType.JSON, doc.mediaType());
    assertTrue(doc.text().contains("\"product\" : \"X\""), doc.text());

    Path yaml = Files.writeString(tmp.resolve("data.yml"), "product: X\nprice: 10\n");
    Document y = loader.load(yaml);
    assertEquals(MediaType.YAML, y.mediaType());
    assertTrue(y.text().contains("product: \"X\"") || y.text().contains("product: X"));
  }

  @Test
  @DisplayName("Text is extracted from PDF files")
  void loadsPdf(@TempDir Path tmp) throws Exception {
    Path file = tmp.resolve("report.pdf");
    try (PDDocument pdf = new PDDocument()) {
      PDPage page = new PDPage();
      pdf.addPage(page);
      try (PDPageContentStream cs = new PDPageContentStream(pdf, page)) {
        cs.beginText();
        cs.setFont(new PDType1Font(Standard14Fonts.FontName.HELVETICA), 12);
        cs.newLineAtOffset(72, 700);
        cs.showText("Quarterly revenue grew by ten percent");
        cs.endText();
      }
      pdf.save(file.toFile());
    }

    Document doc = loader.load(file);
    assertEquals(MediaType.PDF, doc.mediaType());
    assertTrue(doc.text().contains("Quarterly revenue grew by ten percent"), doc.text());
  }

  @Test
  @DisplayName("Missing, unsupported, malformed and non UTF-8 sources are rejected")
  void rejectsBadSources(@TempDir Path tmp) throws Exception {
    IngestionException missing =
        assertThrows(IngestionException.class, () -> loader.load(tmp.resolve("nope.md")));
    assertEquals(tmp.resolve("nope.md").toString(), missing.getSourcePath());

    Path docx = Files.writeString(tmp.resolve("file.docx"), "binary");
    assertThrows(IngestionException.class, () -> loader.load(docx));

    Path badJson = Files.writeString(tmp.resolve("bad.json"), "{\"a\": ");
    assertThrows(IngestionException.class, () -> loader.load(badJson));

    Path latin1 = tmp.resolve("latin1.txt");
    Files.write(latin1, "café".getBytes(StandardCharsets.ISO_8859_1));
    assertThrows(IngestionException.class, () -> loader.load(latin1));
  }

  @Test
  @DisplayName("Media type is derived from the file extension")
  void mediaTypes() {
    assertEquals(MediaType.TEXT, MediaType.fromPath(Path.of("x.LOG")).orElseThrow());
    assertEquals(MediaType.CSV, MediaType.fromPath(Path.of("dir/x.csv")).orElseThrow());
    assertTrue(MediaType.fromPath(Path.of("README")).isEmpty());
    assertTrue(MediaType.fromPath(Path.of("trailing.")).isEmpty());
  }
}
