package com.gentoro.agentflow.knowledge;

import com.gentoro.agentflow.utility.Fingerprints;
import com.vladsch.flexmark.ast.BulletList;
import com.vladsch.flexmark.ast.CodeBlock;
import com.vladsch.flexmark.ast.FencedCodeBlock;
import com.vladsch.flexmark.ast.Heading;
import com.vladsch.flexmark.ast.HtmlBlock;
import com.vladsch.flexmark.ast.OrderedList;
import com.vladsch.flexmark.ext.tables.TableBlock;
import com.vladsch.flexmark.ext.tables.TablesExtension;
import com.vladsch.flexmark.parser.Parser;
import com.vladsch.flexmark.util.ast.Node;
import com.vladsch.flexmark.util.data.MutableDataSet;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Splits a document into bounded, overlapping chunks whose spans point back into the document
 * text.
 *
 * <p>Markdown is parsed with flexmark and grouped by heading sections (the section path is kept on
 * every chunk); code blocks, lists, tables and HTML blocks are kept whole when they fit. Other
 * media types are split by paragraphs. Oversized blocks are split by sentences and, as a last
 * resort, by size. Adjacent pieces of the same section are then packed up to {@code maxTokens -
 * overlapTokens}, and each chunk after the first of a section is extended backwards by up to
 * {@code overlapTokens} into its predecessor, starting on a word boundary. A chunk, overlap
 * included, therefore stays within {@code maxTokens}.
 */
public class Chunker {

  private final int maxTokens;
  private final int overlapTokens;
  // room left for new text once the overlap is taken
  private final int bodyTokens;
  private final Parser parser;

  public Chunker(int maxTokens, int overlapTokens) {
    if (maxTokens <= 0 || overlapTokens < 0 || overlapTokens >= maxTokens) {
      throw new IllegalArgumentException(
          "Invalid token sizes: max=%d overlap=%d".formatted(maxTokens, overlapTokens));
    }
    this.maxTokens = maxTokens;
    this.overlapTokens = overlapTokens;
    this.bodyTokens = maxTokens - overlapTokens;
    MutableDataSet options = new MutableDataSet();
    options.set(Parser.EXTENSIONS, List.of(TablesExtension.create()));
    this.parser = Parser.builder(options).build();
  }

  public int maxTokens() {
    return maxTokens;
  }

  public int overlapTokens() {
    return overlapTokens;
  }

  public List<Chunk> chunk(Document document) {
    String text = document.text();
    if (text.isBlank()) return List.of();

    List<Piece> units =
        document.mediaType() == MediaType.MARKDOWN
            ? markdownUnits(text)
            : paragraphs(text, 0, text.length(), "");

    List<Piece> bounded = new ArrayList<>();
    for (Piece unit : units) {
      bounded.addAll(fit(text, unit));
    }
    List<Piece> packed = pack(bounded);

    List<Chunk> chunks = new ArrayList<>(packed.size());
    Piece prev = null;
    for (Piece p : packed) {
      int start = p.start();
      if (prev != null && overlapTokens > 0 && prev.sectionPath().equals(p.sectionPath())) {
        start = overlapStart(text, prev, p);
      }
      String chunkText = text.substring(start, p.end());
      int seq = chunks.size();
      chunks.add(
          new Chunk(
              Chunk.idOf(document.id(), seq),
              document.id(),
              seq,
              chunkText,
              new Chunk.Span(start, p.end()),
              p.sectionPath(),
              Fingerprints.sha256(chunkText)));
      prev = p;
    }
    return chunks;
  }

  // Top-level markdown blocks, each tagged with the heading path it lives under.
  private List<Piece> markdownUnits(String text) {
    List<Piece> out = new ArrayList<>();
    Deque<String> headingStack = new ArrayDeque<>();
    String path = "";
    Node node = parser.parse(text).getFirstChild();
    while (node != null) {
      int start = node.getStartOffset();
      int end = Math.min(node.getEndOffset(), text.length());
      if (node instanceof Heading h) {
        while (headingStack.size() >= h.getLevel()) {
          headingStack.removeLast();
        }
        headingStack.addLast(h.getText().toString().trim());
        path = String.join(" > ", headingStack);
        addTrimmed(out, text, start, end, path, false);
      } else if (node instanceof FencedCodeBlock
          || node instanceof CodeBlock
          || node instanceof BulletList
          || node instanceof OrderedList
          || node instanceof TableBlock
          || node instanceof HtmlBlock) {
        addTrimmed(out, text, start, end, path, true);
      } else {
        out.addAll(paragraphs(text, start, end, path));
      }
      node = node.getNext();
    }
    return out;
  }

  // Split a unit that is over the limit: sentences for prose, size for everything else.
  private List<Piece> fit(String text, Piece unit) {
    if (Tokenizer.estimateTokens(unit.length()) <= bodyTokens) return List.of(unit);
    if (unit.protectedBlock()) return forceSplit(text, unit);

    List<Piece> sentences = sentences(text, unit);
    if (sentences.size() <= 1) return forceSplit(text, unit);
    List<Piece> out = new ArrayList<>();
    for (Piece s : sentences) {
      if (Tokenizer.estimateTokens(s.length()) <= bodyTokens) {
        out.add(s);
      } else {
        out.addAll(forceSplit(text, s));
      }
    }
    return out;
  }

  private List<Piece> pack(List<Piece> pieces) {
    List<Piece> out = new ArrayList<>();
    Piece current = null;
    for (Piece p : pieces) {
      if (current != null
          && current.sectionPath().equals(p.sectionPath())
          && Tokenizer.estimateTokens(p.end() - current.start()) <= bodyTokens) {
        current = new Piece(current.start(), p.end(), current.sectionPath(), false);
      } else {
        if (current != null) out.add(current);
        current = p;
      }
    }
    if (current != null) out.add(current);
    return out;
  }

  private int overlapStart(String text, Piece prev, Piece current) {
    int candidate =
        Math.max(prev.start() + 1, current.start() - overlapTokens * Tokenizer.CHARS_PER_TOKEN);
    if (candidate >= current.start()) return current.start();
    // move to the next word boundary
    while (candidate < current.start() && !Character.isWhitespace(text.charAt(candidate - 1))) {
      candidate++;
    }
    while (candidate < current.start() && Character.isWhitespace(text.charAt(candidate))) {
      candidate++;
    }
    return candidate;
  }

  /** Paragraph boundary: newline, optional blanks, newline. */
  private List<Piece> paragraphs(String text, int from, int to, String path) {
    List<Piece> out = new ArrayList<>();
    int start = from;
    int i = from;
    while (i < to) {
      if (text.charAt(i) == '\n') {
        int j = i + 1;
        while (j < to && text.charAt(j) != '\n' && Character.isWhitespace(text.charAt(j))) {
          j++;
        }
        if (j < to && text.charAt(j) == '\n') {
          addTrimmed(out, text, start, i, path, false);
          start = j + 1;
          i = j + 1;
          continue;
        }
      }
      i++;
    }
    addTrimmed(out, text, start, to, path, false);
    return out;
  }

  /** Sentence boundary: '.', '!' or '?' followed by whitespace. */
  private List<Piece> sentences(String text, Piece unit) {
    List<Piece> out = new ArrayList<>();
    int start = unit.start();
    for (int i = unit.start(); i < unit.end() - 1; i++) {
      char c = text.charAt(i);
      if ((c == '.' || c == '!' || c == '?') && Character.isWhitespace(text.charAt(i + 1))) {
        addTrimmed(out, text, start, i + 1, unit.sectionPath(), false);
        start = i + 1;
      }
    }
    addTrimmed(out, text, start, unit.end(), unit.sectionPath(), false);
    return out;
  }

  private List<Piece> forceSplit(String text, Piece unit) {
    List<Piece> out = new ArrayList<>();
    int maxChars = bodyTokens * Tokenizer.CHARS_PER_TOKEN;
    int start = unit.start();
    int len = unit.end();
    while (start < len) {
      int end = Math.min(start + maxChars, len);
      if (end < len) {
        for (int i = end - 1; i > start && i > end - 100; i--) {
          if (Character.isWhitespace(text.charAt(i))) {
            end = i;
            break;
          }
        }
      }
      addTrimmed(out, text, start, end, unit.sectionPath(), false);
      start = end;
      while (start < len && Character.isWhitespace(text.charAt(start))) {
        start++;
      }
    }
    return out;
  }

  private static void addTrimmed(
      List<Piece> out, String text, int start, int end, String path, boolean protectedBlock) {
    while (start < end && Character.isWhitespace(text.charAt(start))) start++;
    while (end > start && Character.isWhitespace(text.charAt(end - 1))) end--;
    if (end > start) {
      out.add(new Piece(start, end, path, protectedBlock));
    }
  }

  private record Piece(int start, int end, String sectionPath, boolean protectedBlock) {
    int length() {
      return end - start;
    }
  }
}
