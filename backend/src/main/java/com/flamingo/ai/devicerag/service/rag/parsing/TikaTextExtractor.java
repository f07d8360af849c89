package com.flamingo.ai.devicerag.service.rag.parsing;

import com.flamingo.ai.devicerag.service.rag.model.ExtractedText;
import com.flamingo.ai.devicerag.service.rag.model.StructuralHint;
import com.flamingo.ai.devicerag.service.rag.model.TextBlock;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import lombok.extern.slf4j.Slf4j;
import org.apache.tika.exception.TikaException;
import org.apache.tika.metadata.Metadata;
import org.apache.tika.metadata.TikaCoreProperties;
import org.apache.tika.parser.AutoDetectParser;
import org.apache.tika.parser.ParseContext;
import org.apache.tika.sax.ToXMLContentHandler;
import org.springframework.stereotype.Service;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.SAXException;

/**
 * Extracts text from uploaded documents.
 *
 * <p>Plain-text files are decoded as UTF-8 and split into lines that keep their terminators.
 * Everything else goes through Apache Tika's {@link AutoDetectParser} with a {@link
 * ToXMLContentHandler}; the XHTML DOM is then walked for headings, paragraphs, list items and table
 * cells.
 */
@Service
@Slf4j
public class TikaTextExtractor {

  /**
   * Extracts the text of a document with table-cell and heading hints for the chunker.
   *
   * @throws IOException if the content cannot be read or parsed
   */
  public ExtractedText extract(byte[] content, String filename, String mimeType)
      throws IOException {
    if (isPlainText(filename, mimeType)) {
      return ExtractedText.plain(decode(content));
    }
    return toExtractedText(extractBlocks(content, filename, mimeType));
  }

  /**
   * Extracts the blocks of a document in reading order.
   *
   * @throws IOException if the content cannot be read or parsed
   */
  public List<TextBlock> extractBlocks(byte[] content, String filename, String mimeType)
      throws IOException {
    if (isPlainText(filename, mimeType)) {
      return splitLines(decode(content));
    }
    try {
      byte[] xhtml = toXhtml(content, filename, mimeType);
      List<TextBlock> blocks = parseXhtml(xhtml);
      log.debug("Extracted {} blocks from {}", blocks.size(), filename);
      return blocks;
    } catch (TikaException | SAXException | ParserConfigurationException e) {
      throw new IOException("Failed to extract text from " + filename + ": " + e.getMessage(), e);
    }
  }

  /** Joins blocks into one text; cells of a row share a line separated by " | ". */
  public ExtractedText toExtractedText(List<TextBlock> blocks) {
    StringBuilder text = new StringBuilder();
    List<StructuralHint> hints = new ArrayList<>();
    TextBlock previous = null;
    for (TextBlock block : blocks) {
      if (previous != null) {
        if (block.sameRow(previous)) {
          text.append(" | ");
        } else if (block.isCell() && previous.isCell() && block.table() == previous.table()) {
          text.append('\n');
        } else if (block.kind() == TextBlock.Kind.LINE && previous.kind() == TextBlock.Kind.LINE) {
          text.append('\n');
        } else {
          text.append("\n\n");
        }
      }
      int start = text.length();
      text.append(block.text());
      if (block.isCell() && !block.text().isEmpty()) {
        hints.add(new StructuralHint(start, text.length(), StructuralHint.Kind.TABLE_CELL));
      } else if (block.kind() == TextBlock.Kind.HEADING && !block.text().isEmpty()) {
        hints.add(new StructuralHint(start, text.length(), StructuralHint.Kind.HEADING));
      }
      previous = block;
    }
    return new ExtractedText(text.toString(), hints);
  }

  static boolean isPlainText(String filename, String mimeType) {
    if (mimeType != null && mimeType.toLowerCase(Locale.ROOT).startsWith("text/plain")) {
      return true;
    }
    if (filename == null) {
      return false;
    }
    String lower = filename.toLowerCase(Locale.ROOT);
    return lower.endsWith(".txt") || lower.endsWith(".md") || lower.endsWith(".text");
  }

  private static String decode(byte[] content) {
    String text = new String(content, StandardCharsets.UTF_8);
    // Strip a UTF-8 byte order mark
    return text.startsWith("\uFEFF") ? text.substring(1) : text;
  }

  /**
   * Splits text into lines, keeping each line's terminator so that concatenating text and
   * terminator of every line gives back the input. A trailing terminator yields a final empty line.
   */
  static List<TextBlock> splitLines(String text) {
    List<TextBlock> lines = new ArrayList<>();
    int start = 0;
    int i = 0;
    while (i < text.length()) {
      char c = text.charAt(i);
      if (c == '\n' || c == '\r') {
        boolean crlf = c == '\r' && i + 1 < text.length() && text.charAt(i + 1) == '\n';
        int end = crlf ? i + 2 : i + 1;
        lines.add(TextBlock.line(text.substring(start, i), text.substring(i, end)));
        start = end;
        i = end;
      } else {
        i++;
      }
    }
    lines.add(TextBlock.line(text.substring(start), ""));
    return lines;
  }

  private byte[] toXhtml(byte[] content, String filename, String mimeType)
      throws IOException, TikaException, SAXException {
    AutoDetectParser parser = new AutoDetectParser();
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    ToXMLContentHandler handler = new ToXMLContentHandler(out, StandardCharsets.UTF_8.name());
    Metadata metadata = new Metadata();
    if (filename != null) {
      metadata.set(TikaCoreProperties.RESOURCE_NAME_KEY, filename);
    }
    if (mimeType != null) {
      metadata.set(Metadata.CONTENT_TYPE, mimeType);
    }
    try (InputStream in = new ByteArrayInputStream(content)) {
      parser.parse(in, handler, metadata, new ParseContext());
    }
    return out.toByteArray();
  }

  private List<TextBlock> parseXhtml(byte[] xhtml)
      throws ParserConfigurationException, SAXException, IOException {
    DocumentBuilderFactory dbf = DocumentBuilderFactory.newInstance();
    dbf.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
    dbf.setNamespaceAware(true);
    org.w3c.dom.Document dom = dbf.newDocumentBuilder().parse(new ByteArrayInputStream(xhtml));
    dom.getDocumentElement().normalize();

    List<TextBlock> blocks = new ArrayList<>();
    walk(dom.getDocumentElement(), blocks, new int[] {0});
    return blocks;
  }

  private void walk(Element root, List<TextBlock> blocks, int[] tableCounter) {
    NodeList children = root.getChildNodes();
    for (int i = 0; i < children.getLength(); i++) {
      Node child = children.item(i);
      if (child.getNodeType() != Node.ELEMENT_NODE) {
        continue;
      }
      Element el = (Element) child;
      String tag = tagOf(el);

      if ("head".equals(tag) || "script".equals(tag) || "style".equals(tag)) {
        continue;
      }
      if (tag.matches("h[1-6]")) {
        addIfPresent(blocks, TextBlock.Kind.HEADING, el.getTextContent());
      } else if ("table".equals(tag)) {
        addTable(el, blocks, tableCounter[0]++);
      } else if ("li".equals(tag)) {
        addIfPresent(blocks, TextBlock.Kind.LIST_ITEM, el.getTextContent());
      } else if ("p".equals(tag)) {
        addIfPresent(blocks, TextBlock.Kind.PARAGRAPH, el.getTextContent());
      } else {
        walk(el, blocks, tableCounter);
      }
    }
  }

  private void addTable(Element table, List<TextBlock> blocks, int tableIndex) {
    NodeList rows = table.getElementsByTagNameNS("*", "tr");
    int rowIndex = 0;
    for (int r = 0; r < rows.getLength(); r++) {
      NodeList cells = rows.item(r).getChildNodes();
      int column = 0;
      for (int c = 0; c < cells.getLength(); c++) {
        Node cell = cells.item(c);
        if (cell.getNodeType() != Node.ELEMENT_NODE) {
          continue;
        }
        String cellTag = tagOf((Element) cell);
        if ("td".equals(cellTag) || "th".equals(cellTag)) {
          String text = cell.getTextContent().strip();
          blocks.add(TextBlock.cell(text, tableIndex, rowIndex, column++));
        }
      }
      if (column > 0) {
        rowIndex++;
      }
    }
  }

  private static void addIfPresent(List<TextBlock> blocks, TextBlock.Kind kind, String text) {
    String stripped = text == null ? "" : text.strip();
    if (!stripped.isEmpty()) {
      blocks.add(TextBlock.of(kind, stripped));
    }
  }

  private static String tagOf(Element el) {
    String tag = el.getLocalName() != null ? el.getLocalName() : el.getTagName();
    return tag.toLowerCase(Locale.ROOT);
  }
}
