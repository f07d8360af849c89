package com.flamingo.ai.devicerag.service.template.model;

import com.flamingo.ai.devicerag.service.rag.model.TextBlock;
import java.util.List;
import java.util.stream.IntStream;

/**
 * A parsed template.
 *
 * @param filename uploaded file name
 * @param blocks blocks in reading order
 * @param format how the template was read, which decides how it is written back
 * @param byteOrderMark true when a plain-text template started with a UTF-8 byte order mark
 * @param source the uploaded bytes
 */
public record TemplateDocument(
    String filename,
    List<TemplateBlock> blocks,
    Format format,
    boolean byteOrderMark,
    byte[] source) {

  public enum Format {
    /** A text file split into lines, each keeping its own line terminator. */
    PLAIN_TEXT,
    /** A Word document, written back by editing the original package. */
    DOCX,
    /** Any other format Tika reads, written back as a text rendition. */
    TEXT_RENDITION
  }

  public TemplateDocument {
    blocks = List.copyOf(blocks);
    source = source == null ? new byte[0] : source;
  }

  public TemplateDocument(String filename, List<TemplateBlock> blocks, Format format) {
    this(filename, blocks, format, false, new byte[0]);
  }

  public boolean plainText() {
    return format == Format.PLAIN_TEXT;
  }

  public TemplateDocument withBlocks(List<TemplateBlock> replaced) {
    return new TemplateDocument(filename, replaced, format, byteOrderMark, source);
  }

  /**
   * Renders the document as text. Plain-text lines are written with their own terminators, so an
   * unchanged line comes out byte for byte as it went in. Other formats are laid out the way Tika
   * writes text: cells of a table row separated by tabs, one block per line.
   */
  public String render() {
    StringBuilder sb = new StringBuilder();
    if (plainText()) {
      if (byteOrderMark) {
        sb.append('\uFEFF');
      }
      for (TemplateBlock block : blocks) {
        sb.append(block.text()).append(block.source().lineEnd());
      }
      return sb.toString();
    }
    TemplateBlock previous = null;
    for (TemplateBlock block : blocks) {
      if (previous != null) {
        sb.append(block.source().sameRow(previous.source()) ? '\t' : '\n');
      }
      sb.append(block.text());
      previous = block;
    }
    return sb.toString();
  }

  /** Builds a plain-text document from lines joined by {@code \n}. */
  public static TemplateDocument ofLines(String filename, List<String> lines) {
    int last = lines.size() - 1;
    List<TemplateBlock> blocks =
        IntStream.range(0, lines.size())
            .mapToObj(
                i -> new TemplateBlock(i, TextBlock.line(lines.get(i), i < last ? "\n" : "")))
            .toList();
    return new TemplateDocument(filename, blocks, Format.PLAIN_TEXT);
  }
}
