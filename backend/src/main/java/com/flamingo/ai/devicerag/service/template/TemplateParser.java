package com.flamingo.ai.devicerag.service.template;

import com.flamingo.ai.devicerag.exception.TemplateParseException;
import com.flamingo.ai.devicerag.service.rag.model.TextBlock;
import com.flamingo.ai.devicerag.service.rag.parsing.TikaTextExtractor;
import com.flamingo.ai.devicerag.service.template.docx.DocxTemplateCodec;
import com.flamingo.ai.devicerag.service.template.model.TemplateBlock;
import com.flamingo.ai.devicerag.service.template.model.TemplateDocument;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Parses an uploaded template into blocks. Word documents are read with POI, the rest by Tika. */
@Component
@RequiredArgsConstructor
@Slf4j
public class TemplateParser {

  private final TikaTextExtractor textExtractor;
  private final DocxTemplateCodec docxCodec;

  /**
   * Parses a template.
   *
   * @throws TemplateParseException if the file is empty or cannot be parsed
   */
  public TemplateDocument parse(String filename, String mimeType, byte[] content) {
    if (content == null || content.length == 0) {
      throw new TemplateParseException(filename, "Template " + filename + " is empty");
    }
    boolean docx = DocxTemplateCodec.isDocx(filename, mimeType);
    List<TextBlock> extracted;
    try {
      extracted =
          docx
              ? docxCodec.read(content)
              : textExtractor.extractBlocks(content, filename, mimeType);
    } catch (IOException | RuntimeException e) {
      log.error("Failed to parse template {}: {}", filename, e.getMessage());
      throw new TemplateParseException(
          filename, "Failed to parse template " + filename + ": " + e.getMessage(), e);
    }
    if (extracted.stream().allMatch(b -> b.text().isBlank())) {
      throw new TemplateParseException(filename, "Template " + filename + " contains no text");
    }

    List<TemplateBlock> blocks = new ArrayList<>(extracted.size());
    for (int i = 0; i < extracted.size(); i++) {
      blocks.add(new TemplateBlock(i, extracted.get(i)));
    }
    TemplateDocument.Format format;
    if (docx) {
      format = TemplateDocument.Format.DOCX;
    } else if (extracted.stream().allMatch(b -> b.kind() == TextBlock.Kind.LINE)) {
      format = TemplateDocument.Format.PLAIN_TEXT;
    } else {
      format = TemplateDocument.Format.TEXT_RENDITION;
    }
    boolean bom = format == TemplateDocument.Format.PLAIN_TEXT && startsWithBom(content);
    log.debug("Parsed {} template {} into {} blocks", format, filename, blocks.size());
    return new TemplateDocument(filename, blocks, format, bom, content);
  }

  private static boolean startsWithBom(byte[] content) {
    return content.length >= 3
        && (content[0] & 0xFF) == 0xEF
        && (content[1] & 0xFF) == 0xBB
        && (content[2] & 0xFF) == 0xBF;
  }
}
