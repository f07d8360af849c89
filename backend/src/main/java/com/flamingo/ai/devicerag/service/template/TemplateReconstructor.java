package com.flamingo.ai.devicerag.service.template;

import com.flamingo.ai.devicerag.service.template.docx.DocxTemplateCodec;
import com.flamingo.ai.devicerag.service.template.model.TemplateBlock;
import com.flamingo.ai.devicerag.service.template.model.TemplateDocument;
import com.flamingo.ai.devicerag.service.template.model.TemplateField;
import com.flamingo.ai.devicerag.service.template.output.RenderedTemplate;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Writes filled values back into the template. Only the spans of filled fields change; every other
 * character of every block is kept as parsed.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TemplateReconstructor {

  static final String TEXT_MEDIA_TYPE = "text/plain;charset=UTF-8";

  private final DocxTemplateCodec docxCodec;

  public TemplateDocument reconstruct(TemplateDocument document, List<TemplateField> fields) {
    Map<Integer, List<TemplateField>> byBlock = filledByBlock(fields);
    if (byBlock.isEmpty()) {
      return document;
    }

    List<TemplateBlock> blocks = new ArrayList<>(document.blocks().size());
    for (TemplateBlock block : document.blocks()) {
      List<TemplateField> blockFields = byBlock.get(block.index());
      blocks.add(blockFields == null ? block : block.withText(apply(block.text(), blockFields)));
    }
    log.debug("Wrote {} filled fields into {} blocks", fields.size(), byBlock.size());
    return document.withBlocks(blocks);
  }

  /**
   * Produces the output file. Word templates get the values written into the uploaded document;
   * everything else is written as UTF-8 text.
   *
   * @param template the template as parsed
   * @param fields the fields with their final values
   */
  public RenderedTemplate render(TemplateDocument template, List<TemplateField> fields) {
    if (template.format() == TemplateDocument.Format.DOCX) {
      Map<Integer, List<DocxTemplateCodec.Edit>> byBlock = new LinkedHashMap<>();
      filledByBlock(fields)
          .forEach(
              (index, blockFields) -> {
                if (index >= 0 && index < template.blocks().size()) {
                  byBlock.put(index, edits(template.blocks().get(index).text(), blockFields));
                }
              });
      try {
        byte[] content =
            byBlock.isEmpty() ? template.source() : docxCodec.write(template.source(), byBlock);
        return new RenderedTemplate(content, ".docx", DocxTemplateCodec.MEDIA_TYPE);
      } catch (IOException e) {
        throw new UncheckedIOException("Failed to write template " + template.filename(), e);
      }
    }
    String text = reconstruct(template, fields).render();
    return new RenderedTemplate(text.getBytes(StandardCharsets.UTF_8), ".txt", TEXT_MEDIA_TYPE);
  }

  private static Map<Integer, List<TemplateField>> filledByBlock(List<TemplateField> fields) {
    Map<Integer, List<TemplateField>> byBlock = new LinkedHashMap<>();
    for (TemplateField field : fields) {
      if (field.isFilled()) {
        byBlock.computeIfAbsent(field.getBlockIndex(), k -> new ArrayList<>()).add(field);
      }
    }
    return byBlock;
  }

  static String apply(String text, List<TemplateField> fields) {
    StringBuilder sb = new StringBuilder(text);
    for (DocxTemplateCodec.Edit edit : edits(text, fields)) {
      sb.replace(edit.start(), edit.end(), edit.text());
    }
    return sb.toString();
  }

  /**
   * Edits for a block's fields, last span first so earlier offsets stay valid. Overlapping and
   * out-of-range fields are skipped.
   */
  static List<DocxTemplateCodec.Edit> edits(String text, List<TemplateField> fields) {
    List<TemplateField> ordered = new ArrayList<>(fields);
    ordered.sort(Comparator.comparingInt(TemplateField::getStart).reversed());
    List<DocxTemplateCodec.Edit> edits = new ArrayList<>(ordered.size());
    int limit = text.length();
    for (TemplateField field : ordered) {
      if (field.getEnd() > limit || field.getStart() < 0) {
        log.warn("Skipping overlapping or out-of-range field {}", field);
        continue;
      }
      edits.add(new DocxTemplateCodec.Edit(field.getStart(), field.getEnd(), replacement(field)));
      limit = field.getStart();
    }
    return edits;
  }

  static String replacement(TemplateField field) {
    String value = field.getValue();
    return switch (field.getPatternKind()) {
      case COLON_LABEL -> " " + value;
      case SIGNATURE_LINE -> center(value, field.width());
      case MISSING_MARKER, BRACKET_PLACEHOLDER, UNDERLINE_SHORT, DOT_LEADER, DATE_TOKEN -> value;
    };
  }

  static String center(String value, int width) {
    int padding = width - value.length();
    if (padding <= 0) {
      return value;
    }
    int left = padding / 2;
    return " ".repeat(left) + value + " ".repeat(padding - left);
  }
}
