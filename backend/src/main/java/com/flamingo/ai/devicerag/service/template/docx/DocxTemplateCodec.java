package com.flamingo.ai.devicerag.service.template.docx;

import com.flamingo.ai.devicerag.service.rag.model.TextBlock;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.xwpf.usermodel.IBodyElement;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.apache.poi.xwpf.usermodel.XWPFRun;
import org.apache.poi.xwpf.usermodel.XWPFTable;
import org.apache.poi.xwpf.usermodel.XWPFTableCell;
import org.apache.poi.xwpf.usermodel.XWPFTableRow;
import org.springframework.stereotype.Component;

/**
 * Reads and writes Word (.docx) templates with Apache POI.
 *
 * <p>Body paragraphs and the paragraphs of table cells are visited in document order, and each
 * becomes one block. Writing opens the original package again, visits the same paragraphs in the
 * same order and changes only the characters covered by an edit, inside the runs that hold them,
 * so styles, headers, images and every untouched paragraph are written back as they were read.
 */
@Component
@Slf4j
public class DocxTemplateCodec {

  public static final String MEDIA_TYPE =
      "application/vnd.openxmlformats-officedocument.wordprocessingml.document";

  /** A replacement of the characters {@code [start, end)} of one paragraph's text. */
  public record Edit(int start, int end, String text) {}

  private record Located(XWPFParagraph paragraph, TextBlock block) {}

  public static boolean isDocx(String filename, String mimeType) {
    if (mimeType != null && mimeType.toLowerCase(Locale.ROOT).startsWith(MEDIA_TYPE)) {
      return true;
    }
    return filename != null && filename.toLowerCase(Locale.ROOT).endsWith(".docx");
  }

  /**
   * Reads the paragraphs of a document as blocks.
   *
   * @throws IOException if the content is not a readable .docx package
   */
  public List<TextBlock> read(byte[] content) throws IOException {
    try (XWPFDocument document = new XWPFDocument(new ByteArrayInputStream(content))) {
      return locate(document).stream().map(Located::block).toList();
    }
  }

  /**
   * Applies edits to the original document.
   *
   * @param source the original .docx bytes
   * @param edits edits keyed by block index, as returned by {@link #read}
   * @return the edited document
   * @throws IOException if the document cannot be read or written
   */
  public byte[] write(byte[] source, Map<Integer, List<Edit>> edits) throws IOException {
    try (XWPFDocument document = new XWPFDocument(new ByteArrayInputStream(source));
        ByteArrayOutputStream out = new ByteArrayOutputStream()) {
      List<Located> located = locate(document);
      for (Map.Entry<Integer, List<Edit>> entry : edits.entrySet()) {
        if (entry.getKey() < 0 || entry.getKey() >= located.size()) {
          log.warn("Skipping edits for unknown paragraph {}", entry.getKey());
          continue;
        }
        apply(located.get(entry.getKey()).paragraph(), entry.getValue());
      }
      document.write(out);
      return out.toByteArray();
    }
  }

  private static List<Located> locate(XWPFDocument document) {
    List<Located> located = new ArrayList<>();
    int tableIndex = 0;
    for (IBodyElement element : document.getBodyElements()) {
      if (element instanceof XWPFParagraph paragraph) {
        located.add(new Located(paragraph, TextBlock.of(kindOf(paragraph), paragraph.getText())));
      } else if (element instanceof XWPFTable table) {
        List<XWPFTableRow> rows = table.getRows();
        for (int r = 0; r < rows.size(); r++) {
          List<XWPFTableCell> cells = rows.get(r).getTableCells();
          for (int c = 0; c < cells.size(); c++) {
            for (XWPFParagraph paragraph : cells.get(c).getParagraphs()) {
              located.add(
                  new Located(paragraph, TextBlock.cell(paragraph.getText(), tableIndex, r, c)));
            }
          }
        }
        tableIndex++;
      }
    }
    return located;
  }

  private static TextBlock.Kind kindOf(XWPFParagraph paragraph) {
    String style = paragraph.getStyle();
    return style != null && style.toLowerCase(Locale.ROOT).startsWith("heading")
        ? TextBlock.Kind.HEADING
        : TextBlock.Kind.PARAGRAPH;
  }

  /**
   * Applies edits run by run. Paragraphs whose runs do not add up to the paragraph text (fields,
   * content controls, tabs inside runs) get their whole text rewritten into the first run instead.
   */
  static void apply(XWPFParagraph paragraph, List<Edit> edits) {
    List<Edit> ordered = new ArrayList<>(edits);
    ordered.sort(Comparator.comparingInt(Edit::start).reversed());
    List<XWPFRun> runs = paragraph.getRuns();
    String original = paragraph.getText();

    List<String> texts = new ArrayList<>(runs.size());
    StringBuilder joined = new StringBuilder();
    boolean simpleRuns = true;
    for (XWPFRun run : runs) {
      String text = run.text();
      texts.add(text);
      joined.append(text);
      simpleRuns &=
          run.getCTR().sizeOfTArray() <= 1 && text.indexOf('\t') < 0 && text.indexOf('\n') < 0;
    }
    if (runs.isEmpty()) {
      paragraph.createRun().setText(applyToString(original, ordered));
      return;
    }
    if (!simpleRuns || !joined.toString().equals(original)) {
      log.debug("Rewriting paragraph text in one run: '{}'", original);
      setText(runs.get(0), applyToString(original, ordered));
      for (int i = runs.size() - 1; i > 0; i--) {
        paragraph.removeRun(i);
      }
      return;
    }

    int[] starts = new int[runs.size()];
    int offset = 0;
    for (int i = 0; i < runs.size(); i++) {
      starts[i] = offset;
      offset += texts.get(i).length();
    }
    boolean[] changed = new boolean[runs.size()];
    for (Edit edit : ordered) {
      int first = runAt(starts, texts, edit);
      String head = texts.get(first);
      int local = edit.start() - starts[first];
      int runEnd = starts[first] + head.length();
      if (edit.end() <= runEnd) {
        String tail = head.substring(edit.end() - starts[first]);
        texts.set(first, head.substring(0, local) + edit.text() + tail);
      } else {
        texts.set(first, head.substring(0, local) + edit.text());
        for (int j = first + 1; j < runs.size() && starts[j] < edit.end(); j++) {
          int cut = Math.min(edit.end() - starts[j], texts.get(j).length());
          texts.set(j, texts.get(j).substring(cut));
          changed[j] = true;
        }
      }
      changed[first] = true;
    }
    for (int i = 0; i < runs.size(); i++) {
      if (changed[i]) {
        setText(runs.get(i), texts.get(i));
      }
    }
  }

  /**
   * The run an edit starts in. An insertion continues the run holding the character before it, so
   * a value appended after a label takes the label's formatting.
   */
  private static int runAt(int[] starts, List<String> texts, Edit edit) {
    int position = edit.start();
    boolean insertion = edit.end() == position;
    int last = 0;
    for (int i = 0; i < starts.length; i++) {
      int end = starts[i] + texts.get(i).length();
      if (texts.get(i).isEmpty()) {
        continue;
      }
      last = i;
      boolean inside =
          insertion && position > 0
              ? starts[i] < position && position <= end
              : starts[i] <= position && position < end;
      if (inside) {
        return i;
      }
    }
    return last;
  }

  private static String applyToString(String text, List<Edit> descending) {
    StringBuilder sb = new StringBuilder(text);
    for (Edit edit : descending) {
      sb.replace(edit.start(), edit.end(), edit.text());
    }
    return sb.toString();
  }

  private static void setText(XWPFRun run, String text) {
    if (run.getCTR().sizeOfTArray() == 0) {
      run.setText(text);
    } else {
      run.setText(text, 0);
    }
  }
}
