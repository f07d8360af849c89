package com.flamingo.ai.devicerag.service.rag.chunking;

import com.flamingo.ai.devicerag.domain.model.ContentType;
import com.flamingo.ai.devicerag.service.rag.model.StructuralHint;
import java.util.List;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/** Classifies chunk text as form, structured, list or running text. */
@Component
public class ContentTypeClassifier {

  static final Pattern LABEL_LINE = Pattern.compile("^\\s*[A-Za-z][^:\\n]{0,60}:(\\s|$).*");
  static final Pattern LIST_ITEM =
      Pattern.compile("^\\s*(?:[-*\u2022\u25AA\u25CF\u25E6]|\\d{1,3}[.)]|[a-zA-Z][.)])\\s+.*");
  static final Pattern TABLE_ROW = Pattern.compile("^\\s*\\|.*|.*\\S\\t+\\S.*");

  public ContentType classify(String text, List<StructuralHint> hints) {
    String[] lines = text.split("\\R");
    int nonBlank = 0;
    int labels = 0;
    int tableRows = 0;
    int listItems = 0;
    for (String line : lines) {
      if (line.isBlank()) {
        continue;
      }
      nonBlank++;
      if (TABLE_ROW.matcher(line).matches()) {
        tableRows++;
      } else if (LIST_ITEM.matcher(line).matches()) {
        listItems++;
      } else if (LABEL_LINE.matcher(line).matches()) {
        labels++;
      }
    }
    if (nonBlank == 0) {
      return ContentType.TEXT;
    }
    if (labels >= 2 && labels >= 0.3 * nonBlank) {
      return ContentType.FORM;
    }
    boolean hasTableCells =
        hints.stream().anyMatch(h -> h.kind() == StructuralHint.Kind.TABLE_CELL);
    if (hasTableCells || (tableRows >= 2 && tableRows >= 0.3 * nonBlank)) {
      return ContentType.STRUCTURED;
    }
    if (listItems >= 2 && listItems >= 0.3 * nonBlank) {
      return ContentType.LIST;
    }
    return ContentType.TEXT;
  }
}
