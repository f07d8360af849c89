package com.flamingo.ai.devicerag.service.rag.model;

/**
 * One block of extracted document text in reading order.
 *
 * @param kind structural element the text came from
 * @param text block text, without trailing line breaks
 * @param table zero-based table index for cells, -1 otherwise
 * @param row zero-based row index for cells, -1 otherwise
 * @param column zero-based column index for cells, -1 otherwise
 * @param lineEnd line terminator that followed a plain-text line in the source ({@code "\n"},
 *     {@code "\r\n"}, {@code "\r"}, or empty for the last line and for other kinds)
 */
public record TextBlock(Kind kind, String text, int table, int row, int column, String lineEnd) {

  public enum Kind {
    /** A raw line of a plain-text file. */
    LINE,
    PARAGRAPH,
    HEADING,
    LIST_ITEM,
    TABLE_CELL
  }

  public TextBlock {
    text = text == null ? "" : text;
    lineEnd = lineEnd == null ? "" : lineEnd;
  }

  public static TextBlock of(Kind kind, String text) {
    return new TextBlock(kind, text, -1, -1, -1, "");
  }

  public static TextBlock line(String text, String lineEnd) {
    return new TextBlock(Kind.LINE, text, -1, -1, -1, lineEnd);
  }

  public static TextBlock cell(String text, int table, int row, int column) {
    return new TextBlock(Kind.TABLE_CELL, text, table, row, column, "");
  }

  public TextBlock withText(String replaced) {
    return new TextBlock(kind, replaced, table, row, column, lineEnd);
  }

  public boolean isCell() {
    return kind == Kind.TABLE_CELL;
  }

  /** True when both blocks are cells of the same table row. */
  public boolean sameRow(TextBlock other) {
    return isCell() && other.isCell() && table == other.table && row == other.row;
  }
}
