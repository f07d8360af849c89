package com.flamingo.ai.devicerag.service.rag.chunking;

import com.flamingo.ai.devicerag.config.RagConfig;
import com.flamingo.ai.devicerag.domain.model.Chunk;
import com.flamingo.ai.devicerag.domain.model.ContentType;
import com.flamingo.ai.devicerag.service.rag.DocumentMetadataExtractor;
import com.flamingo.ai.devicerag.service.rag.model.ChunkingResult;
import com.flamingo.ai.devicerag.service.rag.model.ChunkingResult.RejectedSpan;
import com.flamingo.ai.devicerag.service.rag.model.ExtractedText;
import com.flamingo.ai.devicerag.service.rag.model.StructuralHint;
import com.google.common.annotations.VisibleForTesting;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * {@link DocumentChunker} using a sliding character window with overlap.
 *
 * <p>Each window end is pulled back, at most {@code boundaryTolerance} chars, to the best natural
 * break: a paragraph break first, then the start of a label, list or table line, then a sentence
 * end, then any line break, then whitespace. A window never ends inside a hinted table cell or
 * heading when the hint starts within reach. Every window shorter than the remaining text is at
 * least {@code minChunkSize} long.
 *
 * <p>Windows whose quality score falls below the floor are dropped and counted; the rest are
 * emitted in source order with importance, keywords and content type attached.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class QualityAwareChunker implements DocumentChunker {

  private static final Pattern PARAGRAPH_BREAK = Pattern.compile("\\n[ \\t]*\\n");
  private static final Pattern SENTENCE_END = Pattern.compile("[.!?][\"')\\]]?(?=\\s)");

  private final RagConfig ragConfig;
  private final ChunkQualityScorer qualityScorer;
  private final ChunkImportanceScorer importanceScorer;
  private final ContentTypeClassifier contentTypeClassifier;
  private final DocumentMetadataExtractor metadataExtractor;
  private final MeterRegistry meterRegistry;

  @Override
  public ChunkingResult chunk(String documentId, String deviceId, ExtractedText extracted) {
    RagConfig.Chunking config = ragConfig.getChunking();
    validate(config);

    String text = extracted.text();
    List<int[]> windows = computeWindows(text, extracted.hints(), config);

    List<Chunk> chunks = new ArrayList<>();
    List<RejectedSpan> rejected = new ArrayList<>();
    for (int[] window : windows) {
      String span = text.substring(window[0], window[1]);
      double quality = qualityScorer.score(span);
      if (quality < config.getQualityFloor()) {
        rejected.add(new RejectedSpan(window[0], window[1], quality));
        meterRegistry.counter("chunking.chunks.rejected").increment();
        log.info(
            "Dropped low-quality span [{}, {}) of document {} (quality {})",
            window[0],
            window[1],
            documentId,
            String.format("%.2f", quality));
        continue;
      }

      ChunkImportanceScorer.Importance importance = importanceScorer.score(span);
      List<StructuralHint> spanHints = hintsWithin(extracted.hints(), window[0], window[1]);
      ContentType contentType = contentTypeClassifier.classify(span, spanHints);
      int index = chunks.size();
      chunks.add(
          new Chunk(
              Chunk.idFor(documentId, index),
              documentId,
              deviceId,
              index,
              window[0],
              window[1],
              span,
              quality,
              importance.score(),
              metadataExtractor.extractKeywords(span),
              importance.entityDensity(),
              contentType));
    }

    meterRegistry.counter("chunking.chunks.created").increment(chunks.size());
    log.debug(
        "Chunked document {} ({} chars) into {} chunks, {} rejected",
        documentId,
        text.length(),
        chunks.size(),
        rejected.size());
    return new ChunkingResult(chunks, rejected);
  }

  /** Computes the [start, end) windows covering the whole text. */
  @VisibleForTesting
  List<int[]> computeWindows(String text, List<StructuralHint> hints, RagConfig.Chunking config) {
    List<int[]> windows = new ArrayList<>();
    int length = text.length();
    if (text.isBlank()) {
      return windows;
    }

    int start = 0;
    while (true) {
      if (length - start <= config.getSize()) {
        windows.add(new int[] {start, length});
        break;
      }
      int end = findBreak(text, start, start + config.getSize(), hints, config);
      windows.add(new int[] {start, end});

      int overlap = Math.min(config.getOverlap(), (end - start) / 2);
      start = alignToWordStart(text, end - overlap, end);
    }
    return windows;
  }

  private int findBreak(
      String text, int start, int target, List<StructuralHint> hints, RagConfig.Chunking config) {
    int lower = Math.max(start + config.getMinChunkSize(), target - config.getBoundaryTolerance());
    if (lower >= target) {
      return target;
    }

    for (StructuralHint hint : hints) {
      if (hint.contains(target) && hint.start() >= lower) {
        return hint.start();
      }
    }

    int paragraph = lastMatchEnd(PARAGRAPH_BREAK, text, lower, target);
    if (paragraph > 0) {
      return paragraph;
    }

    for (int pos = target; pos > lower; pos--) {
      if (text.charAt(pos - 1) == '\n' && startsStructuredLine(text, pos)) {
        return pos;
      }
    }

    int sentence = lastMatchEnd(SENTENCE_END, text, lower, target);
    if (sentence > 0) {
      return sentence;
    }

    for (int pos = target; pos > lower; pos--) {
      if (text.charAt(pos - 1) == '\n') {
        return pos;
      }
    }
    for (int pos = target; pos > lower; pos--) {
      if (Character.isWhitespace(text.charAt(pos - 1))) {
        return pos;
      }
    }
    return target;
  }

  /** End offset of the last match lying inside [lower, target], or -1. */
  private int lastMatchEnd(Pattern pattern, String text, int lower, int target) {
    Matcher matcher = pattern.matcher(text);
    matcher.region(lower, target);
    int last = -1;
    while (matcher.find()) {
      last = matcher.end();
    }
    return last > lower ? last : -1;
  }

  private boolean startsStructuredLine(String text, int lineStart) {
    int lineEnd = text.indexOf('\n', lineStart);
    String line = text.substring(lineStart, lineEnd < 0 ? text.length() : lineEnd);
    return ContentTypeClassifier.LABEL_LINE.matcher(line).matches()
        || ContentTypeClassifier.LIST_ITEM.matcher(line).matches()
        || ContentTypeClassifier.TABLE_ROW.matcher(line).matches();
  }

  /** Moves a mid-word overlap start forward to the next word, staying before {@code end}. */
  private int alignToWordStart(String text, int position, int end) {
    if (position <= 0 || Character.isWhitespace(text.charAt(position - 1))) {
      return position;
    }
    for (int pos = position; pos < end - 1; pos++) {
      if (Character.isWhitespace(text.charAt(pos))) {
        return pos + 1;
      }
    }
    return position;
  }

  private List<StructuralHint> hintsWithin(List<StructuralHint> hints, int start, int end) {
    return hints.stream()
        .filter(h -> h.start() < end && h.end() > start)
        .collect(Collectors.toList());
  }

  private void validate(RagConfig.Chunking config) {
    if (config.getMinChunkSize() < 1 || config.getMinChunkSize() > config.getSize()) {
      throw new IllegalStateException("rag.chunking.min-chunk-size must be in [1, size]");
    }
    if (config.getOverlap() < 0 || config.getOverlap() >= config.getSize()) {
      throw new IllegalStateException("rag.chunking.overlap must be in [0, size)");
    }
  }
}
