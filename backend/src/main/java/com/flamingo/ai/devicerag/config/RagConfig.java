package com.flamingo.ai.devicerag.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for the RAG pipeline and the template filler. */
@Configuration
@ConfigurationProperties(prefix = "rag")
@Getter
@Setter
public class RagConfig {

  private Chunking chunking = new Chunking();
  private Retrieval retrieval = new Retrieval();
  private Confidence confidence = new Confidence();
  private Generation generation = new Generation();
  private Synthesis synthesis = new Synthesis();
  private Template template = new Template();
  private VectorStore vectorStore = new VectorStore();
  private Metadata metadata = new Metadata();

  @Getter
  @Setter
  public static class Chunking {
    private int size = 1500;
    private int overlap = 400;
    private int minChunkSize = 300;

    /** How far (in chars) a window end may move back to reach a natural break. */
    private int boundaryTolerance = 200;

    /** Chunks scoring below this quality are dropped. */
    private double qualityFloor = 0.3;

    private List<String> domainKeywords =
        new ArrayList<>(
            List.of(
                "device",
                "model",
                "manufacturer",
                "serial",
                "specification",
                "generic name",
                "brand",
                "intended use",
                "indication",
                "certificate",
                "standard",
                "iso",
                "iec",
                "fda",
                "ce",
                "approved",
                "signature",
                "document",
                "revision",
                "warranty",
                "lot",
                "batch",
                "sterile",
                "classification",
                "risk"));
  }

  @Getter
  @Setter
  public static class Retrieval {
    private int variationCount = 3;
    private int perQueryTopK = 10;
    private int finalCount = 10;
    private double similarityWeight = 0.7;
    private double qualityWeight = 0.2;
    private double importanceWeight = 0.1;
    private int maxQueryLength = 500;
    private int historyWindow = 3;
  }

  @Getter
  @Setter
  public static class Confidence {
    private double criticalThreshold = 0.80;
    private double highThreshold = 0.70;
    private double acceptableThreshold = 0.55;

    /**
     * Verifies that critical &gt; high &gt; acceptable.
     *
     * @throws IllegalStateException if the thresholds are not strictly ordered
     */
    public void validate() {
      if (!(criticalThreshold > highThreshold && highThreshold > acceptableThreshold)) {
        throw new IllegalStateException(
            String.format(
                "Confidence thresholds must be strictly ordered (critical > high > acceptable),"
                    + " got %.2f / %.2f / %.2f",
                criticalThreshold, highThreshold, acceptableThreshold));
      }
    }
  }

  @Getter
  @Setter
  public static class Generation {
    private int maxBatchSize = 5;
    private int maxConcurrent = 3;
    private Duration minDelayBetweenCalls = Duration.ofMillis(200);
    private int maxAttempts = 4;
    private Duration initialBackoff = Duration.ofSeconds(1);
    private Duration maxBackoff = Duration.ofSeconds(30);
    private int maxTokens = 1024;
    private double factualTemperature = 0.02;
    private double extractionTemperature = 0.01;
    private double expansionTemperature = 0.3;
  }

  @Getter
  @Setter
  public static class Synthesis {
    private double excellentAverage = 0.80;
    private int excellentMinCount = 3;
    private double goodAverage = 0.70;
    private int previewLength = 200;
    private int maxTopics = 8;
  }

  @Getter
  @Setter
  public static class Template {
    private int maxQuestionsPerField = 3;
    private int evidencePerField = 5;
    private int signatureRunLength = 8;
    private double fallbackConfidenceFactor = 0.8;
    private String outputDir = "filled_templates";
  }

  @Getter
  @Setter
  public static class VectorStore {
    /** Either "elasticsearch" or "memory". */
    private String type = "elasticsearch";

    private String indexName = "device-chunks";
    private int dimensions = 1536;
  }

  @Getter
  @Setter
  public static class Metadata {
    private int maxKeywords = 10;
  }
}
