package com.flamingo.ai.devicerag.service.template.strategy;

/**
 * One step of the per-field value extraction chain.
 *
 * <p>Strategies are injected by Spring in {@code @Order} order (ascending) and run until one
 * returns a definitive result.
 */
public interface ValueExtractionStrategy {

  StrategyResult extract(FillContext context);
}
