package com.flamingo.ai.devicerag.service.generation;

/**
 * Result for one input item, at the same index as the item it answers.
 *
 * @param index position of the item in the input list
 * @param value generated or fallback text; null when no value could be produced
 * @param status how the value was obtained
 */
public record ItemResult(int index, String value, ItemStatus status) {

  public boolean isSuccess() {
    return (status == ItemStatus.GENERATED || status == ItemStatus.CACHED) && value != null;
  }

  /** True when the generative service could not be used at all for this item. */
  public boolean isServiceFailure() {
    return status == ItemStatus.THROTTLED || status == ItemStatus.UNAVAILABLE;
  }
}
