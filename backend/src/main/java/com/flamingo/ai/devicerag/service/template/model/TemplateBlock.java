package com.flamingo.ai.devicerag.service.template.model;

import com.flamingo.ai.devicerag.service.rag.model.TextBlock;

/**
 * One block of a template. Fields point into blocks by index and character span.
 *
 * @param index position of the block in the template
 * @param source extracted block, carrying kind and table coordinates
 */
public record TemplateBlock(int index, TextBlock source) {

  public String text() {
    return source.text();
  }

  public TemplateBlock withText(String text) {
    return new TemplateBlock(index, source.withText(text));
  }
}
