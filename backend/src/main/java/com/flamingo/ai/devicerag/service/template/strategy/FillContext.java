package com.flamingo.ai.devicerag.service.template.strategy;

import com.flamingo.ai.devicerag.service.generation.ItemResult;
import com.flamingo.ai.devicerag.service.rag.search.RetrievalResult;
import com.flamingo.ai.devicerag.service.template.model.TemplateField;
import java.util.List;

/**
 * Inputs available when extracting one field's value.
 *
 * @param field the field being filled
 * @param evidence ranked evidence for the field
 * @param generated result of the batched fill call; null when no call was made
 */
public record FillContext(
    TemplateField field, List<RetrievalResult> evidence, ItemResult generated) {}
