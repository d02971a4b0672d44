package com.flamingo.ai.embellisher.domain.converter;

import com.fasterxml.jackson.core.type.TypeReference;
import com.flamingo.ai.embellisher.domain.model.ProcessingSettings;
import jakarta.persistence.Converter;

/** Stores {@link ProcessingSettings} as a JSON document. */
@Converter
public class ProcessingSettingsConverter extends JsonAttributeConverter<ProcessingSettings> {

  public ProcessingSettingsConverter() {
    super(new TypeReference<>() {});
  }

  @Override
  protected ProcessingSettings emptyValue() {
    return new ProcessingSettings();
  }
}
