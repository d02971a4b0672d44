package com.flamingo.ai.embellisher.client.validation;

/** Name, declared media type and size of a file the user picked. */
public record SelectedFile(String name, String mediaType, long sizeBytes) {}
