package com.example.phoneshop.lisa.validation;

import com.example.phoneshop.lisa.config.LisaProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Objects;

/** Truncates overly long messages instead of rejecting them. */
@Component
public class MaxCharsMessageValidator implements MessageValidator {

  private final int maxChars;

  @Autowired
  public MaxCharsMessageValidator(LisaProperties properties) {
    this(properties.getValidation().getMaxMessageChars());
  }

  public MaxCharsMessageValidator(int maxChars) {
    if (maxChars <= 0) {
      throw new IllegalArgumentException("maxChars must be positive");
    }
    this.maxChars = maxChars;
  }

  @Override
  public ValidationStage stage() {
    return ValidationStage.NORMALIZE;
  }

  @Override
  public void validate(ValidationContext context) {
    String processed = Objects.requireNonNullElse(context.getProcessedMessage(), "");
    if (processed.length() <= maxChars) {
      return;
    }
    context.setProcessedMessage(processed.substring(0, maxChars));
    context.addNotice(String.format("Message truncated to %d characters.", maxChars));
  }
}
