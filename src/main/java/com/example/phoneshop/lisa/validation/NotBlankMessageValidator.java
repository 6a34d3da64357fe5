package com.example.phoneshop.lisa.validation;

import org.springframework.stereotype.Component;

@Component
public class NotBlankMessageValidator implements MessageValidator {

  @Override
  public ValidationStage stage() {
    return ValidationStage.REJECT;
  }

  @Override
  public void validate(ValidationContext context) {
    String raw = context.getRawMessage();
    if (raw == null || raw.trim().isEmpty()) {
      throw new ValidationException("Message must not be blank.");
    }
  }
}
