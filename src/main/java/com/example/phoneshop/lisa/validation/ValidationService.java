package com.example.phoneshop.lisa.validation;

import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/** Runs every registered {@link MessageValidator} in stage order. */
@Service
public class ValidationService {

  private final List<MessageValidator> orderedValidators;

  public ValidationService(List<MessageValidator> validators) {
    List<MessageValidator> safe = validators == null ? List.of() : validators;
    this.orderedValidators = safe.stream()
        .filter(Objects::nonNull)
        .sorted(Comparator.comparing(MessageValidator::stage))
        .toList();
  }

  public ValidationContext validate(String message, String threadId) {
    ValidationContext context = new ValidationContext(message, threadId);
    for (MessageValidator validator : orderedValidators) {
      validator.validate(context);
    }
    return context;
  }
}
