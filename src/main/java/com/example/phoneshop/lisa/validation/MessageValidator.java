package com.example.phoneshop.lisa.validation;

/** One check applied to a chat request before it is routed. */
public interface MessageValidator {

  ValidationStage stage();

  /** Throws {@link ValidationException} to reject, or mutates the context to normalize. */
  void validate(ValidationContext context);
}
