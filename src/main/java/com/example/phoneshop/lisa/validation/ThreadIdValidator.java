package com.example.phoneshop.lisa.validation;

import com.example.phoneshop.lisa.config.LisaProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

/** An absent thread id is fine (a new one is issued); a present one must be a plain token. */
@Component
public class ThreadIdValidator implements MessageValidator {

  private static final Pattern ALLOWED = Pattern.compile("[A-Za-z0-9._:-]+");

  private final int maxChars;

  @Autowired
  public ThreadIdValidator(LisaProperties properties) {
    this(properties.getValidation().getMaxThreadIdChars());
  }

  public ThreadIdValidator(int maxChars) {
    this.maxChars = maxChars;
  }

  @Override
  public ValidationStage stage() {
    return ValidationStage.REJECT;
  }

  @Override
  public void validate(ValidationContext context) {
    String threadId = context.getThreadId();
    if (threadId == null || threadId.isEmpty()) {
      return;
    }
    if (threadId.length() > maxChars) {
      throw new ValidationException("thread_id must be at most " + maxChars + " characters.");
    }
    if (!ALLOWED.matcher(threadId).matches()) {
      throw new ValidationException("thread_id may contain only letters, digits, '.', '_', ':' and '-'.");
    }
  }
}
