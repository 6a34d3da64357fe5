package com.example.phoneshop.lisa.validation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import org.junit.jupiter.api.Test;

class ValidationServiceTest {

  private final ValidationService service = new ValidationService(List.of(
      new MaxCharsMessageValidator(10),
      new ThreadIdValidator(64),
      new NotBlankMessageValidator()));

  @Test
  void acceptsPlainMessageWithoutThreadId() {
    ValidationContext ctx = service.validate("xin chào", null);

    assertThat(ctx.getProcessedMessage()).isEqualTo("xin chào");
    assertThat(ctx.getNotices()).isEmpty();
  }

  @Test
  void truncatesLongMessageWithNotice() {
    ValidationContext ctx = service.validate("abcdefghijklmno", "thread-1");

    assertThat(ctx.getProcessedMessage()).isEqualTo("abcdefghij");
    assertThat(ctx.getNotices()).containsExactly("Message truncated to 10 characters.");
  }

  @Test
  void rejectsBlankMessage() {
    assertThatThrownBy(() -> service.validate("   ", null))
        .isInstanceOf(ValidationException.class)
        .extracting(e -> ((ValidationException) e).getReasons())
        .isEqualTo(List.of("Message must not be blank."));
  }

  @Test
  void rejectsMalformedOrOverlongThreadIds() {
    assertThatThrownBy(() -> service.validate("hi", "has space"))
        .isInstanceOf(ValidationException.class);
    assertThatThrownBy(() -> service.validate("hi", "x".repeat(65)))
        .isInstanceOf(ValidationException.class)
        .hasMessageContaining("64");
  }

  @Test
  void acceptsUuidThreadId() {
    assertThat(service.validate("hi", "3f2b9c1e-6a4d-4f7a-9b1e-0c2d3e4f5a6b").getThreadId())
        .isEqualTo("3f2b9c1e-6a4d-4f7a-9b1e-0c2d3e4f5a6b");
  }
}
