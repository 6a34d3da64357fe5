package com.example.phoneshop.lisa.response;

import java.util.List;

public record ErrorResponse(List<String> errors) {

  public static ErrorResponse of(String message) {
    return new ErrorResponse(List.of(message));
  }
}
