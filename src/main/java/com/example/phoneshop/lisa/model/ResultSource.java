package com.example.phoneshop.lisa.model;

public enum ResultSource {
  LEXICAL,
  VECTOR,
  FUSED,
  RERANKED
}
