package com.example.phoneshop.lisa.validation;

/** Order in which validators run for an incoming chat request. */
public enum ValidationStage {
  /** Rejects requests that cannot be processed at all. */
  REJECT,
  /** Rewrites acceptable input, such as truncating it. */
  NORMALIZE
}
