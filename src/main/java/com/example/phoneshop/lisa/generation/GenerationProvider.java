package com.example.phoneshop.lisa.generation;

public enum GenerationProvider {
    OPENAI,
    OLLAMA,
    GEMINI
}
