package com.example.phoneshop.lisa.prompt;

import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

/**
 * Prompt texts shipped under {@code classpath:prompts/}. Loaded once; a missing file fails
 * startup.
 */
@Component
public class PromptLibrary {

    private static final String CONTEXT_PLACEHOLDER = "{context}";

    private final String router;
    private final String routerStrictAddition;
    private final String persona;
    private final String summary;
    private final String contextTemplate;

    public PromptLibrary() throws IOException {
        this(read("prompts/router.txt"),
                read("prompts/router_strict_addition.txt"),
                read("prompts/persona.txt"),
                read("prompts/summary.txt"),
                read("prompts/context.txt"));
    }

    public PromptLibrary(String router, String routerStrictAddition, String persona,
                         String summary, String contextTemplate) {
        this.router = router;
        this.routerStrictAddition = routerStrictAddition;
        this.persona = persona;
        this.summary = summary;
        this.contextTemplate = contextTemplate;
    }

    public String router() {
        return router;
    }

    /** Router instruction with the strict-output reminder appended, used on retries. */
    public String strictRouter() {
        return router + "\n" + routerStrictAddition;
    }

    public String persona() {
        return persona;
    }

    public String summary() {
        return summary;
    }

    public String context(String context) {
        if (contextTemplate.contains(CONTEXT_PLACEHOLDER)) {
            return contextTemplate.replace(CONTEXT_PLACEHOLDER, context);
        }
        return contextTemplate + "\n" + context;
    }

    private static String read(String path) throws IOException {
        try (InputStream in = new ClassPathResource(path).getInputStream()) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8).strip();
        }
    }
}
