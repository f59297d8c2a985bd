package io.docflow.serialization.llm;

import io.docflow.core.llm.PromptLoader;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/// {@link PromptLoader} reading `<base>/tasks/<taskRef>.txt` from the classpath.
///
/// Loaded prompts are cached for the loader's lifetime.
public class ClasspathPromptLoader implements PromptLoader {

    public static final String DEFAULT_BASE = "prompts";

    private final String base;
    private final ClassLoader classLoader;
    private final Map<String, String> cache = new ConcurrentHashMap<>();

    public ClasspathPromptLoader() {
        this(DEFAULT_BASE, ClasspathPromptLoader.class.getClassLoader());
    }

    public ClasspathPromptLoader(String base, ClassLoader classLoader) {
        this.base = Objects.requireNonNull(base, "base must not be null");
        this.classLoader = Objects.requireNonNull(classLoader, "classLoader must not be null");
    }

    @Override
    public String loadTaskPrompt(String taskRef) throws IOException {
        Objects.requireNonNull(taskRef, "taskRef must not be null");
        if (taskRef.contains("..")) {
            throw new IllegalArgumentException("Invalid task reference: " + taskRef);
        }
        String cached = cache.get(taskRef);
        if (cached != null) {
            return cached;
        }
        String resource = base + "/tasks/" + taskRef + ".txt";
        try (InputStream in = classLoader.getResourceAsStream(resource)) {
            if (in == null) {
                throw new FileNotFoundException("Task prompt not found: " + resource);
            }
            String prompt = new String(in.readAllBytes(), StandardCharsets.UTF_8);
            cache.put(taskRef, prompt);
            return prompt;
        }
    }
}
