package io.clustermanager.configuration;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.io.InputStream;
import java.util.concurrent.CompletableFuture;

/**
 * Handle to a running configuration engine invocation.
 * The output stream carries the engine's live output, {@code cancel} stops the
 * invocation and {@code result} completes normally on success or exceptionally on failure.
 */
@Getter
@AllArgsConstructor
public class ConfigurationRun {
    private final InputStream output;
    private final Runnable cancel;
    private final CompletableFuture<Void> result;
}
