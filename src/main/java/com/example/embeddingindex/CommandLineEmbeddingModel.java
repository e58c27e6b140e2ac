package com.example.embeddingindex;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Service;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * EmbeddingModel that shells out to a configured inference command. The payload
 * (UTF-8 text or raw image bytes) goes to stdin; stdout must be a JSON array of
 * floats or whitespace/comma separated floats.
 */
@Service
@ConditionalOnProperty(prefix = "embedding", name = "cli.enabled", havingValue = "true")
public class CommandLineEmbeddingModel implements EmbeddingModel {

    private static final Logger log = LoggerFactory.getLogger(CommandLineEmbeddingModel.class);

    private final String command;
    private final String model;
    private final long timeoutSeconds;
    private final ProcessRunner runner;
    private final ObjectMapper mapper = new ObjectMapper();
    private final ExecutorService streams = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "embedding-cli-io");
        t.setDaemon(true);
        return t;
    });

    @Autowired
    public CommandLineEmbeddingModel(Environment env, ProcessRunner runner) {
        this.command = env.getProperty("embedding.command", "clip-embed");
        this.model = env.getProperty("embedding.model", "Bingsu/clip-vit-large-patch14-ko");
        this.timeoutSeconds = Long.parseLong(env.getProperty("embedding.timeout-seconds", "120"));
        this.runner = runner;
    }

    @Override
    public float[] embedText(String text) {
        return run("text", text.getBytes(StandardCharsets.UTF_8));
    }

    @Override
    public float[] embedImage(byte[] image, String contentType) {
        return run("image", image);
    }

    private float[] run(String kind, byte[] payload) {
        List<String> cmd = new ArrayList<>();
        cmd.add(command);
        cmd.add("embed");
        cmd.add(model);
        cmd.add("--input");
        cmd.add(kind);

        Process p;
        try {
            p = runner.start(cmd);
        } catch (IOException e) {
            throw new InferenceException("Failed to start embedding command '" + command + "'", e);
        }
        Future<Void> in = streams.submit(() -> {
            try (OutputStream os = p.getOutputStream()) {
                os.write(payload);
                os.flush();
            }
            return null;
        });
        Future<String> out = streams.submit(() -> readAll(p.getInputStream()));
        Future<String> err = streams.submit(() -> readAll(p.getErrorStream()));
        try {
            if (!p.waitFor(timeoutSeconds, TimeUnit.SECONDS)) {
                p.destroyForcibly();
                in.cancel(true);
                out.cancel(true);
                err.cancel(true);
                throw new InferenceException("Embedding command timed out after " + timeoutSeconds + "s");
            }
            int exit = p.exitValue();
            if (exit != 0) {
                String stderr = drained(err).trim();
                throw new InferenceException("Embedding command exited with " + exit + (stderr.isEmpty() ? "" : ": " + stderr));
            }
            drained(in);
            String stdout = drained(out);
            log.debug("Embedding command returned {} chars for {} input", stdout.length(), kind);
            return parse(stdout.trim());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            p.destroyForcibly();
            throw new InferenceException("Interrupted while waiting for embedding command", e);
        }
    }

    // The process has exited, so its pipes close unless a grandchild still holds them.
    private <T> T drained(Future<T> stream) throws InterruptedException {
        try {
            return stream.get(timeoutSeconds, TimeUnit.SECONDS);
        } catch (ExecutionException e) {
            throw new InferenceException("Embedding command I/O failed", e.getCause());
        } catch (TimeoutException e) {
            stream.cancel(true);
            throw new InferenceException("Embedding command streams still open after exit", e);
        }
    }

    @PreDestroy
    void shutdown() {
        streams.shutdownNow();
    }

    float[] parse(String resp) {
        if (resp.isEmpty()) throw new InferenceException("Embedding command produced no output");
        if (resp.startsWith("[")) {
            try {
                return mapper.readValue(resp, float[].class);
            } catch (IOException e) {
                throw new InferenceException("Embedding command output is not a JSON float array", e);
            }
        }
        String[] parts = resp.replaceAll("[,\\s]+", " ").trim().split(" ");
        float[] v = new float[parts.length];
        try {
            for (int i = 0; i < parts.length; i++) v[i] = Float.parseFloat(parts[i]);
        } catch (NumberFormatException e) {
            throw new InferenceException("Embedding command output is not a float list", e);
        }
        return v;
    }

    private static String readAll(InputStream in) throws IOException {
        ByteArrayOutputStream buf = new ByteArrayOutputStream();
        in.transferTo(buf);
        return buf.toString(StandardCharsets.UTF_8);
    }
}
