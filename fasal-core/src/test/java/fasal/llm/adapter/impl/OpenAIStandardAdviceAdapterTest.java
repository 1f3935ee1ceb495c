package fasal.llm.adapter.impl;

import com.sun.net.httpserver.HttpServer;
import fasal.common.exception.AdviceUnavailableException;
import fasal.config.pojo.AdviceConfig;
import fasal.disease.pojo.SeverityTier;
import fasal.llm.pojo.AdviceContext;
import org.junit.After;
import org.junit.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class OpenAIStandardAdviceAdapterTest {

    private static final String REPLY = "{\"id\":\"c1\",\"model\":\"m\",\"choices\":[{\"index\":0,"
            + "\"message\":{\"role\":\"assistant\",\"content\":\"  Remove infected leaves.  \"},\"finish_reason\":\"stop\"}]}";

    private final AdviceContext context = AdviceContext.builder()
            .crop("Tomato")
            .condition("Late Blight")
            .severity(SeverityTier.SEVERE)
            .confidencePercent(91.25)
            .location("Junagadh")
            .build();

    private HttpServer server;

    @After
    public void tearDown() {
        if (server != null) {
            server.stop(0);
        }
    }

    @Test
    public void testPromptFilledFromContext() {
        String prompt = new OpenAIStandardAdviceAdapter(new AdviceConfig()).buildPrompt(context);

        assertTrue(prompt.contains("Tomato"));
        assertTrue(prompt.contains("Late Blight"));
        assertTrue(prompt.contains("severe"));
        assertTrue(prompt.contains("91.3"));
        assertTrue(prompt.contains("Junagadh"));
        assertFalse("Placeholders should be replaced", prompt.contains("{crop}"));
    }

    @Test
    public void testExtractContent() {
        assertEquals("Remove infected leaves.", new OpenAIStandardAdviceAdapter(new AdviceConfig()).extractContent(REPLY));
    }

    @Test
    public void testMalformedRepliesRejected() {
        OpenAIStandardAdviceAdapter adapter = new OpenAIStandardAdviceAdapter(new AdviceConfig());
        for (String body : new String[]{"not json at all {", "{\"choices\":[]}", "{}"}) {
            try {
                adapter.extractContent(body);
                fail("Should reject " + body);
            } catch (AdviceUnavailableException e) {
                assertEquals(502, e.getCode());
            }
        }
    }

    @Test(expected = AdviceUnavailableException.class)
    public void testDisabledByDefault() {
        OpenAIStandardAdviceAdapter adapter = new OpenAIStandardAdviceAdapter(new AdviceConfig());
        assertFalse(adapter.isEnabled());
        adapter.generateAdvice(context);
    }

    @Test
    public void testRepliesCachedPerContext() throws IOException {
        AtomicInteger calls = new AtomicInteger();
        AtomicReference<String> lastBody = new AtomicReference<>();
        AtomicReference<String> lastAuth = new AtomicReference<>();
        startServer(200, REPLY, calls, lastBody, lastAuth);

        OpenAIStandardAdviceAdapter adapter = new OpenAIStandardAdviceAdapter(config());
        assertEquals("Remove infected leaves.", adapter.generateAdvice(context));
        assertEquals("Remove infected leaves.", adapter.generateAdvice(context));

        assertEquals(1, calls.get());
        assertTrue(lastBody.get().contains("\"temperature\":0.0"));
        assertTrue(lastBody.get().contains("\"max_tokens\":800"));
        assertEquals("Bearer test-key", lastAuth.get());
    }

    @Test(expected = AdviceUnavailableException.class)
    public void testServerErrorBecomesAdviceUnavailable() throws IOException {
        startServer(500, "{\"error\":\"overloaded\"}", new AtomicInteger(), new AtomicReference<>(), new AtomicReference<>());
        new OpenAIStandardAdviceAdapter(config()).generateAdvice(context);
    }

    private AdviceConfig config() {
        AdviceConfig config = new AdviceConfig();
        config.setEnable(true);
        config.setApiAddress("http://127.0.0.1:" + server.getAddress().getPort() + "/v1/chat/completions");
        config.setApiKey("test-key");
        config.setModel("test-model");
        config.setRequestsPerSecond(0);
        return config;
    }

    private void startServer(int status, String reply, AtomicInteger calls,
                             AtomicReference<String> lastBody, AtomicReference<String> lastAuth) throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/v1/chat/completions", exchange -> {
            calls.incrementAndGet();
            lastAuth.set(exchange.getRequestHeaders().getFirst("Authorization"));
            lastBody.set(readAll(exchange.getRequestBody()));
            byte[] bytes = reply.getBytes(StandardCharsets.UTF_8);
            exchange.getResponseHeaders().add("Content-Type", "application/json");
            exchange.sendResponseHeaders(status, bytes.length);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(bytes);
            }
        });
        server.start();
    }

    private static String readAll(InputStream in) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        byte[] buffer = new byte[4096];
        int n;
        while ((n = in.read(buffer)) != -1) {
            out.write(buffer, 0, n);
        }
        return new String(out.toByteArray(), StandardCharsets.UTF_8);
    }
}
