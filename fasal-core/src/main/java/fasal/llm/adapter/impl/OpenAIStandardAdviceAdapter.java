package fasal.llm.adapter.impl;

import cn.hutool.core.util.StrUtil;
import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.google.common.util.concurrent.RateLimiter;
import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import fasal.common.exception.AdviceUnavailableException;
import fasal.config.pojo.AdviceConfig;
import fasal.llm.adapter.IAdviceGeneratorAdapter;
import fasal.llm.pojo.AdviceContext;
import fasal.openai.pojo.ChatCompletionRequest;
import fasal.openai.pojo.ChatCompletionResult;
import fasal.openai.pojo.ChatMessage;
import fasal.utils.HttpUtil;
import fasal.utils.ResourceUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Advice generator backed by any OpenAI compatible chat-completions endpoint.
 * Replies are cached per context so the same diagnosis always gets the same narrative.
 */
public class OpenAIStandardAdviceAdapter implements IAdviceGeneratorAdapter {
    private static final Logger logger = LoggerFactory.getLogger(OpenAIStandardAdviceAdapter.class);

    private static final String SYSTEM_PROMPT =
            "You are Fasal Mitra, an agricultural advisor for Indian farmers. Answer in simple, practical language.";
    private static final String DEFAULT_TEMPLATE =
            "A {crop} leaf was diagnosed with {condition} ({severity} severity, {confidence}% confidence) in {location}. "
                    + "Give short, practical treatment and prevention advice.";

    private final AdviceConfig config;
    private final Gson gson = new Gson();
    private final String promptTemplate;
    private final RateLimiter rateLimiter;
    private final Cache<String, String> cache;

    public OpenAIStandardAdviceAdapter(AdviceConfig config) {
        this.config = config;
        String template = ResourceUtil.loadAsString(config.getPromptTemplate());
        this.promptTemplate = StrUtil.isBlank(template) ? DEFAULT_TEMPLATE : template;
        this.rateLimiter = config.getRequestsPerSecond() > 0 ? RateLimiter.create(config.getRequestsPerSecond()) : null;
        this.cache = CacheBuilder.newBuilder()
                .maximumSize(Math.max(1, config.getCacheSize()))
                .build();
    }

    @Override
    public boolean isEnabled() {
        return config.isEnable() && StrUtil.isNotBlank(config.getApiAddress());
    }

    @Override
    public String generateAdvice(AdviceContext context) {
        if (!isEnabled()) {
            throw new AdviceUnavailableException("Advice generation is not configured");
        }
        String prompt = buildPrompt(context);
        String cached = cache.getIfPresent(prompt);
        if (cached != null) {
            return cached;
        }
        if (rateLimiter != null && !rateLimiter.tryAcquire(1, config.getTimeoutMillis(), TimeUnit.MILLISECONDS)) {
            throw new AdviceUnavailableException("Advice generator is rate limited");
        }
        String advice = callApi(prompt);
        cache.put(prompt, advice);
        return advice;
    }

    String buildPrompt(AdviceContext context) {
        Map<String, Object> values = new HashMap<>();
        values.put("crop", StrUtil.blankToDefault(context.getCrop(), "crop"));
        values.put("condition", context.getCondition());
        values.put("severity", context.getSeverity() == null ? "unknown" : context.getSeverity().code());
        values.put("confidence", String.format(Locale.ROOT, "%.1f", context.getConfidencePercent()));
        values.put("location", StrUtil.blankToDefault(context.getLocation(), "an unspecified location"));
        return StrUtil.format(promptTemplate, values);
    }

    private String callApi(String prompt) {
        ChatCompletionRequest request = new ChatCompletionRequest();
        request.setModel(config.getModel());
        request.setTemperature(config.getTemperature());
        request.setMaxTokens(config.getMaxTokens());
        request.getMessages().add(new ChatMessage("system", SYSTEM_PROMPT));
        request.getMessages().add(new ChatMessage("user", prompt));

        Map<String, String> headers = new HashMap<>();
        if (StrUtil.isNotBlank(config.getApiKey())) {
            headers.put("Authorization", "Bearer " + config.getApiKey());
        }
        String body;
        try {
            body = HttpUtil.httpPost(config.getApiAddress(), headers, gson.toJson(request), config.getTimeoutMillis());
        } catch (IOException e) {
            throw new AdviceUnavailableException("Advice generator unreachable: " + e.getMessage(), e);
        }
        return extractContent(body);
    }

    String extractContent(String body) {
        ChatCompletionResult result;
        try {
            result = gson.fromJson(body, ChatCompletionResult.class);
        } catch (JsonParseException e) {
            throw new AdviceUnavailableException("Malformed advice response", e);
        }
        if (result == null || result.getChoices() == null || result.getChoices().isEmpty()
                || result.getChoices().get(0).getMessage() == null
                || StrUtil.isBlank(result.getChoices().get(0).getMessage().getContent())) {
            logger.debug("Advice response without content: {}", body);
            throw new AdviceUnavailableException("Advice response has no content");
        }
        return result.getChoices().get(0).getMessage().getContent().trim();
    }
}
