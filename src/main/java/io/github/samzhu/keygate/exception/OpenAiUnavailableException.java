package io.github.samzhu.keygate.exception;

/**
 * 未配置 OpenAI API Key，無法轉發請求（503）
 */
public class OpenAiUnavailableException extends RuntimeException {

    public OpenAiUnavailableException() {
        super("OpenAI client not available. Please configure OPENAI_API_KEY.");
    }
}
