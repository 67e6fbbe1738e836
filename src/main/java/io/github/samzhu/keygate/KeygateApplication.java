package io.github.samzhu.keygate;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Keygate 應用程式入口
 *
 * <p>OpenAI API 的輕量 HTTP 門面，提供：
 * <ul>
 *   <li>靜態 Access Key 認證（Bearer Header / 登入端點）</li>
 *   <li>Chat、Completion、圖片生成、Embeddings、模型列表的轉發</li>
 *   <li>靜態前端頁面</li>
 *   <li>健康檢查與 OpenTelemetry 追蹤</li>
 * </ul>
 *
 * @see <a href="https://platform.openai.com/docs/api-reference">OpenAI API Reference</a>
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class KeygateApplication {

	public static void main(String[] args) {
		SpringApplication.run(KeygateApplication.class, args);
	}

}
