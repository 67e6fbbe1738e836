package io.github.samzhu.keygate;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.boot.info.BuildProperties;
import org.springframework.context.event.EventListener;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

import io.github.samzhu.keygate.config.KeygateProperties;
import io.github.samzhu.keygate.service.AccessGate;
import io.github.samzhu.keygate.service.OpenAiService;

/**
 * 應用程式啟動處理器
 *
 * <p>應用程式完全啟動後輸出啟動資訊：存取網址、版本、Access Key 與 OpenAI Key 的配置狀態，
 * 缺少的配置以警告列出（缺少配置是合法狀態，不會中止啟動）。
 */
@Component
public class ApplicationStartup {

    private static final Logger log = LoggerFactory.getLogger(ApplicationStartup.class);

    private final Environment env;
    private final Optional<BuildProperties> buildProperties;
    private final KeygateProperties keygateProperties;
    private final AccessGate accessGate;
    private final OpenAiService openAiService;

    public ApplicationStartup(
            Environment env,
            Optional<BuildProperties> buildProperties,
            KeygateProperties keygateProperties,
            AccessGate accessGate,
            OpenAiService openAiService) {
        this.env = env;
        this.buildProperties = buildProperties;
        this.keygateProperties = keygateProperties;
        this.accessGate = accessGate;
        this.openAiService = openAiService;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        logApplicationStartup();
        configurationWarnings().forEach(warning -> log.warn("Configuration warning: {}", warning));
    }

    /**
     * 列出缺少的配置
     */
    List<String> configurationWarnings() {
        List<String> warnings = new ArrayList<>();
        if (!openAiService.isAvailable()) {
            warnings.add("OpenAI API key not configured");
        }
        if (!accessGate.isConfigured()) {
            warnings.add("Access key not configured");
        }
        return warnings;
    }

    private void logApplicationStartup() {
        String applicationName = env.getProperty("spring.application.name");
        String serverPort = env.getProperty("server.port", "8080");
        String contextPath = Optional.ofNullable(env.getProperty("server.servlet.context-path"))
            .filter(StringUtils::isNotBlank)
            .orElse("/");
        String hostAddress = "localhost";
        try {
            hostAddress = InetAddress.getLocalHost().getHostAddress();
        } catch (UnknownHostException e) {
            log.warn("Unable to resolve host address, falling back to `localhost`");
        }

        String[] activeProfiles = env.getActiveProfiles();
        String profiles = String.join(", ", activeProfiles.length > 0 ? activeProfiles : env.getDefaultProfiles());

        String version = buildProperties.map(BuildProperties::getVersion).orElse(keygateProperties.version());

        log.info("""

            ----------------------------------------------------------
            \tApplication '{}' v{} is running!
            \t  Local:    http://localhost:{}{}
            \t  External: http://{}:{}{}
            \t  Profiles: {}
            ----------------------------------------------------------
            \tAuth configured:   {}
            \tOpenAI configured: {}
            ----------------------------------------------------------""",
            applicationName,
            version,
            serverPort,
            contextPath,
            hostAddress,
            serverPort,
            contextPath,
            profiles,
            accessGate.isConfigured(),
            openAiService.isAvailable()
        );
    }
}
