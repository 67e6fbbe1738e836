package io.github.samzhu.keygate.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import jakarta.validation.constraints.NotNull;

/**
 * {@code POST /auth} 登入請求
 *
 * @param accessKey 提交的 Access Key（必填）
 */
public record AuthRequest(
    @JsonProperty("access_key")
    @NotNull
    String accessKey
) {
    @Override
    public String toString() {
        return "AuthRequest[accessKey=****]";
    }
}
