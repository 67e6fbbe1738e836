package io.github.samzhu.keygate.model;

import jakarta.validation.constraints.NotNull;

/**
 * 對話訊息
 *
 * @param role 發送者角色（system、user、assistant）
 * @param content 訊息內容
 */
public record ChatMessage(
    @NotNull
    String role,

    @NotNull
    String content
) {}
