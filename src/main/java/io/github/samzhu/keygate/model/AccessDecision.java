package io.github.samzhu.keygate.model;

/**
 * 存取判定
 *
 * <p>每個請求獨立產生，用完即丟，不做任何保存。{@code credential} 僅在
 * {@link AccessOutcome#GRANTED} 時存在；登入成功時即作為回傳的 token。
 *
 * <p>{@link #toString()} 不輸出 credential，可安全寫入日誌。
 *
 * @param outcome 判定結果
 * @param credential 通過驗證的 credential，未通過時為 null
 */
public record AccessDecision(
    AccessOutcome outcome,
    String credential
) {

    public static AccessDecision granted(String credential) {
        return new AccessDecision(AccessOutcome.GRANTED, credential);
    }

    public static AccessDecision rejected(AccessOutcome outcome) {
        if (outcome.isGranted()) {
            throw new IllegalArgumentException("A rejection cannot carry the GRANTED outcome");
        }
        return new AccessDecision(outcome, null);
    }

    public boolean isGranted() {
        return outcome.isGranted();
    }

    @Override
    public String toString() {
        return "AccessDecision[outcome=" + outcome + ", credential=" + (credential != null ? "****" : "null") + "]";
    }
}
