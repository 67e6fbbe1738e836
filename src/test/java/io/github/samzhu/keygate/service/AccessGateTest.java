package io.github.samzhu.keygate.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import io.github.samzhu.keygate.config.AccessProperties;
import io.github.samzhu.keygate.exception.AccessGateException;
import io.github.samzhu.keygate.model.AccessDecision;
import io.github.samzhu.keygate.model.AccessOutcome;

class AccessGateTest {

    private final AccessGate gate = new AccessGate(new AccessProperties("abc123"));
    private final AccessGate unconfiguredGate = new AccessGate(new AccessProperties(null));

    @Test
    void authenticate_withMatchingKey_echoesKeyAsToken() {
        AccessDecision decision = gate.authenticate("abc123");

        assertThat(decision.isGranted()).isTrue();
        assertThat(decision.outcome()).isEqualTo(AccessOutcome.GRANTED);
        assertThat(decision.credential()).isEqualTo("abc123");
    }

    @ParameterizedTest
    @ValueSource(strings = {"wrong", "ABC123", "abc1234", "abc12", " abc123", ""})
    void authenticate_withDifferentKey_isForbidden(String submitted) {
        assertThatThrownBy(() -> gate.authenticate(submitted))
            .isInstanceOfSatisfying(AccessGateException.class, e -> {
                assertThat(e.getOutcome()).isEqualTo(AccessOutcome.DENIED);
                assertThat(e.getStatus().value()).isEqualTo(403);
            });
    }

    @Test
    void authenticate_withNullKey_isForbidden() {
        assertThatThrownBy(() -> gate.authenticate(null))
            .isInstanceOfSatisfying(AccessGateException.class,
                e -> assertThat(e.getOutcome()).isEqualTo(AccessOutcome.DENIED));
    }

    @ParameterizedTest
    @ValueSource(strings = {"abc123", "anything", ""})
    void authenticate_whenNotConfigured_isUnavailable(String submitted) {
        assertThatThrownBy(() -> unconfiguredGate.authenticate(submitted))
            .isInstanceOfSatisfying(AccessGateException.class, e -> {
                assertThat(e.getOutcome()).isEqualTo(AccessOutcome.UNAVAILABLE);
                assertThat(e.getStatus().value()).isEqualTo(503);
            });
    }

    @Test
    void authorize_withMatchingKey_isGranted() {
        AccessDecision decision = gate.authorize("abc123");

        assertThat(decision.isGranted()).isTrue();
        assertThat(decision.credential()).isEqualTo("abc123");
    }

    @ParameterizedTest
    @NullAndEmptySource
    void authorize_withoutCredential_isUnauthorized(String presented) {
        assertThatThrownBy(() -> gate.authorize(presented))
            .isInstanceOfSatisfying(AccessGateException.class, e -> {
                assertThat(e.getOutcome()).isEqualTo(AccessOutcome.UNAUTHENTICATED);
                assertThat(e.getStatus().value()).isEqualTo(401);
            });
    }

    @Test
    void authorize_withWrongKey_isForbidden() {
        assertThatThrownBy(() -> gate.authorize("wrong"))
            .isInstanceOfSatisfying(AccessGateException.class,
                e -> assertThat(e.getOutcome()).isEqualTo(AccessOutcome.DENIED));
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"abc123", "wrong"})
    void authorize_whenNotConfigured_isUnavailableBeforeAnyOtherCheck(String presented) {
        assertThatThrownBy(() -> unconfiguredGate.authorize(presented))
            .isInstanceOfSatisfying(AccessGateException.class,
                e -> assertThat(e.getOutcome()).isEqualTo(AccessOutcome.UNAVAILABLE));
    }

    @Test
    void authorizeOptional_returnsCredentialOnlyWhenAuthorizeWouldGrant() {
        assertThat(gate.authorizeOptional("abc123")).contains("abc123");
        assertThat(gate.authorizeOptional("wrong")).isEmpty();
        assertThat(gate.authorizeOptional(null)).isEmpty();
        assertThat(gate.authorizeOptional("")).isEmpty();
        assertThat(unconfiguredGate.authorizeOptional("abc123")).isEmpty();
        assertThat(unconfiguredGate.authorizeOptional(null)).isEmpty();
    }

    @Test
    void emptyConfiguredKey_meansNotConfigured() {
        AccessGate gateWithEmptyKey = new AccessGate(new AccessProperties(""));

        assertThat(gateWithEmptyKey.isConfigured()).isFalse();
        assertThat(gateWithEmptyKey.evaluate("").outcome()).isEqualTo(AccessOutcome.UNAVAILABLE);
    }

    @Test
    void keysWithArbitraryCharacters_areComparedExactly() {
        AccessGate unicodeGate = new AccessGate(new AccessProperties("s3crét key/with+symbols=="));

        assertThat(unicodeGate.authorizeOptional("s3crét key/with+symbols==")).isPresent();
        assertThat(unicodeGate.authorizeOptional("s3cret key/with+symbols==")).isEmpty();
    }

    @Test
    void repeatedFailures_doNotChangeLaterDecisions() {
        for (int i = 0; i < 50; i++) {
            assertThat(gate.evaluate("wrong").outcome()).isEqualTo(AccessOutcome.DENIED);
        }

        assertThat(gate.authorize("abc123").isGranted()).isTrue();
        assertThat(gate.authenticate("abc123").credential()).isEqualTo("abc123");
    }

    @Test
    void concurrentEvaluations_agreeWithSequentialOnes() throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            List<Callable<AccessOutcome>> tasks = new ArrayList<>();
            for (int i = 0; i < 200; i++) {
                String presented = i % 3 == 0 ? "abc123" : (i % 3 == 1 ? "wrong" : null);
                tasks.add(() -> gate.evaluate(presented).outcome());
            }

            List<Future<AccessOutcome>> results = executor.invokeAll(tasks);
            for (int i = 0; i < results.size(); i++) {
                AccessOutcome expected = i % 3 == 0 ? AccessOutcome.GRANTED
                    : (i % 3 == 1 ? AccessOutcome.DENIED : AccessOutcome.UNAUTHENTICATED);
                assertThat(results.get(i).get()).isEqualTo(expected);
            }
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void decisionToString_neverContainsCredential() {
        AccessDecision decision = gate.authorize("abc123");

        assertThat(decision.toString()).doesNotContain("abc123").contains("GRANTED");
    }
}
