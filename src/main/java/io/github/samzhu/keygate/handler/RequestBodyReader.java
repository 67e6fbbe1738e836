package io.github.samzhu.keygate.handler;

import java.io.IOException;
import java.util.Set;
import java.util.stream.Collectors;

import org.springframework.stereotype.Component;
import org.springframework.web.servlet.function.ServerRequest;

import io.github.samzhu.keygate.exception.InvalidRequestException;
import jakarta.servlet.ServletException;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;

/**
 * 讀取並驗證請求體
 *
 * <p>Functional Endpoint 不會自動套用 {@code @Valid}，由此元件在反序列化後執行 Bean Validation，
 * 違反限制時拋出 {@link InvalidRequestException}，訊息依欄位名稱排序以保持穩定。
 */
@Component
public class RequestBodyReader {

    private final Validator validator;

    public RequestBodyReader(Validator validator) {
        this.validator = validator;
    }

    public <T> T read(ServerRequest request, Class<T> type) throws ServletException, IOException {
        T body = request.body(type);
        if (body == null) {
            throw new InvalidRequestException("Request body is required");
        }

        Set<ConstraintViolation<T>> violations = validator.validate(body);
        if (!violations.isEmpty()) {
            String message = violations.stream()
                .map(violation -> violation.getPropertyPath() + ": " + violation.getMessage())
                .sorted()
                .collect(Collectors.joining("; "));
            throw new InvalidRequestException(message);
        }
        return body;
    }
}
